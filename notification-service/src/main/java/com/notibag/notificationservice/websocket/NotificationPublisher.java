package com.notibag.notificationservice.websocket;

import com.notibag.notificationservice.model.Notification;
import com.notibag.notificationservice.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Creates a notification and pushes it to every live connection.
 *
 * Create and broadcast run under one fair publish lock, so concurrently
 * published notifications reach each connection in the order they were
 * inserted into the store. The publish lock is separate from the store and
 * registry locks; neither of those is held while waiting for it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationPublisher {

    private final NotificationService notificationService;
    private final NotificationBroadcaster broadcaster;
    private final Lock publishLock = new ReentrantLock(true);

    /**
     * @throws IllegalArgumentException if title or message is blank; nothing is broadcast
     */
    public Notification publish(String title, String message) {
        publishLock.lock();
        try {
            Notification notification = notificationService.create(title, message);
            int delivered = broadcaster.broadcast(notification);
            log.info("Notification pushed to live connections: id={}, connections={}", notification.getId(), delivered);
            return notification;
        } finally {
            publishLock.unlock();
        }
    }
}
