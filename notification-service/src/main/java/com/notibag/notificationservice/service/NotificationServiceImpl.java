package com.notibag.notificationservice.service;

import com.notibag.notificationservice.model.ListScope;
import com.notibag.notificationservice.model.Notification;
import com.notibag.notificationservice.repository.NotificationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationServiceImpl implements NotificationService {

    private final NotificationStore notificationStore;
    private final NotificationIdGenerator idGenerator;
    private final Clock clock;

    @Override
    public List<Notification> listUnread() {
        return notificationStore.list(ListScope.UNREAD_ONLY);
    }

    @Override
    public List<Notification> listAll() {
        return notificationStore.list(ListScope.ALL);
    }

    @Override
    public Notification create(String title, String message) {
        if (isBlank(title)) {
            throw new IllegalArgumentException("Notification title is required");
        }
        if (isBlank(message)) {
            throw new IllegalArgumentException("Notification message is required");
        }

        Instant now = Instant.now(clock);
        Notification notification = Notification.builder()
                .id(idGenerator.nextId(now))
                .title(title)
                .message(message)
                .timestamp(now)
                .read(false)
                .build();

        notificationStore.insert(notification);
        log.info("Notification created: id={}, title={}", notification.getId(), title);

        return notification;
    }

    @Override
    public void markRead(String id) {
        if (isBlank(id)) {
            throw new IllegalArgumentException("Notification ID is required");
        }

        notificationStore.markRead(id);
        log.info("Notification marked as read: id={}", id);
    }

    @Override
    public void clearAll() {
        int removed = notificationStore.clear();
        log.info("All notifications cleared: removed={}", removed);
    }

    @Override
    public int count() {
        return notificationStore.size();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
