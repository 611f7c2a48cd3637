package com.notibag.notificationservice.service;

import com.notibag.notificationservice.model.Notification;

import java.util.List;

/**
 * Business operations on notifications. All input validation happens here;
 * the store underneath accepts whatever it is given.
 *
 * The service does not know about live connections: callers that create a
 * notification are responsible for broadcasting it.
 */
public interface NotificationService {

    /**
     * Unread notifications, newest first.
     */
    List<Notification> listUnread();

    /**
     * Every notification, read or not, newest first. Intended for debugging.
     */
    List<Notification> listAll();

    /**
     * Creates and stores an unread notification stamped with the current time.
     *
     * @throws IllegalArgumentException if title or message is blank
     */
    Notification create(String title, String message);

    /**
     * @throws IllegalArgumentException if id is blank
     * @throws com.notibag.common.exception.ResourceNotFoundException if no notification has that id
     */
    void markRead(String id);

    void clearAll();

    int count();
}
