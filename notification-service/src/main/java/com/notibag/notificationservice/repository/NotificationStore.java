package com.notibag.notificationservice.repository;

import com.notibag.notificationservice.model.ListScope;
import com.notibag.notificationservice.model.Notification;

import java.util.List;

/**
 * Memory-resident collection of notifications, newest first.
 *
 * The store performs no validation; identifiers and timestamps are assigned
 * by the caller. Implementations must allow concurrent readers while giving
 * each mutation exclusive access.
 */
public interface NotificationStore {

    /**
     * Returns a snapshot of the notifications in the given scope, newest first.
     * Modifying the returned list does not affect the store.
     */
    List<Notification> list(ListScope scope);

    /**
     * Makes the notification the new head of the sequence.
     */
    void insert(Notification notification);

    /**
     * Sets the read flag of the notification with the given id.
     *
     * @throws com.notibag.common.exception.ResourceNotFoundException if no notification has that id
     */
    void markRead(String id);

    /**
     * Removes every notification.
     *
     * @return how many notifications were removed
     */
    int clear();

    int size();
}
