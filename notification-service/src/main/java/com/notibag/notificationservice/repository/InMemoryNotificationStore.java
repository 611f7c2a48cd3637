package com.notibag.notificationservice.repository;

import com.notibag.common.exception.ResourceNotFoundException;
import com.notibag.notificationservice.model.ListScope;
import com.notibag.notificationservice.model.Notification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link NotificationStore} backed by a list guarded by a read/write lock.
 */
@Repository
@Slf4j
public class InMemoryNotificationStore implements NotificationStore {

    // oldest first, so insert is an append; listings walk it backwards
    private final List<Notification> notifications = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public List<Notification> list(ListScope scope) {
        lock.readLock().lock();
        try {
            List<Notification> snapshot = new ArrayList<>(notifications.size());
            for (int i = notifications.size() - 1; i >= 0; i--) {
                Notification notification = notifications.get(i);
                if (scope.includes(notification)) {
                    snapshot.add(notification);
                }
            }
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void insert(Notification notification) {
        lock.writeLock().lock();
        try {
            notifications.add(notification);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void markRead(String id) {
        lock.writeLock().lock();
        try {
            for (int i = notifications.size() - 1; i >= 0; i--) {
                Notification notification = notifications.get(i);
                if (notification.getId().equals(id)) {
                    notifications.set(i, notification.markedRead());
                    return;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Notification not found in store: id={}", id);
        throw new ResourceNotFoundException("Notification not found: " + id);
    }

    @Override
    public int clear() {
        lock.writeLock().lock();
        try {
            int removed = notifications.size();
            notifications.clear();
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return notifications.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
