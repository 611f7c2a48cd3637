package com.notibag.notificationservice.model;

/**
 * Which part of the store a listing covers.
 */
public enum ListScope {
    ALL,
    UNREAD_ONLY;

    public boolean includes(Notification notification) {
        return this == ALL || !notification.isRead();
    }
}
