package com.notibag.notificationservice.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A stored notification. Instances are immutable; marking one as read
 * produces a copy, so snapshots handed out by the store never change.
 */
@Value
@Builder(toBuilder = true)
public class Notification {

    String id;
    String title;
    String message;
    Instant timestamp;
    boolean read;

    /**
     * Returns this notification with the read flag set. The flag never goes back to false.
     */
    public Notification markedRead() {
        return read ? this : toBuilder().read(true).build();
    }
}
