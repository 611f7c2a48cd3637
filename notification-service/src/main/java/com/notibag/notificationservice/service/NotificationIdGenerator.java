package com.notibag.notificationservice.service;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Generates notification identifiers from the creation time, e.g.
 * {@code 20261019093000-123}. Identifiers generated within the same
 * millisecond (or while the clock steps backwards) reuse the last time text
 * with an increasing suffix: {@code 20261019093000-123-1}, {@code -2}, ...
 * The time text of a suffixed identifier is that of the earlier identifier,
 * so it can lag behind the notification's own timestamp.
 */
@Component
public class NotificationIdGenerator {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss-SSS").withZone(ZoneOffset.UTC);

    private String lastBase;
    private long sequence;

    public synchronized String nextId(Instant now) {
        String base = FORMAT.format(now);
        // fixed-width text, so lexicographic order is chronological order
        if (lastBase != null && base.compareTo(lastBase) <= 0) {
            sequence++;
            return lastBase + "-" + sequence;
        }
        lastBase = base;
        sequence = 0;
        return base;
    }
}
