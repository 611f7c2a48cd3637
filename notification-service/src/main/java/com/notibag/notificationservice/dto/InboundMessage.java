package com.notibag.notificationservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Frame received from a WebSocket client.
 *
 * The type is kept as raw text so that unknown types can be logged and
 * ignored instead of failing deserialization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {

    private String type;

    // only set for mark_read
    @JsonProperty("notification_id")
    private String notificationId;
}
