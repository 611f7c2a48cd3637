package com.notibag.notificationservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.notibag.common.dto.NotificationDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Frame pushed to WebSocket clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutboundMessage {

    private String type;
    private NotificationDto notification;
    private List<NotificationDto> notifications;

    public static OutboundMessage notification(NotificationDto notification) {
        return OutboundMessage.builder()
                .type(MessageType.NOTIFICATION.getWireName())
                .notification(notification)
                .build();
    }

    public static OutboundMessage notificationsList(List<NotificationDto> notifications) {
        return OutboundMessage.builder()
                .type(MessageType.NOTIFICATIONS_LIST.getWireName())
                .notifications(notifications)
                .build();
    }
}
