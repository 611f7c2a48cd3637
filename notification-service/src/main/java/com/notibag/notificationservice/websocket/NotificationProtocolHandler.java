package com.notibag.notificationservice.websocket;

import com.notibag.common.exception.ResourceNotFoundException;
import com.notibag.notificationservice.dto.InboundMessage;
import com.notibag.notificationservice.dto.MessageType;
import com.notibag.notificationservice.dto.OutboundMessage;
import com.notibag.notificationservice.mapper.NotificationMapper;
import com.notibag.notificationservice.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Dispatches inbound WebSocket frames to the {@link NotificationService}.
 *
 * Only {@code get_notifications} has a reply. The protocol has no error
 * frame: rejected {@code mark_read} requests and unknown frame types are
 * logged here and never reported to the client.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationProtocolHandler {

    private final NotificationService notificationService;
    private final NotificationMapper notificationMapper;

    /**
     * Handles one frame.
     *
     * @return the reply to send back on the same connection, if the frame type has one
     */
    public Optional<OutboundMessage> handle(InboundMessage message) {
        MessageType type = MessageType.fromWireName(message.getType()).orElse(null);
        if (type == null) {
            log.warn("Ignoring frame with unknown type: type={}", message.getType());
            return Optional.empty();
        }

        if (type == MessageType.GET_NOTIFICATIONS) {
            return Optional.of(OutboundMessage.notificationsList(
                    notificationMapper.toDtoList(notificationService.listUnread())));
        }

        switch (type) {
            case MARK_READ -> markRead(message.getNotificationId());
            case CLEAR_ALL -> clearAll();
            default -> log.warn("Ignoring server-to-client frame type sent by client: type={}", message.getType());
        }
        return Optional.empty();
    }

    private void markRead(String notificationId) {
        try {
            notificationService.markRead(notificationId);
        } catch (IllegalArgumentException | ResourceNotFoundException e) {
            log.warn("mark_read rejected: notificationId={}, error={}", notificationId, e.getMessage());
        }
    }

    private void clearAll() {
        try {
            notificationService.clearAll();
        } catch (RuntimeException e) {
            log.error("clear_all failed: error={}", e.getMessage(), e);
        }
    }
}
