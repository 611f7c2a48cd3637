package com.notibag.notificationservice.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notibag.notificationservice.dto.InboundMessage;
import com.notibag.notificationservice.dto.OutboundMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Optional;

/**
 * WebSocket endpoint for live notifications.
 *
 * A connection is registered with the {@link NotificationBroadcaster} once the
 * handshake completes and unregistered when it closes, fails, or sends a frame
 * that is not valid JSON. Frames from one connection are delivered here one at
 * a time by the container.
 *
 * Client usage:
 * ```javascript
 * const ws = new WebSocket('ws://localhost:8080/ws');
 * ws.onopen = () => ws.send(JSON.stringify({ type: 'get_notifications' }));
 * ws.onmessage = (event) => render(JSON.parse(event.data));
 * ```
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationWebSocketHandler extends TextWebSocketHandler {

    private final NotificationBroadcaster broadcaster;
    private final NotificationProtocolHandler protocolHandler;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        broadcaster.register(session);
        log.info("WebSocket connection established: sessionId={}, remote={}",
                session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        InboundMessage inbound = parse(session, message);
        if (inbound == null) {
            broadcaster.unregister(session);
            session.close(CloseStatus.BAD_DATA);
            return;
        }

        log.debug("Frame received: sessionId={}, type={}", session.getId(), inbound.getType());

        Optional<OutboundMessage> reply = protocolHandler.handle(inbound);
        if (reply.isPresent()) {
            // a failed write propagates and the container closes the connection
            broadcaster.send(session, reply.get());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error: sessionId={}, error={}", session.getId(), exception.getMessage());
        broadcaster.unregister(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        broadcaster.unregister(session);
        log.info("WebSocket connection closed: sessionId={}, status={}", session.getId(), status);
    }

    private InboundMessage parse(WebSocketSession session, TextMessage message) {
        try {
            InboundMessage inbound = objectMapper.readValue(message.getPayload(), InboundMessage.class);
            if (inbound == null) {
                log.warn("Empty frame, closing connection: sessionId={}", session.getId());
            }
            return inbound;
        } catch (JsonProcessingException e) {
            log.warn("Malformed frame, closing connection: sessionId={}, error={}",
                    session.getId(), e.getOriginalMessage());
            return null;
        }
    }
}
