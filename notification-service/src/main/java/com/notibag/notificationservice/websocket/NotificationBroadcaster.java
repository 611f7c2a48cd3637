package com.notibag.notificationservice.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notibag.notificationservice.config.WebSocketProperties;
import com.notibag.notificationservice.dto.OutboundMessage;
import com.notibag.notificationservice.mapper.NotificationMapper;
import com.notibag.notificationservice.model.Notification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of live WebSocket connections and fan-out of new notifications.
 *
 * Broadcasts share the read lock, so several may run at once, while
 * register/unregister take the write lock: the connection set cannot change
 * during a broadcast. A connection whose send fails is dropped once the
 * broadcast has released the read lock; the others are unaffected.
 *
 * Every registered session is wrapped in a {@link ConcurrentWebSocketSessionDecorator}
 * so that sends to one connection are serialized and bounded in time and
 * buffered bytes, and the container's blocking send timeout is set to the same
 * limit. A stalled peer is terminated instead of holding up the remaining
 * connections for longer than the send time limit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationBroadcaster {

    // read by Tomcat for blocking sends on this session; other containers ignore it
    static final String BLOCKING_SEND_TIMEOUT_PROPERTY = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    private final ObjectMapper objectMapper;
    private final NotificationMapper notificationMapper;
    private final WebSocketProperties properties;

    // session id -> decorated session
    private final Map<String, WebSocketSession> sessions = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void register(WebSocketSession session) {
        applyBlockingSendTimeout(session);
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(
                session,
                (int) properties.getSendTimeLimit().toMillis(),
                properties.getSendBufferSizeLimit(),
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);

        int connections;
        lock.writeLock().lock();
        try {
            sessions.put(session.getId(), decorated);
            connections = sessions.size();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("WebSocket connection registered: sessionId={}, connections={}", session.getId(), connections);
    }

    /**
     * Removes the session from the registry. Unregistering an unknown or
     * already removed session does nothing.
     */
    public void unregister(WebSocketSession session) {
        boolean removed;
        int connections;
        lock.writeLock().lock();
        try {
            removed = sessions.remove(session.getId()) != null;
            connections = sessions.size();
        } finally {
            lock.writeLock().unlock();
        }
        if (removed) {
            log.info("WebSocket connection unregistered: sessionId={}, connections={}", session.getId(), connections);
        }
    }

    /**
     * Sends a {@code notification} frame to every registered connection.
     * Never throws; connections that fail are dropped.
     *
     * @return the number of connections the frame was handed to
     */
    public int broadcast(Notification notification) {
        TextMessage frame;
        try {
            frame = toTextMessage(OutboundMessage.notification(notificationMapper.toDto(notification)));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize notification frame: id={}, error={}", notification.getId(), e.getMessage(), e);
            return 0;
        }

        List<WebSocketSession> failed = new ArrayList<>();
        int delivered = 0;

        lock.readLock().lock();
        try {
            for (WebSocketSession session : sessions.values()) {
                try {
                    session.sendMessage(frame);
                    delivered++;
                } catch (IOException | RuntimeException e) {
                    // covers SessionLimitExceededException and sends on a closed session
                    log.warn("Broadcast to connection failed, dropping it: sessionId={}, error={}",
                            session.getId(), e.getMessage());
                    failed.add(session);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        failed.forEach(this::drop);

        log.debug("Notification broadcast: id={}, delivered={}, dropped={}",
                notification.getId(), delivered, failed.size());
        return delivered;
    }

    /**
     * Sends a frame to a single connection, through its registered decorator
     * when there is one.
     *
     * @throws IOException if the frame cannot be written; the connection should be considered dead
     */
    public void send(WebSocketSession session, OutboundMessage message) throws IOException {
        WebSocketSession target;
        lock.readLock().lock();
        try {
            target = sessions.getOrDefault(session.getId(), session);
        } finally {
            lock.readLock().unlock();
        }
        target.sendMessage(toTextMessage(message));
    }

    public int connectionCount() {
        lock.readLock().lock();
        try {
            return sessions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void drop(WebSocketSession session) {
        unregister(session);
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Closing dropped connection failed: sessionId={}, error={}", session.getId(), e.getMessage());
        }
    }

    private void applyBlockingSendTimeout(WebSocketSession session) {
        if (session instanceof NativeWebSocketSession nativeSession) {
            jakarta.websocket.Session container = nativeSession.getNativeSession(jakarta.websocket.Session.class);
            if (container != null) {
                container.getUserProperties().put(BLOCKING_SEND_TIMEOUT_PROPERTY, properties.getSendTimeLimit().toMillis());
            }
        }
    }

    private TextMessage toTextMessage(OutboundMessage message) throws JsonProcessingException {
        return new TextMessage(objectMapper.writeValueAsString(message));
    }
}
