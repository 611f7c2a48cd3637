package com.notibag.notificationservice.controller;

import com.notibag.common.dto.CreateNotificationRequest;
import com.notibag.common.dto.NotificationDto;
import com.notibag.common.dto.NotificationListResponse;
import com.notibag.common.dto.SuccessResponse;
import com.notibag.notificationservice.mapper.NotificationMapper;
import com.notibag.notificationservice.model.Notification;
import com.notibag.notificationservice.service.NotificationService;
import com.notibag.notificationservice.websocket.NotificationBroadcaster;
import com.notibag.notificationservice.websocket.NotificationPublisher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API over the notification service.
 *
 * Creating a notification here also pushes it to every live WebSocket connection.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class NotificationController {

    private final NotificationService notificationService;
    private final NotificationBroadcaster broadcaster;
    private final NotificationPublisher notificationPublisher;
    private final NotificationMapper notificationMapper;

    /**
     * GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("message", "Notibag server is running");
        body.put("connections", broadcaster.connectionCount());
        body.put("notifications", notificationService.count());
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/notifications
     * {"title": "...", "message": "..."}
     */
    @PostMapping("/notifications")
    public ResponseEntity<NotificationDto> createNotification(@Valid @RequestBody CreateNotificationRequest request) {
        Notification notification = notificationPublisher.publish(request.getTitle(), request.getMessage());
        return ResponseEntity.status(HttpStatus.CREATED).body(notificationMapper.toDto(notification));
    }

    /**
     * GET /api/notifications
     * Unread notifications, newest first.
     */
    @GetMapping("/notifications")
    public ResponseEntity<NotificationListResponse> getNotifications() {
        return ResponseEntity.ok(new NotificationListResponse(
                notificationMapper.toDtoList(notificationService.listUnread())));
    }

    /**
     * GET /api/notifications/all
     * Every notification including read ones; for debugging.
     */
    @GetMapping("/notifications/all")
    public ResponseEntity<NotificationListResponse> getAllNotifications() {
        return ResponseEntity.ok(new NotificationListResponse(
                notificationMapper.toDtoList(notificationService.listAll())));
    }

    /**
     * PUT /api/notifications/{id}/read
     */
    @PutMapping("/notifications/{id}/read")
    public ResponseEntity<SuccessResponse> markAsRead(@PathVariable String id) {
        log.info("Marking notification as read: notificationId={}", id);
        notificationService.markRead(id);
        return ResponseEntity.ok(SuccessResponse.ok());
    }

    /**
     * DELETE /api/notifications
     */
    @DeleteMapping("/notifications")
    public ResponseEntity<SuccessResponse> clearAll() {
        notificationService.clearAll();
        return ResponseEntity.ok(SuccessResponse.ok());
    }
}
