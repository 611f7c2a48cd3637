package com.notibag.sender;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notibag.common.dto.CreateNotificationRequest;
import com.notibag.common.dto.NotificationDto;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Posts notifications to the hub's REST API.
 */
@Slf4j
public class NotificationSender {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient http;
    private final ObjectMapper objectMapper;

    public NotificationSender(HttpClient http, ObjectMapper objectMapper) {
        this.http = Objects.requireNonNull(http, "http");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Creates a notification on the hub at {@code host}, which pushes it to its live clients.
     *
     * @return the notification as stored by the hub
     * @throws SendFailedException if the hub answers with anything but 201 or cannot be reached
     */
    public NotificationDto send(String host, String title, String message) throws SendFailedException {
        URI uri = URI.create(stripTrailingSlash(host) + "/api/notifications");

        HttpRequest request;
        try {
            byte[] body = objectMapper.writeValueAsBytes(new CreateNotificationRequest(title, message));
            request = HttpRequest.newBuilder(uri)
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                    .build();
        } catch (IOException e) {
            throw new SendFailedException("Error marshaling JSON: " + e.getMessage(), e);
        }

        log.debug("Posting notification to {}", uri);

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SendFailedException("Error sending request: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SendFailedException("Interrupted while sending request", e);
        }

        if (response.statusCode() != 201) {
            throw new SendFailedException("Error: " + response.statusCode() + " - " + response.body());
        }

        try {
            return objectMapper.readValue(response.body(), NotificationDto.class);
        } catch (IOException e) {
            throw new SendFailedException("Unexpected response body: " + e.getMessage(), e);
        }
    }

    private static String stripTrailingSlash(String host) {
        return host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
    }
}
