package com.notibag.notificationservice.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * WebSocket endpoint settings.
 *
 * notibag:
 *   websocket:
 *     endpoint: /ws
 *     allowed-origin-patterns: ["*"]
 *     send-time-limit: 10s
 *     send-buffer-size-limit: 524288
 */
@Data
@Validated
@ConfigurationProperties(prefix = "notibag.websocket")
public class WebSocketProperties {

    @NotBlank
    private String endpoint = "/ws";

    @NotEmpty
    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));

    /**
     * How long a single send to one connection may take before that connection is dropped.
     */
    @NotNull
    private Duration sendTimeLimit = Duration.ofSeconds(10);

    /**
     * Bytes that may queue up for one slow connection before it is dropped.
     */
    @Positive
    private int sendBufferSizeLimit = 512 * 1024;
}
