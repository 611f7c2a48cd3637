package com.notibag.sender;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notibag.common.config.JacksonConfig;
import com.notibag.common.dto.NotificationDto;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationSenderTest {

    private final ObjectMapper objectMapper = JacksonConfig.newObjectMapper();

    @Mock
    private HttpClient http;

    @Mock
    private HttpResponse<String> response;

    @Test
    void send_Created_ReturnsStoredNotification() throws Exception {
        // Arrange
        when(http.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);
        when(response.statusCode()).thenReturn(201);
        when(response.body()).thenReturn("{\"id\":\"20261019093000-123\",\"title\":\"Build done\","
                + "\"message\":\"Target X compiled\",\"timestamp\":\"2026-10-19T09:30:00.123Z\",\"read\":false}");

        NotificationSender sender = new NotificationSender(http, objectMapper);

        // Act
        NotificationDto created = sender.send("http://hub:8080/", "Build done", "Target X compiled");

        // Assert
        assertThat(created.getId()).isEqualTo("20261019093000-123");
        assertThat(created.getTimestamp()).isEqualTo(Instant.parse("2026-10-19T09:30:00.123Z"));

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(captor.capture(), any(HttpResponse.BodyHandler.class));
        HttpRequest request = captor.getValue();
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.uri()).isEqualTo(URI.create("http://hub:8080/api/notifications"));
        assertThat(request.headers().firstValue("Content-Type")).hasValue("application/json");

        JsonNode body = objectMapper.readTree(readBody(request));
        assertThat(body.get("title").asText()).isEqualTo("Build done");
        assertThat(body.get("message").asText()).isEqualTo("Target X compiled");
    }

    @Test
    void send_NonCreatedStatus_FailsWithStatusAndBody() throws Exception {
        when(http.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);
        when(response.statusCode()).thenReturn(400);
        when(response.body()).thenReturn("{\"errorCode\":\"VALIDATION_FAILED\"}");

        NotificationSender sender = new NotificationSender(http, objectMapper);

        assertThatThrownBy(() -> sender.send("http://hub:8080", "", "m"))
                .isInstanceOf(SendFailedException.class)
                .hasMessage("Error: 400 - {\"errorCode\":\"VALIDATION_FAILED\"}");
    }

    @Test
    void send_Unreachable_FailsWithCause() throws Exception {
        ConnectException refused = new ConnectException("Connection refused");
        when(http.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenThrow(refused);

        NotificationSender sender = new NotificationSender(http, objectMapper);

        assertThatThrownBy(() -> sender.send("http://localhost:1", "t", "m"))
                .isInstanceOf(SendFailedException.class)
                .hasMessageStartingWith("Error sending request")
                .hasCause(refused);
    }

    @Test
    void send_Interrupted_RestoresInterruptFlag() throws Exception {
        when(http.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new InterruptedException());

        NotificationSender sender = new NotificationSender(http, objectMapper);

        try {
            assertThatThrownBy(() -> sender.send("http://hub:8080", "t", "m"))
                    .isInstanceOf(SendFailedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    private static String readBody(HttpRequest request) throws InterruptedException, IOException {
        List<ByteBuffer> chunks = new ArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        request.bodyPublisher().orElseThrow().subscribe(new Flow.Subscriber<>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(ByteBuffer item) {
                chunks.add(item);
            }

            @Override
            public void onError(Throwable throwable) {
                done.countDown();
            }

            @Override
            public void onComplete() {
                done.countDown();
            }
        });
        if (!done.await(5, TimeUnit.SECONDS)) {
            throw new IOException("Body publisher did not complete");
        }
        StringBuilder body = new StringBuilder();
        for (ByteBuffer chunk : chunks) {
            byte[] bytes = new byte[chunk.remaining()];
            chunk.get(bytes);
            body.append(new String(bytes, StandardCharsets.UTF_8));
        }
        return body.toString();
    }
}
