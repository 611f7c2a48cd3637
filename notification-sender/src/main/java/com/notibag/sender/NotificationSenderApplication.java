package com.notibag.sender;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notibag.common.config.JacksonConfig;
import com.notibag.common.dto.NotificationDto;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Command-line entry point:
 *
 * send -title "Build done" -message "Target X compiled" [-host http://localhost:8080]
 */
@Slf4j
public final class NotificationSenderApplication {

    private NotificationSenderApplication() {
    }

    public static void main(String[] args) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        ObjectMapper objectMapper = JacksonConfig.newObjectMapper();
        int status = run(args, SenderConfig.defaultLocation(), new NotificationSender(http, objectMapper),
                objectMapper, System.out, System.err);
        System.exit(status);
    }

    static int run(String[] args, Path configPath, NotificationSender sender, ObjectMapper objectMapper,
                   PrintStream out, PrintStream err) {
        SenderConfig config;
        try {
            config = SenderConfig.load(configPath, objectMapper);
        } catch (IOException e) {
            err.println("Error loading config: " + e.getMessage());
            return 1;
        }

        SenderArguments arguments;
        try {
            arguments = SenderArguments.parse(args, config.getHost());
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(SenderArguments.USAGE);
            return 1;
        }

        if (!arguments.isComplete()) {
            err.println(SenderArguments.USAGE);
            return 1;
        }

        try {
            NotificationDto created = sender.send(arguments.getHost(), arguments.getTitle(), arguments.getMessage());
            out.println("Notification sent successfully: " + created.getId());
            return 0;
        } catch (SendFailedException e) {
            log.debug("Send failed", e);
            err.println(e.getMessage());
            return 1;
        }
    }
}
