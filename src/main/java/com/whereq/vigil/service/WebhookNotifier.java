package com.whereq.vigil.service;

import com.whereq.vigil.model.ScheduleStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service for sending scheduled scan webhook notifications
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookNotifier {

    private static final Duration WEBHOOK_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient.Builder webClientBuilder;
    private final Clock clock;

    /**
     * Notify webhook that a triggered scan finished
     *
     * @param webhookUrl webhook URL
     * @param scheduleId schedule identifier
     * @param jobId scan job identifier
     * @param status schedule status after the run
     * @return Mono that completes when the notification was sent or given up
     */
    public Mono<Void> notify(String webhookUrl, long scheduleId, String jobId, ScheduleStatus status) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            return Mono.empty();
        }

        Map<String, Object> payload = buildPayload(scheduleId, jobId, status);

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .timeout(WEBHOOK_TIMEOUT)
            .doOnSuccess(response -> log.info("Webhook notification sent for schedule {}: {} - {}",
                scheduleId, status.getValue(), response.getStatusCode()))
            .doOnError(error -> log.warn("Failed to send webhook notification for schedule {}: {}",
                scheduleId, error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // a dead webhook never changes the schedule
            .then();
    }

    Map<String, Object> buildPayload(long scheduleId, String jobId, ScheduleStatus status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("scheduleId", scheduleId);
        payload.put("jobId", jobId);
        payload.put("status", status.getValue());
        payload.put("timestamp", clock.millis());
        return payload;
    }
}
