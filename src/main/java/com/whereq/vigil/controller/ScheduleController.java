package com.whereq.vigil.controller;

import com.whereq.vigil.dto.ScheduleActionResponse;
import com.whereq.vigil.dto.ScheduleRequest;
import com.whereq.vigil.exception.ScheduleNotFoundException;
import com.whereq.vigil.exception.ScheduleStateException;
import com.whereq.vigil.model.ScheduledScan;
import com.whereq.vigil.service.ScheduleEvaluator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.util.List;

/**
 * Controller for scheduled scans
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/schedules")
@RequiredArgsConstructor
@Tag(name = "Schedules", description = "One-time and recurring scans")
public class ScheduleController {

    private final ScheduleEvaluator scheduleEvaluator;

    @PostMapping
    @Operation(summary = "Schedule a scan", description = "Rejected requests get a body carrying the reason")
    public Mono<ResponseEntity<?>> createSchedule(@Valid @RequestBody ScheduleRequest request) {
        log.info("Received schedule request: target={}, type={}", request.getTarget(), request.getScheduleType());

        return Mono.fromCallable(() -> scheduleEvaluator.schedule(request))
            .subscribeOn(Schedulers.boundedElastic())
            .<ResponseEntity<?>>map(scan -> ResponseEntity
                .created(URI.create("/api/v1/schedules/" + scan.getId()))
                .body(scan))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Schedule rejected: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().body(failure(null, e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Error scheduling scan", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(failure(null, "Scan could not be scheduled")));
            });
    }

    @GetMapping
    @Operation(summary = "List scheduled scans", description = "Newest first")
    public Mono<ResponseEntity<List<ScheduledScan>>> listSchedules() {
        return Mono.fromCallable(scheduleEvaluator::list)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a scheduled scan")
    public Mono<ResponseEntity<ScheduledScan>> getSchedule(@PathVariable long id) {
        return Mono.fromCallable(() -> scheduleEvaluator.find(id))
            .subscribeOn(Schedulers.boundedElastic())
            .map(scan -> scan.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel a scheduled scan", description = "Also cancels its running scan")
    public Mono<ResponseEntity<ScheduleActionResponse>> cancelSchedule(@PathVariable long id) {
        log.info("Schedule cancellation request for {}", id);

        return Mono.fromCallable(() -> scheduleEvaluator.cancelScheduled(id))
            .subscribeOn(Schedulers.boundedElastic())
            .map(scan -> ResponseEntity.ok(ScheduleActionResponse.builder()
                .scheduleId(id)
                .success(true)
                .status(scan.getStatus())
                .message("Scheduled scan cancelled")
                .build()))
            .onErrorResume(ScheduleNotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(failure(id, e.getMessage()))))
            .onErrorResume(ScheduleStateException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(failure(id, e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Error cancelling scheduled scan {}", id, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(failure(id, "Scheduled scan could not be cancelled")));
            });
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a scheduled scan")
    public Mono<ResponseEntity<ScheduleActionResponse>> deleteSchedule(@PathVariable long id) {
        log.info("Schedule deletion request for {}", id);

        return Mono.fromRunnable(() -> scheduleEvaluator.deleteScheduled(id))
            .subscribeOn(Schedulers.boundedElastic())
            .then(Mono.fromCallable(() -> ResponseEntity.ok(ScheduleActionResponse.builder()
                .scheduleId(id)
                .success(true)
                .message("Scheduled scan deleted")
                .build())))
            .onErrorResume(ScheduleNotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(failure(id, e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Error deleting scheduled scan {}", id, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(failure(id, "Scheduled scan could not be deleted")));
            });
    }

    private static ScheduleActionResponse failure(Long id, String message) {
        return ScheduleActionResponse.builder()
            .scheduleId(id)
            .success(false)
            .message(message)
            .build();
    }
}
