package com.whereq.vigil.controller;

import com.whereq.vigil.dto.SaveResultResponse;
import com.whereq.vigil.dto.ScanCancellationResponse;
import com.whereq.vigil.dto.ScanRequest;
import com.whereq.vigil.dto.ScanSubmitResponse;
import com.whereq.vigil.model.ScanJobSnapshot;
import com.whereq.vigil.model.ScanStatus;
import com.whereq.vigil.model.StoredScanResult;
import com.whereq.vigil.model.report.ScanResult;
import com.whereq.vigil.service.ScanService;
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
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Controller for ad-hoc scans: submission, status, results and cancellation.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/scans")
@RequiredArgsConstructor
@Tag(name = "Scans", description = "Ad-hoc network scans")
public class ScanController {

    private final ScanService scanService;

    /**
     * Submit a scan for async execution
     *
     * @param request target and profile
     * @return Mono with 202 Accepted response
     */
    @PostMapping
    @Operation(summary = "Start a scan", description = "Queue a scan of the target with the named profile")
    public Mono<ResponseEntity<ScanSubmitResponse>> submitScan(@Valid @RequestBody ScanRequest request) {
        log.info("Received scan submission: target={}, profile={}", request.getTarget(), request.getProfile());

        return Mono.fromCallable(() -> scanService.startAdHocScan(request.getTarget(), request.getProfile()))
            .map(jobId -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/scans/" + jobId))
                .body(ScanSubmitResponse.builder()
                    .jobId(jobId)
                    .target(request.getTarget())
                    .profile(request.getProfile())
                    .status(ScanStatus.RUNNING)
                    .submittedAt(Instant.now())
                    .build()))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Scan rejected: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(ScanSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during scan submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ScanSubmitResponse.error("Scan could not be started")));
            });
    }

    @GetMapping
    @Operation(summary = "List scans", description = "Status of every scan since startup")
    public Mono<ResponseEntity<Map<String, ScanJobSnapshot>>> listScans() {
        return Mono.fromCallable(scanService::allStatuses)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/profiles")
    @Operation(summary = "List scan profiles")
    public Mono<ResponseEntity<Map<String, String>>> profiles() {
        return Mono.just(ResponseEntity.ok(scanService.profiles()));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get scan status")
    public Mono<ResponseEntity<ScanJobSnapshot>> getScanStatus(@PathVariable String jobId) {
        return Mono.justOrEmpty(scanService.status(jobId))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{jobId}/result")
    @Operation(summary = "Get scan result", description = "Extracted hosts and ports of a completed scan")
    public Mono<ResponseEntity<ScanResult>> getScanResult(@PathVariable String jobId) {
        return Mono.justOrEmpty(scanService.result(jobId))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * Cancel a scan
     *
     * @param jobId job identifier
     * @return Mono with cancellation response
     */
    @DeleteMapping("/{jobId}")
    @Operation(summary = "Cancel a scan")
    public Mono<ResponseEntity<ScanCancellationResponse>> cancelScan(@PathVariable String jobId) {
        log.info("Scan cancellation request for {}", jobId);

        return Mono.justOrEmpty(scanService.status(jobId))
            .map(snapshot -> {
                if (scanService.cancel(jobId)) {
                    return ResponseEntity.ok(ScanCancellationResponse.builder()
                        .jobId(jobId)
                        .status(ScanStatus.CANCELLED)
                        .cancelledAt(Instant.now())
                        .message("Scan cancelled")
                        .build());
                }

                ScanStatus current = scanService.status(jobId).map(ScanJobSnapshot::getStatus).orElse(snapshot.getStatus());
                return ResponseEntity.status(HttpStatus.CONFLICT).body(ScanCancellationResponse.builder()
                    .jobId(jobId)
                    .status(current)
                    .message("Scan already " + current.getValue())
                    .build());
            })
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/{jobId}/save")
    @Operation(summary = "Save scan result", description = "Forward a completed scan's result to the result store")
    public Mono<ResponseEntity<SaveResultResponse>> saveResult(@PathVariable String jobId) {
        if (scanService.status(jobId).isEmpty()) {
            return Mono.just(ResponseEntity.notFound().build());
        }

        return Mono.fromCallable(() -> scanService.saveResult(jobId))
            .subscribeOn(Schedulers.boundedElastic())
            .map(outcome -> {
                SaveResultResponse body = SaveResultResponse.of(jobId, outcome);
                return outcome.ok()
                    ? ResponseEntity.ok(body)
                    : ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
            });
    }

    @GetMapping("/saved/{storedId}")
    @Operation(summary = "Get a stored scan result")
    public Mono<ResponseEntity<StoredScanResult>> getStoredResult(@PathVariable String storedId) {
        return Mono.fromCallable(() -> scanService.storedResult(storedId))
            .subscribeOn(Schedulers.boundedElastic())
            .map(stored -> stored.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build()))
            .onErrorResume(Exception.class, e -> {
                log.error("Error reading stored result {}", storedId, e);
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
            });
    }

    @GetMapping("/saved")
    @Operation(summary = "List stored scan results", description = "Most recently saved first")
    public Mono<ResponseEntity<List<StoredScanResult>>> listStoredResults() {
        return Mono.fromCallable(scanService::storedResults)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok)
            .onErrorResume(Exception.class, e -> {
                log.error("Error listing stored results", e);
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
            });
    }

    @DeleteMapping("/saved/{storedId}")
    @Operation(summary = "Delete a stored scan result")
    public Mono<ResponseEntity<Void>> deleteStoredResult(@PathVariable String storedId) {
        log.info("Stored result deletion request for {}", storedId);

        return Mono.fromCallable(() -> scanService.deleteStoredResult(storedId))
            .subscribeOn(Schedulers.boundedElastic())
            .map(deleted -> deleted
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build())
            .onErrorResume(Exception.class, e -> {
                log.error("Error deleting stored result {}", storedId, e);
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
            });
    }
}
