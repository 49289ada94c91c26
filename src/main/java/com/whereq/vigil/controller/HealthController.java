package com.whereq.vigil.controller;

import com.whereq.vigil.model.ToolInfo;
import com.whereq.vigil.service.ScanService;
import com.whereq.vigil.service.ScheduleEvaluator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and scanner status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private final ScanService scanService;
    private final ScheduleEvaluator scheduleEvaluator;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service is up and the scanner is usable")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> {
                ToolInfo tool = scanService.checkToolInstallation();

                Map<String, Object> health = new HashMap<>();
                health.put("status", "UP");
                health.put("service", "whereq-vigil");

                Map<String, Object> scanner = new HashMap<>();
                scanner.put("installed", tool.installed());
                scanner.put("version", tool.version());
                scanner.put("status", tool.installed() ? "AVAILABLE" : "MISSING");
                health.put("scanner", scanner);

                health.put("adminPrivileges", scanService.hasAdminPrivileges());
                health.put("activeScans", scanService.activeScanCount());
                health.put("schedulerRunning", scheduleEvaluator.isRunning());
                return ResponseEntity.ok(health);
            })
            .subscribeOn(Schedulers.boundedElastic());
    }
}
