package com.whereq.gridx.controller;

import com.whereq.gridx.dto.LogEntryRequest;
import com.whereq.gridx.observability.AdminStatsService;
import com.whereq.gridx.observability.RequestLog;
import com.whereq.gridx.observability.RequestLogEntry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Admin view over request traffic, jobs and workers
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/middleware")
@Tag(name = "Admin", description = "Request log, aggregate statistics and service configuration")
public class AdminController {

    @Autowired
    private AdminStatsService statsService;

    @Autowired
    private RequestLog requestLog;

    @Autowired
    private Clock clock;

    @GetMapping("/health")
    @Operation(summary = "Admin health check")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", clock.instant());
        health.put("logged_requests", requestLog.stats().getTotal());
        return Mono.just(ResponseEntity.ok(health));
    }

    @GetMapping("/stats")
    @Operation(summary = "Aggregate statistics", description = "Request totals, job stats and worker availability")
    public Mono<ResponseEntity<Object>> stats() {
        return statsService.stats().map(Responses::ok);
    }

    @GetMapping("/logs")
    @Operation(summary = "Recent requests", description = "Most recent request log entries, oldest first")
    public Mono<ResponseEntity<Map<String, Object>>> logs(
            @RequestParam(defaultValue = "200") int limit) {
        List<RequestLogEntry> logs = requestLog.recent(limit);
        Map<String, Object> body = new HashMap<>();
        body.put("logs", logs);
        body.put("count", logs.size());
        return Mono.just(ResponseEntity.ok(body));
    }

    @PostMapping("/log")
    @Operation(summary = "Record request", description = "Add a request log entry by hand")
    public Mono<ResponseEntity<Map<String, Object>>> addLog(@Valid @RequestBody LogEntryRequest request) {
        String method = request.getMethod() != null && !request.getMethod().isBlank()
            ? request.getMethod().toUpperCase(Locale.ROOT)
            : "GET";
        requestLog.record(RequestLogEntry.builder()
            .timestamp(clock.instant())
            .method(method)
            .endpoint(request.getEndpoint())
            .worker(request.getWorker())
            .durationMs(request.getDurationMs())
            .success(request.isSuccess())
            .build());
        return Mono.just(ResponseEntity.ok(Map.of("success", true)));
    }

    @DeleteMapping("/logs")
    @Operation(summary = "Clear request log")
    public Mono<ResponseEntity<Map<String, Object>>> clearLogs() {
        requestLog.clear();
        return Mono.just(ResponseEntity.ok(Map.of("success", true, "message", "Logs cleared")));
    }

    @GetMapping("/config")
    @Operation(summary = "Service configuration", description = "Service settings and the worker list")
    public Mono<ResponseEntity<Map<String, Object>>> config() {
        return Mono.fromCallable(statsService::config)
            .map(ResponseEntity::ok);
    }
}
