package com.flagship.settlement_engine.deadletter;

import com.flagship.settlement_engine.deadletter.dto.FailedEventResponse;
import com.flagship.settlement_engine.deadletter.dto.ReprocessResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Operator endpoints for the dead-letter log.
 */
@RestController
@RequestMapping("/api/admin/failed-events")
@RequiredArgsConstructor
public class FailedEventController {

    private static final int MAX_LIMIT = 500;

    private final DeadLetterService deadLetterService;

    @GetMapping
    public ResponseEntity<List<FailedEventResponse>> listUnresolved(
            @RequestParam(name = "limit", defaultValue = "100") int limit) {
        List<FailedEventResponse> events = deadLetterService.listUnresolved(clamp(limit)).stream()
                .map(FailedEventResponse::from)
                .toList();
        return ResponseEntity.ok(events);
    }

    @GetMapping("/{id}")
    public ResponseEntity<FailedEventResponse> get(@PathVariable("id") UUID id) {
        return deadLetterService.find(id)
                .map(event -> ResponseEntity.ok(FailedEventResponse.from(event)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<ReprocessResponse> retry(@PathVariable("id") UUID id) {
        return deadLetterService.retry(id)
                .map(result -> ResponseEntity.ok(ReprocessResponse.from(result)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/retry")
    public ResponseEntity<List<ReprocessResponse>> retryUnresolved(
            @RequestParam(name = "limit", defaultValue = "100") int limit) {
        List<ReprocessResponse> results = deadLetterService.retryUnresolved(clamp(limit)).stream()
                .map(ReprocessResponse::from)
                .toList();
        return ResponseEntity.ok(results);
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }
}
