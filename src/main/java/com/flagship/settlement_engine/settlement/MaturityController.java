package com.flagship.settlement_engine.settlement;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Manual trigger for the maturity sweep.
 */
@RestController
@RequestMapping("/api/admin/maturity")
@RequiredArgsConstructor
public class MaturityController {

    private final MaturityTransitioner transitioner;

    @PostMapping("/sweep")
    public ResponseEntity<Map<String, Integer>> sweep() {
        return ResponseEntity.ok(Map.of("matured", transitioner.sweep()));
    }
}
