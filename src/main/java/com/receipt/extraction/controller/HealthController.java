package com.receipt.extraction.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final Clock clock;
    private final String serviceName;
    private final String version;

    public HealthController(Clock clock,
                            @Value("${spring.application.name:receipt-extraction}") String serviceName,
                            @Value("${receipt.extraction.version:1.0.0}") String version) {
        this.clock = clock;
        this.serviceName = serviceName;
        this.version = version;
    }

    @GetMapping("/healthz")
    public Map<String, String> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", serviceName);
        body.put("version", version);
        body.put("timestamp", OffsetDateTime.now(clock).toString());
        return body;
    }
}
