package com.phillippitts.cipherseal.presentation.controller;

import com.phillippitts.cipherseal.service.WatermarkKeyProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root liveness message. Reports degraded state when the secret key is missing.
 */
@RestController
class StatusController {

    private static final Logger LOG = LogManager.getLogger(StatusController.class);

    static final String RUNNING = "Digital Watermarking API is running.";
    static final String DEGRADED = "Digital Watermarking API is degraded (secret key not configured).";

    private final WatermarkKeyProvider keys;

    StatusController(WatermarkKeyProvider keys) {
        this.keys = keys;
    }

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> root() {
        boolean configured = keys.isConfigured();
        LOG.debug("Status requested: keyConfigured={}", configured);
        return ResponseEntity.ok(Map.of("message", configured ? RUNNING : DEGRADED));
    }
}
