package com.example.websearcher.controller;

import com.example.websearcher.browser.BrowserProvider;
import com.example.websearcher.service.SessionRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final SessionRegistry registry;
    private final BrowserProvider browserProvider;

    public HealthController(SessionRegistry registry, BrowserProvider browserProvider) {
        this.registry = registry;
        this.browserProvider = browserProvider;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "web-searcher");
        health.put("version", "1.0.0");
        health.put("activeSessions", registry.count());

        // the browser is launched lazily with the first session
        try {
            health.put("browser", browserProvider.isRunning() ? "UP" : "NOT_STARTED");
        } catch (Exception e) {
            health.put("browser", "DOWN");
            health.put("browserError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }
}
