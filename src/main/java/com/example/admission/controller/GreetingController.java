package com.example.admission.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routes guarded by the admission filter, plus an unguarded health check.
 */
@RestController
public class GreetingController {

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> index() {
        return ResponseEntity.ok(Map.of("message", "Hello, world!"));
    }

    @GetMapping("/api/resource")
    public ResponseEntity<Map<String, Object>> resource() {
        return ResponseEntity.ok(Map.of("message", "Resource accessed successfully"));
    }

    /**
     * Echoes the proxy-related headers of the request. Missing headers come back as null.
     */
    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info(
            @RequestHeader(value = "X-Real-IP", required = false) String realIp,
            @RequestHeader(value = "X-Forwarded-For", required = false) String forwardedFor,
            @RequestHeader(value = "Host", required = false) String host,
            @RequestHeader(value = "User-Agent", required = false) String userAgent
    ) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("connecting_ip", realIp);
        body.put("proxy_ip", forwardedFor);
        body.put("host", host);
        body.put("user-agent", userAgent);
        return ResponseEntity.ok(body);
    }

    @GetMapping(value = "/health-check", produces = MediaType.TEXT_PLAIN_VALUE)
    public String healthCheck() {
        return "success";
    }
}
