package com.example.techpack.interfaces.api;

import com.example.techpack.config.TechPackProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint.
 */
@RestController
public class HealthController {

    private static final String SERVICE_NAME = "Tech Pack Parser";

    private final TechPackProperties properties;

    public HealthController(TechPackProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "OK");
        body.put("service", SERVICE_NAME);
        body.put("version", properties.apiVersion());
        return body;
    }
}
