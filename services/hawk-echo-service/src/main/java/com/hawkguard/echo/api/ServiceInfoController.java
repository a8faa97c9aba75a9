package com.hawkguard.echo.api;

import com.hawkguard.echo.config.HawkEchoProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated service info endpoint.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final HawkEchoProperties properties;

    public ServiceInfoController(HawkEchoProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "timestamp", Instant.now().toString());
    }
}
