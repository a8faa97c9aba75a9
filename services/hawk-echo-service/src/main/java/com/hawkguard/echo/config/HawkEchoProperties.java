package com.hawkguard.echo.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service settings bound from {@code hawk.service.*}:
 *
 * <pre>
 * hawk:
 *   service:
 *     name: hawk-echo-service
 *     environment: production
 *     description: Echoes the Hawk credentials presented to it
 * </pre>
 *
 * @param name service name reported by {@code /api/v1/info}. Required.
 * @param environment deployment environment, {@code development} when unset
 * @param description optional human-readable description
 */
@ConfigurationProperties(prefix = "hawk.service")
@Validated
public record HawkEchoProperties(@NotBlank String name, String environment, String description) {

    public HawkEchoProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
