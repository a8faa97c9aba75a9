package com.hawkguard.echo;

import com.hawkguard.echo.config.HawkEchoProperties;
import com.hawkguard.web.HawkWebConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Reference service for the Hawk header guards.
 *
 * <p>Its routes declare {@code AuthorizationHeader}, {@code ServerAuthorizationHeader} or
 * {@code GuardOutcome<...>} parameters and echo what the guard extracted. Nothing here verifies
 * a MAC: a request with a well-formed but forged header is answered like any other.
 */
@SpringBootApplication
@EnableConfigurationProperties(HawkEchoProperties.class)
@Import(HawkWebConfig.class)
public class HawkEchoApplication {

    private static final Logger log = LoggerFactory.getLogger(HawkEchoApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(HawkEchoApplication.class, args);
        log.info("Hawk echo service started");
    }
}
