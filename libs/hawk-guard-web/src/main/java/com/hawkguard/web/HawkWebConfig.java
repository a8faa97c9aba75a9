package com.hawkguard.web;

import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the Hawk header argument resolver and its exception handler with Spring MVC.
 * Import it from the application: {@code @Import(HawkWebConfig.class)}.
 */
@Configuration
@EnableConfigurationProperties(HawkWebProperties.class)
public class HawkWebConfig implements WebMvcConfigurer {

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(hawkHeaderArgumentResolver());
    }

    @Bean
    public HawkHeaderArgumentResolver hawkHeaderArgumentResolver() {
        return new HawkHeaderArgumentResolver();
    }

    @Bean
    public HawkGuardExceptionHandler hawkGuardExceptionHandler(HawkWebProperties properties) {
        return new HawkGuardExceptionHandler(properties);
    }
}
