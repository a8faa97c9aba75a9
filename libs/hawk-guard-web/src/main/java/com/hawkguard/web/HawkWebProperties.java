package com.hawkguard.web;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the Spring MVC binding of the Hawk header guards, bound from
 * {@code hawk.guard.web.*}:
 *
 * <pre>
 * hawk:
 *   guard:
 *     web:
 *       problem-type-base: https://errors.example.com/hawk
 *       include-parser-detail: false
 * </pre>
 *
 * @param problemTypeBase base URI of the ProblemDetail {@code type} field; the error kind is
 *     appended
 * @param includeParserDetail whether a malformed credential's parser message is sent to the client
 */
@ConfigurationProperties(prefix = "hawk.guard.web")
public record HawkWebProperties(String problemTypeBase, Boolean includeParserDetail) {

    public static final String DEFAULT_PROBLEM_TYPE_BASE = "https://hawk-guard.dev/errors";

    public HawkWebProperties {
        if (problemTypeBase == null || problemTypeBase.isBlank()) {
            problemTypeBase = DEFAULT_PROBLEM_TYPE_BASE;
        } else if (problemTypeBase.endsWith("/")) {
            problemTypeBase = problemTypeBase.substring(0, problemTypeBase.length() - 1);
        }
        if (includeParserDetail == null) {
            includeParserDetail = Boolean.TRUE;
        }
    }

    /** Properties with every default applied. */
    public static HawkWebProperties defaults() {
        return new HawkWebProperties(null, null);
    }
}
