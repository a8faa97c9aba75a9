package com.hawkguard.web;

import com.hawkguard.guard.GuardStatus;
import com.hawkguard.guard.HawkError;
import com.hawkguard.guard.HawkGuardException;
import com.hawkguard.guard.SchemeSplitter;
import java.net.URI;
import java.time.Instant;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps {@link HawkGuardException} to an RFC 7807 {@link ProblemDetail} response.
 * <p>
 * The status is the guard's own (401 or 400). 401 responses carry a
 * {@code WWW-Authenticate: Hawk} challenge. Example body:
 *
 * <pre>
 * {
 *   "type": "https://hawk-guard.dev/errors/malformed-credential",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Invalid Hawk field nosuchfield",
 *   "header": "authorization",
 *   "timestamp": "2025-07-12T10:30:00Z"
 * }
 * </pre>
 *
 * Ordered ahead of application advice so that a catch-all {@code Exception} handler
 * does not turn guard failures into 500s.
 */
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class HawkGuardExceptionHandler {

    static final String MALFORMED_DETAIL = "Malformed Hawk credential";

    private final HawkWebProperties properties;

    public HawkGuardExceptionHandler(HawkWebProperties properties) {
        this.properties = properties;
    }

    @ExceptionHandler(HawkGuardException.class)
    public ResponseEntity<ProblemDetail> handleGuardFailure(HawkGuardException ex) {
        GuardStatus status = ex.status();
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.valueOf(status.code()), detail(ex.error()));
        problem.setTitle(status.reasonPhrase());
        problem.setType(URI.create(properties.problemTypeBase() + "/" + kind(ex.error())));
        problem.setProperty("header", ex.headerName());
        problem.setProperty("timestamp", Instant.now().toString());

        var response = ResponseEntity.status(status.code());
        if (status == GuardStatus.UNAUTHORIZED) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, SchemeSplitter.HAWK_SCHEME);
        }
        return response.body(problem);
    }

    private String detail(HawkError error) {
        if (error instanceof HawkError.MalformedCredential && !properties.includeParserDetail()) {
            return MALFORMED_DETAIL;
        }
        return error.message();
    }

    private static String kind(HawkError error) {
        return error instanceof HawkError.MalformedCredential
                ? "malformed-credential"
                : "no-header";
    }
}
