package com.hawkguard.echo.infrastructure.web;

import com.hawkguard.web.HawkWebProperties;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps exceptions that are not guard failures to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Spring MVC's own exceptions (unknown route, unsupported method, unreadable body) keep the
 * status and headers the framework assigns them. Anything else is a 500 whose message is not
 * exposed. Guard failures never reach this class; {@code HawkGuardExceptionHandler} runs first.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final HawkWebProperties properties;

    public GlobalExceptionHandler(HawkWebProperties properties) {
        this.properties = properties;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(properties.problemTypeBase() + "/internal"));
        stamp(problem);
        return problem;
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            Exception ex,
            @Nullable Object body,
            HttpHeaders headers,
            HttpStatusCode statusCode,
            WebRequest request) {
        log.debug("Request rejected with {}: {}", statusCode.value(), ex.getMessage());
        ResponseEntity<Object> response =
                super.handleExceptionInternal(ex, body, headers, statusCode, request);
        if (response != null && response.getBody() instanceof ProblemDetail problem) {
            stamp(problem);
        }
        return response;
    }

    private static void stamp(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
    }
}
