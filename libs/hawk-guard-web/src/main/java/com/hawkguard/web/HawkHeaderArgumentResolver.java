package com.hawkguard.web;

import com.hawkguard.guard.GuardOutcome;
import com.hawkguard.guard.GuardStatus;
import com.hawkguard.guard.HawkError;
import com.hawkguard.guard.HeaderView;
import com.hawkguard.header.AuthorizationHeader;
import com.hawkguard.header.HawkAuthzHeader;
import com.hawkguard.header.ServerAuthorizationHeader;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.MethodParameter;
import org.springframework.core.ResolvableType;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves Hawk header guards as controller method arguments.
 * <p>
 * Supported parameter types:
 * <ul>
 *   <li>{@link AuthorizationHeader}, {@link ServerAuthorizationHeader}: a failed guard
 *       throws {@link com.hawkguard.guard.HawkGuardException}, which
 *       {@link HawkGuardExceptionHandler} turns into a 401 or 400 response.</li>
 *   <li>{@code GuardOutcome<AuthorizationHeader>}, {@code GuardOutcome<ServerAuthorizationHeader>}:
 *       the handler receives the outcome and decides itself.</li>
 * </ul>
 * Each failure is logged once here. Header values are never logged.
 */
public class HawkHeaderArgumentResolver implements HandlerMethodArgumentResolver {

    private static final Logger log = LoggerFactory.getLogger(HawkHeaderArgumentResolver.class);

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return headerType(parameter) != null;
    }

    @Override
    public Object resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {

        Class<? extends HawkAuthzHeader> type = headerType(parameter);
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        if (type == null || request == null) {
            throw new IllegalStateException("Cannot resolve Hawk header for " + parameter);
        }

        HeaderView headers = new ServletHeaderView(request);
        String headerName;
        GuardOutcome<? extends HawkAuthzHeader> outcome;
        if (type == AuthorizationHeader.class) {
            headerName = AuthorizationHeader.HEADER_NAME;
            outcome = AuthorizationHeader.from(headers);
        } else {
            headerName = ServerAuthorizationHeader.HEADER_NAME;
            outcome = ServerAuthorizationHeader.from(headers);
        }

        if (outcome instanceof GuardOutcome.Failure<? extends HawkAuthzHeader> failure) {
            logFailure(request, headerName, failure.error(), failure.status());
        }
        if (parameter.getParameterType() == GuardOutcome.class) {
            return outcome;
        }
        return outcome.orElseThrow(headerName);
    }

    /** The guarded header type a parameter asks for, or null when the parameter is not ours. */
    private static Class<? extends HawkAuthzHeader> headerType(MethodParameter parameter) {
        Class<?> type = parameter.getParameterType();
        if (type == GuardOutcome.class) {
            type = ResolvableType.forMethodParameter(parameter).getGeneric(0).resolve();
        }
        if (type == AuthorizationHeader.class) {
            return AuthorizationHeader.class;
        }
        if (type == ServerAuthorizationHeader.class) {
            return ServerAuthorizationHeader.class;
        }
        return null;
    }

    private static void logFailure(HttpServletRequest request, String headerName, HawkError error,
                                   GuardStatus status) {
        if (error instanceof HawkError.MalformedCredential malformed) {
            log.warn(
                    "Malformed Hawk {} header on {} {}: {}",
                    headerName,
                    request.getMethod(),
                    request.getRequestURI(),
                    malformed.cause().getMessage());
        } else if (status == GuardStatus.BAD_REQUEST) {
            log.warn(
                    "Duplicate {} headers on {} {}",
                    headerName,
                    request.getMethod(),
                    request.getRequestURI());
        } else {
            log.debug(
                    "No usable Hawk {} header on {} {}",
                    headerName,
                    request.getMethod(),
                    request.getRequestURI());
        }
    }
}
