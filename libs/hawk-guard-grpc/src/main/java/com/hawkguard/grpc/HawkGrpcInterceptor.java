package com.hawkguard.grpc;

import com.hawkguard.guard.GuardOutcome;
import com.hawkguard.guard.GuardStatus;
import com.hawkguard.guard.HawkError;
import com.hawkguard.guard.HeaderView;
import com.hawkguard.header.AuthorizationHeader;
import com.hawkguard.header.HawkAuthzHeader;
import com.hawkguard.header.ServerAuthorizationHeader;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * gRPC server interceptor that requires one well-formed Hawk header in the call metadata.
 *
 * <p>On success the parsed header is published in the call {@link Context}:
 *
 * <pre>
 * AuthorizationHeader header = HawkGrpcInterceptor.AUTHORIZATION.get();
 * </pre>
 *
 * <p>On failure the call is closed before the service method runs:
 *
 * <ul>
 *   <li>401 failures → {@code UNAUTHENTICATED}
 *   <li>400 (duplicate header) → {@code INVALID_ARGUMENT}
 * </ul>
 *
 * @param <H> the guarded header type
 */
public final class HawkGrpcInterceptor<H extends HawkAuthzHeader> implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(HawkGrpcInterceptor.class);

    /** Context key holding the client's {@code authorization} header. */
    public static final Context.Key<AuthorizationHeader> AUTHORIZATION =
            Context.key("hawk-authorization");

    /** Context key holding the {@code server-authorization} header. */
    public static final Context.Key<ServerAuthorizationHeader> SERVER_AUTHORIZATION =
            Context.key("hawk-server-authorization");

    private final String headerName;
    private final Function<HeaderView, GuardOutcome<H>> guard;
    private final Context.Key<H> contextKey;

    private HawkGrpcInterceptor(
            String headerName,
            Function<HeaderView, GuardOutcome<H>> guard,
            Context.Key<H> contextKey) {
        this.headerName = headerName;
        this.guard = guard;
        this.contextKey = contextKey;
    }

    /** Interceptor guarding the {@code authorization} metadata entry. */
    public static HawkGrpcInterceptor<AuthorizationHeader> authorization() {
        return new HawkGrpcInterceptor<>(
                AuthorizationHeader.HEADER_NAME, AuthorizationHeader::from, AUTHORIZATION);
    }

    /** Interceptor guarding the {@code server-authorization} metadata entry. */
    public static HawkGrpcInterceptor<ServerAuthorizationHeader> serverAuthorization() {
        return new HawkGrpcInterceptor<>(
                ServerAuthorizationHeader.HEADER_NAME,
                ServerAuthorizationHeader::from,
                SERVER_AUTHORIZATION);
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        GuardOutcome<H> outcome = guard.apply(new MetadataHeaderView(headers));
        if (outcome instanceof GuardOutcome.Failure<H> failure) {
            logRejection(failure.error(), failure.status());
            call.close(toStatus(failure.error(), failure.status()), new Metadata());
            return new ServerCall.Listener<>() {};
        }

        H header = outcome.orElseThrow(headerName);
        Context context = Context.current().withValue(contextKey, header);
        return Contexts.interceptCall(context, call, headers, next);
    }

    private void logRejection(HawkError error, GuardStatus status) {
        if (status == GuardStatus.BAD_REQUEST) {
            log.warn("Rejecting call with duplicate {} metadata", headerName);
        } else if (error instanceof HawkError.MalformedCredential) {
            log.warn(
                    "Rejecting call with malformed Hawk {} metadata: {}",
                    headerName,
                    error.message());
        } else {
            log.debug("Rejecting call without usable {} metadata", headerName);
        }
    }

    /** Maps a guard failure to a gRPC status. Package-private for testing. */
    Status toStatus(HawkError error, GuardStatus status) {
        if (status == GuardStatus.BAD_REQUEST) {
            return Status.INVALID_ARGUMENT.withDescription("Multiple " + headerName + " headers");
        }
        Status unauthenticated = Status.UNAUTHENTICATED.withDescription(error.message());
        if (error instanceof HawkError.MalformedCredential malformed) {
            return unauthenticated.withCause(malformed.cause());
        }
        return unauthenticated;
    }
}
