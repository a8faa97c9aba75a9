package com.hawkguard.grpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.hawkguard.guard.CredentialParseException;
import com.hawkguard.guard.GuardStatus;
import com.hawkguard.guard.HawkError;
import com.hawkguard.header.AuthorizationHeader;
import com.hawkguard.header.ServerAuthorizationHeader;
import com.hawkguard.testing.TestHawkHeaders;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.Status;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

@DisplayName("HawkGrpcInterceptor")
class HawkGrpcInterceptorTest {

    private static final Metadata.Key<String> AUTHORIZATION_KEY =
            Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);
    private static final Metadata.Key<String> SERVER_AUTHORIZATION_KEY =
            Metadata.Key.of("server-authorization", Metadata.ASCII_STRING_MARSHALLER);

    private ServerCall<String, String> call;
    private ServerCallHandler<String, String> handler;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        call = mock(ServerCall.class);
        handler = mock(ServerCallHandler.class);
    }

    private Status closedStatus() {
        var captor = ArgumentCaptor.forClass(Status.class);
        verify(call).close(captor.capture(), any(Metadata.class));
        verify(handler, never()).startCall(any(), any());
        return captor.getValue();
    }

    @Nested
    @DisplayName("rejected calls")
    class Rejected {

        @Test
        @DisplayName("missing metadata closes the call with UNAUTHENTICATED")
        void missingHeader() {
            HawkGrpcInterceptor.authorization().interceptCall(call, new Metadata(), handler);

            assertThat(closedStatus().getCode()).isEqualTo(Status.Code.UNAUTHENTICATED);
        }

        @Test
        @DisplayName("duplicate metadata closes the call with INVALID_ARGUMENT")
        void duplicateHeader() {
            var metadata = new Metadata();
            metadata.put(AUTHORIZATION_KEY, TestHawkHeaders.VALID);
            metadata.put(AUTHORIZATION_KEY, TestHawkHeaders.VALID);

            HawkGrpcInterceptor.authorization().interceptCall(call, metadata, handler);

            var status = closedStatus();
            assertThat(status.getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
            assertThat(status.getDescription()).isEqualTo("Multiple authorization headers");
        }

        @Test
        @DisplayName("malformed credential closes the call with UNAUTHENTICATED and the message")
        void malformedCredential() {
            var metadata = new Metadata();
            metadata.put(AUTHORIZATION_KEY, TestHawkHeaders.UNKNOWN_FIELD);

            HawkGrpcInterceptor.authorization().interceptCall(call, metadata, handler);

            var status = closedStatus();
            assertThat(status.getCode()).isEqualTo(Status.Code.UNAUTHENTICATED);
            assertThat(status.getDescription()).isEqualTo("Invalid Hawk field nosuchfield");
            assertThat(status.getCause()).isInstanceOf(CredentialParseException.class);
        }
    }

    @Nested
    @DisplayName("rejection logging")
    class RejectionLogging {

        private final Logger logger = (Logger) LoggerFactory.getLogger(HawkGrpcInterceptor.class);
        private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        private Level previousLevel;

        @BeforeEach
        void attach() {
            previousLevel = logger.getLevel();
            logger.setLevel(Level.DEBUG);
            appender.start();
            logger.addAppender(appender);
        }

        @AfterEach
        void detach() {
            logger.detachAppender(appender);
            logger.setLevel(previousLevel);
        }

        @Test
        @DisplayName("a malformed credential is logged once, at warn, without the raw value")
        void malformedLoggedOnce() {
            var metadata = new Metadata();
            metadata.put(AUTHORIZATION_KEY, TestHawkHeaders.UNKNOWN_FIELD);

            HawkGrpcInterceptor.authorization().interceptCall(call, metadata, handler);

            assertThat(appender.list).hasSize(1);
            ILoggingEvent event = appender.list.get(0);
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage())
                    .contains("Invalid Hawk field nosuchfield")
                    .doesNotContain(TestHawkHeaders.UNKNOWN_FIELD);
        }

        @Test
        @DisplayName("a missing header is logged once, at debug")
        void missingLoggedOnce() {
            HawkGrpcInterceptor.authorization().interceptCall(call, new Metadata(), handler);

            assertThat(appender.list).singleElement()
                    .extracting(ILoggingEvent::getLevel)
                    .isEqualTo(Level.DEBUG);
        }

        @Test
        @DisplayName("mapping a failure to a status does not log")
        void toStatusDoesNotLog() {
            var error = new HawkError.MalformedCredential(new CredentialParseException("bad"));

            HawkGrpcInterceptor.authorization().toStatus(error, GuardStatus.UNAUTHORIZED);

            assertThat(appender.list).isEmpty();
        }
    }

    @Nested
    @DisplayName("accepted calls")
    class Accepted {

        @Test
        @DisplayName("publishes the authorization header in the call context")
        void publishesAuthorization() {
            var metadata = new Metadata();
            metadata.put(AUTHORIZATION_KEY, TestHawkHeaders.withScheme("hawk"));
            var seen = new AtomicReference<AuthorizationHeader>();
            when(handler.startCall(any(), any())).thenAnswer(invocation -> {
                seen.set(HawkGrpcInterceptor.AUTHORIZATION.get());
                return new ServerCall.Listener<String>() {};
            });

            HawkGrpcInterceptor.authorization().interceptCall(call, metadata, handler);

            assertThat(seen.get()).isNotNull();
            assertThat(seen.get().id()).contains("xyz");
            verify(call, never()).close(any(), any());
        }

        @Test
        @DisplayName("server interceptor reads server-authorization only")
        void publishesServerAuthorization() {
            var metadata = new Metadata();
            metadata.put(SERVER_AUTHORIZATION_KEY, TestHawkHeaders.VALID);
            metadata.put(AUTHORIZATION_KEY, TestHawkHeaders.BEARER);
            var seen = new AtomicReference<ServerAuthorizationHeader>();
            when(handler.startCall(any(), any())).thenAnswer(invocation -> {
                seen.set(HawkGrpcInterceptor.SERVER_AUTHORIZATION.get());
                return new ServerCall.Listener<String>() {};
            });

            HawkGrpcInterceptor.serverAuthorization().interceptCall(call, metadata, handler);

            assertThat(seen.get().id()).contains("xyz");
        }
    }

    @Test
    @DisplayName("status mapping follows the guard status")
    void statusMapping() {
        var interceptor = HawkGrpcInterceptor.authorization();

        assertThat(interceptor.toStatus(HawkError.NO_HEADER, GuardStatus.UNAUTHORIZED).getCode())
                .isEqualTo(Status.Code.UNAUTHENTICATED);
        assertThat(interceptor.toStatus(HawkError.NO_HEADER, GuardStatus.BAD_REQUEST).getCode())
                .isEqualTo(Status.Code.INVALID_ARGUMENT);
    }
}
