package com.hawkguard.guard;

import java.util.Objects;

/**
 * Why a guard did not produce a credential.
 * <p>
 * Closed set of two kinds:
 * <ul>
 *   <li>{@link NoHeader}: no usable header (absent, duplicated, wrong scheme, or no
 *       space after the scheme). The duplicate case is told apart only by its
 *       {@link GuardStatus#BAD_REQUEST} status.</li>
 *   <li>{@link MalformedCredential}: the scheme matched but the credential parser
 *       rejected the payload. Carries the parser's exception unchanged.</li>
 * </ul>
 */
public sealed interface HawkError permits HawkError.NoHeader, HawkError.MalformedCredential {

    /** Human-readable description, safe to return to clients. */
    String message();

    /** Shared instance of {@link NoHeader}. */
    NoHeader NO_HEADER = new NoHeader();

    /**
     * No usable authentication header was presented.
     */
    record NoHeader() implements HawkError {

        @Override
        public String message() {
            return "No Hawk authentication header";
        }
    }

    /**
     * The header carried the Hawk scheme but its payload could not be parsed.
     *
     * @param cause the parser's error, surfaced verbatim
     */
    record MalformedCredential(CredentialParseException cause) implements HawkError {

        public MalformedCredential {
            Objects.requireNonNull(cause, "cause must not be null");
        }

        @Override
        public String message() {
            return cause.getMessage();
        }
    }
}
