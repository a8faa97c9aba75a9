package com.hawkguard.guard;

/**
 * Unchecked form of a failed {@link GuardOutcome}, for hosts that signal request
 * rejection by throwing.
 */
public class HawkGuardException extends RuntimeException {

    private final String headerName;
    private final HawkError error;
    private final GuardStatus status;

    public HawkGuardException(String headerName, HawkError error, GuardStatus status) {
        super(
                "%s header rejected: %s".formatted(headerName, error.message()),
                error instanceof HawkError.MalformedCredential malformed
                        ? malformed.cause()
                        : null);
        this.headerName = headerName;
        this.error = error;
        this.status = status;
    }

    public String headerName() {
        return headerName;
    }

    public HawkError error() {
        return error;
    }

    public GuardStatus status() {
        return status;
    }
}
