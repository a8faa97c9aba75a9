package com.hawkguard.guard;

/**
 * HTTP status attached to a failed {@link GuardOutcome}.
 * <p>
 * Only the two statuses the guard can produce are listed. The host framework
 * translates them into its own status type.
 */
public enum GuardStatus {

    BAD_REQUEST(400, "Bad Request"),
    UNAUTHORIZED(401, "Unauthorized");

    private final int code;
    private final String reasonPhrase;

    GuardStatus(int code, String reasonPhrase) {
        this.code = code;
        this.reasonPhrase = reasonPhrase;
    }

    /** Numeric HTTP status code. */
    public int code() {
        return code;
    }

    public String reasonPhrase() {
        return reasonPhrase;
    }
}
