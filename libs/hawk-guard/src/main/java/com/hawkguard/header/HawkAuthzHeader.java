package com.hawkguard.header;

import com.hawkguard.credential.HawkHeader;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Base for the two guarded header types. Wraps a syntactically valid {@link HawkHeader}
 * and exposes its attributes read-only.
 * <p>
 * Holding one of these proves only that the request carried exactly one well-formed
 * Hawk header. Authenticating it is the caller's job.
 */
public abstract sealed class HawkAuthzHeader
        permits AuthorizationHeader, ServerAuthorizationHeader {

    private final HawkHeader header;

    HawkAuthzHeader(HawkHeader header) {
        this.header = Objects.requireNonNull(header, "header must not be null");
    }

    /** The parsed header. */
    public HawkHeader header() {
        return header;
    }

    /** Name of the HTTP header this value was read from. */
    public abstract String headerName();

    public Optional<String> id() {
        return header.id();
    }

    public Optional<Instant> ts() {
        return header.ts();
    }

    public Optional<String> nonce() {
        return header.nonce();
    }

    public Optional<byte[]> mac() {
        return header.mac();
    }

    public Optional<String> ext() {
        return header.ext();
    }

    public Optional<byte[]> hash() {
        return header.hash();
    }

    public Optional<String> app() {
        return header.app();
    }

    public Optional<String> dlg() {
        return header.dlg();
    }

    @Override
    public boolean equals(Object o) {
        return o != null
                && o.getClass() == getClass()
                && header.equals(((HawkAuthzHeader) o).header);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), header);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + header + "]";
    }
}
