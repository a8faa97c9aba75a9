package com.hawkguard.credential;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * The attributes of a Hawk {@code Authorization} or {@code Server-Authorization} header.
 * <p>
 * Every attribute is optional at this level: the header is only known to be well formed,
 * not complete or authentic. Verifying the MAC, the nonce and the timestamp is left to
 * the application.
 * <p>
 * Immutable. Byte arrays are copied in and out. {@link #toString()} never prints
 * {@code mac} or {@code hash}.
 */
public final class HawkHeader {

    private final String id;
    private final Instant ts;
    private final String nonce;
    private final byte[] mac;
    private final String ext;
    private final byte[] hash;
    private final String app;
    private final String dlg;

    public HawkHeader(String id, Instant ts, String nonce, byte[] mac,
                      String ext, byte[] hash, String app, String dlg) {
        this.id = id;
        this.ts = ts;
        this.nonce = nonce;
        this.mac = mac == null ? null : mac.clone();
        this.ext = ext;
        this.hash = hash == null ? null : hash.clone();
        this.app = app;
        this.dlg = dlg;
    }

    /** Key identifier. */
    public Optional<String> id() {
        return Optional.ofNullable(id);
    }

    /** Timestamp, whole seconds. */
    public Optional<Instant> ts() {
        return Optional.ofNullable(ts);
    }

    public Optional<String> nonce() {
        return Optional.ofNullable(nonce);
    }

    /** Decoded request MAC. */
    public Optional<byte[]> mac() {
        return Optional.ofNullable(mac).map(byte[]::clone);
    }

    /** Application-specific extension data. */
    public Optional<String> ext() {
        return Optional.ofNullable(ext);
    }

    /** Decoded payload hash. */
    public Optional<byte[]> hash() {
        return Optional.ofNullable(hash).map(byte[]::clone);
    }

    /** Oz application id. */
    public Optional<String> app() {
        return Optional.ofNullable(app);
    }

    /** Oz delegated-by application id. */
    public Optional<String> dlg() {
        return Optional.ofNullable(dlg);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HawkHeader other)) {
            return false;
        }
        return Objects.equals(id, other.id)
                && Objects.equals(ts, other.ts)
                && Objects.equals(nonce, other.nonce)
                && Arrays.equals(mac, other.mac)
                && Objects.equals(ext, other.ext)
                && Arrays.equals(hash, other.hash)
                && Objects.equals(app, other.app)
                && Objects.equals(dlg, other.dlg);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, ts, nonce, ext, app, dlg);
        result = 31 * result + Arrays.hashCode(mac);
        result = 31 * result + Arrays.hashCode(hash);
        return result;
    }

    @Override
    public String toString() {
        return "HawkHeader[id=" + id
                + ", ts=" + ts
                + ", nonce=" + nonce
                + ", mac=" + (mac == null ? null : "[REDACTED]")
                + ", ext=" + ext
                + ", hash=" + (hash == null ? null : "[REDACTED]")
                + ", app=" + app
                + ", dlg=" + dlg
                + "]";
    }
}
