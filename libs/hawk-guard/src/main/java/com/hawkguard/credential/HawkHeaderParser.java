package com.hawkguard.credential;

import com.hawkguard.guard.CredentialParseException;
import com.hawkguard.guard.CredentialParser;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Parses the attribute list of a Hawk header, e.g.
 * {@code id="dh37fgj492je", ts="1353832234", nonce="j4h3g2",
 * mac="6R4rV5iE+NPoym+WwjeHzjAGXUtLNIxmo1vpMofpLAE="}.
 * <p>
 * Attributes are {@code name="value"} pairs separated by commas and whitespace, in any
 * order, each at most once. Recognized names: {@code id ts nonce mac ext hash app dlg}.
 * {@code ts} is decimal epoch seconds; {@code mac} and {@code hash} are standard base64.
 * Values cannot contain a double quote; there is no escaping.
 * <p>
 * Stateless and thread-safe.
 */
public final class HawkHeaderParser implements CredentialParser<HawkHeader> {

    /** Shared instance. */
    public static final HawkHeaderParser INSTANCE = new HawkHeaderParser();

    @Override
    public HawkHeader parse(String payload) throws CredentialParseException {
        Map<String, String> attributes = readAttributes(payload);
        return new HawkHeader(
                attributes.get("id"),
                timestamp(attributes.get("ts")),
                attributes.get("nonce"),
                base64("mac", attributes.get("mac")),
                attributes.get("ext"),
                base64("hash", attributes.get("hash")),
                attributes.get("app"),
                attributes.get("dlg"));
    }

    private static Map<String, String> readAttributes(String payload)
            throws CredentialParseException {
        Map<String, String> attributes = new HashMap<>();
        int pos = skipSeparators(payload, 0);
        while (pos < payload.length()) {
            int eq = payload.indexOf('=', pos);
            if (eq < 0) {
                throw new CredentialParseException("Expected '='");
            }
            String name = payload.substring(pos, eq).strip();
            if (!isKnownField(name)) {
                throw new CredentialParseException("Invalid Hawk field " + name);
            }

            int open = skipWhitespace(payload, eq + 1);
            if (open >= payload.length() || payload.charAt(open) != '"') {
                throw new CredentialParseException("Expected opening quote");
            }
            int close = payload.indexOf('"', open + 1);
            if (close < 0) {
                throw new CredentialParseException("Expected closing quote");
            }
            String value = payload.substring(open + 1, close);
            if (value.indexOf('\\') >= 0) {
                throw new CredentialParseException("Invalid character in Hawk field " + name);
            }
            if (attributes.putIfAbsent(name, value) != null) {
                throw new CredentialParseException("Duplicate Hawk field " + name);
            }
            pos = skipSeparators(payload, close + 1);
        }
        return attributes;
    }

    private static boolean isKnownField(String name) {
        return switch (name) {
            case "id", "ts", "nonce", "mac", "ext", "hash", "app", "dlg" -> true;
            default -> false;
        };
    }

    private static Instant timestamp(String value) throws CredentialParseException {
        if (value == null) {
            return null;
        }
        try {
            return Instant.ofEpochSecond(Long.parseLong(value));
        } catch (NumberFormatException | DateTimeException e) {
            throw new CredentialParseException("Error parsing ts field", e);
        }
    }

    private static byte[] base64(String field, String value) throws CredentialParseException {
        if (value == null) {
            return null;
        }
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new CredentialParseException("Error parsing " + field + " field", e);
        }
    }

    private static int skipSeparators(String s, int pos) {
        while (pos < s.length()
                && (s.charAt(pos) == ',' || Character.isWhitespace(s.charAt(pos)))) {
            pos++;
        }
        return pos;
    }

    private static int skipWhitespace(String s, int pos) {
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) {
            pos++;
        }
        return pos;
    }
}
