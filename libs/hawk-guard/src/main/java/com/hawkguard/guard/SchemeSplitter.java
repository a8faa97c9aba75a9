package com.hawkguard.guard;

/**
 * Separates the scheme token of an authentication header value from its credential payload.
 */
public final class SchemeSplitter {

    /** The only scheme the guards accept. */
    public static final String HAWK_SCHEME = "Hawk";

    private SchemeSplitter() {
        // utility class
    }

    /**
     * Splits {@code "<scheme> <payload>"}.
     * <p>
     * The scheme token runs up to the first space and is compared to {@code scheme}
     * ignoring ASCII case only. The payload is everything after that one space, returned
     * as is: it may be empty and keeps any further leading whitespace. A value with no
     * space at all fails, even when it equals the scheme.
     *
     * @param raw the header value
     * @param scheme the expected scheme token
     * @return the payload, or {@link HawkError.NoHeader} with {@link GuardStatus#UNAUTHORIZED}
     */
    public static GuardOutcome<String> split(String raw, String scheme) {
        int space = raw.indexOf(' ');
        if (space < 0) {
            return GuardOutcome.noHeader(GuardStatus.UNAUTHORIZED);
        }
        if (!equalsIgnoreAsciiCase(raw, space, scheme)) {
            return GuardOutcome.noHeader(GuardStatus.UNAUTHORIZED);
        }
        return GuardOutcome.success(raw.substring(space + 1));
    }

    // String.equalsIgnoreCase folds non-ASCII letters too, e.g. the Kelvin sign to 'k'
    private static boolean equalsIgnoreAsciiCase(String raw, int length, String scheme) {
        if (length != scheme.length()) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (toLowerAscii(raw.charAt(i)) != toLowerAscii(scheme.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static char toLowerAscii(char c) {
        return c >= 'A' && c <= 'Z' ? (char) (c + ('a' - 'A')) : c;
    }
}
