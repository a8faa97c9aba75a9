package com.hawkguard.guard;

import java.util.List;

/**
 * Picks the single value of an authentication header out of everything the client sent.
 */
public final class HeaderLocator {

    private HeaderLocator() {
        // utility class
    }

    /**
     * Applies the presence and uniqueness rules to the values of one header name.
     * <ul>
     *   <li>no value: {@link HawkError.NoHeader}, {@link GuardStatus#UNAUTHORIZED}</li>
     *   <li>one value: that value</li>
     *   <li>two or more values, identical or not: {@link HawkError.NoHeader},
     *       {@link GuardStatus#BAD_REQUEST}</li>
     * </ul>
     *
     * @param values the header values in request order (null is treated as none)
     * @return the single raw value or a failure
     */
    public static GuardOutcome<String> locate(List<String> values) {
        if (values == null || values.isEmpty()) {
            return GuardOutcome.noHeader(GuardStatus.UNAUTHORIZED);
        }
        if (values.size() > 1) {
            return GuardOutcome.noHeader(GuardStatus.BAD_REQUEST);
        }
        return GuardOutcome.success(values.get(0));
    }
}
