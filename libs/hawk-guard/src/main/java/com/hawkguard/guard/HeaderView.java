package com.hawkguard.guard;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only, multi-valued header lookup supplied by the host framework.
 * <p>
 * Name matching is the host's job and is expected to be case-insensitive.
 */
@FunctionalInterface
public interface HeaderView {

    /**
     * Returns every value sent under the given header name, in request order.
     *
     * @param name header name
     * @return the values, empty when the header is absent; never null
     */
    List<String> values(String name);

    /**
     * Builds a view over a plain map whose keys are header names and whose values are listed in
     * request order. Keys are matched ignoring case, so each header name may appear under one key
     * only. Intended for tests and for hosts without a native header type.
     *
     * @throws IllegalArgumentException if two keys differ only in case
     */
    static HeaderView of(Map<String, List<String>> headers) {
        Map<String, List<String>> byName = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, values) -> {
            if (byName.putIfAbsent(name, List.copyOf(values)) != null) {
                throw new IllegalArgumentException(
                        "Header " + name + " appears under more than one key");
            }
        });
        return name -> byName.getOrDefault(name, List.of());
    }
}
