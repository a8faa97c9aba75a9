package com.hawkguard.guard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HeaderView.of")
class HeaderViewTest {

    @Test
    @DisplayName("looks names up ignoring case and keeps the listed order")
    void caseInsensitiveLookupInOrder() {
        var view = HeaderView.of(Map.of("Authorization", List.of("second", "first")));

        assertThat(view.values("authorization")).containsExactly("second", "first");
        assertThat(view.values("AUTHORIZATION")).containsExactly("second", "first");
    }

    @Test
    @DisplayName("absent name yields an empty list")
    void absentName() {
        assertThat(HeaderView.of(Map.of()).values("authorization")).isEmpty();
    }

    @Test
    @DisplayName("rejects keys that differ only in case")
    void rejectsCaseVariantKeys() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Authorization", List.of("a"));
        headers.put("authorization", List.of("b"));

        assertThatThrownBy(() -> HeaderView.of(headers))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("more than one key");
    }

    @Test
    @DisplayName("later changes to the source list are not visible")
    void copiesValues() {
        List<String> values = new ArrayList<>(List.of("a"));
        var view = HeaderView.of(Map.of("Authorization", values));

        values.add("b");

        assertThat(view.values("authorization")).containsExactly("a");
    }
}
