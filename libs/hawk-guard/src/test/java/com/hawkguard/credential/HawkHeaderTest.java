package com.hawkguard.credential;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HawkHeader")
class HawkHeaderTest {

    @Test
    @DisplayName("toString redacts mac and hash")
    void toStringRedactsSecrets() {
        var header = new HawkHeader("id-1", Instant.ofEpochSecond(1), "n", new byte[] {1, 2},
                null, new byte[] {3}, null, null);

        assertThat(header.toString())
                .contains("id=id-1")
                .contains("mac=[REDACTED]")
                .contains("hash=[REDACTED]")
                .doesNotContain("[1, 2]");
    }

    @Test
    @DisplayName("byte arrays are copied defensively")
    void copiesByteArrays() {
        byte[] mac = {1, 2, 3};
        var header = new HawkHeader(null, null, null, mac, null, null, null, null);
        mac[0] = 9;
        header.mac().orElseThrow()[1] = 9;

        assertThat(header.mac()).hasValueSatisfying(m -> assertThat(m).containsExactly(1, 2, 3));
    }

    @Test
    @DisplayName("equality compares byte array contents")
    void equality() {
        var a = new HawkHeader("x", null, null, new byte[] {1}, null, null, null, null);
        var b = new HawkHeader("x", null, null, new byte[] {1}, null, null, null, null);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }
}
