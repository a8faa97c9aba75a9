package com.hawkguard.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HawkWebProperties")
class HawkWebPropertiesTest {

    @Test
    @DisplayName("applies defaults when unset")
    void defaults() {
        var props = HawkWebProperties.defaults();

        assertThat(props.problemTypeBase()).isEqualTo("https://hawk-guard.dev/errors");
        assertThat(props.includeParserDetail()).isTrue();
    }

    @Test
    @DisplayName("strips a trailing slash from the problem type base")
    void stripsTrailingSlash() {
        var props = new HawkWebProperties("https://errors.example.com/", false);

        assertThat(props.problemTypeBase()).isEqualTo("https://errors.example.com");
        assertThat(props.includeParserDetail()).isFalse();
    }
}
