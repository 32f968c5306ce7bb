package com.conduit.grpc.interceptor;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MethodNames")
class MethodNamesTest {

    @Test
    @DisplayName("splits a full method name with a leading slash")
    void leadingSlash() {
        assertThat(MethodNames.split("/sa.StorageAuthority/GetOrder"))
                .isEqualTo(new MethodNames("sa.StorageAuthority", "GetOrder"));
    }

    @Test
    @DisplayName("splits a full method name without a leading slash")
    void noLeadingSlash() {
        assertThat(MethodNames.split("Chiller/Chill")).isEqualTo(new MethodNames("Chiller", "Chill"));
    }

    @Test
    @DisplayName("falls back to unknown")
    void unknown() {
        assertThat(MethodNames.split(null)).isEqualTo(MethodNames.UNKNOWN);
        assertThat(MethodNames.split("Chiller")).isEqualTo(MethodNames.UNKNOWN);
    }
}
