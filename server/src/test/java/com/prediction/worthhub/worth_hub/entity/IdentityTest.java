package com.prediction.worthhub.worth_hub.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Identity")
class IdentityTest {

    private static final String HEX = "a1".repeat(32);

    @Test
    @DisplayName("Should parse and print 64 hex characters")
    void hex() {
        Identity identity = Identity.fromHex(HEX);

        assertThat(identity.toHex()).isEqualTo(HEX);
        assertThat(identity.toBytes()).hasSize(Identity.LENGTH);
        assertThat(identity).isEqualTo(Identity.fromHex(HEX.toUpperCase()));
    }

    @Test
    @DisplayName("Should reject anything that is not 32 bytes of hex")
    void rejects() {
        assertThatThrownBy(() -> Identity.fromHex("a1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Identity.fromHex("zz".repeat(32))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Identity.of(new byte[31])).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should not expose its internal bytes")
    void defensiveCopy() {
        Identity identity = Identity.fromHex(HEX);
        identity.toBytes()[0] = 0;

        assertThat(identity.toHex()).isEqualTo(HEX);
    }
}
