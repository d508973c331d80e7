package io.github.drompincen.aigov.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrustLevelTest {

    @Test
    void levelsAreStrictlyOrdered() {
        assertThat(TrustLevel.values()).containsExactly(
                TrustLevel.ANONYMOUS,
                TrustLevel.CONTRIBUTOR,
                TrustLevel.AUTHORIZED,
                TrustLevel.ELEVATED);
        assertThat(TrustLevel.CONTRIBUTOR.isBelow(TrustLevel.AUTHORIZED)).isTrue();
        assertThat(TrustLevel.ELEVATED.isAtLeast(TrustLevel.AUTHORIZED)).isTrue();
        assertThat(TrustLevel.AUTHORIZED.isAtLeast(TrustLevel.AUTHORIZED)).isTrue();
        assertThat(TrustLevel.ANONYMOUS.isAtLeast(TrustLevel.CONTRIBUTOR)).isFalse();
    }

    @Test
    void lowerPicksTheMoreConservativeLevel() {
        assertThat(TrustLevel.lower(TrustLevel.ELEVATED, TrustLevel.CONTRIBUTOR)).isEqualTo(TrustLevel.CONTRIBUTOR);
        assertThat(TrustLevel.lower(TrustLevel.ANONYMOUS, TrustLevel.AUTHORIZED)).isEqualTo(TrustLevel.ANONYMOUS);
    }

    @Test
    void fromStringIsCaseInsensitive() {
        assertThat(TrustLevel.fromString("authorized")).isEqualTo(TrustLevel.AUTHORIZED);
        assertThat(TrustLevel.fromString("ELEVATED")).isEqualTo(TrustLevel.ELEVATED);
        assertThatThrownBy(() -> TrustLevel.fromString("root"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
