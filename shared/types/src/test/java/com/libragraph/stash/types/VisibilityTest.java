package com.libragraph.stash.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class VisibilityTest {

    @Test
    void shouldParseKnownLabelsCaseInsensitively() {
        assertThat(Visibility.parseOrPrivate("public")).isEqualTo(Visibility.PUBLIC);
        assertThat(Visibility.parseOrPrivate(" Unlisted ")).isEqualTo(Visibility.UNLISTED);
        assertThat(Visibility.parseOrPrivate("PRIVATE")).isEqualTo(Visibility.PRIVATE);
    }

    @Test
    void shouldFallBackToPrivateOnInvalidInput() {
        assertThat(Visibility.parseOrPrivate(null)).isEqualTo(Visibility.PRIVATE);
        assertThat(Visibility.parseOrPrivate("")).isEqualTo(Visibility.PRIVATE);
        assertThat(Visibility.parseOrPrivate("friends-only")).isEqualTo(Visibility.PRIVATE);
    }

    @Test
    void shouldRoundTripIds() {
        for (Visibility v : Visibility.values()) {
            assertThat(Visibility.fromId(v.id())).isEqualTo(v);
        }
        assertThatIllegalArgumentException().isThrownBy(() -> Visibility.fromId(99));
    }

    @Test
    void objectKindIdsAreStable() {
        assertThat(ObjectKind.fromId(0)).isEqualTo(ObjectKind.FILE);
        assertThat(ObjectKind.fromId(1)).isEqualTo(ObjectKind.CONTENT);
        assertThat(ObjectKind.fromId(2)).isEqualTo(ObjectKind.ATTACHMENT);
    }
}
