package com.libragraph.stash.core.access;

import com.libragraph.stash.core.dao.StoredObjectRecord;
import com.libragraph.stash.types.ObjectKind;
import com.libragraph.stash.types.Visibility;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessPolicyTest {

    private static final long OWNER = 10L;
    private static final long STRANGER = 20L;

    private final AccessPolicy policy = new AccessPolicy();

    private static StoredObjectRecord object(Visibility visibility) {
        return new StoredObjectRecord(1L, OWNER, "doc.pdf", "x.pdf", 3L, null, "application/pdf",
                false, false, null, visibility, ObjectKind.FILE, null, Instant.now());
    }

    @Test
    void publicObjectsAreReadableByAnyone() {
        assertThat(policy.authorizeRead(STRANGER, object(Visibility.PUBLIC))).isEqualTo(AccessDecision.ALLOW);
        assertThat(policy.authorizeRead(OWNER, object(Visibility.PUBLIC))).isEqualTo(AccessDecision.ALLOW);
    }

    @Test
    void privateAndUnlistedObjectsAreOwnerOnly() {
        for (Visibility v : new Visibility[]{Visibility.PRIVATE, Visibility.UNLISTED}) {
            assertThat(policy.authorizeRead(OWNER, object(v))).isEqualTo(AccessDecision.ALLOW);
            assertThat(policy.authorizeRead(STRANGER, object(v))).isEqualTo(AccessDecision.DENY);
        }
    }

    @Test
    void mutationsAreOwnerOnlyWhateverTheVisibility() {
        for (Visibility v : Visibility.values()) {
            assertThat(policy.authorizeMutation(OWNER, object(v))).isEqualTo(AccessDecision.ALLOW);
            assertThat(policy.authorizeMutation(STRANGER, object(v))).isEqualTo(AccessDecision.DENY);
        }
    }

    @Test
    void requireMethodsThrowOnDeny() {
        assertThatThrownBy(() -> policy.requireRead(STRANGER, object(Visibility.PRIVATE)))
                .isInstanceOf(AccessDeniedException.class)
                .hasMessageContaining("object 1");
        assertThatThrownBy(() -> policy.requireMutation(STRANGER, object(Visibility.PUBLIC)))
                .isInstanceOf(AccessDeniedException.class);
        assertThatCode(() -> policy.requireRead(STRANGER, object(Visibility.PUBLIC))).doesNotThrowAnyException();
    }
}
