package dev.univer.points.model;

import org.junit.jupiter.api.Test;

import static dev.univer.points.model.AccountStatus.*;
import static org.assertj.core.api.Assertions.assertThat;

class AccountStatusTest {

    @Test
    void lifecycle() {
        assertThat(PENDING.canTransitionTo(ACTIVE)).isTrue();
        assertThat(ACTIVE.canTransitionTo(DELETED)).isTrue();
        assertThat(DELETED.canTransitionTo(PENDING_RESTORE)).isTrue();
        assertThat(PENDING_RESTORE.canTransitionTo(ACTIVE)).isTrue();
        assertThat(PENDING_RESTORE.canTransitionTo(BANNED)).isTrue();

        assertThat(PENDING.canTransitionTo(DELETED)).isFalse();
        assertThat(DELETED.canTransitionTo(ACTIVE)).isFalse();
        for (AccountStatus next : values()) assertThat(BANNED.canTransitionTo(next)).isFalse();
    }

    @Test
    void goneAccounts() {
        assertThat(DELETED.isGone()).isTrue();
        assertThat(BANNED.isGone()).isTrue();
        assertThat(ACTIVE.isGone()).isFalse();
        assertThat(PENDING_RESTORE.isGone()).isFalse();
    }
}
