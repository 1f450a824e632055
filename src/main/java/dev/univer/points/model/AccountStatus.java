package dev.univer.points.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Account lifecycle.
 *
 * <pre>
 * PENDING         -> ACTIVE (approved)
 * ACTIVE          -> DELETED (removed by a teacher)
 * DELETED         -> PENDING_RESTORE (user asked to come back)
 * PENDING_RESTORE -> ACTIVE (restore approved) | BANNED (restore rejected)
 * </pre>
 *
 * Rejected registrations are hard-deleted rather than moved to a status.
 */
public enum AccountStatus {
    PENDING,
    ACTIVE,
    PENDING_RESTORE,
    DELETED,
    BANNED;

    private static final Set<AccountStatus> GONE = EnumSet.of(DELETED, BANNED);

    public boolean canTransitionTo(AccountStatus next) {
        return switch (this) {
            case PENDING -> next == ACTIVE;
            case ACTIVE -> next == DELETED;
            case DELETED -> next == PENDING_RESTORE;
            case PENDING_RESTORE -> next == ACTIVE || next == BANNED;
            case BANNED -> false;
        };
    }

    /** Accounts whose spreadsheet rows should be removed. */
    public boolean isGone() {
        return GONE.contains(this);
    }
}
