package dev.univer.points.service;

public enum ReconcileMode {
    /** Cleanup, resurrection, creation, newest-wins balances and sheet-to-ledger contact info. */
    SMART,
    /** Contact info only. */
    NAMES_ONLY,
    /** Newest-wins balances only. */
    POINTS_ONLY,
    /** Sheet balances and contact info overwrite the ledger; missing accounts are created. */
    FORCE_SHEET_TO_LEDGER,
    /** The sheet is rewritten to hold exactly the active accounts of the partition. */
    FORCE_LEDGER_TO_SHEET;

    boolean syncsContactInfo() {
        return this == SMART || this == NAMES_ONLY || this == FORCE_SHEET_TO_LEDGER;
    }

    boolean syncsBalances() {
        return this == SMART || this == POINTS_ONLY;
    }

    boolean createsAccounts() {
        return this == SMART || this == FORCE_SHEET_TO_LEDGER;
    }
}
