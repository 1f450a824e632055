package dev.univer.points.service;

import dev.univer.points.config.SheetsProperties;
import dev.univer.points.config.SyncProperties;
import dev.univer.points.exception.SpreadsheetException;
import dev.univer.points.model.*;
import dev.univer.points.sheets.SheetRow;
import dev.univer.points.sheets.SpreadsheetAdapter;
import dev.univer.points.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.*;

/**
 * Brings one spreadsheet tab and the ledger into agreement. The spreadsheet has no transactions,
 * so every balance conflict is settled by comparing last-modified timestamps: the strictly newer
 * side wins, ties go to the ledger. Ledger writes are compare-and-set against the version read at
 * the start of the pass, so a transfer that lands mid-pass is never overwritten.
 * <p>
 * Not thread-safe on its own; {@link SyncService} serializes passes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SheetReconciler {
    static final String SHEET_SOURCE = "google_sheets";

    private final SpreadsheetAdapter sheets;
    private final LedgerService ledger;
    private final BotSettingsService settings;
    private final SheetsProperties sheetsProperties;
    private final SyncProperties syncProperties;

    /**
     * @param sheetName tab to reconcile
     * @param groupId   group the tab belongs to, {@code null} for the legacy sheet, see {@link LedgerService#partitionMembers}
     */
    public ReconcileStats reconcile(String sheetName, String groupId, ReconcileMode mode) {
        ReconcileStats stats = new ReconcileStats();
        try {
            Pass pass = new Pass(sheetName, groupId, mode, stats,
                                 ledger.partitionMembers(groupId), sheets.readRows(sheetName));
            if (mode == ReconcileMode.FORCE_LEDGER_TO_SHEET) {
                pass.overwriteSheet();
            } else {
                if (mode == ReconcileMode.SMART) {
                    pass.removeGoneAccounts();
                    pass.appendMissingRows();
                }
                pass.reconcileRows();
            }
        } catch (RuntimeException e) {
            log.error("Reconciliation of {} aborted: {}", sheetName, e.getMessage(), e);
            stats.error();
            settings.recordSyncFailure(sheetName + ": " + e.getMessage());
            return stats;
        }

        settings.recordSyncSuccess(Instant.now());
        if (stats.hasWrites() || stats.getErrors() > 0 || stats.getConflicts() > 0) {
            log.info("Reconciled {} ({}): {}", sheetName, mode, stats);
        } else {
            log.debug("Reconciled {} ({}): nothing to do", sheetName, mode);
        }
        return stats;
    }

    private ZoneId zone() {
        return sheetsProperties.zone();
    }

    // the ledger's own time, so a mutation committed after this pass read the account stays newer
    private String stampOf(Account a) {
        return ParseUtil.formatTimestamp(a.getLastModified(), zone());
    }

    private SheetRow rowOf(Account a) {
        return SheetRow.of(a.getId(), a.getFullName(), a.getPhone(), a.getUsername(), a.getBalance(), stampOf(a));
    }

    /** State of a single pass over one tab. */
    private class Pass {
        final String sheet;
        final String groupId;
        final ReconcileMode mode;
        final ReconcileStats stats;
        final Map<String, Account> active = new LinkedHashMap<>();
        final List<SheetRow> rows = new ArrayList<>();
        final Set<String> removed = new HashSet<>();

        Pass(String sheet, String groupId, ReconcileMode mode, ReconcileStats stats,
             List<Account> activeAccounts, List<SheetRow> sheetRows) {
            this.sheet = sheet;
            this.groupId = groupId;
            this.mode = mode;
            this.stats = stats;
            for (Account a : activeAccounts) active.put(a.getId(), a);

            Set<String> seen = new HashSet<>();
            for (SheetRow row : sheetRows) {
                if (!seen.add(row.id())) {
                    log.warn("Duplicate row for {} in {}, only the first one is used", row.id(), sheet);
                    stats.warning();
                    continue;
                }
                rows.add(row);
            }
        }

        void removeGoneAccounts() {
            for (SheetRow row : rows) {
                if (active.containsKey(row.id())) continue;
                Optional<Account> account = ledger.findAccount(row.id());
                if (account.isEmpty() || !account.get().getStatus().isGone()) continue;
                try {
                    if (sheets.deleteRow(sheet, row.id())) {
                        stats.deleted();
                        log.info("Removed {} account {} from {}", account.get().getStatus(), row.id(), sheet);
                    }
                    removed.add(row.id());
                } catch (SpreadsheetException e) {
                    rowFailed(row.id(), e);
                }
            }
        }

        void appendMissingRows() {
            Set<String> inSheet = new HashSet<>();
            for (SheetRow row : rows) inSheet.add(row.id());
            for (Account a : active.values()) {
                if (inSheet.contains(a.getId())) continue;
                try {
                    sheets.appendRow(sheet, rowOf(a));
                    stats.added();
                    log.info("Added missing row for {} to {}", a.getId(), sheet);
                } catch (SpreadsheetException e) {
                    rowFailed(a.getId(), e);
                }
            }
        }

        void reconcileRows() {
            for (SheetRow row : rows) {
                if (removed.contains(row.id())) continue;
                if (row.malformedPoints()) {
                    log.warn("Row {} in {} has a malformed points value, treating it as 0", row.id(), sheet);
                    stats.warning();
                }
                try {
                    reconcileRow(row);
                } catch (SpreadsheetException | DataAccessException e) {
                    rowFailed(row.id(), e);
                }
            }
        }

        private void reconcileRow(SheetRow row) {
            Account account = active.get(row.id());
            if (account == null) account = ledger.findAccount(row.id()).orElse(null);

            if (account == null) {
                if (mode.createsAccounts()) createFromRow(row);
                else stats.skipped();
                return;
            }
            if (account.getStatus().isGone()) {
                stats.skipped();
                return;
            }

            int conflictsBefore = stats.getConflicts();
            boolean changed = false;
            if (mode == ReconcileMode.FORCE_SHEET_TO_LEDGER) {
                changed = account.getBalance() != row.points() && applySheetBalance(account, row);
            } else if (mode.syncsBalances()) {
                changed = reconcileBalance(account, row);
            }
            if (mode.syncsContactInfo()) {
                changed |= applyContactInfo(account, row);
            }

            if (changed) stats.updated();
            else if (stats.getConflicts() == conflictsBefore) stats.skipped();
        }

        private void createFromRow(SheetRow row) {
            Instant sheetTime = ParseUtil.parseTimestamp(row.lastUpdated(), zone());
            ledger.createAccount(Account.builder()
                                        .id(row.id())
                                        .fullName(row.fullName())
                                        .phone(row.phone())
                                        .username(row.username())
                                        .balance(row.points())
                                        .role(AccountRole.STUDENT)
                                        .status(AccountStatus.ACTIVE)
                                        .groupId(groupId)
                                        .lastModified(sheetTime != null ? sheetTime : Instant.now())
                                        .build());
            stats.added();
            log.info("Created account {} ({}) from {}", row.id(), row.fullName(), sheet);
        }

        // true if something was written
        private boolean reconcileBalance(Account account, SheetRow row) {
            if (account.getBalance() == row.points()) return false;

            if (sheetIsNewer(ParseUtil.parseTimestamp(row.lastUpdated(), zone()), account.getLastModified())) {
                return applySheetBalance(account, row);
            }
            if (sheets.writeRow(sheet, row.withPoints(account.getBalance(), stampOf(account)))) {
                log.info("Ledger -> {}: {} {} -> {}", sheet, row.id(), row.points(), account.getBalance());
                return true;
            }
            return false;
        }

        private boolean applySheetBalance(Account account, SheetRow row) {
            if (!ledger.compareAndSetBalance(account.getId(), account.getVersion(), row.points())) {
                stats.conflict();
                log.warn("Account {} changed during reconciliation of {}, leaving it for the next pass", account.getId(), sheet);
                return false;
            }
            ledger.appendLogEntry(TxLogEntry.builder()
                                            .type(TxType.MANUAL_EDIT)
                                            .recipientId(account.getId())
                                            .subjectName(row.fullName())
                                            .amount(row.points() - account.getBalance())
                                            .oldBalance(account.getBalance())
                                            .newBalance(row.points())
                                            .source(SHEET_SOURCE)
                                            .status("completed")
                                            .createdAt(Instant.now())
                                            .build());
            log.info("{} -> ledger: {} {} -> {}", sheet, account.getId(), account.getBalance(), row.points());
            return true;
        }

        private boolean applyContactInfo(Account account, SheetRow row) {
            if (sameContactInfo(row, account)) return false;
            ledger.updateContactInfo(account.getId(), row.fullName(), row.phone(), row.username());
            log.debug("Contact info of {} taken from {}", account.getId(), sheet);
            return true;
        }

        void overwriteSheet() {
            Map<String, SheetRow> byId = new HashMap<>();
            for (SheetRow row : rows) byId.put(row.id(), row);

            for (Account a : active.values()) {
                try {
                    SheetRow current = byId.get(a.getId());
                    if (current == null) {
                        sheets.appendRow(sheet, rowOf(a));
                        stats.added();
                    } else if (matches(current, a)) {
                        stats.skipped();
                    } else if (sheets.writeRow(sheet, rowOf(a))) {
                        stats.updated();
                    }
                } catch (SpreadsheetException e) {
                    rowFailed(a.getId(), e);
                }
            }
            for (SheetRow row : rows) {
                if (active.containsKey(row.id())) continue;
                try {
                    if (sheets.deleteRow(sheet, row.id())) stats.deleted();
                } catch (SpreadsheetException e) {
                    rowFailed(row.id(), e);
                }
            }
        }

        private boolean matches(SheetRow row, Account a) {
            return row.points() == a.getBalance() && !row.malformedPoints() && sameContactInfo(row, a);
        }

        private boolean sameContactInfo(SheetRow row, Account a) {
            return ParseUtil.trimToEmpty(row.fullName()).equals(ParseUtil.trimToEmpty(a.getFullName()))
                   && ParseUtil.trimToEmpty(row.phone()).equals(ParseUtil.trimToEmpty(a.getPhone()))
                   && ParseUtil.trimToEmpty(row.username()).equals(ParseUtil.trimToEmpty(a.getUsername()));
        }

        private void rowFailed(String id, RuntimeException e) {
            stats.error();
            log.error("Row {} in {} failed: {}", id, sheet, e.getMessage(), e);
        }
    }

    /**
     * Newest wins. With both timestamps the sheet has to be newer by more than the tolerance;
     * with one, that side wins; with neither, the ledger does.
     */
    boolean sheetIsNewer(Instant sheetTime, Instant ledgerTime) {
        if (sheetTime != null && ledgerTime != null) {
            return sheetTime.isAfter(ledgerTime.plus(syncProperties.getTimestampTolerance()));
        }
        return sheetTime != null;
    }
}
