package dev.univer.points.service;

import dev.univer.points.config.SheetsProperties;
import dev.univer.points.model.Account;
import dev.univer.points.sheets.SheetRow;
import dev.univer.points.sheets.SpreadsheetAdapter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Read-only diff between a tab and the ledger, for a teacher to look at before forcing a sync.
 */
@Service
@RequiredArgsConstructor
public class ComparisonService {
    private final SpreadsheetAdapter sheets;
    private final LedgerService ledger;
    private final SheetsProperties sheetsProperties;

    public record Mismatch(String accountId, String fullName, int ledgerBalance, int sheetBalance) {}

    public record ComparisonReport(String sheet,
                                   int common,
                                   List<String> onlyInLedger,
                                   List<String> onlyInSheet,
                                   List<Mismatch> mismatches) {
        public boolean inSync() {
            return onlyInLedger.isEmpty() && onlyInSheet.isEmpty() && mismatches.isEmpty();
        }
    }

    /** @param groupId group to compare, {@code null} for the legacy sheet */
    public ComparisonReport compare(String groupId) {
        String sheet = groupId == null ? sheetsProperties.getLegacySheetName() : groupId;

        Map<String, Account> inLedger = new LinkedHashMap<>();
        for (Account a : ledger.partitionMembers(groupId)) inLedger.put(a.getId(), a);
        Map<String, SheetRow> inSheet = new LinkedHashMap<>();
        for (SheetRow row : sheets.readRows(sheet)) inSheet.putIfAbsent(row.id(), row);

        List<String> onlyInLedger = new ArrayList<>();
        List<Mismatch> mismatches = new ArrayList<>();
        int common = 0;
        for (Account a : inLedger.values()) {
            SheetRow row = inSheet.get(a.getId());
            if (row == null) {
                onlyInLedger.add(a.getId());
                continue;
            }
            common++;
            if (row.points() != a.getBalance()) {
                mismatches.add(new Mismatch(a.getId(), a.getFullName(), a.getBalance(), row.points()));
            }
        }
        List<String> onlyInSheet = inSheet.keySet().stream().filter(id -> !inLedger.containsKey(id)).toList();
        return new ComparisonReport(sheet, common, List.copyOf(onlyInLedger), onlyInSheet, List.copyOf(mismatches));
    }
}
