package dev.univer.points.bot;

import dev.univer.points.model.Account;
import dev.univer.points.service.*;
import dev.univer.points.service.ComparisonService.ComparisonReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps chat commands onto the ledger and sync services. Sync and group commands are for teachers only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "bot", name = "enabled", havingValue = "true")
public class LedgerCommandBot {

    private final TransferService transferService;
    private final LedgerService ledgerService;
    private final SyncService syncService;
    private final ComparisonService comparisonService;
    private final GroupRegistry groupRegistry;
    private final RegistrationService registrationService;
    private final BotSettingsService settingsService;
    private final TelegramSender sender;

    private static final String MENTION_OPT = "(?:@\\w+)?";
    private static final String OPT_ARG = "(?:\\s+(\\S+))?";

    private static final Pattern HELP       = Pattern.compile("^/(start|help)" + MENTION_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BALANCE    = Pattern.compile("^/balance" + MENTION_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRANSFER   = Pattern.compile("^/transfer" + MENTION_OPT + "\\s+(\\S+)\\s+(\\d{1,9})\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SYNC       = Pattern.compile("^/sync" + MENTION_OPT + OPT_ARG + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SYNCSTATUS = Pattern.compile("^/syncstatus" + MENTION_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SYNCON     = Pattern.compile("^/syncon" + MENTION_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SYNCOFF    = Pattern.compile("^/syncoff" + MENTION_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INTERVAL   = Pattern.compile("^/interval" + MENTION_OPT + "\\s+(\\d{1,6})\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPARE    = Pattern.compile("^/compare" + MENTION_OPT + OPT_ARG + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORPHANS    = Pattern.compile("^/orphans" + MENTION_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);

    @EventListener
    public void onUpdate(Update update) {
        try { handle(update); } catch (Exception e) { log.error("Error processing update", e); }
    }

    private void handle(Update update) throws TelegramApiException {
        if (!update.hasMessage()) return;
        Message msg = update.getMessage();
        if (!msg.hasText() || msg.getFrom() == null) return;

        Long chatId = msg.getChatId();
        String userId = msg.getFrom().getId().toString();
        String text = msg.getText().trim();
        boolean teacher = registrationService.isTeacher(userId);

        if (HELP.matcher(text).matches()) {
            send(chatId, help(teacher));
            return;
        }
        if (BALANCE.matcher(text).matches()) {
            send(chatId, ledgerService.findAccount(userId)
                                      .map(a -> "Balance: " + a.getBalance())
                                      .orElse("You are not registered."));
            return;
        }
        Matcher m = TRANSFER.matcher(text);
        if (m.matches()) {
            if (settingsService.isMaintenance() && !teacher) {
                send(chatId, "Transfers are paused for maintenance.");
                return;
            }
            MutationResult r = transferService.transfer(userId, m.group(1), Integer.parseInt(m.group(2)));
            send(chatId, r.success()
                         ? "Sent " + m.group(2) + ". Your balance: " + r.balance()
                         : "Transfer failed: " + r.message());
            return;
        }

        if (!teacher) return;

        if (SYNCSTATUS.matcher(text).matches()) {
            send(chatId, renderStatus(syncService.getSyncStatus()));
        } else if (SYNCON.matcher(text).matches()) {
            send(chatId, renderStatus(syncService.setSyncEnabled(true)));
        } else if (SYNCOFF.matcher(text).matches()) {
            send(chatId, renderStatus(syncService.setSyncEnabled(false)));
        } else if ((m = INTERVAL.matcher(text)).matches()) {
            try {
                send(chatId, renderStatus(syncService.setSyncInterval(Integer.parseInt(m.group(1)))));
            } catch (IllegalArgumentException e) {
                send(chatId, e.getMessage());
            }
        } else if ((m = SYNC.matcher(text)).matches()) {
            try {
                send(chatId, renderResults(syncService.forceReconcile(m.group(1))));
            } catch (IllegalArgumentException e) {
                send(chatId, e.getMessage());
            }
        } else if ((m = COMPARE.matcher(text)).matches()) {
            send(chatId, renderComparison(comparisonService.compare(m.group(1))));
        } else if (ORPHANS.matcher(text).matches()) {
            groupRegistry.listPartitions(true);
            List<Account> orphans = groupRegistry.findOrphanedAccounts();
            if (orphans.isEmpty()) {
                send(chatId, "No orphaned accounts.");
            } else {
                StringBuilder sb = new StringBuilder("Orphaned accounts:\n");
                for (Account a : orphans) {
                    sb.append("• ").append(a.getFullName()).append(" (").append(a.getId()).append(") group ").append(a.getGroupId()).append("\n");
                }
                send(chatId, sb.toString());
            }
        }
    }

    private String help(boolean teacher) {
        StringBuilder sb = new StringBuilder();
        sb.append("/balance - your balance\n");
        sb.append("/transfer <id> <amount> - send points\n");
        if (teacher) {
            sb.append("/sync [group] - reconcile with the sheet now\n");
            sb.append("/syncstatus, /syncon, /syncoff - background sync\n");
            sb.append("/interval <seconds> - background sync interval\n");
            sb.append("/compare [group] - differences between sheet and ledger\n");
            sb.append("/orphans - accounts of deleted groups\n");
        }
        return sb.toString();
    }

    private String renderStatus(SyncStatus s) {
        return "Sync " + (s.enabled() ? "enabled" : "disabled")
               + (s.running() ? ", loop running" : ", loop stopped")
               + (s.inProgress() ? ", pass in progress" : "")
               + "\nInterval: " + s.interval() + "s"
               + "\nLast sync: " + (s.lastSyncTime() == null ? "never" : s.lastSyncTime())
               + "\nPasses: " + s.stats().getTotalSyncs()
               + " (ok " + s.stats().getSuccessfulSyncs() + ", failed " + s.stats().getFailedSyncs() + ")"
               + (s.stats().getLastError() == null ? "" : "\nLast error: " + s.stats().getLastError());
    }

    private String renderResults(Map<String, ReconcileStats> results) {
        if (results.isEmpty()) return "Nothing was reconciled, see the sync status for the error.";
        StringBuilder sb = new StringBuilder();
        results.forEach((sheet, st) -> sb.append(sheet).append(": ")
                                         .append(st.getUpdated()).append(" updated, ")
                                         .append(st.getAdded()).append(" added, ")
                                         .append(st.getDeleted()).append(" deleted, ")
                                         .append(st.getErrors()).append(" errors\n"));
        return sb.toString();
    }

    private String renderComparison(ComparisonReport r) {
        if (r.inSync()) return r.sheet() + " is in sync (" + r.common() + " accounts).";
        StringBuilder sb = new StringBuilder(r.sheet()).append(": ").append(r.common()).append(" in both\n");
        if (!r.onlyInLedger().isEmpty()) sb.append("Only in ledger: ").append(String.join(", ", r.onlyInLedger())).append("\n");
        if (!r.onlyInSheet().isEmpty()) sb.append("Only in sheet: ").append(String.join(", ", r.onlyInSheet())).append("\n");
        for (ComparisonService.Mismatch mm : r.mismatches()) {
            sb.append("• ").append(mm.fullName()).append(": ledger ").append(mm.ledgerBalance())
              .append(", sheet ").append(mm.sheetBalance()).append("\n");
        }
        return sb.toString();
    }

    private void send(Long chatId, String text) throws TelegramApiException {
        sender.send(chatId, text);
    }
}
