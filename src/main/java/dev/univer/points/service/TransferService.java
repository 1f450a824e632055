package dev.univer.points.service;

import dev.univer.points.exception.LedgerException;
import dev.univer.points.exception.MutationError;
import dev.univer.points.model.Account;
import dev.univer.points.model.TxLogEntry;
import dev.univer.points.model.TxType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Entry point for balance changes requested by users and teachers. Failures come back as
 * {@link MutationResult}s instead of exceptions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferService {
    private static final String COMPLETED = "completed";
    private static final String NO_REASON = "No reason provided";

    private final BalanceMutationService mutations;
    private final LedgerService ledger;
    private final BotSettingsService settings;

    /** Transfer with the commission taken from the current settings. */
    public MutationResult transfer(String senderId, String recipientId, int amount) {
        if (amount <= 0) return MutationResult.failed(MutationError.INVALID_ARGUMENT, "Amount must be positive");
        return transferPoints(senderId, recipientId, amount, settings.commissionFor(amount));
    }

    public MutationResult transferPoints(String senderId, String recipientId, int amount, int commission) {
        if (senderId == null || recipientId == null) {
            return MutationResult.failed(MutationError.INVALID_ARGUMENT, "Sender and recipient are required");
        }
        TransferBalances balances;
        try {
            balances = mutations.transferPoints(senderId, recipientId, amount, commission);
        } catch (LedgerException e) {
            log.info("Transfer {} -> {} of {} rejected: {}", senderId, recipientId, amount, e.getMessage());
            return MutationResult.failed(e.getError(), e.getMessage());
        } catch (IllegalArgumentException | ArithmeticException e) {
            return MutationResult.failed(MutationError.INVALID_ARGUMENT, e.getMessage());
        }

        appendLog(TxLogEntry.builder()
                            .type(TxType.TRANSFER)
                            .senderId(senderId)
                            .recipientId(recipientId)
                            .subjectName(nameOf(recipientId))
                            .amount(amount)
                            .commission(commission)
                            .newBalance(balances.senderBalance())
                            .status(COMPLETED)
                            .createdAt(Instant.now())
                            .build());
        log.info("Transfer {} -> {}: {} (+{} commission)", senderId, recipientId, amount, commission);
        return MutationResult.transferred(balances);
    }

    public MutationResult adjustBalance(String accountId, int delta) {
        try {
            return MutationResult.adjusted(mutations.adjustBalance(accountId, delta));
        } catch (LedgerException e) {
            return MutationResult.failed(e.getError(), e.getMessage());
        } catch (IllegalArgumentException | ArithmeticException e) {
            return MutationResult.failed(MutationError.INVALID_ARGUMENT, e.getMessage());
        }
    }

    public MutationResult addPoints(String actorId, String accountId, int amount, String reason) {
        return adjustByTeacher(TxType.ADD, actorId, accountId, amount, reason);
    }

    public MutationResult subtractPoints(String actorId, String accountId, int amount, String reason) {
        return adjustByTeacher(TxType.SUBTRACT, actorId, accountId, amount, reason);
    }

    private MutationResult adjustByTeacher(TxType type, String actorId, String accountId, int amount, String reason) {
        if (amount <= 0) return MutationResult.failed(MutationError.INVALID_ARGUMENT, "Amount must be positive");
        BalanceChange change;
        try {
            change = mutations.adjustBalance(accountId, type == TxType.ADD ? amount : -amount);
        } catch (LedgerException e) {
            return MutationResult.failed(e.getError(), e.getMessage());
        } catch (IllegalArgumentException | ArithmeticException e) {
            return MutationResult.failed(MutationError.INVALID_ARGUMENT, e.getMessage());
        }

        appendLog(TxLogEntry.builder()
                            .type(type)
                            .senderId(type == TxType.SUBTRACT ? accountId : null)
                            .recipientId(type == TxType.ADD ? accountId : null)
                            .actorId(actorId)
                            .subjectName(change.fullName())
                            .amount(amount)
                            .oldBalance(change.oldBalance())
                            .newBalance(change.newBalance())
                            .reason(reason == null || reason.isBlank() ? NO_REASON : reason)
                            .status(COMPLETED)
                            .createdAt(Instant.now())
                            .build());
        return MutationResult.adjusted(change);
    }

    // the mutation is already committed, a lost log line must not turn it into a failure
    private void appendLog(TxLogEntry entry) {
        try {
            ledger.appendLogEntry(entry);
        } catch (DataAccessException e) {
            log.error("Failed to log {} for {}", entry.getType(), entry.getRecipientId(), e);
        }
    }

    private String nameOf(String accountId) {
        return ledger.findAccount(accountId).map(Account::getFullName).orElse(null);
    }
}
