package dev.univer.points.service;

import dev.univer.points.exception.ConcurrentWriteConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Atomic balance mutations with bounded optimistic retries. Each attempt runs in its own
 * transaction; once the attempts run out the caller gets a {@link ConcurrentWriteConflictException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceMutationService {
    private final AtomicBalanceOps ops;

    /**
     * Moves {@code amount} to the recipient and burns {@code commission} from the sender.
     * Both accounts must be active and the sender must hold {@code amount + commission}.
     */
    @Retryable(retryFor = ConcurrencyFailureException.class,
               maxAttemptsExpression = "${ledger.retry.max-attempts:5}",
               backoff = @Backoff(delayExpression = "${ledger.retry.delay-ms:20}",
                                  multiplierExpression = "${ledger.retry.multiplier:2.0}",
                                  maxDelayExpression = "${ledger.retry.max-delay-ms:500}",
                                  random = true))
    public TransferBalances transferPoints(String senderId, String recipientId, int amount, int commission) {
        if (amount <= 0) throw new IllegalArgumentException("Amount must be positive");
        if (commission < 0) throw new IllegalArgumentException("Commission must not be negative");
        if (senderId.equals(recipientId)) throw new IllegalArgumentException("Cannot transfer to yourself");
        return ops.transfer(senderId, recipientId, amount, commission);
    }

    @Retryable(retryFor = ConcurrencyFailureException.class,
               maxAttemptsExpression = "${ledger.retry.max-attempts:5}",
               backoff = @Backoff(delayExpression = "${ledger.retry.delay-ms:20}",
                                  multiplierExpression = "${ledger.retry.multiplier:2.0}",
                                  maxDelayExpression = "${ledger.retry.max-delay-ms:500}",
                                  random = true))
    public BalanceChange adjustBalance(String accountId, int delta) {
        return ops.adjust(accountId, delta);
    }

    @Recover
    public TransferBalances recoverTransfer(RuntimeException e, String senderId, String recipientId, int amount, int commission) {
        throw translate(e, "transfer " + senderId + " -> " + recipientId);
    }

    @Recover
    public BalanceChange recoverAdjust(RuntimeException e, String accountId, int delta) {
        throw translate(e, "adjustment of " + accountId);
    }

    private RuntimeException translate(RuntimeException e, String what) {
        if (e instanceof ConcurrencyFailureException) {
            log.warn("Gave up on {} after repeated write conflicts", what);
            return new ConcurrentWriteConflictException("Too many concurrent writes, " + what + " not applied", e);
        }
        return e;
    }
}
