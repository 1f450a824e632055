package dev.univer.points.service;

import dev.univer.points.exception.MutationError;

/**
 * Outcome of a transfer or adjustment. On success {@code balance} is the sender's (or the
 * adjusted account's) new balance and {@code counterpartBalance} the recipient's, if any.
 */
public record MutationResult(boolean success,
                             MutationError error,
                             String message,
                             Integer balance,
                             Integer counterpartBalance) {

    public static MutationResult transferred(TransferBalances b) {
        return new MutationResult(true, null, null, b.senderBalance(), b.recipientBalance());
    }

    public static MutationResult adjusted(BalanceChange c) {
        return new MutationResult(true, null, null, c.newBalance(), null);
    }

    public static MutationResult failed(MutationError error, String message) {
        return new MutationResult(false, error, message, null, null);
    }
}
