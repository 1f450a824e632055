package dev.univer.points.exception;

import lombok.Getter;

/**
 * Base type for failures of a balance mutation. The error code travels into
 * {@code MutationResult} so that callers never have to match on exception types.
 */
@Getter
public class LedgerException extends RuntimeException {
    private final MutationError error;

    public LedgerException(MutationError error, String message) {
        super(message);
        this.error = error;
    }

    public LedgerException(MutationError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
