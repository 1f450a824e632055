package dev.univer.points.exception;

public class ConcurrentWriteConflictException extends LedgerException {
    public ConcurrentWriteConflictException(String message, Throwable cause) {
        super(MutationError.CONCURRENT_WRITE_CONFLICT, message, cause);
    }
}
