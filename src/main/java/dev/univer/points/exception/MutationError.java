package dev.univer.points.exception;

public enum MutationError {
    NOT_FOUND,
    INACTIVE_ACCOUNT,
    INSUFFICIENT_BALANCE,
    CONCURRENT_WRITE_CONFLICT,
    INVALID_ARGUMENT,
    INTERNAL
}
