package dev.univer.points.exception;

import lombok.Getter;

@Getter
public class AccountNotFoundException extends LedgerException {
    private final String accountId;

    public AccountNotFoundException(String accountId) {
        super(MutationError.NOT_FOUND, "Account not found: " + accountId);
        this.accountId = accountId;
    }
}
