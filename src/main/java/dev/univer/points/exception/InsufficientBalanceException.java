package dev.univer.points.exception;

import lombok.Getter;

@Getter
public class InsufficientBalanceException extends LedgerException {
    private final String accountId;
    private final int balance;
    private final int required;

    public InsufficientBalanceException(String accountId, int balance, int required) {
        super(MutationError.INSUFFICIENT_BALANCE,
              "Insufficient balance on " + accountId + ": have " + balance + ", need " + required);
        this.accountId = accountId;
        this.balance = balance;
        this.required = required;
    }
}
