package dev.univer.points.exception;

import dev.univer.points.model.AccountStatus;
import lombok.Getter;

@Getter
public class InactiveAccountException extends LedgerException {
    private final String accountId;
    private final AccountStatus status;

    public InactiveAccountException(String accountId, AccountStatus status) {
        super(MutationError.INACTIVE_ACCOUNT, "Account " + accountId + " is not active (" + status + ")");
        this.accountId = accountId;
        this.status = status;
    }
}
