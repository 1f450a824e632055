package dev.univer.points.service;

import dev.univer.points.exception.AccountNotFoundException;
import dev.univer.points.exception.InactiveAccountException;
import dev.univer.points.exception.InsufficientBalanceException;
import dev.univer.points.model.Account;
import dev.univer.points.repo.AccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Single-attempt read-check-write of balances. A concurrent writer makes the commit fail
 * with an optimistic locking error; {@link BalanceMutationService} retries.
 */
@Component
@RequiredArgsConstructor
public class AtomicBalanceOps {
    private final AccountRepository accounts;

    @Transactional
    public TransferBalances transfer(String senderId, String recipientId, int amount, int commission) {
        // rows are read and flushed in id order so opposite transfers cannot deadlock
        boolean senderFirst = senderId.compareTo(recipientId) < 0;
        Account first = load(senderFirst ? senderId : recipientId);
        Account second = load(senderFirst ? recipientId : senderId);
        Account sender = senderFirst ? first : second;
        Account recipient = senderFirst ? second : first;

        if (!sender.isActive()) throw new InactiveAccountException(senderId, sender.getStatus());
        if (!recipient.isActive()) throw new InactiveAccountException(recipientId, recipient.getStatus());

        int cost = Math.addExact(amount, commission);
        if (sender.getBalance() < cost) {
            throw new InsufficientBalanceException(senderId, sender.getBalance(), cost);
        }

        Instant now = Instant.now();
        sender.setBalance(sender.getBalance() - cost);
        sender.setLastModified(now);
        recipient.setBalance(Math.addExact(recipient.getBalance(), amount));
        recipient.setLastModified(now);
        return new TransferBalances(sender.getBalance(), recipient.getBalance());
    }

    @Transactional
    public BalanceChange adjust(String accountId, int delta) {
        Account a = load(accountId);
        int old = a.getBalance();
        a.setBalance(Math.addExact(old, delta));
        a.setLastModified(Instant.now());
        return new BalanceChange(accountId, a.getFullName(), old, a.getBalance());
    }

    private Account load(String id) {
        return accounts.findById(id).orElseThrow(() -> new AccountNotFoundException(id));
    }
}
