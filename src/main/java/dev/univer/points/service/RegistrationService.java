package dev.univer.points.service;

import dev.univer.points.config.TelegramProperties;
import dev.univer.points.model.Account;
import dev.univer.points.model.AccountRole;
import dev.univer.points.model.AccountStatus;
import dev.univer.points.repo.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Account lifecycle: registration, teacher approval, removal and restoration.
 * See {@link AccountStatus} for the allowed transitions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegistrationService {
    private final AccountRepository accounts;
    private final LedgerService ledger;
    private final GroupRegistry groups;
    private final TelegramProperties telegramProperties;

    public enum Outcome { REGISTERED, RESTORE_REQUESTED, ALREADY_PENDING, ALREADY_ACTIVE, BANNED }

    public record Registration(Outcome outcome, Account account) {}

    /**
     * New students wait for approval. A previously removed student asks for restoration instead;
     * banned accounts are refused.
     */
    @Transactional
    public Registration registerStudent(String id, String fullName, String phone, String username, String groupId) {
        Optional<Account> existing = accounts.findById(id);
        if (existing.isPresent()) {
            Account a = existing.get();
            return switch (a.getStatus()) {
                case BANNED -> new Registration(Outcome.BANNED, a);
                case DELETED -> {
                    a.setStatus(AccountStatus.PENDING_RESTORE);
                    log.info("Account {} asked to be restored", id);
                    yield new Registration(Outcome.RESTORE_REQUESTED, a);
                }
                case PENDING, PENDING_RESTORE -> new Registration(Outcome.ALREADY_PENDING, a);
                case ACTIVE -> new Registration(Outcome.ALREADY_ACTIVE, a);
            };
        }

        if (fullName == null || fullName.isBlank()) throw new IllegalArgumentException("Full name is required");
        if (groupId != null && groups.findPartition(groupId).isEmpty()) {
            throw new IllegalArgumentException("Unknown group: " + groupId);
        }
        Account created = ledger.createAccount(Account.builder()
                                                      .id(id)
                                                      .fullName(fullName.trim())
                                                      .phone(phone)
                                                      .username(username)
                                                      .role(AccountRole.STUDENT)
                                                      .status(AccountStatus.PENDING)
                                                      .groupId(groupId)
                                                      .build());
        log.info("Student {} registered, waiting for approval", id);
        return new Registration(Outcome.REGISTERED, created);
    }

    /** Teachers are active right away if they know the code. */
    @Transactional
    public Account registerTeacher(String id, String fullName, String username, String teacherCode) {
        String expected = telegramProperties.getTeacherCode();
        if (expected == null || expected.isBlank() || !expected.equals(teacherCode)) {
            throw new IllegalArgumentException("Invalid teacher code");
        }
        if (accounts.existsById(id)) throw new IllegalArgumentException("Already registered: " + id);
        log.info("Teacher {} registered", id);
        return ledger.createAccount(Account.builder()
                                           .id(id)
                                           .fullName(fullName)
                                           .username(username)
                                           .role(AccountRole.TEACHER)
                                           .status(AccountStatus.ACTIVE)
                                           .build());
    }

    @Transactional
    public Account approve(String id) {
        return transition(id, AccountStatus.PENDING, AccountStatus.ACTIVE);
    }

    /** Rejected registrations leave no trace. */
    @Transactional
    public void reject(String id) {
        Account a = ledger.getAccount(id);
        if (a.getStatus() != AccountStatus.PENDING) {
            throw new IllegalStateException("Only pending registrations can be rejected, " + id + " is " + a.getStatus());
        }
        accounts.delete(a);
        log.info("Registration of {} rejected", id);
    }

    @Transactional
    public Account remove(String id) {
        return transition(id, AccountStatus.ACTIVE, AccountStatus.DELETED);
    }

    @Transactional
    public Account requestRestore(String id) {
        return transition(id, AccountStatus.DELETED, AccountStatus.PENDING_RESTORE);
    }

    @Transactional
    public Account approveRestore(String id) {
        return transition(id, AccountStatus.PENDING_RESTORE, AccountStatus.ACTIVE);
    }

    @Transactional
    public Account rejectRestore(String id) {
        return transition(id, AccountStatus.PENDING_RESTORE, AccountStatus.BANNED);
    }

    public List<Account> pendingApprovals() {
        return ledger.pendingApprovals();
    }

    public boolean isTeacher(String id) {
        return accounts.findById(id)
                       .map(a -> a.getRole() == AccountRole.TEACHER && a.isActive())
                       .orElse(false);
    }

    private Account transition(String id, AccountStatus from, AccountStatus to) {
        Account a = ledger.getAccount(id);
        if (a.getStatus() != from || !from.canTransitionTo(to)) {
            throw new IllegalStateException("Account " + id + " is " + a.getStatus() + ", expected " + from);
        }
        a.setStatus(to);
        log.info("Account {}: {} -> {}", id, from, to);
        return a;
    }
}
