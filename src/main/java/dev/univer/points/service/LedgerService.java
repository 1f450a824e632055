package dev.univer.points.service;

import dev.univer.points.exception.AccountNotFoundException;
import dev.univer.points.model.*;
import dev.univer.points.repo.AccountRepository;
import dev.univer.points.repo.PartitionGroupRepository;
import dev.univer.points.repo.TxLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {
    private final AccountRepository accountRepository;
    private final TxLogRepository txLogRepository;
    private final PartitionGroupRepository groupRepository;

    public Optional<Account> findAccount(String id) {
        return accountRepository.findById(id);
    }

    public Account getAccount(String id) {
        return accountRepository.findById(id).orElseThrow(() -> new AccountNotFoundException(id));
    }

    @Transactional
    public Account createAccount(Account account) {
        if (account.getId() == null || account.getId().isBlank()) {
            throw new IllegalArgumentException("Account id is required");
        }
        if (accountRepository.existsById(account.getId())) {
            throw new IllegalArgumentException("Account already exists: " + account.getId());
        }
        Instant now = Instant.now();
        if (account.getCreatedAt() == null) account.setCreatedAt(now);
        if (account.getLastModified() == null) account.setLastModified(now);
        if (account.getRole() == null) account.setRole(AccountRole.STUDENT);
        if (account.getStatus() == null) account.setStatus(AccountStatus.PENDING);
        return accountRepository.save(account);
    }

    @Transactional
    public Account updateAccount(String id, AccountPatch patch) {
        Account a = getAccount(id);
        if (patch.fullName() != null) a.setFullName(patch.fullName());
        if (patch.phone() != null) a.setPhone(patch.phone());
        if (patch.username() != null) a.setUsername(patch.username());
        if (patch.role() != null) a.setRole(patch.role());
        if (patch.status() != null) a.setStatus(patch.status());
        if (patch.groupId() != null) a.setGroupId(patch.groupId());
        return a;
    }

    /** Name, phone and username only; leaves lastModified alone. */
    @Transactional
    public boolean updateContactInfo(String id, String fullName, String phone, String username) {
        return accountRepository.updateContactInfo(id, fullName, phone, username) == 1;
    }

    /**
     * Sets the balance if the account still carries {@code expectedVersion}.
     *
     * @return {@code false} when someone else wrote the account first
     */
    @Transactional
    public boolean compareAndSetBalance(String id, Long expectedVersion, int balance) {
        return accountRepository.compareAndSetBalance(id, expectedVersion, balance, Instant.now()) == 1;
    }

    @Transactional
    public void deleteAccount(String id) {
        accountRepository.deleteById(id);
    }

    public List<Account> listAccounts(AccountRole role, AccountStatus status, String groupId) {
        return accountRepository.search(role, status, groupId);
    }

    /** Active students of a group; every active student when {@code groupId} is null. */
    public List<Account> activeStudents(String groupId) {
        return groupId == null
               ? accountRepository.findAllByRoleAndStatusOrderByBalanceDesc(AccountRole.STUDENT, AccountStatus.ACTIVE)
               : accountRepository.findAllByRoleAndStatusAndGroupIdOrderByBalanceDesc(AccountRole.STUDENT, AccountStatus.ACTIVE, groupId);
    }

    /**
     * Accounts that belong on a partition's tab. For the legacy sheet ({@code groupId == null}) these
     * are the ungrouped students, or every active student while no group exists.
     */
    public List<Account> partitionMembers(String groupId) {
        if (groupId != null || groupRepository.findAllByStatusOrderByNameAsc(GroupStatus.ACTIVE).isEmpty()) {
            return activeStudents(groupId);
        }
        return accountRepository.findAllByRoleAndStatusAndGroupIdIsNullOrderByBalanceDesc(AccountRole.STUDENT, AccountStatus.ACTIVE);
    }

    public List<Account> ranking(String groupId) {
        return activeStudents(groupId);
    }

    public List<Account> pendingApprovals() {
        return accountRepository.findAllByStatusIn(List.of(AccountStatus.PENDING, AccountStatus.PENDING_RESTORE));
    }

    @Transactional
    public TxLogEntry appendLogEntry(TxLogEntry entry) {
        return txLogRepository.save(entry);
    }

    public List<TxLogEntry> recentLogs(int limit, TxType type) {
        PageRequest page = PageRequest.of(0, limit);
        return type == null
               ? txLogRepository.findAllByOrderByCreatedAtDescIdDesc(page)
               : txLogRepository.findAllByTypeOrderByCreatedAtDescIdDesc(type, page);
    }

    public List<TxLogEntry> history(String accountId, int limit) {
        return txLogRepository.findHistory(accountId, PageRequest.of(0, limit));
    }
}
