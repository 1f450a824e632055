package dev.univer.points.service;

import dev.univer.points.config.SheetsProperties;
import dev.univer.points.config.SyncProperties;
import dev.univer.points.exception.SpreadsheetException;
import dev.univer.points.model.Account;
import dev.univer.points.model.AccountStatus;
import dev.univer.points.model.GroupStatus;
import dev.univer.points.model.PartitionGroup;
import dev.univer.points.repo.AccountRepository;
import dev.univer.points.repo.PartitionGroupRepository;
import dev.univer.points.sheets.SpreadsheetAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.*;

/**
 * Keeps the group records in line with the tabs of the spreadsheet. Tabs are the source of
 * truth for which groups exist; the records add display settings and carry the accounts.
 */
@Service
@Slf4j
public class GroupRegistry {
    private final SpreadsheetAdapter sheets;
    private final PartitionGroupRepository groups;
    private final AccountRepository accounts;
    private final SyncProperties syncProperties;
    private final SheetsProperties sheetsProperties;
    private final TransactionTemplate tx;

    private volatile List<PartitionGroup> cache;
    private volatile boolean legacySheetPresent;

    public GroupRegistry(SpreadsheetAdapter sheets,
                         PartitionGroupRepository groups,
                         AccountRepository accounts,
                         SyncProperties syncProperties,
                         SheetsProperties sheetsProperties,
                         PlatformTransactionManager transactionManager) {
        this.sheets = sheets;
        this.groups = groups;
        this.accounts = accounts;
        this.syncProperties = syncProperties;
        this.sheetsProperties = sheetsProperties;
        this.tx = new TransactionTemplate(transactionManager);
    }

    /**
     * Active groups. Without {@code forceRefresh} the last known list is returned; with it the
     * tabs are enumerated and vanished, new and renamed tabs are applied to the records first.
     */
    public List<PartitionGroup> listPartitions(boolean forceRefresh) {
        List<PartitionGroup> current = cache;
        if (current != null && !forceRefresh) return current;
        return forceRefresh ? refresh() : reload();
    }

    public List<PartitionGroup> listVisiblePartitions() {
        return listPartitions(false).stream().filter(g -> !g.isHidden()).toList();
    }

    /** Whether the last refresh saw the legacy tab. It is never registered as a group. */
    public boolean hasLegacySheet() {
        return legacySheetPresent;
    }

    public Optional<PartitionGroup> findPartition(String name) {
        return groups.findById(name).filter(PartitionGroup::isActive);
    }

    private synchronized List<PartitionGroup> refresh() {
        String legacy = sheetsProperties.getLegacySheetName();
        Set<String> tabs = new LinkedHashSet<>(sheets.listPartitionNames());
        legacySheetPresent = tabs.remove(legacy);
        Set<String> known = new LinkedHashSet<>();
        for (PartitionGroup g : groups.findAllByStatusOrderByNameAsc(GroupStatus.ACTIVE)) known.add(g.getName());
        if (known.remove(legacy)) markDeleted(legacy);

        Set<String> removed = new LinkedHashSet<>(known);
        removed.removeAll(tabs);
        Set<String> added = new LinkedHashSet<>(tabs);
        added.removeAll(known);

        if (syncProperties.isRenameDetection() && removed.size() == 1 && added.size() == 1) {
            String oldName = removed.iterator().next();
            String newName = added.iterator().next();
            log.info("Tab {} looks renamed to {}", oldName, newName);
            renameRecords(oldName, newName);
        } else {
            for (String name : removed) markDeleted(name);
            for (String name : added) activate(name);
        }
        return reload();
    }

    private synchronized List<PartitionGroup> reload() {
        List<PartitionGroup> fresh = List.copyOf(groups.findAllByStatusOrderByNameAsc(GroupStatus.ACTIVE));
        cache = fresh;
        return fresh;
    }

    /**
     * Adds a group and its tab. If the tab cannot be created the record is rolled back and the
     * adapter's exception is rethrown.
     */
    public synchronized PartitionGroup createPartition(String name) {
        String tab = requireName(name);
        Optional<PartitionGroup> previous = groups.findById(tab);
        if (previous.isPresent() && previous.get().isActive()) {
            throw new IllegalArgumentException("Group already exists: " + tab);
        }

        PartitionGroup group = activate(tab);
        try {
            sheets.createPartition(tab);
        } catch (SpreadsheetException e) {
            log.error("Could not create tab {}, dropping the group record", tab, e);
            if (previous.isPresent()) groups.save(previous.get());
            else groups.deleteById(tab);
            throw e;
        } finally {
            reload();
        }
        return group;
    }

    /** Renames the tab and re-points the group's accounts. */
    public synchronized PartitionGroup renamePartition(String oldName, String newName) {
        String from = requireName(oldName);
        String to = requireName(newName);
        if (findPartition(from).isEmpty()) throw new IllegalArgumentException("Unknown group: " + from);
        if (findPartition(to).isPresent()) throw new IllegalArgumentException("Group already exists: " + to);

        sheets.renamePartition(from, to);
        PartitionGroup renamed = renameRecords(from, to);
        reload();
        return renamed;
    }

    public synchronized PartitionGroup setHidden(String name, boolean hidden) {
        PartitionGroup g = findPartition(name).orElseThrow(() -> new IllegalArgumentException("Unknown group: " + name));
        g.setHidden(hidden);
        PartitionGroup saved = groups.save(g);
        reload();
        return saved;
    }

    /** Active accounts whose group is not an active group any more. */
    public List<Account> findOrphanedAccounts() {
        Set<String> valid = new HashSet<>();
        for (PartitionGroup g : groups.findAllByStatusOrderByNameAsc(GroupStatus.ACTIVE)) valid.add(g.getName());
        return accounts.findAllByStatusAndGroupIdIsNotNull(AccountStatus.ACTIVE).stream()
                       .filter(a -> !valid.contains(a.getGroupId()))
                       .toList();
    }

    /** Hard-deletes orphaned accounts. */
    public synchronized int purgeOrphanedAccounts() {
        List<Account> orphans = findOrphanedAccounts();
        if (orphans.isEmpty()) return 0;
        tx.executeWithoutResult(status -> accounts.deleteAllById(orphans.stream().map(Account::getId).toList()));
        log.warn("Deleted {} orphaned accounts", orphans.size());
        return orphans.size();
    }

    private PartitionGroup renameRecords(String oldName, String newName) {
        return tx.execute(status -> {
            PartitionGroup old = groups.findById(oldName).orElse(null);
            int moved = accounts.regroup(oldName, newName);

            PartitionGroup renamed = PartitionGroup.builder()
                    .name(newName)
                    .displayName(old == null || oldName.equals(old.getDisplayName()) ? newName : old.getDisplayName())
                    .hidden(old != null && old.isHidden())
                    .status(GroupStatus.ACTIVE)
                    .createdAt(old == null ? Instant.now() : old.getCreatedAt())
                    .build();
            if (old != null) groups.delete(old);
            groups.save(renamed);
            log.info("Group {} renamed to {}, {} accounts moved", oldName, newName, moved);
            return renamed;
        });
    }

    private void markDeleted(String name) {
        groups.findById(name).ifPresent(g -> {
            g.setStatus(GroupStatus.DELETED);
            g.setDeletedAt(Instant.now());
            groups.save(g);
            log.info("Tab {} is gone, group marked deleted", name);
        });
    }

    private PartitionGroup activate(String name) {
        PartitionGroup g = groups.findById(name).orElseGet(() -> PartitionGroup.builder()
                                                                               .name(name)
                                                                               .displayName(name)
                                                                               .createdAt(Instant.now())
                                                                               .build());
        g.setStatus(GroupStatus.ACTIVE);
        g.setDeletedAt(null);
        log.info("Group {} registered", name);
        return groups.save(g);
    }

    private String requireName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Group name is required");
        String trimmed = name.trim();
        if (trimmed.equals(sheetsProperties.getLegacySheetName())) {
            throw new IllegalArgumentException(trimmed + " is the legacy sheet and cannot be a group");
        }
        return trimmed;
    }
}
