package dev.univer.points.service;

import dev.univer.points.config.SheetsProperties;
import dev.univer.points.config.SyncProperties;
import dev.univer.points.exception.SpreadsheetException;
import dev.univer.points.model.BotSettings;
import dev.univer.points.model.PartitionGroup;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Trigger surface of the reconciler. Every pass, whether forced or from the background loop,
 * runs under one process-wide lock; a second trigger waits for the running pass.
 */
@Service
@Slf4j
public class SyncService {
    private final ReentrantLock lock = new ReentrantLock(true);

    private final SheetReconciler reconciler;
    private final GroupRegistry registry;
    private final BotSettingsService settings;
    private final SheetsProperties sheetsProperties;
    private final SyncProperties syncProperties;
    private final SyncTask task;

    public SyncService(SheetReconciler reconciler,
                       GroupRegistry registry,
                       BotSettingsService settings,
                       SheetsProperties sheetsProperties,
                       SyncProperties syncProperties,
                       TaskScheduler taskScheduler) {
        this.reconciler = reconciler;
        this.registry = registry;
        this.settings = settings;
        this.sheetsProperties = sheetsProperties;
        this.syncProperties = syncProperties;
        this.task = new SyncTask(taskScheduler, this::backgroundTick, this::currentInterval, syncProperties.getErrorBackoff());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!syncProperties.isAutoStart()) return;
        log.info("Initial reconciliation of all partitions");
        forceReconcile(null);
        if (settings.isSyncEnabled()) task.start();
    }

    @PreDestroy
    public void shutdown() {
        task.stop();
    }

    public Map<String, ReconcileStats> forceReconcile(String partition) {
        return forceReconcile(partition, ReconcileMode.SMART);
    }

    /**
     * Reconciles one partition, or every active partition when {@code partition} is null. The legacy
     * sheet is reconciled too when it exists, and always when no group is registered.
     *
     * @return stats per reconciled tab, in processing order
     */
    public Map<String, ReconcileStats> forceReconcile(String partition, ReconcileMode mode) {
        lock.lock();
        try {
            Map<String, ReconcileStats> results = new LinkedHashMap<>();
            if (partition != null) {
                results.put(partition, reconcileOne(partition, mode));
                return results;
            }

            List<PartitionGroup> groups;
            try {
                groups = registry.listPartitions(true);
            } catch (SpreadsheetException | DataAccessException e) {
                log.error("Could not enumerate partitions: {}", e.getMessage(), e);
                settings.recordSyncFailure("partition listing: " + e.getMessage());
                return results;
            }
            for (PartitionGroup g : groups) {
                results.put(g.getName(), reconciler.reconcile(g.getName(), g.getName(), mode));
            }
            if (groups.isEmpty() || registry.hasLegacySheet()) {
                String legacy = sheetsProperties.getLegacySheetName();
                results.put(legacy, reconciler.reconcile(legacy, null, mode));
            }
            return results;
        } finally {
            lock.unlock();
        }
    }

    private ReconcileStats reconcileOne(String partition, ReconcileMode mode) {
        if (registry.findPartition(partition).isPresent()) {
            return reconciler.reconcile(partition, partition, mode);
        }
        if (partition.equals(sheetsProperties.getLegacySheetName())) {
            return reconciler.reconcile(partition, null, mode);
        }
        throw new IllegalArgumentException("Unknown partition: " + partition);
    }

    public SyncStatus setSyncEnabled(boolean enabled) {
        settings.update(SettingsPatch.builder().syncEnabled(enabled).build());
        if (enabled) task.start();
        else task.stop();
        return getSyncStatus();
    }

    /** Takes effect after the current wait; rejects values outside the configured bounds. */
    public SyncStatus setSyncInterval(int seconds) {
        settings.update(SettingsPatch.builder().syncInterval(seconds).build());
        return getSyncStatus();
    }

    public SyncStatus getSyncStatus() {
        BotSettings s = settings.get();
        return new SyncStatus(s.isSyncEnabled(),
                              task.getState() == SyncTask.State.RUNNING,
                              lock.isLocked(),
                              s.getSyncInterval(),
                              s.getSyncStatistics().copy(),
                              s.getLastSyncTime());
    }

    SyncTask.State taskState() {
        return task.getState();
    }

    private void backgroundTick() {
        if (!settings.isSyncEnabled()) {
            log.debug("Sync disabled in settings, skipping tick");
            return;
        }
        forceReconcile(null);
    }

    private Duration currentInterval() {
        try {
            return Duration.ofSeconds(settings.get().getSyncInterval());
        } catch (DataAccessException e) {
            log.warn("Could not read sync interval, using the default: {}", e.getMessage());
            return Duration.ofSeconds(syncProperties.getDefaultInterval());
        }
    }
}
