package dev.univer.points.service;

import dev.univer.points.config.LedgerProperties;
import dev.univer.points.config.SyncProperties;
import dev.univer.points.model.BotMode;
import dev.univer.points.model.BotSettings;
import dev.univer.points.model.SyncStatistics;
import dev.univer.points.repo.BotSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class BotSettingsService {
    private static final int MAX_ERROR_LENGTH = 1024;

    private final BotSettingsRepository repo;
    private final SyncProperties syncProperties;
    private final LedgerProperties ledgerProperties;

    /**
     * The settings record, created with defaults on first use. Two callers racing on the
     * first insert both end up with the row that won.
     */
    public BotSettings get() {
        return repo.findById(BotSettings.SINGLETON_ID).orElseGet(this::createDefaults);
    }

    private BotSettings createDefaults() {
        try {
            BotSettings saved = repo.saveAndFlush(defaults());
            log.info("Created default bot settings");
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.debug("Settings were created concurrently, re-reading");
            return repo.findById(BotSettings.SINGLETON_ID).orElseThrow(() -> e);
        }
    }

    private BotSettings defaults() {
        return BotSettings.builder()
                .id(BotSettings.SINGLETON_ID)
                .commissionRate(ledgerProperties.getDefaultCommissionRate())
                .botMode(BotMode.PUBLIC)
                .syncEnabled(true)
                .syncInterval(syncProperties.getDefaultInterval())
                .rulesText(ledgerProperties.getDefaultRules())
                .syncStatistics(new SyncStatistics())
                .build();
    }

    @Transactional
    @Retryable(retryFor = {ConcurrencyFailureException.class, DataIntegrityViolationException.class},
               maxAttempts = 3, backoff = @Backoff(delay = 50))
    public BotSettings update(SettingsPatch patch) {
        validate(patch);
        BotSettings s = loadForUpdate();
        if (patch.commissionRate() != null) s.setCommissionRate(patch.commissionRate());
        if (patch.botMode() != null) s.setBotMode(patch.botMode());
        if (patch.syncEnabled() != null) s.setSyncEnabled(patch.syncEnabled());
        if (patch.syncInterval() != null) s.setSyncInterval(patch.syncInterval());
        if (patch.rulesText() != null) s.setRulesText(patch.rulesText());
        return s;
    }

    @Transactional
    @Retryable(retryFor = {ConcurrencyFailureException.class, DataIntegrityViolationException.class},
               maxAttempts = 3, backoff = @Backoff(delay = 50))
    public void recordSyncSuccess(Instant at) {
        BotSettings s = loadForUpdate();
        SyncStatistics stats = s.getSyncStatistics();
        stats.setTotalSyncs(stats.getTotalSyncs() + 1);
        stats.setSuccessfulSyncs(stats.getSuccessfulSyncs() + 1);
        s.setLastSyncTime(at);
    }

    @Transactional
    @Retryable(retryFor = {ConcurrencyFailureException.class, DataIntegrityViolationException.class},
               maxAttempts = 3, backoff = @Backoff(delay = 50))
    public void recordSyncFailure(String error) {
        BotSettings s = loadForUpdate();
        SyncStatistics stats = s.getSyncStatistics();
        stats.setTotalSyncs(stats.getTotalSyncs() + 1);
        stats.setFailedSyncs(stats.getFailedSyncs() + 1);
        stats.setLastError(error == null || error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH));
    }

    /** floor(amount * rate) */
    public int commissionFor(int amount) {
        return (int) Math.floor(amount * get().getCommissionRate());
    }

    public boolean isMaintenance() {
        return get().getBotMode() == BotMode.MAINTENANCE;
    }

    public boolean isSyncEnabled() {
        return get().isSyncEnabled();
    }

    // a lost race on the first insert fails the commit and the retry sees the winner's row
    private BotSettings loadForUpdate() {
        BotSettings s = repo.findById(BotSettings.SINGLETON_ID).orElseGet(() -> repo.save(defaults()));
        if (s.getSyncStatistics() == null) s.setSyncStatistics(new SyncStatistics());
        return s;
    }

    private void validate(SettingsPatch patch) {
        Integer interval = patch.syncInterval();
        if (interval != null && (interval < syncProperties.getMinInterval() || interval > syncProperties.getMaxInterval())) {
            throw new IllegalArgumentException("Sync interval must be between " + syncProperties.getMinInterval()
                                               + " and " + syncProperties.getMaxInterval() + " seconds");
        }
        Double rate = patch.commissionRate();
        if (rate != null && (rate.isNaN() || rate < 0 || rate >= 1)) {
            throw new IllegalArgumentException("Commission rate must be in [0, 1)");
        }
    }
}
