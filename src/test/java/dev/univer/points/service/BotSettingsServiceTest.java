package dev.univer.points.service;

import dev.univer.points.config.TestSheetsConfig;
import dev.univer.points.model.BotMode;
import dev.univer.points.model.BotSettings;
import dev.univer.points.repo.BotSettingsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestSheetsConfig.class)
class BotSettingsServiceTest {

    @Autowired private BotSettingsService settingsService;
    @Autowired private BotSettingsRepository settingsRepository;

    @BeforeEach
    void setUp() {
        settingsRepository.deleteAll();
    }

    @Test
    @DisplayName("settings are created with defaults on first read")
    void defaults() {
        BotSettings s = settingsService.get();

        assertThat(s.getCommissionRate()).isEqualTo(0.10);
        assertThat(s.getBotMode()).isEqualTo(BotMode.PUBLIC);
        assertThat(s.isSyncEnabled()).isTrue();
        assertThat(s.getSyncInterval()).isEqualTo(10);
        assertThat(s.getSyncStatistics().getTotalSyncs()).isZero();
        assertThat(settingsRepository.count()).isEqualTo(1);
    }

    @Test
    void updateMergesOnlyGivenFields() {
        settingsService.update(SettingsPatch.builder().syncInterval(60).build());
        settingsService.update(SettingsPatch.builder().botMode(BotMode.MAINTENANCE).commissionRate(0.2).build());

        BotSettings s = settingsService.get();
        assertThat(s.getSyncInterval()).isEqualTo(60);
        assertThat(s.getBotMode()).isEqualTo(BotMode.MAINTENANCE);
        assertThat(s.getCommissionRate()).isEqualTo(0.2);
        assertThat(s.isSyncEnabled()).isTrue();
        assertThat(settingsService.isMaintenance()).isTrue();
    }

    @Test
    void commissionIsRoundedDown() {
        assertThat(settingsService.commissionFor(55)).isEqualTo(5);
        assertThat(settingsService.commissionFor(9)).isZero();

        settingsService.update(SettingsPatch.builder().commissionRate(0.0).build());
        assertThat(settingsService.commissionFor(55)).isZero();
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> settingsService.update(SettingsPatch.builder().commissionRate(1.0).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settingsService.update(SettingsPatch.builder().commissionRate(-0.1).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settingsService.update(SettingsPatch.builder().syncInterval(4).build()))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(settingsService.get().getCommissionRate()).isEqualTo(0.10);
    }

    @Test
    void recordsSyncOutcomes() {
        Instant at = Instant.parse("2025-03-01T10:00:00Z");
        settingsService.recordSyncSuccess(at);
        settingsService.recordSyncFailure("10A: boom");
        settingsService.recordSyncFailure("x".repeat(5000));

        BotSettings s = settingsService.get();
        assertThat(s.getLastSyncTime()).isEqualTo(at);
        assertThat(s.getSyncStatistics().getTotalSyncs()).isEqualTo(3);
        assertThat(s.getSyncStatistics().getSuccessfulSyncs()).isEqualTo(1);
        assertThat(s.getSyncStatistics().getFailedSyncs()).isEqualTo(2);
        assertThat(s.getSyncStatistics().getLastError()).hasSize(1024);
    }
}
