package dev.univer.points.repo;

import dev.univer.points.model.BotSettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BotSettingsRepository extends JpaRepository<BotSettings, String> {
}
