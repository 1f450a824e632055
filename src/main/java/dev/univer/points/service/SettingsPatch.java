package dev.univer.points.service;

import dev.univer.points.model.BotMode;
import lombok.Builder;

/**
 * Merge patch for {@link dev.univer.points.model.BotSettings}; null fields are left as they are.
 */
@Builder
public record SettingsPatch(Double commissionRate,
                            BotMode botMode,
                            Boolean syncEnabled,
                            Integer syncInterval,
                            String rulesText) {
}
