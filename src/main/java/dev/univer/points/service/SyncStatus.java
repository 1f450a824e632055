package dev.univer.points.service;

import dev.univer.points.model.SyncStatistics;

import java.time.Instant;

/**
 * @param running    the background loop is scheduled
 * @param inProgress a pass holds the reconciliation lock right now
 */
public record SyncStatus(boolean enabled,
                         boolean running,
                         boolean inProgress,
                         int interval,
                         SyncStatistics stats,
                         Instant lastSyncTime) {
}
