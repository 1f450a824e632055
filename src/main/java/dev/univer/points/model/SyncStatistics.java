package dev.univer.points.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

@Embeddable
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SyncStatistics {
    private long totalSyncs;
    private long successfulSyncs;
    private long failedSyncs;

    @Column(length = 1024)
    private String lastError;

    public SyncStatistics copy() {
        return new SyncStatistics(totalSyncs, successfulSyncs, failedSyncs, lastError);
    }
}
