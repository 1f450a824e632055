package dev.univer.points.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "bot_settings")
public class BotSettings {
    public static final String SINGLETON_ID = "bot_config";

    @Id
    @Column(length = 32)
    private String id;

    private double commissionRate;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private BotMode botMode;

    private boolean syncEnabled;

    // seconds between background passes
    private int syncInterval;

    @Column(length = 2048)
    private String rulesText;

    private Instant lastSyncTime;

    @Embedded
    @Builder.Default
    private SyncStatistics syncStatistics = new SyncStatistics();

    @Version
    private Long version;
}
