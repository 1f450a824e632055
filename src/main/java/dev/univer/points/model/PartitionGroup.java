package dev.univer.points.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A group of students backed by one spreadsheet tab. The tab name is the identity.
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "ledger_group")
public class PartitionGroup {
    @Id
    @Column(length = 128)
    private String name;

    private String displayName;

    private boolean hidden;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private GroupStatus status;

    private Instant createdAt;
    private Instant deletedAt;

    public boolean isActive() {
        return status == GroupStatus.ACTIVE;
    }
}
