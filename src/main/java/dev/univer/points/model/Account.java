package dev.univer.points.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(indexes = {
        @Index(name = "idx_account_role_status", columnList = "role, status"),
        @Index(name = "idx_account_group", columnList = "groupId")
})
public class Account {
    @Id
    @Column(length = 64)
    private String id; // telegram user id as text

    private String fullName;
    private String phone;
    private String username;

    private int balance;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private AccountRole role;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private AccountStatus status;

    // tab name of the group, null for legacy single-sheet accounts
    private String groupId;

    // moves only when the balance is written
    private Instant lastModified;

    private Instant createdAt;

    @Version
    private Long version;

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }
}
