package dev.univer.points.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

@Entity
@Immutable
@Getter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "tx_log", indexes = {
        @Index(name = "idx_tx_log_type_time", columnList = "type, createdAt"),
        @Index(name = "idx_tx_log_sender", columnList = "senderId"),
        @Index(name = "idx_tx_log_recipient", columnList = "recipientId")
})
public class TxLogEntry {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private TxType type;

    // debited side of a transfer or subtract, null for credits
    private String senderId;

    // credited side of a transfer or add, subject of a manual edit
    private String recipientId;

    // teacher who adjusted the balance, if any
    private String actorId;

    private String subjectName;

    private int amount;
    private int commission;

    private Integer oldBalance;
    private Integer newBalance;

    @Column(length = 512)
    private String reason;

    @Column(length = 32)
    private String source;

    @Column(length = 16)
    private String status;

    private Instant createdAt;
}
