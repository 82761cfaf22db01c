package com.chicu.riskwatch.domain;

import com.chicu.riskwatch.common.enums.AlertStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "alerts",
        indexes = @Index(name = "ix_alerts_created", columnList = "created_at")
)
public class AlertRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // null for summary alerts
    @Column(name = "student_id", length = 64)
    private String studentId;

    @Column(name = "risk_level", length = 16)
    private String riskLevel;

    @Column(name = "recipient", length = 128)
    private String recipient;

    @Column(name = "subject", length = 256)
    private String subject;

    @Lob
    @Column(name = "message")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AlertStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant timestamp;
}
