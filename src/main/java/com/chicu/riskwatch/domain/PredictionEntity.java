package com.chicu.riskwatch.domain;

import com.chicu.riskwatch.common.enums.RiskBand;
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
        name = "predictions",
        indexes = {
                @Index(name = "ix_predictions_student", columnList = "student_id"),
                @Index(name = "ix_predictions_created", columnList = "created_at")
        }
)
public class PredictionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", length = 64)
    private String studentId;

    @Column(name = "prediction", nullable = false)
    private Integer prediction;

    @Column(name = "probability", nullable = false)
    private Double probability;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", nullable = false, length = 16)
    private RiskBand riskLevel;

    @Column(name = "model_version", length = 64)
    private String modelVersion;

    @Column(name = "created_at", nullable = false)
    private Instant timestamp;
}
