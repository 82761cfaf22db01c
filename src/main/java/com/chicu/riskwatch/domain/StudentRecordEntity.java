package com.chicu.riskwatch.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One row of the student register. {@code studentId} is nullable on purpose:
 * the hourly data-quality check counts rows that arrived without one.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "student_records",
        indexes = {
                @Index(name = "ix_student_records_student_id", columnList = "student_id"),
                @Index(name = "ix_student_records_last_updated", columnList = "last_updated")
        }
)
public class StudentRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", length = 64)
    private String studentId;

    @Column(name = "name", length = 128)
    private String name;

    @Column(name = "gender", length = 16)
    private String gender;

    @Column(name = "age")
    private Integer age;

    @Column(name = "socioeconomic_status", length = 16)
    private String socioeconomicStatus;

    @Column(name = "previous_academic_score")
    private Double previousAcademicScore;

    @Column(name = "distance_from_school_km")
    private Double distanceFromSchoolKm;

    @Column(name = "attendance_rate")
    private Double attendanceRate;

    @Column(name = "avg_test_score")
    private Double avgTestScore;

    @Column(name = "fee_default_rate")
    private Double feeDefaultRate;

    @Column(name = "extracurricular_participation", length = 8)
    private String extracurricularParticipation; // Yes/No

    @Column(name = "mentor_id", length = 64)
    private String mentorId;

    // 1 = still enrolled, 0 = dropped out, null = outcome unknown
    @Column(name = "is_active")
    private Integer isActive;

    @Column(name = "last_updated")
    private Instant lastUpdated;
}
