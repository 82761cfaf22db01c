package com.chicu.riskwatch.storage;

import com.chicu.riskwatch.ai.ml.PredictionResult;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.common.enums.AlertStatus;
import com.chicu.riskwatch.domain.AlertRecordEntity;
import com.chicu.riskwatch.domain.PredictionEntity;
import com.chicu.riskwatch.domain.StudentRecordEntity;
import com.chicu.riskwatch.repository.AlertRecordRepository;
import com.chicu.riskwatch.repository.PredictionRepository;
import com.chicu.riskwatch.repository.StudentRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Student register over JPA. Entity columns are exposed to the model under their
 * snake_case column names.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaStudentRecordStore implements StudentRecordSource, PredictionSink {

    private final StudentRecordRepository studentRepo;
    private final PredictionRepository predictionRepo;
    private final AlertRecordRepository alertRepo;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<StudentFeatureRecord> fetchUpdatedSince(Instant since) {
        return toRecords(studentRepo.findByLastUpdatedAfterOrderByIdAsc(since));
    }

    @Override
    @Transactional(readOnly = true)
    public List<StudentFeatureRecord> fetchLabeled(String targetColumn) {
        List<StudentFeatureRecord> out = new ArrayList<>();
        for (StudentFeatureRecord r : toRecords(studentRepo.findByIsActiveIsNotNullOrderByIdAsc())) {
            if (r.label(targetColumn).isPresent()) out.add(r);
        }
        return out;
    }

    @Override
    @Transactional(readOnly = true)
    public DataQualityReport dataQuality(List<String> featureNames) {
        long total = studentRepo.count();
        long missingIds = studentRepo.countMissingStudentIds();

        Map<String, Long> missing = new LinkedHashMap<>();
        for (StudentRecordEntity e : studentRepo.findAll()) {
            Map<String, Object> attrs = attributes(e);
            for (String f : featureNames) {
                if (attrs.get(f) == null) missing.merge(f, 1L, Long::sum);
            }
        }
        return new DataQualityReport(total, missingIds, missing);
    }

    @Override
    @Transactional
    public int savePredictions(List<PredictionResult> results) {
        List<PredictionEntity> rows = new ArrayList<>(results.size());
        for (PredictionResult r : results) {
            rows.add(PredictionEntity.builder()
                    .studentId(r.recordId())
                    .prediction(r.prediction())
                    .probability(r.probability())
                    .riskLevel(r.riskBand())
                    .modelVersion(r.modelVersion())
                    .timestamp(r.timestamp())
                    .build());
        }
        predictionRepo.saveAll(rows);
        log.info("💾 Saved {} predictions", rows.size());
        return rows.size();
    }

    @Override
    @Transactional
    public void saveAlert(String studentId, String riskLevel, String recipient, String subject,
                          String message, AlertStatus status) {
        alertRepo.save(AlertRecordEntity.builder()
                .studentId(studentId)
                .riskLevel(riskLevel)
                .recipient(recipient)
                .subject(subject)
                .message(message)
                .status(status)
                .timestamp(clock.instant())
                .build());
    }

    // =====================================================================
    // mapping
    // =====================================================================

    private static List<StudentFeatureRecord> toRecords(List<StudentRecordEntity> rows) {
        List<StudentFeatureRecord> out = new ArrayList<>(rows.size());
        for (StudentRecordEntity e : rows) {
            out.add(StudentFeatureRecord.of(e.getStudentId(), attributes(e)));
        }
        return out;
    }

    static Map<String, Object> attributes(StudentRecordEntity e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("student_id", e.getStudentId());
        m.put("name", e.getName());
        m.put("gender", e.getGender());
        m.put("age", e.getAge());
        m.put("socioeconomic_status", e.getSocioeconomicStatus());
        m.put("previous_academic_score", e.getPreviousAcademicScore());
        m.put("distance_from_school_km", e.getDistanceFromSchoolKm());
        m.put("attendance_rate", e.getAttendanceRate());
        m.put("avg_test_score", e.getAvgTestScore());
        m.put("fee_default_rate", e.getFeeDefaultRate());
        m.put("extracurricular_participation", e.getExtracurricularParticipation());
        m.put("mentor_id", e.getMentorId());
        m.put("is_active", e.getIsActive());
        return m;
    }
}
