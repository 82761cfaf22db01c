package com.chicu.riskwatch.web.dto;

import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;

import java.util.Map;

/**
 * {"studentId": "S0001", "features": {"gender": "Male", "attendance_rate": 0.82, ...}}
 */
public record PredictRequestDto(
        String studentId,
        Map<String, Object> features
) {
    public StudentFeatureRecord toRecord() {
        return StudentFeatureRecord.of(studentId, features);
    }
}
