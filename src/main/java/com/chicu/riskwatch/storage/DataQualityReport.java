package com.chicu.riskwatch.storage;

import java.util.Map;

/**
 * @param missingByFeature contract feature → rows where it is null (only features with at least one)
 */
public record DataQualityReport(
        long totalRecords,
        long missingStudentIds,
        Map<String, Long> missingByFeature
) {
    public DataQualityReport {
        missingByFeature = Map.copyOf(missingByFeature);
    }

    public boolean isClean() {
        return missingStudentIds == 0 && missingByFeature.isEmpty();
    }
}
