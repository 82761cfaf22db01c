package com.chicu.riskwatch.storage;

import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;

import java.time.Instant;
import java.util.List;

public interface StudentRecordSource {

    /** Records updated strictly after {@code since}. */
    List<StudentFeatureRecord> fetchUpdatedSince(Instant since);

    /** Records whose {@code targetColumn} holds a 0/1 outcome. */
    List<StudentFeatureRecord> fetchLabeled(String targetColumn);

    DataQualityReport dataQuality(List<String> featureNames);
}
