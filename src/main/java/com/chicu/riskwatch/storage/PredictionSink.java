package com.chicu.riskwatch.storage;

import com.chicu.riskwatch.ai.ml.PredictionResult;
import com.chicu.riskwatch.common.enums.AlertStatus;

import java.util.List;

public interface PredictionSink {

    int savePredictions(List<PredictionResult> results);

    void saveAlert(String studentId, String riskLevel, String recipient, String subject,
                   String message, AlertStatus status);
}
