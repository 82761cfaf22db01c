package com.chicu.riskwatch.ai.ml;

import com.chicu.riskwatch.common.enums.RiskBand;

import java.time.Instant;

/**
 * @param prediction  model label (1 = active, 0 = dropout)
 * @param probability probability of the risk-positive class, in [0,1]
 */
public record PredictionResult(
        String recordId,
        int prediction,
        double probability,
        RiskBand riskBand,
        Instant timestamp,
        String modelVersion
) {}
