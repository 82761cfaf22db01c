package com.chicu.riskwatch.ai.monitoring;

import java.time.Instant;

public record PerformanceSnapshot(
        Instant timestamp,
        double accuracy,
        double f1Score,
        int sampleCount
) {}
