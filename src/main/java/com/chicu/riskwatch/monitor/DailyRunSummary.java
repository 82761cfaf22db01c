package com.chicu.riskwatch.monitor;

import com.chicu.riskwatch.ai.lifecycle.LifecycleReport;
import com.chicu.riskwatch.ai.monitoring.PerformanceSnapshot;

/**
 * @param snapshot null when no evaluation ran
 */
public record DailyRunSummary(
        int scored,
        int failed,
        int alertsQueued,
        PerformanceSnapshot snapshot,
        LifecycleReport lifecycle
) {}
