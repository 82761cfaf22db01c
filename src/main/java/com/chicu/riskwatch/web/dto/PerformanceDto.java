package com.chicu.riskwatch.web.dto;

import com.chicu.riskwatch.ai.monitoring.PerformanceSnapshot;

import java.util.List;

public record PerformanceDto(
        List<PerformanceSnapshot> history,
        boolean drifting
) {}
