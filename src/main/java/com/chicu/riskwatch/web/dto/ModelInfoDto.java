package com.chicu.riskwatch.web.dto;

import com.chicu.riskwatch.common.enums.LifecycleState;

import java.time.Instant;
import java.util.List;

public record ModelInfoDto(
        String version,
        String algorithm,
        List<String> featureNames,
        List<String> categoricalFeatures,
        Instant createdAt,
        Instant retrainedAt,
        LifecycleState lifecycleState
) {}
