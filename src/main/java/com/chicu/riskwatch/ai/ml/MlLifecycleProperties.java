package com.chicu.riskwatch.ai.ml;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "riskwatch.lifecycle")
public class MlLifecycleProperties {
    private int minTrainingRows = 10;
    private double testFraction = 0.2;
    private long seed = 42L;

    /** Accuracy drop between two consecutive snapshots that counts as drift. */
    private double driftThreshold = 0.05;

    /** Both margins must be met for a candidate to replace the incumbent. */
    private double accuracyMargin = 0.02;
    private double f1Margin = 0.02;

    /** Share of the daily labeled batch held out for arbitration. */
    private double arbitrationFraction = 0.2;
}
