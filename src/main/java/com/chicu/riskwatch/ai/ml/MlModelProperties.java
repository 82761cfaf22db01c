package com.chicu.riskwatch.ai.ml;

import com.chicu.riskwatch.common.enums.ModelAlgorithm;
import com.chicu.riskwatch.common.enums.RiskBand;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "riskwatch.model")
public class MlModelProperties {

    /** Ground-truth column: 1 = still enrolled, 0 = dropped out. */
    private String targetColumn = "is_active";

    /** Model label whose probability is reported as "risk". */
    private int riskPositiveLabel = 0;

    private List<String> featureNames = new ArrayList<>(List.of(
            "gender",
            "age",
            "socioeconomic_status",
            "previous_academic_score",
            "distance_from_school_km",
            "attendance_rate",
            "avg_test_score",
            "fee_default_rate",
            "extracurricular_participation"
    ));

    private List<String> categoricalColumns = new ArrayList<>(List.of(
            "gender",
            "socioeconomic_status",
            "extracurricular_participation"
    ));

    /** Algorithm of the very first model; retrains inherit the incumbent's. */
    private ModelAlgorithm algorithm = ModelAlgorithm.GRADIENT_BOOSTING;

    /** Train from labeled storage records at start-up when no artifact file exists. */
    private boolean trainIfMissing = true;

    private double mediumRiskFrom = RiskBand.MEDIUM_FROM;
    private double highRiskFrom = RiskBand.HIGH_FROM;
}
