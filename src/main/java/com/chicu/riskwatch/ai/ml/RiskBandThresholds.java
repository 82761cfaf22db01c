package com.chicu.riskwatch.ai.ml;

import com.chicu.riskwatch.common.enums.RiskBand;

/**
 * Band boundaries in use. Defaults are {@link RiskBand#MEDIUM_FROM} / {@link RiskBand#HIGH_FROM}.
 */
public record RiskBandThresholds(double mediumFrom, double highFrom) {

    public static final RiskBandThresholds DEFAULT = new RiskBandThresholds(RiskBand.MEDIUM_FROM, RiskBand.HIGH_FROM);

    public RiskBandThresholds {
        if (!(0.0 <= mediumFrom && mediumFrom <= highFrom && highFrom <= 1.0)) {
            throw new IllegalArgumentException("risk bands: need 0 <= mediumFrom <= highFrom <= 1, got "
                    + mediumFrom + "/" + highFrom);
        }
    }

    public RiskBand band(double probability) {
        return RiskBand.of(probability, mediumFrom, highFrom);
    }
}
