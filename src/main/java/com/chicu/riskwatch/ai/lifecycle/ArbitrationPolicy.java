package com.chicu.riskwatch.ai.lifecycle;

import com.chicu.riskwatch.ai.ml.MlLifecycleProperties;
import com.chicu.riskwatch.ai.ml.metrics.ClassificationMetrics;
import com.chicu.riskwatch.common.enums.ArbitrationVerdict;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conjunctive promotion rule: the candidate must beat the incumbent by the accuracy margin
 * AND by the F1 margin. Trading one metric for the other is a loss.
 * <p>
 * Metrics are compared at 4 decimals so that 0.70 vs 0.68 clears a 0.02 margin.
 */
@Component
@RequiredArgsConstructor
public class ArbitrationPolicy {

    private static final int SCALE = 4;

    private final MlLifecycleProperties props;

    public ArbitrationResult decide(ClassificationMetrics incumbent, ClassificationMetrics candidate) {
        BigDecimal dAcc = round(candidate.accuracy()).subtract(round(incumbent.accuracy()));
        BigDecimal dF1 = round(candidate.f1()).subtract(round(incumbent.f1()));

        boolean accOk = dAcc.compareTo(round(props.getAccuracyMargin())) >= 0;
        boolean f1Ok = dF1.compareTo(round(props.getF1Margin())) >= 0;

        ArbitrationVerdict verdict = (accOk && f1Ok) ? ArbitrationVerdict.CANDIDATE : ArbitrationVerdict.INCUMBENT;
        String reason = "Δaccuracy=" + dAcc.toPlainString() + (accOk ? " ok" : " < " + props.getAccuracyMargin())
                + ", Δf1=" + dF1.toPlainString() + (f1Ok ? " ok" : " < " + props.getF1Margin());

        return ArbitrationResult.builder()
                .verdict(verdict)
                .incumbent(incumbent)
                .candidate(candidate)
                .reason(reason)
                .build();
    }

    private static BigDecimal round(double v) {
        return BigDecimal.valueOf(v).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
