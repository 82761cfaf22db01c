package com.chicu.riskwatch.ai.ml;

import com.chicu.riskwatch.ai.ml.features.FeatureCodec;
import com.chicu.riskwatch.ai.ml.features.FeatureVector;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.ai.ml.model.ModelArtifact;
import com.chicu.riskwatch.common.exception.RiskWatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scores records with the active artifact: encode → scale → classify → band.
 * Read-only with respect to the artifact.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MlPredictionService {

    private final ArtifactSlot slot;
    private final FeatureCodec codec;
    private final MlModelProperties modelProps;
    private final RiskBandThresholds thresholds;
    private final Clock clock;

    public PredictionResult score(StudentFeatureRecord raw) {
        ModelArtifact artifact = slot.require();
        FeatureVector v = codec.encode(raw, artifact);
        if (!v.defaulted().isEmpty()) {
            log.warn("⚠️ record={} missing features defaulted to 0: {}", raw.idOrUnknown(), v.defaulted());
        }
        return classify(v, artifact);
    }

    /**
     * Scores with an explicit artifact instead of the active one.
     */
    public PredictionResult score(StudentFeatureRecord raw, ModelArtifact artifact) {
        return classify(codec.encode(raw, artifact), artifact);
    }

    /**
     * The active artifact is read once for the whole batch; a bad record becomes an error entry
     * and never aborts the others. Throws only when no artifact is loaded.
     */
    public List<ScoringOutcome> scoreBatch(List<StudentFeatureRecord> records) {
        ModelArtifact artifact = slot.require();
        List<ScoringOutcome> out = new ArrayList<>(records.size());
        Set<String> missing = new TreeSet<>();
        int failed = 0;

        for (StudentFeatureRecord raw : records) {
            String id = raw != null ? raw.studentId() : null;
            try {
                FeatureVector v = codec.encode(raw, artifact);
                missing.addAll(v.defaulted());
                out.add(ScoringOutcome.success(classify(v, artifact)));
            } catch (RiskWatchException e) {
                failed++;
                log.warn("🧠 SCORE FAIL record={} code={} msg={}", id, e.getErrorCode(), e.getMessage());
                out.add(ScoringOutcome.failure(id, e.getErrorCode(), e.getMessage()));
            } catch (RuntimeException e) {
                failed++;
                log.warn("🧠 SCORE FAIL record={} err={}", id, e.toString());
                out.add(ScoringOutcome.failure(id, "ERR-SCORE", e.getMessage()));
            }
        }

        if (!missing.isEmpty()) {
            log.warn("⚠️ Missing features defaulted to 0 in batch: {}", missing);
        }
        log.info("🧠 BATCH scored={} failed={} model={}", records.size() - failed, failed, artifact.getVersion());
        return out;
    }

    private PredictionResult classify(FeatureVector v, ModelArtifact artifact) {
        double[] scaled = artifact.getScaler().transform(v.values());
        double p1 = artifact.getModel().probabilityOfPositive(scaled);
        int label = p1 > 0.5 ? 1 : 0;
        double risk = modelProps.getRiskPositiveLabel() == 1 ? p1 : 1.0 - p1;
        risk = Math.max(0.0, Math.min(1.0, risk));

        log.debug("🧠 PREDICT record={} label={} risk={} model={}", v.recordId(), label, risk, artifact.getVersion());
        return new PredictionResult(v.recordId(), label, risk, thresholds.band(risk), clock.instant(), artifact.getVersion());
    }
}
