package com.chicu.riskwatch.ai.monitoring;

import com.chicu.riskwatch.ai.ml.MlLifecycleProperties;
import com.chicu.riskwatch.ai.ml.MlPredictionService;
import com.chicu.riskwatch.ai.ml.ScoringOutcome;
import com.chicu.riskwatch.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.ai.ml.metrics.ClassificationMetrics;
import com.chicu.riskwatch.common.exception.InvalidInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Accuracy / F1 of the active model against labeled batches, with an append-only history.
 * <p>
 * Drift = the last snapshot is more than {@code driftThreshold} accuracy below the one before it.
 * Only two snapshots are compared; there is no trend smoothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceTracker {

    private final MlPredictionService predictor;
    private final MlLifecycleProperties lifecycleProps;
    private final Clock clock;

    private final List<PerformanceSnapshot> history = new ArrayList<>();

    public PerformanceSnapshot evaluate(List<StudentFeatureRecord> labeledBatch, String targetColumn) {
        if (labeledBatch == null || labeledBatch.isEmpty()) {
            throw new InvalidInputException("evaluation batch is empty");
        }
        int[] labels = TrainingDatasetBuilder.labels(labeledBatch, targetColumn);
        List<ScoringOutcome> outcomes = predictor.scoreBatch(labeledBatch);

        List<Integer> yTrue = new ArrayList<>();
        List<Integer> yPred = new ArrayList<>();
        for (int i = 0; i < outcomes.size(); i++) {
            ScoringOutcome o = outcomes.get(i);
            if (!o.isSuccess()) {
                log.warn("📉 EVAL skip record={} code={} msg={}", o.recordId(), o.errorCode(), o.message());
                continue;
            }
            yTrue.add(labels[i]);
            yPred.add(o.result().prediction());
        }
        if (yTrue.isEmpty()) {
            throw new InvalidInputException("no record of " + labeledBatch.size() + " could be scored");
        }

        ClassificationMetrics m = ClassificationMetrics.of(
                yTrue.stream().mapToInt(Integer::intValue).toArray(),
                yPred.stream().mapToInt(Integer::intValue).toArray());

        PerformanceSnapshot snapshot = new PerformanceSnapshot(clock.instant(), m.accuracy(), m.f1(), m.samples());
        synchronized (history) {
            history.add(snapshot);
        }
        log.info("📊 EVAL accuracy={} f1={} samples={}",
                String.format("%.4f", m.accuracy()), String.format("%.4f", m.f1()), m.samples());
        return snapshot;
    }

    public boolean isDrifting() {
        PerformanceSnapshot prev;
        PerformanceSnapshot cur;
        synchronized (history) {
            if (history.size() < 2) return false;
            prev = history.get(history.size() - 2);
            cur = history.get(history.size() - 1);
        }
        boolean drifting = isDrift(prev, cur, lifecycleProps.getDriftThreshold());
        if (drifting) {
            log.warn("📉 DRIFT accuracy {} -> {}",
                    String.format("%.4f", prev.accuracy()), String.format("%.4f", cur.accuracy()));
        }
        return drifting;
    }

    public static boolean isDrift(PerformanceSnapshot previous, PerformanceSnapshot current, double threshold) {
        return previous.accuracy() - current.accuracy() > threshold;
    }

    public List<PerformanceSnapshot> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public Optional<PerformanceSnapshot> latest() {
        synchronized (history) {
            return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
        }
    }
}
