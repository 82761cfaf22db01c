package com.chicu.riskwatch.ai.lifecycle;

import com.chicu.riskwatch.ai.ml.ArtifactSlot;
import com.chicu.riskwatch.ai.ml.MlTrainingService;
import com.chicu.riskwatch.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.riskwatch.ai.ml.features.FeatureCodec;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.ai.ml.metrics.ClassificationMetrics;
import com.chicu.riskwatch.ai.ml.model.ModelArtifact;
import com.chicu.riskwatch.ai.persistence.ArtifactStore;
import com.chicu.riskwatch.ai.persistence.MlStorageProperties;
import com.chicu.riskwatch.common.enums.ArbitrationVerdict;
import com.chicu.riskwatch.common.enums.LifecycleBranch;
import com.chicu.riskwatch.common.enums.LifecycleState;
import com.chicu.riskwatch.common.exception.ArtifactPersistenceException;
import com.chicu.riskwatch.common.exception.InvalidInputException;
import com.chicu.riskwatch.common.exception.PromotionConflictException;
import com.chicu.riskwatch.common.exception.RiskWatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Retrain → arbitrate → promote / roll back, one transition at a time.
 * <p>
 * STABLE → RETRAINING → ARBITRATING → (PROMOTED | ROLLED_BACK) → STABLE.
 * A failed retrain goes back to STABLE with the active artifact untouched.
 * The outgoing artifact is always written to the backup slot before the active slot changes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelLifecycleManager {

    private final ArtifactSlot slot;
    private final ArtifactStore store;
    private final MlStorageProperties storageProps;
    private final MlTrainingService trainer;
    private final TrainingDatasetBuilder datasetBuilder;
    private final FeatureCodec codec;
    private final ArbitrationPolicy policy;
    private final Clock clock;

    private final ReentrantLock transitionLock = new ReentrantLock();
    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.STABLE);

    public LifecycleState state() {
        return state.get();
    }

    // =====================================================================
    // RETRAIN
    // =====================================================================

    /**
     * Trains a challenger on {@code trainingBatch} with the incumbent's feature contract,
     * scaler class and model hyper-parameters. Does not touch the active artifact.
     */
    public RetrainResult retrain(List<StudentFeatureRecord> trainingBatch, String targetColumn) {
        // preconditions first: a rejected batch leaves every slot as it was
        trainer.requireTrainable(trainingBatch, targetColumn);

        return exclusive("retrain", () -> {
            ModelArtifact incumbent = slot.require();
            state.set(LifecycleState.RETRAINING);
            log.info("🧠 RETRAIN START rows={} incumbent={}", trainingBatch.size(), incumbent.getVersion());

            store.save(incumbent, storageProps.backupPath());

            TrainingDatasetBuilder.Dataset ds = datasetBuilder.build(trainingBatch, incumbent.contract(), targetColumn);
            MlTrainingService.TrainingOutcome out = trainer.fitAndEvaluate(ds, incumbent.getScaler(), incumbent.getModel());

            Instant now = clock.instant();
            ModelArtifact candidate = ModelArtifact.builder()
                    .version(MlTrainingService.versionTag("retrain", now))
                    .model(out.model())
                    .scaler(out.scaler())
                    .encoders(incumbent.getEncoders())
                    .featureNames(incumbent.getFeatureNames())
                    .createdAt(incumbent.getCreatedAt())
                    .retrainedAt(now)
                    .build();

            log.info("🧠 RETRAIN OK candidate={} rows={}/{} holdoutAccuracy={}",
                    candidate.getVersion(), out.trainRows(), out.testRows(),
                    String.format("%.4f", out.holdout().accuracy()));

            return new RetrainResult(candidate, out.holdout().accuracy(), out.trainRows(), out.testRows());
        });
    }

    // =====================================================================
    // ARBITRATION
    // =====================================================================

    public ArbitrationVerdict arbitrate(ModelArtifact candidate, List<StudentFeatureRecord> testBatch, String targetColumn) {
        return arbitrateDetailed(candidate, testBatch, targetColumn).verdict();
    }

    /**
     * Both artifacts score the same records encoded with the incumbent's contract; each applies
     * its own scaler. Anything that goes wrong after input validation keeps the incumbent.
     */
    public ArbitrationResult arbitrateDetailed(ModelArtifact candidate,
                                               List<StudentFeatureRecord> testBatch,
                                               String targetColumn) {
        if (testBatch == null || testBatch.isEmpty()) {
            throw new InvalidInputException("arbitration batch is empty");
        }
        int[] y = TrainingDatasetBuilder.labels(testBatch, targetColumn);

        if (transitionLock.isHeldByCurrentThread()) {
            state.set(LifecycleState.ARBITRATING);
        }

        try {
            if (candidate == null) {
                return ArbitrationResult.failSafe("no candidate");
            }
            ModelArtifact incumbent = slot.require();
            if (!candidate.getFeatureNames().equals(incumbent.getFeatureNames())) {
                return ArbitrationResult.failSafe("candidate features " + candidate.getFeatureNames()
                        + " differ from incumbent " + incumbent.getFeatureNames());
            }

            double[][] x = codec.encodeMatrix(testBatch, incumbent.contract());
            ClassificationMetrics inc = measure(incumbent, x, y);
            ClassificationMetrics cand = measure(candidate, x, y);

            ArbitrationResult result = policy.decide(inc, cand);
            log.info("⚖️ ARBITRATION verdict={} incumbent acc={} f1={} candidate acc={} f1={} ({})",
                    result.verdict(),
                    String.format("%.4f", inc.accuracy()), String.format("%.4f", inc.f1()),
                    String.format("%.4f", cand.accuracy()), String.format("%.4f", cand.f1()),
                    result.reason());
            return result;

        } catch (RuntimeException e) {
            log.error("⚖️ ARBITRATION FAIL, incumbent kept: {}", e.toString(), e);
            return ArbitrationResult.failSafe("arbitration error: " + e.getMessage());
        }
    }

    private static ClassificationMetrics measure(ModelArtifact artifact, double[][] encoded, int[] y) {
        double[][] scaled = artifact.getScaler().transformAll(encoded);
        return ClassificationMetrics.of(y, artifact.getModel().predictAll(scaled));
    }

    // =====================================================================
    // PROMOTION / ROLLBACK
    // =====================================================================

    /**
     * Backup ← outgoing, active file ← candidate, then the in-memory swap.
     * If persisting fails the in-memory artifact stays the old one.
     */
    public void promote(ModelArtifact candidate) {
        if (candidate == null) throw new IllegalArgumentException("candidate=null");

        exclusive("promote", () -> {
            ModelArtifact outgoing = slot.current().orElse(null);
            if (outgoing != null) {
                store.save(outgoing, storageProps.backupPath());
            }
            store.save(candidate, storageProps.activePath());
            slot.swap(candidate);
            state.set(LifecycleState.PROMOTED);
            log.info("✅ PROMOTED {} (backup={})", candidate.getVersion(),
                    outgoing != null ? outgoing.getVersion() : "none");
            return null;
        });
    }

    /**
     * Re-activates the backup artifact. The artifact it displaces goes to the rollback file.
     */
    public ModelArtifact restoreBackup() {
        return exclusive("restore", () -> {
            if (!store.exists(storageProps.backupPath())) {
                throw new ArtifactPersistenceException("no backup artifact at " + storageProps.backupPath());
            }
            ModelArtifact backup = store.load(storageProps.backupPath());

            slot.current().ifPresent(cur -> store.save(cur, storageProps.rollbackPath()));
            store.save(backup, storageProps.activePath());
            slot.swap(backup);
            state.set(LifecycleState.ROLLED_BACK);

            log.warn("↩️ ROLLED BACK to {}", backup.getVersion());
            return backup;
        });
    }

    // =====================================================================
    // FULL CYCLE
    // =====================================================================

    /**
     * retrain → arbitrate → promote or keep the incumbent. Lifecycle failures are reported, not thrown;
     * only a concurrent transition raises {@link PromotionConflictException}.
     */
    public LifecycleReport runLifecycle(List<StudentFeatureRecord> trainingBatch,
                                        List<StudentFeatureRecord> testBatch,
                                        String targetColumn) {
        return exclusive("lifecycle", () -> {
            RetrainResult retrained;
            try {
                retrained = retrain(trainingBatch, targetColumn);
            } catch (RiskWatchException | IllegalArgumentException e) {
                state.set(LifecycleState.RETRAIN_FAILED);
                log.warn("🧠 RETRAIN FAIL: {}", e.getMessage());
                return LifecycleReport.failed(e.getMessage());
            } catch (RuntimeException e) {
                state.set(LifecycleState.RETRAIN_FAILED);
                log.error("🧠 RETRAIN FAIL", e);
                return LifecycleReport.failed(e.toString());
            }

            ModelArtifact candidate = retrained.candidate();
            ArbitrationResult verdict;
            try {
                verdict = arbitrateDetailed(candidate, testBatch, targetColumn);
            } catch (InvalidInputException e) {
                log.warn("⚖️ ARBITRATION rejected test batch, incumbent kept: {}", e.getMessage());
                verdict = ArbitrationResult.failSafe(e.getMessage());
            } catch (RuntimeException e) {
                log.error("⚖️ ARBITRATION FAIL, incumbent kept: {}", e.toString(), e);
                verdict = ArbitrationResult.failSafe("arbitration error: " + e.getMessage());
            }

            if (!verdict.candidateWins()) {
                state.set(LifecycleState.ROLLED_BACK);
                log.info("🧠 candidate {} discarded: {}", candidate.getVersion(), verdict.reason());
                return report(LifecycleBranch.INCUMBENT_RETAINED, verdict, candidate);
            }

            try {
                promote(candidate);
            } catch (RiskWatchException e) {
                state.set(LifecycleState.RETRAIN_FAILED);
                log.error("🧠 PROMOTE FAIL candidate={}", candidate.getVersion(), e);
                return LifecycleReport.failed("promotion failed: " + e.getMessage());
            }
            return report(LifecycleBranch.CANDIDATE_PROMOTED, verdict, candidate);
        });
    }

    private static LifecycleReport report(LifecycleBranch branch, ArbitrationResult verdict, ModelArtifact candidate) {
        return LifecycleReport.builder()
                .branch(branch)
                .reason(verdict.reason())
                .incumbentMetrics(verdict.incumbent())
                .candidateMetrics(verdict.candidate())
                .candidateVersion(candidate.getVersion())
                .build();
    }

    /**
     * Runs {@code body} as (part of) the single in-flight transition. The outermost call
     * returns the state to STABLE.
     */
    private <T> T exclusive(String operation, Supplier<T> body) {
        if (!transitionLock.tryLock()) {
            throw new PromotionConflictException(operation + ": another lifecycle transition is in progress ("
                    + state.get() + ")");
        }
        try {
            return body.get();
        } finally {
            if (transitionLock.getHoldCount() == 1) {
                state.set(LifecycleState.STABLE);
            }
            transitionLock.unlock();
        }
    }
}
