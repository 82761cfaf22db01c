package com.chicu.riskwatch.ai.ml;

import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.ai.ml.model.ModelArtifact;
import com.chicu.riskwatch.ai.persistence.ArtifactStore;
import com.chicu.riskwatch.ai.persistence.MlStorageProperties;
import com.chicu.riskwatch.common.exception.RiskWatchException;
import com.chicu.riskwatch.storage.StudentRecordSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Fills the artifact slot at start-up: active file if present, otherwise a model trained from
 * labeled storage records. Never fails the application; scoring reports ERR-ARTIFACT until a model exists.
 */
@Slf4j
@Component
@Order(10)
@RequiredArgsConstructor
public class ArtifactBootstrapper implements ApplicationRunner {

    private final ArtifactStore store;
    private final ArtifactSlot slot;
    private final MlStorageProperties storageProps;
    private final MlModelProperties modelProps;
    private final MlTrainingService trainer;
    private final StudentRecordSource source;

    @Override
    public void run(ApplicationArguments args) {
        bootstrap();
    }

    public boolean bootstrap() {
        Path active = storageProps.activePath();
        try {
            if (store.exists(active)) {
                slot.swap(store.load(active));
                log.info("✅ Model loaded: {}", slot.require().getVersion());
                return true;
            }

            if (!modelProps.isTrainIfMissing()) {
                log.warn("⚠️ No model at {} and train-if-missing=false, predictions unavailable", active);
                return false;
            }

            List<StudentFeatureRecord> labeled = source.fetchLabeled(modelProps.getTargetColumn());
            log.info("🧠 No model at {}, training from {} labeled records", active, labeled.size());
            ModelArtifact artifact = trainer.trainInitial(labeled);
            store.save(artifact, active);
            slot.swap(artifact);
            return true;

        } catch (RiskWatchException e) {
            log.warn("⚠️ Model NOT available [{}]: {}", e.getErrorCode(), e.getMessage());
            return false;
        }
    }
}
