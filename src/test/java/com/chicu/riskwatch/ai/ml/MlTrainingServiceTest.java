package com.chicu.riskwatch.ai.ml;

import com.chicu.riskwatch.ai.ml.features.FeatureCodec;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.ai.ml.model.GradientBoostingClassifier;
import com.chicu.riskwatch.ai.ml.model.ModelArtifact;
import com.chicu.riskwatch.ai.ml.model.StandardScaler;
import com.chicu.riskwatch.common.exception.InsufficientDataException;
import com.chicu.riskwatch.support.StudentFixtures;
import com.chicu.riskwatch.support.TestModels;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MlTrainingServiceTest {

    private final MlModelProperties modelProps = new MlModelProperties();
    private final MlTrainingService trainer = TestModels.trainer(modelProps, new MlLifecycleProperties());

    @Test
    void initialModelCarriesEncodersScalerAndFeatureOrder() {
        List<StudentFeatureRecord> records = StudentFixtures.records(200, 5);
        ModelArtifact a = trainer.trainInitial(records);

        assertEquals(modelProps.getFeatureNames(), a.getFeatureNames());
        assertEquals(Set.of("gender", "socioeconomic_status", "extracurricular_participation"), a.getEncoders().keySet());
        assertEquals(List.of("High", "Low", "Medium"), a.getEncoders().get("socioeconomic_status").getClasses());
        assertInstanceOf(StandardScaler.class, a.getScaler());
        assertInstanceOf(GradientBoostingClassifier.class, a.getModel());
        assertEquals("initial-20261019T020000Z", a.getVersion());
        assertNull(a.getRetrainedAt());
    }

    @Test
    void initialModelLearnsTheFixture() {
        List<StudentFeatureRecord> records = StudentFixtures.records(300, 8);
        ModelArtifact a = trainer.trainInitial(records);
        FeatureCodec codec = new FeatureCodec();

        int ok = 0;
        for (StudentFeatureRecord r : records) {
            double[] x = a.getScaler().transform(codec.encode(r, a).values());
            if (a.getModel().predict(x) == r.label("is_active").getAsInt()) ok++;
        }
        assertTrue(ok > 0.85 * records.size(), "correct=" + ok);
    }

    @Test
    void tooFewRowsAreInsufficient() {
        InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> trainer.requireTrainable(StudentFixtures.records(5, 1), "is_active"));
        assertEquals("ERR-DATA", e.getErrorCode());
    }

    @Test
    void missingTargetColumnIsInsufficient() {
        List<StudentFeatureRecord> rows = new ArrayList<>(StudentFixtures.records(20, 1));
        rows.set(4, StudentFixtures.without(rows.get(4), "is_active"));
        assertThrows(InsufficientDataException.class, () -> trainer.requireTrainable(rows, "is_active"));
    }

    @Test
    void singleClassIsInsufficient() {
        List<StudentFeatureRecord> rows = new ArrayList<>();
        for (StudentFeatureRecord r : StudentFixtures.records(20, 1)) rows.add(StudentFixtures.with(r, "is_active", 1));
        assertThrows(InsufficientDataException.class, () -> trainer.requireTrainable(rows, "is_active"));
    }

    @Test
    void emptyBatchIsInsufficient() {
        assertThrows(InsufficientDataException.class, () -> trainer.requireTrainable(List.of(), "is_active"));
    }
}
