package com.chicu.riskwatch.ai.persistence;

import com.chicu.riskwatch.ai.ml.MlLifecycleProperties;
import com.chicu.riskwatch.ai.ml.MlModelProperties;
import com.chicu.riskwatch.ai.ml.features.FeatureCodec;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.ai.ml.model.ModelArtifact;
import com.chicu.riskwatch.common.exception.ArtifactPersistenceException;
import com.chicu.riskwatch.common.exception.SchemaMismatchException;
import com.chicu.riskwatch.support.StudentFixtures;
import com.chicu.riskwatch.support.TestModels;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemArtifactStoreTest {

    @TempDir
    Path dir;

    private final FileSystemArtifactStore store = new FileSystemArtifactStore();

    @Test
    void savedBundleLoadsBackWithIdenticalBehaviour() {
        List<StudentFeatureRecord> records = StudentFixtures.records(150, 21);
        ModelArtifact original = TestModels.trainer(new MlModelProperties(), new MlLifecycleProperties())
                .trainInitial(records);

        Path file = dir.resolve("models").resolve("active.json");
        store.save(original, file);
        ModelArtifact loaded = store.load(file);

        assertEquals(original.getVersion(), loaded.getVersion());
        assertEquals(original.getFeatureNames(), loaded.getFeatureNames());
        assertEquals(original.getEncoders(), loaded.getEncoders());
        assertEquals(original.getCreatedAt(), loaded.getCreatedAt());

        FeatureCodec codec = new FeatureCodec();
        for (StudentFeatureRecord r : records) {
            double[] a = original.getScaler().transform(codec.encode(r, original).values());
            double[] b = loaded.getScaler().transform(codec.encode(r, loaded).values());
            assertEquals(original.getModel().probabilityOfPositive(a), loaded.getModel().probabilityOfPositive(b), 1e-12);
        }
        assertFalse(Files.exists(dir.resolve("models").resolve("active.json.tmp")));
    }

    @Test
    void overwriteReplacesPreviousBundle() {
        Path file = dir.resolve("active.json");
        store.save(TestModels.trained(StudentFixtures.records(60, 1)), file);

        ModelArtifact second = ModelArtifact.builder()
                .version("second")
                .model(TestModels.trained(StudentFixtures.records(60, 2)).getModel())
                .scaler(TestModels.trained(StudentFixtures.records(60, 2)).getScaler())
                .featureNames(new MlModelProperties().getFeatureNames())
                .build();
        store.save(second, file);

        assertEquals("second", store.load(file).getVersion());
    }

    @Test
    void missingFileIsPersistenceError() {
        ArtifactPersistenceException e = assertThrows(ArtifactPersistenceException.class,
                () -> store.load(dir.resolve("nope.json")));
        assertEquals("ERR-PERSIST", e.getErrorCode());
        assertFalse(store.exists(dir.resolve("nope.json")));
    }

    @Test
    void corruptFileIsPersistenceError() throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ not json");
        assertThrows(ArtifactPersistenceException.class, () -> store.load(file));
    }

    @Test
    void inconsistentBundleIsSchemaMismatch() throws Exception {
        Path file = dir.resolve("mixed.json");
        store.save(TestModels.trained(StudentFixtures.records(60, 1)), file);

        // scaler and model stay 9 features wide, the contract shrinks to 2
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode bundle = (ObjectNode) mapper.readTree(file.toFile());
        bundle.putObject("encoders");
        bundle.putArray("featureNames").add("age").add("attendance_rate");
        mapper.writeValue(file.toFile(), bundle);

        assertThrows(SchemaMismatchException.class, () -> store.load(file));
    }

    @Test
    void truncatedModelPayloadIsPersistenceError() throws Exception {
        Path file = dir.resolve("truncated.json");
        store.save(TestModels.trained(StudentFixtures.records(60, 1)), file);

        ObjectMapper mapper = new ObjectMapper();
        ObjectNode bundle = (ObjectNode) mapper.readTree(file.toFile());
        ((ObjectNode) bundle.get("model")).put("model", new byte[]{1, 2, 3});
        mapper.writeValue(file.toFile(), bundle);

        assertThrows(ArtifactPersistenceException.class, () -> store.load(file));
    }
}
