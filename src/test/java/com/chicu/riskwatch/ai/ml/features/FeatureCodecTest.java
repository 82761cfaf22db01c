package com.chicu.riskwatch.ai.ml.features;

import com.chicu.riskwatch.ai.ml.model.LabelEncoder;
import com.chicu.riskwatch.common.exception.SchemaMismatchException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureCodecTest {

    private final FeatureCodec codec = new FeatureCodec();

    private final FeatureContract contract = new FeatureContract(
            List.of("gender", "age", "distance_from_school_km"),
            Map.of("gender", new LabelEncoder(List.of("Female", "Male")))
    );

    private static StudentFeatureRecord record(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
        return StudentFeatureRecord.of("S1", m);
    }

    @Test
    void vectorFollowsContractOrder() {
        FeatureVector v = codec.encode(record("distance_from_school_km", 4.5, "age", 16, "gender", "Male"), contract);

        assertEquals(contract.featureNames(), v.featureNames());
        assertArrayEquals(new double[]{1.0, 16.0, 4.5}, v.values());
        assertTrue(v.defaulted().isEmpty());
    }

    @Test
    void missingFeatureDefaultsToZero() {
        FeatureVector v = codec.encode(record("gender", "Female", "age", 15), contract);

        assertEquals(0.0, v.values()[2]);
        assertEquals(List.of("distance_from_school_km"), v.defaulted());
    }

    @Test
    void unseenCategoryMapsToFirstKnownCategory() {
        FeatureVector v = codec.encode(record("gender", "Other", "age", 15, "distance_from_school_km", 1.0), contract);
        assertEquals(0.0, v.values()[0]);
    }

    @Test
    void attributesOutsideTheContractAreIgnored() {
        FeatureVector v = codec.encode(record("gender", "Male", "age", 17, "distance_from_school_km", 2.0,
                "name", "Ann", "is_active", 1, "mentor_id", "M1"), contract);
        assertEquals(3, v.values().length);
    }

    @Test
    void nonNumericValueForNumericFeatureIsSchemaMismatch() {
        StudentFeatureRecord bad = record("gender", "Male", "age", "sixteen", "distance_from_school_km", 2.0);
        SchemaMismatchException e = assertThrows(SchemaMismatchException.class, () -> codec.encode(bad, contract));
        assertEquals("ERR-SCHEMA", e.getErrorCode());
    }

    @Test
    void nonFiniteNumberIsSchemaMismatch() {
        StudentFeatureRecord bad = record("gender", "Male", "age", 16, "distance_from_school_km", Double.NaN);
        assertThrows(SchemaMismatchException.class, () -> codec.encode(bad, contract));
    }

    @Test
    void layoutCheckRejectsReorderedVector() {
        FeatureVector reordered = new FeatureVector("S1", List.of("age", "gender", "distance_from_school_km"),
                new double[]{16, 1, 2}, List.of());
        assertThrows(SchemaMismatchException.class, () -> codec.requireLayout(reordered, contract));
    }

    @Test
    void matrixEncodesEveryRecord() {
        double[][] x = codec.encodeMatrix(List.of(
                record("gender", "Male", "age", 16, "distance_from_school_km", 2.0),
                record("gender", "Female", "age", 18)
        ), contract);

        assertEquals(2, x.length);
        assertArrayEquals(new double[]{0.0, 18.0, 0.0}, x[1]);
    }
}
