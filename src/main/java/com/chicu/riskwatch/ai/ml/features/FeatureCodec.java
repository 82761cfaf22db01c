package com.chicu.riskwatch.ai.ml.features;

import com.chicu.riskwatch.ai.ml.model.LabelEncoder;
import com.chicu.riskwatch.ai.ml.model.ModelArtifact;
import com.chicu.riskwatch.common.exception.SchemaMismatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Raw record → numeric vector in the artifact's feature order.
 * <p>
 * Policies:
 * <ul>
 *   <li>categorical value outside the encoder's known set (or null) → encoder's FIRST known category;</li>
 *   <li>feature absent from the record (or null) → 0. Weak guarantee: callers that depend on a
 *       feature being real must check completeness before scoring;</li>
 *   <li>numeric feature that is not a finite number → {@link SchemaMismatchException};</li>
 *   <li>attributes outside the contract (id, name, target column...) are ignored.</li>
 * </ul>
 */
@Slf4j
@Component
public class FeatureCodec {

    public FeatureVector encode(StudentFeatureRecord raw, ModelArtifact artifact) {
        if (artifact == null) throw new IllegalArgumentException("artifact=null");
        return encode(raw, artifact.contract());
    }

    public FeatureVector encode(StudentFeatureRecord raw, FeatureContract contract) {
        if (raw == null) throw new SchemaMismatchException("record=null");
        if (contract == null) throw new IllegalArgumentException("contract=null");

        List<String> names = contract.featureNames();
        double[] x = new double[names.size()];
        List<String> defaulted = new ArrayList<>();

        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            Object value = raw.get(name);
            LabelEncoder encoder = contract.encoders().get(name);

            if (value == null) {
                // absent categorical → 0 is also the first category's code
                defaulted.add(name);
                x[i] = 0.0;
                continue;
            }

            if (encoder != null) {
                if (!encoder.knows(value)) {
                    log.debug("unseen category: record={} feature={} value={} -> '{}'",
                            raw.idOrUnknown(), name, value, encoder.firstClass());
                }
                x[i] = encoder.encodeOrFallback(value);
                continue;
            }

            x[i] = numeric(raw, name, value);
        }

        if (!defaulted.isEmpty()) {
            log.debug("missing features defaulted to 0: record={} features={}", raw.idOrUnknown(), defaulted);
        }

        FeatureVector vector = new FeatureVector(raw.studentId(), names, x, defaulted);
        requireLayout(vector, contract);
        return vector;
    }

    /**
     * Encodes a whole batch; the first bad record fails the batch.
     * Missing features are reported once per batch instead of per row.
     */
    public double[][] encodeMatrix(List<StudentFeatureRecord> records, FeatureContract contract) {
        double[][] out = new double[records.size()][];
        Set<String> missing = new TreeSet<>();
        for (int i = 0; i < records.size(); i++) {
            FeatureVector v = encode(records.get(i), contract);
            missing.addAll(v.defaulted());
            out[i] = v.values();
        }
        if (!missing.isEmpty()) {
            log.warn("⚠️ Missing features defaulted to 0 in batch of {}: {}", records.size(), missing);
        }
        return out;
    }

    /**
     * A vector is only usable by a model whose contract lists the same names in the same order.
     */
    public void requireLayout(FeatureVector vector, FeatureContract contract) {
        if (!vector.featureNames().equals(contract.featureNames())) {
            throw new SchemaMismatchException("feature order " + vector.featureNames()
                    + " does not match contract " + contract.featureNames());
        }
        if (vector.values().length != contract.size()) {
            throw new SchemaMismatchException("vector width " + vector.values().length
                    + " != contract width " + contract.size());
        }
    }

    private static double numeric(StudentFeatureRecord raw, String name, Object value) {
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof Boolean b) {
            d = b ? 1.0 : 0.0;
        } else {
            throw new SchemaMismatchException("record " + raw.idOrUnknown() + ": feature '" + name
                    + "' is not numeric (" + value.getClass().getSimpleName() + "='" + value + "')");
        }
        if (!Double.isFinite(d)) {
            throw new SchemaMismatchException("record " + raw.idOrUnknown() + ": feature '" + name + "' is not finite (" + d + ")");
        }
        return d;
    }
}
