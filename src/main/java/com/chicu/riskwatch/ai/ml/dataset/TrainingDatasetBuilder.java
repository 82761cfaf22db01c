package com.chicu.riskwatch.ai.ml.dataset;

import com.chicu.riskwatch.ai.ml.features.FeatureCodec;
import com.chicu.riskwatch.ai.ml.features.FeatureContract;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.common.exception.InvalidInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * TrainingDatasetBuilder
 * ======================
 * Labeled records → X: double[][] (contract order, unscaled), y: int[] (0/1).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingDatasetBuilder {

    private final FeatureCodec codec;

    /**
     * X: [n_samples][n_features], y: [n_samples]
     */
    public record Dataset(
            String datasetId,
            double[][] X,
            int[] y,
            int samples,
            int features
    ) {
        /** Rows at the given indices, in that order. */
        public Dataset subset(int[] idx) {
            double[][] sx = new double[idx.length][];
            int[] sy = new int[idx.length];
            for (int i = 0; i < idx.length; i++) {
                sx[i] = X[idx[i]];
                sy[i] = y[idx[i]];
            }
            return new Dataset(datasetId, sx, sy, idx.length, features);
        }
    }

    public Dataset build(List<StudentFeatureRecord> records, FeatureContract contract, String targetColumn) {
        if (records == null || records.isEmpty()) {
            throw new InvalidInputException("dataset is empty");
        }
        int[] y = labels(records, targetColumn);
        double[][] X = codec.encodeMatrix(records, contract);

        String id = UUID.randomUUID().toString();
        log.info("📦 Dataset built: id={} samples={} features={}", id, X.length, contract.size());
        return new Dataset(id, X, y, X.length, contract.size());
    }

    /**
     * 0/1 labels of every record; one null or unlabeled record rejects the batch.
     */
    public static int[] labels(List<StudentFeatureRecord> records, String targetColumn) {
        int[] y = new int[records.size()];
        for (int i = 0; i < records.size(); i++) {
            StudentFeatureRecord r = records.get(i);
            if (r == null) {
                throw new InvalidInputException("record #" + i + " is null");
            }
            OptionalInt label = r.label(targetColumn);
            if (label.isEmpty()) {
                throw new InvalidInputException("record " + r.idOrUnknown() + " has no 0/1 '" + targetColumn
                        + "' label (value=" + r.get(targetColumn) + ")");
            }
            y[i] = label.getAsInt();
        }
        return y;
    }
}
