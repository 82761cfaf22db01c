package com.chicu.riskwatch.ai.ml;

import com.chicu.riskwatch.ai.ml.dataset.StratifiedSplitter;
import com.chicu.riskwatch.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.riskwatch.ai.ml.features.FeatureContract;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.ai.ml.metrics.ClassificationMetrics;
import com.chicu.riskwatch.ai.ml.model.BinaryClassifier;
import com.chicu.riskwatch.ai.ml.model.FeatureScaler;
import com.chicu.riskwatch.ai.ml.model.GradientBoostingClassifier;
import com.chicu.riskwatch.ai.ml.model.LabelEncoder;
import com.chicu.riskwatch.ai.ml.model.LogisticRegressionClassifier;
import com.chicu.riskwatch.ai.ml.model.ModelArtifact;
import com.chicu.riskwatch.ai.ml.model.StandardScaler;
import com.chicu.riskwatch.common.enums.ModelAlgorithm;
import com.chicu.riskwatch.common.exception.InsufficientDataException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Fits scaler + classifier on labeled data. Used for the first model and, through
 * {@link #fitAndEvaluate}, by retraining.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MlTrainingService {

    private static final DateTimeFormatter VERSION_TS =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final TrainingDatasetBuilder datasetBuilder;
    private final MlModelProperties modelProps;
    private final MlLifecycleProperties lifecycleProps;
    private final Clock clock;

    public record TrainingOutcome(
            FeatureScaler scaler,
            BinaryClassifier model,
            ClassificationMetrics holdout,
            int trainRows,
            int testRows
    ) {}

    /**
     * First model: encoders fitted on the categorical columns, a standard scaler and the
     * configured algorithm.
     */
    public ModelArtifact trainInitial(List<StudentFeatureRecord> records) {
        String target = modelProps.getTargetColumn();
        requireTrainable(records, target);

        List<String> featureNames = List.copyOf(modelProps.getFeatureNames());
        Map<String, LabelEncoder> encoders = new LinkedHashMap<>();
        for (String col : modelProps.getCategoricalColumns()) {
            if (!featureNames.contains(col)) {
                log.warn("⚠️ categorical column '{}' is not a model feature, skipped", col);
                continue;
            }
            List<Object> values = new ArrayList<>(records.size());
            for (StudentFeatureRecord r : records) values.add(r.get(col));
            try {
                encoders.put(col, LabelEncoder.fit(values));
            } catch (IllegalArgumentException e) {
                throw new InsufficientDataException("categorical column '" + col + "' has no values", e);
            }
        }

        FeatureContract contract = new FeatureContract(featureNames, encoders);
        TrainingDatasetBuilder.Dataset ds = datasetBuilder.build(records, contract, target);

        TrainingOutcome outcome = fitAndEvaluate(ds, new StandardScaler(), newClassifier(modelProps.getAlgorithm()));

        Instant now = clock.instant();
        ModelArtifact artifact = ModelArtifact.builder()
                .version(versionTag("initial", now))
                .model(outcome.model())
                .scaler(outcome.scaler())
                .encoders(encoders)
                .featureNames(featureNames)
                .createdAt(now)
                .build();

        log.info("🧠 TRAIN OK version={} algorithm={} rows={}/{} holdoutAccuracy={}",
                artifact.getVersion(), modelProps.getAlgorithm(), outcome.trainRows(), outcome.testRows(),
                String.format("%.4f", outcome.holdout().accuracy()));
        return artifact;
    }

    /**
     * Stratified split → scaler fitted on the train part only → classifier → holdout metrics.
     * Prototypes are only used for their class and hyper-parameters.
     */
    public TrainingOutcome fitAndEvaluate(TrainingDatasetBuilder.Dataset ds,
                                          FeatureScaler scalerPrototype,
                                          BinaryClassifier modelPrototype) {

        StratifiedSplitter.Split split = StratifiedSplitter.split(
                ds.y(), lifecycleProps.getTestFraction(), lifecycleProps.getSeed());

        TrainingDatasetBuilder.Dataset train = ds.subset(split.train());
        TrainingDatasetBuilder.Dataset test = ds.subset(split.test());

        FeatureScaler scaler = scalerPrototype.fit(train.X());
        BinaryClassifier model = modelPrototype.fit(scaler.transformAll(train.X()), train.y());

        int[] predicted = model.predictAll(scaler.transformAll(test.X()));
        ClassificationMetrics holdout = ClassificationMetrics.of(test.y(), predicted);

        return new TrainingOutcome(scaler, model, holdout, train.samples(), test.samples());
    }

    /**
     * Rejects batches that cannot give a meaningful fit; touches nothing.
     */
    public void requireTrainable(List<StudentFeatureRecord> records, String targetColumn) {
        if (records == null || records.isEmpty()) {
            throw new InsufficientDataException("training batch is empty");
        }
        int minRows = lifecycleProps.getMinTrainingRows();
        if (records.size() < minRows) {
            throw new InsufficientDataException("training batch has " + records.size()
                    + " rows, at least " + minRows + " required");
        }

        int[] perClass = new int[2];
        for (StudentFeatureRecord r : records) {
            if (r == null) {
                throw new InsufficientDataException("training batch contains a null record");
            }
            OptionalInt label = r.label(targetColumn);
            if (label.isEmpty()) {
                throw new InsufficientDataException("record " + r.idOrUnknown()
                        + " lacks a 0/1 target column '" + targetColumn + "'");
            }
            perClass[label.getAsInt()]++;
        }

        if (perClass[0] < 2 || perClass[1] < 2) {
            throw new InsufficientDataException("each class needs at least 2 rows, got class0="
                    + perClass[0] + " class1=" + perClass[1]);
        }
    }

    public static BinaryClassifier newClassifier(ModelAlgorithm algorithm) {
        return switch (algorithm) {
            case GRADIENT_BOOSTING -> new GradientBoostingClassifier();
            case LOGISTIC_REGRESSION -> new LogisticRegressionClassifier();
        };
    }

    public static String versionTag(String prefix, Instant at) {
        return prefix + "-" + VERSION_TS.format(at);
    }
}
