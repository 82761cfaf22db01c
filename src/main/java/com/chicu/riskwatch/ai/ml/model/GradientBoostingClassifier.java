package com.chicu.riskwatch.ai.ml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import smile.classification.GradientTreeBoost;
import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.data.vector.IntVector;
import smile.math.MathEx;

/**
 * Gradient tree boosting with log-loss (Smile).
 * <p>
 * Rows are wrapped in a frame {@code x0..x(d-1), label}; prediction frames use the same layout
 * with a dummy label so the fitted formula binds the same way. Smile draws from a per-thread
 * RNG, which is reseeded before every fit.
 */
public final class GradientBoostingClassifier implements BinaryClassifier {

    public static final int DEFAULT_TREES = 100;
    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final int DEFAULT_MAX_NODES = 8;
    public static final int DEFAULT_NODE_SIZE = 5;
    public static final double DEFAULT_SHRINKAGE = 0.1;

    private static final String LABEL = "label";
    private static final long SEED = 42L;

    @Getter private final int trees;
    @Getter private final int maxDepth;
    @Getter private final int maxNodes;
    @Getter private final int nodeSize;
    @Getter private final double shrinkage;
    @Getter private final int dimension;

    private final GradientTreeBoost model;

    public GradientBoostingClassifier() {
        this(DEFAULT_TREES, DEFAULT_MAX_DEPTH, DEFAULT_MAX_NODES, DEFAULT_NODE_SIZE, DEFAULT_SHRINKAGE);
    }

    public GradientBoostingClassifier(int trees, int maxDepth, int maxNodes, int nodeSize, double shrinkage) {
        this(trees, maxDepth, maxNodes, nodeSize, shrinkage, 0, (GradientTreeBoost) null);
    }

    @JsonCreator
    public GradientBoostingClassifier(@JsonProperty("trees") int trees,
                                      @JsonProperty("maxDepth") int maxDepth,
                                      @JsonProperty("maxNodes") int maxNodes,
                                      @JsonProperty("nodeSize") int nodeSize,
                                      @JsonProperty("shrinkage") double shrinkage,
                                      @JsonProperty("dimension") int dimension,
                                      @JsonProperty("model") byte[] model) {
        this(trees, maxDepth, maxNodes, nodeSize, shrinkage, dimension,
                SmileModels.fromBytes(model, GradientTreeBoost.class));
    }

    private GradientBoostingClassifier(int trees, int maxDepth, int maxNodes, int nodeSize, double shrinkage,
                                       int dimension, GradientTreeBoost model) {
        if (trees <= 0) throw new IllegalArgumentException("trees must be > 0");
        if (maxDepth < 2) throw new IllegalArgumentException("maxDepth must be >= 2");
        if (maxNodes < 2) throw new IllegalArgumentException("maxNodes must be >= 2");
        if (nodeSize < 1) throw new IllegalArgumentException("nodeSize must be >= 1");
        if (!(shrinkage > 0 && shrinkage <= 1)) throw new IllegalArgumentException("shrinkage must be in (0,1]");
        this.trees = trees;
        this.maxDepth = maxDepth;
        this.maxNodes = maxNodes;
        this.nodeSize = nodeSize;
        this.shrinkage = shrinkage;
        this.dimension = dimension;
        this.model = model;
    }

    @Override
    public GradientBoostingClassifier fit(double[][] x, int[] y) {
        BinaryClassifier.requireTrainingSet(x, y);
        int d = x[0].length;
        DataFrame data = DataFrame.of(x, columns(d)).merge(IntVector.of(LABEL, y));

        MathEx.setSeed(SEED);
        GradientTreeBoost fitted = GradientTreeBoost.fit(Formula.lhs(LABEL), data,
                trees, maxDepth, maxNodes, nodeSize, shrinkage, 1.0);
        return new GradientBoostingClassifier(trees, maxDepth, maxNodes, nodeSize, shrinkage, d, fitted);
    }

    @Override
    public double probabilityOfPositive(double[] x) {
        return probabilities(new double[][]{x})[0];
    }

    @Override
    public int[] predictAll(double[][] x) {
        double[] p = probabilities(x);
        int[] out = new int[p.length];
        for (int i = 0; i < p.length; i++) {
            out[i] = p[i] > 0.5 ? 1 : 0;
        }
        return out;
    }

    private double[] probabilities(double[][] rows) {
        if (model == null) throw new IllegalStateException("GradientBoosting: not fitted");
        for (double[] row : rows) {
            if (row.length != dimension) {
                throw new IllegalArgumentException("GradientBoosting: expected " + dimension + " features, got " + row.length);
            }
        }
        DataFrame frame = DataFrame.of(rows, columns(dimension)).merge(IntVector.of(LABEL, new int[rows.length]));
        double[] out = new double[rows.length];
        double[] posteriori = new double[2];
        for (int i = 0; i < rows.length; i++) {
            model.predict(frame.get(i), posteriori);
            out[i] = posteriori[1];
        }
        return out;
    }

    private static String[] columns(int d) {
        String[] names = new String[d];
        for (int j = 0; j < d; j++) names[j] = "x" + j;
        return names;
    }

    @JsonProperty("model")
    public byte[] modelBytes() {
        return SmileModels.toBytes(model);
    }
}
