package com.chicu.riskwatch.ai.ml.dataset;

import smile.math.Random;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Train/test split that keeps the 0/1 class ratio in both parts.
 * Deterministic for a given seed: each class is shuffled with Smile's seeded {@link Random}.
 */
public final class StratifiedSplitter {

    public record Split(int[] train, int[] test) {}

    private StratifiedSplitter() {}

    /**
     * @param testFraction share of each class sent to the test part, in (0, 1)
     */
    public static Split split(int[] y, double testFraction, long seed) {
        if (y == null || y.length == 0) throw new IllegalArgumentException("split: empty labels");
        if (!(testFraction > 0.0 && testFraction < 1.0)) {
            throw new IllegalArgumentException("split: testFraction must be in (0,1), got " + testFraction);
        }

        Random rnd = new Random(seed);
        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();

        for (int cls = 0; cls <= 1; cls++) {
            int[] members = members(y, cls);
            if (members.length == 0) continue;

            rnd.permutate(members);
            int nTest = (int) Math.round(members.length * testFraction);
            // both parts keep at least one member of a class that has two or more
            if (members.length >= 2) {
                nTest = Math.max(1, Math.min(members.length - 1, nTest));
            } else {
                nTest = 0;
            }
            for (int k = 0; k < members.length; k++) {
                (k < nTest ? test : train).add(members[k]);
            }
        }

        int[] tr = train.stream().mapToInt(Integer::intValue).toArray();
        int[] te = test.stream().mapToInt(Integer::intValue).toArray();
        Arrays.sort(tr);
        Arrays.sort(te);
        return new Split(tr, te);
    }

    private static int[] members(int[] y, int cls) {
        int[] out = new int[count(y, cls)];
        int k = 0;
        for (int i = 0; i < y.length; i++) {
            if (y[i] == cls) out[k++] = i;
        }
        return out;
    }

    public static int count(int[] y, int cls) {
        int c = 0;
        for (int v : y) if (v == cls) c++;
        return c;
    }
}
