package com.chicu.riskwatch.ai.ml.dataset;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StratifiedSplitterTest {

    private static int[] labels(int zeros, int ones) {
        int[] y = new int[zeros + ones];
        Arrays.fill(y, zeros, y.length, 1);
        return y;
    }

    @Test
    void classRatioIsKeptInBothParts() {
        int[] y = labels(80, 20);
        StratifiedSplitter.Split s = StratifiedSplitter.split(y, 0.2, 42);

        assertEquals(80, s.train().length);
        assertEquals(20, s.test().length);
        assertEquals(4, countOnes(y, s.test()));
        assertEquals(16, countOnes(y, s.train()));
    }

    @Test
    void partsAreDisjointAndCoverEverything() {
        int[] y = labels(13, 9);
        StratifiedSplitter.Split s = StratifiedSplitter.split(y, 0.2, 1);

        Set<Integer> all = new HashSet<>();
        for (int i : s.train()) assertTrue(all.add(i));
        for (int i : s.test()) assertTrue(all.add(i));
        assertEquals(y.length, all.size());
    }

    @Test
    void sameSeedSameSplit() {
        int[] y = labels(30, 30);
        assertArrayEquals(StratifiedSplitter.split(y, 0.2, 42).test(), StratifiedSplitter.split(y, 0.2, 42).test());
    }

    @Test
    void smallClassStillReachesBothParts() {
        int[] y = labels(10, 2);
        StratifiedSplitter.Split s = StratifiedSplitter.split(y, 0.2, 42);

        assertEquals(1, countOnes(y, s.test()));
        assertEquals(1, countOnes(y, s.train()));
    }

    private static int countOnes(int[] y, int[] idx) {
        int c = 0;
        for (int i : idx) if (y[i] == 1) c++;
        return c;
    }
}
