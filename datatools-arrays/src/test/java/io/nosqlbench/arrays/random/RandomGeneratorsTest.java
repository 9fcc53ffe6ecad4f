package io.nosqlbench.arrays.random;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.commons.math3.stat.inference.ChiSquareTest;
import org.apache.commons.rng.RandomProviderState;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for RandomGenerators utility
 */
@Tag("unit")
class RandomGeneratorsTest {

    @Test
    void testCreateWithAlgorithm() {
        // Different algorithms should produce different sequences even with same seed
        long seed = 12345L;
        RestorableUniformRandomProvider rng1 = RandomGenerators.create(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, seed);
        RestorableUniformRandomProvider rng2 = RandomGenerators.create(RandomGenerators.Algorithm.XO_SHI_RO_128_PP, seed);
        assertNotEquals(rng1.nextLong(), rng2.nextLong());
    }

    @Test
    void testCreateDefaultAlgorithm() {
        long seed = 54321L;
        RestorableUniformRandomProvider rng1 = RandomGenerators.create(seed);
        RestorableUniformRandomProvider rng2 = RandomGenerators.create(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, seed);
        for (int i = 0; i < 3; i++) {
            assertEquals(rng1.nextInt(), rng2.nextInt());
        }
    }

    @Test
    void testSaveAndRestoreState() {
        RestorableUniformRandomProvider rng = RandomGenerators.create(42L);
        rng.nextInt();
        RandomProviderState saved = rng.saveState();
        int c1 = rng.nextInt();
        int d1 = rng.nextInt();
        rng.restoreState(saved);
        assertEquals(c1, rng.nextInt(), "RNG should reproduce the same values after state restoration");
        assertEquals(d1, rng.nextInt(), "RNG should reproduce the same values after state restoration");
    }

    @Test
    void testFreshGeneratorsAreIndependentInstances() {
        assertNotSame(RandomGenerators.fresh(), RandomGenerators.fresh());
    }

    @Test
    void testShuffleLeavesInputUntouched() {
        Integer[] original = IntStream.range(0, 100).boxed().toArray(Integer[]::new);
        Integer[] shuffled = RandomGenerators.shuffle(original, RandomGenerators.create(101L));

        assertThat(shuffled).containsExactlyInAnyOrder(original);
        assertThat(shuffled).isNotEqualTo(original);
        assertEquals(0, original[0]);
        assertEquals(99, original[99]);

        // Multiple shuffles with same seed should be identical
        assertArrayEquals(
            RandomGenerators.shuffle(original, RandomGenerators.create(202L)),
            RandomGenerators.shuffle(original, RandomGenerators.create(202L)));
    }

    @Test
    void testIntShuffleWithSeed() {
        int[] original = IntStream.range(0, 50).toArray();
        int[] first = RandomGenerators.shuffle(original, RandomGenerators.create(7L));
        int[] second = RandomGenerators.shuffle(original, RandomGenerators.create(7L));
        assertArrayEquals(first, second);
        assertThat(first).containsExactlyInAnyOrder(original);
        assertArrayEquals(IntStream.range(0, 50).toArray(), original);
    }

    @Test
    void testShufflePlacesEachElementUniformly() {
        // Position of element 0 after many shuffles of a 5-element array
        int size = 5;
        int trials = 10_000;
        long[] observed = new long[size];
        UniformRandomProvider rng = RandomGenerators.create(303L);
        Integer[] values = {0, 1, 2, 3, 4};
        for (int t = 0; t < trials; t++) {
            Integer[] shuffled = RandomGenerators.shuffle(values, rng);
            for (int i = 0; i < size; i++) {
                if (shuffled[i] == 0) {
                    observed[i]++;
                }
            }
        }
        double[] expected = new double[size];
        Arrays.fill(expected, trials / (double) size);
        double pValue = new ChiSquareTest().chiSquareTest(expected, observed);
        assertThat(pValue).isGreaterThan(0.001);
    }

    @Test
    void testSample() {
        String[] items = {"A", "B", "C", "D", "E"};
        String[] sample = RandomGenerators.sample(items, 3, RandomGenerators.create(789L));
        assertEquals(3, sample.length);
        assertThat(items).contains(sample);
        assertThat(sample).doesNotHaveDuplicates();

        assertThat(RandomGenerators.sample(items, 9, RandomGenerators.create(1L))).containsExactlyInAnyOrder(items);
        assertEquals(0, RandomGenerators.sample(items, 0, RandomGenerators.create(1L)).length);
        assertThrows(IllegalArgumentException.class, () -> RandomGenerators.sample(items, -1, RandomGenerators.create(1L)));
    }
}
