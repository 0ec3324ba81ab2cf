package io.nosqlbench.schedsim.workload;

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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Seeded random number generators for workload generation, based on Apache Commons RNG.
 * The same algorithm and seed always yield the same sequence, which keeps generated
 * workloads reproducible.
 */
public final class RandomGenerators {

    /**
     * Available PRNG algorithms.
     */
    public enum Algorithm {
        /**
         * XorShiro256++ algorithm, 256-bit state. The default.
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * XorShiro128++ algorithm, 128-bit state.
         */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),

        /**
         * SplitMix64 algorithm, 64-bit state.
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister, 19937-bit state.
         */
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * @param algorithm the PRNG algorithm to use
     * @param seed the seed for deterministic generation
     * @return a uniform random provider
     */
    public static UniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /**
     * @param seed the seed for deterministic generation
     * @return a {@link Algorithm#XO_SHI_RO_256_PP} provider
     */
    public static UniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * @param rng the generator
     * @param min lower bound, inclusive
     * @param max upper bound, inclusive
     * @return a uniformly distributed value in [min, max]
     */
    public static long nextLongInclusive(UniformRandomProvider rng, long min, long max) {
        if (max < min) {
            throw new IllegalArgumentException("Upper bound " + max + " is below lower bound " + min);
        }
        return min + rng.nextLong(max - min + 1);
    }

    /**
     * @param rng the generator
     * @param min lower bound, inclusive
     * @param max upper bound, inclusive
     * @return a uniformly distributed value in [min, max]
     */
    public static int nextIntInclusive(UniformRandomProvider rng, int min, int max) {
        return (int) nextLongInclusive(rng, min, max);
    }
}
