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

import io.nosqlbench.schedsim.cfs.WeightTable;
import io.nosqlbench.schedsim.errors.InvalidConfigurationException;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Builds random workloads: pids 1..count, each with a uniformly drawn arrival time,
/// burst and nice value. The same settings and seed always produce the same workload.
///
/// ```
/// Workload w = WorkloadGenerator.builder().count(50).seed(42L).maxBurst(500).build().generate();
/// ```
public class WorkloadGenerator {
    private static final Logger logger = LogManager.getLogger(WorkloadGenerator.class);

    /// Default number of processes.
    public static final int DEFAULT_COUNT = 10;
    /// Default upper bound on arrival times.
    public static final long DEFAULT_MAX_ARRIVAL = 200L;
    /// Default upper bound on bursts.
    public static final long DEFAULT_MAX_BURST = 500L;
    /// Default lowest nice value drawn.
    public static final int DEFAULT_MIN_NICE = 1;
    /// Default highest nice value drawn.
    public static final int DEFAULT_MAX_NICE = 10;

    private final int count;
    private final long seed;
    private final long maxArrival;
    private final long maxBurst;
    private final int minNice;
    private final int maxNice;
    private final RandomGenerators.Algorithm algorithm;

    private WorkloadGenerator(Builder builder) {
        this.count = builder.count;
        this.seed = builder.seed;
        this.maxArrival = builder.maxArrival;
        this.maxBurst = builder.maxBurst;
        this.minNice = builder.minNice;
        this.maxNice = builder.maxNice;
        this.algorithm = builder.algorithm;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return a new workload drawn from this generator's settings
    public Workload generate() {
        UniformRandomProvider rng = RandomGenerators.create(algorithm, seed);
        List<ProcessDescriptor> descriptors = new ArrayList<>(count);
        for (int pid = 1; pid <= count; pid++) {
            long arrival = RandomGenerators.nextLongInclusive(rng, 0L, maxArrival);
            long burst = RandomGenerators.nextLongInclusive(rng, 1L, maxBurst);
            int nice = RandomGenerators.nextIntInclusive(rng, minNice, maxNice);
            descriptors.add(new ProcessDescriptor(pid, nice, burst, arrival));
        }
        logger.debug("generated {} processes with seed {} ({})", count, seed, algorithm);
        return Workload.of(descriptors);
    }

    public int getCount() {
        return count;
    }

    public long getSeed() {
        return seed;
    }

    /// Settings for a [WorkloadGenerator]. Every setting has a default: 10 processes, seed 0,
    /// arrivals up to 200, bursts up to 500 and nice values 1..10.
    public static class Builder {
        private int count = DEFAULT_COUNT;
        private long seed = 0L;
        private long maxArrival = DEFAULT_MAX_ARRIVAL;
        private long maxBurst = DEFAULT_MAX_BURST;
        private int minNice = DEFAULT_MIN_NICE;
        private int maxNice = DEFAULT_MAX_NICE;
        private RandomGenerators.Algorithm algorithm = RandomGenerators.Algorithm.XO_SHI_RO_256_PP;

        public Builder count(int count) {
            this.count = count;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder maxArrival(long maxArrival) {
            this.maxArrival = maxArrival;
            return this;
        }

        public Builder maxBurst(long maxBurst) {
            this.maxBurst = maxBurst;
            return this;
        }

        public Builder niceRange(int minNice, int maxNice) {
            this.minNice = minNice;
            this.maxNice = maxNice;
            return this;
        }

        public Builder algorithm(RandomGenerators.Algorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        /// @return the generator
        /// @throws InvalidConfigurationException if any setting is out of range
        public WorkloadGenerator build() {
            if (count <= 0) {
                throw new InvalidConfigurationException("Process count must be positive, was " + count);
            }
            if (maxArrival < 0) {
                throw new InvalidConfigurationException("Maximum arrival time cannot be negative, was " + maxArrival);
            }
            if (maxBurst <= 0) {
                throw new InvalidConfigurationException("Maximum burst must be positive, was " + maxBurst);
            }
            if (!WeightTable.isValidNice(minNice) || !WeightTable.isValidNice(maxNice) || minNice > maxNice) {
                throw new InvalidConfigurationException("Invalid nice range [" + minNice + ", " + maxNice + "]");
            }
            if (algorithm == null) {
                throw new InvalidConfigurationException("PRNG algorithm is required");
            }
            return new WorkloadGenerator(this);
        }
    }
}
