package io.nosqlbench.schedsim.commands.common;

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

import io.nosqlbench.schedsim.workload.RandomGenerators;
import io.nosqlbench.schedsim.workload.Workload;
import io.nosqlbench.schedsim.workload.WorkloadFile;
import io.nosqlbench.schedsim.workload.WorkloadGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Mixin selecting the workload to simulate: either a JSON workload file, or a random
 * workload drawn from the generator options.
 */
public class WorkloadOption {
    private static final Logger logger = LogManager.getLogger(WorkloadOption.class);

    @CommandLine.Option(names = {"-w", "--workload"},
        description = "Workload JSON file; when absent a random workload is generated")
    private Path workloadPath;

    @CommandLine.Option(names = {"-n", "--count"},
        description = "Number of random processes to generate (default: ${DEFAULT-VALUE})",
        defaultValue = "" + WorkloadGenerator.DEFAULT_COUNT)
    private int count;

    @CommandLine.Option(names = {"-s", "--seed"},
        description = "Random seed for generation (default: current time)")
    private Long seed;

    @CommandLine.Option(names = {"--max-arrival"},
        description = "Largest random arrival time (default: ${DEFAULT-VALUE})",
        defaultValue = "" + WorkloadGenerator.DEFAULT_MAX_ARRIVAL)
    private long maxArrival;

    @CommandLine.Option(names = {"--max-burst"},
        description = "Largest random burst (default: ${DEFAULT-VALUE})",
        defaultValue = "" + WorkloadGenerator.DEFAULT_MAX_BURST)
    private long maxBurst;

    @CommandLine.Option(names = {"--min-nice"},
        description = "Lowest random nice value (default: ${DEFAULT-VALUE})",
        defaultValue = "" + WorkloadGenerator.DEFAULT_MIN_NICE)
    private int minNice;

    @CommandLine.Option(names = {"--max-nice"},
        description = "Highest random nice value (default: ${DEFAULT-VALUE})",
        defaultValue = "" + WorkloadGenerator.DEFAULT_MAX_NICE)
    private int maxNice;

    @CommandLine.Option(names = {"--prng"},
        description = "PRNG algorithm to use (${COMPLETION-CANDIDATES})",
        defaultValue = "XO_SHI_RO_256_PP")
    private RandomGenerators.Algorithm algorithm;

    /**
     * Loads the workload file if one was given, otherwise generates a workload.
     *
     * @return the validated workload
     * @throws IOException if the workload file cannot be read
     */
    public Workload resolve() throws IOException {
        if (workloadPath != null) {
            logger.debug("loading workload from {}", workloadPath);
            return WorkloadFile.load(workloadPath.normalize());
        }
        long effectiveSeed = getSeed();
        logger.info("generating {} processes with seed {}", count, effectiveSeed);
        return generator(effectiveSeed).generate();
    }

    /**
     * @param effectiveSeed the seed to generate with
     * @return a generator configured from these options
     */
    public WorkloadGenerator generator(long effectiveSeed) {
        return WorkloadGenerator.builder()
            .count(count)
            .seed(effectiveSeed)
            .maxArrival(maxArrival)
            .maxBurst(maxBurst)
            .niceRange(minNice, maxNice)
            .algorithm(algorithm)
            .build();
    }

    /**
     * @return the explicit seed, or one derived from the current time
     */
    public long getSeed() {
        if (seed == null) {
            seed = System.nanoTime() ^ System.currentTimeMillis();
        }
        return seed;
    }

    public Path getWorkloadPath() {
        return workloadPath;
    }

    @Override
    public String toString() {
        return workloadPath != null ? workloadPath.toString() : "random(count=" + count + ", seed=" + seed + ")";
    }
}
