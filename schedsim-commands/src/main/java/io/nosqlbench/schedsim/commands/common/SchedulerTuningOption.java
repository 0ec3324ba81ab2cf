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

import io.nosqlbench.schedsim.cfs.ArrivalPlacement;
import io.nosqlbench.schedsim.cfs.SchedulerConfig;
import picocli.CommandLine;

/**
 * Mixin for the tuning shared by every scheduling command.
 */
public class SchedulerTuningOption {

    @CommandLine.Option(names = {"-l", "--target-latency"},
        description = "CFS scheduling period (default: ${DEFAULT-VALUE})",
        defaultValue = "" + SchedulerConfig.DEFAULT_TARGET_LATENCY)
    private long targetLatency;

    @CommandLine.Option(names = {"-g", "--min-granularity"},
        description = "CFS minimum timeslice (default: ${DEFAULT-VALUE})",
        defaultValue = "" + SchedulerConfig.DEFAULT_MIN_GRANULARITY)
    private long minGranularity;

    @CommandLine.Option(names = {"--arrival-placement"},
        description = "Initial vruntime of late arrivals (${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE})",
        defaultValue = "QUEUE_MINIMUM")
    private ArrivalPlacement arrivalPlacement;

    @CommandLine.Option(names = {"-q", "--quantum"},
        description = "Preemption quantum of the SRTF, PRIORITY and RR baselines (default: ${DEFAULT-VALUE})",
        defaultValue = "20")
    private long quantum;

    /**
     * @return the validated CFS configuration
     */
    public SchedulerConfig toConfig() {
        return new SchedulerConfig(targetLatency, minGranularity, arrivalPlacement);
    }

    public long getQuantum() {
        return quantum;
    }
}
