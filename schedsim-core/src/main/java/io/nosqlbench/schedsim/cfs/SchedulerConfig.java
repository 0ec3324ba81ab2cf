package io.nosqlbench.schedsim.cfs;

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

import io.nosqlbench.schedsim.errors.InvalidConfigurationException;

/// Tuning for one [CfsScheduler].
///
/// @param targetLatency the period within which every runnable process should get a turn
/// @param minGranularity the floor on any timeslice
/// @param arrivalPlacement how processes admitted mid-run are seeded with virtual runtime
public record SchedulerConfig(
    long targetLatency,
    long minGranularity,
    ArrivalPlacement arrivalPlacement
) {
    /// Default scheduling period, in time units.
    public static final long DEFAULT_TARGET_LATENCY = 20L;

    /// Default minimum timeslice, in time units.
    public static final long DEFAULT_MIN_GRANULARITY = 1L;

    /// Largest target latency whose slice product with the heaviest weight fits in a long.
    public static final long MAX_TARGET_LATENCY = Long.MAX_VALUE / WeightTable.weightOf(WeightTable.MIN_NICE);

    public SchedulerConfig {
        if (targetLatency <= 0) {
            throw new InvalidConfigurationException("Target latency must be positive, was " + targetLatency);
        }
        if (targetLatency > MAX_TARGET_LATENCY) {
            throw new InvalidConfigurationException("Target latency cannot exceed " + MAX_TARGET_LATENCY + ", was " + targetLatency);
        }
        if (minGranularity <= 0) {
            throw new InvalidConfigurationException("Minimum granularity must be positive, was " + minGranularity);
        }
        if (arrivalPlacement == null) {
            throw new InvalidConfigurationException("Arrival placement is required");
        }
    }

    /// @param targetLatency the scheduling period
    /// @param minGranularity the minimum timeslice
    public SchedulerConfig(long targetLatency, long minGranularity) {
        this(targetLatency, minGranularity, ArrivalPlacement.QUEUE_MINIMUM);
    }

    /// @return a target latency of 20, minimum granularity of 1, with arrivals placed at the queue minimum
    public static SchedulerConfig defaults() {
        return new SchedulerConfig(DEFAULT_TARGET_LATENCY, DEFAULT_MIN_GRANULARITY);
    }

    public SchedulerConfig withTargetLatency(long targetLatency) {
        return new SchedulerConfig(targetLatency, minGranularity, arrivalPlacement);
    }

    public SchedulerConfig withMinGranularity(long minGranularity) {
        return new SchedulerConfig(targetLatency, minGranularity, arrivalPlacement);
    }

    public SchedulerConfig withArrivalPlacement(ArrivalPlacement arrivalPlacement) {
        return new SchedulerConfig(targetLatency, minGranularity, arrivalPlacement);
    }
}
