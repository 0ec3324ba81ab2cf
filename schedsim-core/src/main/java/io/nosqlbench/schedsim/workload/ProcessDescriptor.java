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
import io.nosqlbench.schedsim.errors.NiceOutOfRangeException;

/// Static attributes of one process, as supplied by the caller.
///
/// @param pid identifier, unique within a workload
/// @param nice priority in [WeightTable#MIN_NICE, WeightTable#MAX_NICE]
/// @param burst total execution demand, positive
/// @param arrivalTime when the process becomes runnable, 0 meaning present at start
public record ProcessDescriptor(int pid, int nice, long burst, long arrivalTime) {

    public ProcessDescriptor {
        if (!WeightTable.isValidNice(nice)) {
            throw new NiceOutOfRangeException(nice, WeightTable.MIN_NICE, WeightTable.MAX_NICE);
        }
        if (burst <= 0) {
            throw new InvalidConfigurationException("Burst of pid " + pid + " must be positive, was " + burst);
        }
        if (arrivalTime < 0) {
            throw new InvalidConfigurationException("Arrival time of pid " + pid + " cannot be negative, was " + arrivalTime);
        }
    }

    /// Creates a descriptor for a process present at the start of the run.
    public ProcessDescriptor(int pid, int nice, long burst) {
        this(pid, nice, burst, 0L);
    }
}
