package io.nosqlbench.schedsim.report;

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

/// How one process fared over a complete run.
///
/// @param pid the process
/// @param nice its nice value
/// @param arrivalTime when it became runnable
/// @param burst its total demand
/// @param firstStart when it was first dispatched
/// @param completionTime when its last grant ended
/// @param turns how many times it was dispatched
public record ProcessOutcome(
    int pid,
    int nice,
    long arrivalTime,
    long burst,
    long firstStart,
    long completionTime,
    int turns
) {
    /// @return completion time minus arrival time
    public long turnaroundTime() {
        return completionTime - arrivalTime;
    }

    /// @return time spent runnable but not running
    public long waitingTime() {
        return turnaroundTime() - burst;
    }

    /// @return delay from arrival to first dispatch
    public long responseTime() {
        return firstStart - arrivalTime;
    }

    /// @return mean grant length
    public double averageSlice() {
        return (double) burst / turns;
    }
}
