package io.nosqlbench.schedsim.events;

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

/// One scheduling decision: a process ran from startTime to endTime and its
/// virtual runtime moved from vruntimeBefore to vruntimeAfter.
///
/// Schedulers that do not account virtual runtime report both values as 0.
///
/// @param startTime simulated time the process was dispatched
/// @param endTime simulated time the process was switched out
/// @param pid the process that ran
/// @param vruntimeBefore virtual runtime at dispatch
/// @param vruntimeAfter virtual runtime after the grant was charged
public record SchedulingEvent(
    long startTime,
    long endTime,
    int pid,
    double vruntimeBefore,
    double vruntimeAfter
) {
    public SchedulingEvent {
        if (startTime < 0) {
            throw new IllegalArgumentException("Event start time cannot be negative");
        }
        if (endTime < startTime) {
            throw new IllegalArgumentException("Event cannot end (" + endTime + ") before it starts (" + startTime + ")");
        }
    }

    /// @return the time granted to the process
    public long granted() {
        return endTime - startTime;
    }

    @Override
    public String toString() {
        return String.format("SchedulingEvent[pid=%d, %d..%d, vruntime %.3f -> %.3f]",
            pid, startTime, endTime, vruntimeBefore, vruntimeAfter);
    }
}
