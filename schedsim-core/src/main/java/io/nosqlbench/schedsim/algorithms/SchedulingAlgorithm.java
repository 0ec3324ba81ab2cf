package io.nosqlbench.schedsim.algorithms;

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

import io.nosqlbench.schedsim.events.SchedulingEvent;
import io.nosqlbench.schedsim.workload.Workload;

import java.util.List;

/// A single-core scheduling policy that turns a workload into a timeline.
///
/// Implementations are deterministic and keep no state between calls, so one
/// instance may schedule any number of workloads.
public interface SchedulingAlgorithm {

    /// @return a short display name
    String getName();

    /// @param workload the processes to schedule
    /// @return every dispatch in timeline order
    List<SchedulingEvent> schedule(Workload workload);
}
