package io.nosqlbench.schedsim;

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

import io.nosqlbench.schedsim.cfs.CfsScheduler;
import io.nosqlbench.schedsim.cfs.SchedulerConfig;
import io.nosqlbench.schedsim.events.EventLog;
import io.nosqlbench.schedsim.events.SchedulingEvent;
import io.nosqlbench.schedsim.errors.InvalidConfigurationException;
import io.nosqlbench.schedsim.workload.ProcessDescriptor;
import io.nosqlbench.schedsim.workload.Workload;

import java.util.List;

/// Entry points that run a complete CFS simulation and return its trace.
///
/// All input is validated before the first decision, and the result depends only on
/// the input, so two runs over equal input produce equal traces.
public final class Simulation {

    private Simulation() {
    }

    /// @param processes the processes to schedule
    /// @param targetLatency the scheduling period
    /// @param minGranularity the minimum timeslice
    /// @return every dispatch in timeline order
    /// @throws InvalidConfigurationException if any process or setting is invalid
    public static List<SchedulingEvent> run(List<ProcessDescriptor> processes, long targetLatency, long minGranularity) {
        return run(Workload.of(processes), new SchedulerConfig(targetLatency, minGranularity));
    }

    /// @param workload the processes to schedule
    /// @param config scheduler tuning
    /// @return every dispatch in timeline order
    public static List<SchedulingEvent> run(Workload workload, SchedulerConfig config) {
        return run(workload, config, new EventLog());
    }

    /// @param workload the processes to schedule
    /// @param config scheduler tuning
    /// @param eventLog the log to record into, for callers that attach sinks
    /// @return every dispatch in timeline order
    public static List<SchedulingEvent> run(Workload workload, SchedulerConfig config, EventLog eventLog) {
        CfsScheduler scheduler = new CfsScheduler(workload, config, eventLog);
        scheduler.runToCompletion();
        return eventLog.drain();
    }
}
