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

import io.nosqlbench.schedsim.Simulation;
import io.nosqlbench.schedsim.cfs.SchedulerConfig;
import io.nosqlbench.schedsim.events.SchedulingEvent;
import io.nosqlbench.schedsim.workload.Workload;

import java.util.List;

/// The Completely Fair Scheduler, run through [Simulation].
public class CfsAlgorithm implements SchedulingAlgorithm {

    private final SchedulerConfig config;

    public CfsAlgorithm(SchedulerConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "CFS";
    }

    @Override
    public List<SchedulingEvent> schedule(Workload workload) {
        return Simulation.run(workload, config);
    }

    public SchedulerConfig getConfig() {
        return config;
    }
}
