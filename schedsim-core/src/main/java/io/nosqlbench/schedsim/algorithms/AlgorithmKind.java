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

import io.nosqlbench.schedsim.cfs.SchedulerConfig;

/// Selectable scheduling policies, as named on the command line.
public enum AlgorithmKind {
    CFS,
    FCFS,
    SRTF,
    PRIORITY,
    RR;

    /// @param config tuning used by [#CFS]
    /// @param quantum preemption interval used by [#SRTF], [#PRIORITY] and [#RR]
    /// @return a new instance of this policy
    public SchedulingAlgorithm create(SchedulerConfig config, long quantum) {
        switch (this) {
            case CFS:
                return new CfsAlgorithm(config);
            case FCFS:
                return new FcfsAlgorithm();
            case SRTF:
                return new SrtfAlgorithm(quantum);
            case PRIORITY:
                return new PriorityAlgorithm(quantum);
            case RR:
                return new RoundRobinAlgorithm(quantum);
            default:
                throw new IllegalStateException("Unhandled algorithm " + this);
        }
    }
}
