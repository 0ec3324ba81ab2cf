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

import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.Queue;

/// Preemptive static priority: the lowest nice value runs first. Ties go to the
/// earlier arrival, then the lower pid.
public class PriorityAlgorithm extends QuantumAlgorithm {

    private static final Comparator<ReadyTask> ORDER = Comparator
        .comparingInt(ReadyTask::nice)
        .thenComparingLong(ReadyTask::arrivalTime)
        .thenComparingInt(ReadyTask::pid);

    public PriorityAlgorithm(long quantum) {
        super(quantum);
    }

    @Override
    public String getName() {
        return "PRIORITY";
    }

    @Override
    protected Queue<ReadyTask> newReadyQueue() {
        return new PriorityQueue<>(ORDER);
    }
}
