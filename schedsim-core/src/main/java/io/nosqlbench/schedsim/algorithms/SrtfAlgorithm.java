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

/// Preemptive shortest job first (shortest remaining time first). Ties go to the
/// earlier arrival, then the lower pid.
public class SrtfAlgorithm extends QuantumAlgorithm {

    private static final Comparator<ReadyTask> ORDER = Comparator
        .comparingLong((ReadyTask t) -> t.remaining)
        .thenComparingLong(ReadyTask::arrivalTime)
        .thenComparingInt(ReadyTask::pid);

    public SrtfAlgorithm(long quantum) {
        super(quantum);
    }

    @Override
    public String getName() {
        return "SRTF";
    }

    @Override
    protected Queue<ReadyTask> newReadyQueue() {
        return new PriorityQueue<>(ORDER);
    }
}
