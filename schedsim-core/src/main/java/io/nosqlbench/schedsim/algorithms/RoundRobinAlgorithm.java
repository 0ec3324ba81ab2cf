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

import java.util.ArrayDeque;
import java.util.Queue;

/// Preemptive round robin over a FIFO ready queue.
public class RoundRobinAlgorithm extends QuantumAlgorithm {

    public RoundRobinAlgorithm(long quantum) {
        super(quantum);
    }

    @Override
    public String getName() {
        return "RR";
    }

    @Override
    protected Queue<ReadyTask> newReadyQueue() {
        return new ArrayDeque<>();
    }
}
