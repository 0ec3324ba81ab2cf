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

/// First come, first served: processes run to completion in arrival order.
public class FcfsAlgorithm extends ReadyQueueAlgorithm {

    @Override
    public String getName() {
        return "FCFS";
    }

    @Override
    protected Queue<ReadyTask> newReadyQueue() {
        return new ArrayDeque<>();
    }

    @Override
    protected long grantFor(ReadyTask task) {
        return task.remaining;
    }
}
