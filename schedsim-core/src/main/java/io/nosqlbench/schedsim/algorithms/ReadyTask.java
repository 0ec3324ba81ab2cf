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

import io.nosqlbench.schedsim.workload.ProcessDescriptor;

/// Mutable run state of a process under one of the baseline algorithms.
final class ReadyTask {

    final ProcessDescriptor descriptor;
    long remaining;

    ReadyTask(ProcessDescriptor descriptor) {
        this.descriptor = descriptor;
        this.remaining = descriptor.burst();
    }

    int pid() {
        return descriptor.pid();
    }

    int nice() {
        return descriptor.nice();
    }

    long arrivalTime() {
        return descriptor.arrivalTime();
    }
}
