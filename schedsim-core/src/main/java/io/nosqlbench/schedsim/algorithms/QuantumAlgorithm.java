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

import io.nosqlbench.schedsim.errors.InvalidConfigurationException;

/// A baseline policy that re-evaluates its choice after every quantum.
public abstract class QuantumAlgorithm extends ReadyQueueAlgorithm {

    private final long quantum;

    /// @param quantum the longest uninterrupted run, positive
    protected QuantumAlgorithm(long quantum) {
        if (quantum <= 0) {
            throw new InvalidConfigurationException("Quantum must be positive, was " + quantum);
        }
        this.quantum = quantum;
    }

    @Override
    protected long grantFor(ReadyTask task) {
        return quantum;
    }

    public long getQuantum() {
        return quantum;
    }
}
