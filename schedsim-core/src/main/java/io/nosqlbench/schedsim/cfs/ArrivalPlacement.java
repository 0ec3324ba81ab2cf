package io.nosqlbench.schedsim.cfs;

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

/// How a process admitted after the run has started is seeded with virtual runtime.
public enum ArrivalPlacement {

    /// Start at the current run queue minimum, or 0 if the queue is empty. A late
    /// arrival then competes evenly with the processes already running instead of
    /// monopolizing the CPU until it catches up.
    QUEUE_MINIMUM,

    /// Always start at 0.
    ZERO
}
