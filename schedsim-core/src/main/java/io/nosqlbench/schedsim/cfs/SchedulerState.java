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

/// Lifecycle of a [CfsScheduler].
public enum SchedulerState {
    /// No decision has dispatched a process yet, or the last decision only moved the
    /// clock forward to the next arrival.
    IDLE,
    /// The last decision granted time to a process and work remains.
    RUNNING,
    /// Every process has finished and no arrivals remain. Terminal.
    FINISHED
}
