package io.nosqlbench.schedsim.errors;

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

/**
 * Signals that the scheduler used its own data structures incorrectly. These are
 * programming errors rather than input errors; a correctly validated workload can
 * never produce one, so callers are not expected to recover from them.
 */
public class SchedulerInvariantException extends IllegalStateException {

    /**
     * The invariant that was broken.
     */
    public enum Violation {
        /** A process id was inserted into the run queue while already present. */
        DUPLICATE_KEY,
        /** The run queue was read or popped while empty. */
        EMPTY_QUEUE,
        /** A process id was referenced that is not queued. */
        UNKNOWN_KEY,
        /** An event overlapped or preceded the previously recorded event. */
        EVENT_ORDER
    }

    private final Violation violation;

    public SchedulerInvariantException(Violation violation, String message) {
        super(violation + ": " + message);
        this.violation = violation;
    }

    public Violation getViolation() {
        return violation;
    }
}
