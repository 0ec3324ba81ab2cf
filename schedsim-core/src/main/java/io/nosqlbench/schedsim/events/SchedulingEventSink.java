package io.nosqlbench.schedsim.events;

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
 * Receives scheduling events as they are appended to an {@link EventLog}.
 *
 * <p>Sinks observe the timeline while a simulation runs; the log itself remains the
 * authoritative record. A sink is called on the simulation thread, in event order,
 * and must not throw.</p>
 *
 * @see LoggerEventSink
 * @see NoopEventSink
 */
public interface SchedulingEventSink {

    /**
     * Called once per appended event.
     *
     * @param event the event just recorded
     */
    void eventRecorded(SchedulingEvent event);

    /**
     * Called when the producing simulation has nothing left to schedule.
     *
     * @param finishTime the simulated time the last event ended
     */
    default void simulationFinished(long finishTime) {
        // No-op by default
    }
}
