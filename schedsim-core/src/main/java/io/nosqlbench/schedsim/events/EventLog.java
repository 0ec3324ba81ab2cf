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

import io.nosqlbench.schedsim.errors.SchedulerInvariantException;
import io.nosqlbench.schedsim.errors.SchedulerInvariantException.Violation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Append-only record of scheduling decisions for a single-core timeline.
///
/// Every appended event must start no earlier than the previous event ended;
/// events therefore never overlap and are strictly ordered by start time (zero-length
/// grants are not produced by the schedulers). Ordering is checked against the last
/// event ever appended, so draining does not reset it.
///
/// Appended events are forwarded to the registered [SchedulingEventSink]s.
public class EventLog {

    private final List<SchedulingEvent> events = new ArrayList<>();
    private final List<SchedulingEventSink> sinks;
    private SchedulingEvent last;

    public EventLog() {
        this(List.of());
    }

    /// @param sinks observers notified of every appended event
    public EventLog(List<SchedulingEventSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    /// Records an event.
    ///
    /// @param event the next event on the timeline
    /// @throws SchedulerInvariantException with [Violation#EVENT_ORDER] if it overlaps the previous event
    public void append(SchedulingEvent event) {
        if (last != null && event.startTime() < last.endTime()) {
            throw new SchedulerInvariantException(Violation.EVENT_ORDER,
                "event " + event + " starts before the previous event ended at " + last.endTime());
        }
        events.add(event);
        last = event;
        for (SchedulingEventSink sink : sinks) {
            sink.eventRecorded(event);
        }
    }

    /// Notifies the sinks that the producing simulation has finished.
    ///
    /// @param finishTime the final simulated time
    public void finish(long finishTime) {
        for (SchedulingEventSink sink : sinks) {
            sink.simulationFinished(finishTime);
        }
    }

    /// Removes and returns every event recorded since the last drain.
    ///
    /// @return the events in timeline order
    public List<SchedulingEvent> drain() {
        List<SchedulingEvent> drained = List.copyOf(events);
        events.clear();
        return drained;
    }

    /// @return the undrained events in timeline order, without consuming them
    public List<SchedulingEvent> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    /// @return the number of undrained events
    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
