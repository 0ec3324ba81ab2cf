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

/// Simulated time of one scheduler instance. It never runs backwards and has no
/// relation to wall-clock time.
public class SimClock {

    private long now;

    public SimClock() {
        this(0L);
    }

    /// @param start initial time, must not be negative
    public SimClock(long start) {
        if (start < 0) {
            throw new IllegalArgumentException("Clock cannot start at a negative time");
        }
        this.now = start;
    }

    /// @return the current simulated time
    public long now() {
        return now;
    }

    /// Advances the clock by a granted amount of time.
    ///
    /// @param delta non-negative number of time units
    /// @return the new time
    public long advance(long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("Clock cannot advance by a negative amount: " + delta);
        }
        now = Math.addExact(now, delta);
        return now;
    }

    /// Jumps forward to a later time, used when the run queue is idle until the next arrival.
    ///
    /// @param time a time not earlier than now
    /// @return the new time
    public long advanceTo(long time) {
        if (time < now) {
            throw new IllegalArgumentException("Clock cannot move backwards from " + now + " to " + time);
        }
        now = time;
        return now;
    }

    @Override
    public String toString() {
        return "SimClock[now=" + now + "]";
    }
}
