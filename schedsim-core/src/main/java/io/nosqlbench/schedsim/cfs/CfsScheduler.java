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

import io.nosqlbench.schedsim.events.EventLog;
import io.nosqlbench.schedsim.events.SchedulingEvent;
import io.nosqlbench.schedsim.workload.ProcessDescriptor;
import io.nosqlbench.schedsim.workload.Workload;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/// Single-core Completely Fair Scheduler simulation.
///
/// Each call to [#step()] makes one scheduling decision:
///
/// 1. Admit every process whose arrival time has been reached.
/// 2. If nothing is runnable and nothing is still to arrive, the run is [SchedulerState#FINISHED].
/// 3. If nothing is runnable but arrivals remain, jump the clock to the next arrival
///    ([SchedulerState#IDLE]); the next step dispatches.
/// 4. Otherwise pop the process with least `(vruntime, pid)` and grant it
///    `min(max(targetLatency * weight / totalWeight, minGranularity), remainingBurst)`,
///    where `totalWeight` covers every runnable process including the one selected.
/// 5. Advance the clock by the grant and charge `granted * NICE_0_WEIGHT / weight`
///    of virtual runtime, so heavier processes accrue virtual runtime more slowly.
/// 6. Record a [SchedulingEvent], requeue the process if it still has work, and admit
///    the arrivals that occurred during the grant.
///
/// A decision is never interleaved with anything else. The run* methods evaluate their
/// stop conditions only between decisions.
///
/// Instances are single-threaded and own their run queue, clock and event log, so
/// independent simulations can run side by side.
public class CfsScheduler {
    private static final Logger logger = LogManager.getLogger(CfsScheduler.class);

    private final SchedulerConfig config;
    private final RunQueue runQueue = new RunQueue();
    private final SimClock clock = new SimClock();
    private final EventLog eventLog;
    private final Deque<SchedProcess> pendingArrivals = new ArrayDeque<>();
    private final Map<Integer, SchedProcess> processes = new LinkedHashMap<>();

    private SchedulerState state = SchedulerState.IDLE;
    private long dispatchCount;

    /// @param workload the validated processes to schedule
    /// @param config scheduler tuning
    public CfsScheduler(Workload workload, SchedulerConfig config) {
        this(workload, config, new EventLog());
    }

    /// @param workload the validated processes to schedule
    /// @param config scheduler tuning
    /// @param eventLog where decisions are recorded
    public CfsScheduler(Workload workload, SchedulerConfig config, EventLog eventLog) {
        this.config = config;
        this.eventLog = eventLog;
        for (ProcessDescriptor descriptor : workload.processes()) {
            SchedProcess process = new SchedProcess(descriptor);
            processes.put(process.getPid(), process);
            pendingArrivals.addLast(process);
        }
        admitArrivals();
    }

    /// Makes one scheduling decision.
    ///
    /// @return the dispatch that was recorded, or empty if this decision idled or the run is finished
    public Optional<SchedulingEvent> step() {
        if (state == SchedulerState.FINISHED) {
            return Optional.empty();
        }
        admitArrivals();
        if (runQueue.isEmpty()) {
            if (pendingArrivals.isEmpty()) {
                finish();
                return Optional.empty();
            }
            long nextArrival = pendingArrivals.peekFirst().getArrivalTime();
            logger.debug("t={} run queue idle until next arrival at t={}", clock.now(), nextArrival);
            clock.advanceTo(nextArrival);
            admitArrivals();
            state = SchedulerState.IDLE;
            return Optional.empty();
        }

        SchedProcess candidate = runQueue.popMin();
        long slice = timeslice(candidate);
        long granted = Math.min(slice, candidate.getRemainingBurst());

        long start = clock.now();
        double vruntimeBefore = candidate.getVruntime();
        clock.advance(granted);
        double vruntimeAfter = candidate.charge(granted);

        SchedulingEvent event = new SchedulingEvent(start, clock.now(), candidate.getPid(), vruntimeBefore, vruntimeAfter);
        eventLog.append(event);
        dispatchCount++;
        state = SchedulerState.RUNNING;
        logger.trace("t={} pid {} granted {} of slice {}, vruntime {} -> {}",
            start, candidate.getPid(), granted, slice, vruntimeBefore, vruntimeAfter);

        if (candidate.isFinished()) {
            logger.debug("t={} pid {} retired", clock.now(), candidate.getPid());
        } else {
            runQueue.insert(candidate);
        }
        admitArrivals();

        if (runQueue.isEmpty() && pendingArrivals.isEmpty()) {
            finish();
        }
        return Optional.of(event);
    }

    /// Runs decisions until the run finishes or the stop predicate holds. The predicate
    /// is tested before every decision.
    ///
    /// @param stop checked between decisions
    /// @return the final state
    public SchedulerState runUntil(Predicate<CfsScheduler> stop) {
        while (state != SchedulerState.FINISHED && !stop.test(this)) {
            step();
        }
        return state;
    }

    /// @return the final state, always [SchedulerState#FINISHED]
    public SchedulerState runToCompletion() {
        return runUntil(s -> false);
    }

    /// Runs until at least `ticks` time units have elapsed from now. The last decision
    /// may overshoot, since decisions are never cut short.
    ///
    /// @param ticks simulated time to run for
    /// @return the state after the last decision
    public SchedulerState runFor(long ticks) {
        if (ticks < 0) {
            throw new IllegalArgumentException("Cannot run for a negative number of ticks: " + ticks);
        }
        long deadline = Math.addExact(clock.now(), ticks);
        return runUntil(s -> s.now() >= deadline);
    }

    /// Runs until `count` more processes have been dispatched.
    ///
    /// @param count number of dispatches
    /// @return the state after the last decision
    public SchedulerState runDecisions(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Cannot run a negative number of decisions: " + count);
        }
        long target = dispatchCount + count;
        return runUntil(s -> s.getDispatchCount() >= target);
    }

    private long timeslice(SchedProcess candidate) {
        long totalWeight = runQueue.totalWeight() + candidate.getWeight();
        long ideal = Math.multiplyExact(config.targetLatency(), (long) candidate.getWeight()) / totalWeight;
        return Math.max(ideal, config.minGranularity());
    }

    private void admitArrivals() {
        while (!pendingArrivals.isEmpty() && pendingArrivals.peekFirst().getArrivalTime() <= clock.now()) {
            SchedProcess arrival = pendingArrivals.pollFirst();
            double seed = config.arrivalPlacement() == ArrivalPlacement.QUEUE_MINIMUM ? runQueue.minVruntime() : 0.0d;
            arrival.setVruntime(seed);
            runQueue.insert(arrival);
            logger.debug("t={} admitted pid {} (nice {}, weight {}) at vruntime {}",
                clock.now(), arrival.getPid(), arrival.getNice(), arrival.getWeight(), seed);
        }
    }

    private void finish() {
        state = SchedulerState.FINISHED;
        eventLog.finish(clock.now());
        logger.info("finished {} processes with {} dispatches at t={}", processes.size(), dispatchCount, clock.now());
    }

    /// @return the current simulated time
    public long now() {
        return clock.now();
    }

    public SchedulerState getState() {
        return state;
    }

    public boolean isFinished() {
        return state == SchedulerState.FINISHED;
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    public EventLog getEventLog() {
        return eventLog;
    }

    /// @return the number of processes granted time so far
    public long getDispatchCount() {
        return dispatchCount;
    }

    /// @return the number of queued processes, excluding those not yet arrived
    public int getRunnableCount() {
        return runQueue.size();
    }

    /// @return the number of processes that have not arrived yet
    public int getPendingArrivalCount() {
        return pendingArrivals.size();
    }

    /// @return the least virtual runtime in the run queue, or 0 if it is empty
    public double getMinVruntime() {
        return runQueue.minVruntime();
    }

    /// @param pid a process id from the workload
    /// @return its scheduling state, queued, pending or retired
    public SchedProcess getProcess(int pid) {
        SchedProcess process = processes.get(pid);
        if (process == null) {
            throw new IllegalArgumentException("No process with pid " + pid);
        }
        return process;
    }

    /// @return every process of the workload, in admission order
    public Collection<SchedProcess> getProcesses() {
        return Collections.unmodifiableCollection(processes.values());
    }
}
