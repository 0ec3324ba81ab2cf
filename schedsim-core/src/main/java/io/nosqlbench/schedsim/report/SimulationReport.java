package io.nosqlbench.schedsim.report;

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

import io.nosqlbench.schedsim.events.SchedulingEvent;
import io.nosqlbench.schedsim.workload.ProcessDescriptor;
import io.nosqlbench.schedsim.workload.Workload;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-process and aggregate statistics of a completed run.
 *
 * <p>Waiting and turnaround times are derived from the timeline rather than tracked
 * while scheduling: a process completes when its last grant ends, its turnaround is
 * completion minus arrival, and its waiting time is turnaround minus burst.</p>
 */
public class SimulationReport {

    private final String algorithm;
    private final List<ProcessOutcome> outcomes;
    private final long makespan;
    private final int contextSwitches;
    private final long busyTime;

    private SimulationReport(String algorithm, List<ProcessOutcome> outcomes, long makespan,
                             int contextSwitches, long busyTime) {
        this.algorithm = algorithm;
        this.outcomes = outcomes;
        this.makespan = makespan;
        this.contextSwitches = contextSwitches;
        this.busyTime = busyTime;
    }

    /**
     * @param algorithm the name of the policy that produced the events
     * @param workload the workload that was scheduled
     * @param events the complete timeline
     * @return the report
     * @throws IllegalArgumentException if the events do not complete every process of the workload
     */
    public static SimulationReport of(String algorithm, Workload workload, List<SchedulingEvent> events) {
        Map<Integer, long[]> firstAndLast = new HashMap<>();
        Map<Integer, Long> granted = new HashMap<>();
        Map<Integer, Integer> turns = new HashMap<>();
        int switches = 0;
        long busy = 0;
        long makespan = 0;
        SchedulingEvent previous = null;

        for (SchedulingEvent event : events) {
            long[] span = firstAndLast.computeIfAbsent(event.pid(), p -> new long[]{event.startTime(), event.endTime()});
            span[1] = event.endTime();
            granted.merge(event.pid(), event.granted(), Long::sum);
            turns.merge(event.pid(), 1, Integer::sum);
            busy += event.granted();
            makespan = Math.max(makespan, event.endTime());
            if (previous != null && previous.pid() != event.pid()) {
                switches++;
            }
            previous = event;
        }

        List<ProcessOutcome> outcomes = new ArrayList<>(workload.size());
        for (ProcessDescriptor descriptor : workload.processes()) {
            long[] span = firstAndLast.get(descriptor.pid());
            long ran = granted.getOrDefault(descriptor.pid(), 0L);
            if (span == null || ran != descriptor.burst()) {
                throw new IllegalArgumentException("pid " + descriptor.pid() + " ran " + ran
                    + " of its burst " + descriptor.burst() + "; a report needs a completed run");
            }
            outcomes.add(new ProcessOutcome(descriptor.pid(), descriptor.nice(), descriptor.arrivalTime(),
                descriptor.burst(), span[0], span[1], turns.get(descriptor.pid())));
        }
        return new SimulationReport(algorithm, Collections.unmodifiableList(outcomes), makespan, switches, busy);
    }

    public String getAlgorithm() {
        return algorithm;
    }

    /**
     * @return one outcome per process, in admission order
     */
    public List<ProcessOutcome> getOutcomes() {
        return outcomes;
    }

    /**
     * @return the time the last process completed
     */
    public long getMakespan() {
        return makespan;
    }

    /**
     * @return the number of adjacent dispatches that changed process
     */
    public int getContextSwitches() {
        return contextSwitches;
    }

    /**
     * @return the total time granted, which equals the sum of all bursts
     */
    public long getBusyTime() {
        return busyTime;
    }

    public double getAverageWaitingTime() {
        return new Mean().evaluate(waitingTimes());
    }

    public double getAverageTurnaroundTime() {
        double[] values = new double[outcomes.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = outcomes.get(i).turnaroundTime();
        }
        return new Mean().evaluate(values);
    }

    public double getAverageResponseTime() {
        double[] values = new double[outcomes.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = outcomes.get(i).responseTime();
        }
        return new Mean().evaluate(values);
    }

    /**
     * @return the population standard deviation of waiting times
     */
    public double getWaitingTimeStdDev() {
        return new StandardDeviation(false).evaluate(waitingTimes());
    }

    private double[] waitingTimes() {
        double[] values = new double[outcomes.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = outcomes.get(i).waitingTime();
        }
        return values;
    }

    @Override
    public String toString() {
        return String.format("%s: %d processes, makespan=%d, avgWait=%.3f, avgTurnaround=%.3f, waitStdDev=%.3f",
            algorithm, outcomes.size(), makespan, getAverageWaitingTime(), getAverageTurnaroundTime(),
            getWaitingTimeStdDev());
    }
}
