package io.nosqlbench.schedsim.commands.common;

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
import io.nosqlbench.schedsim.report.ProcessOutcome;
import io.nosqlbench.schedsim.report.SimulationReport;

import java.io.PrintStream;
import java.util.List;

/// Fixed-width text tables for traces and reports.
public final class ReportPrinter {

    private ReportPrinter() {
    }

    /// Prints one row per dispatch.
    ///
    /// @param out destination
    /// @param events the timeline
    public static void printTrace(PrintStream out, List<SchedulingEvent> events) {
        out.printf("%8s %10s %10s %8s %16s %16s%n", "PID", "START", "END", "RAN", "VRUNTIME_BEFORE", "VRUNTIME_AFTER");
        for (SchedulingEvent event : events) {
            out.printf("%8d %10d %10d %8d %16.3f %16.3f%n",
                event.pid(), event.startTime(), event.endTime(), event.granted(),
                event.vruntimeBefore(), event.vruntimeAfter());
        }
    }

    /// Prints one row per process followed by the averages.
    ///
    /// @param out destination
    /// @param report a completed run
    public static void printReport(PrintStream out, SimulationReport report) {
        out.printf("%n%s%n", report.getAlgorithm());
        out.printf("%8s %10s %10s %6s %6s %12s %12s %12s%n",
            "PID", "ARRIVAL", "BURST", "NICE", "TURNS", "WAITING", "TURNAROUND", "RESPONSE");
        for (ProcessOutcome outcome : report.getOutcomes()) {
            out.printf("%8d %10d %10d %6d %6d %12d %12d %12d%n",
                outcome.pid(), outcome.arrivalTime(), outcome.burst(), outcome.nice(), outcome.turns(),
                outcome.waitingTime(), outcome.turnaroundTime(), outcome.responseTime());
        }
        out.printf("%nAverage waiting time: %.3f%n", report.getAverageWaitingTime());
        out.printf("Average turnaround time: %.3f%n", report.getAverageTurnaroundTime());
        out.printf("Standard deviation in waiting time: %.3f%n", report.getWaitingTimeStdDev());
        out.printf("Makespan: %d, context switches: %d%n", report.getMakespan(), report.getContextSwitches());
    }

    /// Prints one row of averages per algorithm.
    ///
    /// @param out destination
    /// @param reports completed runs of the same workload
    public static void printComparison(PrintStream out, List<SimulationReport> reports) {
        out.printf("%-10s %14s %14s %14s %14s %10s %10s%n",
            "ALGORITHM", "AVG_WAITING", "AVG_TURNAROUND", "WAITING_STDEV", "AVG_RESPONSE", "SWITCHES", "MAKESPAN");
        for (SimulationReport report : reports) {
            out.printf("%-10s %14.3f %14.3f %14.3f %14.3f %10d %10d%n",
                report.getAlgorithm(), report.getAverageWaitingTime(), report.getAverageTurnaroundTime(),
                report.getWaitingTimeStdDev(), report.getAverageResponseTime(),
                report.getContextSwitches(), report.getMakespan());
        }
    }
}
