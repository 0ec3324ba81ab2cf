package io.nosqlbench.schedsim.commands.subcommands;

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

import io.nosqlbench.schedsim.algorithms.AlgorithmKind;
import io.nosqlbench.schedsim.cfs.CfsScheduler;
import io.nosqlbench.schedsim.cfs.SchedulerConfig;
import io.nosqlbench.schedsim.commands.common.ReportPrinter;
import io.nosqlbench.schedsim.commands.common.SchedulerTuningOption;
import io.nosqlbench.schedsim.commands.common.WorkloadOption;
import io.nosqlbench.schedsim.errors.InvalidConfigurationException;
import io.nosqlbench.schedsim.events.EventLog;
import io.nosqlbench.schedsim.events.LoggerEventSink;
import io.nosqlbench.schedsim.events.SchedulingEvent;
import io.nosqlbench.schedsim.events.SchedulingEventSink;
import io.nosqlbench.schedsim.report.SimulationReport;
import io.nosqlbench.schedsim.workload.Workload;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Runs one scheduling algorithm over a workload and prints the dispatch trace and
/// per-process waiting and turnaround times.
@CommandLine.Command(name = "run",
    description = "Simulate one scheduling algorithm and print its trace and summary")
public class CMD_schedsim_run implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_schedsim_run.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private WorkloadOption workloadOption = new WorkloadOption();

    @CommandLine.Mixin
    private SchedulerTuningOption tuningOption = new SchedulerTuningOption();

    @CommandLine.Option(names = {"-a", "--algorithm"},
        description = "Scheduling algorithm (${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE})",
        defaultValue = "CFS")
    private AlgorithmKind algorithm;

    @CommandLine.Option(names = {"--max-ticks"},
        description = "Stop a CFS run after this much simulated time; the summary is skipped if work remains")
    private Long maxTicks;

    @CommandLine.Option(names = {"--summary-only"},
        description = "Do not print the dispatch trace")
    private boolean summaryOnly = false;

    @CommandLine.Option(names = {"--log-events"},
        description = "Also log every dispatch through the schedsim.trace logger")
    private boolean logEvents = false;

    public static void main(String[] args) {
        CMD_schedsim_run cmd = new CMD_schedsim_run();
        int exitCode = new CommandLine(cmd).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        Workload workload;
        SchedulerConfig config;
        List<SchedulingEvent> events;
        boolean complete = true;
        try {
            workload = workloadOption.resolve();
            config = tuningOption.toConfig();
            if (maxTicks != null && algorithm != AlgorithmKind.CFS) {
                throw new InvalidConfigurationException("--max-ticks is only supported with the CFS algorithm");
            }
            if (maxTicks != null && maxTicks < 0) {
                throw new InvalidConfigurationException("--max-ticks cannot be negative, was " + maxTicks);
            }
            if (algorithm == AlgorithmKind.CFS) {
                List<SchedulingEventSink> sinks = new ArrayList<>();
                if (logEvents) {
                    sinks.add(new LoggerEventSink("schedsim.trace", Level.INFO));
                }
                EventLog eventLog = new EventLog(sinks);
                CfsScheduler scheduler = new CfsScheduler(workload, config, eventLog);
                if (maxTicks != null) {
                    scheduler.runFor(maxTicks);
                } else {
                    scheduler.runToCompletion();
                }
                complete = scheduler.isFinished();
                events = eventLog.drain();
            } else {
                events = algorithm.create(config, tuningOption.getQuantum()).schedule(workload);
            }
        } catch (InvalidConfigurationException e) {
            logger.error("invalid input: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("unable to read workload {}", workloadOption, e);
            System.err.println("Error: unable to read workload: " + e.getMessage());
            return EXIT_ERROR;
        }

        if (!summaryOnly) {
            ReportPrinter.printTrace(System.out, events);
        }
        if (complete) {
            ReportPrinter.printReport(System.out, SimulationReport.of(algorithm.name(), workload, events));
        } else {
            System.out.printf("%nStopped after %d dispatches with work remaining; no summary.%n", events.size());
        }
        return EXIT_SUCCESS;
    }
}
