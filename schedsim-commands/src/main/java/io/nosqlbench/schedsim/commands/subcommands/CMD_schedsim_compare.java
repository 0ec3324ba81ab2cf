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
import io.nosqlbench.schedsim.algorithms.SchedulingAlgorithm;
import io.nosqlbench.schedsim.cfs.SchedulerConfig;
import io.nosqlbench.schedsim.commands.common.ReportPrinter;
import io.nosqlbench.schedsim.commands.common.SchedulerTuningOption;
import io.nosqlbench.schedsim.commands.common.WorkloadOption;
import io.nosqlbench.schedsim.errors.InvalidConfigurationException;
import io.nosqlbench.schedsim.report.SimulationReport;
import io.nosqlbench.schedsim.workload.Workload;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Runs every algorithm over the same workload and prints their averages side by side.
@CommandLine.Command(name = "compare",
    description = "Compare CFS against FCFS, SRTF, priority and round robin on one workload")
public class CMD_schedsim_compare implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_schedsim_compare.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private WorkloadOption workloadOption = new WorkloadOption();

    @CommandLine.Mixin
    private SchedulerTuningOption tuningOption = new SchedulerTuningOption();

    @CommandLine.Option(names = {"--details"},
        description = "Also print the per-process table of every algorithm")
    private boolean details = false;

    @Override
    public Integer call() {
        List<SimulationReport> reports = new ArrayList<>();
        try {
            Workload workload = workloadOption.resolve();
            SchedulerConfig config = tuningOption.toConfig();
            for (AlgorithmKind kind : AlgorithmKind.values()) {
                SchedulingAlgorithm algorithm = kind.create(config, tuningOption.getQuantum());
                reports.add(SimulationReport.of(algorithm.getName(), workload, algorithm.schedule(workload)));
                logger.debug("{} complete", algorithm.getName());
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

        ReportPrinter.printComparison(System.out, reports);
        if (details) {
            for (SimulationReport report : reports) {
                ReportPrinter.printReport(System.out, report);
            }
        }
        return EXIT_SUCCESS;
    }
}
