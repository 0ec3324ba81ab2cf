package io.nosqlbench.schedsim.commands;

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

import io.nosqlbench.schedsim.commands.subcommands.CMD_schedsim_compare;
import io.nosqlbench.schedsim.commands.subcommands.CMD_schedsim_generate;
import io.nosqlbench.schedsim.commands.subcommands.CMD_schedsim_run;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 # Scheduler Simulation Tools

 Simulates a single-core Completely Fair Scheduler and the classic baselines it is
 usually compared with.

 ## Subcommands
 - `run`: simulate one algorithm and print the dispatch trace and summary
 - `compare`: run every algorithm on the same workload and compare averages
 - `generate`: write a random workload file

 # Basic Usage
 ```
 schedsim generate --output workload.json --count 20 --seed 7
 schedsim run --workload workload.json --target-latency 20 --min-granularity 1
 schedsim compare --count 50 --seed 7 --quantum 20
 ```
 */
@CommandLine.Command(name = "schedsim",
    header = "Simulate and compare CPU schedulers",
    description = "Discrete-event simulation of the Completely Fair Scheduler and classic baseline schedulers.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: output exists", "2: error"},
    subcommands = {
        CMD_schedsim_run.class,
        CMD_schedsim_compare.class,
        CMD_schedsim_generate.class,
        CommandLine.HelpCommand.class
    })
public class CMD_schedsim implements Callable<Integer> {

    /**
     * Run a schedsim command
     * @param args command line arguments
     */
    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * @return the configured top-level command line
     */
    public static CommandLine newCommandLine() {
        return new CommandLine(new CMD_schedsim())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
