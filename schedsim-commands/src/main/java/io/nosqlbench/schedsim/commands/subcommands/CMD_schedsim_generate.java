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

import io.nosqlbench.schedsim.commands.common.WorkloadOption;
import io.nosqlbench.schedsim.errors.InvalidConfigurationException;
import io.nosqlbench.schedsim.workload.Workload;
import io.nosqlbench.schedsim.workload.WorkloadFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Writes a random workload to a JSON file that `run --workload` and `compare --workload` accept.
@CommandLine.Command(name = "generate",
    description = "Generate a random workload file")
public class CMD_schedsim_generate implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_schedsim_generate.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FILE_EXISTS = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"-o", "--output"}, description = "The output file", required = true)
    private Path outputPath;

    @CommandLine.Option(names = {"--force"}, description = "Force overwrite if output file already exists")
    private boolean force = false;

    @CommandLine.Mixin
    private WorkloadOption workloadOption = new WorkloadOption();

    @Override
    public Integer call() {
        if (workloadOption.getWorkloadPath() != null) {
            System.err.println("Error: --workload cannot be combined with generate");
            return EXIT_ERROR;
        }
        Path output = outputPath.normalize();
        if (Files.exists(output) && !force) {
            System.err.println("Error: Output file already exists. Use --force to overwrite.");
            return EXIT_FILE_EXISTS;
        }
        try {
            long seed = workloadOption.getSeed();
            Workload workload = workloadOption.generator(seed).generate();
            Path parent = output.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            WorkloadFile.save(workload, output);
            logger.info("wrote {} processes to {}", workload.size(), output);
            System.out.println("Generated " + workload.size() + " processes with seed " + seed + " to " + output);
            return EXIT_SUCCESS;
        } catch (InvalidConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("unable to write {}", output, e);
            System.err.println("Error: unable to write workload: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
