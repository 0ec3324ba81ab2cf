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

import io.nosqlbench.schedsim.commands.CMD_schedsim;
import io.nosqlbench.schedsim.workload.Workload;
import io.nosqlbench.schedsim.workload.WorkloadFile;
import io.nosqlbench.schedsim.workload.WorkloadGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/// Tests for the generate subcommand
public class CMD_schedsim_generateTest {

    @TempDir
    Path tempDir;

    private Path outputPath;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errContent = new ByteArrayOutputStream();
    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;

    @BeforeEach
    public void setUp() {
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
        outputPath = tempDir.resolve("nested").resolve("workload.json");
    }

    @AfterEach
    public void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    public void testGenerateWritesTheSeededWorkload() throws IOException {
        int exitCode = CMD_schedsim.newCommandLine().execute(
            "generate", "--output", outputPath.toString(), "--count", "12", "--seed", "42", "--max-burst", "30");

        assertEquals(0, exitCode, errContent.toString());
        assertTrue(Files.exists(outputPath));
        Workload expected = WorkloadGenerator.builder().count(12).seed(42L).maxBurst(30).build().generate();
        assertEquals(expected, WorkloadFile.load(outputPath));
        assertTrue(outContent.toString().contains("Generated 12 processes with seed 42"));
    }

    @Test
    public void testExistingFileNeedsForce() throws IOException {
        Files.createDirectories(outputPath.getParent());
        Files.writeString(outputPath, "keep me");

        int exitCode = CMD_schedsim.newCommandLine().execute("generate", "-o", outputPath.toString(), "-s", "1");

        assertEquals(1, exitCode);
        assertEquals("keep me", Files.readString(outputPath));
        assertTrue(errContent.toString().contains("Use --force to overwrite"));

        exitCode = CMD_schedsim.newCommandLine().execute("generate", "-o", outputPath.toString(), "-s", "1", "--force");
        assertEquals(0, exitCode);
        assertEquals(10, WorkloadFile.load(outputPath).size());
    }

    @Test
    public void testWorkloadOptionIsRejected() {
        int exitCode = CMD_schedsim.newCommandLine().execute(
            "generate", "-o", outputPath.toString(), "--workload", "other.json");

        assertEquals(2, exitCode);
        assertFalse(Files.exists(outputPath));
    }

    @Test
    public void testInvalidNiceRangeIsAnError() {
        int exitCode = CMD_schedsim.newCommandLine().execute(
            "generate", "-o", outputPath.toString(), "--min-nice", "5", "--max-nice", "1");

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("Invalid nice range"));
    }
}
