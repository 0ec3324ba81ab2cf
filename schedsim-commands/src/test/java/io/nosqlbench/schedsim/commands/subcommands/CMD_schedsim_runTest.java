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

/// Tests for the run subcommand, driven through the top-level command line.
public class CMD_schedsim_runTest {

    @TempDir
    Path tempDir;

    private Path workloadFile;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errContent = new ByteArrayOutputStream();
    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;

    @BeforeEach
    public void setUp() throws IOException {
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
        workloadFile = tempDir.resolve("three.json");
        Files.writeString(workloadFile, """
            {"processes": [
              {"pid": 1, "nice": 0, "burst": 10},
              {"pid": 2, "nice": 0, "burst": 10},
              {"pid": 3, "nice": 0, "burst": 10}
            ]}
            """);
    }

    @AfterEach
    public void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private static long traceRows(String output) {
        return output.lines()
            .map(String::trim)
            .filter(line -> line.matches("\\d+ +\\d+ +\\d+ +\\d+ +\\S+ +\\S+"))
            .count();
    }

    @Test
    public void testCfsRunPrintsTraceAndSummary() {
        int exitCode = CMD_schedsim.newCommandLine().execute(
            "run", "--workload", workloadFile.toString(), "--target-latency", "6", "--min-granularity", "1");

        assertEquals(0, exitCode, "run should succeed: " + errContent);
        String output = outContent.toString();
        assertTrue(output.contains("VRUNTIME_BEFORE"), "trace header expected");
        assertEquals(15, traceRows(output), "three processes at two units per turn need 15 dispatches");
        assertTrue(output.contains("Average waiting time:"));
        assertTrue(output.contains("Makespan: 30, context switches: 14"));
    }

    @Test
    public void testBaselineAlgorithmIsSelectable() {
        int exitCode = CMD_schedsim.newCommandLine().execute(
            "run", "-w", workloadFile.toString(), "--algorithm", "fcfs", "--summary-only");

        assertEquals(0, exitCode);
        String output = outContent.toString();
        assertFalse(output.contains("VRUNTIME_BEFORE"), "--summary-only suppresses the trace");
        assertTrue(output.contains("FCFS"));
        assertTrue(output.contains("Makespan: 30, context switches: 2"));
    }

    @Test
    public void testMaxTicksStopsEarlyWithoutSummary() {
        int exitCode = CMD_schedsim.newCommandLine().execute(
            "run", "-w", workloadFile.toString(), "-l", "6", "--max-ticks", "5");

        assertEquals(0, exitCode);
        String output = outContent.toString();
        assertEquals(3, traceRows(output));
        assertTrue(output.contains("Stopped after 3 dispatches with work remaining; no summary."));
        assertFalse(output.contains("Average waiting time:"));
    }

    @Test
    public void testMaxTicksRequiresCfs() {
        int exitCode = CMD_schedsim.newCommandLine().execute(
            "run", "-w", workloadFile.toString(), "-a", "rr", "--max-ticks", "5");

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("--max-ticks is only supported"));
    }

    @Test
    public void testNegativeMaxTicksIsAnError() {
        int exitCode = CMD_schedsim.newCommandLine().execute(
            "run", "--count", "3", "--seed", "1", "--max-ticks", "-5");

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("Error: --max-ticks cannot be negative"), errContent.toString());
        assertEquals("", outContent.toString());
    }

    @Test
    public void testOversizedTargetLatencyIsAnError() {
        int exitCode = CMD_schedsim.newCommandLine().execute(
            "run", "-w", workloadFile.toString(), "--target-latency", String.valueOf(1L << 50));

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("Error: Target latency cannot exceed"), errContent.toString());
    }

    @Test
    public void testInvalidWorkloadIsReported() throws IOException {
        Path bad = tempDir.resolve("bad.json");
        Files.writeString(bad, "{\"processes\": [{\"pid\": 1, \"nice\": 25, \"burst\": 4}]}");

        int exitCode = CMD_schedsim.newCommandLine().execute("run", "-w", bad.toString());

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("Error: nice"), errContent.toString());
    }

    @Test
    public void testMissingWorkloadFileIsReported() {
        int exitCode = CMD_schedsim.newCommandLine().execute(
            "run", "-w", tempDir.resolve("absent.json").toString());

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("unable to read workload"));
    }

    @Test
    public void testGeneratedWorkloadIsReproducible() {
        String[] args = {"run", "--count", "8", "--seed", "17", "--summary-only"};

        assertEquals(0, CMD_schedsim.newCommandLine().execute(args));
        String first = outContent.toString();
        outContent.reset();
        assertEquals(0, CMD_schedsim.newCommandLine().execute(args));

        assertEquals(first, outContent.toString());
    }

    @Test
    public void testInvalidTuningIsRejected() {
        int exitCode = CMD_schedsim.newCommandLine().execute(
            "run", "-w", workloadFile.toString(), "--target-latency", "0");

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("Target latency must be positive"));
    }
}
