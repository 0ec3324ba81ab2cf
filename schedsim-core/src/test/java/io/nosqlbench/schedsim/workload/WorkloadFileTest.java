package io.nosqlbench.schedsim.workload;

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

import io.nosqlbench.schedsim.errors.InvalidConfigurationException;
import io.nosqlbench.schedsim.errors.NiceOutOfRangeException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class WorkloadFileTest {

    @TempDir
    Path tempDir;

    @Test
    public void omittedNiceAndArrivalDefaultToZero() {
        Workload workload = WorkloadFile.load("""
            {"processes": [
              {"pid": 1, "burst": 10},
              {"pid": 2, "nice": -5, "burst": 40, "arrival_time": 15}
            ]}
            """);

        assertThat(workload.processes()).containsExactly(
            new ProcessDescriptor(1, 0, 10, 0),
            new ProcessDescriptor(2, -5, 40, 15));
    }

    @Test
    public void savedFileLoadsBackTheSameWorkload() throws IOException {
        Workload workload = WorkloadGenerator.builder().count(12).seed(5L).build().generate();
        Path file = tempDir.resolve("workload.json");

        WorkloadFile.save(workload, file);

        assertThat(Files.readString(file)).contains("\"arrival_time\"");
        assertThat(WorkloadFile.load(file)).isEqualTo(workload);
    }

    @Test
    public void missingRequiredFieldsAreReported() {
        assertThatThrownBy(() -> WorkloadFile.load("{\"processes\": [{\"burst\": 3}]}"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("pid");
        assertThatThrownBy(() -> WorkloadFile.load("{\"processes\": [{\"pid\": 4}]}"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("burst");
    }

    @Test
    public void invalidContentIsAConfigurationError() {
        assertThatThrownBy(() -> WorkloadFile.load("{\"processes\": [ {\"pid\": "))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> WorkloadFile.load("{\"processes\": []}"))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> WorkloadFile.load(""))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> WorkloadFile.load("{\"processes\": [{\"pid\": 1, \"nice\": 30, \"burst\": 3}]}"))
            .isInstanceOf(NiceOutOfRangeException.class);
        assertThatThrownBy(() -> WorkloadFile.load(
            "{\"processes\": [{\"pid\": 1, \"burst\": 3}, {\"pid\": 1, \"burst\": 4}]}"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("Duplicate pid");
    }
}
