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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.schedsim.errors.InvalidConfigurationException;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a {@link Workload}.
 *
 * <h2>JSON Schema</h2>
 * <pre>{@code
 * {
 *   "processes": [
 *     {"pid": 1, "nice": 0, "burst": 10, "arrival_time": 0},
 *     {"pid": 2, "nice": -5, "burst": 40},
 *     {"pid": 3, "nice": 5, "burst": 25, "arrival_time": 15}
 *   ]
 * }
 * }</pre>
 *
 * <p>{@code nice} and {@code arrival_time} default to 0 when omitted. {@code pid} and
 * {@code burst} are required.</p>
 */
public class WorkloadFile {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    @SerializedName("processes")
    private List<Entry> processes;

    /**
     * One process in the file. Boxed fields distinguish missing values from zeros.
     */
    public static class Entry {
        @SerializedName("pid")
        private Integer pid;

        @SerializedName("nice")
        private Integer nice;

        @SerializedName("burst")
        private Long burst;

        @SerializedName("arrival_time")
        private Long arrivalTime;

        public Entry() {
        }

        Entry(ProcessDescriptor descriptor) {
            this.pid = descriptor.pid();
            this.nice = descriptor.nice();
            this.burst = descriptor.burst();
            this.arrivalTime = descriptor.arrivalTime();
        }

        ProcessDescriptor toDescriptor(int index) {
            if (pid == null) {
                throw new InvalidConfigurationException("Process entry " + index + " is missing 'pid'");
            }
            if (burst == null) {
                throw new InvalidConfigurationException("Process entry " + index + " (pid " + pid + ") is missing 'burst'");
            }
            return new ProcessDescriptor(
                pid,
                nice != null ? nice : 0,
                burst,
                arrivalTime != null ? arrivalTime : 0L
            );
        }
    }

    public WorkloadFile() {
    }

    /**
     * @param workload the workload to represent
     * @return the serializable form of the workload
     */
    public static WorkloadFile fromWorkload(Workload workload) {
        WorkloadFile file = new WorkloadFile();
        file.processes = new ArrayList<>(workload.size());
        for (ProcessDescriptor descriptor : workload.processes()) {
            file.processes.add(new Entry(descriptor));
        }
        return file;
    }

    /**
     * Validates the entries and builds the workload.
     *
     * @return the validated workload
     * @throws InvalidConfigurationException if an entry is incomplete or the workload is invalid
     */
    public Workload toWorkload() {
        if (processes == null || processes.isEmpty()) {
            throw new InvalidConfigurationException("Workload file contains no 'processes'");
        }
        List<ProcessDescriptor> descriptors = new ArrayList<>(processes.size());
        for (int i = 0; i < processes.size(); i++) {
            Entry entry = processes.get(i);
            if (entry == null) {
                throw new InvalidConfigurationException("Process entry " + i + " is null");
            }
            descriptors.add(entry.toDescriptor(i));
        }
        return Workload.of(descriptors);
    }

    /**
     * @param reader JSON source
     * @return the validated workload
     * @throws InvalidConfigurationException if the JSON is malformed or the workload is invalid
     */
    public static Workload load(Reader reader) {
        WorkloadFile file;
        try {
            file = GSON.fromJson(reader, WorkloadFile.class);
        } catch (JsonParseException e) {
            throw new InvalidConfigurationException("Malformed workload JSON: " + e.getMessage(), e);
        }
        if (file == null) {
            throw new InvalidConfigurationException("Workload JSON is empty");
        }
        return file.toWorkload();
    }

    public static Workload load(String json) {
        return load(new StringReader(json));
    }

    /**
     * @param path a workload JSON file
     * @return the validated workload
     * @throws IOException if the file cannot be read
     */
    public static Workload load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return load(reader);
        }
    }

    public static void save(Workload workload, Writer writer) {
        GSON.toJson(fromWorkload(workload), writer);
    }

    /**
     * @param workload the workload to write
     * @param path destination, overwritten if present
     * @throws IOException if the file cannot be written
     */
    public static void save(Workload workload, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            save(workload, writer);
        }
    }

    public static String toJson(Workload workload) {
        return GSON.toJson(fromWorkload(workload));
    }
}
