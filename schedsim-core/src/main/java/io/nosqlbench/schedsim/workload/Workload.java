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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A validated set of process descriptors.
 *
 * <p>Descriptors are held in arrival order, with the pid as tie-break, which is the order
 * every scheduler admits them in. Individual descriptors validate their own fields; this
 * class adds the cross-descriptor rules (at least one process, unique pids).</p>
 */
public final class Workload {

    /** Admission order shared by every scheduler. */
    public static final Comparator<ProcessDescriptor> ARRIVAL_ORDER =
        Comparator.comparingLong(ProcessDescriptor::arrivalTime).thenComparingInt(ProcessDescriptor::pid);

    private final List<ProcessDescriptor> processes;

    private Workload(List<ProcessDescriptor> processes) {
        this.processes = processes;
    }

    /**
     * @param descriptors the processes to simulate
     * @return a validated workload
     * @throws InvalidConfigurationException if the collection is empty, contains nulls, or repeats a pid
     */
    public static Workload of(Collection<ProcessDescriptor> descriptors) {
        if (descriptors == null || descriptors.isEmpty()) {
            throw new InvalidConfigurationException("A workload needs at least one process");
        }
        Set<Integer> seen = new HashSet<>();
        List<ProcessDescriptor> sorted = new ArrayList<>(descriptors.size());
        for (ProcessDescriptor descriptor : descriptors) {
            if (descriptor == null) {
                throw new InvalidConfigurationException("Workload contains a null process descriptor");
            }
            if (!seen.add(descriptor.pid())) {
                throw new InvalidConfigurationException("Duplicate pid " + descriptor.pid() + " in workload");
            }
            sorted.add(descriptor);
        }
        sorted.sort(ARRIVAL_ORDER);
        return new Workload(List.copyOf(sorted));
    }

    public static Workload of(ProcessDescriptor... descriptors) {
        return of(Arrays.asList(descriptors));
    }

    /**
     * @return the descriptors in admission order
     */
    public List<ProcessDescriptor> processes() {
        return processes;
    }

    public int size() {
        return processes.size();
    }

    /**
     * @return the sum of all bursts
     */
    public long totalBurst() {
        long total = 0;
        for (ProcessDescriptor descriptor : processes) {
            total = Math.addExact(total, descriptor.burst());
        }
        return total;
    }

    /**
     * @param pid a process id
     * @return the descriptor with that pid
     * @throws IllegalArgumentException if no such process exists
     */
    public ProcessDescriptor get(int pid) {
        for (ProcessDescriptor descriptor : processes) {
            if (descriptor.pid() == pid) {
                return descriptor;
            }
        }
        throw new IllegalArgumentException("No process with pid " + pid + " in workload");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return processes.equals(((Workload) o).processes);
    }

    @Override
    public int hashCode() {
        return processes.hashCode();
    }

    @Override
    public String toString() {
        return "Workload[" + processes.size() + " processes, totalBurst=" + totalBurst() + "]";
    }
}
