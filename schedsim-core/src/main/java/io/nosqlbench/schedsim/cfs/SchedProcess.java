package io.nosqlbench.schedsim.cfs;

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

import io.nosqlbench.schedsim.workload.ProcessDescriptor;

/// Scheduling state of one simulated process.
///
/// The static attributes (pid, nice, weight, burst, arrival time) are fixed at
/// construction. The virtual runtime and remaining burst are mutated only by
/// [CfsScheduler], and only while the process is not in a [RunQueue], since the
/// queue is keyed by the virtual runtime.
public class SchedProcess {

    private final int pid;
    private final int nice;
    private final int weight;
    private final long burst;
    private final long arrivalTime;

    private double vruntime;
    private long remainingBurst;

    /// Creates a process from a validated descriptor, with zero virtual runtime.
    ///
    /// @param descriptor the static attributes of the process
    public SchedProcess(ProcessDescriptor descriptor) {
        this.pid = descriptor.pid();
        this.nice = descriptor.nice();
        this.weight = WeightTable.weightOf(descriptor.nice());
        this.burst = descriptor.burst();
        this.arrivalTime = descriptor.arrivalTime();
        this.remainingBurst = descriptor.burst();
    }

    public int getPid() {
        return pid;
    }

    public int getNice() {
        return nice;
    }

    public int getWeight() {
        return weight;
    }

    public long getBurst() {
        return burst;
    }

    public long getArrivalTime() {
        return arrivalTime;
    }

    public double getVruntime() {
        return vruntime;
    }

    public long getRemainingBurst() {
        return remainingBurst;
    }

    /// @return true once the whole burst has been granted
    public boolean isFinished() {
        return remainingBurst == 0;
    }

    void setVruntime(double vruntime) {
        this.vruntime = vruntime;
    }

    /// Charges a grant of CPU time against this process.
    ///
    /// @param granted time units actually run, at most the remaining burst
    /// @return the virtual runtime after the charge
    double charge(long granted) {
        this.vruntime += granted * (double) WeightTable.NICE_0_WEIGHT / weight;
        this.remainingBurst -= granted;
        return vruntime;
    }

    @Override
    public String toString() {
        return String.format("SchedProcess[pid=%d, nice=%d, weight=%d, vruntime=%.3f, remaining=%d]",
            pid, nice, weight, vruntime, remainingBurst);
    }
}
