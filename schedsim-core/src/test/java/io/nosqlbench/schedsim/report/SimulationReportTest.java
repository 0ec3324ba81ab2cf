package io.nosqlbench.schedsim.report;

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

import io.nosqlbench.schedsim.algorithms.FcfsAlgorithm;
import io.nosqlbench.schedsim.algorithms.RoundRobinAlgorithm;
import io.nosqlbench.schedsim.events.SchedulingEvent;
import io.nosqlbench.schedsim.workload.ProcessDescriptor;
import io.nosqlbench.schedsim.workload.Workload;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class SimulationReportTest {

    private static final Workload WORKLOAD = Workload.of(
        new ProcessDescriptor(1, 3, 5, 0),
        new ProcessDescriptor(2, 1, 3, 1),
        new ProcessDescriptor(3, 2, 1, 2));

    @Test
    public void fcfsOutcomes() {
        SimulationReport report = SimulationReport.of("FCFS", WORKLOAD, new FcfsAlgorithm().schedule(WORKLOAD));

        assertThat(report.getAlgorithm()).isEqualTo("FCFS");
        assertThat(report.getOutcomes()).extracting(ProcessOutcome::waitingTime).containsExactly(0L, 4L, 6L);
        assertThat(report.getOutcomes()).extracting(ProcessOutcome::turnaroundTime).containsExactly(5L, 7L, 7L);
        assertThat(report.getAverageWaitingTime()).isCloseTo(10.0 / 3, within(1e-9));
        assertThat(report.getAverageTurnaroundTime()).isCloseTo(19.0 / 3, within(1e-9));
        assertThat(report.getAverageResponseTime()).isCloseTo(10.0 / 3, within(1e-9));
        assertThat(report.getWaitingTimeStdDev()).isCloseTo(Math.sqrt(56.0 / 9), within(1e-9));
        assertThat(report.getMakespan()).isEqualTo(9);
        assertThat(report.getBusyTime()).isEqualTo(9);
        assertThat(report.getContextSwitches()).isEqualTo(2);
    }

    @Test
    public void roundRobinOutcomes() {
        SimulationReport report = SimulationReport.of("RR", WORKLOAD, new RoundRobinAlgorithm(2).schedule(WORKLOAD));

        ProcessOutcome first = report.getOutcomes().get(0);
        assertThat(first.pid()).isEqualTo(1);
        assertThat(first.firstStart()).isZero();
        assertThat(first.completionTime()).isEqualTo(8);
        assertThat(first.turns()).isEqualTo(3);
        assertThat(first.averageSlice()).isCloseTo(5.0 / 3, within(1e-9));
        assertThat(report.getOutcomes()).extracting(ProcessOutcome::waitingTime).containsExactly(3L, 5L, 4L);
        assertThat(report.getOutcomes()).extracting(ProcessOutcome::responseTime).containsExactly(0L, 3L, 4L);
        assertThat(report.getContextSwitches()).isEqualTo(4);
    }

    @Test
    public void idleTimeCountsTowardsMakespanButNotBusyTime() {
        Workload sparse = Workload.of(
            new ProcessDescriptor(1, 0, 4, 0),
            new ProcessDescriptor(2, 0, 3, 10));

        SimulationReport report = SimulationReport.of("FCFS", sparse, new FcfsAlgorithm().schedule(sparse));

        assertThat(report.getMakespan()).isEqualTo(13);
        assertThat(report.getBusyTime()).isEqualTo(7);
        assertThat(report.getAverageWaitingTime()).isZero();
    }

    @Test
    public void incompleteRunsAreRejected() {
        List<SchedulingEvent> partial = List.of(new SchedulingEvent(0, 2, 1, 0.0, 0.0));

        assertThatThrownBy(() -> SimulationReport.of("partial", WORKLOAD, partial))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pid 1");
    }
}
