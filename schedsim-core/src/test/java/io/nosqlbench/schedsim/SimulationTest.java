package io.nosqlbench.schedsim;

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

import io.nosqlbench.schedsim.cfs.SchedulerConfig;
import io.nosqlbench.schedsim.errors.InvalidConfigurationException;
import io.nosqlbench.schedsim.errors.NiceOutOfRangeException;
import io.nosqlbench.schedsim.events.EventLog;
import io.nosqlbench.schedsim.events.SchedulingEvent;
import io.nosqlbench.schedsim.events.SchedulingEventSink;
import io.nosqlbench.schedsim.workload.ProcessDescriptor;
import io.nosqlbench.schedsim.workload.Workload;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class SimulationTest {

    @Test
    public void threeEqualProcessesTakeTurnsOfTwo() {
        List<SchedulingEvent> events = Simulation.run(List.of(
            new ProcessDescriptor(1, 0, 10),
            new ProcessDescriptor(2, 0, 10),
            new ProcessDescriptor(3, 0, 10)), 6, 1);

        assertThat(events).hasSize(15);
        assertThat(events.get(14).endTime()).isEqualTo(30);
    }

    @Test
    public void invalidInputFailsBeforeAnyStep() {
        assertThatThrownBy(() -> Simulation.run(List.of(new ProcessDescriptor(1, 0, 5)), 0, 1))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> Simulation.run(List.of(new ProcessDescriptor(1, -21, 5)), 20, 1))
            .isInstanceOf(NiceOutOfRangeException.class);
        assertThatThrownBy(() -> Simulation.run(List.of(), 20, 1))
            .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    public void eventLogSinksObserveTheRun() {
        List<SchedulingEvent> observed = new ArrayList<>();
        EventLog log = new EventLog(List.<SchedulingEventSink>of(observed::add));
        Workload workload = Workload.of(new ProcessDescriptor(1, 0, 30), new ProcessDescriptor(2, 5, 30));

        List<SchedulingEvent> events = Simulation.run(workload, SchedulerConfig.defaults(), log);

        assertThat(observed).isEqualTo(events);
        assertThat(log.isEmpty()).isTrue();
    }
}
