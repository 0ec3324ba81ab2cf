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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class WorkloadGeneratorTest {

    @ParameterizedTest
    @EnumSource(RandomGenerators.Algorithm.class)
    public void sameSeedGivesTheSameWorkload(RandomGenerators.Algorithm algorithm) {
        WorkloadGenerator generator = WorkloadGenerator.builder().count(30).seed(42L).algorithm(algorithm).build();

        assertThat(generator.generate()).isEqualTo(generator.generate());
        assertThat(WorkloadGenerator.builder().count(30).seed(42L).algorithm(algorithm).build().generate())
            .isEqualTo(generator.generate());
    }

    @Test
    public void differentSeedsDiffer() {
        Workload a = WorkloadGenerator.builder().count(30).seed(1L).build().generate();
        Workload b = WorkloadGenerator.builder().count(30).seed(2L).build().generate();

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    public void drawsStayWithinTheConfiguredBounds() {
        Workload workload = WorkloadGenerator.builder()
            .count(500).seed(3L).maxArrival(50).maxBurst(7).niceRange(-3, 4)
            .build().generate();

        assertThat(workload.size()).isEqualTo(500);
        assertThat(workload.processes()).allSatisfy(p -> {
            assertThat(p.pid()).isBetween(1, 500);
            assertThat(p.arrivalTime()).isBetween(0L, 50L);
            assertThat(p.burst()).isBetween(1L, 7L);
            assertThat(p.nice()).isBetween(-3, 4);
        });
        assertThat(workload.processes()).anySatisfy(p -> assertThat(p.burst()).isEqualTo(7L));
        assertThat(workload.processes()).anySatisfy(p -> assertThat(p.nice()).isEqualTo(-3));
    }

    @Test
    public void everySettingHasADefault() {
        WorkloadGenerator generator = WorkloadGenerator.builder().build();

        assertThat(generator.getCount()).isEqualTo(WorkloadGenerator.DEFAULT_COUNT).isEqualTo(10);
        assertThat(generator.getSeed()).isZero();
        assertThat(generator.generate().processes()).allSatisfy(p -> {
            assertThat(p.arrivalTime()).isBetween(0L, WorkloadGenerator.DEFAULT_MAX_ARRIVAL);
            assertThat(p.burst()).isBetween(1L, WorkloadGenerator.DEFAULT_MAX_BURST);
            assertThat(p.nice()).isBetween(WorkloadGenerator.DEFAULT_MIN_NICE, WorkloadGenerator.DEFAULT_MAX_NICE);
        });
    }

    @Test
    public void invalidSettingsAreRejected() {
        assertThatThrownBy(() -> WorkloadGenerator.builder().count(0).build())
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> WorkloadGenerator.builder().maxBurst(0).build())
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> WorkloadGenerator.builder().maxArrival(-1).build())
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> WorkloadGenerator.builder().niceRange(5, 2).build())
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> WorkloadGenerator.builder().niceRange(-21, 2).build())
            .isInstanceOf(InvalidConfigurationException.class);
    }
}
