/// Completely Fair Scheduler core.
///
/// ## Key Components
///
/// - {@link io.nosqlbench.schedsim.cfs.CfsScheduler}: the decision loop
/// - {@link io.nosqlbench.schedsim.cfs.RunQueue}: runnable processes ordered by virtual runtime
/// - {@link io.nosqlbench.schedsim.cfs.WeightTable}: nice value to load weight mapping
/// - {@link io.nosqlbench.schedsim.cfs.SchedulerConfig}: target latency, minimum granularity
///   and arrival placement
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
