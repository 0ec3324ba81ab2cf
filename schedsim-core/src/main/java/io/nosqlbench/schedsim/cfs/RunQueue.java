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

import io.nosqlbench.schedsim.errors.SchedulerInvariantException;
import io.nosqlbench.schedsim.errors.SchedulerInvariantException.Violation;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * The set of runnable processes, ordered by {@code (vruntime, pid)}.
 *
 * <p>Ordering is held in a red-black tree, so insertion, removal of the minimum,
 * arbitrary removal and re-keying are all O(log n). A pid index backs duplicate
 * detection and lookup by id. The pid is the tie-break, which makes the order total
 * and selection deterministic when virtual runtimes coincide.</p>
 *
 * <p>A queued process must not have its virtual runtime changed except through
 * {@link #rekey(int, double)}; doing so would corrupt the tree order.</p>
 *
 * <p>Not thread-safe. Each simulation owns its own queue.</p>
 */
public class RunQueue {

    private static final Comparator<SchedProcess> ORDER =
        Comparator.comparingDouble(SchedProcess::getVruntime).thenComparingInt(SchedProcess::getPid);

    private final NavigableSet<SchedProcess> tree = new TreeSet<>(ORDER);
    private final Map<Integer, SchedProcess> byPid = new HashMap<>();
    private long totalWeight;

    /**
     * Adds a process keyed by its current virtual runtime and pid.
     *
     * @param process a runnable process that is not already queued
     * @throws SchedulerInvariantException with {@link Violation#DUPLICATE_KEY} if the pid is already queued
     */
    public void insert(SchedProcess process) {
        if (byPid.putIfAbsent(process.getPid(), process) != null) {
            throw new SchedulerInvariantException(Violation.DUPLICATE_KEY,
                "pid " + process.getPid() + " is already in the run queue");
        }
        tree.add(process);
        totalWeight += process.getWeight();
    }

    /**
     * Removes and returns the process with the least {@code (vruntime, pid)}.
     *
     * @return the next process to run
     * @throws SchedulerInvariantException with {@link Violation#EMPTY_QUEUE} if nothing is queued
     */
    public SchedProcess popMin() {
        SchedProcess min = tree.pollFirst();
        if (min == null) {
            throw new SchedulerInvariantException(Violation.EMPTY_QUEUE, "popMin on an empty run queue");
        }
        byPid.remove(min.getPid());
        totalWeight -= min.getWeight();
        return min;
    }

    /**
     * Returns the process with the least {@code (vruntime, pid)} without removing it.
     * Intended for baselines and diagnostics, not for selection.
     *
     * @return the current minimum
     * @throws SchedulerInvariantException with {@link Violation#EMPTY_QUEUE} if nothing is queued
     */
    public SchedProcess peekMin() {
        if (tree.isEmpty()) {
            throw new SchedulerInvariantException(Violation.EMPTY_QUEUE, "peekMin on an empty run queue");
        }
        return tree.first();
    }

    /**
     * Moves a queued process to a new virtual runtime.
     *
     * @param pid the queued process
     * @param vruntime its new key
     * @throws SchedulerInvariantException with {@link Violation#UNKNOWN_KEY} if the pid is not queued
     */
    public void rekey(int pid, double vruntime) {
        SchedProcess process = lookup(pid);
        tree.remove(process);
        process.setVruntime(vruntime);
        tree.add(process);
    }

    /**
     * Removes an arbitrary queued process.
     *
     * @param pid the queued process
     * @return the removed process
     * @throws SchedulerInvariantException with {@link Violation#UNKNOWN_KEY} if the pid is not queued
     */
    public SchedProcess remove(int pid) {
        SchedProcess process = lookup(pid);
        tree.remove(process);
        byPid.remove(pid);
        totalWeight -= process.getWeight();
        return process;
    }

    public boolean contains(int pid) {
        return byPid.containsKey(pid);
    }

    public boolean isEmpty() {
        return tree.isEmpty();
    }

    public int size() {
        return tree.size();
    }

    /**
     * @return the sum of the weights of all queued processes
     */
    public long totalWeight() {
        return totalWeight;
    }

    /**
     * @return the virtual runtime of the minimum element, or 0 when the queue is empty
     */
    public double minVruntime() {
        return tree.isEmpty() ? 0.0d : tree.first().getVruntime();
    }

    private SchedProcess lookup(int pid) {
        SchedProcess process = byPid.get(pid);
        if (process == null) {
            throw new SchedulerInvariantException(Violation.UNKNOWN_KEY, "pid " + pid + " is not in the run queue");
        }
        return process;
    }

    @Override
    public String toString() {
        return "RunQueue[size=" + tree.size() + ", totalWeight=" + totalWeight + ", minVruntime=" + minVruntime() + "]";
    }
}
