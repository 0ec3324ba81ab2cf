package io.nosqlbench.schedsim.algorithms;

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

import io.nosqlbench.schedsim.events.EventLog;
import io.nosqlbench.schedsim.events.SchedulingEvent;
import io.nosqlbench.schedsim.workload.ProcessDescriptor;
import io.nosqlbench.schedsim.workload.Workload;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Queue;

/**
 * Shared dispatch loop for the baseline algorithms, which differ only in how the
 * ready queue orders processes and how long a dispatched process may run.
 *
 * <p>Each turn admits the processes that have arrived, takes the head of the ready
 * queue, runs it for {@link #grantFor(ReadyTask)} (never past its completion), and
 * requeues it if it has work left. Processes that arrived during the turn are admitted
 * at the start of the next turn, behind the preempted process. When nothing is ready
 * the clock jumps to the next arrival.</p>
 *
 * <p>None of these policies account virtual runtime, so their events carry zero for
 * both virtual runtime fields.</p>
 */
public abstract class ReadyQueueAlgorithm implements SchedulingAlgorithm {
    private static final Logger logger = LogManager.getLogger(ReadyQueueAlgorithm.class);

    /**
     * @return an empty ready queue whose poll order is this policy's dispatch order
     */
    protected abstract Queue<ReadyTask> newReadyQueue();

    /**
     * @param task the process being dispatched
     * @return how long it may run before being preempted, positive
     */
    protected abstract long grantFor(ReadyTask task);

    @Override
    public List<SchedulingEvent> schedule(Workload workload) {
        Deque<ReadyTask> arrivals = new ArrayDeque<>(workload.size());
        for (ProcessDescriptor descriptor : workload.processes()) {
            arrivals.addLast(new ReadyTask(descriptor));
        }
        Queue<ReadyTask> ready = newReadyQueue();
        EventLog log = new EventLog();
        long now = 0L;

        while (!ready.isEmpty() || !arrivals.isEmpty()) {
            admit(arrivals, ready, now);
            if (ready.isEmpty()) {
                now = arrivals.peekFirst().arrivalTime();
                continue;
            }
            ReadyTask task = ready.poll();
            long granted = Math.min(grantFor(task), task.remaining);
            log.append(new SchedulingEvent(now, now + granted, task.pid(), 0.0d, 0.0d));
            now += granted;
            task.remaining -= granted;
            if (task.remaining > 0) {
                ready.offer(task);
            }
        }
        logger.debug("{} scheduled {} processes, finishing at t={}", getName(), workload.size(), now);
        return log.drain();
    }

    private static void admit(Deque<ReadyTask> arrivals, Queue<ReadyTask> ready, long now) {
        while (!arrivals.isEmpty() && arrivals.peekFirst().arrivalTime() <= now) {
            ready.offer(arrivals.pollFirst());
        }
    }
}
