package io.nosqlbench.schedsim.events;

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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Writes each scheduling event to a Log4j logger.
 *
 * <pre>{@code
 * EventLog log = new EventLog(List.of(new LoggerEventSink("schedsim.trace", Level.DEBUG)));
 * }</pre>
 */
public class LoggerEventSink implements SchedulingEventSink {

    private final Logger logger;
    private final Level level;

    public LoggerEventSink() {
        this(LogManager.getLogger(LoggerEventSink.class));
    }

    public LoggerEventSink(Logger logger) {
        this(logger, Level.INFO);
    }

    public LoggerEventSink(Logger logger, Level level) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
    }

    public LoggerEventSink(String loggerName, Level level) {
        this(LogManager.getLogger(loggerName), level);
    }

    @Override
    public void eventRecorded(SchedulingEvent event) {
        if (logger.isEnabled(level)) {
            logger.log(level, "pid {} ran {}..{} ({} units), vruntime {} -> {}",
                event.pid(), event.startTime(), event.endTime(), event.granted(),
                String.format("%.3f", event.vruntimeBefore()), String.format("%.3f", event.vruntimeAfter()));
        }
    }

    @Override
    public void simulationFinished(long finishTime) {
        logger.log(level, "simulation finished at t={}", finishTime);
    }
}
