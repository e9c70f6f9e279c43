package io.arqsim.core.events;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/// Background task that keeps an {@link EventLoop} drained.
///
/// Each pass runs events while any are pending, then the pump idles for
/// the configured interval before checking again. The idle interval is wall
/// clock only and has no effect on simulation time.
public class EventPump implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(EventPump.class);

    /// Default idle interval between drain passes
    public static final Duration DEFAULT_IDLE = Duration.ofMillis(1);

    private final EventLoop eventLoop;
    private final Duration idle;
    private final ScheduledExecutorService executor;
    private final AtomicLong firedEvents = new AtomicLong();
    private volatile ScheduledFuture<?> task;
    private volatile RuntimeException failure;
    private volatile boolean draining;

    /// Creates a pump with the default idle interval.
    /// @param eventLoop the loop to drain
    public EventPump(EventLoop eventLoop) {
        this(eventLoop, DEFAULT_IDLE);
    }

    /// Creates a pump.
    /// @param eventLoop the loop to drain
    /// @param idle pause between drain passes
    public EventPump(EventLoop eventLoop, Duration idle) {
        this.eventLoop = eventLoop;
        this.idle = idle;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "event-pump");
            thread.setDaemon(true);
            return thread;
        });
    }

    /// Starts pumping. Calling start twice has no additional effect.
    /// @return this pump
    public synchronized EventPump start() {
        if (task == null) {
            task = executor.scheduleWithFixedDelay(this::drain, 0, idle.toNanos(), TimeUnit.NANOSECONDS);
        }
        return this;
    }

    private void drain() {
        if (failure != null) {
            return;
        }
        draining = true;
        try {
            while (eventLoop.pendingCount() > 0) {
                if (eventLoop.advance()) {
                    firedEvents.incrementAndGet();
                }
            }
        } catch (RuntimeException e) {
            logger.error("event action failed, pump halted", e);
            failure = e;
        } finally {
            draining = false;
        }
    }

    /// Waits until the loop has no pending events and no action is running.
    ///
    /// @param timeout maximum wall-clock wait
    /// @return true if the loop went idle within the timeout
    /// @throws InterruptedException if interrupted while waiting
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (eventLoop.pendingCount() > 0 || draining) {
            if (failure != null) {
                throw failure;
            }
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(Math.max(1, idle.toMillis()));
        }
        return true;
    }

    /// Number of actions the pump has run.
    /// @return fired event count
    public long getFiredEvents() {
        return firedEvents.get();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
