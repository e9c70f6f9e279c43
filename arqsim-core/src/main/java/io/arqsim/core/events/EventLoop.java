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

import java.util.HashSet;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/// Time-ordered, cancellable event queue for discrete event simulation.
///
/// The loop knows nothing about the simulation it drives. Callers schedule
/// actions at absolute simulation times and pump the loop with {@link #advance()}
/// while {@link #pendingCount()} is non-zero. No wall-clock pacing is applied:
/// the earliest logical event always runs next.
///
/// The event queue and the cancellation set have separate locks. An event is
/// popped and checked against the cancellation set while both are held, so a
/// {@link #cancel(long)} racing the same id either wins before the pop or
/// finds the event gone. Actions run after both locks are released, which lets
/// them schedule and cancel other events.
public class EventLoop {

    private static final Logger logger = LogManager.getLogger(EventLoop.class);

    private final ReentrantLock queueLock = new ReentrantLock();
    private final ReentrantLock cancelLock = new ReentrantLock();

    private final PriorityQueue<ScheduledEvent> events = new PriorityQueue<>();
    private final Set<Long> pendingIds = new HashSet<>();
    private final Set<Long> cancelledIds = new HashSet<>();
    private final AtomicLong nextEventId = new AtomicLong();

    private volatile double currentTime = 0.0;

    /// Schedules an action.
    ///
    /// @param time absolute simulation time at which the action fires
    /// @param action the action to run
    /// @return the event id, usable with {@link #cancel(long)}
    public long schedule(double time, SimulationAction action) {
        if (Double.isNaN(time) || time < 0) {
            throw new IllegalArgumentException("Event time must be a non-negative number, got " + time);
        }
        if (action == null) {
            throw new IllegalArgumentException("Event action cannot be null");
        }
        queueLock.lock();
        try {
            long id = nextEventId.getAndIncrement();
            events.offer(new ScheduledEvent(time, id, action));
            pendingIds.add(id);
            return id;
        } finally {
            queueLock.unlock();
        }
    }

    /// Marks an event as void. Idempotent; cancelling an event that already
    /// fired, or that never existed, does nothing.
    ///
    /// @param eventId the id returned by {@link #schedule(double, SimulationAction)}
    public void cancel(long eventId) {
        queueLock.lock();
        try {
            if (!pendingIds.contains(eventId)) {
                return;
            }
            cancelLock.lock();
            try {
                cancelledIds.add(eventId);
            } finally {
                cancelLock.unlock();
            }
        } finally {
            queueLock.unlock();
        }
    }

    /// Pops the earliest event and runs it unless it was cancelled.
    ///
    /// Returns immediately when the queue is empty. An exception thrown by the
    /// action propagates to the caller; the event is already removed by then.
    ///
    /// @return true if an action ran
    public boolean advance() {
        ScheduledEvent event;
        boolean cancelled;

        queueLock.lock();
        try {
            event = events.poll();
            if (event == null) {
                return false;
            }
            pendingIds.remove(event.getId());
            cancelLock.lock();
            try {
                cancelled = cancelledIds.remove(event.getId());
            } finally {
                cancelLock.unlock();
            }
        } finally {
            queueLock.unlock();
        }

        if (cancelled) {
            logger.trace("skipping cancelled {}", event);
            return false;
        }

        if (event.getTime() > currentTime) {
            currentTime = event.getTime();
        }
        event.getAction().fire(event.getTime());
        return true;
    }

    /// Number of events not yet popped, cancelled ones included.
    ///
    /// @return the pending event count
    public int pendingCount() {
        queueLock.lock();
        try {
            return events.size();
        } finally {
            queueLock.unlock();
        }
    }

    /// Scheduled time of the earliest queued event.
    ///
    /// @return the time, or {@link Double#NaN} when the queue is empty
    public double peekTime() {
        queueLock.lock();
        try {
            ScheduledEvent head = events.peek();
            return head == null ? Double.NaN : head.getTime();
        } finally {
            queueLock.unlock();
        }
    }

    /// Simulation time of the latest event that ran. Never moves backwards.
    ///
    /// @return current simulation time in seconds
    public double now() {
        return currentTime;
    }
}
