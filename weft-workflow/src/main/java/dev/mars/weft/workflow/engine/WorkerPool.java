/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.weft.workflow.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of task workers shared by every execution of an engine, plus the timer
 * that enforces attempt deadlines.
 *
 * <p>Capacity is tracked as slots. A dispatcher takes a slot before it hands an attempt to
 * the pool and the slot is returned when the worker thread finishes with it, even if the
 * attempt's result was already recorded as a timeout. A dispatcher that finds no free slot
 * is queued and called back, in FIFO order, when a slot is returned.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class WorkerPool {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    /**
     * Notified when capacity may have become available.
     */
    public interface CapacityListener {
        void onCapacityAvailable();
    }

    private final int capacity;
    private final ThreadPoolExecutor executor;
    private final ScheduledExecutorService timer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<CapacityListener> waiting = new LinkedHashSet<>();
    private int inUse;

    public WorkerPool(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Worker pool capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
        AtomicInteger workerIds = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                capacity,
                capacity,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "weft-worker-" + workerIds.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }
        );
        this.executor.allowCoreThreadTimeOut(true);
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "weft-deadline-timer");
            t.setDaemon(true);
            return t;
        });
        logger.info("WorkerPool initialized with capacity {}", capacity);
    }

    /**
     * Takes a slot if one is free. Otherwise registers {@code listener} to be called back once
     * a slot is returned. Both happen under one lock, so a release cannot slip in between.
     *
     * @return {@code true} if a slot was taken
     */
    public boolean tryAcquire(CapacityListener listener) {
        lock.lock();
        try {
            if (inUse < capacity) {
                inUse++;
                return true;
            }
            if (listener != null) {
                waiting.add(listener);
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a slot and notifies every waiting listener outside the pool lock.
     */
    public void release() {
        List<CapacityListener> toNotify;
        lock.lock();
        try {
            if (inUse == 0) {
                throw new IllegalStateException("Worker pool slot released more often than acquired");
            }
            inUse--;
            toNotify = new ArrayList<>(waiting);
            waiting.clear();
        } finally {
            lock.unlock();
        }
        for (CapacityListener listener : toNotify) {
            try {
                listener.onCapacityAvailable();
            } catch (RuntimeException e) {
                logger.warn("Capacity listener failed: {}", e.getMessage(), e);
            }
        }
    }

    public void removeListener(CapacityListener listener) {
        lock.lock();
        try {
            waiting.remove(listener);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a worker body. The caller must hold a slot for it.
     *
     * @throws java.util.concurrent.RejectedExecutionException if the pool has been shut down
     */
    public void execute(Runnable work) {
        executor.execute(work);
    }

    public ScheduledFuture<?> schedule(Runnable action, long delay, TimeUnit unit) {
        return timer.schedule(action, delay, unit);
    }

    public int getCapacity() {
        return capacity;
    }

    public int getInUse() {
        lock.lock();
        try {
            return inUse;
        } finally {
            lock.unlock();
        }
    }

    public int getWaitingCount() {
        lock.lock();
        try {
            return waiting.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Shuts down the workers and the deadline timer, interrupting workers still busy after
     * {@code timeoutSeconds}.
     *
     * @return {@code true} if every worker finished in time
     */
    public boolean shutdown(long timeoutSeconds) {
        timer.shutdownNow();
        executor.shutdown();
        try {
            boolean terminated = executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS);
            if (!terminated) {
                logger.warn("Worker pool shutdown timed out after {}s, interrupting workers", timeoutSeconds);
                executor.shutdownNow();
                return false;
            }
            logger.info("Worker pool shutdown completed");
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            return false;
        }
    }
}
