/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.phonepe.tierstore.persistence;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.phonepe.tierstore.core.errors.ErrorType;
import com.phonepe.tierstore.core.errors.StorageError;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Live state with periodic snapshots. Readers share a lock, updates take it exclusively. A background thread persists
 * the state on a fixed delay while holding only the read lock; a failed snapshot is logged and the next one runs as
 * scheduled.
 *
 * @param <T> State type. Treated as immutable: updates replace the value.
 */
@Slf4j
public class CrashResistantState<T> implements AutoCloseable {
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);

    private final PersistenceEngine<T> engine;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ScheduledExecutorService executor;
    private T state;

    public CrashResistantState(@NonNull T initialState,
                               @NonNull PersistenceEngine<T> engine,
                               @NonNull Duration interval) {
        Preconditions.checkArgument(!interval.isNegative() && !interval.isZero(),
                                    "Persistence interval must be positive, got %s", interval);
        this.state = initialState;
        this.engine = engine;
        this.executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                                                                           .setNameFormat("state-persistence-%d")
                                                                           .setDaemon(true)
                                                                           .build());
        this.executor.scheduleWithFixedDelay(this::persistQuietly,
                                             interval.toMillis(),
                                             interval.toMillis(),
                                             TimeUnit.MILLISECONDS);
        log.info("State persistence loop started, interval {}", interval);
    }

    /**
     * Starts from the last consistent snapshot. Falls back to a fresh initial state only when no snapshot was ever
     * written; snapshots that exist but are all unusable are an error.
     *
     * @throws StorageError NO_CONSISTENT_STATE if snapshots exist but none can be recovered
     */
    public static <T> CrashResistantState<T> recoverOrCreate(@NonNull PersistenceEngine<T> engine,
                                                             @NonNull Supplier<T> initialState,
                                                             @NonNull Duration interval) {
        final T start;
        if (engine.getStorage().hasSnapshots()) {
            start = engine.recover();
        }
        else {
            log.info("No snapshots found, starting from a fresh state");
            start = initialState.get();
        }
        return new CrashResistantState<>(start, engine, interval);
    }

    public <R> R read(final Function<T, R> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(state);
        }
        finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the state with the result of the updater
     *
     * @return The new state
     */
    public T update(final UnaryOperator<T> updater) {
        lock.writeLock().lock();
        try {
            final var updated = updater.apply(state);
            Preconditions.checkArgument(updated != null, "State update must not produce null");
            state = updated;
            return updated;
        }
        finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Persists the current state on the calling thread
     *
     * @throws StorageError as raised by {@link PersistenceEngine#persist}
     */
    public void persistNow() {
        lock.readLock().lock();
        try {
            engine.persist(state);
        }
        finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stops the loop. Does not take a final snapshot; call {@link #persistNow()} first for that.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("State persistence loop did not stop in {}, forcing shutdown", SHUTDOWN_WAIT);
                executor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("State persistence loop stopped");
    }

    private void persistQuietly() {
        try {
            persistNow();
        }
        catch (StorageError e) {
            if (e.getErrorType() == ErrorType.VALIDATION_FAILURE) {
                log.error("Snapshot written but inconsistent: {}", e.getMessage());
            }
            else {
                log.error("Snapshot failed, will retry on next tick: {}", e.getMessage(), e);
            }
        }
        catch (RuntimeException e) {
            log.error("Unexpected error in state persistence loop, will retry on next tick", e);
        }
    }
}
