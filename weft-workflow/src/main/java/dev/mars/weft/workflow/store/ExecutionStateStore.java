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

package dev.mars.weft.workflow.store;

import dev.mars.weft.workflow.ExecutionState;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Single source of truth for execution state.
 *
 * <p>Only the scheduler and the execution controller write to it. Each committed transition is
 * a complete immutable {@link ExecutionState}; readers always see the latest committed one.
 * Implementations signal unrecoverable failures with
 * {@link dev.mars.weft.core.exceptions.StateStoreException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public interface ExecutionStateStore {

    /**
     * Commits a state, replacing any earlier state with the same execution id.
     */
    void save(ExecutionState state);

    Optional<ExecutionState> find(String executionId);

    List<ExecutionState> findAll();

    /**
     * Executions that have not reached a terminal status, ordered by start time.
     */
    List<ExecutionState> findActive();

    /**
     * Executions of a workflow whose start time lies within {@code [from, to]}, ordered by start time
     * ascending. A {@code null} bound is open.
     */
    List<ExecutionState> findHistory(String workflowName, Instant from, Instant to);

    /**
     * Removes an execution.
     *
     * @return {@code true} if the execution existed
     */
    boolean purge(String executionId);

    byte[] takeSnapshot();

    /**
     * Replaces the store's contents with a snapshot produced by {@link #takeSnapshot()}.
     */
    void restoreSnapshot(byte[] snapshot);

    /**
     * Writes a snapshot to a file through a temporary file and an atomic rename.
     */
    void snapshotTo(Path file);

    void restoreFrom(Path file);

    int size();
}
