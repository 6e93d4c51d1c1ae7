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

package dev.mars.weft.workflow;

import dev.mars.weft.core.exceptions.InvalidParameterException;
import dev.mars.weft.core.exceptions.InvalidTransitionException;
import dev.mars.weft.core.exceptions.NotFoundException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Execution controller: starts workflows and controls their executions.
 *
 * <p>Task failures never surface as exceptions from these methods. They are recorded as
 * {@link TaskResult}s and observable through {@link #getResult(String)} and {@link #getStatus(String)}.</p>
 */
public interface WorkflowEngine {

    /**
     * Starts a new execution of the named workflow.
     *
     * @param workflowName the registered workflow name
     * @return the new execution id
     * @throws NotFoundException         if the workflow is unknown or disabled
     * @throws InvalidParameterException if the task graph is malformed or a task has no executable
     */
    String start(String workflowName) throws NotFoundException, InvalidParameterException;

    /**
     * Starts a new execution with opaque user data visible to every task attempt.
     */
    String start(String workflowName, Map<String, String> userData)
            throws NotFoundException, InvalidParameterException;

    /**
     * Stops dispatching, lets running attempts drain, then cancels the execution.
     *
     * @throws InvalidTransitionException if the execution is already terminal or stopping
     */
    void stop(String executionId) throws NotFoundException, InvalidTransitionException;

    /**
     * Stops dispatching new attempts. Running attempts are unaffected.
     *
     * @throws InvalidTransitionException if the execution is not running
     */
    void pause(String executionId) throws NotFoundException, InvalidTransitionException;

    /**
     * @throws InvalidTransitionException if the execution is not paused
     */
    void resume(String executionId) throws NotFoundException, InvalidTransitionException;

    ExecutionContext getStatus(String executionId) throws NotFoundException;

    WorkflowResult getResult(String executionId) throws NotFoundException;

    /**
     * Waits for an execution to reach a terminal status.
     *
     * @throws TimeoutException if it is still active after {@code timeout}
     */
    WorkflowResult awaitResult(String executionId, Duration timeout)
            throws NotFoundException, TimeoutException, InterruptedException;

    /**
     * Executions that have not reached a terminal status.
     */
    List<ExecutionContext> listRunning();

    /**
     * Results of the workflow's executions started within {@code [from, to]}, oldest first.
     */
    List<WorkflowResult> getHistory(String workflowName, Instant from, Instant to);

    /**
     * Read-only check of a registered workflow's task graph. Never creates an execution.
     */
    ValidationResult validateDependencies(String workflowName) throws NotFoundException;

    /**
     * Resumes every active execution in the state store that has no live dispatcher,
     * typically after the store was restored from a snapshot.
     *
     * @return ids of the executions resumed
     */
    List<String> recover();

    /**
     * Removes a terminal execution from the state store.
     */
    void purge(String executionId) throws NotFoundException, InvalidParameterException;

    void addListener(WorkflowEventListener listener);

    void removeListener(WorkflowEventListener listener);

    /**
     * Stops accepting work and shuts the worker pool down. Active executions are left as
     * last committed so that {@link #recover()} can resume them later.
     */
    void shutdown();
}
