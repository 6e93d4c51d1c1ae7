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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable committed state of one workflow execution.
 *
 * <p>Every transition produces a new instance which is written to the
 * {@link dev.mars.weft.workflow.store.ExecutionStateStore} before anything else observes it.
 * The workflow definition is a snapshot taken at start.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExecutionState {

    private final String executionId;
    private final WorkflowDefinition workflow;
    private final ExecutionStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final Map<String, TaskState> taskStates;
    private final Map<String, Integer> attempts;
    private final List<TaskResult> results;
    private final Map<String, String> userData;
    private final String failureReason;

    @JsonCreator
    public ExecutionState(@JsonProperty("executionId") String executionId,
                          @JsonProperty("workflow") WorkflowDefinition workflow,
                          @JsonProperty("status") ExecutionStatus status,
                          @JsonProperty("startTime") Instant startTime,
                          @JsonProperty("endTime") Instant endTime,
                          @JsonProperty("taskStates") Map<String, TaskState> taskStates,
                          @JsonProperty("attempts") Map<String, Integer> attempts,
                          @JsonProperty("results") List<TaskResult> results,
                          @JsonProperty("userData") Map<String, String> userData,
                          @JsonProperty("failureReason") String failureReason) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflow = Objects.requireNonNull(workflow, "Workflow cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = endTime;
        this.taskStates = orderedCopy(taskStates);
        this.attempts = orderedCopy(attempts);
        this.results = results != null ? List.copyOf(results) : List.of();
        this.userData = orderedCopy(userData);
        this.failureReason = failureReason;
    }

    /**
     * Initial PENDING state with every task PENDING and no attempts.
     */
    public static ExecutionState pending(String executionId, WorkflowDefinition workflow,
                                         Map<String, String> userData, Instant startTime) {
        Map<String, TaskState> states = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (TaskDefinition task : workflow.getTasks()) {
            states.put(task.getName(), TaskState.PENDING);
            counts.put(task.getName(), 0);
        }
        return new ExecutionState(executionId, workflow, ExecutionStatus.PENDING, startTime, null,
                states, counts, List.of(), userData, null);
    }

    private static <V> Map<String, V> orderedCopy(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public String getExecutionId() {
        return executionId;
    }

    public WorkflowDefinition getWorkflow() {
        return workflow;
    }

    @JsonIgnore
    public String getWorkflowName() {
        return workflow.getName();
    }

    @JsonIgnore
    public String getWorkflowVersion() {
        return workflow.getVersion();
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Map<String, TaskState> getTaskStates() {
        return taskStates;
    }

    public TaskState getTaskState(String taskName) {
        return taskStates.getOrDefault(taskName, TaskState.PENDING);
    }

    public Map<String, Integer> getAttempts() {
        return attempts;
    }

    public int getAttemptCount(String taskName) {
        return attempts.getOrDefault(taskName, 0);
    }

    public List<TaskResult> getResults() {
        return results;
    }

    public Map<String, String> getUserData() {
        return userData;
    }

    public String getFailureReason() {
        return failureReason;
    }

    /**
     * Tasks with an attempt currently dispatched, in workflow order.
     */
    @JsonIgnore
    public List<String> getRunningTasks() {
        List<String> running = new ArrayList<>();
        taskStates.forEach((name, state) -> {
            if (state == TaskState.RUNNING) {
                running.add(name);
            }
        });
        return running;
    }

    public Optional<TaskResult> getLatestResult(String taskName) {
        for (int i = results.size() - 1; i >= 0; i--) {
            if (results.get(i).getTaskName().equals(taskName)) {
                return Optional.of(results.get(i));
            }
        }
        return Optional.empty();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionState that = (ExecutionState) o;
        return executionId.equals(that.executionId) &&
               workflow.equals(that.workflow) &&
               status == that.status &&
               startTime.equals(that.startTime) &&
               Objects.equals(endTime, that.endTime) &&
               taskStates.equals(that.taskStates) &&
               attempts.equals(that.attempts) &&
               results.equals(that.results) &&
               userData.equals(that.userData) &&
               Objects.equals(failureReason, that.failureReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId, status, startTime, endTime, taskStates, results.size());
    }

    @Override
    public String toString() {
        return "ExecutionState{" +
                "executionId='" + executionId + '\'' +
                ", workflow='" + workflow.getName() + "' v" + workflow.getVersion() +
                ", status=" + status +
                ", taskStates=" + taskStates +
                ", results=" + results.size() +
                '}';
    }

    /**
     * Mutable working copy used to assemble the next committed state.
     */
    public static final class Builder {
        private final String executionId;
        private final WorkflowDefinition workflow;
        private final Instant startTime;
        private ExecutionStatus status;
        private Instant endTime;
        private final Map<String, TaskState> taskStates;
        private final Map<String, Integer> attempts;
        private final List<TaskResult> results;
        private final Map<String, String> userData;
        private String failureReason;

        private Builder(ExecutionState source) {
            this.executionId = source.executionId;
            this.workflow = source.workflow;
            this.startTime = source.startTime;
            this.status = source.status;
            this.endTime = source.endTime;
            this.taskStates = new LinkedHashMap<>(source.taskStates);
            this.attempts = new LinkedHashMap<>(source.attempts);
            this.results = new ArrayList<>(source.results);
            this.userData = source.userData;
            this.failureReason = source.failureReason;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder taskState(String taskName, TaskState state) {
            taskStates.put(taskName, state);
            return this;
        }

        public Builder attempts(String taskName, int count) {
            attempts.put(taskName, count);
            return this;
        }

        public Builder result(TaskResult result) {
            results.add(result);
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public TaskState taskState(String taskName) {
            return taskStates.getOrDefault(taskName, TaskState.PENDING);
        }

        public ExecutionStatus status() {
            return status;
        }

        public ExecutionState build() {
            return new ExecutionState(executionId, workflow, status, startTime, endTime,
                    taskStates, attempts, results, userData, failureReason);
        }
    }
}
