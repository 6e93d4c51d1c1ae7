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

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Status view of an execution as returned by {@link WorkflowEngine#getStatus(String)}.
 */
public final class ExecutionContext {

    private final String executionId;
    private final String workflowName;
    private final String workflowVersion;
    private final ExecutionStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final List<String> runningTasks;
    private final Map<String, TaskState> taskStates;
    private final Map<String, String> userData;

    public ExecutionContext(String executionId, String workflowName, String workflowVersion,
                            ExecutionStatus status, Instant startTime, Instant endTime,
                            List<String> runningTasks, Map<String, TaskState> taskStates,
                            Map<String, String> userData) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.workflowVersion = workflowVersion;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startTime = startTime;
        this.endTime = endTime;
        this.runningTasks = runningTasks != null ? List.copyOf(runningTasks) : List.of();
        this.taskStates = taskStates != null ? taskStates : Map.of();
        this.userData = userData != null ? userData : Map.of();
    }

    public static ExecutionContext from(ExecutionState state) {
        return new ExecutionContext(state.getExecutionId(), state.getWorkflowName(), state.getWorkflowVersion(),
                state.getStatus(), state.getStartTime(), state.getEndTime(), state.getRunningTasks(),
                state.getTaskStates(), state.getUserData());
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getWorkflowVersion() {
        return workflowVersion;
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

    /**
     * Tasks with an attempt in flight at the time of the last committed transition.
     */
    public List<String> getRunningTasks() {
        return runningTasks;
    }

    public Map<String, TaskState> getTaskStates() {
        return taskStates;
    }

    public Map<String, String> getUserData() {
        return userData;
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
                "executionId='" + executionId + '\'' +
                ", workflow='" + workflowName + '\'' +
                ", status=" + status +
                ", runningTasks=" + runningTasks +
                '}';
    }
}
