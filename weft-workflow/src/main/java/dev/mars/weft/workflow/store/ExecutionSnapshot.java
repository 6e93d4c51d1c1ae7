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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.weft.workflow.ExecutionState;

import java.time.Instant;
import java.util.List;

/**
 * Serialized form of an {@link ExecutionStateStore}'s contents.
 */
public class ExecutionSnapshot {

    public static final int FORMAT_VERSION = 1;

    private final int formatVersion;
    private final List<ExecutionState> executions;
    private final Instant timestamp;

    @JsonCreator
    public ExecutionSnapshot(@JsonProperty("formatVersion") int formatVersion,
                             @JsonProperty("executions") List<ExecutionState> executions,
                             @JsonProperty("timestamp") Instant timestamp) {
        this.formatVersion = formatVersion;
        this.executions = executions != null ? List.copyOf(executions) : List.of();
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public ExecutionSnapshot(List<ExecutionState> executions) {
        this(FORMAT_VERSION, executions, Instant.now());
    }

    public int getFormatVersion() {
        return formatVersion;
    }

    public List<ExecutionState> getExecutions() {
        return executions;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "ExecutionSnapshot{" +
                "formatVersion=" + formatVersion +
                ", executions=" + executions.size() +
                ", timestamp=" + timestamp +
                '}';
    }
}
