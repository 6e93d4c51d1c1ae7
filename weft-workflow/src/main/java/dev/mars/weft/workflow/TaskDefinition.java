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
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable definition of a single task within a workflow.
 *
 * <p>A task names the tasks it depends on, a timeout in seconds (zero means no deadline) and
 * the maximum number of retries after the first attempt. The work itself is either an inline
 * {@link TaskExecutable} or a {@code handler} name resolved through the engine's handler
 * registry, with string {@code parameters} passed to each attempt.</p>
 *
 * <p>Equality is structural and ignores the inline executable, which is never serialized.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "description", "dependsOn", "handler", "parameters", "timeoutSeconds", "retryCount"})
public final class TaskDefinition {

    private final String name;
    private final List<String> dependsOn;
    private final String handler;
    private final Map<String, String> parameters;
    private final long timeoutSeconds;
    private final int retryCount;
    private final String description;
    private final TaskExecutable executable;

    @JsonCreator
    public TaskDefinition(@JsonProperty("name") String name,
                          @JsonProperty("dependsOn") List<String> dependsOn,
                          @JsonProperty("handler") String handler,
                          @JsonProperty("parameters") Map<String, String> parameters,
                          @JsonProperty("timeoutSeconds") long timeoutSeconds,
                          @JsonProperty("retryCount") int retryCount,
                          @JsonProperty("description") String description) {
        this(name, dependsOn, handler, parameters, timeoutSeconds, retryCount, description, null);
    }

    private TaskDefinition(String name, List<String> dependsOn, String handler,
                           Map<String, String> parameters, long timeoutSeconds, int retryCount,
                           String description, TaskExecutable executable) {
        Objects.requireNonNull(name, "Task name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be blank");
        }
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("Timeout cannot be negative for task '" + name + "': " + timeoutSeconds);
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("Retry count cannot be negative for task '" + name + "': " + retryCount);
        }
        LinkedHashSet<String> deps = new LinkedHashSet<>();
        if (dependsOn != null) {
            for (String dep : dependsOn) {
                Objects.requireNonNull(dep, "Dependency name cannot be null in task '" + name + "'");
                deps.add(dep);
            }
        }
        if (deps.contains(name)) {
            throw new IllegalArgumentException("Task '" + name + "' cannot depend on itself");
        }
        this.name = name;
        this.dependsOn = List.copyOf(deps);
        this.handler = handler;
        this.parameters = parameters == null || parameters.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.timeoutSeconds = timeoutSeconds;
        this.retryCount = retryCount;
        this.description = description;
        this.executable = executable;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        return new Builder(name)
                .dependsOn(dependsOn)
                .handler(handler)
                .parameters(parameters)
                .timeoutSeconds(timeoutSeconds)
                .retryCount(retryCount)
                .description(description)
                .executable(executable);
    }

    /**
     * Returns a copy of this task bound to the given executable.
     */
    public TaskDefinition withExecutable(TaskExecutable executable) {
        return new TaskDefinition(name, dependsOn, handler, parameters, timeoutSeconds, retryCount,
                description, executable);
    }

    public String getName() {
        return name;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public String getHandler() {
        return handler;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public String getDescription() {
        return description;
    }

    @JsonIgnore
    public TaskExecutable getExecutable() {
        return executable;
    }

    public boolean dependsOn(String taskName) {
        return dependsOn.contains(taskName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskDefinition that = (TaskDefinition) o;
        return timeoutSeconds == that.timeoutSeconds &&
               retryCount == that.retryCount &&
               name.equals(that.name) &&
               dependsOn.equals(that.dependsOn) &&
               Objects.equals(handler, that.handler) &&
               parameters.equals(that.parameters) &&
               Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dependsOn, handler, parameters, timeoutSeconds, retryCount, description);
    }

    @Override
    public String toString() {
        return "TaskDefinition{" +
                "name='" + name + '\'' +
                ", dependsOn=" + dependsOn +
                (handler != null ? ", handler='" + handler + '\'' : "") +
                ", timeoutSeconds=" + timeoutSeconds +
                ", retryCount=" + retryCount +
                '}';
    }

    public static final class Builder {
        private final String name;
        private final List<String> dependsOn = new ArrayList<>();
        private String handler;
        private final Map<String, String> parameters = new LinkedHashMap<>();
        private long timeoutSeconds;
        private int retryCount;
        private String description;
        private TaskExecutable executable;

        private Builder(String name) {
            this.name = name;
        }

        public Builder dependsOn(String... names) {
            dependsOn.addAll(Arrays.asList(names));
            return this;
        }

        public Builder dependsOn(List<String> names) {
            dependsOn.addAll(names);
            return this;
        }

        public Builder handler(String handler) {
            this.handler = handler;
            return this;
        }

        public Builder parameter(String key, String value) {
            parameters.put(key, value);
            return this;
        }

        public Builder parameters(Map<String, String> parameters) {
            this.parameters.putAll(parameters);
            return this;
        }

        public Builder timeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder executable(TaskExecutable executable) {
            this.executable = executable;
            return this;
        }

        public TaskDefinition build() {
            return new TaskDefinition(name, dependsOn, handler, parameters, timeoutSeconds, retryCount,
                    description, executable);
        }
    }
}
