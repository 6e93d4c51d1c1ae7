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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, versioned definition of a workflow: an ordered collection of tasks forming a
 * dependency graph.
 *
 * <p>Task order is significant. When worker capacity is limited, ready tasks are dispatched in
 * the order they appear here. The {@code variables} map holds default values for template
 * placeholders.</p>
 *
 * <p>Edits return new instances. Executions always run against the instance captured at start,
 * so later edits never affect them.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "version", "description", "enabled", "variables", "tasks"})
public final class WorkflowDefinition {

    public static final String DEFAULT_VERSION = "1.0.0";

    private final String name;
    private final String version;
    private final String description;
    private final boolean enabled;
    private final List<TaskDefinition> tasks;
    private final Map<String, String> variables;

    @JsonCreator
    public WorkflowDefinition(@JsonProperty("name") String name,
                              @JsonProperty("version") String version,
                              @JsonProperty("description") String description,
                              @JsonProperty("enabled") Boolean enabled,
                              @JsonProperty("tasks") List<TaskDefinition> tasks,
                              @JsonProperty("variables") Map<String, String> variables) {
        Objects.requireNonNull(name, "Workflow name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Workflow name cannot be blank");
        }
        this.name = name;
        this.version = version != null && !version.isBlank() ? version : DEFAULT_VERSION;
        this.description = description;
        this.enabled = enabled == null || enabled;
        this.tasks = tasks != null ? List.copyOf(tasks) : List.of();
        this.variables = variables == null || variables.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));

        Set<String> seen = new HashSet<>();
        for (TaskDefinition task : this.tasks) {
            if (!seen.add(task.getName())) {
                throw new IllegalArgumentException("Duplicate task name '" + task.getName()
                        + "' in workflow '" + name + "'");
            }
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(name)
                .version(version)
                .description(description)
                .enabled(enabled)
                .variables(variables);
        tasks.forEach(builder::task);
        return builder;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<TaskDefinition> getTasks() {
        return tasks;
    }

    public Map<String, String> getVariables() {
        return variables;
    }

    public Optional<TaskDefinition> getTask(String taskName) {
        for (TaskDefinition task : tasks) {
            if (task.getName().equals(taskName)) {
                return Optional.of(task);
            }
        }
        return Optional.empty();
    }

    public boolean hasTask(String taskName) {
        return getTask(taskName).isPresent();
    }

    @JsonIgnore
    public List<String> getTaskNames() {
        List<String> names = new ArrayList<>(tasks.size());
        tasks.forEach(t -> names.add(t.getName()));
        return names;
    }

    /**
     * Returns a copy with the task appended.
     *
     * @throws IllegalArgumentException if a task with the same name exists
     */
    public WorkflowDefinition withTask(TaskDefinition task) {
        Objects.requireNonNull(task, "Task cannot be null");
        List<TaskDefinition> updated = new ArrayList<>(tasks);
        updated.add(task);
        return new WorkflowDefinition(name, version, description, enabled, updated, variables);
    }

    /**
     * Returns a copy without the named task. Dependencies of other tasks are left untouched.
     */
    public WorkflowDefinition withoutTask(String taskName) {
        List<TaskDefinition> updated = new ArrayList<>(tasks);
        updated.removeIf(t -> t.getName().equals(taskName));
        return new WorkflowDefinition(name, version, description, enabled, updated, variables);
    }

    /**
     * Returns a copy with the task of the same name replaced in place, keeping its position.
     *
     * @throws IllegalArgumentException if no task with that name exists
     */
    public WorkflowDefinition withUpdatedTask(TaskDefinition task) {
        Objects.requireNonNull(task, "Task cannot be null");
        List<TaskDefinition> updated = new ArrayList<>(tasks);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).getName().equals(task.getName())) {
                updated.set(i, task);
                return new WorkflowDefinition(name, version, description, enabled, updated, variables);
            }
        }
        throw new IllegalArgumentException("Task '" + task.getName() + "' not found in workflow '" + name + "'");
    }

    public WorkflowDefinition withTasks(List<TaskDefinition> replacement) {
        return new WorkflowDefinition(name, version, description, enabled, replacement, variables);
    }

    public WorkflowDefinition withEnabled(boolean enabled) {
        return new WorkflowDefinition(name, version, description, enabled, tasks, variables);
    }

    public WorkflowDefinition withVersion(String version) {
        return new WorkflowDefinition(name, version, description, enabled, tasks, variables);
    }

    public WorkflowDefinition withName(String name) {
        return new WorkflowDefinition(name, version, description, enabled, tasks, variables);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return enabled == that.enabled &&
               name.equals(that.name) &&
               version.equals(that.version) &&
               Objects.equals(description, that.description) &&
               tasks.equals(that.tasks) &&
               variables.equals(that.variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, description, enabled, tasks, variables);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
                "name='" + name + '\'' +
                ", version='" + version + '\'' +
                ", enabled=" + enabled +
                ", tasks=" + getTaskNames() +
                '}';
    }

    public static final class Builder {
        private final String name;
        private String version = DEFAULT_VERSION;
        private String description;
        private boolean enabled = true;
        private final List<TaskDefinition> tasks = new ArrayList<>();
        private final Map<String, String> variables = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder task(TaskDefinition task) {
            tasks.add(Objects.requireNonNull(task, "Task cannot be null"));
            return this;
        }

        public Builder task(TaskDefinition.Builder task) {
            return task(task.build());
        }

        public Builder variable(String key, String value) {
            variables.put(key, value);
            return this;
        }

        public Builder variables(Map<String, String> variables) {
            this.variables.putAll(variables);
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(name, version, description, enabled, tasks, variables);
        }
    }
}
