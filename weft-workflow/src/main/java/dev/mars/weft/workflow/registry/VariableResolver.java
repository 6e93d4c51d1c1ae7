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

package dev.mars.weft.workflow.registry;

import dev.mars.weft.workflow.TaskDefinition;
import dev.mars.weft.workflow.WorkflowDefinition;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves variables in workflow templates using template substitution.
 * Supports variable references in the format {{variableName}}.
 */
public class VariableResolver {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    private final Map<String, String> defaults;
    private final Map<String, String> overrides;

    public VariableResolver() {
        this(Map.of(), Map.of());
    }

    /**
     * @param defaults  values used when no override is given, usually the template's variables
     * @param overrides values supplied at instantiation; they take precedence over defaults
     */
    public VariableResolver(Map<String, String> defaults, Map<String, String> overrides) {
        this.defaults = new LinkedHashMap<>(defaults != null ? defaults : Map.of());
        this.overrides = new LinkedHashMap<>(overrides != null ? overrides : Map.of());
    }

    /**
     * Resolves variables in a string template.
     *
     * @param template the template string containing variable references
     * @return the resolved string with variables substituted
     * @throws VariableResolutionException if a variable cannot be resolved
     */
    public String resolve(String template) {
        if (template == null) {
            return null;
        }

        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String variableName = matcher.group(1).trim();
            String value = resolveVariable(variableName);

            if (value == null) {
                throw new VariableResolutionException("Variable not found: " + variableName);
            }

            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Resolves variables in a task's description, handler name and parameter values.
     */
    public TaskDefinition resolve(TaskDefinition task) {
        Objects.requireNonNull(task, "Task definition cannot be null");

        Map<String, String> resolvedParameters = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : task.getParameters().entrySet()) {
            resolvedParameters.put(entry.getKey(), resolve(entry.getValue()));
        }

        return task.toBuilder()
                .description(resolve(task.getDescription()))
                .handler(resolve(task.getHandler()))
                .parameters(resolvedParameters)
                .build();
    }

    /**
     * Resolves variables in a complete workflow definition. The workflow's own variables are
     * kept, with overrides applied, so that the result records what it was instantiated with.
     */
    public WorkflowDefinition resolve(WorkflowDefinition workflow) {
        Objects.requireNonNull(workflow, "Workflow definition cannot be null");

        List<TaskDefinition> resolvedTasks = workflow.getTasks().stream()
                .map(this::resolve)
                .toList();

        return workflow.toBuilder()
                .description(resolve(workflow.getDescription()))
                .variables(getAllVariables())
                .build()
                .withTasks(resolvedTasks);
    }

    /**
     * Checks if a template contains any variable references.
     */
    public boolean hasVariables(String template) {
        if (template == null) {
            return false;
        }
        return VARIABLE_PATTERN.matcher(template).find();
    }

    /**
     * Gets all variable names referenced in a template, in order of first appearance.
     */
    public Set<String> getVariableNames(String template) {
        if (template == null) {
            return Set.of();
        }

        Set<String> variables = new LinkedHashSet<>();
        Matcher matcher = VARIABLE_PATTERN.matcher(template);

        while (matcher.find()) {
            variables.add(matcher.group(1).trim());
        }

        return variables;
    }

    /**
     * Gets all available variables (overrides win over defaults).
     */
    public Map<String, String> getAllVariables() {
        Map<String, String> allVariables = new LinkedHashMap<>(defaults);
        allVariables.putAll(overrides);
        return allVariables;
    }

    private String resolveVariable(String variableName) {
        if (overrides.containsKey(variableName)) {
            return overrides.get(variableName);
        }
        return defaults.get(variableName);
    }

    /**
     * Exception thrown when variable resolution fails.
     */
    public static class VariableResolutionException extends RuntimeException {
        public VariableResolutionException(String message) {
            super(message);
        }
    }
}
