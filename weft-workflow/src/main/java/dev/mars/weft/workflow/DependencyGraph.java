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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validated dependency graph over the tasks of one workflow.
 *
 * <p>Instances are immutable and only created through {@link #build(WorkflowDefinition)},
 * which guarantees every dependency name resolves and the relation is acyclic. All queries
 * return task names in workflow insertion order, which is the dispatch tie-break order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public final class DependencyGraph {

    private enum Mark { UNVISITED, IN_PROGRESS, DONE }

    private final String workflowName;
    private final List<String> taskNames;
    private final Map<String, List<String>> dependencies;
    private final Map<String, List<String>> dependents;

    private DependencyGraph(String workflowName, List<String> taskNames,
                            Map<String, List<String>> dependencies,
                            Map<String, List<String>> dependents) {
        this.workflowName = workflowName;
        this.taskNames = taskNames;
        this.dependencies = dependencies;
        this.dependents = dependents;
    }

    /**
     * Builds the graph for a workflow.
     *
     * @param workflow the workflow definition
     * @return the validated graph
     * @throws UnknownDependencyException if a task depends on a name that is not in the workflow
     * @throws CyclicDependencyException  if the dependency relation contains a cycle
     */
    public static DependencyGraph build(WorkflowDefinition workflow)
            throws UnknownDependencyException, CyclicDependencyException {
        Objects.requireNonNull(workflow, "Workflow definition cannot be null");

        Map<String, List<String>> deps = new LinkedHashMap<>();
        for (TaskDefinition task : workflow.getTasks()) {
            deps.put(task.getName(), task.getDependsOn());
        }
        for (TaskDefinition task : workflow.getTasks()) {
            for (String dep : task.getDependsOn()) {
                if (!deps.containsKey(dep)) {
                    throw new UnknownDependencyException(workflow.getName(), task.getName(), dep);
                }
            }
        }
        Optional<List<String>> cycle = findCycle(deps);
        if (cycle.isPresent()) {
            throw new CyclicDependencyException(workflow.getName(), cycle.get());
        }

        Map<String, List<String>> reverse = new LinkedHashMap<>();
        deps.keySet().forEach(name -> reverse.put(name, new ArrayList<>()));
        deps.forEach((name, taskDeps) -> taskDeps.forEach(dep -> reverse.get(dep).add(name)));
        Map<String, List<String>> frozenReverse = new LinkedHashMap<>();
        reverse.forEach((name, list) -> frozenReverse.put(name, List.copyOf(list)));

        return new DependencyGraph(workflow.getName(), List.copyOf(deps.keySet()),
                Collections.unmodifiableMap(deps), Collections.unmodifiableMap(frozenReverse));
    }

    /**
     * Validates a workflow without throwing, reporting every unknown dependency and the first
     * cycle found.
     */
    public static ValidationResult validate(WorkflowDefinition workflow) {
        Objects.requireNonNull(workflow, "Workflow definition cannot be null");
        ValidationResult result = new ValidationResult();

        if (workflow.getTasks().isEmpty()) {
            result.addWarning("tasks", "Workflow '" + workflow.getName() + "' has no tasks");
        }

        Map<String, List<String>> deps = new LinkedHashMap<>();
        for (TaskDefinition task : workflow.getTasks()) {
            deps.put(task.getName(), task.getDependsOn());
        }
        Map<String, List<String>> knownOnly = new LinkedHashMap<>();
        for (TaskDefinition task : workflow.getTasks()) {
            List<String> known = new ArrayList<>();
            for (String dep : task.getDependsOn()) {
                if (deps.containsKey(dep)) {
                    known.add(dep);
                } else {
                    result.addError("tasks." + task.getName() + ".dependsOn",
                            "Dependency '" + dep + "' not found");
                }
            }
            knownOnly.put(task.getName(), known);
        }

        findCycle(knownOnly).ifPresent(cycle ->
                result.addError("tasks", "Cyclic dependency: " + String.join(" -> ", cycle)));
        return result;
    }

    /**
     * Three-colour depth-first search, starting from tasks in insertion order and following
     * dependency edges. An edge into an in-progress task closes a cycle.
     */
    private static Optional<List<String>> findCycle(Map<String, List<String>> deps) {
        Map<String, Mark> marks = new HashMap<>();
        deps.keySet().forEach(name -> marks.put(name, Mark.UNVISITED));
        Deque<String> path = new ArrayDeque<>();
        for (String name : deps.keySet()) {
            if (marks.get(name) == Mark.UNVISITED) {
                List<String> cycle = visit(name, deps, marks, path);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> visit(String name, Map<String, List<String>> deps,
                                      Map<String, Mark> marks, Deque<String> path) {
        marks.put(name, Mark.IN_PROGRESS);
        path.addLast(name);
        for (String dep : deps.getOrDefault(name, List.of())) {
            Mark mark = marks.get(dep);
            if (mark == Mark.IN_PROGRESS) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String step : path) {
                    if (step.equals(dep)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(step);
                    }
                }
                cycle.add(dep);
                return cycle;
            }
            if (mark == Mark.UNVISITED) {
                List<String> cycle = visit(dep, deps, marks, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.removeLast();
        marks.put(name, Mark.DONE);
        return null;
    }

    /**
     * Tasks whose dependencies are all in {@code resolved} and which are not in {@code excluded},
     * in insertion order. Pure: the graph is not modified.
     *
     * @param resolved tasks that succeeded or were skipped
     * @param excluded tasks that must not be returned, typically everything already attempted or terminal
     */
    public List<String> readySet(Collection<String> resolved, Collection<String> excluded) {
        List<String> ready = new ArrayList<>();
        for (String name : taskNames) {
            if (excluded.contains(name) || resolved.contains(name)) {
                continue;
            }
            if (resolved.containsAll(dependencies.get(name))) {
                ready.add(name);
            }
        }
        return ready;
    }

    /**
     * Every task that directly or indirectly depends on {@code taskName}, in insertion order.
     */
    public Set<String> transitiveDependents(String taskName) {
        requireTask(taskName);
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(dependents.get(taskName));
        while (!pending.isEmpty()) {
            String next = pending.poll();
            if (reached.add(next)) {
                pending.addAll(dependents.get(next));
            }
        }
        Set<String> ordered = new LinkedHashSet<>();
        for (String name : taskNames) {
            if (reached.contains(name)) {
                ordered.add(name);
            }
        }
        return ordered;
    }

    /**
     * A dependency-respecting order of all tasks. Among tasks whose dependencies are already
     * placed, the one declared first comes first.
     */
    public List<String> topologicalOrder() {
        List<String> order = new ArrayList<>(taskNames.size());
        Set<String> placed = new LinkedHashSet<>();
        while (order.size() < taskNames.size()) {
            for (String name : taskNames) {
                if (!placed.contains(name) && placed.containsAll(dependencies.get(name))) {
                    order.add(name);
                    placed.add(name);
                    break;
                }
            }
        }
        return order;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public List<String> getTaskNames() {
        return taskNames;
    }

    public List<String> getDependencies(String taskName) {
        requireTask(taskName);
        return dependencies.get(taskName);
    }

    public List<String> getDependents(String taskName) {
        requireTask(taskName);
        return dependents.get(taskName);
    }

    public boolean contains(String taskName) {
        return dependencies.containsKey(taskName);
    }

    public int size() {
        return taskNames.size();
    }

    private void requireTask(String taskName) {
        if (!dependencies.containsKey(taskName)) {
            throw new IllegalArgumentException("Unknown task '" + taskName + "' in workflow '" + workflowName + "'");
        }
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "workflow='" + workflowName + '\'' +
               ", dependencies=" + dependencies +
               '}';
    }
}
