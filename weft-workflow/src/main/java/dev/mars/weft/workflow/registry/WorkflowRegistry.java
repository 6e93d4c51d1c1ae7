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

import dev.mars.weft.core.exceptions.AlreadyExistsException;
import dev.mars.weft.core.exceptions.InvalidParameterException;
import dev.mars.weft.core.exceptions.NotFoundException;
import dev.mars.weft.workflow.DependencyGraph;
import dev.mars.weft.workflow.TaskDefinition;
import dev.mars.weft.workflow.WorkflowDefinition;
import dev.mars.weft.workflow.persistence.WorkflowCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named workflow definitions, their schedule policies and reusable templates.
 *
 * <p>Definitions are immutable. Every edit builds a new definition, validates its task graph and
 * swaps it in with a compare-and-replace, retrying if another edit to the same workflow won the
 * race. Structural edits (adding, removing or updating a task) bump the last numeric segment of
 * the version, so {@code 1.0.0} becomes {@code 1.0.1}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-12
 * @version 1.0
 */
public class WorkflowRegistry {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowRegistry.class);
    private static final Pattern TRAILING_NUMBER = Pattern.compile("^(.*?)(\\d+)$");

    private final ConcurrentHashMap<String, WorkflowDefinition> workflows = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SchedulePolicy> schedules = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, WorkflowDefinition> templates = new ConcurrentHashMap<>();
    private final WorkflowCodec codec;

    public WorkflowRegistry() {
        this(new WorkflowCodec());
    }

    public WorkflowRegistry(WorkflowCodec codec) {
        this.codec = Objects.requireNonNull(codec, "Codec cannot be null");
    }

    // ---------------------------------------------------------------- workflows

    /**
     * Creates an empty, enabled workflow at the default version.
     */
    public WorkflowDefinition createWorkflow(String name) throws AlreadyExistsException {
        WorkflowDefinition workflow = WorkflowDefinition.builder(name).build();
        if (workflows.putIfAbsent(name, workflow) != null) {
            throw new AlreadyExistsException("Workflow", name);
        }
        logger.info("Created workflow '{}'", name);
        return workflow;
    }

    /**
     * Registers a complete definition after validating its task graph.
     */
    public WorkflowDefinition register(WorkflowDefinition workflow)
            throws AlreadyExistsException, InvalidParameterException {
        Objects.requireNonNull(workflow, "Workflow definition cannot be null");
        validate(workflow);
        if (workflows.putIfAbsent(workflow.getName(), workflow) != null) {
            throw new AlreadyExistsException("Workflow", workflow.getName());
        }
        logger.info("Registered workflow '{}' version {} with {} task(s)",
                workflow.getName(), workflow.getVersion(), workflow.getTasks().size());
        return workflow;
    }

    public WorkflowDefinition addTask(String workflowName, TaskDefinition task)
            throws NotFoundException, AlreadyExistsException, InvalidParameterException {
        Objects.requireNonNull(task, "Task cannot be null");
        while (true) {
            WorkflowDefinition current = require(workflowName);
            if (current.hasTask(task.getName())) {
                throw new AlreadyExistsException("Task", workflowName + "/" + task.getName());
            }
            WorkflowDefinition updated = bumpVersion(current.withTask(task));
            validate(updated);
            if (workflows.replace(workflowName, current, updated)) {
                logger.info("Added task '{}' to workflow '{}' (version {})",
                        task.getName(), workflowName, updated.getVersion());
                return updated;
            }
        }
    }

    /**
     * Removes a task that no other task depends on.
     *
     * @throws InvalidParameterException if other tasks depend on it
     */
    public WorkflowDefinition removeTask(String workflowName, String taskName)
            throws NotFoundException, InvalidParameterException {
        while (true) {
            WorkflowDefinition current = require(workflowName);
            if (!current.hasTask(taskName)) {
                throw new NotFoundException("Task", workflowName + "/" + taskName);
            }
            List<String> dependents = current.getTasks().stream()
                    .filter(t -> t.dependsOn(taskName))
                    .map(TaskDefinition::getName)
                    .toList();
            if (!dependents.isEmpty()) {
                throw new InvalidParameterException("Task '" + taskName + "' in workflow '" + workflowName
                        + "' is required by " + dependents);
            }
            WorkflowDefinition updated = bumpVersion(current.withoutTask(taskName));
            if (workflows.replace(workflowName, current, updated)) {
                logger.info("Removed task '{}' from workflow '{}' (version {})",
                        taskName, workflowName, updated.getVersion());
                return updated;
            }
        }
    }

    /**
     * Replaces the task with the same name, keeping its position, and re-validates the graph.
     */
    public WorkflowDefinition updateTask(String workflowName, TaskDefinition task)
            throws NotFoundException, InvalidParameterException {
        Objects.requireNonNull(task, "Task cannot be null");
        while (true) {
            WorkflowDefinition current = require(workflowName);
            if (!current.hasTask(task.getName())) {
                throw new NotFoundException("Task", workflowName + "/" + task.getName());
            }
            WorkflowDefinition updated = bumpVersion(current.withUpdatedTask(task));
            validate(updated);
            if (workflows.replace(workflowName, current, updated)) {
                logger.info("Updated task '{}' in workflow '{}' (version {})",
                        task.getName(), workflowName, updated.getVersion());
                return updated;
            }
        }
    }

    /**
     * Enables or disables new starts of a workflow. Executions already running are unaffected.
     */
    public WorkflowDefinition setEnabled(String workflowName, boolean enabled) throws NotFoundException {
        while (true) {
            WorkflowDefinition current = require(workflowName);
            if (current.isEnabled() == enabled) {
                return current;
            }
            WorkflowDefinition updated = current.withEnabled(enabled);
            if (workflows.replace(workflowName, current, updated)) {
                logger.info("Workflow '{}' {}", workflowName, enabled ? "enabled" : "disabled");
                return updated;
            }
        }
    }

    public void deleteWorkflow(String workflowName) throws NotFoundException {
        if (workflows.remove(workflowName) == null) {
            throw new NotFoundException("Workflow", workflowName);
        }
        schedules.remove(workflowName);
        logger.info("Deleted workflow '{}'", workflowName);
    }

    public WorkflowDefinition getInfo(String workflowName) throws NotFoundException {
        return require(workflowName);
    }

    public Optional<WorkflowDefinition> find(String workflowName) {
        return Optional.ofNullable(workflowName != null ? workflows.get(workflowName) : null);
    }

    public boolean contains(String workflowName) {
        return workflowName != null && workflows.containsKey(workflowName);
    }

    /**
     * All registered workflows ordered by name.
     */
    public List<WorkflowDefinition> list() {
        List<WorkflowDefinition> all = new ArrayList<>(workflows.values());
        all.sort(Comparator.comparing(WorkflowDefinition::getName));
        return all;
    }

    // ---------------------------------------------------------------- schedules

    public void setSchedule(String workflowName, String policy, String data) throws NotFoundException {
        SchedulePolicy schedule = new SchedulePolicy(policy, data);
        if (schedules.compute(workflowName, (name, old) -> workflows.containsKey(name) ? schedule : null) == null) {
            throw new NotFoundException("Workflow", workflowName);
        }
        logger.debug("Schedule of workflow '{}' set to {}", workflowName, schedule);
    }

    public Optional<SchedulePolicy> getSchedule(String workflowName) throws NotFoundException {
        require(workflowName);
        return Optional.ofNullable(schedules.get(workflowName));
    }

    // ---------------------------------------------------------------- templates

    /**
     * Stores a copy of a registered workflow as a template.
     */
    public WorkflowDefinition createTemplate(String templateName, String workflowName)
            throws NotFoundException, AlreadyExistsException {
        WorkflowDefinition template = require(workflowName).withName(templateName);
        if (templates.putIfAbsent(templateName, template) != null) {
            throw new AlreadyExistsException("Template", templateName);
        }
        logger.info("Created template '{}' from workflow '{}'", templateName, workflowName);
        return template;
    }

    /**
     * Registers a new workflow from a template, substituting {@code {{name}}} references in
     * descriptions, handler names and task parameter values. The template's variables are the
     * defaults; {@code parameters} override them.
     *
     * @throws InvalidParameterException if a reference has no value or the result is invalid
     */
    public WorkflowDefinition instantiateTemplate(String templateName, String workflowName,
                                                  Map<String, String> parameters)
            throws NotFoundException, AlreadyExistsException, InvalidParameterException {
        WorkflowDefinition template = templates.get(templateName);
        if (template == null) {
            throw new NotFoundException("Template", templateName);
        }
        VariableResolver resolver = new VariableResolver(template.getVariables(), parameters);
        WorkflowDefinition instance;
        try {
            instance = resolver.resolve(template)
                    .withName(workflowName)
                    .withVersion(WorkflowDefinition.DEFAULT_VERSION);
        } catch (VariableResolver.VariableResolutionException e) {
            throw new InvalidParameterException("Cannot instantiate template '" + templateName + "': "
                    + e.getMessage(), e);
        }
        return register(instance);
    }

    public Optional<WorkflowDefinition> getTemplate(String templateName) {
        return Optional.ofNullable(templates.get(templateName));
    }

    /**
     * Template names in alphabetical order.
     */
    public List<String> listTemplates() {
        return templates.keySet().stream().sorted().toList();
    }

    // ---------------------------------------------------------------- export / import

    public String exportJson(String workflowName) throws NotFoundException {
        return codec.toJson(require(workflowName));
    }

    /**
     * Parses and registers a workflow exported with {@link #exportJson(String)}.
     */
    public WorkflowDefinition importJson(String json) throws InvalidParameterException, AlreadyExistsException {
        return register(codec.fromJson(json));
    }

    /**
     * Writes a workflow to a file, as YAML when the file name ends in .yaml or .yml, else as JSON.
     */
    public void save(String workflowName, Path path) throws NotFoundException, IOException {
        WorkflowDefinition workflow = require(workflowName);
        codec.write(workflow, path);
        logger.info("Saved workflow '{}' to {}", workflowName, path);
    }

    /**
     * Reads a workflow file written by {@link #save(String, Path)} and registers it.
     */
    public WorkflowDefinition load(Path path)
            throws IOException, InvalidParameterException, AlreadyExistsException {
        WorkflowDefinition workflow = register(codec.read(path));
        logger.info("Loaded workflow '{}' from {}", workflow.getName(), path);
        return workflow;
    }

    // ---------------------------------------------------------------- helpers

    private WorkflowDefinition require(String workflowName) throws NotFoundException {
        WorkflowDefinition workflow = workflowName != null ? workflows.get(workflowName) : null;
        if (workflow == null) {
            throw new NotFoundException("Workflow", workflowName);
        }
        return workflow;
    }

    private static void validate(WorkflowDefinition workflow) throws InvalidParameterException {
        DependencyGraph.build(workflow);
    }

    static String nextVersion(String version) {
        Matcher matcher = TRAILING_NUMBER.matcher(version);
        if (!matcher.matches()) {
            return version + ".1";
        }
        BigInteger next = new BigInteger(matcher.group(2)).add(BigInteger.ONE);
        return matcher.group(1) + next;
    }

    private static WorkflowDefinition bumpVersion(WorkflowDefinition workflow) {
        return workflow.withVersion(nextVersion(workflow.getVersion()));
    }
}
