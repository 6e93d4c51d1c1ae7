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

package dev.mars.weft.workflow.engine;

import dev.mars.weft.config.WeftConfiguration;
import dev.mars.weft.core.exceptions.InvalidParameterException;
import dev.mars.weft.core.exceptions.InvalidTransitionException;
import dev.mars.weft.core.exceptions.NotFoundException;
import dev.mars.weft.core.exceptions.StateStoreException;
import dev.mars.weft.workflow.DependencyGraph;
import dev.mars.weft.workflow.ExecutionContext;
import dev.mars.weft.workflow.ExecutionState;
import dev.mars.weft.workflow.ExecutionStatus;
import dev.mars.weft.workflow.TaskDefinition;
import dev.mars.weft.workflow.TaskExecutable;
import dev.mars.weft.workflow.ValidationResult;
import dev.mars.weft.workflow.WorkflowDefinition;
import dev.mars.weft.workflow.WorkflowEngine;
import dev.mars.weft.workflow.WorkflowEventListener;
import dev.mars.weft.workflow.WorkflowResult;
import dev.mars.weft.workflow.observability.WorkflowMetrics;
import dev.mars.weft.workflow.registry.WorkflowRegistry;
import dev.mars.weft.workflow.store.ExecutionStateStore;
import dev.mars.weft.workflow.store.InMemoryExecutionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Workflow engine backed by a shared {@link WorkerPool} and an {@link ExecutionStateStore}.
 *
 * <p>Each execution is driven by its own {@link ExecutionDispatcher}. The engine keeps the live
 * dispatchers and answers queries from them, falling back to the store for executions that have
 * finished or that belong to a previous engine instance.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-11
 * @version 1.0
 */
public class DefaultWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(DefaultWorkflowEngine.class);

    private final WorkflowRegistry registry;
    private final ExecutionStateStore store;
    private final TaskHandlerRegistry handlers;
    private final WorkflowMetrics metrics;
    private final WeftConfiguration configuration;
    private final WorkerPool pool;
    private final Map<String, ExecutionDispatcher> dispatchers = new ConcurrentHashMap<>();
    private final List<WorkflowEventListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean shutdown = false;

    public DefaultWorkflowEngine(WorkflowRegistry registry, WeftConfiguration configuration) {
        this(registry, new InMemoryExecutionStateStore(configuration.getMaxHistory()),
                new TaskHandlerRegistry(), new WorkflowMetrics(), configuration);
    }

    public DefaultWorkflowEngine(WorkflowRegistry registry,
                                 ExecutionStateStore store,
                                 TaskHandlerRegistry handlers,
                                 WorkflowMetrics metrics,
                                 WeftConfiguration configuration) {
        this.registry = Objects.requireNonNull(registry, "Workflow registry cannot be null");
        this.store = Objects.requireNonNull(store, "State store cannot be null");
        this.handlers = Objects.requireNonNull(handlers, "Handler registry cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.pool = new WorkerPool(configuration.getMaxWorkers());
        logger.info("DefaultWorkflowEngine created with {} worker(s)", pool.getCapacity());
    }

    @Override
    public String start(String workflowName) throws NotFoundException, InvalidParameterException {
        return start(workflowName, Map.of());
    }

    @Override
    public String start(String workflowName, Map<String, String> userData)
            throws NotFoundException, InvalidParameterException {
        if (shutdown) {
            throw new IllegalStateException("Workflow engine is shut down");
        }
        WorkflowDefinition workflow = registry.getInfo(workflowName);
        if (!workflow.isEnabled()) {
            throw new NotFoundException("Workflow", workflowName, "disabled");
        }

        Map<String, TaskExecutable> executables = new HashMap<>();
        for (TaskDefinition task : workflow.getTasks()) {
            TaskExecutable executable = handlers.resolve(task).orElseThrow(() -> new InvalidParameterException(
                    "Task '" + task.getName() + "' in workflow '" + workflowName + "' has no executable"
                            + (task.getHandler() != null ? " and no handler named '" + task.getHandler() + "'" : "")));
            executables.put(task.getName(), executable);
        }
        DependencyGraph graph = DependencyGraph.build(workflow);

        String executionId = UUID.randomUUID().toString();
        ExecutionState initial = ExecutionState.pending(executionId, workflow, userData, Instant.now());
        store.save(initial);

        ExecutionDispatcher dispatcher = newDispatcher(initial, graph, executables);
        dispatchers.put(executionId, dispatcher);
        metrics.recordExecutionStarted(workflowName);
        dispatcher.start();
        return executionId;
    }

    @Override
    public void stop(String executionId) throws NotFoundException, InvalidTransitionException {
        liveDispatcher(executionId, ExecutionStatus.STOPPING).stop();
    }

    @Override
    public void pause(String executionId) throws NotFoundException, InvalidTransitionException {
        liveDispatcher(executionId, ExecutionStatus.PAUSED).pause();
    }

    @Override
    public void resume(String executionId) throws NotFoundException, InvalidTransitionException {
        liveDispatcher(executionId, ExecutionStatus.RUNNING).resume();
    }

    @Override
    public ExecutionContext getStatus(String executionId) throws NotFoundException {
        return ExecutionContext.from(currentState(executionId));
    }

    @Override
    public WorkflowResult getResult(String executionId) throws NotFoundException {
        return WorkflowResult.from(currentState(executionId));
    }

    @Override
    public WorkflowResult awaitResult(String executionId, Duration timeout)
            throws NotFoundException, TimeoutException, InterruptedException {
        ExecutionDispatcher dispatcher = dispatchers.get(executionId);
        if (dispatcher != null) {
            try {
                return dispatcher.getCompletion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Execution " + executionId + " completed exceptionally", e.getCause());
            }
        }
        ExecutionState state = currentState(executionId);
        if (!state.isTerminal()) {
            throw new TimeoutException("Execution " + executionId + " is " + state.getStatus()
                    + " but not live in this engine");
        }
        return WorkflowResult.from(state);
    }

    @Override
    public List<ExecutionContext> listRunning() {
        return store.findActive().stream()
                .map(ExecutionContext::from)
                .toList();
    }

    @Override
    public List<WorkflowResult> getHistory(String workflowName, Instant from, Instant to) {
        return store.findHistory(workflowName, from, to).stream()
                .map(WorkflowResult::from)
                .toList();
    }

    @Override
    public ValidationResult validateDependencies(String workflowName) throws NotFoundException {
        WorkflowDefinition workflow = registry.getInfo(workflowName);
        ValidationResult result = DependencyGraph.validate(workflow);
        for (TaskDefinition task : workflow.getTasks()) {
            if (handlers.resolve(task).isEmpty()) {
                result.addError("tasks." + task.getName() + ".handler",
                        task.getHandler() != null
                                ? "No handler registered under '" + task.getHandler() + "'"
                                : "Task has neither an executable nor a handler");
            }
        }
        return result;
    }

    @Override
    public List<String> recover() {
        if (shutdown) {
            throw new IllegalStateException("Workflow engine is shut down");
        }
        List<String> resumed = new ArrayList<>();
        for (ExecutionState state : store.findActive()) {
            String executionId = state.getExecutionId();
            if (dispatchers.containsKey(executionId)) {
                continue;
            }
            WorkflowDefinition workflow = state.getWorkflow();
            DependencyGraph graph;
            try {
                graph = DependencyGraph.build(workflow);
            } catch (InvalidParameterException e) {
                logger.error("Cannot recover execution {}: {}", executionId, e.getMessage());
                failUnrecoverable(state, "unrecoverable: " + e.getMessage());
                continue;
            }
            ExecutionDispatcher dispatcher = newDispatcher(state, graph, recoverExecutables(workflow));
            if (dispatchers.putIfAbsent(executionId, dispatcher) != null) {
                continue;
            }
            metrics.recordExecutionResumed();
            dispatcher.recover();
            resumed.add(executionId);
        }
        if (!resumed.isEmpty()) {
            logger.info("Recovered {} execution(s)", resumed.size());
        }
        return resumed;
    }

    @Override
    public void purge(String executionId) throws NotFoundException, InvalidParameterException {
        ExecutionState state = currentState(executionId);
        if (!state.isTerminal()) {
            throw new InvalidParameterException("Execution " + executionId + " is still " + state.getStatus());
        }
        dispatchers.remove(executionId);
        store.purge(executionId);
        logger.debug("Purged execution {}", executionId);
    }

    @Override
    public void addListener(WorkflowEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    @Override
    public void removeListener(WorkflowEventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("DefaultWorkflowEngine shutting down, {} live execution(s)", dispatchers.size());
        for (ExecutionDispatcher dispatcher : dispatchers.values()) {
            dispatcher.detach();
        }
        dispatchers.clear();
        if (!pool.shutdown(configuration.getShutdownTimeoutSeconds())) {
            logger.warn("Worker pool did not terminate within {}s", configuration.getShutdownTimeoutSeconds());
        }
        Optional<Path> snapshotPath = configuration.getSnapshotPath();
        if (snapshotPath.isPresent()) {
            try {
                store.snapshotTo(snapshotPath.get());
                logger.info("Execution state snapshot written to {}", snapshotPath.get());
            } catch (StateStoreException e) {
                logger.error("Failed to write execution state snapshot to {}", snapshotPath.get(), e);
            }
        }
        logger.info("DefaultWorkflowEngine shutdown complete");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public WorkflowRegistry getRegistry() {
        return registry;
    }

    public ExecutionStateStore getStateStore() {
        return store;
    }

    public TaskHandlerRegistry getHandlerRegistry() {
        return handlers;
    }

    WorkerPool getWorkerPool() {
        return pool;
    }

    private ExecutionDispatcher newDispatcher(ExecutionState state, DependencyGraph graph,
                                              Map<String, TaskExecutable> executables) {
        return new ExecutionDispatcher(state, graph, executables, pool, store, metrics, listeners,
                configuration.getDefaultTaskTimeoutSeconds(), this::onExecutionFinished);
    }

    private void onExecutionFinished(ExecutionDispatcher dispatcher) {
        // an execution whose final state never reached the store stays visible here
        if (dispatcher.isPersisted()) {
            dispatchers.remove(dispatcher.getExecutionId(), dispatcher);
        }
    }

    /**
     * Executables for a recovered execution: the registry's current inline executable for a task of
     * the same name, else the task's handler. Tasks with neither fail when dispatched.
     */
    private Map<String, TaskExecutable> recoverExecutables(WorkflowDefinition workflow) {
        Optional<WorkflowDefinition> current = registry.find(workflow.getName());
        Map<String, TaskExecutable> executables = new HashMap<>();
        for (TaskDefinition task : workflow.getTasks()) {
            Optional<TaskExecutable> executable = current
                    .flatMap(def -> def.getTask(task.getName()))
                    .map(TaskDefinition::getExecutable)
                    .or(() -> handlers.resolve(task));
            if (executable.isPresent()) {
                executables.put(task.getName(), executable.get());
            } else {
                logger.warn("No executable for task '{}' of recovered workflow '{}'", task.getName(), workflow.getName());
            }
        }
        return executables;
    }

    private void failUnrecoverable(ExecutionState state, String reason) {
        ExecutionState failed = state.toBuilder()
                .status(ExecutionStatus.FAILED)
                .endTime(Instant.now())
                .failureReason(reason)
                .build();
        try {
            store.save(failed);
        } catch (StateStoreException e) {
            logger.error("Could not record failure of execution {}", state.getExecutionId(), e);
        }
    }

    private ExecutionState currentState(String executionId) throws NotFoundException {
        ExecutionDispatcher dispatcher = executionId != null ? dispatchers.get(executionId) : null;
        if (dispatcher != null) {
            return dispatcher.getState();
        }
        return store.find(executionId)
                .orElseThrow(() -> new NotFoundException("Execution", executionId));
    }

    private ExecutionDispatcher liveDispatcher(String executionId, ExecutionStatus requested)
            throws NotFoundException, InvalidTransitionException {
        ExecutionDispatcher dispatcher = executionId != null ? dispatchers.get(executionId) : null;
        if (dispatcher != null) {
            return dispatcher;
        }
        ExecutionState state = currentState(executionId);
        if (state.isTerminal()) {
            throw new InvalidTransitionException(executionId, state.getStatus(), requested,
                    state.getStatus().getValidTransitions());
        }
        throw new NotFoundException("Execution", executionId, "not live in this engine, recover it first");
    }
}
