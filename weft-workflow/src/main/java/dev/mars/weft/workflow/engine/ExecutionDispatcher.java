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

import dev.mars.weft.core.ResultCode;
import dev.mars.weft.core.exceptions.InvalidTransitionException;
import dev.mars.weft.core.exceptions.StateStoreException;
import dev.mars.weft.core.exceptions.WeftException;
import dev.mars.weft.workflow.AttemptOutcome;
import dev.mars.weft.workflow.CancellationToken;
import dev.mars.weft.workflow.DependencyGraph;
import dev.mars.weft.workflow.ExecutionContext;
import dev.mars.weft.workflow.ExecutionState;
import dev.mars.weft.workflow.ExecutionStatus;
import dev.mars.weft.workflow.TaskContext;
import dev.mars.weft.workflow.TaskDefinition;
import dev.mars.weft.workflow.TaskExecutable;
import dev.mars.weft.workflow.TaskOutcome;
import dev.mars.weft.workflow.TaskResult;
import dev.mars.weft.workflow.TaskState;
import dev.mars.weft.workflow.WorkflowEventListener;
import dev.mars.weft.workflow.WorkflowResult;
import dev.mars.weft.workflow.observability.WorkflowMetrics;
import dev.mars.weft.workflow.store.ExecutionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Control loop of one execution.
 *
 * <p>All decisions for the execution (ready-set computation, state transitions, dispatch) are
 * made under a single lock. They are re-evaluated only at start, when an attempt finishes or
 * times out, when worker capacity is returned, and on pause, resume and stop.</p>
 *
 * <p>Every transition is committed to the {@link ExecutionStateStore}
 * before attempts are handed to workers or listeners are told about it. Listener callbacks,
 * completion of the result future and the return of pool slots happen after the lock is
 * released, so a dispatcher never holds its own lock while another dispatcher's code runs.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
final class ExecutionDispatcher implements WorkerPool.CapacityListener {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final String executionId;
    private final DependencyGraph graph;
    private final Map<String, TaskDefinition> tasks;
    private final Map<String, TaskExecutable> executables;
    private final WorkerPool pool;
    private final ExecutionStateStore store;
    private final WorkflowMetrics metrics;
    private final List<WorkflowEventListener> listeners;
    private final long defaultTimeoutSeconds;
    private final Consumer<ExecutionDispatcher> onFinished;

    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock deliveryLock = new ReentrantLock();
    private final Map<String, Attempt> inFlight = new HashMap<>();
    private final List<Consumer<WorkflowEventListener>> pendingEvents = new ArrayList<>();
    private final CompletableFuture<WorkflowResult> completion = new CompletableFuture<>();

    private volatile ExecutionState state;
    private volatile boolean persisted = true;
    private WorkflowResult pendingCompletion;
    private int deferredReleases;
    private boolean detached;

    ExecutionDispatcher(ExecutionState initial,
                        DependencyGraph graph,
                        Map<String, TaskExecutable> executables,
                        WorkerPool pool,
                        ExecutionStateStore store,
                        WorkflowMetrics metrics,
                        List<WorkflowEventListener> listeners,
                        long defaultTimeoutSeconds,
                        Consumer<ExecutionDispatcher> onFinished) {
        this.state = Objects.requireNonNull(initial, "Initial state cannot be null");
        this.executionId = initial.getExecutionId();
        this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
        this.tasks = new HashMap<>();
        initial.getWorkflow().getTasks().forEach(t -> tasks.put(t.getName(), t));
        this.executables = new HashMap<>(executables);
        this.pool = pool;
        this.store = store;
        this.metrics = metrics;
        this.listeners = listeners;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
        this.onFinished = onFinished;
    }

    String getExecutionId() {
        return executionId;
    }

    /**
     * Latest state as seen by this dispatcher. Matches the store unless a store write failed.
     */
    ExecutionState getState() {
        return state;
    }

    /**
     * Whether the latest state reached the store.
     */
    boolean isPersisted() {
        return persisted;
    }

    CompletableFuture<WorkflowResult> getCompletion() {
        return completion;
    }

    // ---------------------------------------------------------------- entry points

    void start() {
        lock.lock();
        try {
            requireStatus(ExecutionStatus.PENDING, ExecutionStatus.RUNNING);
            ExecutionContext context = ExecutionContext.from(state);
            pendingEvents.add(l -> l.onExecutionStarted(context));
            if (commit(state.toBuilder().status(ExecutionStatus.RUNNING).build())) {
                logger.info("Started execution {} of workflow '{}' version {}",
                        executionId, state.getWorkflowName(), state.getWorkflowVersion());
                evaluate();
            }
        } finally {
            lock.unlock();
            flush();
        }
    }

    /**
     * Picks up an execution found active in the store with no live dispatcher. Attempts recorded
     * as running were lost with the previous process and count as failed attempts.
     */
    void recover() {
        lock.lock();
        try {
            Instant now = Instant.now();
            ExecutionState.Builder next = state.toBuilder();
            for (Map.Entry<String, TaskState> entry : state.getTaskStates().entrySet()) {
                if (entry.getValue() == TaskState.RUNNING) {
                    String name = entry.getKey();
                    int attempt = state.getAttemptCount(name);
                    next.result(TaskResult.attempt(name, attempt, null, now,
                            AttemptOutcome.FAILURE, ResultCode.ERROR, "interrupted by restart"));
                    applyFailure(next, name, attempt, now);
                }
            }
            if (next.status() == ExecutionStatus.PENDING) {
                next.status(ExecutionStatus.RUNNING);
            }
            logger.info("Recovering execution {} of workflow '{}' in status {}",
                    executionId, state.getWorkflowName(), next.status());
            if (commit(next.build())) {
                evaluate();
            }
        } finally {
            lock.unlock();
            flush();
        }
    }

    void pause() throws InvalidTransitionException {
        lock.lock();
        try {
            ExecutionStatus current = state.getStatus();
            if (detached || !current.canTransitionTo(ExecutionStatus.PAUSED)) {
                throw new InvalidTransitionException(executionId, current, ExecutionStatus.PAUSED,
                        current.getValidTransitions());
            }
            if (commit(state.toBuilder().status(ExecutionStatus.PAUSED).build())) {
                logger.info("Paused execution {}", executionId);
            }
        } finally {
            lock.unlock();
            flush();
        }
    }

    void resume() throws InvalidTransitionException {
        lock.lock();
        try {
            ExecutionStatus current = state.getStatus();
            if (detached || current != ExecutionStatus.PAUSED) {
                throw new InvalidTransitionException(executionId, current, ExecutionStatus.RUNNING,
                        current.getValidTransitions());
            }
            if (commit(state.toBuilder().status(ExecutionStatus.RUNNING).build())) {
                logger.info("Resumed execution {}", executionId);
                evaluate();
            }
        } finally {
            lock.unlock();
            flush();
        }
    }

    void stop() throws InvalidTransitionException {
        lock.lock();
        try {
            ExecutionStatus current = state.getStatus();
            if (!detached && current == ExecutionStatus.PENDING) {
                finishCancelled();
                return;
            }
            if (detached || !current.canTransitionTo(ExecutionStatus.STOPPING)) {
                throw new InvalidTransitionException(executionId, current, ExecutionStatus.STOPPING,
                        current.getValidTransitions());
            }
            if (commit(state.toBuilder().status(ExecutionStatus.STOPPING).build())) {
                logger.info("Stopping execution {}: {} attempt(s) draining", executionId, inFlight.size());
                pool.removeListener(this);
                evaluate();
            }
        } finally {
            lock.unlock();
            flush();
        }
    }

    @Override
    public void onCapacityAvailable() {
        lock.lock();
        try {
            evaluate();
        } finally {
            lock.unlock();
            flush();
        }
    }

    /**
     * Stops reacting to anything. Used when the engine shuts down: the state stays as last
     * committed so the execution can be recovered later.
     */
    void detach() {
        lock.lock();
        try {
            if (detached) {
                return;
            }
            detached = true;
            pool.removeListener(this);
            for (Attempt attempt : inFlight.values()) {
                attempt.cancelTimer();
                attempt.token.cancel("engine shutting down");
                attempt.interrupt();
            }
            inFlight.clear();
        } finally {
            lock.unlock();
            flush();
        }
    }

    // ---------------------------------------------------------------- evaluation

    private void evaluate() {
        if (detached || state.isTerminal()) {
            return;
        }
        ExecutionStatus status = state.getStatus();
        if (status == ExecutionStatus.PENDING) {
            return;
        }
        if (status == ExecutionStatus.STOPPING) {
            if (inFlight.isEmpty()) {
                finishCancelled();
            }
            return;
        }
        if (allTasksTerminal()) {
            finish();
            return;
        }
        if (status != ExecutionStatus.RUNNING) {
            return;
        }

        Set<String> resolved = new HashSet<>();
        Set<String> excluded = new HashSet<>();
        state.getTaskStates().forEach((name, taskState) -> {
            if (taskState.satisfiesDependents()) {
                resolved.add(name);
            }
            if (taskState != TaskState.PENDING) {
                excluded.add(name);
            }
        });
        List<String> ready = graph.readySet(resolved, excluded);
        if (ready.isEmpty()) {
            if (inFlight.isEmpty()) {
                abort("no task can run but the execution has not finished: " + state.getTaskStates(), null);
            }
            return;
        }

        List<String> granted = new ArrayList<>();
        for (String name : ready) {
            if (!pool.tryAcquire(this)) {
                logger.debug("Execution {}: worker pool full, {} ready task(s) waiting",
                        executionId, ready.size() - granted.size());
                break;
            }
            granted.add(name);
        }
        if (granted.isEmpty()) {
            return;
        }

        ExecutionState.Builder next = state.toBuilder();
        for (String name : granted) {
            next.taskState(name, TaskState.RUNNING).attempts(name, state.getAttemptCount(name) + 1);
        }
        if (!commit(next.build())) {
            deferredReleases += granted.size();
            return;
        }
        Instant now = Instant.now();
        for (int i = 0; i < granted.size(); i++) {
            String name = granted.get(i);
            try {
                dispatch(name, state.getAttemptCount(name), now);
            } catch (RejectedExecutionException e) {
                deferredReleases += granted.size() - i;
                abort("worker pool rejected task '" + name + "'", e);
                return;
            } catch (RuntimeException e) {
                deferredReleases += granted.size() - i;
                abort("could not dispatch task '" + name + "': " + e, e);
                return;
            }
        }
    }

    private void dispatch(String name, int attemptNumber, Instant startTime) {
        TaskDefinition task = tasks.get(name);
        Attempt attempt = new Attempt(name, attemptNumber, startTime);
        long timeout = task.getTimeoutSeconds() > 0 ? task.getTimeoutSeconds() : defaultTimeoutSeconds;
        Instant deadline = deadlineOf(startTime, timeout);
        TaskContext context = new TaskContext(executionId, state.getWorkflowName(), name, attemptNumber,
                task.getParameters(), state.getUserData(), deadline, attempt.token);
        TaskExecutable executable = executables.get(name);

        inFlight.put(name, attempt);
        try {
            if (deadline != null) {
                attempt.timer = pool.schedule(() -> deadlineExpired(attempt, timeout), timeout, TimeUnit.SECONDS);
            }
            pool.execute(() -> runAttempt(attempt, executable, context));
        } catch (RuntimeException e) {
            inFlight.remove(name);
            attempt.cancelTimer();
            throw e;
        }
        logger.debug("Dispatched task '{}' attempt {} of execution {}", name, attemptNumber, executionId);
    }

    /**
     * Deadline of an attempt, or {@code null} when it has none. Timeouts that reach past
     * {@link Instant#MAX} count as no deadline.
     */
    static Instant deadlineOf(Instant startTime, long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            return null;
        }
        if (timeoutSeconds > Instant.MAX.getEpochSecond() - startTime.getEpochSecond() - 1) {
            return null;
        }
        return startTime.plusSeconds(timeoutSeconds);
    }

    // ---------------------------------------------------------------- worker side

    private void runAttempt(Attempt attempt, TaskExecutable executable, TaskContext context) {
        TaskOutcome outcome = null;
        Throwable failure = null;
        try {
            attempt.bind(Thread.currentThread());
            if (executable == null) {
                outcome = TaskOutcome.failure(ResultCode.NOT_SUPPORTED,
                        "no executable or handler available for task '" + attempt.taskName + "'");
            } else if (attempt.token.isCancelled()) {
                outcome = TaskOutcome.failure(ResultCode.ERROR, "cancelled before start");
            } else {
                outcome = executable.execute(context);
                if (outcome == null) {
                    outcome = TaskOutcome.failure(ResultCode.ERROR, "task returned no outcome");
                }
            }
        } catch (Throwable t) {
            failure = t;
        } finally {
            attempt.unbind();
        }
        try {
            attemptFinished(attempt, outcome, failure);
        } finally {
            pool.release();
        }
        if (failure instanceof VirtualMachineError vmError) {
            throw vmError;
        }
    }

    private void attemptFinished(Attempt attempt, TaskOutcome outcome, Throwable failure) {
        lock.lock();
        try {
            if (detached || state.isTerminal() || inFlight.get(attempt.taskName) != attempt) {
                logger.debug("Discarding late completion of task '{}' attempt {} in execution {}",
                        attempt.taskName, attempt.number, executionId);
                return;
            }
            inFlight.remove(attempt.taskName);
            attempt.cancelTimer();

            Instant end = Instant.now();
            ExecutionState.Builder next = state.toBuilder();
            if (failure == null && outcome.isSuccess()) {
                next.taskState(attempt.taskName, TaskState.SUCCEEDED)
                    .result(TaskResult.attempt(attempt.taskName, attempt.number, attempt.startTime, end,
                            AttemptOutcome.SUCCESS, ResultCode.SUCCESS, outcome.getMessage()));
                logger.debug("Task '{}' attempt {} of execution {} succeeded",
                        attempt.taskName, attempt.number, executionId);
            } else {
                ResultCode code;
                String message;
                if (failure != null) {
                    code = failure instanceof WeftException weftException
                            ? weftException.getResultCode() : ResultCode.ERROR;
                    message = describe(failure);
                } else {
                    code = outcome.getResultCode();
                    message = outcome.getMessage();
                }
                next.result(TaskResult.attempt(attempt.taskName, attempt.number, attempt.startTime, end,
                        AttemptOutcome.FAILURE, code, message));
                metrics.recordAttemptFailed(state.getWorkflowName(), AttemptOutcome.FAILURE);
                logger.warn("Task '{}' attempt {} of execution {} failed: [{}] {}",
                        attempt.taskName, attempt.number, executionId, code, message);
                applyFailure(next, attempt.taskName, attempt.number, end);
            }
            if (commit(next.build())) {
                evaluate();
            }
        } finally {
            lock.unlock();
            flush();
        }
    }

    private void deadlineExpired(Attempt attempt, long timeoutSeconds) {
        lock.lock();
        try {
            if (detached || state.isTerminal() || inFlight.get(attempt.taskName) != attempt) {
                return;
            }
            inFlight.remove(attempt.taskName);
            String message = "timed out after " + timeoutSeconds + "s";
            attempt.token.cancel(message);
            attempt.interrupt();
            logger.warn("Task '{}' attempt {} of execution {} {}",
                    attempt.taskName, attempt.number, executionId, message);

            Instant end = Instant.now();
            ExecutionState.Builder next = state.toBuilder()
                    .result(TaskResult.attempt(attempt.taskName, attempt.number, attempt.startTime, end,
                            AttemptOutcome.TIMEOUT, ResultCode.TIMEOUT, message));
            metrics.recordAttemptFailed(state.getWorkflowName(), AttemptOutcome.TIMEOUT);
            applyFailure(next, attempt.taskName, attempt.number, end);
            if (commit(next.build())) {
                evaluate();
            }
        } finally {
            lock.unlock();
            flush();
        }
    }

    /**
     * Decides what happens to a task after a failed or timed-out attempt: another attempt,
     * terminal failure with its dependents skipped, or cancellation when the execution is stopping.
     */
    private void applyFailure(ExecutionState.Builder next, String name, int attemptNumber, Instant at) {
        TaskDefinition task = tasks.get(name);
        boolean retriesLeft = attemptNumber <= task.getRetryCount();
        if (next.status() == ExecutionStatus.STOPPING && retriesLeft) {
            next.taskState(name, TaskState.CANCELLED)
                .result(TaskResult.cancelled(name, at, "cancelled before retry"));
            return;
        }
        if (retriesLeft) {
            next.taskState(name, TaskState.PENDING);
            metrics.recordRetry(state.getWorkflowName());
            logger.warn("Retrying task '{}' of execution {} ({} of {} retries)",
                    name, executionId, attemptNumber, task.getRetryCount());
            return;
        }
        next.taskState(name, TaskState.FAILED);
        logger.warn("Task '{}' of execution {} failed after {} attempt(s)", name, executionId, attemptNumber);
        String reason = "dependency '" + name + "' failed";
        for (String dependent : graph.transitiveDependents(name)) {
            TaskState dependentState = next.taskState(dependent);
            if (!dependentState.isTerminal() && dependentState != TaskState.RUNNING) {
                next.taskState(dependent, TaskState.SKIPPED)
                    .result(TaskResult.skipped(dependent, at, reason));
            }
        }
    }

    private boolean allTasksTerminal() {
        for (TaskState taskState : state.getTaskStates().values()) {
            if (!taskState.isTerminal()) {
                return false;
            }
        }
        return true;
    }

    private void finish() {
        boolean allSucceeded = state.getTaskStates().values().stream()
                .allMatch(s -> s == TaskState.SUCCEEDED);
        ExecutionStatus target = allSucceeded ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED;
        requireStatus(state.getStatus(), target);
        commit(state.toBuilder().status(target).endTime(Instant.now()).build());
    }

    private void finishCancelled() {
        Instant now = Instant.now();
        ExecutionState.Builder next = state.toBuilder();
        for (Map.Entry<String, TaskState> entry : state.getTaskStates().entrySet()) {
            if (entry.getValue() != TaskState.PENDING) {
                continue;
            }
            String name = entry.getKey();
            if (state.getAttemptCount(name) == 0) {
                next.taskState(name, TaskState.SKIPPED).result(TaskResult.skipped(name, now, "cancelled"));
            } else {
                next.taskState(name, TaskState.CANCELLED)
                    .result(TaskResult.cancelled(name, now, "cancelled before retry"));
            }
        }
        requireStatus(state.getStatus(), ExecutionStatus.CANCELLED);
        commit(next.status(ExecutionStatus.CANCELLED).endTime(now).build());
    }

    private void requireStatus(ExecutionStatus from, ExecutionStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Execution " + executionId + " cannot move from " + from + " to " + to);
        }
    }

    // ---------------------------------------------------------------- commit and events

    private boolean commit(ExecutionState next) {
        try {
            store.save(next);
        } catch (StateStoreException e) {
            abort("state store failure: " + e.getMessage(), e);
            return false;
        }
        ExecutionState previous = state;
        state = next;
        persisted = true;
        afterTransition(previous, next);
        return true;
    }

    /**
     * Fails the execution after an engine-internal error. The failure is recorded in memory
     * even if the store cannot take it, so it stays visible through the engine.
     */
    private void abort(String reason, Throwable cause) {
        logger.error("Aborting execution {} of workflow '{}': {}", executionId, state.getWorkflowName(), reason, cause);
        for (Attempt attempt : inFlight.values()) {
            attempt.cancelTimer();
            attempt.token.cancel("execution aborted");
            attempt.interrupt();
        }
        inFlight.clear();
        ExecutionState failed = state.toBuilder()
                .status(ExecutionStatus.FAILED)
                .endTime(Instant.now())
                .failureReason(reason)
                .build();
        ExecutionState previous = state;
        state = failed;
        try {
            store.save(failed);
            persisted = true;
        } catch (StateStoreException e) {
            persisted = false;
            logger.error("Could not record failure of execution {} in the state store", executionId, e);
        }
        afterTransition(previous, failed);
    }

    private void afterTransition(ExecutionState previous, ExecutionState next) {
        String workflowName = next.getWorkflowName();
        for (String name : next.getTaskStates().keySet()) {
            int attempt = next.getAttemptCount(name);
            if (attempt > previous.getAttemptCount(name) && next.getTaskState(name) == TaskState.RUNNING) {
                metrics.recordAttemptStarted(workflowName);
                pendingEvents.add(l -> l.onTaskStarted(executionId, name, attempt));
            }
        }
        List<TaskResult> results = next.getResults();
        for (int i = previous.getResults().size(); i < results.size(); i++) {
            TaskResult result = results.get(i);
            pendingEvents.add(l -> l.onTaskFinished(executionId, result));
        }
        ExecutionStatus from = previous.getStatus();
        ExecutionStatus to = next.getStatus();
        if (from != to) {
            pendingEvents.add(l -> l.onStatusChanged(executionId, from, to));
        }
        if (to.isTerminal() && !from.isTerminal()) {
            pool.removeListener(this);
            WorkflowResult result = WorkflowResult.from(next);
            metrics.recordExecutionFinished(workflowName, to,
                    Duration.between(next.getStartTime(), next.getEndTime()));
            logger.info("Execution {} finished: {}", executionId, result.getSummary());
            pendingEvents.add(l -> l.onExecutionFinished(result));
            pendingCompletion = result;
        }
    }

    /**
     * Runs everything deferred while the lock was held: slot releases, listener callbacks
     * and completion of the result future. Slots go back before the delivery lock is taken;
     * event batches are delivered one at a time, in the order they were committed.
     */
    private void flush() {
        int releases;
        lock.lock();
        try {
            releases = deferredReleases;
            deferredReleases = 0;
        } finally {
            lock.unlock();
        }
        for (int i = 0; i < releases; i++) {
            pool.release();
        }

        deliveryLock.lock();
        try {
            List<Consumer<WorkflowEventListener>> events;
            WorkflowResult finished;
            lock.lock();
            try {
                events = new ArrayList<>(pendingEvents);
                pendingEvents.clear();
                finished = pendingCompletion;
                pendingCompletion = null;
            } finally {
                lock.unlock();
            }
            for (Consumer<WorkflowEventListener> event : events) {
                for (WorkflowEventListener listener : listeners) {
                    try {
                        event.accept(listener);
                    } catch (RuntimeException e) {
                        logger.warn("Workflow event listener {} failed: {}", listener, e.getMessage(), e);
                    }
                }
            }
            if (finished != null) {
                if (onFinished != null) {
                    onFinished.accept(this);
                }
                completion.complete(finished);
            }
        } finally {
            deliveryLock.unlock();
        }
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    /**
     * One dispatched attempt. The worker thread is tracked only while the executable runs,
     * so a late interrupt can never hit a pool thread that has moved on to other work.
     */
    private static final class Attempt {
        private final String taskName;
        private final int number;
        private final Instant startTime;
        private final CancellationToken token = new CancellationToken();
        private volatile ScheduledFuture<?> timer;
        private Thread runner;
        private boolean interruptRequested;

        private Attempt(String taskName, int number, Instant startTime) {
            this.taskName = taskName;
            this.number = number;
            this.startTime = startTime;
        }

        synchronized void bind(Thread thread) {
            runner = thread;
            if (interruptRequested) {
                thread.interrupt();
            }
        }

        synchronized void unbind() {
            runner = null;
            Thread.interrupted();
        }

        synchronized void interrupt() {
            interruptRequested = true;
            if (runner != null) {
                runner.interrupt();
            }
        }

        void cancelTimer() {
            ScheduledFuture<?> scheduled = timer;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
