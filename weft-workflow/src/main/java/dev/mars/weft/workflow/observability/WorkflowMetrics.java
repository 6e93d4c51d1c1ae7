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

package dev.mars.weft.workflow.observability;

import dev.mars.weft.workflow.AttemptOutcome;
import dev.mars.weft.workflow.ExecutionStatus;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the Weft execution engine.
 *
 * Provides these metrics:
 * - weft.execution.active (gauge) - Executions not yet terminal
 * - weft.execution.started (counter) - Executions started
 * - weft.execution.completed (counter) - Executions that completed
 * - weft.execution.failed (counter) - Executions that failed
 * - weft.execution.cancelled (counter) - Executions that were stopped
 * - weft.execution.duration.seconds (histogram) - Execution duration distribution
 * - weft.task.attempts (counter) - Task attempts dispatched
 * - weft.task.attempts.failed (counter) - Attempts that failed or timed out
 * - weft.task.timeouts (counter) - Attempts that exceeded their deadline
 * - weft.task.retries (counter) - Attempts re-queued for retry
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    public static final String METER_NAME = "weft-workflow";

    // Counters
    private final LongCounter executionsStarted;
    private final LongCounter executionsCompleted;
    private final LongCounter executionsFailed;
    private final LongCounter executionsCancelled;
    private final LongCounter attempts;
    private final LongCounter attemptsFailed;
    private final LongCounter timeouts;
    private final LongCounter retries;

    private final DoubleHistogram executionDuration;

    private final AtomicLong activeExecutions = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("attempt.outcome");

    /**
     * Metrics bound to the global OpenTelemetry instance.
     */
    public WorkflowMetrics() {
        this(GlobalOpenTelemetry.getMeter(METER_NAME));
    }

    public WorkflowMetrics(Meter meter) {
        Objects.requireNonNull(meter, "Meter cannot be null");

        executionsStarted = meter.counterBuilder("weft.execution.started")
                .setDescription("Total number of workflow executions started")
                .setUnit("1")
                .build();

        executionsCompleted = meter.counterBuilder("weft.execution.completed")
                .setDescription("Number of executions in which every task succeeded")
                .setUnit("1")
                .build();

        executionsFailed = meter.counterBuilder("weft.execution.failed")
                .setDescription("Number of failed executions")
                .setUnit("1")
                .build();

        executionsCancelled = meter.counterBuilder("weft.execution.cancelled")
                .setDescription("Number of cancelled executions")
                .setUnit("1")
                .build();

        attempts = meter.counterBuilder("weft.task.attempts")
                .setDescription("Total number of task attempts dispatched")
                .setUnit("1")
                .build();

        attemptsFailed = meter.counterBuilder("weft.task.attempts.failed")
                .setDescription("Number of task attempts that failed or timed out")
                .setUnit("1")
                .build();

        timeouts = meter.counterBuilder("weft.task.timeouts")
                .setDescription("Number of task attempts that exceeded their deadline")
                .setUnit("1")
                .build();

        retries = meter.counterBuilder("weft.task.retries")
                .setDescription("Number of task attempts re-queued for retry")
                .setUnit("1")
                .build();

        executionDuration = meter.histogramBuilder("weft.execution.duration.seconds")
                .setDescription("Execution duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("weft.execution.active")
                .setDescription("Number of executions that have not reached a terminal status")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeExecutions.get()));

        logger.debug("WorkflowMetrics initialized");
    }

    public void recordExecutionStarted(String workflowName) {
        executionsStarted.add(1, workflowAttributes(workflowName));
        activeExecutions.incrementAndGet();
    }

    /**
     * Counts an execution picked up again by recovery as active without counting a new start.
     */
    public void recordExecutionResumed() {
        activeExecutions.incrementAndGet();
    }

    /**
     * Records a terminal status. Non-terminal statuses are ignored.
     */
    public void recordExecutionFinished(String workflowName, ExecutionStatus status, Duration duration) {
        if (!status.isTerminal()) {
            return;
        }
        activeExecutions.decrementAndGet();
        Attributes attrs = workflowAttributes(workflowName);
        switch (status) {
            case COMPLETED -> executionsCompleted.add(1, attrs);
            case FAILED -> executionsFailed.add(1, attrs);
            case CANCELLED -> executionsCancelled.add(1, attrs);
            default -> { }
        }
        executionDuration.record(duration.toMillis() / 1000.0, attrs);
    }

    public void recordAttemptStarted(String workflowName) {
        attempts.add(1, workflowAttributes(workflowName));
    }

    public void recordAttemptFailed(String workflowName, AttemptOutcome outcome) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(OUTCOME_KEY, outcome.name())
                .build();
        attemptsFailed.add(1, attrs);
        if (outcome == AttemptOutcome.TIMEOUT) {
            timeouts.add(1, workflowAttributes(workflowName));
        }
    }

    public void recordRetry(String workflowName) {
        retries.add(1, workflowAttributes(workflowName));
    }

    public long getActiveExecutions() {
        return activeExecutions.get();
    }

    private static Attributes workflowAttributes(String workflowName) {
        return Attributes.of(WORKFLOW_NAME_KEY, workflowName);
    }
}
