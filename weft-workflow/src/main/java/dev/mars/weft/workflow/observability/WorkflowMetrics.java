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

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the Weft workflow engine.
 *
 * Provides the following metrics on the {@code weft-workflow} meter:
 * - weft.workflow.active (gauge) - Running or paused executions
 * - weft.workflow.total (counter) - Executions started
 * - weft.workflow.completed (counter) - Executions completed
 * - weft.workflow.failed (counter) - Executions failed
 * - weft.workflow.cancelled (counter) - Executions cancelled
 * - weft.workflow.paused (counter) - Pause requests accepted
 * - weft.workflow.steps.total (counter) - Steps executed, by step type
 * - weft.workflow.steps.failed (counter) - Steps failed, by step type
 * - weft.workflow.duration.seconds (histogram) - Execution duration distribution
 *
 * Without an OpenTelemetry SDK registered globally, every instrument is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "weft-workflow";

    private static WorkflowMetrics instance;

    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter workflowsPaused;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;

    private final DoubleHistogram workflowDuration;

    private final AtomicLong activeWorkflows = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_ID_KEY = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> STEP_TYPE_KEY = AttributeKey.stringKey("step.type");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        workflowsTotal = meter.counterBuilder("weft.workflow.total")
                .setDescription("Total number of workflow executions started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("weft.workflow.completed")
                .setDescription("Number of completed workflow executions")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("weft.workflow.failed")
                .setDescription("Number of failed workflow executions")
                .setUnit("1")
                .build();

        workflowsCancelled = meter.counterBuilder("weft.workflow.cancelled")
                .setDescription("Number of cancelled workflow executions")
                .setUnit("1")
                .build();

        workflowsPaused = meter.counterBuilder("weft.workflow.paused")
                .setDescription("Number of accepted pause requests")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("weft.workflow.steps.total")
                .setDescription("Total number of workflow steps executed")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("weft.workflow.steps.failed")
                .setDescription("Number of failed workflow steps")
                .setUnit("1")
                .build();

        workflowDuration = meter.histogramBuilder("weft.workflow.duration.seconds")
                .setDescription("Workflow execution duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("weft.workflow.active")
                .setDescription("Number of running or paused workflow executions")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.info("WorkflowMetrics initialized");
    }

    /**
     * Get the singleton instance of WorkflowMetrics.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    public void recordWorkflowStarted(String workflowId) {
        workflowsTotal.add(1, workflowAttributes(workflowId));
        activeWorkflows.incrementAndGet();
    }

    public void recordWorkflowCompleted(String workflowId, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = workflowAttributes(workflowId);
        workflowsCompleted.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    public void recordWorkflowFailed(String workflowId, String failureReason, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        workflowsFailed.add(1, attrs);
        workflowDuration.record(durationSeconds, workflowAttributes(workflowId));
    }

    public void recordWorkflowCancelled(String workflowId) {
        activeWorkflows.decrementAndGet();
        workflowsCancelled.add(1, workflowAttributes(workflowId));
    }

    public void recordWorkflowPaused(String workflowId) {
        workflowsPaused.add(1, workflowAttributes(workflowId));
    }

    public void recordStepExecuted(String workflowId, String stepType) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(STEP_TYPE_KEY, stepType)
                .build();
        stepsTotal.add(1, attrs);
    }

    public void recordStepFailed(String workflowId, String stepType, String failureReason) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(STEP_TYPE_KEY, stepType)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        stepsFailed.add(1, attrs);
    }

    /**
     * Get the current number of running or paused executions.
     */
    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static Attributes workflowAttributes(String workflowId) {
        return Attributes.of(WORKFLOW_ID_KEY, workflowId);
    }
}
