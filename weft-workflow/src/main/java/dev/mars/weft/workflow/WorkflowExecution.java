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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one run of a workflow. Every state change produces a new snapshot
 * through the {@code with*} methods; the execution state store swaps snapshots atomically.
 *
 * <p>Variable values may be null, so the variable map keeps null values rather than
 * rejecting them.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowExecution {

    private final String executionId;
    private final String workflowId;
    private final WorkflowStatus status;
    private final Map<String, Object> variables;
    private final String currentStep;
    private final List<StepExecutionRecord> stepHistory;
    private final Instant startTime;
    private final Instant endTime;
    private final String errorMessage;
    private final Throwable cause;

    public WorkflowExecution(String executionId, String workflowId, WorkflowStatus status,
                             Map<String, Object> variables, String currentStep,
                             List<StepExecutionRecord> stepHistory, Instant startTime, Instant endTime,
                             String errorMessage, Throwable cause) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.variables = variables != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(variables))
                : Collections.emptyMap();
        this.currentStep = currentStep;
        this.stepHistory = stepHistory != null ? List.copyOf(stepHistory) : List.of();
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = endTime;
        this.errorMessage = errorMessage;
        this.cause = cause;
    }

    /**
     * A new running execution with the given seed variables and an empty history.
     */
    public static WorkflowExecution started(String executionId, String workflowId,
                                            Map<String, Object> input, Instant startTime) {
        return new WorkflowExecution(executionId, workflowId, WorkflowStatus.RUNNING, input,
                null, List.of(), startTime, null, null, null);
    }

    public WorkflowExecution withStatus(WorkflowStatus newStatus) {
        return new WorkflowExecution(executionId, workflowId, newStatus, variables, currentStep,
                stepHistory, startTime, endTime, errorMessage, cause);
    }

    public WorkflowExecution withVariable(String name, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(variables);
        merged.put(name, value);
        return withVariables(merged);
    }

    /**
     * Overlays the given bindings on top of the current variables.
     */
    public WorkflowExecution mergeVariables(Map<String, Object> overlay) {
        if (overlay == null || overlay.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(variables);
        merged.putAll(overlay);
        return withVariables(merged);
    }

    private WorkflowExecution withVariables(Map<String, Object> newVariables) {
        return new WorkflowExecution(executionId, workflowId, status, newVariables, currentStep,
                stepHistory, startTime, endTime, errorMessage, cause);
    }

    public WorkflowExecution withCurrentStep(String stepId) {
        return new WorkflowExecution(executionId, workflowId, status, variables, stepId,
                stepHistory, startTime, endTime, errorMessage, cause);
    }

    public WorkflowExecution withStepAppended(StepExecutionRecord record) {
        List<StepExecutionRecord> history = new ArrayList<>(stepHistory);
        history.add(record);
        return new WorkflowExecution(executionId, workflowId, status, variables, currentStep,
                history, startTime, endTime, errorMessage, cause);
    }

    /**
     * Replaces the history entry at {@code index}.
     */
    public WorkflowExecution withStepRecord(int index, StepExecutionRecord record) {
        List<StepExecutionRecord> history = new ArrayList<>(stepHistory);
        history.set(index, record);
        return new WorkflowExecution(executionId, workflowId, status, variables, currentStep,
                history, startTime, endTime, errorMessage, cause);
    }

    public WorkflowExecution completed(Instant end) {
        return new WorkflowExecution(executionId, workflowId, WorkflowStatus.COMPLETED, variables,
                currentStep, stepHistory, startTime, end, null, null);
    }

    public WorkflowExecution failed(Instant end, String message, Throwable failure) {
        return new WorkflowExecution(executionId, workflowId, WorkflowStatus.FAILED, variables,
                currentStep, stepHistory, startTime, end, message, failure);
    }

    public WorkflowExecution cancelled(Instant end) {
        return new WorkflowExecution(executionId, workflowId, WorkflowStatus.CANCELLED, variables,
                currentStep, stepHistory, startTime, end, errorMessage, cause);
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public Optional<String> getCurrentStep() {
        return Optional.ofNullable(currentStep);
    }

    public List<StepExecutionRecord> getStepHistory() {
        return stepHistory;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Duration> getDuration() {
        return endTime != null ? Optional.of(Duration.between(startTime, endTime)) : Optional.empty();
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    public boolean isSuccessful() {
        return status == WorkflowStatus.COMPLETED;
    }

    public boolean isActive() {
        return status.isActive();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowExecution that = (WorkflowExecution) o;
        return Objects.equals(executionId, that.executionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId);
    }

    @Override
    public String toString() {
        return "WorkflowExecution{" +
               "executionId='" + executionId + '\'' +
               ", workflowId='" + workflowId + '\'' +
               ", status=" + status +
               ", currentStep=" + currentStep +
               ", steps=" + stepHistory.size() +
               ", startTime=" + startTime +
               ", endTime=" + endTime +
               '}';
    }
}
