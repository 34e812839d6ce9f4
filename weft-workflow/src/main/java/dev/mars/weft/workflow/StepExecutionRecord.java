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

import dev.mars.weft.workflow.step.StepType;
import dev.mars.weft.workflow.step.WorkflowStep;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * History entry for one step attempt. Instances are immutable; completion produces a new
 * record that replaces the running one in the execution history.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class StepExecutionRecord {

    private final String stepId;
    private final StepType stepType;
    private final StepStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final Object input;
    private final Object output;
    private final String errorMessage;
    private final int retryCount;

    public StepExecutionRecord(String stepId, StepType stepType, StepStatus status, Instant startTime,
                               Instant endTime, Object input, Object output, String errorMessage,
                               int retryCount) {
        this.stepId = Objects.requireNonNull(stepId, "Step ID cannot be null");
        this.stepType = Objects.requireNonNull(stepType, "Step type cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = endTime;
        this.input = input;
        this.output = output;
        this.errorMessage = errorMessage;
        this.retryCount = retryCount;
    }

    /**
     * A fresh record in {@link StepStatus#RUNNING} for the given step.
     */
    public static StepExecutionRecord running(WorkflowStep step, Instant startTime) {
        return new StepExecutionRecord(step.id(), step.type(), StepStatus.RUNNING, startTime,
                null, null, null, null, 0);
    }

    public StepExecutionRecord completed(Instant endTime, Object input, Object output) {
        return new StepExecutionRecord(stepId, stepType, StepStatus.COMPLETED, startTime,
                endTime, input, output, null, retryCount);
    }

    public StepExecutionRecord failed(Instant endTime, String errorMessage) {
        return new StepExecutionRecord(stepId, stepType, StepStatus.FAILED, startTime,
                endTime, input, null, errorMessage, retryCount);
    }

    public String getStepId() {
        return stepId;
    }

    public StepType getStepType() {
        return stepType;
    }

    public StepStatus getStatus() {
        return status;
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

    public Object getInput() {
        return input;
    }

    public Object getOutput() {
        return output;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public int getRetryCount() {
        return retryCount;
    }

    @Override
    public String toString() {
        return "StepExecutionRecord{" +
               "stepId='" + stepId + '\'' +
               ", type=" + stepType +
               ", status=" + status +
               ", startTime=" + startTime +
               ", endTime=" + endTime +
               '}';
    }
}
