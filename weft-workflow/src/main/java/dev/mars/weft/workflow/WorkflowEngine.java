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

import dev.mars.weft.core.Result;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs workflows and controls their executions.
 *
 * <p>No method throws for an unknown execution or a rejected state change; those outcomes
 * come back as a {@link Result.Failure}.</p>
 */
public interface WorkflowEngine {

    /**
     * Starts a new execution with a generated id.
     *
     * <p>The execution record exists, in status {@link WorkflowStatus#RUNNING}, by the time
     * this method returns; the steps run asynchronously.</p>
     *
     * @param workflow the workflow to run
     * @param input    initial variable bindings, may be null
     * @return future completing with the completed execution, or a failure if a step failed
     *         or the execution was paused or cancelled
     */
    CompletableFuture<Result<WorkflowExecution>> execute(Workflow workflow, Map<String, Object> input);

    /**
     * Starts a new execution under a caller-chosen id, so the caller can address it
     * before it finishes.
     */
    CompletableFuture<Result<WorkflowExecution>> execute(Workflow workflow, Map<String, Object> input,
                                                         String executionId);

    /**
     * Pauses a running execution. Takes effect before the next step starts.
     */
    Result<Void> pause(String executionId);

    /**
     * Returns a paused execution to running, overlaying {@code input} on its variables.
     * Step dispatch does not continue automatically.
     */
    Result<WorkflowExecution> resume(String executionId, Map<String, Object> input);

    default Result<WorkflowExecution> resume(String executionId) {
        return resume(executionId, Map.of());
    }

    /**
     * Cancels a running or paused execution.
     */
    Result<Void> cancel(String executionId);

    Result<WorkflowExecution> getExecution(String executionId);

    Result<WorkflowStatus> getStatus(String executionId);

    /**
     * Executions that are running or paused.
     */
    List<WorkflowExecution> listActive();

    /**
     * Executions of one workflow, or all executions when {@code workflowId} is null.
     */
    List<WorkflowExecution> listExecutions(String workflowId);

    /**
     * Removes a finished execution from the store. Active executions cannot be cleared.
     */
    Result<Void> clearExecution(String executionId);

    /**
     * Removes every finished execution from the store.
     *
     * @return the number of executions removed
     */
    int clearCompleted();

    /**
     * Shuts down the workflow engine. Later {@code execute} calls fail.
     */
    void shutdown();
}
