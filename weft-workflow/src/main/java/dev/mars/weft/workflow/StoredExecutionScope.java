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

import dev.mars.weft.workflow.store.ExecutionStateStore;

import java.util.Map;

/**
 * Scope backed by the execution state store. Every write is a single atomic store update,
 * so a concurrent pause or cancel is never lost.
 */
final class StoredExecutionScope implements ExecutionScope {

    private final ExecutionStateStore store;
    private final String executionId;
    private final String workflowId;

    StoredExecutionScope(ExecutionStateStore store, String executionId, String workflowId) {
        this.store = store;
        this.executionId = executionId;
        this.workflowId = workflowId;
    }

    @Override
    public String executionId() {
        return executionId;
    }

    @Override
    public String workflowId() {
        return workflowId;
    }

    /**
     * An execution cleared from the store mid-run is treated as cancelled.
     */
    @Override
    public WorkflowStatus status() {
        return store.get(executionId)
                .map(WorkflowExecution::getStatus)
                .orElse(WorkflowStatus.CANCELLED);
    }

    @Override
    public Map<String, Object> variables() {
        return store.get(executionId)
                .map(WorkflowExecution::getVariables)
                .orElse(Map.of());
    }

    @Override
    public void setVariable(String name, Object value) {
        store.update(executionId, execution -> execution.withVariable(name, value));
    }

    @Override
    public int beginStep(StepExecutionRecord running) {
        return store.update(executionId, execution -> execution
                        .withStepAppended(running)
                        .withCurrentStep(running.getStepId()))
                .map(execution -> execution.getStepHistory().size() - 1)
                .orElse(-1);
    }

    @Override
    public void finishStep(int index, StepExecutionRecord finished) {
        if (index < 0) {
            return;
        }
        store.update(executionId, execution -> execution.withStepRecord(index, finished));
    }

    @Override
    public ExecutionScope branch() {
        return new BranchExecutionScope(this, variables());
    }
}
