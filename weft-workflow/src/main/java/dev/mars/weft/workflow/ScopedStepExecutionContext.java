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

import dev.mars.weft.core.exceptions.WeftException;
import dev.mars.weft.workflow.executor.StepExecutionContext;
import dev.mars.weft.workflow.step.StepInput;
import dev.mars.weft.workflow.step.WorkflowStep;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link StepExecutionContext} bound to one {@link ExecutionScope}.
 */
final class ScopedStepExecutionContext implements StepExecutionContext {

    private final WorkflowStepRunner runner;
    private final ExecutionScope scope;
    private final Workflow workflow;

    ScopedStepExecutionContext(WorkflowStepRunner runner, ExecutionScope scope, Workflow workflow) {
        this.runner = runner;
        this.scope = scope;
        this.workflow = workflow;
    }

    @Override
    public String getExecutionId() {
        return scope.executionId();
    }

    @Override
    public String getWorkflowId() {
        return scope.workflowId();
    }

    @Override
    public Map<String, Object> getVariables() {
        return scope.variables();
    }

    @Override
    public void setVariable(String name, Object value) {
        scope.setVariable(name, value);
    }

    @Override
    public Object resolve(WorkflowStep step, StepInput input) throws WeftException {
        try {
            return runner.resolver().resolve(input, scope.variables());
        } catch (RuntimeException e) {
            throw new StepExecutionException(step.id(), step.type(), e.getMessage(), e);
        }
    }

    @Override
    public Object evaluate(WorkflowStep step, String expression, Map<String, Object> variables)
            throws StepExecutionException {
        try {
            return runner.evaluator().evaluate(expression, variables);
        } catch (RuntimeException e) {
            throw new StepExecutionException(step.id(), step.type(), e.getMessage(), e);
        }
    }

    @Override
    public void executeSteps(List<WorkflowStep> steps) throws WeftException {
        runner.runSteps(steps, scope, workflow);
    }

    @Override
    public CompletableFuture<Map<String, Object>> executeBranch(List<WorkflowStep> steps) {
        ExecutionScope branch = scope.branch();
        return CompletableFuture.supplyAsync(() -> {
            try {
                runner.runSteps(steps, branch, workflow);
                return branch.variables();
            } catch (WeftException e) {
                throw new CompletionException(e);
            }
        }, runner.executorService());
    }

    @Override
    public <T> T await(WorkflowStep step, CompletableFuture<T> call, Duration stepTimeout)
            throws StepExecutionException {
        if (call == null) {
            throw new StepExecutionException(step.id(), step.type(), "Collaborator returned no result");
        }
        Duration deadline = runner.effectiveTimeout(stepTimeout, workflow);
        try {
            if (deadline == null) {
                return call.get();
            }
            return call.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new StepTimeoutException(step.id(), step.type(), deadline);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            throw new StepExecutionException(step.id(), step.type(),
                    cause.getMessage() != null ? cause.getMessage() : cause.toString(), cause);
        } catch (CancellationException e) {
            throw new StepExecutionException(step.id(), step.type(), "Collaborator call was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException(step.id(), step.type(),
                    "Interrupted while waiting for step '" + step.id() + "'", e);
        }
    }
}
