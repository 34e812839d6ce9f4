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

package dev.mars.weft.workflow.executor;

import dev.mars.weft.core.exceptions.WeftException;
import dev.mars.weft.workflow.StepExecutionException;
import dev.mars.weft.workflow.step.StepInput;
import dev.mars.weft.workflow.step.WorkflowStep;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The view of a running execution handed to step executors.
 *
 * <p>A context is bound to one variable scope: the execution's shared variables at the
 * top level and inside conditionals and loops, or an isolated copy inside a parallel
 * branch.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface StepExecutionContext {

    String getExecutionId();

    String getWorkflowId();

    /**
     * Snapshot of the variables visible in this scope.
     */
    Map<String, Object> getVariables();

    void setVariable(String name, Object value);

    /**
     * Resolves a step input against the current variables.
     */
    Object resolve(WorkflowStep step, StepInput input) throws WeftException;

    /**
     * Evaluates an expression with the configured evaluator. Evaluator failures surface as
     * {@link StepExecutionException} for {@code step}.
     */
    Object evaluate(WorkflowStep step, String expression, Map<String, Object> variables)
            throws StepExecutionException;

    /**
     * Runs steps in order in this scope, checking for pause and cancel before each one.
     */
    void executeSteps(List<WorkflowStep> steps) throws WeftException;

    /**
     * Starts a parallel branch on the engine's executor, against a copy of the current
     * variables. The future completes with the branch's final variables.
     */
    CompletableFuture<Map<String, Object>> executeBranch(List<WorkflowStep> steps);

    /**
     * Waits for a collaborator call. The deadline is {@code stepTimeout} when given, else the
     * workflow timeout, else the configured default.
     *
     * @throws dev.mars.weft.workflow.StepTimeoutException if the deadline passes first
     * @throws StepExecutionException                      if the call completes exceptionally
     */
    <T> T await(WorkflowStep step, CompletableFuture<T> call, Duration stepTimeout)
            throws StepExecutionException;
}
