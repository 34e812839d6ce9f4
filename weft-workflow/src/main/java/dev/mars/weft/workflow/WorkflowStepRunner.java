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
import dev.mars.weft.workflow.executor.StepExecutors;
import dev.mars.weft.workflow.executor.StepOutcome;
import dev.mars.weft.workflow.expression.ExpressionEvaluator;
import dev.mars.weft.workflow.expression.StepInputResolver;
import dev.mars.weft.workflow.observability.WorkflowMetrics;
import dev.mars.weft.workflow.step.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * The dispatch loop: runs step lists in order against a scope, recording each step in the
 * scope's history and writing declared outputs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
final class WorkflowStepRunner {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowStepRunner.class);

    private final StepExecutors executors;
    private final StepInputResolver resolver;
    private final ExecutorService executorService;
    private final Duration defaultStepTimeout;
    private final WorkflowMetrics metrics;

    WorkflowStepRunner(StepExecutors executors, StepInputResolver resolver, ExecutorService executorService,
                       Duration defaultStepTimeout, WorkflowMetrics metrics) {
        this.executors = executors;
        this.resolver = resolver;
        this.executorService = executorService;
        this.defaultStepTimeout = defaultStepTimeout;
        this.metrics = metrics;
    }

    /**
     * Runs {@code steps} strictly in order. Stops at the first failing step.
     */
    void runSteps(List<WorkflowStep> steps, ExecutionScope scope, Workflow workflow) throws WeftException {
        for (WorkflowStep step : steps) {
            checkBoundary(scope);
            runStep(step, scope, workflow);
        }
    }

    void checkBoundary(ExecutionScope scope) throws ExecutionInterruptedException {
        WorkflowStatus status = scope.status();
        if (status == WorkflowStatus.PAUSED || status == WorkflowStatus.CANCELLED) {
            throw new ExecutionInterruptedException(scope.executionId(), status);
        }
    }

    private void runStep(WorkflowStep step, ExecutionScope scope, Workflow workflow) throws WeftException {
        StepExecutionRecord running = StepExecutionRecord.running(step, Instant.now());
        int index = scope.beginStep(running);
        logger.debug("Execution {} dispatching step '{}' ({})", scope.executionId(), step.id(), step.type());

        StepOutcome outcome;
        try {
            outcome = executors.dispatch(step, new ScopedStepExecutionContext(this, scope, workflow));
        } catch (WeftException e) {
            recordFailure(step, scope, running, index, e);
            throw e;
        } catch (RuntimeException e) {
            StepExecutionException wrapped = new StepExecutionException(step.id(), step.type(),
                    e.getMessage() != null ? e.getMessage() : e.toString(), e);
            recordFailure(step, scope, running, index, wrapped);
            throw wrapped;
        }

        scope.finishStep(index, running.completed(Instant.now(), outcome.input(), outcome.output()));
        Optional<String> outputVariable = step.getOutputVariable();
        if (outputVariable.isPresent() && outcome.output() != null) {
            scope.setVariable(outputVariable.get(), outcome.output());
        }
        if (metrics != null) {
            metrics.recordStepExecuted(scope.workflowId(), step.type().getTag());
        }
        logger.debug("Execution {} completed step '{}'", scope.executionId(), step.id());
    }

    private void recordFailure(WorkflowStep step, ExecutionScope scope, StepExecutionRecord running,
                               int index, WeftException error) {
        scope.finishStep(index, running.failed(Instant.now(), error.getMessage()));
        if (error instanceof ExecutionInterruptedException) {
            return;
        }
        logger.warn("Execution {} step '{}' failed: {}", scope.executionId(), step.id(), error.getMessage());
        if (metrics != null) {
            metrics.recordStepFailed(scope.workflowId(), step.type().getTag(), error.getClass().getSimpleName());
        }
    }

    /**
     * Deadline for a collaborator call: the step's own timeout, else the workflow's, else the
     * configured default. Null means unbounded.
     */
    Duration effectiveTimeout(Duration stepTimeout, Workflow workflow) {
        if (stepTimeout != null) {
            return stepTimeout;
        }
        if (workflow.getTimeout().isPresent()) {
            return workflow.getTimeout().get();
        }
        return defaultStepTimeout.isZero() ? null : defaultStepTimeout;
    }

    StepInputResolver resolver() {
        return resolver;
    }

    ExpressionEvaluator evaluator() {
        return resolver.getEvaluator();
    }

    ExecutorService executorService() {
        return executorService;
    }
}
