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

import dev.mars.weft.capability.AgentCapability;
import dev.mars.weft.capability.HumanCheckpointHandler;
import dev.mars.weft.capability.RagPipeline;
import dev.mars.weft.capability.ToolCapability;
import dev.mars.weft.config.WeftConfiguration;
import dev.mars.weft.core.Result;
import dev.mars.weft.core.exceptions.ExecutionNotFoundException;
import dev.mars.weft.core.exceptions.InvalidTransitionException;
import dev.mars.weft.core.exceptions.WeftException;
import dev.mars.weft.workflow.executor.StepExecutors;
import dev.mars.weft.workflow.expression.ExpressionEvaluator;
import dev.mars.weft.workflow.expression.StepInputResolver;
import dev.mars.weft.workflow.expression.TemplateExpressionEvaluator;
import dev.mars.weft.workflow.observability.WorkflowMetrics;
import dev.mars.weft.workflow.store.ExecutionStateStore;
import dev.mars.weft.workflow.store.InMemoryExecutionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Default {@link WorkflowEngine}.
 *
 * <p>Each execution's steps run on a cached thread pool, one logical flow per execution.
 * Parallel branches run on the same pool. Every state change goes through an atomic
 * update of the {@link ExecutionStateStore}, so pause, resume and cancel calls from other
 * threads are arbitrated per execution id against the dispatch loop's own writes.</p>
 *
 * <p>Pause and cancel are cooperative: they are observed before the next step starts, and
 * a step already waiting on a collaborator runs to completion. An execution interrupted
 * this way keeps its paused or cancelled status; it is never rewritten to failed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StandardWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(StandardWorkflowEngine.class);

    private final ExecutionStateStore stateStore;
    private final ExecutorService executorService;
    private final WorkflowStepRunner stepRunner;
    private final WorkflowMetrics metrics;
    private volatile boolean shutdown = false;

    private StandardWorkflowEngine(Builder builder) {
        WeftConfiguration configuration = builder.configuration != null
                ? builder.configuration
                : WeftConfiguration.defaults();
        this.stateStore = builder.stateStore != null ? builder.stateStore : new InMemoryExecutionStateStore();
        this.executorService = newExecutor(configuration.getExecutorThreadPrefix());
        this.metrics = configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null;

        ExpressionEvaluator evaluator = builder.expressionEvaluator != null
                ? builder.expressionEvaluator
                : new TemplateExpressionEvaluator();
        StepExecutors executors = new StepExecutors(builder.agentCapability, builder.toolCapability,
                builder.ragPipelines, builder.humanCheckpointHandler);
        this.stepRunner = new WorkflowStepRunner(executors,
                new StepInputResolver(evaluator, configuration.getMissingVariablePolicy()),
                executorService, configuration.getDefaultStepTimeout(), metrics);

        logger.info("StandardWorkflowEngine initialized: {}", configuration);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public CompletableFuture<Result<WorkflowExecution>> execute(Workflow workflow, Map<String, Object> input) {
        return execute(workflow, input, UUID.randomUUID().toString());
    }

    @Override
    public CompletableFuture<Result<WorkflowExecution>> execute(Workflow workflow, Map<String, Object> input,
                                                                String executionId) {
        if (shutdown) {
            return CompletableFuture.completedFuture(
                    Result.failure(new WeftException("Workflow engine is shutdown")));
        }
        if (workflow == null || executionId == null) {
            return CompletableFuture.completedFuture(
                    Result.failure(new WeftException("Workflow and execution id are required")));
        }

        try {
            stateStore.create(WorkflowExecution.started(executionId, workflow.getId(), input, Instant.now()));
        } catch (IllegalStateException e) {
            return CompletableFuture.completedFuture(Result.failure(new WeftException(e.getMessage())));
        }
        logger.info("Started execution {} of workflow '{}'", executionId, workflow.getId());
        if (metrics != null) {
            metrics.recordWorkflowStarted(workflow.getId());
        }

        try {
            return CompletableFuture.supplyAsync(() -> run(workflow, executionId), executorService);
        } catch (RejectedExecutionException e) {
            WeftException error = new WeftException("Workflow engine is shutdown", e);
            markFailed(workflow, executionId, error);
            return CompletableFuture.completedFuture(Result.failure(error));
        }
    }

    private Result<WorkflowExecution> run(Workflow workflow, String executionId) {
        StoredExecutionScope scope = new StoredExecutionScope(stateStore, executionId, workflow.getId());
        try {
            stepRunner.runSteps(workflow.getSteps(), scope, workflow);
            stepRunner.checkBoundary(scope);
            return markCompleted(workflow, executionId);
        } catch (ExecutionInterruptedException e) {
            logger.info("Execution {} stopped at a step boundary: {}", executionId, e.getMessage());
            return Result.failure(e);
        } catch (WeftException e) {
            markFailed(workflow, executionId, e);
            return Result.failure(e);
        } catch (RuntimeException e) {
            WeftException error = new WeftException("Unexpected failure in execution " + executionId, e);
            markFailed(workflow, executionId, error);
            return Result.failure(error);
        }
    }

    private Result<WorkflowExecution> markCompleted(Workflow workflow, String executionId) {
        Optional<WorkflowExecution> updated = stateStore.update(executionId, current ->
                current.getStatus() == WorkflowStatus.RUNNING ? current.completed(Instant.now()) : current);
        if (updated.isEmpty()) {
            return Result.failure(new ExecutionNotFoundException(executionId));
        }
        WorkflowExecution execution = updated.get();
        if (execution.getStatus() != WorkflowStatus.COMPLETED) {
            return Result.failure(new ExecutionInterruptedException(executionId, execution.getStatus()));
        }
        logger.info("Execution {} of workflow '{}' completed", executionId, workflow.getId());
        if (metrics != null) {
            metrics.recordWorkflowCompleted(workflow.getId(), seconds(execution));
        }
        return Result.success(execution);
    }

    private void markFailed(Workflow workflow, String executionId, WeftException error) {
        Optional<WorkflowExecution> updated = stateStore.update(executionId, current ->
                current.getStatus() == WorkflowStatus.RUNNING
                        ? current.failed(Instant.now(), error.getMessage(), error)
                        : current);
        if (updated.isEmpty() || updated.get().getStatus() != WorkflowStatus.FAILED) {
            return;
        }
        logger.error("Execution {} of workflow '{}' failed: {}", executionId, workflow.getId(), error.getMessage());
        if (logger.isDebugEnabled()) {
            logger.debug("Execution failure details for: {}", executionId, error);
        }
        if (metrics != null) {
            metrics.recordWorkflowFailed(workflow.getId(), error.getClass().getSimpleName(), seconds(updated.get()));
        }
    }

    @Override
    public Result<Void> pause(String executionId) {
        Result<WorkflowExecution> result = transition(executionId, WorkflowStatus.PAUSED,
                current -> current.withStatus(WorkflowStatus.PAUSED));
        if (result.isSuccess()) {
            logger.info("Paused execution {}", executionId);
            if (metrics != null) {
                metrics.recordWorkflowPaused(result.getValue().getWorkflowId());
            }
        }
        return result.map(execution -> null);
    }

    @Override
    public Result<WorkflowExecution> resume(String executionId, Map<String, Object> input) {
        Result<WorkflowExecution> result = transition(executionId, WorkflowStatus.RUNNING,
                current -> current.mergeVariables(input).withStatus(WorkflowStatus.RUNNING));
        if (result.isSuccess()) {
            logger.info("Resumed execution {}", executionId);
        }
        return result;
    }

    @Override
    public Result<Void> cancel(String executionId) {
        Result<WorkflowExecution> result = transition(executionId, WorkflowStatus.CANCELLED,
                current -> current.cancelled(Instant.now()));
        if (result.isSuccess()) {
            logger.info("Cancelled execution {}", executionId);
            if (metrics != null) {
                metrics.recordWorkflowCancelled(result.getValue().getWorkflowId());
            }
        }
        return result.map(execution -> null);
    }

    /**
     * Applies {@code change} atomically if {@code target} is reachable from the current status.
     */
    private Result<WorkflowExecution> transition(String executionId, WorkflowStatus target,
                                                 UnaryOperator<WorkflowExecution> change) {
        AtomicReference<InvalidTransitionException> rejected = new AtomicReference<>();
        Optional<WorkflowExecution> updated = stateStore.update(executionId, current -> {
            if (!current.getStatus().canTransitionTo(target)) {
                rejected.set(new InvalidTransitionException(executionId, current.getStatus(), target,
                        current.getStatus().validTransitions().toArray(new WorkflowStatus[0])));
                return current;
            }
            return change.apply(current);
        });
        if (updated.isEmpty()) {
            return Result.failure(new ExecutionNotFoundException(executionId));
        }
        if (rejected.get() != null) {
            logger.warn("Rejected transition: {}", rejected.get().getMessage());
            return Result.failure(rejected.get());
        }
        return Result.success(updated.get());
    }

    @Override
    public Result<WorkflowExecution> getExecution(String executionId) {
        return stateStore.get(executionId)
                .map(Result::success)
                .orElseGet(() -> Result.failure(new ExecutionNotFoundException(executionId)));
    }

    @Override
    public Result<WorkflowStatus> getStatus(String executionId) {
        return getExecution(executionId).map(WorkflowExecution::getStatus);
    }

    @Override
    public List<WorkflowExecution> listActive() {
        return stateStore.findAll(WorkflowExecution::isActive);
    }

    @Override
    public List<WorkflowExecution> listExecutions(String workflowId) {
        return stateStore.findAll(execution -> workflowId == null || workflowId.equals(execution.getWorkflowId()));
    }

    @Override
    public Result<Void> clearExecution(String executionId) {
        Optional<WorkflowExecution> execution = stateStore.get(executionId);
        if (execution.isEmpty()) {
            return Result.failure(new ExecutionNotFoundException(executionId));
        }
        if (execution.get().isActive()) {
            return Result.failure(new WeftException("Cannot clear active execution: " + executionId));
        }
        stateStore.remove(executionId);
        logger.debug("Cleared execution {}", executionId);
        return Result.success();
    }

    @Override
    public int clearCompleted() {
        int removed = stateStore.removeIf(execution -> execution.getStatus().isTerminal());
        logger.info("Cleared {} finished executions", removed);
        return removed;
    }

    @Override
    public void shutdown() {
        shutdown = true;
        executorService.shutdown();
        logger.info("StandardWorkflowEngine shutdown initiated");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private static double seconds(WorkflowExecution execution) {
        return execution.getDuration().map(Duration::toMillis).orElse(0L) / 1000.0;
    }

    private static ExecutorService newExecutor(String threadPrefix) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, threadPrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Builder for {@link StandardWorkflowEngine}. Every collaborator is optional; a step
     * whose collaborator is missing fails when it runs.
     */
    public static class Builder {
        private AgentCapability agentCapability;
        private ToolCapability toolCapability;
        private final Map<String, RagPipeline> ragPipelines = new HashMap<>();
        private HumanCheckpointHandler humanCheckpointHandler;
        private ExpressionEvaluator expressionEvaluator;
        private WeftConfiguration configuration;
        private ExecutionStateStore stateStore;

        public Builder agentCapability(AgentCapability agentCapability) {
            this.agentCapability = agentCapability;
            return this;
        }

        public Builder toolCapability(ToolCapability toolCapability) {
            this.toolCapability = toolCapability;
            return this;
        }

        public Builder ragPipeline(String name, RagPipeline pipeline) {
            this.ragPipelines.put(Objects.requireNonNull(name, "Pipeline name cannot be null"),
                    Objects.requireNonNull(pipeline, "Pipeline cannot be null"));
            return this;
        }

        public Builder ragPipelines(Map<String, RagPipeline> pipelines) {
            if (pipelines != null) {
                pipelines.forEach(this::ragPipeline);
            }
            return this;
        }

        public Builder humanCheckpointHandler(HumanCheckpointHandler handler) {
            this.humanCheckpointHandler = handler;
            return this;
        }

        public Builder expressionEvaluator(ExpressionEvaluator evaluator) {
            this.expressionEvaluator = evaluator;
            return this;
        }

        public Builder configuration(WeftConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder stateStore(ExecutionStateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        public StandardWorkflowEngine build() {
            return new StandardWorkflowEngine(this);
        }
    }
}
