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

import dev.mars.weft.workflow.step.AgentStep;
import dev.mars.weft.workflow.step.ConditionalStep;
import dev.mars.weft.workflow.step.HumanInTheLoopStep;
import dev.mars.weft.workflow.step.LoopStep;
import dev.mars.weft.workflow.step.ParallelStep;
import dev.mars.weft.workflow.step.RagStep;
import dev.mars.weft.workflow.step.StepInput;
import dev.mars.weft.workflow.step.ToolStep;
import dev.mars.weft.workflow.step.TransformStep;
import dev.mars.weft.workflow.step.WorkflowStep;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Fluent builder for {@link Workflow} definitions.
 *
 * <pre>{@code
 * Workflow onboarding = new WorkflowBuilder("customer-onboarding", "1.0.0")
 *     .agent("welcome-agent", WorkflowBuilder.variable("customer"), "welcome")
 *     .tool("send-email", WorkflowBuilder.variable("welcome"))
 *     .condition("${premium}",
 *         then -> then.agent("premium-onboarding", WorkflowBuilder.variable("customer")),
 *         otherwise -> otherwise.agent("standard-onboarding", WorkflowBuilder.variable("customer")))
 *     .build();
 * }</pre>
 *
 * Step ids are generated as {@code step-1}, {@code step-2}, ... in the order steps are
 * added. Nested builders share the counter, so ids are unique across the whole workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowBuilder {

    static final Duration DEFAULT_HUMAN_TIMEOUT = Duration.ofMinutes(5);

    private final String workflowId;
    private final String workflowVersion;
    private final AtomicInteger stepCounter;
    private final List<WorkflowStep> steps = new ArrayList<>();
    private String workflowName;
    private Duration timeout;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    public WorkflowBuilder(String workflowId) {
        this(workflowId, Workflow.DEFAULT_VERSION);
    }

    public WorkflowBuilder(String workflowId, String version) {
        this(workflowId, version, new AtomicInteger());
    }

    private WorkflowBuilder(String workflowId, String version, AtomicInteger stepCounter) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.workflowVersion = version;
        this.stepCounter = stepCounter;
    }

    public WorkflowBuilder name(String name) {
        this.workflowName = name;
        return this;
    }

    public WorkflowBuilder withTimeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public WorkflowBuilder withMetadata(String key, String value) {
        this.metadata.put(key, value);
        return this;
    }

    public WorkflowBuilder withMetadata(Map<String, String> metadata) {
        if (metadata != null) {
            this.metadata.putAll(metadata);
        }
        return this;
    }

    public WorkflowBuilder agent(String agentId, StepInput input) {
        return agent(agentId, input, null, null);
    }

    public WorkflowBuilder agent(String agentId, StepInput input, String output) {
        return agent(agentId, input, output, null);
    }

    public WorkflowBuilder agent(String agentId, StepInput input, String output, Duration timeout) {
        steps.add(new AgentStep(nextStepId(), agentId, input, output, timeout));
        return this;
    }

    public WorkflowBuilder tool(String toolName, StepInput input) {
        return tool(toolName, input, null, null);
    }

    public WorkflowBuilder tool(String toolName, StepInput input, String output) {
        return tool(toolName, input, output, null);
    }

    public WorkflowBuilder tool(String toolName, StepInput input, String output, Duration timeout) {
        steps.add(new ToolStep(nextStepId(), toolName, input, output, timeout));
        return this;
    }

    public WorkflowBuilder condition(String expression, Consumer<WorkflowBuilder> thenBranch) {
        return condition(expression, thenBranch, null);
    }

    /**
     * Adds a conditional step.
     *
     * @param elseBranch may be null for a conditional without an else branch
     */
    public WorkflowBuilder condition(String expression, Consumer<WorkflowBuilder> thenBranch,
                                     Consumer<WorkflowBuilder> elseBranch) {
        String id = nextStepId();
        List<WorkflowStep> thenSteps = nested(thenBranch);
        List<WorkflowStep> elseSteps = elseBranch != null ? nested(elseBranch) : null;
        steps.add(new ConditionalStep(id, expression, thenSteps, elseSteps));
        return this;
    }

    @SafeVarargs
    public final WorkflowBuilder parallel(Consumer<WorkflowBuilder>... branches) {
        String id = nextStepId();
        List<List<WorkflowStep>> built = new ArrayList<>();
        for (Consumer<WorkflowBuilder> branch : branches) {
            built.add(nested(branch));
        }
        steps.add(new ParallelStep(id, built, true));
        return this;
    }

    public WorkflowBuilder loop(StepInput collection, String itemVariable, Consumer<WorkflowBuilder> body) {
        return loop(collection, itemVariable, body, null);
    }

    public WorkflowBuilder loop(StepInput collection, String itemVariable, Consumer<WorkflowBuilder> body,
                                Integer maxIterations) {
        String id = nextStepId();
        steps.add(new LoopStep(id, collection, itemVariable, maxIterations, nested(body)));
        return this;
    }

    public WorkflowBuilder humanApproval(String prompt, List<String> options) {
        return humanApproval(prompt, options, null, null, null);
    }

    /**
     * Adds a human checkpoint. A null timeout means five minutes.
     */
    public WorkflowBuilder humanApproval(String prompt, List<String> options, Duration timeout,
                                        String assignee, String output) {
        steps.add(new HumanInTheLoopStep(nextStepId(), prompt, options,
                timeout != null ? timeout : DEFAULT_HUMAN_TIMEOUT, assignee, output));
        return this;
    }

    public WorkflowBuilder rag(String pipeline, StepInput query) {
        return rag(pipeline, query, null, null);
    }

    public WorkflowBuilder rag(String pipeline, StepInput query, Integer topK, String output) {
        steps.add(new RagStep(nextStepId(), pipeline, query, topK, output));
        return this;
    }

    public WorkflowBuilder transform(StepInput input, String expression, String output) {
        steps.add(new TransformStep(nextStepId(), input, expression, output));
        return this;
    }

    /**
     * Adds a pre-built step as is, keeping its id.
     */
    public WorkflowBuilder step(WorkflowStep step) {
        steps.add(Objects.requireNonNull(step, "Step cannot be null"));
        return this;
    }

    public static StepInput literal(Object value) {
        return StepInput.literal(value);
    }

    public static StepInput variable(String name) {
        return StepInput.variable(name);
    }

    public static StepInput expression(String expression) {
        return StepInput.expression(expression);
    }

    public Workflow build() {
        return new Workflow(workflowId, workflowName, workflowVersion, steps, timeout, metadata);
    }

    private List<WorkflowStep> nested(Consumer<WorkflowBuilder> configurer) {
        WorkflowBuilder child = new WorkflowBuilder(workflowId, workflowVersion, stepCounter);
        configurer.accept(child);
        return child.steps;
    }

    private String nextStepId() {
        return "step-" + stepCounter.incrementAndGet();
    }
}
