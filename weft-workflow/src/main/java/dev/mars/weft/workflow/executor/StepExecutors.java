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

import dev.mars.weft.capability.AgentCapability;
import dev.mars.weft.capability.HumanCheckpointHandler;
import dev.mars.weft.capability.RagPipeline;
import dev.mars.weft.capability.ToolCapability;
import dev.mars.weft.core.exceptions.WeftException;
import dev.mars.weft.workflow.step.AgentStep;
import dev.mars.weft.workflow.step.ConditionalStep;
import dev.mars.weft.workflow.step.HumanInTheLoopStep;
import dev.mars.weft.workflow.step.LoopStep;
import dev.mars.weft.workflow.step.ParallelStep;
import dev.mars.weft.workflow.step.RagStep;
import dev.mars.weft.workflow.step.ToolStep;
import dev.mars.weft.workflow.step.TransformStep;
import dev.mars.weft.workflow.step.WorkflowStep;

import java.util.Map;

/**
 * One executor per step kind, dispatched through {@link WorkflowStep.Visitor}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StepExecutors {

    private final AgentStepExecutor agent;
    private final ToolStepExecutor tool;
    private final ConditionalStepExecutor conditional = new ConditionalStepExecutor();
    private final ParallelStepExecutor parallel = new ParallelStepExecutor();
    private final LoopStepExecutor loop = new LoopStepExecutor();
    private final HumanInTheLoopStepExecutor human;
    private final RagStepExecutor rag;
    private final TransformStepExecutor transform = new TransformStepExecutor();

    /**
     * Any collaborator may be null; steps of the matching kind then fail with
     * {@link dev.mars.weft.core.exceptions.CapabilityNotFoundException}.
     */
    public StepExecutors(AgentCapability agentCapability, ToolCapability toolCapability,
                         Map<String, RagPipeline> ragPipelines, HumanCheckpointHandler humanHandler) {
        this.agent = new AgentStepExecutor(agentCapability);
        this.tool = new ToolStepExecutor(toolCapability);
        this.human = new HumanInTheLoopStepExecutor(humanHandler);
        this.rag = new RagStepExecutor(ragPipelines);
    }

    public StepOutcome dispatch(WorkflowStep step, StepExecutionContext context) throws WeftException {
        return step.accept(new WorkflowStep.Visitor<StepOutcome>() {
            @Override
            public StepOutcome visitAgent(AgentStep s) throws WeftException {
                return agent.execute(s, context);
            }

            @Override
            public StepOutcome visitTool(ToolStep s) throws WeftException {
                return tool.execute(s, context);
            }

            @Override
            public StepOutcome visitConditional(ConditionalStep s) throws WeftException {
                return conditional.execute(s, context);
            }

            @Override
            public StepOutcome visitParallel(ParallelStep s) throws WeftException {
                return parallel.execute(s, context);
            }

            @Override
            public StepOutcome visitLoop(LoopStep s) throws WeftException {
                return loop.execute(s, context);
            }

            @Override
            public StepOutcome visitHumanInTheLoop(HumanInTheLoopStep s) throws WeftException {
                return human.execute(s, context);
            }

            @Override
            public StepOutcome visitRag(RagStep s) throws WeftException {
                return rag.execute(s, context);
            }

            @Override
            public StepOutcome visitTransform(TransformStep s) throws WeftException {
                return transform.execute(s, context);
            }
        });
    }
}
