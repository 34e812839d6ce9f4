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

package dev.mars.weft.workflow.step;

import dev.mars.weft.core.exceptions.WeftException;

import java.util.Optional;

/**
 * One unit of work within a workflow.
 *
 * <p>The step kinds form a closed set; dispatch goes through {@link Visitor}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public sealed interface WorkflowStep
        permits AgentStep, ToolStep, ConditionalStep, ParallelStep,
                LoopStep, HumanInTheLoopStep, RagStep, TransformStep {

    String id();

    StepType type();

    /**
     * Name of the variable that receives this step's output, if the step declares one.
     */
    default Optional<String> getOutputVariable() {
        return Optional.empty();
    }

    <R> R accept(Visitor<R> visitor) throws WeftException;

    /**
     * Exhaustive handler over all step kinds.
     *
     * @param <R> result type
     */
    interface Visitor<R> {

        R visitAgent(AgentStep step) throws WeftException;

        R visitTool(ToolStep step) throws WeftException;

        R visitConditional(ConditionalStep step) throws WeftException;

        R visitParallel(ParallelStep step) throws WeftException;

        R visitLoop(LoopStep step) throws WeftException;

        R visitHumanInTheLoop(HumanInTheLoopStep step) throws WeftException;

        R visitRag(RagStep step) throws WeftException;

        R visitTransform(TransformStep step) throws WeftException;
    }
}
