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
import dev.mars.weft.capability.AgentInvocation;
import dev.mars.weft.core.exceptions.CapabilityNotFoundException;
import dev.mars.weft.core.exceptions.WeftException;
import dev.mars.weft.workflow.step.AgentStep;

/**
 * Hands the resolved input to the agent runtime and waits for its result.
 */
public class AgentStepExecutor implements StepExecutor<AgentStep> {

    private final AgentCapability agentCapability;

    /**
     * @param agentCapability the agent runtime, or null when agents are not available
     */
    public AgentStepExecutor(AgentCapability agentCapability) {
        this.agentCapability = agentCapability;
    }

    @Override
    public StepOutcome execute(AgentStep step, StepExecutionContext context) throws WeftException {
        if (agentCapability == null) {
            throw new CapabilityNotFoundException(CapabilityNotFoundException.CapabilityKind.AGENT, null);
        }
        Object input = context.resolve(step, step.input());
        AgentInvocation invocation = new AgentInvocation(context.getExecutionId(), step.id(), step.agentId(), input);
        Object output = context.await(step, agentCapability.execute(invocation), step.timeout());
        return StepOutcome.of(input, output);
    }
}
