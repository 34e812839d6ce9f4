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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Delegates to the agent runtime.
 *
 * @param id      step id
 * @param agentId the agent to run
 * @param input   declared input
 * @param output  variable receiving the agent result, or null
 * @param timeout deadline for the agent call, or null
 */
public record AgentStep(String id, String agentId, StepInput input, String output, Duration timeout)
        implements WorkflowStep {

    public AgentStep {
        Objects.requireNonNull(id, "Step id cannot be null");
        Objects.requireNonNull(agentId, "Agent id cannot be null");
        Objects.requireNonNull(input, "Step input cannot be null");
    }

    public AgentStep(String id, String agentId, StepInput input, String output) {
        this(id, agentId, input, output, null);
    }

    @Override
    public StepType type() {
        return StepType.AGENT;
    }

    @Override
    public Optional<String> getOutputVariable() {
        return Optional.ofNullable(output);
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws WeftException {
        return visitor.visitAgent(this);
    }
}
