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

package dev.mars.weft.capability;

import java.util.Objects;

/**
 * A single request to the agent runtime, issued by an agent step.
 *
 * @param executionId the workflow execution that issued the call
 * @param stepId      the step that issued the call
 * @param agentId     the agent to run
 * @param input       the resolved step input, opaque to the engine (may be null)
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public record AgentInvocation(String executionId, String stepId, String agentId, Object input) {

    public AgentInvocation {
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(agentId, "agentId");
    }
}
