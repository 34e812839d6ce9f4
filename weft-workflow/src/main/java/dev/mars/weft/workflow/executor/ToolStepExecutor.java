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

import dev.mars.weft.capability.Tool;
import dev.mars.weft.capability.ToolCapability;
import dev.mars.weft.core.exceptions.CapabilityNotFoundException;
import dev.mars.weft.core.exceptions.WeftException;
import dev.mars.weft.workflow.step.ToolStep;

import static dev.mars.weft.core.exceptions.CapabilityNotFoundException.CapabilityKind.TOOL;

/**
 * Looks the tool up by name and invokes it with the resolved input.
 */
public class ToolStepExecutor implements StepExecutor<ToolStep> {

    private final ToolCapability toolCapability;

    public ToolStepExecutor(ToolCapability toolCapability) {
        this.toolCapability = toolCapability;
    }

    @Override
    public StepOutcome execute(ToolStep step, StepExecutionContext context) throws WeftException {
        if (toolCapability == null) {
            throw new CapabilityNotFoundException(TOOL, null);
        }
        Tool tool = toolCapability.get(step.toolName())
                .orElseThrow(() -> new CapabilityNotFoundException(TOOL, step.toolName()));
        Object input = context.resolve(step, step.input());
        Object output = context.await(step, tool.execute(input), step.timeout());
        return StepOutcome.of(input, output);
    }
}
