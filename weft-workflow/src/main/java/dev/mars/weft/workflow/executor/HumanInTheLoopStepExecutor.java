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

import dev.mars.weft.capability.HumanCheckpointHandler;
import dev.mars.weft.core.exceptions.CapabilityNotFoundException;
import dev.mars.weft.core.exceptions.WeftException;
import dev.mars.weft.workflow.step.HumanInTheLoopStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocks the step on a human answer. The answer becomes the step output.
 */
public class HumanInTheLoopStepExecutor implements StepExecutor<HumanInTheLoopStep> {

    private static final Logger logger = LoggerFactory.getLogger(HumanInTheLoopStepExecutor.class);

    private final HumanCheckpointHandler handler;

    public HumanInTheLoopStepExecutor(HumanCheckpointHandler handler) {
        this.handler = handler;
    }

    @Override
    public StepOutcome execute(HumanInTheLoopStep step, StepExecutionContext context) throws WeftException {
        if (handler == null) {
            throw new CapabilityNotFoundException(CapabilityNotFoundException.CapabilityKind.HUMAN_CHECKPOINT, null);
        }
        logger.info("Execution {} waiting on human checkpoint '{}'{}", context.getExecutionId(), step.id(),
                step.assignee() != null ? " assigned to " + step.assignee() : "");
        String answer = context.await(step, handler.request(step.prompt(), step.options()), step.timeout());
        return StepOutcome.of(step.prompt(), answer);
    }
}
