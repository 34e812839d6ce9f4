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

import dev.mars.weft.core.exceptions.WeftException;
import dev.mars.weft.workflow.expression.Truthiness;
import dev.mars.weft.workflow.step.ConditionalStep;

public class ConditionalStepExecutor implements StepExecutor<ConditionalStep> {

    @Override
    public StepOutcome execute(ConditionalStep step, StepExecutionContext context) throws WeftException {
        Object value = context.evaluate(step, step.condition(), context.getVariables());
        if (Truthiness.isTruthy(value)) {
            context.executeSteps(step.thenSteps());
        } else if (step.elseSteps() != null) {
            context.executeSteps(step.elseSteps());
        }
        return StepOutcome.none();
    }
}
