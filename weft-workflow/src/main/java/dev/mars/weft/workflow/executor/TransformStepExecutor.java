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
import dev.mars.weft.workflow.step.TransformStep;

import java.util.LinkedHashMap;
import java.util.Map;

public class TransformStepExecutor implements StepExecutor<TransformStep> {

    @Override
    public StepOutcome execute(TransformStep step, StepExecutionContext context) throws WeftException {
        Object input = context.resolve(step, step.input());
        Map<String, Object> bindings = new LinkedHashMap<>(context.getVariables());
        bindings.put(TransformStep.INPUT_VARIABLE, input);
        return StepOutcome.of(input, context.evaluate(step, step.expression(), bindings));
    }
}
