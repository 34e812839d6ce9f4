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
import dev.mars.weft.workflow.StepExecutionException;
import dev.mars.weft.workflow.step.LoopStep;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Runs the loop body once per element, up to {@code maxIterations}. The item variable is
 * bound in the shared variables, so it stays bound to the last element afterwards.
 */
public class LoopStepExecutor implements StepExecutor<LoopStep> {

    @Override
    public StepOutcome execute(LoopStep step, StepExecutionContext context) throws WeftException {
        List<?> items = asSequence(step, context.resolve(step, step.collection()));
        int iterations = step.maxIterations() != null
                ? Math.min(items.size(), step.maxIterations())
                : items.size();
        for (int i = 0; i < iterations; i++) {
            context.setVariable(step.itemVariable(), items.get(i));
            context.executeSteps(step.steps());
        }
        return StepOutcome.none();
    }

    private static List<?> asSequence(LoopStep step, Object collection) throws StepExecutionException {
        if (collection instanceof List) {
            return (List<?>) collection;
        }
        if (collection instanceof Collection) {
            return new ArrayList<>((Collection<?>) collection);
        }
        if (collection instanceof Object[]) {
            return Arrays.asList((Object[]) collection);
        }
        throw new StepExecutionException(step.id(), step.type(), "Loop collection must be an array");
    }
}
