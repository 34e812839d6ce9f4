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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Iterates over a resolved sequence, binding each element to {@code itemVariable} in the
 * shared execution variables before running the body.
 *
 * @param maxIterations upper bound on iterations, or null for the collection length
 */
public record LoopStep(String id, StepInput collection, String itemVariable, Integer maxIterations,
                       List<WorkflowStep> steps) implements WorkflowStep {

    public LoopStep {
        Objects.requireNonNull(id, "Step id cannot be null");
        Objects.requireNonNull(collection, "Loop collection cannot be null");
        Objects.requireNonNull(itemVariable, "Item variable cannot be null");
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public Optional<Integer> getMaxIterations() {
        return Optional.ofNullable(maxIterations);
    }

    @Override
    public StepType type() {
        return StepType.LOOP;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws WeftException {
        return visitor.visitLoop(this);
    }
}
