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
 * Runs {@code thenSteps} when the condition evaluates truthy, otherwise {@code elseSteps}
 * if present. An absent else branch is a no-op.
 */
public record ConditionalStep(String id, String condition, List<WorkflowStep> thenSteps,
                              List<WorkflowStep> elseSteps) implements WorkflowStep {

    public ConditionalStep {
        Objects.requireNonNull(id, "Step id cannot be null");
        Objects.requireNonNull(condition, "Condition cannot be null");
        thenSteps = thenSteps != null ? List.copyOf(thenSteps) : List.of();
        elseSteps = elseSteps != null ? List.copyOf(elseSteps) : null;
    }

    public Optional<List<WorkflowStep>> getElseSteps() {
        return Optional.ofNullable(elseSteps);
    }

    @Override
    public StepType type() {
        return StepType.CONDITIONAL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws WeftException {
        return visitor.visitConditional(this);
    }
}
