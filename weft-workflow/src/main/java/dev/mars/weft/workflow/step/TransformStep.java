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

import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates an expression with the resolved input bound as {@code $input}.
 */
public record TransformStep(String id, StepInput input, String expression, String output)
        implements WorkflowStep {

    /**
     * Reserved variable name holding the resolved input during evaluation.
     */
    public static final String INPUT_VARIABLE = "$input";

    public TransformStep {
        Objects.requireNonNull(id, "Step id cannot be null");
        Objects.requireNonNull(input, "Step input cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");
    }

    @Override
    public Optional<String> getOutputVariable() {
        return Optional.ofNullable(output);
    }

    @Override
    public StepType type() {
        return StepType.TRANSFORM;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws WeftException {
        return visitor.visitTransform(this);
    }
}
