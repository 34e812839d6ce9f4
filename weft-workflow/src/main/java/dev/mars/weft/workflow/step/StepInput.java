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

import java.util.Objects;

/**
 * Declared input of a step: a literal value, a reference to an execution variable,
 * or an expression evaluated against the execution variables.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public sealed interface StepInput permits StepInput.Literal, StepInput.Variable, StepInput.Expression {

    static StepInput literal(Object value) {
        return new Literal(value);
    }

    static StepInput variable(String name) {
        return new Variable(name);
    }

    static StepInput expression(String expression) {
        return new Expression(expression);
    }

    /**
     * An embedded value, returned unchanged (may be null).
     */
    record Literal(Object value) implements StepInput {
    }

    /**
     * A reference to a variable binding by name.
     */
    record Variable(String name) implements StepInput {
        public Variable {
            Objects.requireNonNull(name, "Variable name cannot be null");
        }
    }

    /**
     * An expression handed to the configured expression evaluator.
     */
    record Expression(String expression) implements StepInput {
        public Expression {
            Objects.requireNonNull(expression, "Expression cannot be null");
        }
    }
}
