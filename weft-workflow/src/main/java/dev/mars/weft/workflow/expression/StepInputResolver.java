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

package dev.mars.weft.workflow.expression;

import dev.mars.weft.config.MissingVariablePolicy;
import dev.mars.weft.workflow.step.StepInput;

import java.util.Map;
import java.util.Objects;

/**
 * Resolves a declared {@link StepInput} to a concrete value against the current variables.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StepInputResolver {

    private final ExpressionEvaluator evaluator;
    private final MissingVariablePolicy missingVariablePolicy;

    public StepInputResolver(ExpressionEvaluator evaluator, MissingVariablePolicy missingVariablePolicy) {
        this.evaluator = Objects.requireNonNull(evaluator, "Expression evaluator cannot be null");
        this.missingVariablePolicy = Objects.requireNonNull(missingVariablePolicy,
                "Missing variable policy cannot be null");
    }

    /**
     * Literal values are returned unchanged; variable references are looked up;
     * expressions are handed to the evaluator.
     *
     * @throws VariableResolutionException if a referenced variable is unbound and the policy
     *                                     is {@link MissingVariablePolicy#STRICT}
     */
    public Object resolve(StepInput input, Map<String, Object> variables) throws VariableResolutionException {
        Objects.requireNonNull(input, "Step input cannot be null");
        if (input instanceof StepInput.Literal) {
            return ((StepInput.Literal) input).value();
        }
        if (input instanceof StepInput.Variable) {
            String name = ((StepInput.Variable) input).name();
            if (!variables.containsKey(name) && missingVariablePolicy == MissingVariablePolicy.STRICT) {
                throw new VariableResolutionException(name);
            }
            return variables.get(name);
        }
        return evaluator.evaluate(((StepInput.Expression) input).expression(), variables);
    }

    public ExpressionEvaluator getEvaluator() {
        return evaluator;
    }

    public MissingVariablePolicy getMissingVariablePolicy() {
        return missingVariablePolicy;
    }
}
