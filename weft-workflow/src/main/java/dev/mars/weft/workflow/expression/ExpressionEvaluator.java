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

import java.util.Map;

/**
 * Pluggable strategy for evaluating condition and transform expressions.
 *
 * <p>Implementations must be safe for concurrent use; parallel branches evaluate
 * against independent variable maps at the same time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@FunctionalInterface
public interface ExpressionEvaluator {

    /**
     * Evaluates an expression against a set of variable bindings.
     *
     * @param expression the expression text
     * @param variables  bindings visible to the expression, values may be null
     * @return the result value, which may be null
     * @throws ExpressionEvaluationException if the expression cannot be parsed or evaluated
     */
    Object evaluate(String expression, Map<String, Object> variables);
}
