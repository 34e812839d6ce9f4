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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpelExpressionEvaluatorTest {

    private SpelExpressionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new SpelExpressionEvaluator();
    }

    @Test
    void testRewritesPlaceholders() {
        assertEquals("#total > 100", SpelExpressionEvaluator.rewritePlaceholders("${total} > 100"));
        assertEquals("#root['$input'].length()", SpelExpressionEvaluator.rewritePlaceholders("${$input}.length()"));
        assertEquals("#root['first-name']", SpelExpressionEvaluator.rewritePlaceholders("${ first-name }"));
        assertEquals("#root['it''s']", SpelExpressionEvaluator.rewritePlaceholders("${it's}"));
    }

    @Test
    void testEvaluatesComparisons() {
        assertEquals(Boolean.TRUE, evaluator.evaluate("${total} > 100", Map.of("total", 250)));
        assertEquals(Boolean.FALSE, evaluator.evaluate("${tier} == 'gold'", Map.of("tier", "silver")));
    }

    @Test
    void testVariablesAreAlsoReachableByHashName() {
        assertEquals(12, evaluator.evaluate("#a * #b", Map.of("a", 3, "b", 4)));
    }

    @Test
    void testInvokesInstanceMethods() {
        assertEquals("ADA", evaluator.evaluate("${$input}.toUpperCase()", Map.of("$input", "ada")));
        assertEquals(2, evaluator.evaluate("${items}.size()", Map.of("items", List.of("x", "y"))));
    }

    @Test
    void testUnboundVariableIsNull() {
        assertNull(evaluator.evaluate("${missing}", Map.of()));
    }

    @Test
    void testTypeReferencesAreNotAllowed() {
        ExpressionEvaluationException e = assertThrows(ExpressionEvaluationException.class,
                () -> evaluator.evaluate("T(java.lang.System).exit(1)", Map.of()));
        assertEquals("T(java.lang.System).exit(1)", e.getExpression());
    }

    @Test
    void testSyntaxErrorIsWrapped() {
        ExpressionEvaluationException e = assertThrows(ExpressionEvaluationException.class,
                () -> evaluator.evaluate("${a} >", Map.of("a", 1)));
        assertTrue(e.getMessage().startsWith("Failed to evaluate expression '${a} >'"));
    }

    @Test
    void testParsedExpressionsAreReusedAcrossBindings() {
        assertEquals(Boolean.TRUE, evaluator.evaluate("${n} > 1", Map.of("n", 2)));
        assertEquals(Boolean.FALSE, evaluator.evaluate("${n} > 1", Map.of("n", 0)));
    }
}
