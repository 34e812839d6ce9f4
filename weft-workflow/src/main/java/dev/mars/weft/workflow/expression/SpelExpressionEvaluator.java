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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluator backed by the Spring Expression Language.
 *
 * <p>Every binding is available as a SpEL variable ({@code #name}) and through the root
 * map ({@code #root['name']}). {@code ${name}} placeholders are rewritten to those
 * references before parsing, so templated conditions such as {@code "${count} > 3"} keep
 * working, with typed comparison instead of string substitution.</p>
 *
 * <p>Evaluation runs in a read-only data binding context: expressions cannot assign
 * variables or reach types, constructors or bean references.</p>
 */
public class SpelExpressionEvaluator implements ExpressionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(SpelExpressionEvaluator.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)\\}");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentHashMap<>();

    @Override
    public Object evaluate(String expression, Map<String, Object> variables) {
        if (expression == null) {
            return null;
        }
        Map<String, Object> bindings = variables != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(variables))
                : Collections.emptyMap();

        SimpleEvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding()
                .withInstanceMethods()
                .withRootObject(bindings)
                .build();
        bindings.forEach(context::setVariable);

        try {
            Expression parsed = cache.computeIfAbsent(expression, this::parse);
            return parsed.getValue(context);
        } catch (ExpressionException e) {
            logger.debug("SpEL evaluation failed for '{}': {}", expression, e.getMessage());
            throw new ExpressionEvaluationException(expression,
                    "Failed to evaluate expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    private Expression parse(String expression) {
        return parser.parseExpression(rewritePlaceholders(expression));
    }

    static String rewritePlaceholders(String expression) {
        Matcher matcher = PLACEHOLDER.matcher(expression);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            String reference = IDENTIFIER.matcher(name).matches()
                    ? "#" + name
                    : "#root['" + name.replace("'", "''") + "']";
            matcher.appendReplacement(result, Matcher.quoteReplacement(reference));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
