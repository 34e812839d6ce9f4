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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default evaluator: substitutes {@code ${name}} placeholders with the string form of the
 * bound value, then coerces the result.
 *
 * <ul>
 *   <li>{@code "true"} and {@code "false"} become booleans</li>
 *   <li>text that parses fully as a number becomes a {@link Long} when integral, otherwise
 *   a {@link Double}</li>
 *   <li>anything else is returned as the substituted string</li>
 * </ul>
 *
 * Placeholders naming unbound variables are left in the text. A bound null renders as
 * {@code "null"}. Substitution is single pass, so substituted values are never
 * re-scanned for placeholders.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TemplateExpressionEvaluator implements ExpressionEvaluator {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)\\}");
    private static final Pattern NUMBER =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern INTEGRAL = Pattern.compile("[+-]?\\d+");

    @Override
    public Object evaluate(String expression, Map<String, Object> variables) {
        if (expression == null) {
            return null;
        }
        return coerce(substitute(expression, variables));
    }

    /**
     * Replaces every placeholder whose name is bound in {@code variables}.
     */
    public String substitute(String template, Map<String, Object> variables) {
        if (variables == null || variables.isEmpty()) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = variables.containsKey(name)
                    ? String.valueOf(variables.get(name))
                    : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static Object coerce(String text) {
        if ("true".equals(text)) {
            return Boolean.TRUE;
        }
        if ("false".equals(text)) {
            return Boolean.FALSE;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || !NUMBER.matcher(trimmed).matches()) {
            return text;
        }
        if (INTEGRAL.matcher(trimmed).matches()) {
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException overflow) {
                return Double.parseDouble(trimmed);
            }
        }
        return Double.parseDouble(trimmed);
    }
}
