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

package dev.mars.weft.config;

import java.util.Locale;

/**
 * How a step input that references an unbound variable is resolved.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum MissingVariablePolicy {

    /**
     * An unbound variable resolves to {@code null} and the step proceeds.
     */
    LENIENT,

    /**
     * An unbound variable fails the step.
     */
    STRICT;

    /**
     * Parses a policy name case-insensitively, falling back to the given default for
     * null or unrecognised input.
     */
    public static MissingVariablePolicy fromString(String value, MissingVariablePolicy defaultPolicy) {
        if (value == null || value.isBlank()) {
            return defaultPolicy;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultPolicy;
        }
    }
}
