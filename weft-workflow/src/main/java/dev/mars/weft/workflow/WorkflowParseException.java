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

package dev.mars.weft.workflow;

import dev.mars.weft.core.exceptions.WeftException;

/**
 * Exception thrown when a workflow definition cannot be parsed or fails validation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowParseException extends WeftException {

    private static final long serialVersionUID = 1L;

    private final String fieldPath;
    private final transient ValidationResult validationResult;

    public WorkflowParseException(String message) {
        this(null, message, null, null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(null, message, cause, null);
    }

    public WorkflowParseException(String fieldPath, String message) {
        this(fieldPath, message, null, null);
    }

    public WorkflowParseException(String fieldPath, String message, Throwable cause) {
        this(fieldPath, message, cause, null);
    }

    /**
     * A definition rejected by validation; the result holds every issue found.
     */
    public WorkflowParseException(String message, ValidationResult validationResult) {
        this(null, message + validationResult.describeErrors(), null, validationResult);
    }

    private WorkflowParseException(String fieldPath, String message, Throwable cause,
                                   ValidationResult validationResult) {
        super(fieldPath != null ? "Field '" + fieldPath + "': " + message : message, cause);
        this.fieldPath = fieldPath;
        this.validationResult = validationResult;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    /**
     * The validation issues, when the definition was rejected by validation.
     */
    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
