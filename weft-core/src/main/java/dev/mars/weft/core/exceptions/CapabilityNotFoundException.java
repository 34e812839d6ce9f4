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

package dev.mars.weft.core.exceptions;

/**
 * Thrown when a step names a collaborator (tool, retrieval pipeline) that is not
 * registered, or when the collaborator for a whole step kind was never configured.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class CapabilityNotFoundException extends WeftException {

    /**
     * Kinds of collaborator a step can look up.
     */
    public enum CapabilityKind {
        AGENT,
        TOOL,
        RAG_PIPELINE,
        HUMAN_CHECKPOINT
    }

    private final CapabilityKind kind;
    private final String name;

    public CapabilityNotFoundException(CapabilityKind kind, String name) {
        super(formatMessage(kind, name));
        this.kind = kind;
        this.name = name;
    }

    public CapabilityKind getKind() {
        return kind;
    }

    /**
     * The looked-up name, or null when the whole capability is not configured.
     */
    public String getName() {
        return name;
    }

    private static String formatMessage(CapabilityKind kind, String name) {
        switch (kind) {
            case TOOL:
                return name != null ? "Tool not found: " + name : "Tool capability not configured";
            case RAG_PIPELINE:
                return "RAG pipeline not found: " + name;
            case AGENT:
                return "Agent capability not configured";
            case HUMAN_CHECKPOINT:
                return "Human checkpoint handler not configured";
            default:
                return "Capability not found: " + kind + " " + name;
        }
    }
}
