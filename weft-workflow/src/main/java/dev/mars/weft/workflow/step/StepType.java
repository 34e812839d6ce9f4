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

/**
 * Discriminator of the workflow step kinds. The tag is the wire name used in YAML
 * definitions and serialized execution history.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum StepType {

    AGENT("agent"),
    TOOL("tool"),
    CONDITIONAL("conditional"),
    PARALLEL("parallel"),
    LOOP("loop"),
    HUMAN_IN_THE_LOOP("human_in_the_loop"),
    RAG("rag"),
    TRANSFORM("transform");

    private final String tag;

    StepType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Looks up a step type by its tag.
     *
     * @throws IllegalArgumentException if the tag is not a known step type
     */
    public static StepType fromTag(String tag) {
        for (StepType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown step type: " + tag);
    }

    /**
     * Whether steps of this kind contain nested sub-steps.
     */
    public boolean isComposite() {
        return this == CONDITIONAL || this == PARALLEL || this == LOOP;
    }

    @Override
    public String toString() {
        return tag;
    }
}
