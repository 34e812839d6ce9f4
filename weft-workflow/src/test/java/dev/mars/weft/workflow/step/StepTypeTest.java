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

import dev.mars.weft.core.exceptions.WeftException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StepTypeTest {

    @Test
    void testTagsRoundTrip() {
        for (StepType type : StepType.values()) {
            assertSame(type, StepType.fromTag(type.getTag()));
        }
        assertEquals("human_in_the_loop", StepType.HUMAN_IN_THE_LOOP.toString());
    }

    @Test
    void testUnknownTag() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> StepType.fromTag("sleep"));
        assertEquals("Unknown step type: sleep", e.getMessage());
    }

    @Test
    void testCompositeTypes() {
        assertTrue(StepType.CONDITIONAL.isComposite());
        assertTrue(StepType.PARALLEL.isComposite());
        assertTrue(StepType.LOOP.isComposite());
        assertFalse(StepType.AGENT.isComposite());
        assertFalse(StepType.TRANSFORM.isComposite());
    }

    @Test
    void testVisitorDispatchesOnKind() throws WeftException {
        WorkflowStep.Visitor<String> names = new WorkflowStep.Visitor<>() {
            @Override
            public String visitAgent(AgentStep step) {
                return "agent:" + step.agentId();
            }

            @Override
            public String visitTool(ToolStep step) {
                return "tool:" + step.toolName();
            }

            @Override
            public String visitConditional(ConditionalStep step) {
                return "conditional";
            }

            @Override
            public String visitParallel(ParallelStep step) {
                return "parallel:" + step.branches().size();
            }

            @Override
            public String visitLoop(LoopStep step) {
                return "loop";
            }

            @Override
            public String visitHumanInTheLoop(HumanInTheLoopStep step) {
                return "human";
            }

            @Override
            public String visitRag(RagStep step) {
                return "rag:" + step.pipeline();
            }

            @Override
            public String visitTransform(TransformStep step) {
                return "transform";
            }
        };

        assertEquals("agent:writer", new AgentStep("s1", "writer", StepInput.literal("x"), null).accept(names));
        assertEquals("tool:send", new ToolStep("s2", "send", StepInput.literal("x"), null).accept(names));
        assertEquals("parallel:2", new ParallelStep("s3", List.of(List.of(), List.of())).accept(names));
        assertEquals("rag:kb", new RagStep("s4", "kb", StepInput.literal("q"), null, null).accept(names));
    }

    @Test
    void testParallelDefaultsToWaitForAll() {
        ParallelStep step = new ParallelStep("p", List.of(List.of()));

        assertTrue(step.waitForAll());
        assertEquals(StepType.PARALLEL, step.type());
        assertTrue(step.getOutputVariable().isEmpty());
    }
}
