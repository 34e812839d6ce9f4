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

import dev.mars.weft.capability.AgentCapability;
import dev.mars.weft.capability.AgentInvocation;
import dev.mars.weft.capability.HumanCheckpointHandler;
import dev.mars.weft.capability.InMemoryToolRegistry;
import dev.mars.weft.capability.RagPipeline;
import dev.mars.weft.capability.RagQueryOptions;
import dev.mars.weft.capability.RetrievalResult;
import dev.mars.weft.capability.RetrievedDocument;
import dev.mars.weft.capability.Tool;
import dev.mars.weft.config.WeftConfiguration;
import dev.mars.weft.core.Result;
import dev.mars.weft.core.exceptions.CapabilityNotFoundException;
import dev.mars.weft.core.exceptions.ExecutionNotFoundException;
import dev.mars.weft.core.exceptions.InvalidTransitionException;
import dev.mars.weft.workflow.expression.SpelExpressionEvaluator;
import dev.mars.weft.workflow.expression.VariableResolutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

import static dev.mars.weft.workflow.WorkflowBuilder.literal;
import static dev.mars.weft.workflow.WorkflowBuilder.variable;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StandardWorkflowEngineTest {

    @Mock
    private AgentCapability agentCapability;

    @Mock
    private HumanCheckpointHandler humanHandler;

    @Mock
    private RagPipeline ragPipeline;

    private InMemoryToolRegistry tools;
    private List<String> calls;
    private StandardWorkflowEngine engine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        tools = new InMemoryToolRegistry();
        calls = new CopyOnWriteArrayList<>();
        engine = newEngine(WeftConfiguration.defaults());
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    void testSequentialStepsRunInDeclarationOrder() throws Exception {
        registerRecordingTools("first", "second", "third");
        Workflow workflow = new WorkflowBuilder("sequence")
                .tool("first", literal(1))
                .tool("second", literal(2))
                .tool("third", literal(3))
                .build();

        Result<WorkflowExecution> result = run(workflow, Map.of());

        assertTrue(result.isSuccess());
        assertEquals(List.of("first", "second", "third"), calls);
        WorkflowExecution execution = result.getValue();
        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus());
        assertTrue(execution.getEndTime().isPresent());
        assertEquals(List.of("step-1", "step-2", "step-3"), stepIds(execution));
        assertTrue(execution.getStepHistory().stream().allMatch(r -> r.getStatus() == StepStatus.COMPLETED));
    }

    @Test
    void testAgentOutputFeedsNextStep() throws Exception {
        when(agentCapability.execute(any())).thenAnswer(invocation -> {
            AgentInvocation call = invocation.getArgument(0);
            return CompletableFuture.completedFuture("Hello " + call.input());
        });
        registerTool("shout", input -> CompletableFuture.completedFuture(input.toString().toUpperCase()));
        Workflow workflow = new WorkflowBuilder("greeting")
                .agent("greeter", variable("name"), "greeting")
                .tool("shout", variable("greeting"), "shouted")
                .build();

        WorkflowExecution execution = run(workflow, Map.of("name", "Ada")).getValue();

        assertEquals("Hello Ada", execution.getVariables().get("greeting"));
        assertEquals("HELLO ADA", execution.getVariables().get("shouted"));
        StepExecutionRecord agentRecord = execution.getStepHistory().get(0);
        assertEquals("Ada", agentRecord.getInput());
        assertEquals("Hello Ada", agentRecord.getOutput());
    }

    @Test
    void testConditionalRunsThenBranchWhenTruthy() throws Exception {
        registerRecordingTools("premium", "standard");
        Workflow workflow = tieredWorkflow();

        WorkflowExecution execution = run(workflow, Map.of("premium", true)).getValue();

        assertEquals(List.of("premium"), calls);
        assertEquals(List.of("step-1", "step-2"), stepIds(execution));
    }

    @Test
    void testConditionalRunsElseBranchWhenFalsy() throws Exception {
        registerRecordingTools("premium", "standard");
        Workflow workflow = tieredWorkflow();

        WorkflowExecution execution = run(workflow, Map.of("premium", false)).getValue();

        assertEquals(List.of("standard"), calls);
        assertEquals(List.of("step-1", "step-3"), stepIds(execution));
    }

    @Test
    void testConditionalWithoutElseDoesNothingWhenFalsy() throws Exception {
        registerRecordingTools("premium");
        Workflow workflow = new WorkflowBuilder("optional")
                .condition("${premium}", then -> then.tool("premium", literal("vip")))
                .build();

        Result<WorkflowExecution> result = run(workflow, Map.of("premium", 0));

        assertTrue(result.isSuccess());
        assertTrue(calls.isEmpty());
        assertEquals(1, result.getValue().getStepHistory().size());
    }

    @Test
    void testLoopStopsAtMaxIterations() throws Exception {
        List<Object> seen = new CopyOnWriteArrayList<>();
        registerTool("collect", input -> {
            seen.add(input);
            return CompletableFuture.completedFuture(null);
        });
        Workflow workflow = new WorkflowBuilder("batch")
                .loop(variable("items"), "item", body -> body.tool("collect", variable("item")), 3)
                .build();

        WorkflowExecution execution = run(workflow, Map.of("items", List.of(1, 2, 3, 4, 5))).getValue();

        assertEquals(List.of(1, 2, 3), seen);
        assertEquals(3, execution.getVariables().get("item"));
        assertEquals(4, execution.getStepHistory().size());
    }

    @Test
    void testLoopOverNonCollectionFails() throws Exception {
        registerRecordingTools("collect");
        Workflow workflow = new WorkflowBuilder("batch")
                .loop(literal("not a list"), "item", body -> body.tool("collect", variable("item")))
                .build();

        Result<WorkflowExecution> result = run(workflow, Map.of());

        assertTrue(result.isFailure());
        assertEquals("Loop collection must be an array", result.getError().getMessage());
        assertEquals(WorkflowStatus.FAILED, statusOf(workflow));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testParallelBranchesDoNotShareVariables() throws Exception {
        Workflow workflow = new WorkflowBuilder("fan-out")
                .parallel(
                        left -> left.transform(literal("left"), "${$input}", "side"),
                        right -> right.transform(literal("right"), "${$input}", "side"))
                .build();

        WorkflowExecution execution = run(workflow, Map.of("shared", "yes")).getValue();

        assertFalse(execution.getVariables().containsKey("side"));
        assertEquals(1, execution.getStepHistory().size());
        List<Map<String, Object>> branches = (List<Map<String, Object>>) execution.getStepHistory().get(0).getOutput();
        assertEquals(2, branches.size());
        assertEquals("left", branches.get(0).get("side"));
        assertEquals("right", branches.get(1).get("side"));
        assertEquals("yes", branches.get(1).get("shared"));
    }

    @Test
    void testParallelReportsFirstFailingBranch() throws Exception {
        registerTool("broken", input -> CompletableFuture.failedFuture(new IllegalStateException("branch " + input)));
        Workflow workflow = new WorkflowBuilder("fan-out")
                .parallel(
                        ok -> ok.transform(literal("fine"), "${$input}", "value"),
                        bad -> bad.tool("broken", literal("two")),
                        worse -> worse.tool("broken", literal("three")))
                .build();

        Result<WorkflowExecution> result = run(workflow, Map.of());

        assertTrue(result.isFailure());
        assertEquals("branch two", result.getError().getMessage());
    }

    @Test
    void testFailingStepStopsExecution() throws Exception {
        registerRecordingTools("a", "c");
        registerTool("b", input -> CompletableFuture.failedFuture(new IllegalStateException("boom")));
        Workflow workflow = new WorkflowBuilder("fail-fast")
                .tool("a", literal(1))
                .tool("b", literal(2))
                .tool("c", literal(3))
                .build();

        Result<WorkflowExecution> result = run(workflow, Map.of());

        assertTrue(result.isFailure());
        assertTrue(result.getError() instanceof StepExecutionException);
        assertEquals("boom", result.getError().getMessage());
        assertEquals(List.of("a"), calls);

        WorkflowExecution execution = onlyExecution(workflow);
        assertEquals(WorkflowStatus.FAILED, execution.getStatus());
        assertEquals("boom", execution.getErrorMessage().orElseThrow());
        assertEquals(2, execution.getStepHistory().size());
        StepExecutionRecord failed = execution.getStepHistory().get(1);
        assertEquals(StepStatus.FAILED, failed.getStatus());
        assertEquals("boom", failed.getErrorMessage().orElseThrow());
    }

    @Test
    void testTransformSubstitutesVariables() throws Exception {
        Workflow workflow = new WorkflowBuilder("template")
                .transform(variable("name"), "Hello ${$input} from ${city}", "message")
                .transform(literal(null), "${count}", "copied")
                .build();

        WorkflowExecution execution = run(workflow, Map.of("name", "Ada", "city", "London", "count", 42)).getValue();

        assertEquals("Hello Ada from London", execution.getVariables().get("message"));
        assertEquals(42L, execution.getVariables().get("copied"));
    }

    @Test
    void testSpelEvaluatorDrivesConditionsAndTransforms() throws Exception {
        engine.shutdown();
        engine = StandardWorkflowEngine.builder()
                .toolCapability(tools)
                .expressionEvaluator(new SpelExpressionEvaluator())
                .build();
        Workflow workflow = new WorkflowBuilder("spel")
                .condition("${score} > 10",
                        then -> then.transform(variable("name"), "${$input}.toUpperCase()", "label"),
                        otherwise -> otherwise.transform(literal("low"), "${$input}", "label"))
                .build();

        assertEquals("ADA", run(workflow, Map.of("score", 20, "name", "ada")).getValue().getVariables().get("label"));
        assertEquals("low", run(workflow, Map.of("score", 5, "name", "ada")).getValue().getVariables().get("label"));
    }

    @Test
    void testRagStepQueriesNamedPipeline() throws Exception {
        RetrievalResult retrieved = RetrievalResult.of(
                List.of(new RetrievedDocument("doc-1", "Refunds take 5 days", null)), List.of(0.9));
        when(ragPipeline.query(eq("refund policy"), any(RagQueryOptions.class)))
                .thenReturn(CompletableFuture.completedFuture(retrieved));
        engine.shutdown();
        engine = StandardWorkflowEngine.builder().ragPipeline("docs", ragPipeline).build();
        Workflow workflow = new WorkflowBuilder("lookup")
                .rag("docs", variable("question"), 3, "context")
                .build();

        WorkflowExecution execution = run(workflow, Map.of("question", "refund policy")).getValue();

        assertSame(retrieved, execution.getVariables().get("context"));
        verify(ragPipeline).query("refund policy", new RagQueryOptions(3));
    }

    @Test
    void testMissingToolFailsStep() throws Exception {
        Workflow workflow = new WorkflowBuilder("ghost").tool("ghost", literal(1)).build();

        Result<WorkflowExecution> result = run(workflow, Map.of());

        assertTrue(result.getError() instanceof CapabilityNotFoundException);
        assertEquals("Tool not found: ghost", result.getError().getMessage());
        assertEquals(WorkflowStatus.FAILED, statusOf(workflow));
    }

    @Test
    void testUnconfiguredCapabilitiesFailSteps() throws Exception {
        engine.shutdown();
        engine = StandardWorkflowEngine.builder().build();

        Result<WorkflowExecution> agent = run(new WorkflowBuilder("a").agent("x", literal(1)).build(), Map.of());
        Result<WorkflowExecution> tool = run(new WorkflowBuilder("t").tool("x", literal(1)).build(), Map.of());
        Result<WorkflowExecution> rag = run(new WorkflowBuilder("r").rag("docs", literal("q")).build(), Map.of());
        Result<WorkflowExecution> human = run(new WorkflowBuilder("h").humanApproval("ok?", null).build(), Map.of());

        assertEquals("Agent capability not configured", agent.getError().getMessage());
        assertEquals("Tool capability not configured", tool.getError().getMessage());
        assertEquals("RAG pipeline not found: docs", rag.getError().getMessage());
        assertEquals("Human checkpoint handler not configured", human.getError().getMessage());
    }

    @Test
    void testStrictPolicyRejectsUnboundVariable() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(WeftConfiguration.MISSING_VARIABLE_POLICY, "strict");
        engine.shutdown();
        engine = newEngine(new WeftConfiguration(properties));
        registerRecordingTools("echo");

        Result<WorkflowExecution> result = run(new WorkflowBuilder("strict")
                .tool("echo", variable("missing")).build(), Map.of());

        assertTrue(result.getError() instanceof VariableResolutionException);
        assertEquals("Variable not found: missing", result.getError().getMessage());
        assertTrue(calls.isEmpty());
    }

    @Test
    void testLenientPolicyPassesNullForUnboundVariable() throws Exception {
        List<Object> inputs = new ArrayList<>();
        registerTool("echo", input -> {
            inputs.add(input);
            return CompletableFuture.completedFuture("seen");
        });

        Result<WorkflowExecution> result = run(new WorkflowBuilder("lenient")
                .tool("echo", variable("missing"), "out").build(), Map.of());

        assertTrue(result.isSuccess());
        assertEquals(Arrays.asList((Object) null), inputs);
        assertEquals("seen", result.getValue().getVariables().get("out"));
    }

    @Test
    void testStepTimeoutFailsExecution() throws Exception {
        registerTool("slow", input -> new CompletableFuture<>());
        Workflow workflow = new WorkflowBuilder("slow")
                .tool("slow", literal(1), null, Duration.ofMillis(50))
                .build();

        Result<WorkflowExecution> result = run(workflow, Map.of());

        assertTrue(result.getError() instanceof StepTimeoutException);
        assertEquals("Step 'step-1' timed out after 50ms", result.getError().getMessage());
        assertEquals(WorkflowStatus.FAILED, statusOf(workflow));
    }

    @Test
    void testWorkflowTimeoutAppliesToStepsWithoutOwnTimeout() throws Exception {
        registerTool("slow", input -> new CompletableFuture<>());
        Workflow workflow = new WorkflowBuilder("slow")
                .withTimeout(Duration.ofMillis(40))
                .tool("slow", literal(1))
                .build();

        Result<WorkflowExecution> result = run(workflow, Map.of());

        assertTrue(result.getError() instanceof StepTimeoutException);
    }

    @Test
    void testPauseStopsAtNextStepBoundary() throws Exception {
        CompletableFuture<String> answer = blockOnHuman();
        registerRecordingTools("after");
        Workflow workflow = approvalWorkflow();

        CompletableFuture<Result<WorkflowExecution>> running = engine.execute(workflow, Map.of(), "exec-pause");
        awaitCurrentStep("exec-pause", "step-1");

        assertTrue(engine.pause("exec-pause").isSuccess());
        assertEquals(WorkflowStatus.PAUSED, engine.getStatus("exec-pause").getValue());
        answer.complete("approve");

        Result<WorkflowExecution> result = running.get(5, TimeUnit.SECONDS);
        assertTrue(result.getError() instanceof ExecutionInterruptedException);
        assertEquals(WorkflowStatus.PAUSED, ((ExecutionInterruptedException) result.getError()).getStatus());

        WorkflowExecution execution = engine.getExecution("exec-pause").getValue();
        assertEquals(WorkflowStatus.PAUSED, execution.getStatus());
        assertEquals("approve", execution.getVariables().get("decision"));
        assertEquals(1, execution.getStepHistory().size());
        assertTrue(calls.isEmpty());
        assertTrue(engine.listActive().contains(execution));
    }

    @Test
    void testCancelStopsAtNextStepBoundary() throws Exception {
        CompletableFuture<String> answer = blockOnHuman();
        registerRecordingTools("after");

        CompletableFuture<Result<WorkflowExecution>> running = engine.execute(approvalWorkflow(), Map.of(), "exec-cancel");
        awaitCurrentStep("exec-cancel", "step-1");

        assertTrue(engine.cancel("exec-cancel").isSuccess());
        answer.complete("approve");

        Result<WorkflowExecution> result = running.get(5, TimeUnit.SECONDS);
        assertEquals("Execution cancelled", result.getError().getMessage());
        WorkflowExecution execution = engine.getExecution("exec-cancel").getValue();
        assertEquals(WorkflowStatus.CANCELLED, execution.getStatus());
        assertTrue(execution.getEndTime().isPresent());
        assertTrue(calls.isEmpty());
        assertTrue(engine.listActive().isEmpty());
    }

    @Test
    void testResumeMergesInputAndContinues() throws Exception {
        CompletableFuture<String> answer = blockOnHuman();
        registerRecordingTools("after");

        CompletableFuture<Result<WorkflowExecution>> running =
                engine.execute(approvalWorkflow(), Map.of("x", 1, "y", 5), "exec-resume");
        awaitCurrentStep("exec-resume", "step-1");

        assertTrue(engine.pause("exec-resume").isSuccess());
        Result<WorkflowExecution> resumed = engine.resume("exec-resume", Map.of("x", 2));

        assertTrue(resumed.isSuccess());
        assertEquals(WorkflowStatus.RUNNING, resumed.getValue().getStatus());
        assertEquals(Map.of("x", 2, "y", 5), resumed.getValue().getVariables());

        answer.complete("approve");
        Result<WorkflowExecution> result = running.get(5, TimeUnit.SECONDS);
        assertTrue(result.isSuccess());
        assertEquals(List.of("after"), calls);
        assertEquals(2, result.getValue().getVariables().get("x"));
    }

    @Test
    void testResumeRejectedWhileRunning() throws Exception {
        CompletableFuture<String> answer = blockOnHuman();
        registerRecordingTools("after");

        CompletableFuture<Result<WorkflowExecution>> running = engine.execute(approvalWorkflow(), Map.of("x", 1), "exec-1");
        awaitCurrentStep("exec-1", "step-1");

        Result<WorkflowExecution> resumed = engine.resume("exec-1", Map.of("x", 2));

        assertTrue(resumed.getError() instanceof InvalidTransitionException);
        assertEquals(1, engine.getExecution("exec-1").getValue().getVariables().get("x"));
        answer.complete("approve");
        assertTrue(running.get(5, TimeUnit.SECONDS).isSuccess());
    }

    @Test
    void testPauseAndCancelRejectedOnFinishedExecution() throws Exception {
        registerRecordingTools("only");
        engine.execute(new WorkflowBuilder("done").tool("only", literal(1)).build(), Map.of("k", "v"), "exec-done")
                .get(5, TimeUnit.SECONDS);

        Result<Void> pause = engine.pause("exec-done");
        Result<Void> cancel = engine.cancel("exec-done");

        assertTrue(pause.getError() instanceof InvalidTransitionException);
        assertTrue(cancel.getError() instanceof InvalidTransitionException);
        WorkflowExecution execution = engine.getExecution("exec-done").getValue();
        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus());
        assertEquals(Map.of("k", "v"), execution.getVariables());
    }

    @Test
    void testUnknownExecutionIsReportedAsNotFound() {
        assertTrue(engine.pause("nope").getError() instanceof ExecutionNotFoundException);
        assertTrue(engine.resume("nope").getError() instanceof ExecutionNotFoundException);
        assertTrue(engine.cancel("nope").getError() instanceof ExecutionNotFoundException);
        assertTrue(engine.getExecution("nope").getError() instanceof ExecutionNotFoundException);
        assertTrue(engine.getStatus("nope").getError() instanceof ExecutionNotFoundException);
        assertTrue(engine.clearExecution("nope").getError() instanceof ExecutionNotFoundException);
    }

    @Test
    void testDuplicateExecutionIdRejected() throws Exception {
        registerRecordingTools("only");
        Workflow workflow = new WorkflowBuilder("dup").tool("only", literal(1)).build();
        engine.execute(workflow, Map.of(), "exec-dup").get(5, TimeUnit.SECONDS);

        Result<WorkflowExecution> second = engine.execute(workflow, Map.of(), "exec-dup").get(5, TimeUnit.SECONDS);

        assertTrue(second.isFailure());
        assertEquals(List.of("only"), calls);
    }

    @Test
    void testListingAndClearingExecutions() throws Exception {
        CompletableFuture<String> answer = blockOnHuman();
        registerRecordingTools("after", "only");
        engine.execute(new WorkflowBuilder("quick").tool("only", literal(1)).build(), Map.of(), "exec-quick")
                .get(5, TimeUnit.SECONDS);
        CompletableFuture<Result<WorkflowExecution>> waiting = engine.execute(approvalWorkflow(), Map.of(), "exec-wait");
        awaitCurrentStep("exec-wait", "step-1");

        assertEquals(2, engine.listExecutions(null).size());
        assertEquals(1, engine.listExecutions("quick").size());
        assertEquals(List.of("exec-wait"), engine.listActive().stream()
                .map(WorkflowExecution::getExecutionId).collect(Collectors.toList()));

        Result<Void> clearActive = engine.clearExecution("exec-wait");
        assertEquals("Cannot clear active execution: exec-wait", clearActive.getError().getMessage());

        assertTrue(engine.clearExecution("exec-quick").isSuccess());
        assertTrue(engine.getExecution("exec-quick").isFailure());

        answer.complete("approve");
        waiting.get(5, TimeUnit.SECONDS);
        assertEquals(1, engine.clearCompleted());
        assertTrue(engine.listExecutions(null).isEmpty());
    }

    @Test
    void testShutdownRejectsNewExecutions() throws Exception {
        engine.shutdown();

        Result<WorkflowExecution> result = engine.execute(new WorkflowBuilder("late").build(), Map.of())
                .get(5, TimeUnit.SECONDS);

        assertTrue(engine.isShutdown());
        assertEquals("Workflow engine is shutdown", result.getError().getMessage());
        assertTrue(engine.listExecutions(null).isEmpty());
    }

    @Test
    void testHumanStepReceivesPromptAndOptions() throws Exception {
        when(humanHandler.request(any(), any())).thenReturn(CompletableFuture.completedFuture("reject"));
        registerRecordingTools("after");

        run(approvalWorkflow(), Map.of());

        verify(humanHandler).request("Approve the refund?", List.of("approve", "reject"));
        verify(agentCapability, never()).execute(any());
    }

    private StandardWorkflowEngine newEngine(WeftConfiguration configuration) {
        return StandardWorkflowEngine.builder()
                .agentCapability(agentCapability)
                .toolCapability(tools)
                .humanCheckpointHandler(humanHandler)
                .configuration(configuration)
                .build();
    }

    private Result<WorkflowExecution> run(Workflow workflow, Map<String, Object> input) throws Exception {
        return engine.execute(workflow, input).get(5, TimeUnit.SECONDS);
    }

    private Workflow tieredWorkflow() {
        return new WorkflowBuilder("tiered")
                .condition("${premium}",
                        then -> then.tool("premium", literal("vip")),
                        otherwise -> otherwise.tool("standard", literal("basic")))
                .build();
    }

    private Workflow approvalWorkflow() {
        return new WorkflowBuilder("approval")
                .humanApproval("Approve the refund?", List.of("approve", "reject"), null, "ops", "decision")
                .tool("after", variable("decision"))
                .build();
    }

    private CompletableFuture<String> blockOnHuman() {
        CompletableFuture<String> answer = new CompletableFuture<>();
        when(humanHandler.request(any(), any())).thenReturn(answer);
        return answer;
    }

    private void awaitCurrentStep(String executionId, String stepId) {
        await().atMost(Duration.ofSeconds(5)).until(() -> engine.getExecution(executionId).getValue()
                .getCurrentStep().filter(stepId::equals).isPresent());
    }

    private WorkflowExecution onlyExecution(Workflow workflow) {
        List<WorkflowExecution> executions = engine.listExecutions(workflow.getId());
        assertEquals(1, executions.size());
        return executions.get(0);
    }

    private WorkflowStatus statusOf(Workflow workflow) {
        return onlyExecution(workflow).getStatus();
    }

    private static List<String> stepIds(WorkflowExecution execution) {
        List<String> ids = new ArrayList<>();
        execution.getStepHistory().forEach(record -> ids.add(record.getStepId()));
        return ids;
    }

    private void registerRecordingTools(String... names) {
        for (String name : names) {
            registerTool(name, input -> {
                calls.add(name);
                return CompletableFuture.completedFuture(name + "-done");
            });
        }
    }

    private void registerTool(String name, Function<Object, CompletableFuture<Object>> behaviour) {
        tools.register(new StubTool(name, behaviour));
    }

    private static final class StubTool implements Tool {
        private final String name;
        private final Function<Object, CompletableFuture<Object>> behaviour;

        StubTool(String name, Function<Object, CompletableFuture<Object>> behaviour) {
            this.name = name;
            this.behaviour = behaviour;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public CompletableFuture<Object> execute(Object input) {
            return behaviour.apply(input);
        }
    }
}
