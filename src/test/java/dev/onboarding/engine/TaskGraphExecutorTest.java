package dev.onboarding.engine;

import dev.onboarding.backend.BackendException;
import dev.onboarding.backend.TextBackend;
import dev.onboarding.model.AnalysisInput;
import dev.onboarding.model.AnalysisResult;
import dev.onboarding.model.ExecutionResult;
import dev.onboarding.model.InsightPayload;
import dev.onboarding.model.TaskOutcome;
import dev.onboarding.model.TaskRole;
import dev.onboarding.model.Trait;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class TaskGraphExecutorTest {

    private static final AnalysisInput INPUT =
        new AnalysisInput("u1", "What are you looking for?", "I want a serious relationship.");

    private static final String INSIGHT_REPLY =
        "{\"summary\":\"Wants commitment\",\"keywords\":[\"serious\",\"relationship\"]}";

    private static final String TRAIT_REPLY = """
        {"traits":[{"name":"relationship_goal_readiness","score":0.9,"reason":"States a clear goal"},\
        {"name":"openness_to_commitment","score":0.8,"reason":"Uses the word serious"}]}""";

    private ExecutorService pool;
    private TaskGraphExecutor executor;

    @BeforeEach
    void setUp() {
        pool = TaskGraphExecutor.newDefaultPool(4);
        executor = new TaskGraphExecutor(pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        MDC.clear();
    }

    /** Routes each task to its own reply by looking at the system instruction. */
    private static TextBackend routing(String insightReply, String traitReply) {
        return (system, user, maxTokens) -> system.contains("InsightAgent") ? insightReply : traitReply;
    }

    private static List<AnalysisTask<?>> standardTasks(TextBackend backend) {
        return List.of(new InsightTask(backend), new TraitTask(backend));
    }

    @Test
    void mergesBothPayloadsOnSuccess() {
        var result = executor.run(INPUT, standardTasks(routing(INSIGHT_REPLY, TRAIT_REPLY)));

        assertThat(result).isInstanceOf(ExecutionResult.Completed.class);
        AnalysisResult merged = ((ExecutionResult.Completed) result).result();
        assertThat(merged.subjectId()).isEqualTo("u1");
        assertThat(merged.insight()).isEqualTo(new InsightPayload("Wants commitment", List.of("serious", "relationship")));
        assertThat(merged.traits()).containsExactly(
            new Trait("relationship_goal_readiness", 0.9, "States a clear goal"),
            new Trait("openness_to_commitment", 0.8, "Uses the word serious"));
    }

    @Test
    void echoesSubjectIdVerbatim() {
        var input = new AnalysisInput("  User-ÄB 7 ", "Q?", "A.");

        var result = executor.run(input, standardTasks(routing(INSIGHT_REPLY, TRAIT_REPLY)));

        assertThat(((ExecutionResult.Completed) result).result().subjectId()).isEqualTo("  User-ÄB 7 ");
    }

    @Test
    void singleFailureFailsTheRun() {
        TextBackend backend = (system, user, maxTokens) -> {
            if (system.contains("TraitAgent")) {
                throw new BackendException("connection reset");
            }
            return INSIGHT_REPLY;
        };

        var result = executor.run(INPUT, standardTasks(backend));

        assertThat(result).isInstanceOf(ExecutionResult.Failed.class);
        assertThat(((ExecutionResult.Failed) result).error().messages())
            .containsExactly("TraitAgent error: connection reset");
    }

    @Test
    void alwaysFailingBackendReportsBothFailuresWithoutHanging() {
        TextBackend failing = (system, user, maxTokens) -> {
            throw new BackendException("service unavailable");
        };

        var result = assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> executor.run(INPUT, standardTasks(failing)));

        assertThat(result).isInstanceOf(ExecutionResult.Failed.class);
        assertThat(((ExecutionResult.Failed) result).error().messages()).containsExactly(
            "InsightAgent error: service unavailable",
            "TraitAgent error: service unavailable");
    }

    @Test
    void unparseableReplyDiscardsTheOtherTasksValidOutput() {
        var result = executor.run(INPUT, standardTasks(routing(INSIGHT_REPLY, "not json at all")));

        assertThat(result).isInstanceOf(ExecutionResult.Failed.class);
        List<String> messages = ((ExecutionResult.Failed) result).error().messages();
        assertThat(messages).hasSize(1);
        assertThat(messages.get(0)).startsWith("TraitAgent error:");
    }

    @Test
    void waitsForSlowSiblingAfterFastFailure() {
        var slowFinished = new CountDownLatch(1);
        AnalysisTask<Object> fastFailure = new FixedTask("Fast", TaskRole.INSIGHT,
            () -> TaskOutcome.failure("Fast error: boom"));
        AnalysisTask<Object> slowFailure = new FixedTask("Slow", TaskRole.TRAITS, () -> {
            sleep(200);
            slowFinished.countDown();
            return TaskOutcome.failure("Slow error: late");
        });

        var result = executor.run(INPUT, List.of(fastFailure, slowFailure));

        assertThat(slowFinished.getCount()).isZero();
        assertThat(((ExecutionResult.Failed) result).error().messages())
            .containsExactly("Fast error: boom", "Slow error: late");
    }

    @Test
    void runsTasksConcurrently() {
        // each backend call blocks until both have started; a sequential executor would deadlock
        var bothStarted = new CountDownLatch(2);
        TextBackend rendezvous = (system, user, maxTokens) -> {
            bothStarted.countDown();
            try {
                if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                    throw new BackendException("sibling never started");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackendException("interrupted");
            }
            return system.contains("InsightAgent") ? INSIGHT_REPLY : TRAIT_REPLY;
        };

        var result = assertTimeoutPreemptively(Duration.ofSeconds(10),
            () -> executor.run(INPUT, standardTasks(rendezvous)));

        assertThat(result).isInstanceOf(ExecutionResult.Completed.class);
    }

    @Test
    void containsTasksThatThrow() {
        AnalysisTask<Object> throwing = new FixedTask("Broken", TaskRole.TRAITS, () -> {
            throw new IllegalStateException("bug in task");
        });
        var tasks = List.<AnalysisTask<?>>of(new InsightTask(routing(INSIGHT_REPLY, TRAIT_REPLY)), throwing);

        var result = executor.run(INPUT, tasks);

        assertThat(((ExecutionResult.Failed) result).error().messages())
            .containsExactly("Broken error: bug in task");
    }

    @Test
    void missingRoleIsAnIncompleteResult() {
        var insightOnly = List.<AnalysisTask<?>>of(new InsightTask(routing(INSIGHT_REPLY, TRAIT_REPLY)));

        assertThatThrownBy(() -> executor.run(INPUT, insightOnly))
            .isInstanceOf(IncompleteResultException.class)
            .hasMessageContaining("TRAITS");
    }

    @Test
    void mistypedPayloadIsAnIncompleteResult() {
        var tasks = List.<AnalysisTask<?>>of(
            new InsightTask(routing(INSIGHT_REPLY, TRAIT_REPLY)),
            new FixedTask("Wrong", TaskRole.TRAITS, () -> TaskOutcome.success("not traits")));

        assertThatThrownBy(() -> executor.run(INPUT, tasks))
            .isInstanceOf(IncompleteResultException.class)
            .hasMessageContaining("expected TraitPayload");
    }

    @Test
    void rejectsEmptyTaskSet() {
        assertThatThrownBy(() -> executor.run(INPUT, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsDuplicateRoles() {
        TextBackend backend = routing(INSIGHT_REPLY, TRAIT_REPLY);
        var tasks = List.<AnalysisTask<?>>of(new InsightTask(backend),
            new FixedTask("Other", TaskRole.INSIGHT, () -> TaskOutcome.success("x")));

        assertThatThrownBy(() -> executor.run(INPUT, tasks))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate task role");
    }

    @Test
    void propagatesCallerMdcToTaskThreads() {
        var seen = new ConcurrentHashMap<String, String>();
        TextBackend recording = (system, user, maxTokens) -> {
            String subject = MDC.get("subjectId");
            String task = MDC.get("task");
            seen.put(task, subject == null ? "<none>" : subject);
            return system.contains("InsightAgent") ? INSIGHT_REPLY : TRAIT_REPLY;
        };

        MDC.put("subjectId", "u1");
        executor.run(INPUT, standardTasks(recording));

        assertThat(seen).isEqualTo(Map.of("InsightAgent", "u1", "TraitAgent", "u1"));
    }

    @Test
    void isReusableAcrossRuns() {
        var tasks = standardTasks(routing(INSIGHT_REPLY, TRAIT_REPLY));

        var first = executor.run(INPUT, tasks);
        var second = executor.run(new AnalysisInput("u2", "Q?", "A."), tasks);

        assertThat(((ExecutionResult.Completed) first).result().subjectId()).isEqualTo("u1");
        assertThat(((ExecutionResult.Completed) second).result().subjectId()).isEqualTo("u2");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record FixedTask(String name, TaskRole role, Supplier<TaskOutcome<Object>> body)
            implements AnalysisTask<Object> {

        @Override
        public TaskOutcome<Object> execute(AnalysisInput input) {
            return body.get();
        }
    }
}
