package dev.onboarding.engine;

import dev.onboarding.backend.BackendException;
import dev.onboarding.backend.TextBackend;
import dev.onboarding.model.AnalysisResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class AnalysisServiceTest {

    private static final String INSIGHT_REPLY =
        "{\"summary\":\"Wants commitment\",\"keywords\":[\"serious\",\"relationship\"]}";

    private static final String TRAIT_REPLY = """
        {"traits":[{"name":"relationship_goal_readiness","score":0.9,"reason":"States a clear goal"},\
        {"name":"openness_to_commitment","score":0.8,"reason":"Uses the word serious"}]}""";

    private final ExecutorService pool = TaskGraphExecutor.newDefaultPool(2);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private AnalysisService serviceReplying(String insightReply, String traitReply) {
        TextBackend backend = (system, user, maxTokens) ->
            system.contains("InsightAgent") ? insightReply : traitReply;
        return AnalysisService.create(backend, pool);
    }

    @Test
    void analyzesTheReferenceScenario() throws Exception {
        AnalysisResult result = serviceReplying(INSIGHT_REPLY, TRAIT_REPLY)
            .analyze("u1", "What are you looking for?", "I want a serious relationship.");

        assertThat(result.subjectId()).isEqualTo("u1");
        assertThat(result.insight().summary()).isEqualTo("Wants commitment");
        assertThat(result.insight().keywords()).containsExactly("serious", "relationship");
        assertThat(result.traits()).hasSize(2);
        assertThat(result.traits().get(0).name()).isEqualTo("relationship_goal_readiness");
        assertThat(result.traits().get(1).score()).isEqualTo(0.8);
    }

    @Test
    void createBuildsInsightAndTraitTasks() {
        var service = serviceReplying(INSIGHT_REPLY, TRAIT_REPLY);

        assertThat(service.tasks()).extracting(AnalysisTask::name).containsExactly("InsightAgent", "TraitAgent");
    }

    @Test
    void rejectsBlankInputBeforeCallingTheBackend() {
        TextBackend mustNotBeCalled = (system, user, maxTokens) -> {
            throw new AssertionError("backend should not be called");
        };
        var service = AnalysisService.create(mustNotBeCalled, pool);

        assertThatThrownBy(() -> service.analyze("", "Q?", " "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'user_id'")
            .hasMessageContaining("'answer'")
            .hasMessageNotContaining("'question'");
    }

    @Test
    void wrapsAllTaskFailures() {
        TextBackend failing = (system, user, maxTokens) -> {
            throw new BackendException("timeout");
        };
        var service = AnalysisService.create(failing, pool);

        AnalysisException error = catchThrowableOfType(AnalysisException.class,
            () -> service.analyze("u1", "Q?", "A."));

        assertThat(error.errors()).containsExactly("InsightAgent error: timeout", "TraitAgent error: timeout");
        assertThat(error.getMessage()).startsWith("Agent errors:");
    }

    @Test
    void rejectsUnderProducedKeywordsDownstream() {
        var service = serviceReplying("{\"summary\":\"s\",\"keywords\":[\"one\"]}", TRAIT_REPLY);

        AnalysisException error = catchThrowableOfType(AnalysisException.class,
            () -> service.analyze("u1", "Q?", "A."));

        assertThat(error.getMessage()).startsWith("Invalid analysis output");
        assertThat(error.errors()).singleElement().asString().contains("insight.keywords");
    }
}
