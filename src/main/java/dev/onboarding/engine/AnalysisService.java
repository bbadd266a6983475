package dev.onboarding.engine;

import dev.onboarding.backend.TextBackend;
import dev.onboarding.model.AnalysisInput;
import dev.onboarding.model.AnalysisResult;
import dev.onboarding.model.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Entry point for analyzing one onboarding answer: validates the request, runs the insight and
 * trait tasks in parallel, and validates the merged result.
 */
public final class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    static final String MDC_SUBJECT = "subjectId";

    private final TaskGraphExecutor executor;
    private final List<AnalysisTask<?>> tasks;

    public AnalysisService(TaskGraphExecutor executor, List<AnalysisTask<?>> tasks) {
        this.executor = executor;
        this.tasks = List.copyOf(tasks);
    }

    /**
     * Build the standard insight + trait task set over one backend.
     */
    public static AnalysisService create(TextBackend backend, Executor taskExecutor) {
        return new AnalysisService(
            new TaskGraphExecutor(taskExecutor),
            List.of(new InsightTask(backend), new TraitTask(backend)));
    }

    /**
     * Analyze a question/answer pair.
     *
     * @throws IllegalArgumentException if any input field is missing or blank
     * @throws AnalysisException        if any task failed or the merged result is out of bounds
     */
    public AnalysisResult analyze(String subjectId, String promptText, String responseText)
            throws AnalysisException {
        var input = new AnalysisInput(subjectId, promptText, responseText);
        List<String> inputErrors = AnalysisValidator.validateInput(input);
        if (!inputErrors.isEmpty()) {
            throw new IllegalArgumentException("Invalid input: " + String.join("; ", inputErrors));
        }

        MDC.put(MDC_SUBJECT, subjectId);
        try {
            ExecutionResult outcome = executor.run(input, tasks);
            if (outcome instanceof ExecutionResult.Failed failed) {
                log.warn("Analysis failed: {}", failed.error().messages());
                throw new AnalysisException(failed.error());
            }

            AnalysisResult result = ((ExecutionResult.Completed) outcome).result();
            List<String> outputErrors = AnalysisValidator.validateResult(result);
            if (!outputErrors.isEmpty()) {
                log.warn("Analysis produced an invalid result: {}", outputErrors);
                throw new AnalysisException("Invalid analysis output: " + String.join("; ", outputErrors),
                    outputErrors);
            }
            return result;
        } finally {
            MDC.remove(MDC_SUBJECT);
        }
    }

    public List<AnalysisTask<?>> tasks() {
        return tasks;
    }
}
