package dev.onboarding.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.onboarding.backend.BackendException;
import dev.onboarding.backend.TextBackend;
import dev.onboarding.model.AnalysisInput;
import dev.onboarding.model.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Skeleton shared by backend-driven tasks: build the prompt, call the backend, parse the reply.
 * Backend failures, unparseable replies and unchecked errors all become a {@link TaskOutcome.Failure}
 * prefixed with the task name.
 */
public abstract class AbstractAnalysisTask<P> implements AnalysisTask<P> {

    static final String MDC_TASK = "task";

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final TextBackend backend;

    protected AbstractAnalysisTask(TextBackend backend) {
        this.backend = backend;
    }

    /** Instruction describing the task and the exact JSON reply format. */
    protected abstract String systemInstruction();

    /** Last paragraph of the user message. */
    protected abstract String closingInstruction();

    protected abstract int maxTokens();

    /** Convert the parsed reply object into this task's payload. */
    protected abstract P parsePayload(JsonNode reply) throws ReplyShapeException;

    @Override
    public final TaskOutcome<P> execute(AnalysisInput input) {
        MDC.put(MDC_TASK, name());
        try {
            String userContent = PromptBuilder.buildUserContent(input, closingInstruction());
            log.debug("Invoking backend {}", backend.getName());
            String reply = backend.invoke(systemInstruction(), userContent, maxTokens());
            P payload = parsePayload(ReplyParser.parseObject(reply));
            log.debug("{} produced {}", name(), payload);
            return TaskOutcome.success(payload);
        } catch (BackendException | ReplyShapeException e) {
            log.warn("{} failed: {}", name(), e.getMessage());
            return TaskOutcome.failure(failureMessage(name(), e));
        } catch (RuntimeException e) {
            log.warn("{} failed unexpectedly", name(), e);
            return TaskOutcome.failure(failureMessage(name(), e));
        } finally {
            MDC.remove(MDC_TASK);
        }
    }

    static String failureMessage(String taskName, Throwable error) {
        String detail = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return taskName + " error: " + detail;
    }
}
