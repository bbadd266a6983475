package dev.onboarding.engine;

import dev.onboarding.model.AnalysisInput;
import dev.onboarding.model.TaskOutcome;
import dev.onboarding.model.TaskRole;

/**
 * An independently schedulable unit of analysis over a shared, read-only input.
 *
 * @param <P> payload type carried by a successful outcome
 */
public interface AnalysisTask<P> {

    /** Display name, also used as the prefix of failure messages. */
    String name();

    /** The result slot this task's payload is merged into. */
    TaskRole role();

    /**
     * Run the task. Implementations report every failure as a {@link TaskOutcome.Failure}
     * and do not throw.
     */
    TaskOutcome<P> execute(AnalysisInput input);
}
