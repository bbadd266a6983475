package dev.onboarding.engine;

import dev.onboarding.model.AggregateError;
import dev.onboarding.model.AnalysisInput;
import dev.onboarding.model.AnalysisResult;
import dev.onboarding.model.ExecutionResult;
import dev.onboarding.model.InsightPayload;
import dev.onboarding.model.TaskOutcome;
import dev.onboarding.model.TaskRole;
import dev.onboarding.model.TraitPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fan-out/fan-in executor for a fixed set of independent analysis tasks.
 *
 * <p>Every task is started concurrently against the same immutable input and the executor waits for
 * all of them, regardless of individual failures. If any task failed, the run fails with every
 * failure message; otherwise the payloads are merged by {@link TaskRole} into one
 * {@link AnalysisResult}. A partial result is never built.
 *
 * <p>The executor keeps no per-run state and may be shared by concurrent callers.
 */
public final class TaskGraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphExecutor.class);

    public static final int DEFAULT_POOL_SIZE = 8;

    private final Executor executor;

    /**
     * @param executor runs the tasks; the caller's MDC is propagated onto its threads
     */
    public TaskGraphExecutor(Executor executor) {
        this.executor = new MdcAwareExecutor(executor);
    }

    /**
     * Create a fixed pool of daemon threads named {@code analysis-task-N}.
     */
    public static ExecutorService newDefaultPool(int size) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "analysis-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run all tasks concurrently and merge their payloads.
     *
     * @param input shared read-only input
     * @param tasks non-empty list of tasks with distinct names and roles
     * @return {@link ExecutionResult.Completed} when every task succeeded, otherwise
     *         {@link ExecutionResult.Failed} carrying every failure message in task order
     * @throws IncompleteResultException if all tasks succeeded but a role needed by the merge has no payload
     */
    public ExecutionResult run(AnalysisInput input, List<? extends AnalysisTask<?>> tasks) {
        checkTaskSet(tasks);

        long start = System.currentTimeMillis();
        log.debug("Dispatching {} tasks for subject {}", tasks.size(), input.subjectId());

        var futures = new ArrayList<CompletableFuture<TaskOutcome<?>>>(tasks.size());
        for (AnalysisTask<?> task : tasks) {
            futures.add(dispatch(task, input));
        }

        // single join point: nothing is decided until every task has finished
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

        var failures = new ArrayList<String>();
        var payloads = new EnumMap<TaskRole, Object>(TaskRole.class);
        for (int i = 0; i < tasks.size(); i++) {
            AnalysisTask<?> task = tasks.get(i);
            TaskOutcome<?> outcome = futures.get(i).join();
            if (outcome instanceof TaskOutcome.Failure<?> failure) {
                failures.add(failure.message());
            } else if (outcome instanceof TaskOutcome.Success<?> success) {
                payloads.put(task.role(), success.payload());
            }
        }

        long elapsed = System.currentTimeMillis() - start;
        if (!failures.isEmpty()) {
            log.info("Run for subject {} failed in {} ms: {}/{} tasks failed",
                input.subjectId(), elapsed, failures.size(), tasks.size());
            return new ExecutionResult.Failed(new AggregateError(failures));
        }

        log.info("Run for subject {} completed in {} ms", input.subjectId(), elapsed);
        return new ExecutionResult.Completed(merge(input, payloads));
    }

    private CompletableFuture<TaskOutcome<?>> dispatch(AnalysisTask<?> task, AnalysisInput input) {
        try {
            return CompletableFuture.supplyAsync(() -> runContained(task, input), executor);
        } catch (RejectedExecutionException e) {
            log.error("Task {} could not be scheduled", task.name(), e);
            return CompletableFuture.completedFuture(
                TaskOutcome.failure(AbstractAnalysisTask.failureMessage(task.name(), e)));
        }
    }

    private static TaskOutcome<?> runContained(AnalysisTask<?> task, AnalysisInput input) {
        try {
            TaskOutcome<?> outcome = task.execute(input);
            if (outcome == null) {
                return TaskOutcome.failure(task.name() + " error: no outcome produced");
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Task {} threw instead of reporting a failure", task.name(), e);
            return TaskOutcome.failure(AbstractAnalysisTask.failureMessage(task.name(), e));
        }
    }

    private static AnalysisResult merge(AnalysisInput input, Map<TaskRole, Object> payloads) {
        InsightPayload insight = payload(payloads, TaskRole.INSIGHT, InsightPayload.class);
        TraitPayload traits = payload(payloads, TaskRole.TRAITS, TraitPayload.class);
        return new AnalysisResult(input.subjectId(), insight, traits.traits());
    }

    private static <T> T payload(Map<TaskRole, Object> payloads, TaskRole role, Class<T> type) {
        Object payload = payloads.get(role);
        if (payload == null) {
            throw new IncompleteResultException("No task produced the " + role + " payload");
        }
        if (!type.isInstance(payload)) {
            throw new IncompleteResultException("%s payload has type %s, expected %s"
                .formatted(role, payload.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(payload);
    }

    private static void checkTaskSet(List<? extends AnalysisTask<?>> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("At least one task is required");
        }
        var names = new HashSet<String>();
        var roles = new HashSet<TaskRole>();
        for (AnalysisTask<?> task : tasks) {
            if (!names.add(task.name())) {
                throw new IllegalArgumentException("Duplicate task name: " + task.name());
            }
            if (!roles.add(task.role())) {
                throw new IllegalArgumentException("Duplicate task role: " + task.role());
            }
        }
    }
}
