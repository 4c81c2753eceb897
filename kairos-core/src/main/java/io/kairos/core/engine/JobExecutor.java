package io.kairos.core.engine;

import io.kairos.core.action.ActionContext;
import io.kairos.core.action.ActionException;
import io.kairos.core.action.ActionHandler;
import io.kairos.core.action.ActionHandlerRegistry;
import io.kairos.core.action.ActionResult;
import io.kairos.core.action.CancellationSignal;
import io.kairos.core.error.NotFoundException;
import io.kairos.core.execution.ExecutionError;
import io.kairos.core.execution.ExecutionPatch;
import io.kairos.core.execution.ExecutionStatus;
import io.kairos.core.execution.ExecutionStore;
import io.kairos.core.execution.JobExecution;
import io.kairos.core.job.Job;
import io.kairos.core.job.JobAction;
import io.kairos.core.job.JobPatch;
import io.kairos.core.job.JobStore;
import io.kairos.core.retry.RetryDecision;
import io.kairos.core.retry.RetryPolicyEvaluator;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs claimed occurrences on a bounded worker pool.
 *
 * <p>Each job has a lane: while one of its executions is RUNNING or RETRYING, later occurrences of
 * the same job are recorded as PENDING and started in arrival order once the lane frees. Handlers
 * run on a separate pool so a worker can stop waiting on a handler that ignores cancellation; the
 * lane stays occupied until such a handler returns, so a retry or the next occurrence never runs
 * beside it.
 */
public final class JobExecutor implements OccurrenceSink, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobExecutor.class);

    private final JobStore jobStore;
    private final ExecutionStore executionStore;
    private final ActionHandlerRegistry handlers;
    private final RetryPolicyEvaluator retryEvaluator;
    private final Clock clock;
    private final Duration defaultTimeout;
    private final Duration cancelGrace;

    private final ExecutorService workers;
    private final ExecutorService handlerPool;
    private final ScheduledExecutorService retryTimer;

    private final Map<String, Deque<Run>> lanes = new HashMap<>();
    private final Map<String, Run> active = new ConcurrentHashMap<>();

    public JobExecutor(
        JobStore jobStore,
        ExecutionStore executionStore,
        ActionHandlerRegistry handlers,
        RetryPolicyEvaluator retryEvaluator,
        Clock clock,
        SchedulerSettings settings
    ) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.executionStore = Objects.requireNonNull(executionStore, "executionStore must not be null");
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.retryEvaluator = Objects.requireNonNull(retryEvaluator, "retryEvaluator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.defaultTimeout = settings.defaultTimeout();
        this.cancelGrace = settings.cancelGrace();
        int poolSize = settings.maxConcurrentExecutions();
        this.workers = new ThreadPoolExecutor(
            poolSize,
            poolSize,
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            named("kairos-worker")
        );
        this.handlerPool = Executors.newCachedThreadPool(named("kairos-handler"));
        this.retryTimer = Executors.newSingleThreadScheduledExecutor(named("kairos-retry"));
    }

    /**
     * Records a PENDING execution for the occurrence and queues it behind any execution of the same
     * job that is still in flight.
     */
    @Override
    public JobExecution submit(Occurrence occurrence) throws IOException {
        Objects.requireNonNull(occurrence, "occurrence must not be null");
        JobExecution execution = JobExecution.pending(
            UUID.randomUUID().toString(),
            occurrence.jobId(),
            occurrence.trigger(),
            occurrence.scheduledFor(),
            clock.instant()
        );
        executionStore.append(execution);
        Run run = new Run(occurrence, execution.id());

        boolean startNow;
        synchronized (lanes) {
            Deque<Run> lane = lanes.get(occurrence.jobId());
            if (lane == null) {
                lanes.put(occurrence.jobId(), new ArrayDeque<>());
                startNow = true;
            } else {
                lane.addLast(run);
                startNow = false;
            }
        }
        if (startNow) {
            start(run);
        } else {
            LOG.debug("Job {} busy; execution {} queued", occurrence.jobId(), execution.id());
        }
        return execution;
    }

    /**
     * Requests cancellation of an execution. Queued and retry-waiting executions are cancelled
     * immediately; a running handler is signalled and given the grace period before the execution
     * is recorded as CANCELLED.
     *
     * @return {@code false} if the execution already reached a terminal state
     */
    public boolean cancel(String executionId) throws IOException {
        Run queued = removeQueued(executionId);
        if (queued != null) {
            executionStore.update(executionId, ExecutionPatch.cancelled("cancelled while pending", clock.instant()));
            markLastRun(queued.occurrence.jobId());
            LOG.info("Cancelled pending execution {} of job {}", executionId, queued.occurrence.jobId());
            return true;
        }

        Run run = active.get(executionId);
        if (run != null) {
            if (run.requestCancel()) {
                LOG.info("Cancelled execution {} of job {} while waiting to retry", executionId, run.occurrence.jobId());
                executionStore.update(executionId, ExecutionPatch.cancelled("cancelled before retry", clock.instant()));
                finish(run);
            } else {
                LOG.info("Cancellation requested for execution {} of job {}", executionId, run.occurrence.jobId());
            }
            return true;
        }

        JobExecution stored = executionStore.get(executionId).orElseThrow(() -> NotFoundException.execution(executionId));
        return !stored.status().isTerminal();
    }

    public int activeCount() {
        return active.size();
    }

    /**
     * Whether this executor still owns the execution, running, waiting to retry, or queued.
     */
    public boolean isTracking(String executionId) {
        if (active.containsKey(executionId)) {
            return true;
        }
        synchronized (lanes) {
            return lanes.values().stream()
                .flatMap(Deque::stream)
                .anyMatch(run -> run.executionId.equals(executionId));
        }
    }

    public int queuedCount() {
        synchronized (lanes) {
            return lanes.values().stream().mapToInt(Deque::size).sum();
        }
    }

    private void start(Run run) {
        CompletableFuture<?> straggler = run.takeStraggler();
        if (straggler != null) {
            LOG.debug("Execution {} of job {} waits for its previous handler call to return", run.executionId, run.occurrence.jobId());
            straggler.whenComplete((ignored, error) -> start(run));
            return;
        }
        active.put(run.executionId, run);
        try {
            workers.execute(() -> attempt(run));
        } catch (RejectedExecutionException e) {
            LOG.warn("Executor is shut down; execution {} of job {} was not started", run.executionId, run.occurrence.jobId());
            active.remove(run.executionId);
            abandonLane(run);
        }
    }

    private void abandonLane(Run run) {
        Deque<Run> queued;
        synchronized (lanes) {
            queued = lanes.remove(run.occurrence.jobId());
        }
        cancelUnstarted(run);
        if (queued != null) {
            for (Run pending : queued) {
                cancelUnstarted(pending);
            }
        }
    }

    private void cancelUnstarted(Run run) {
        try {
            Optional<JobExecution> current = executionStore.get(run.executionId);
            if (current.isPresent() && current.get().status().canTransitionTo(ExecutionStatus.CANCELLED)) {
                executionStore.update(run.executionId, ExecutionPatch.cancelled("scheduler shut down", clock.instant()));
            }
        } catch (IOException | RuntimeException e) {
            LOG.error("Could not record cancellation of execution {}", run.executionId, e);
        }
    }

    private void attempt(Run run) {
        boolean terminal;
        try {
            terminal = runAttempt(run);
        } catch (Exception e) {
            LOG.error("Execution {} of job {} failed unexpectedly", run.executionId, run.occurrence.jobId(), e);
            recordFailure(run, new ExecutionError(ExecutionError.HANDLER_ERROR, describe(e), false));
            terminal = true;
        }
        if (terminal) {
            finish(run);
        }
    }

    /**
     * @return {@code true} if the execution reached a terminal state, {@code false} if a retry was
     *     scheduled
     */
    private boolean runAttempt(Run run) throws IOException {
        String jobId = run.occurrence.jobId();
        if (run.isCancelRequested()) {
            executionStore.update(run.executionId, ExecutionPatch.cancelled("cancelled before start", clock.instant()));
            return true;
        }

        JobExecution execution = executionStore.update(run.executionId, ExecutionPatch.running(clock.instant()));
        Optional<Job> maybeJob = jobStore.get(jobId);
        if (maybeJob.isEmpty()) {
            executionStore.update(run.executionId, ExecutionPatch.failed(
                new ExecutionError(ExecutionError.JOB_NOT_FOUND, "Job " + jobId + " no longer exists", false),
                clock.instant()
            ));
            return true;
        }
        Job job = maybeJob.get();
        JobAction action = job.action();
        Optional<ActionHandler> handler = handlers.find(action.type());
        if (handler.isEmpty()) {
            LOG.warn("No handler registered for {} (job {})", action.type(), jobId);
            executionStore.update(run.executionId, ExecutionPatch.failed(
                new ExecutionError(ExecutionError.HANDLER_NOT_FOUND, "No handler registered for " + action.type(), false),
                clock.instant()
            ));
            return true;
        }

        CancellationSignal signal = run.newSignal();
        ActionContext context = new ActionContext(
            jobId,
            run.executionId,
            job.ownerId(),
            execution.retryCount() + 1,
            action.parameters().deepMerge(run.occurrence.overrides()),
            job.metadata(),
            run.occurrence.scheduledFor(),
            signal
        );
        Duration timeout = action.timeoutSeconds() != null ? Duration.ofSeconds(action.timeoutSeconds()) : defaultTimeout;
        LOG.debug("Running {} for job {} (execution {}, attempt {})", action.type(), jobId, run.executionId, context.attempt());

        Outcome outcome = invoke(run, handler.get(), action, context, timeout, signal);
        if (outcome.cancelled()) {
            executionStore.update(run.executionId, ExecutionPatch.cancelled(signal.reason(), clock.instant()));
            LOG.info("Execution {} of job {} cancelled", run.executionId, jobId);
            return true;
        }
        if (outcome.result() != null) {
            executionStore.update(run.executionId, ExecutionPatch.completed(outcome.result().data(), clock.instant()));
            LOG.info("Execution {} of job {} completed", run.executionId, jobId);
            return true;
        }

        ExecutionError error = outcome.error();
        RetryDecision decision = retryEvaluator.evaluate(action.retryPolicy(), error.retryable(), execution.retryCount());
        if (!decision.retry()) {
            executionStore.update(run.executionId, ExecutionPatch.failed(error, clock.instant()));
            LOG.warn("Execution {} of job {} failed [{}]: {} ({})", run.executionId, jobId, error.code(), error.message(), decision.reason());
            return true;
        }

        executionStore.update(run.executionId, ExecutionPatch.retrying(error, clock.instant()));
        LOG.info("Execution {} of job {} failed [{}], retrying in {} ms", run.executionId, jobId, error.code(), decision.delay().toMillis());
        if (!run.scheduleRetry(() -> start(run), decision.delay())) {
            executionStore.update(run.executionId, ExecutionPatch.cancelled("cancelled before retry", clock.instant()));
            return true;
        }
        return false;
    }

    private Outcome invoke(
        Run run,
        ActionHandler handler,
        JobAction action,
        ActionContext context,
        Duration timeout,
        CancellationSignal signal
    ) {
        CompletableFuture<ActionResult> call = CompletableFuture.supplyAsync(() -> {
            try {
                return handler.execute(action, context);
            } catch (ActionException | IOException e) {
                throw new CompletionException(e);
            }
        }, handlerPool);

        try {
            CompletableFuture.anyOf(call, signal.whenCancelled()).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            signal.cancel("timed out after " + timeout.toSeconds() + "s");
            awaitGrace(run, call, context);
            return Outcome.failed(new ExecutionError(
                ExecutionError.EXECUTION_TIMEOUT,
                "Action did not finish within " + timeout.toSeconds() + "s",
                true
            ));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            signal.cancel("executor shutting down");
            return Outcome.cancelledOutcome();
        } catch (ExecutionException e) {
            // the handler failed; classified below from the call itself
            LOG.trace("Handler for execution {} completed exceptionally", context.executionId());
        }

        if (signal.isCancelled() && !call.isDone()) {
            awaitGrace(run, call, context);
            return Outcome.cancelledOutcome();
        }
        if (signal.isCancelled()) {
            return Outcome.cancelledOutcome();
        }
        return classify(call);
    }

    private void awaitGrace(Run run, CompletableFuture<ActionResult> call, ActionContext context) {
        try {
            call.get(cancelGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Handler for execution {} ignored cancellation for {} ms; holding the lane until it returns", context.executionId(), cancelGrace.toMillis());
            run.holdUntil(call);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | CancellationException e) {
            LOG.debug("Handler for execution {} stopped after cancellation: {}", context.executionId(), e.getMessage());
        }
    }

    private Outcome classify(CompletableFuture<ActionResult> call) {
        try {
            ActionResult result = call.join();
            if (result == null) {
                return Outcome.failed(new ExecutionError(ExecutionError.HANDLER_ERROR, "Handler returned no result", false));
            }
            if (result.success()) {
                return Outcome.succeeded(result);
            }
            String code = result.errorCode() == null ? ExecutionError.HANDLER_ERROR : result.errorCode();
            return Outcome.failed(new ExecutionError(code, result.message(), result.retryable()));
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof ActionException actionException) {
                return Outcome.failed(new ExecutionError(actionException.code(), actionException.getMessage(), actionException.retryable()));
            }
            if (cause instanceof IOException) {
                return Outcome.failed(new ExecutionError(ExecutionError.IO_ERROR, describe(cause), true));
            }
            return Outcome.failed(new ExecutionError(ExecutionError.HANDLER_ERROR, describe(cause), false));
        }
    }

    private void recordFailure(Run run, ExecutionError error) {
        try {
            Optional<JobExecution> current = executionStore.get(run.executionId);
            if (current.isPresent() && current.get().status().canTransitionTo(ExecutionStatus.FAILED)) {
                executionStore.update(run.executionId, ExecutionPatch.failed(error, clock.instant()));
            }
        } catch (IOException | RuntimeException e) {
            LOG.error("Could not record failure of execution {}", run.executionId, e);
        }
    }

    private void finish(Run run) {
        active.remove(run.executionId);
        markLastRun(run.occurrence.jobId());
        CompletableFuture<?> straggler = run.takeStraggler();
        if (straggler != null) {
            straggler.whenComplete((ignored, error) -> releaseLane(run));
        } else {
            releaseLane(run);
        }
    }

    private void releaseLane(Run run) {
        Run next;
        synchronized (lanes) {
            Deque<Run> lane = lanes.get(run.occurrence.jobId());
            next = lane == null ? null : lane.pollFirst();
            if (next == null) {
                lanes.remove(run.occurrence.jobId());
            }
        }
        if (next != null) {
            start(next);
        }
    }

    private void markLastRun(String jobId) {
        try {
            jobStore.update(jobId, JobPatch.lastRun(clock.instant()));
        } catch (NotFoundException e) {
            LOG.warn("Job {} was deleted before its execution finished", jobId);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to record last run of job {}", jobId, e);
        }
    }

    private Run removeQueued(String executionId) {
        synchronized (lanes) {
            for (Deque<Run> lane : lanes.values()) {
                Iterator<Run> iterator = lane.iterator();
                while (iterator.hasNext()) {
                    Run run = iterator.next();
                    if (run.executionId.equals(executionId)) {
                        iterator.remove();
                        return run;
                    }
                }
            }
        }
        return null;
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        retryTimer.shutdownNow();
        workers.shutdownNow();
        handlerPool.shutdownNow();
        try {
            if (!workers.awaitTermination(cancelGrace.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                LOG.warn("Workers did not stop in time; {} executions still active", active.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private final class Run {
        private final Occurrence occurrence;
        private final String executionId;
        private CancellationSignal signal;
        private ScheduledFuture<?> pendingRetry;
        private CompletableFuture<?> straggler;
        private boolean cancelRequested;

        private Run(Occurrence occurrence, String executionId) {
            this.occurrence = occurrence;
            this.executionId = executionId;
        }

        synchronized CancellationSignal newSignal() {
            pendingRetry = null;
            signal = new CancellationSignal();
            if (cancelRequested) {
                signal.cancel("cancel requested");
            }
            return signal;
        }

        synchronized void holdUntil(CompletableFuture<?> call) {
            straggler = call;
        }

        /**
         * @return the handler call that outlived its cancellation, or {@code null} once it has returned
         */
        synchronized CompletableFuture<?> takeStraggler() {
            CompletableFuture<?> pending = straggler;
            straggler = null;
            return pending == null || pending.isDone() ? null : pending;
        }

        synchronized boolean isCancelRequested() {
            return cancelRequested;
        }

        /**
         * @return {@code true} if a pending retry was withdrawn and the caller must finish the run
         */
        synchronized boolean requestCancel() {
            cancelRequested = true;
            if (pendingRetry != null && pendingRetry.cancel(false)) {
                pendingRetry = null;
                return true;
            }
            if (signal != null) {
                signal.cancel("cancel requested");
            }
            return false;
        }

        synchronized boolean scheduleRetry(Runnable task, Duration delay) {
            if (cancelRequested) {
                return false;
            }
            try {
                pendingRetry = retryTimer.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
                return true;
            } catch (RejectedExecutionException e) {
                LOG.warn("Retry timer is shut down; execution {} will not be retried", executionId);
                return false;
            }
        }
    }

    private record Outcome(ActionResult result, ExecutionError error, boolean cancelled) {
        static Outcome succeeded(ActionResult result) {
            return new Outcome(result, null, false);
        }

        static Outcome failed(ExecutionError error) {
            return new Outcome(null, error, false);
        }

        static Outcome cancelledOutcome() {
            return new Outcome(null, null, true);
        }
    }
}
