package com.agentrelay.workflow;

import com.agentrelay.delegation.AgentDispatcher;
import com.agentrelay.observability.RelayMetrics;
import com.agentrelay.registry.AgentNotFoundException;
import com.agentrelay.registry.AgentRegistry;
import com.agentrelay.shared.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs multi-agent workflows. Step failures are reported in the result, never
 * thrown; only invalid specs and an exhausted fallback chain raise.
 */
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final AgentRegistry registry;
    private final AgentDispatcher dispatcher;
    private final RelayMetrics metrics;
    private final Map<String, WorkflowRun> active = new ConcurrentHashMap<>();

    public WorkflowOrchestrator(AgentRegistry registry, AgentDispatcher dispatcher, RelayMetrics metrics) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    public WorkflowResult executeSequential(WorkflowSpec spec, Duration timeout) {
        return executeSequential(spec, timeout, newWorkflowId());
    }

    /**
     * Runs steps once their dependencies are terminal. Independent branches run
     * concurrently; root steps are started in declaration order.
     */
    public WorkflowResult executeSequential(WorkflowSpec spec, Duration timeout, String workflowId) {
        var run = new WorkflowRun(workflowId, "sequential", spec.steps());
        active.put(workflowId, run);
        log.info("Workflow {} started: {} steps, timeout {}", workflowId, spec.size(), timeout);
        try {
            @SuppressWarnings("unchecked")
            CompletableFuture<Void>[] done = new CompletableFuture[spec.size()];
            for (int index : spec.executionOrder()) {
                var deps = spec.steps().get(index).dependsOn().stream()
                        .map(d -> done[d])
                        .toArray(CompletableFuture<?>[]::new);
                var gate = deps.length == 0
                        ? CompletableFuture.<Void>completedFuture(null)
                        : CompletableFuture.allOf(deps);
                done[index] = gate.thenCompose(v -> runWhenReady(run, index));
            }
            await(run, done, timeout);
            return finish(run, sequentialStatus(run.snapshotSteps(), spec.executionOrder()));
        } finally {
            active.remove(workflowId);
        }
    }

    public WorkflowResult executeParallel(List<WorkflowStep> steps, Duration timeout) {
        return executeParallel(steps, timeout, newWorkflowId());
    }

    /**
     * Dispatches every step at once and waits for all of them. One failure never
     * cancels its siblings.
     */
    public WorkflowResult executeParallel(List<WorkflowStep> steps, Duration timeout, String workflowId) {
        if (steps == null || steps.isEmpty()) {
            throw new WorkflowValidationException("workflow has no steps");
        }
        for (int i = 0; i < steps.size(); i++) {
            if (!steps.get(i).dependsOn().isEmpty()) {
                throw new WorkflowValidationException("parallel step " + i + " must not declare dependencies");
            }
        }
        var run = new WorkflowRun(workflowId, "parallel", List.copyOf(steps));
        active.put(workflowId, run);
        log.info("Parallel workflow {} started: {} steps, timeout {}", workflowId, steps.size(), timeout);
        try {
            @SuppressWarnings("unchecked")
            CompletableFuture<Void>[] done = new CompletableFuture[steps.size()];
            for (int i = 0; i < steps.size(); i++) {
                done[i] = runStep(run, i);
            }
            await(run, done, timeout);
            return finish(run, parallelStatus(run.snapshotSteps()));
        } finally {
            active.remove(workflowId);
        }
    }

    /**
     * Tries each candidate in order until one answers. Any delegation failure,
     * including an unresolvable candidate, moves on to the next one.
     *
     * @throws FallbackExhaustedException when every candidate failed or the timeout ran out
     */
    public FallbackResult executeWithFallback(String task, List<String> candidates, Duration timeout) {
        if (candidates == null || candidates.isEmpty()) {
            throw new WorkflowValidationException("fallback needs at least one candidate agent");
        }
        var correlationId = newWorkflowId();
        long deadline = System.nanoTime() + timeout.toNanos();
        var failures = new ArrayList<FallbackAttempt>();

        for (var candidate : candidates) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                failures.add(new FallbackAttempt(candidate, "TimeoutException", "fallback deadline reached"));
                continue;
            }
            var agent = registry.resolve(candidate);
            if (agent.isEmpty()) {
                var e = new AgentNotFoundException(candidate);
                log.warn("[{}] Fallback candidate '{}' not registered, trying next", correlationId, candidate);
                failures.add(new FallbackAttempt(candidate, e.getClass().getSimpleName(), e.getMessage()));
                continue;
            }
            var name = agent.get().name();
            try {
                var text = dispatcher.dispatch(agent.get(), task, correlationId)
                        .get(remaining, TimeUnit.NANOSECONDS);
                if (!failures.isEmpty()) {
                    log.info("[{}] Recovered via '{}' after {} failed attempts", correlationId, name, failures.size());
                }
                return new FallbackResult(name, text, List.copyOf(failures));
            } catch (ExecutionException e) {
                var cause = Futures.unwrap(e);
                log.warn("[{}] Fallback agent '{}' failed: {}, trying next", correlationId, name, cause.getMessage());
                failures.add(new FallbackAttempt(name, cause.getClass().getSimpleName(), String.valueOf(cause.getMessage())));
            } catch (TimeoutException e) {
                log.warn("[{}] Fallback agent '{}' did not answer before the deadline", correlationId, name);
                failures.add(new FallbackAttempt(name, "TimeoutException", "fallback deadline reached"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.add(new FallbackAttempt(name, "InterruptedException", "interrupted"));
                break;
            }
        }
        throw new FallbackExhaustedException(failures);
    }

    /** Live view of a running workflow, empty once it has finished. */
    public Optional<WorkflowResult> status(String workflowId) {
        return Optional.ofNullable(active.get(workflowId)).map(run -> run.snapshot(WorkflowStatus.RUNNING));
    }

    public List<WorkflowResult> activeWorkflows() {
        return active.values().stream().map(run -> run.snapshot(WorkflowStatus.RUNNING)).toList();
    }

    private CompletableFuture<Void> runWhenReady(WorkflowRun run, int index) {
        if (run.cancelled()) {
            run.settle(index, StepStatus.CANCELLED, "not started before workflow deadline");
            return CompletableFuture.completedFuture(null);
        }
        for (int dep : run.step(index).dependsOn()) {
            var depStatus = run.status(dep);
            if (depStatus == StepStatus.CANCELLED) {
                run.settle(index, StepStatus.CANCELLED, "dependency " + dep + " was cancelled");
                return CompletableFuture.completedFuture(null);
            }
            if (depStatus != StepStatus.COMPLETED) {
                run.settle(index, StepStatus.SKIPPED, "dependency " + dep + " " + depStatus.name().toLowerCase());
                return CompletableFuture.completedFuture(null);
            }
        }
        return runStep(run, index);
    }

    // Never completes exceptionally: every outcome is written into the run.
    private CompletableFuture<Void> runStep(WorkflowRun run, int index) {
        var step = run.step(index);
        var agent = registry.resolve(step.agent());
        if (agent.isEmpty()) {
            run.fail(index, new AgentNotFoundException(step.agent()));
            return CompletableFuture.completedFuture(null);
        }
        if (!run.start(index, agent.get().name())) {
            return CompletableFuture.completedFuture(null);
        }
        var correlationId = run.workflowId() + "-" + index;
        CompletableFuture<String> call;
        try {
            call = dispatcher.dispatch(agent.get(), step.task(), correlationId);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call.handle((text, err) -> {
            if (err == null) {
                run.complete(index, text);
            } else {
                run.fail(index, Futures.unwrap(err));
            }
            return null;
        });
    }

    private void await(WorkflowRun run, CompletableFuture<?>[] done, Duration timeout) {
        try {
            CompletableFuture.allOf(done).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Workflow {} hit its {} deadline, cancelling unfinished steps", run.workflowId(), timeout);
            run.cancel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancel();
        } catch (ExecutionException e) {
            log.error("Workflow {} step bookkeeping failed", run.workflowId(), Futures.unwrap(e));
            run.cancel();
        }
    }

    private WorkflowResult finish(WorkflowRun run, WorkflowStatus status) {
        var result = run.snapshot(status);
        metrics.workflowDuration(run.mode(), status.name()).record(result.durationMillis(), TimeUnit.MILLISECONDS);
        log.info("Workflow {} finished {} in {}ms", run.workflowId(), status, result.durationMillis());
        return result;
    }

    static WorkflowStatus sequentialStatus(List<StepResult> steps, List<Integer> executionOrder) {
        if (steps.stream().allMatch(s -> s.status() == StepStatus.COMPLETED)) {
            return WorkflowStatus.COMPLETED;
        }
        var firstRan = executionOrder.stream()
                .map(steps::get)
                .filter(s -> s.status() == StepStatus.COMPLETED || s.status() == StepStatus.FAILED)
                .findFirst();
        if (firstRan.isEmpty()) {
            boolean anyCancelled = steps.stream().anyMatch(s -> s.status() == StepStatus.CANCELLED);
            return anyCancelled ? WorkflowStatus.CANCELLED : WorkflowStatus.FAILED;
        }
        if (firstRan.get().status() == StepStatus.FAILED) {
            return WorkflowStatus.FAILED;
        }
        return WorkflowStatus.PARTIAL;
    }

    static WorkflowStatus parallelStatus(List<StepResult> steps) {
        long completed = steps.stream().filter(s -> s.status() == StepStatus.COMPLETED).count();
        if (completed == steps.size()) return WorkflowStatus.COMPLETED;
        if (completed > 0) return WorkflowStatus.PARTIAL;
        boolean allCancelled = steps.stream().allMatch(s -> s.status() == StepStatus.CANCELLED);
        return allCancelled ? WorkflowStatus.CANCELLED : WorkflowStatus.FAILED;
    }

    private static String newWorkflowId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
