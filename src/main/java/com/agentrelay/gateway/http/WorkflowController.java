package com.agentrelay.gateway.http;

import com.agentrelay.shared.config.RelayConfig;
import com.agentrelay.workflow.FallbackResult;
import com.agentrelay.workflow.WorkflowOrchestrator;
import com.agentrelay.workflow.WorkflowResult;
import com.agentrelay.workflow.WorkflowSpec;
import com.agentrelay.workflow.WorkflowStep;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

@RestController
public class WorkflowController {

    private final WorkflowOrchestrator orchestrator;
    private final Duration defaultTimeout;

    public WorkflowController(WorkflowOrchestrator orchestrator, RelayConfig config) {
        this.orchestrator = orchestrator;
        this.defaultTimeout = config.workflowTimeout();
    }

    /**
     * Body: {@code {"mode": "sequential"|"parallel", "timeout_seconds": n,
     * "steps": [{"agent", "task", "depends_on": [i, ...]}]}}.
     */
    @PostMapping("/v1/workflows")
    public WorkflowResult run(@RequestBody Map<String, Object> body) {
        var steps = parseSteps(body.get("steps"));
        var timeout = timeout(body);
        var mode = String.valueOf(body.getOrDefault("mode", "sequential"));
        return switch (mode) {
            case "sequential" -> orchestrator.executeSequential(WorkflowSpec.of(steps), timeout);
            case "parallel" -> orchestrator.executeParallel(steps, timeout);
            default -> throw new IllegalArgumentException("unknown workflow mode: " + mode);
        };
    }

    @PostMapping("/v1/workflows/fallback")
    public FallbackResult fallback(@RequestBody Map<String, Object> body) {
        var task = body.get("task");
        if (!(task instanceof String t) || t.isBlank()) {
            throw new IllegalArgumentException("'task' is required");
        }
        if (!(body.get("candidates") instanceof List<?> raw)) {
            throw new IllegalArgumentException("'candidates' must be a list of agent names");
        }
        var candidates = raw.stream().map(String::valueOf).toList();
        return orchestrator.executeWithFallback(t, candidates, timeout(body));
    }

    @GetMapping("/v1/workflows/active")
    public List<WorkflowResult> active() {
        return orchestrator.activeWorkflows();
    }

    @GetMapping("/v1/workflows/{id}")
    public ResponseEntity<WorkflowResult> status(@PathVariable String id) {
        return orchestrator.status(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private Duration timeout(Map<String, Object> body) {
        var raw = body.get("timeout_seconds");
        if (raw == null) return defaultTimeout;
        if (!(raw instanceof Number n) || n.doubleValue() <= 0) {
            throw new IllegalArgumentException("'timeout_seconds' must be a positive number");
        }
        return Duration.ofMillis((long) (n.doubleValue() * 1000));
    }

    static List<WorkflowStep> parseSteps(Object raw) {
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            throw new IllegalArgumentException("'steps' must be a non-empty list");
        }
        var steps = new ArrayList<WorkflowStep>();
        for (var item : list) {
            if (!(item instanceof Map<?, ?> m)) {
                throw new IllegalArgumentException("each step must be an object");
            }
            var deps = new LinkedHashSet<Integer>();
            if (m.get("depends_on") instanceof List<?> d) {
                for (var dep : d) {
                    if (!(dep instanceof Number n)) {
                        throw new IllegalArgumentException("depends_on entries must be step indices");
                    }
                    deps.add(n.intValue());
                }
            }
            steps.add(new WorkflowStep(
                    m.get("agent") != null ? String.valueOf(m.get("agent")) : null,
                    m.get("task") != null ? String.valueOf(m.get("task")) : null,
                    deps));
        }
        return steps;
    }
}
