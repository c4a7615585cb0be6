package stableui.contract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.config.EngineConfig;
import stableui.controller.ActionOutcome;
import stableui.controller.ActionRequest;
import stableui.controller.DecisionController;
import stableui.gate.GateDecision;
import stableui.model.ActionPlan;
import stableui.model.ActionStep;
import stableui.model.AnchorSpec;
import stableui.model.BoundingBox;
import stableui.model.ExecutionResult;
import stableui.model.FailureKind;
import stableui.model.InteractiveElement;
import stableui.model.Operation;
import stableui.model.ScreenElement;
import stableui.model.ScreenState;
import stableui.model.TargetSpec;
import stableui.util.Deadline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs declarative plans against open surfaces and answers "what is on screen".
 *
 * <p>Per step of a plan:
 * <ol>
 *   <li>abort conditions are checked; a match halts the plan</li>
 *   <li>every {@code verify_before} condition must hold, otherwise the step fails
 *       without acting</li>
 *   <li>the operation runs through the surface's {@link DecisionController}, the
 *       state is refreshed, abort conditions are checked again, and every
 *       {@code verify_after} condition must hold</li>
 *   <li>a failed attempt is retried, with backoff, until the step's budget
 *       (capped by the {@link RetryPolicy}) is spent</li>
 * </ol>
 * A step's terminal failure ends the plan. Failures come back as an
 * {@link ExecutionResult}; only a malformed plan raises, and it does so before the
 * first step.
 *
 * <p>Screen-change conditions compare against the structural hash taken before
 * the most recent attempt, or at plan start when nothing has run yet.
 */
public class ContractEngine {

    private static final Logger log = LoggerFactory.getLogger(ContractEngine.class);

    private final SurfaceRegistry registry;
    private final EngineConfig config;
    private final RetryPolicy retryPolicy;

    public ContractEngine(SurfaceRegistry registry, EngineConfig config, RetryPolicy retryPolicy) {
        this.registry    = Objects.requireNonNull(registry, "registry");
        this.config      = Objects.requireNonNull(config, "config");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    public ContractEngine(SurfaceRegistry registry, EngineConfig config) {
        this(registry, config, RetryPolicy.fromConfig(config));
    }

    // ── Analysis ──────────────────────────────────────────────────────────

    /**
     * Analyses a surface for the given anchors and targets. When the change gate
     * reports the surface unchanged and the same anchors and targets were analysed
     * last time, the cached state is returned without touching the markup.
     *
     * @throws IllegalArgumentException if the surface is not open or a name repeats
     */
    public ScreenState analyzeState(String surfaceId, List<AnchorSpec> anchors, List<TargetSpec> targets) {
        SurfaceSession session = registry.require(surfaceId);
        ScreenState.requireDistinctNames(anchors, targets);
        synchronized (session.runLock()) {
            return analyze(session, List.copyOf(anchors), List.copyOf(targets), Deadline.none());
        }
    }

    private ScreenState analyze(SurfaceSession session, List<AnchorSpec> anchors, List<TargetSpec> targets,
                                Deadline deadline) {
        GateDecision decision = session.getGate().shouldAnalyze();
        if (!decision.changed()) {
            Optional<ScreenState> cached = session.cachedFor(anchors, targets);
            if (cached.isPresent()) {
                log.debug("ContractEngine[{}]: surface unchanged ({}), serving cached state",
                        session.getSurfaceId(), decision.reason());
                return cached.get();
            }
        }
        ScreenState state = session.getController()
                .analyze(anchors, targets, config.getContractMinConfidence(), deadline);
        session.cache(state, anchors, targets);
        return state;
    }

    // ── Plans ─────────────────────────────────────────────────────────────

    /**
     * Executes a plan step by step. Plans and analyses on the same surface run one
     * at a time; a second plan waits for the first to finish.
     *
     * @throws PlanValidationException if the plan is malformed; nothing has run
     */
    public ExecutionResult executePlan(ActionPlan plan) {
        PlanValidator.validate(plan, registry::isOpen);

        SurfaceSession session = registry.require(plan.surfaceId());
        synchronized (session.runLock()) {
            return runPlan(plan, session);
        }
    }

    private ExecutionResult runPlan(ActionPlan plan, SurfaceSession session) {
        long start = System.nanoTime();
        long budget = plan.deadlineMs() != null ? plan.deadlineMs() : config.getPlanDeadlineMs();
        Run run = new Run(plan, session, Deadline.after(budget), start);

        log.info("ContractEngine[{}]: starting plan '{}' ({} steps, deadline {} ms)",
                plan.surfaceId(), plan.goal(), plan.steps().size(), budget);
        run.trail("Plan '" + plan.goal() + "' on '" + plan.surfaceId() + "': "
                + plan.steps().size() + " step(s)");

        int index = 0;
        try {
            run.state = analyze(session, run.anchors, run.targets, run.deadline);
            run.reference = run.state.structuralHash();

            for (; index < plan.steps().size(); index++) {
                ExecutionResult failure = runStep(run, index);
                if (failure != null) {
                    return failure;
                }
                run.completed++;
            }
        } catch (RuntimeException e) {
            log.error("ContractEngine[{}]: unexpected error at step {}", plan.surfaceId(), index, e);
            ScreenState after = session.lastState()
                    .orElse(ScreenState.empty(plan.surfaceId(), "No state captured"));
            return run.fail(index, FailureKind.EXECUTION_FAILURE,
                    "Unexpected error: " + e.getClass().getSimpleName() + ": " + e.getMessage(), after);
        }

        run.trail("Plan completed: " + run.completed + "/" + plan.steps().size() + " steps");
        long elapsed = elapsedMs(start);
        log.info("ContractEngine[{}]: plan '{}' completed in {} ms", plan.surfaceId(), plan.goal(), elapsed);
        return ExecutionResult.succeeded(run.completed, run.state, elapsed, run.lines);
    }

    /** Runs one step with its retries; {@code null} when the step succeeded. */
    private ExecutionResult runStep(Run run, int index) {
        ActionStep step = run.plan.steps().get(index);
        String label = "Step " + index + " (" + step.describe() + ")";
        DecisionController controller = run.session.getController();

        if (run.deadline.exhausted()) {
            return run.fail(index, FailureKind.DEADLINE_EXCEEDED, label + ": plan deadline exceeded", run.state);
        }
        ExecutionResult aborted = checkAbort(run, index, label);
        if (aborted != null) return aborted;

        Optional<ConditionResult> unmet = run.evaluator.firstFailing(step.verifyBefore(), run.state,
                run.reference, run.deadline);
        if (unmet.isPresent()) {
            run.trail(label + ": pre-condition failed: " + unmet.get().detail());
            return run.fail(index, FailureKind.VERIFICATION_FAILURE,
                    label + ": pre-condition failed: " + unmet.get().detail(), run.state);
        }

        int attempts = retryPolicy.attemptsFor(step);
        FailureKind lastKind = null;
        String lastMessage = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (attempt > 1) {
                long wait = run.deadline.cap(retryPolicy.backoffFor(attempt - 1));
                run.trail(label + ": retry " + (attempt - 1) + "/" + (attempts - 1)
                        + (wait > 0 ? " after " + wait + " ms" : ""));
                if (!pause(wait)) {
                    return run.fail(index, FailureKind.EXECUTION_FAILURE, label + ": interrupted", run.state);
                }
            }
            if (run.deadline.exhausted()) {
                return run.fail(index, FailureKind.DEADLINE_EXCEEDED, label + ": plan deadline exceeded",
                        run.state);
            }

            String baseline = controller.currentHash(run.deadline).orElse(run.state.structuralHash());
            Deadline stepDeadline = Deadline.after(Math.max(1L, run.deadline.cap(step.timeoutMs())));
            ActionOutcome outcome = perform(run, step, stepDeadline);

            run.state = analyze(run.session, run.anchors, run.targets, run.deadline);
            run.reference = baseline;

            aborted = checkAbort(run, index, label);
            if (aborted != null) return aborted;

            if (outcome != null && !outcome.success()) {
                lastKind = outcome.failureKind() == null ? FailureKind.EXECUTION_FAILURE : outcome.failureKind();
                lastMessage = label + ": " + outcome.message();
                run.trail(label + ": attempt " + attempt + "/" + attempts + " failed ("
                        + lastKind + "): " + outcome.message());
                continue;
            }

            Optional<ConditionResult> failed = run.evaluator.firstFailing(step.verifyAfter(), run.state,
                    baseline, run.deadline);
            if (failed.isPresent()) {
                lastKind = FailureKind.VERIFICATION_FAILURE;
                lastMessage = label + ": post-condition failed: " + failed.get().detail();
                run.trail(label + ": attempt " + attempt + "/" + attempts + " post-condition failed: "
                        + failed.get().detail());
                continue;
            }

            run.trail(label + ": ok" + (outcome == null ? "" : " via " + outcome.method()
                    + (outcome.fellBack() ? " (fell back)" : "")) + ", attempt " + attempt + "/" + attempts);
            return null;
        }

        log.warn("ContractEngine[{}]: {} failed after {} attempt(s): {}",
                run.plan.surfaceId(), label, attempts, lastMessage);
        return run.fail(index, lastKind, lastMessage, run.state);
    }

    /** Performs the step's operation; {@code null} for operations that do not act. */
    private ActionOutcome perform(Run run, ActionStep step, Deadline stepDeadline) {
        Operation op = step.operation();
        if (op instanceof Operation.Wait w) {
            pause(stepDeadline.cap(w.durationMs()));
            return null;
        }
        if (op instanceof Operation.Verify) {
            return null;
        }
        TargetSpec target = step.hasTarget() ? run.session.targetSpec(step.target(), run.state) : null;
        BoundingBox hint = step.hasTarget()
                ? run.state.element(step.target())
                        .map(ScreenElement::element)
                        .map(InteractiveElement::boundingBox)
                        .orElse(null)
                : null;
        ActionRequest request = new ActionRequest(op, target, null, hint, null);
        return run.session.getController().execute(request, stepDeadline);
    }

    private ExecutionResult checkAbort(Run run, int index, String label) {
        if (run.plan.abortConditions().isEmpty()) return null;
        Optional<ConditionResult> hit = run.evaluator.firstHolding(run.plan.abortConditions(), run.state,
                run.reference, run.deadline);
        if (hit.isEmpty()) return null;
        log.warn("ContractEngine[{}]: abort condition matched at {}: {}",
                run.plan.surfaceId(), label, hit.get().detail());
        run.trail(label + ": abort condition matched: " + hit.get().detail());
        return run.fail(index, FailureKind.ABORT_TRIGGERED,
                "Abort condition matched: " + hit.get().detail(), run.state);
    }

    /** Sleeps; {@code false} if interrupted. */
    private static boolean pause(long ms) {
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    /** Targets analysed during a plan: everything registered on the surface plus every step target. */
    private static List<TargetSpec> planTargets(SurfaceSession session, ActionPlan plan) {
        Map<String, TargetSpec> byName = new LinkedHashMap<>();
        for (TargetSpec t : session.knownTargets()) {
            byName.put(t.name(), t);
        }
        for (ActionStep step : plan.steps()) {
            if (step.hasTarget() && !byName.containsKey(step.target())) {
                byName.put(step.target(), session.targetSpec(step.target(), null));
            }
        }
        return List.copyOf(byName.values());
    }

    // ── Per-run state ─────────────────────────────────────────────────────

    private static final class Run {
        final ActionPlan plan;
        final SurfaceSession session;
        final Deadline deadline;
        final long startNanos;
        final ConditionEvaluator evaluator;
        final List<AnchorSpec> anchors;
        final List<TargetSpec> targets;
        final List<String> lines = new ArrayList<>();

        ScreenState state;
        String reference;
        int completed;

        Run(ActionPlan plan, SurfaceSession session, Deadline deadline, long startNanos) {
            this.plan       = plan;
            this.session    = session;
            this.deadline   = deadline;
            this.startNanos = startNanos;
            this.evaluator  = new ConditionEvaluator(session);
            this.anchors    = session.knownAnchors();
            this.targets    = planTargets(session, plan);
        }

        void trail(String line) {
            lines.add(line);
        }

        ExecutionResult fail(int index, FailureKind kind, String message, ScreenState after) {
            trail("Plan failed at step " + index + " (" + kind + "): " + message);
            return ExecutionResult.failed(completed, plan.steps().size(), index, kind, message,
                    after, elapsedMs(startNanos), lines);
        }
    }
}
