package com.questrail.choreography.simulation;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.config.SimulatorConfig;
import com.questrail.choreography.observability.NullObservabilitySink;
import com.questrail.choreography.observability.SimulationObservabilitySink;
import com.questrail.choreography.observability.SimulationTransitionEvent;
import com.questrail.choreography.observability.StepRejectedEvent;
import com.questrail.choreography.time.SystemWallClock;
import com.questrail.choreography.time.WallClock;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Simulator
 * -----------------------------------------------------------------------------
 * Stateful owner of one simulated execution of a {@link Cfg}.
 *
 * <h2>What this class is</h2>
 * <ul>
 *   <li>The holder of the current {@link SimulatorState}</li>
 *   <li>The composition point for reducer, observability sink and clock</li>
 *   <li>A single-threaded coordinator; callers serialize access</li>
 * </ul>
 *
 * All step semantics live in {@link SimulationReducer}. This class threads
 * states through it, keeps the bounded history used by {@link #stepBack()},
 * and reports committed and rejected steps to the sink.
 *
 * <h2>Execution model</h2>
 * <pre>
 *   step(choice) → reducer → new state + event → sink
 * </pre>
 * A rejected step leaves the state untouched, so calls may be retried.
 */
public final class Simulator
{
    /** Step budget of {@link #run()} when the config sets no step limit. */
    public static final int DEFAULT_RUN_STEPS = 10_000;

    private final Cfg cfg;
    private final SimulatorConfig config;
    private final SimulationReducer reducer;
    private final SimulationObservabilitySink sink;
    private final WallClock clock;

    private final Deque<SimulatorState> history = new ArrayDeque<>();

    private SimulatorState state;
    private Instant startTime;
    private Instant endTime;

    public Simulator(Cfg cfg)
    {
        this(cfg, SimulatorConfig.defaults());
    }

    public Simulator(Cfg cfg, SimulatorConfig config)
    {
        this(cfg, config, NullObservabilitySink.INSTANCE);
    }

    public Simulator(Cfg cfg, SimulatorConfig config, SimulationObservabilitySink sink)
    {
        this(cfg, config, sink, SystemWallClock.INSTANCE);
    }

    public Simulator(Cfg cfg, SimulatorConfig config, SimulationObservabilitySink sink, WallClock clock)
    {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reducer = new SimulationReducer(cfg, config);
        reset();
    }

    // ---------------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------------

    /**
     * Exposes the current immutable state snapshot.
     */
    public SimulatorState getState()
    {
        return state;
    }

    public boolean isComplete()
    {
        return state.completed();
    }

    public List<ChoiceOption> availableChoices()
    {
        return state.availableChoices();
    }

    public Cfg cfg()
    {
        return cfg;
    }

    public SimulatorConfig config()
    {
        return config;
    }

    /**
     * Returns the execution trace so far. Events are only present when the
     * config enables trace recording; step counts and timestamps always are.
     */
    public ExecutionTrace getTrace()
    {
        return new ExecutionTrace(state.events(), startTime, endTime, state.completed(), state.stepCount());
    }

    // ---------------------------------------------------------------------
    // Stepping
    // ---------------------------------------------------------------------

    /**
     * Takes one step, resolving a pending choice per the configured strategy.
     */
    public StepResult step()
    {
        return step(null);
    }

    /**
     * Takes one step.
     *
     * @param choice option label for the pending choice point, or {@code null}
     */
    public StepResult step(String choice)
    {
        SimulatorState before = state;
        StepResult result = reducer.step(before, choice);

        if (!result.success()) {
            sink.onStepRejected(new StepRejectedEvent(clock.now(), before, choice, result.error()));
            return result;
        }

        remember(before);
        state = result.state();
        Instant now = clock.now();
        if (state.completed()) {
            endTime = now;
        }
        sink.onStateTransition(new SimulationTransitionEvent(now, before, state, result.event()));
        return result;
    }

    /**
     * Steps until completion, the first refused step, or the step budget.
     * Pending choices are resolved by the configured strategy.
     */
    public RunResult run()
    {
        return run(config.stepLimited() ? config.maxSteps() : DEFAULT_RUN_STEPS);
    }

    /**
     * Steps until completion, the first refused step, or {@code maxSteps}
     * successful steps taken by this call.
     */
    public RunResult run(int maxSteps)
    {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be > 0");
        }

        List<SimulationEvent> emitted = new ArrayList<>();
        StepError error = null;
        while (!state.completed()) {
            if (emitted.size() >= maxSteps) {
                error = StepError.of(StepError.Kind.STEP_LIMIT_REACHED,
                        "Run stopped after " + maxSteps + " steps");
                break;
            }
            StepResult result = step();
            if (!result.success()) {
                error = result.error();
                break;
            }
            emitted.add(result.event());
        }
        return new RunResult(state.completed(), emitted.size(), emitted, error, state);
    }

    // ---------------------------------------------------------------------
    // Rewinding
    // ---------------------------------------------------------------------

    /**
     * Returns to the state before the first step and clears history.
     */
    public void reset()
    {
        history.clear();
        state = reducer.initialState();
        startTime = clock.now();
        endTime = state.completed() ? startTime : null;
    }

    /**
     * Replaces the current state with a snapshot previously taken from a
     * simulator over the same CFG. The current state becomes undoable.
     */
    public void restore(SimulatorState snapshot)
    {
        Objects.requireNonNull(snapshot, "snapshot");
        for (Integer nodeId : snapshot.activeNodeIds()) {
            if (nodeId < 0 || nodeId >= cfg.nodeCount()) {
                throw new IllegalArgumentException("Snapshot refers to node " + nodeId
                        + " outside protocol " + cfg.protocolName());
            }
        }
        remember(state);
        state = snapshot;
        endTime = state.completed() ? clock.now() : null;
    }

    public boolean canStepBack()
    {
        return !history.isEmpty();
    }

    /**
     * Undoes the most recent step or restore.
     *
     * @return {@code false} when there is no history to return to
     */
    public boolean stepBack()
    {
        SimulatorState previous = history.pollFirst();
        if (previous == null) {
            return false;
        }
        state = previous;
        if (!state.completed()) {
            endTime = null;
        }
        return true;
    }

    private void remember(SimulatorState previous)
    {
        if (config.historyLimit() == 0) {
            return;
        }
        history.addFirst(previous);
        while (history.size() > config.historyLimit()) {
            history.removeLast();
        }
    }
}
