package com.questrail.choreography.simulation;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.config.ChoiceStrategy;
import com.questrail.choreography.config.SimulatorConfig;
import com.questrail.choreography.simulation.SimulationEvent.ChoiceEvent;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Re-executes a recorded trace on a fresh simulator and compares the events.
 *
 * <p>
 * Every recorded choice event drives an explicit option; every other event
 * drives a plain step. The replay simulator uses {@link ChoiceStrategy#MANUAL}
 * so a trace that skips a choice point diverges instead of silently taking
 * the first option.
 * </p>
 */
public final class TraceReplay
{
    private TraceReplay() {}

    /**
     * Outcome of a replay.
     *
     * @param matches          true when every event matched and completion agrees
     * @param matchedEvents    number of leading events that matched
     * @param divergenceIndex  index of the first mismatching event, or {@code null}
     * @param detail           human-readable summary
     * @param replayed         trace produced by the replay simulator
     */
    public record ReplayResult(boolean matches,
                               int matchedEvents,
                               Integer divergenceIndex,
                               String detail,
                               ExecutionTrace replayed)
    {
        public Optional<Integer> divergence() {
            return Optional.ofNullable(divergenceIndex);
        }
    }

    public static ReplayResult replay(Cfg cfg, ExecutionTrace trace)
    {
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(trace, "trace");

        SimulatorConfig config = SimulatorConfig.builder()
                .withRecordTrace(true)
                .withChoiceStrategy(ChoiceStrategy.MANUAL)
                .build();
        Simulator simulator = new Simulator(cfg, config);

        List<SimulationEvent> expected = trace.events();
        for (int i = 0; i < expected.size(); i++) {
            SimulationEvent recorded = expected.get(i);
            StepResult result = recorded instanceof ChoiceEvent choice
                    ? simulator.step(choice.selectedLabel())
                    : simulator.step();

            if (!result.success()) {
                return diverged(simulator, i, "event " + i + " (" + recorded + ") could not be replayed: "
                        + result.error());
            }
            if (!result.event().equals(recorded)) {
                return diverged(simulator, i, "event " + i + " expected " + recorded
                        + " but replay produced " + result.event());
            }
        }

        if (simulator.isComplete() != trace.completed()) {
            return new ReplayResult(false, expected.size(), null,
                    "all events matched but completion differs (recorded " + trace.completed()
                            + ", replayed " + simulator.isComplete() + ")",
                    simulator.getTrace());
        }
        return new ReplayResult(true, expected.size(), null,
                expected.size() + " events replayed", simulator.getTrace());
    }

    private static ReplayResult diverged(Simulator simulator, int index, String detail)
    {
        return new ReplayResult(false, index, index, detail, simulator.getTrace());
    }
}
