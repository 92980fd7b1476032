package com.questrail.choreography.simulation;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.cfg.CfgEdge;
import com.questrail.choreography.cfg.CfgNode;
import com.questrail.choreography.cfg.CfgNode.ActionNode;
import com.questrail.choreography.cfg.CfgNode.BranchNode;
import com.questrail.choreography.cfg.CfgNode.ForkNode;
import com.questrail.choreography.cfg.CfgNode.RecursiveNode;
import com.questrail.choreography.cfg.EdgeType;
import com.questrail.choreography.cfg.NodeType;
import com.questrail.choreography.config.ChoiceStrategy;
import com.questrail.choreography.config.SimulatorConfig;
import com.questrail.choreography.model.Action;
import com.questrail.choreography.simulation.SimulationEvent.ChoiceEvent;
import com.questrail.choreography.simulation.SimulationEvent.ForkEvent;
import com.questrail.choreography.simulation.SimulationEvent.JoinEvent;
import com.questrail.choreography.simulation.SimulationEvent.MessageEvent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SimulationReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic step function over {@link SimulatorState}.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior state and an optional option label, the reducer computes
 * either a new state plus exactly one {@link SimulationEvent}, or a
 * {@link StepError} with the prior state untouched. It performs no I/O and
 * keeps no mutable fields; the stateful {@link Simulator} threads states
 * through it and reports transitions to observability sinks.
 *
 * <h2>Traversal policy</h2>
 * <ul>
 *   <li>{@code initial}, {@code merge} and {@code recursive} nodes are crossed
 *       silently right after the step that reaches them</li>
 *   <li>{@code action}, {@code branch}, {@code fork} and {@code join} each cost
 *       one step and emit one event</li>
 *   <li>reaching {@code end} completes the protocol on that same step</li>
 * </ul>
 *
 * <h2>Parallel scheduling</h2>
 * Inside a parallel region the first branch (declaration order) that has not
 * reached the join advances, recursively for nested regions. Once every
 * branch waits on the join, the next step consumes the join.
 *
 * <h2>Loops</h2>
 * Crossing a recursive node counts one entry for its label on the cursor.
 * A silent cycle (a loop with no action) leaves the cursor resting on a
 * silent node; stepping it fails with {@link StepError.Kind#NO_PROGRESS}.
 */
public final class SimulationReducer
{
    private final Cfg cfg;
    private final SimulatorConfig config;

    public SimulationReducer(Cfg cfg, SimulatorConfig config) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * State before the first step: the root cursor has silently crossed the
     * initial node and any leading recursive nodes.
     */
    public SimulatorState initialState() {
        Moved moved = normalize(ExecutionCursor.root(cfg.initialNodeId()));
        return stateAt(moved.cursor(), 0, EventLog.EMPTY);
    }

    /**
     * Applies one step.
     *
     * @param state  the current state (must not be {@code null})
     * @param choice option label for a pending choice point, or {@code null}
     * @return the step outcome; on failure {@link StepResult#state()} is {@code state}
     */
    public StepResult step(SimulatorState state, String choice) {
        Objects.requireNonNull(state, "state");

        if (state.completed()) {
            return StepResult.failed(StepError.of(StepError.Kind.ALREADY_COMPLETED,
                    "Protocol " + cfg.protocolName() + " already completed"), state);
        }
        if (config.stepLimited() && state.stepCount() >= config.maxSteps()) {
            return StepResult.failed(StepError.of(StepError.Kind.STEP_LIMIT_REACHED,
                    "Step limit of " + config.maxSteps() + " reached"), state);
        }
        if (choice != null && !state.atChoice()) {
            return StepResult.failed(StepError.of(StepError.Kind.INVALID_CHOICE,
                    "Option '" + choice + "' given but no choice is pending"), state);
        }

        int stepNumber = state.stepCount() + 1;
        Advance advance = advance(state.cursor(), choice, stepNumber);
        if (advance.error() != null) {
            return StepResult.failed(advance.error(), state);
        }

        EventLog events = state.eventLog();
        if (config.recordTrace()) {
            events = events.append(advance.event());
        }
        return StepResult.ok(advance.event(), stateAt(advance.cursor(), stepNumber, events));
    }

    // ---------------------------------------------------------------------
    // Advancing cursors
    // ---------------------------------------------------------------------

    private record Advance(ExecutionCursor cursor, SimulationEvent event, StepError error) {

        static Advance ok(ExecutionCursor cursor, SimulationEvent event) {
            return new Advance(cursor, event, null);
        }

        static Advance failed(StepError error) {
            return new Advance(null, null, error);
        }
    }

    private record Moved(ExecutionCursor cursor, StepError error) {}

    private Advance advance(ExecutionCursor cursor, String choice, int stepNumber) {
        if (cursor.inParallel()) {
            return advanceParallel(cursor, choice, stepNumber);
        }

        CfgNode node = cfg.node(cursor.nodeId());
        return switch (node.type()) {
            case ACTION -> advanceAction(cursor, (ActionNode) node, stepNumber);
            case BRANCH -> advanceChoice(cursor, (BranchNode) node, choice, stepNumber);
            case FORK -> advanceFork(cursor, (ForkNode) node, stepNumber);
            case INITIAL, MERGE, RECURSIVE -> Advance.failed(StepError.at(StepError.Kind.NO_PROGRESS,
                    "No action is reachable from node " + node.id() + " without looping", node.id()));
            case JOIN, END -> Advance.failed(StepError.at(StepError.Kind.NODE_NOT_STEPPABLE,
                    "Node " + node.id() + " (" + node.type() + ") cannot be stepped here", node.id()));
        };
    }

    private Advance advanceAction(ExecutionCursor cursor, ActionNode node, int stepNumber) {
        List<CfgEdge> out = cfg.outgoing(node.id());
        if (out.size() != 1) {
            return notSteppable(node, out.size());
        }

        Action action = node.action();
        MessageEvent event = new MessageEvent(stepNumber, node.id(),
                action.from(), action.to(), action.label(), action.payloadType());
        return moveAndEmit(cursor, out.get(0).to(), event);
    }

    private Advance advanceChoice(ExecutionCursor cursor, BranchNode node, String choice, int stepNumber) {
        List<CfgEdge> options = optionEdges(node.id(), EdgeType.CHOICE_BRANCH);

        CfgEdge selected = null;
        if (choice == null) {
            if (config.choiceStrategy() == ChoiceStrategy.MANUAL) {
                return Advance.failed(StepError.at(StepError.Kind.CHOICE_REQUIRED,
                        "Choice at " + node.at() + " needs one of " + labels(options), node.id()));
            }
            selected = options.isEmpty() ? null : options.get(0);
        } else {
            for (CfgEdge option : options) {
                if (option.hasLabel(choice)) {
                    selected = option;
                    break;
                }
            }
            if (selected == null) {
                return Advance.failed(StepError.at(StepError.Kind.INVALID_CHOICE,
                        "Unknown option '" + choice + "' at choice " + node.id()
                                + "; expected one of " + labels(options), node.id()));
            }
        }
        if (selected == null) {
            return notSteppable(node, 0);
        }

        ChoiceEvent event = new ChoiceEvent(stepNumber, node.id(), node.at(), selected.label(), selected.to());
        return moveAndEmit(cursor, selected.to(), event);
    }

    private Advance advanceFork(ExecutionCursor cursor, ForkNode node, int stepNumber) {
        List<CfgEdge> branchEdges = optionEdges(node.id(), EdgeType.PARALLEL_BRANCH);
        if (branchEdges.isEmpty()) {
            return notSteppable(node, 0);
        }

        List<ExecutionCursor> children = new ArrayList<>();
        for (CfgEdge edge : branchEdges) {
            ExecutionCursor child = new ExecutionCursor(edge.to(), node.joinId(), List.of(), cursor.recursionEntries());
            Moved moved = normalize(child);
            if (moved.error() != null) {
                return Advance.failed(moved.error());
            }
            children.add(moved.cursor());
        }

        ForkEvent event = new ForkEvent(stepNumber, node.id(), node.parallelId(), children.size());
        return Advance.ok(cursor.withBranches(children), event);
    }

    private Advance advanceParallel(ExecutionCursor cursor, String choice, int stepNumber) {
        List<ExecutionCursor> branches = cursor.branches();
        for (int i = 0; i < branches.size(); i++) {
            ExecutionCursor branch = branches.get(i);
            if (isFinished(branch)) {
                continue;
            }
            Advance inner = advance(branch, choice, stepNumber);
            if (inner.error() != null) {
                return inner;
            }
            return Advance.ok(cursor.withBranch(i, inner.cursor()), inner.event());
        }

        ForkNode fork = cfg.node(cursor.nodeId(), ForkNode.class);
        for (ExecutionCursor branch : branches) {
            if (!branch.atBoundary()) {
                return Advance.failed(StepError.at(StepError.Kind.NO_PROGRESS,
                        "Parallel region " + fork.parallelId() + " can no longer reach its join", fork.id()));
            }
        }

        List<CfgEdge> out = cfg.outgoing(fork.joinId());
        if (out.size() != 1) {
            return notSteppable(cfg.node(fork.joinId()), out.size());
        }
        JoinEvent event = new JoinEvent(stepNumber, fork.joinId(), fork.parallelId());
        return moveAndEmit(cursor, out.get(0).to(), event);
    }

    private Advance moveAndEmit(ExecutionCursor cursor, int target, SimulationEvent event) {
        Moved moved = normalize(cursor.withNode(target));
        if (moved.error() != null) {
            return Advance.failed(moved.error());
        }
        return Advance.ok(moved.cursor(), event);
    }

    private Advance notSteppable(CfgNode node, int outgoing) {
        return Advance.failed(StepError.at(StepError.Kind.NODE_NOT_STEPPABLE,
                "Node " + node.id() + " (" + node.type() + ") has " + outgoing + " usable outgoing edges",
                node.id()));
    }

    // ---------------------------------------------------------------------
    // Silent traversal
    // ---------------------------------------------------------------------

    /**
     * Moves a non-parallel cursor across silent nodes until it rests on a
     * steppable node, its boundary, or a silent node it already crossed.
     */
    private Moved normalize(ExecutionCursor cursor) {
        ExecutionCursor current = cursor;
        Set<Integer> visited = new HashSet<>();

        while (true) {
            int id = current.nodeId();
            if (id == current.boundaryNodeId()) {
                return new Moved(current, null);
            }
            CfgNode node = cfg.node(id);
            if (!isSilent(node.type()) || !visited.add(id)) {
                return new Moved(current, null);
            }

            if (node instanceof RecursiveNode rec) {
                current = current.withRecursionEntry(rec.label());
                if (config.recursionLimited() && current.entriesOf(rec.label()) > config.maxRecursionEntries()) {
                    return new Moved(current, StepError.at(StepError.Kind.RECURSION_LIMIT_REACHED,
                            "Recursion " + rec.label() + " entered more than "
                                    + config.maxRecursionEntries() + " times", id));
                }
            }

            List<CfgEdge> out = cfg.outgoing(id);
            if (out.size() != 1) {
                return new Moved(current, StepError.at(StepError.Kind.NODE_NOT_STEPPABLE,
                        "Node " + id + " (" + node.type() + ") has " + out.size() + " outgoing edges", id));
            }
            current = current.withNode(out.get(0).to());
        }
    }

    private static boolean isSilent(NodeType type) {
        return type == NodeType.INITIAL || type == NodeType.MERGE || type == NodeType.RECURSIVE;
    }

    private boolean isFinished(ExecutionCursor branch) {
        if (branch.atBoundary()) {
            return true;
        }
        return !branch.inParallel() && cfg.node(branch.nodeId()).type() == NodeType.END;
    }

    // ---------------------------------------------------------------------
    // Derived state
    // ---------------------------------------------------------------------

    private SimulatorState stateAt(ExecutionCursor cursor, int stepCount, EventLog events) {
        boolean completed = !cursor.inParallel() && cfg.node(cursor.nodeId()).type() == NodeType.END;
        List<ChoiceOption> choices = completed ? List.of() : choicesFor(cursor);
        return SimulatorState.of(cursor, completed, stepCount, choices, events);
    }

    /**
     * Options of the choice point the next step would resolve, or an empty list.
     */
    private List<ChoiceOption> choicesFor(ExecutionCursor cursor) {
        ExecutionCursor leaf = activeLeaf(cursor);
        if (leaf == null || !(cfg.node(leaf.nodeId()) instanceof BranchNode branch)) {
            return List.of();
        }

        List<CfgEdge> edges = optionEdges(branch.id(), EdgeType.CHOICE_BRANCH);
        List<ChoiceOption> options = new ArrayList<>(edges.size());
        for (int i = 0; i < edges.size(); i++) {
            CfgEdge edge = edges.get(i);
            options.add(new ChoiceOption(i, edge.label(), edge.to(), describeOption(branch, edge)));
        }
        return options;
    }

    private ExecutionCursor activeLeaf(ExecutionCursor cursor) {
        if (!cursor.inParallel()) {
            return cursor;
        }
        for (ExecutionCursor branch : cursor.branches()) {
            if (!isFinished(branch)) {
                return activeLeaf(branch);
            }
        }
        return null;
    }

    private String describeOption(BranchNode branch, CfgEdge edge) {
        if (cfg.isLoopBack(edge)) {
            return "continue " + cfg.node(edge.to(), RecursiveNode.class).label();
        }

        int id = edge.to();
        Set<Integer> visited = new HashSet<>();
        while (visited.add(id)) {
            CfgNode node = cfg.node(id);
            switch (node.type()) {
                case ACTION:
                    return ((ActionNode) node).action().toString();
                case BRANCH:
                    return "choice at " + ((BranchNode) node).at();
                case FORK:
                    return "parallel " + ((ForkNode) node).parallelId();
                case END:
                    return "end of protocol";
                case JOIN:
                    return "end of parallel branch";
                default:
                    if (branch.mergeId() != null && branch.mergeId() == id) {
                        return "skip";
                    }
                    List<CfgEdge> out = cfg.outgoing(id);
                    if (out.size() != 1) {
                        return "no interaction";
                    }
                    id = out.get(0).to();
            }
        }
        return "no interaction";
    }

    private List<CfgEdge> optionEdges(int nodeId, EdgeType type) {
        List<CfgEdge> result = new ArrayList<>();
        for (CfgEdge edge : cfg.outgoing(nodeId)) {
            if (edge.type() == type) {
                result.add(edge);
            }
        }
        return result;
    }

    private static String labels(List<CfgEdge> edges) {
        return edges.stream().map(CfgEdge::label).collect(Collectors.joining(", ", "[", "]"));
    }
}
