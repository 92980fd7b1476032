package com.questrail.choreography.verification;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.cfg.CfgEdge;
import com.questrail.choreography.cfg.CfgNode;
import com.questrail.choreography.cfg.CfgNode.ActionNode;
import com.questrail.choreography.cfg.CfgNode.ForkNode;
import com.questrail.choreography.cfg.EdgeType;
import com.questrail.choreography.cfg.NodeType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Graph walks shared by the verifier checks.
 *
 * <p>
 * An <em>option region</em> is everything an option of a choice (or a branch
 * of a parallel region) can execute before reconverging: the nodes reachable
 * from the option edge without crossing the merge/join and without following
 * loop-back edges.
 * </p>
 */
final class CfgAnalysis
{
    private CfgAnalysis() {}

    /**
     * Outgoing edges of the given type, in option order.
     */
    static List<CfgEdge> optionEdges(Cfg cfg, int nodeId, EdgeType type) {
        List<CfgEdge> result = new ArrayList<>();
        for (CfgEdge edge : cfg.outgoing(nodeId)) {
            if (edge.type() == type) {
                result.add(edge);
            }
        }
        return result;
    }

    /**
     * Node ids of the option region entered by {@code optionEdge}, in id order.
     *
     * @param boundary merge or join id that ends the region, or {@code null}
     */
    static Set<Integer> region(Cfg cfg, CfgEdge optionEdge, Integer boundary) {
        Set<Integer> region = new TreeSet<>();
        if (cfg.isLoopBack(optionEdge)) {
            return region;
        }
        Deque<Integer> work = new ArrayDeque<>();
        work.add(optionEdge.to());
        while (!work.isEmpty()) {
            int id = work.poll();
            if (isBoundary(cfg, id, boundary) || !region.add(id)) {
                continue;
            }
            for (CfgEdge edge : cfg.outgoing(id)) {
                if (!cfg.isLoopBack(edge)) {
                    work.add(edge.to());
                }
            }
        }
        return region;
    }

    /**
     * Loop-back edges leaving the option region entered by {@code optionEdge},
     * including the option edge itself when it is one.
     */
    static List<CfgEdge> loopBacksOf(Cfg cfg, CfgEdge optionEdge, Integer boundary) {
        List<CfgEdge> result = new ArrayList<>();
        if (cfg.isLoopBack(optionEdge)) {
            result.add(optionEdge);
            return result;
        }
        for (int id : region(cfg, optionEdge, boundary)) {
            for (CfgEdge edge : cfg.outgoing(id)) {
                if (cfg.isLoopBack(edge)) {
                    result.add(edge);
                }
            }
        }
        return result;
    }

    /**
     * Action nodes that can execute first in an option: walking from the option
     * edge, each path stops at its first action, at the boundary, at the end
     * node, at the join of an enclosing region, or when it comes back to
     * {@code origin}. Loop-back edges are followed, so an option that begins
     * with {@code continue} starts with the loop body's first actions.
     */
    static List<ActionNode> firstActions(Cfg cfg, CfgEdge optionEdge, int origin, Integer boundary) {
        return firstMatching(cfg, optionEdge.to(), origin, boundary, true, node -> true);
    }

    /**
     * First action nodes inside the option region that satisfy {@code relevant};
     * actions that do not are stepped over. Loop-back edges are not followed.
     */
    static List<ActionNode> firstRelevantActions(Cfg cfg,
                                                 CfgEdge optionEdge,
                                                 Integer boundary,
                                                 Predicate<ActionNode> relevant) {
        if (cfg.isLoopBack(optionEdge)) {
            return List.of();
        }
        return firstMatching(cfg, optionEdge.to(), optionEdge.from(), boundary, false, relevant);
    }

    private static List<ActionNode> firstMatching(Cfg cfg,
                                                  int start,
                                                  int origin,
                                                  Integer boundary,
                                                  boolean followLoopBacks,
                                                  Predicate<ActionNode> relevant) {
        Set<Integer> found = new TreeSet<>();
        new FirstActionWalk(cfg, origin, followLoopBacks, relevant, found).walk(start, boundary);

        List<ActionNode> result = new ArrayList<>(found.size());
        for (int id : found) {
            result.add(cfg.node(id, ActionNode.class));
        }
        return result;
    }

    /**
     * Breadth-first search for first relevant actions.
     *
     * <p>
     * A nested parallel region is crossed as a unit: the walk descends into
     * every branch with the region's join as boundary, and continues after
     * the join only when every branch can reach it without a relevant action.
     * Any other join belongs to an enclosing region and ends the path.
     * </p>
     */
    private static final class FirstActionWalk
    {
        private final Cfg cfg;
        private final int origin;
        private final boolean followLoopBacks;
        private final Predicate<ActionNode> relevant;
        private final Set<Integer> found;
        private final Set<Integer> visited = new HashSet<>();

        FirstActionWalk(Cfg cfg,
                        int origin,
                        boolean followLoopBacks,
                        Predicate<ActionNode> relevant,
                        Set<Integer> found) {
            this.cfg = cfg;
            this.origin = origin;
            this.followLoopBacks = followLoopBacks;
            this.relevant = relevant;
            this.found = found;
        }

        /**
         * @return true when some path from {@code start} reaches {@code boundary}
         *         without meeting a relevant action
         */
        boolean walk(int start, Integer boundary) {
            boolean reachedBoundary = false;
            Deque<Integer> work = new ArrayDeque<>();
            work.add(start);

            while (!work.isEmpty()) {
                int id = work.poll();
                if (boundary != null && boundary == id) {
                    reachedBoundary = true;
                    continue;
                }
                if (id == origin || !visited.add(id)) {
                    continue;
                }
                CfgNode node = cfg.node(id);
                if (node.type() == NodeType.END || node.type() == NodeType.JOIN) {
                    continue;
                }
                if (node instanceof ActionNode action && relevant.test(action)) {
                    found.add(id);
                    continue;
                }
                if (node instanceof ForkNode fork) {
                    if (crossesSilently(fork)) {
                        enqueueSuccessors(fork.joinId(), work);
                    }
                    continue;
                }
                enqueueSuccessors(id, work);
            }
            return reachedBoundary;
        }

        private boolean crossesSilently(ForkNode fork) {
            boolean all = true;
            for (CfgEdge branch : optionEdges(cfg, fork.id(), EdgeType.PARALLEL_BRANCH)) {
                if (!followLoopBacks && cfg.isLoopBack(branch)) {
                    all = false;
                    continue;
                }
                // Every branch is walked so its first actions are collected.
                if (!walk(branch.to(), fork.joinId())) {
                    all = false;
                }
            }
            return all;
        }

        private void enqueueSuccessors(int id, Deque<Integer> work) {
            for (CfgEdge edge : cfg.outgoing(id)) {
                if (followLoopBacks || !cfg.isLoopBack(edge)) {
                    work.add(edge.to());
                }
            }
        }
    }

    /**
     * Node ids reachable from the initial node along any edge.
     */
    static Set<Integer> reachableFromInitial(Cfg cfg) {
        Set<Integer> reached = new HashSet<>();
        Deque<Integer> work = new ArrayDeque<>();
        work.add(cfg.initialNodeId());
        while (!work.isEmpty()) {
            int id = work.poll();
            if (!reached.add(id)) {
                continue;
            }
            for (CfgEdge edge : cfg.outgoing(id)) {
                work.add(edge.to());
            }
        }
        return reached;
    }

    private static boolean isBoundary(Cfg cfg, int id, Integer boundary) {
        return (boundary != null && boundary == id) || cfg.node(id).type() == NodeType.END;
    }
}
