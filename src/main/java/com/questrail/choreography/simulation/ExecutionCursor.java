package com.questrail.choreography.simulation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Position of one line of execution in the CFG.
 *
 * <p>
 * Outside a parallel region a cursor simply rests on a node. After a fork the
 * cursor stays on the fork node and owns one child cursor per branch; each
 * child runs until it rests on its {@code boundaryNodeId}, the region's join.
 * Children nest for nested regions.
 * </p>
 *
 * @param nodeId           node the cursor rests on
 * @param boundaryNodeId   join node that ends this cursor's branch, or -1 for the root
 * @param branches         child cursors while inside a parallel region, else empty
 * @param recursionEntries entries per recursion label seen by this cursor
 */
public record ExecutionCursor(int nodeId,
                              int boundaryNodeId,
                              List<ExecutionCursor> branches,
                              Map<String, Integer> recursionEntries)
{
    public static final int NO_BOUNDARY = -1;

    public ExecutionCursor {
        branches = List.copyOf(Objects.requireNonNull(branches, "branches"));
        recursionEntries = Map.copyOf(Objects.requireNonNull(recursionEntries, "recursionEntries"));
    }

    public static ExecutionCursor root(int nodeId) {
        return new ExecutionCursor(nodeId, NO_BOUNDARY, List.of(), Map.of());
    }

    public boolean inParallel() {
        return !branches.isEmpty();
    }

    /**
     * True when this branch cursor waits on its join.
     */
    public boolean atBoundary() {
        return !inParallel() && nodeId == boundaryNodeId;
    }

    public int entriesOf(String label) {
        return recursionEntries.getOrDefault(label, 0);
    }

    public ExecutionCursor withNode(int newNodeId) {
        return new ExecutionCursor(newNodeId, boundaryNodeId, List.of(), recursionEntries);
    }

    public ExecutionCursor withRecursionEntry(String label) {
        Map<String, Integer> updated = new HashMap<>(recursionEntries);
        updated.merge(label, 1, Integer::sum);
        return new ExecutionCursor(nodeId, boundaryNodeId, branches, updated);
    }

    public ExecutionCursor withBranches(List<ExecutionCursor> newBranches) {
        return new ExecutionCursor(nodeId, boundaryNodeId, newBranches, recursionEntries);
    }

    public ExecutionCursor withBranch(int index, ExecutionCursor branch) {
        List<ExecutionCursor> updated = new ArrayList<>(branches);
        updated.set(index, branch);
        return new ExecutionCursor(nodeId, boundaryNodeId, updated, recursionEntries);
    }

    /**
     * Node ids of every innermost cursor, in branch order.
     */
    public List<Integer> leafNodeIds() {
        List<Integer> ids = new ArrayList<>();
        collectLeaves(this, ids);
        return ids;
    }

    private static void collectLeaves(ExecutionCursor cursor, List<Integer> into) {
        if (!cursor.inParallel()) {
            into.add(cursor.nodeId());
            return;
        }
        for (ExecutionCursor branch : cursor.branches()) {
            collectLeaves(branch, into);
        }
    }
}
