package com.questrail.choreography.cfg;

import com.questrail.choreography.model.Action;
import com.questrail.choreography.model.Role;

import java.util.Objects;
import java.util.Optional;

/**
 * CfgNode
 * -----------------------------------------------------------------------------
 * A node of a compiled {@link Cfg}.
 *
 * <h2>Identity</h2>
 * Node ids are dense: a node's id is its index in {@link Cfg#nodes()}. Nodes
 * never reference each other directly, only by id, so a graph with loops is
 * still a plain list of values.
 *
 * <h2>Construction order</h2>
 * The builder allocates ids in construction order. A {@code branch} or
 * {@code fork} node is allocated before any node of its options, and a
 * {@code recursive} node before any node of its body. {@link Cfg#isLoopBack}
 * relies on this.
 */
public sealed interface CfgNode
{
    int id();

    NodeType type();

    // ---------------------------------------------------------------------
    // Variants
    // ---------------------------------------------------------------------

    record InitialNode(int id) implements CfgNode {
        @Override
        public NodeType type() {
            return NodeType.INITIAL;
        }
    }

    record ActionNode(int id, Action action) implements CfgNode {
        public ActionNode {
            Objects.requireNonNull(action, "action");
        }

        @Override
        public NodeType type() {
            return NodeType.ACTION;
        }
    }

    /**
     * @param at      the deciding role
     * @param mergeId id of the merge node, or {@code null} when no option falls through
     */
    record BranchNode(int id, Role at, Integer mergeId) implements CfgNode {
        public BranchNode {
            Objects.requireNonNull(at, "at");
        }

        public Optional<Integer> merge() {
            return Optional.ofNullable(mergeId);
        }

        @Override
        public NodeType type() {
            return NodeType.BRANCH;
        }
    }

    record MergeNode(int id) implements CfgNode {
        @Override
        public NodeType type() {
            return NodeType.MERGE;
        }
    }

    record ForkNode(int id, String parallelId, int joinId) implements CfgNode {
        public ForkNode {
            Objects.requireNonNull(parallelId, "parallelId");
        }

        @Override
        public NodeType type() {
            return NodeType.FORK;
        }
    }

    record JoinNode(int id, String parallelId) implements CfgNode {
        public JoinNode {
            Objects.requireNonNull(parallelId, "parallelId");
        }

        @Override
        public NodeType type() {
            return NodeType.JOIN;
        }
    }

    record RecursiveNode(int id, String label) implements CfgNode {
        public RecursiveNode {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public NodeType type() {
            return NodeType.RECURSIVE;
        }
    }

    record EndNode(int id) implements CfgNode {
        @Override
        public NodeType type() {
            return NodeType.END;
        }
    }
}
