package com.questrail.choreography.cfg;

import com.questrail.choreography.cfg.CfgNode.ActionNode;
import com.questrail.choreography.cfg.CfgNode.BranchNode;
import com.questrail.choreography.cfg.CfgNode.EndNode;
import com.questrail.choreography.cfg.CfgNode.ForkNode;
import com.questrail.choreography.cfg.CfgNode.InitialNode;
import com.questrail.choreography.cfg.CfgNode.JoinNode;
import com.questrail.choreography.cfg.CfgNode.MergeNode;
import com.questrail.choreography.cfg.CfgNode.RecursiveNode;
import com.questrail.choreography.model.Action;
import com.questrail.choreography.model.Choice;
import com.questrail.choreography.model.Continue;
import com.questrail.choreography.model.Interaction;
import com.questrail.choreography.model.Parallel;
import com.questrail.choreography.model.ProtocolDeclaration;
import com.questrail.choreography.model.Recursion;
import com.questrail.choreography.model.Sequence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * CfgBuilder
 * -----------------------------------------------------------------------------
 * Compiles the interaction tree of one {@link ProtocolDeclaration} into a
 * {@link Cfg}.
 *
 * <h2>Translation</h2>
 * Each term compiles to a fragment with an entry node and, when control can
 * fall through the term, an exit node:
 * <ul>
 *   <li>{@code Action}: one action node, entry = exit</li>
 *   <li>{@code Sequence}: items chained with sequential edges</li>
 *   <li>{@code Choice}: branch node, one {@code choice-branch} edge per option,
 *       merge node reached from every option that falls through</li>
 *   <li>{@code Parallel}: fork node, one {@code parallel-branch} edge per branch,
 *       join node reached from every branch that falls through</li>
 *   <li>{@code Recursion}: recursive node with an epsilon edge into its body;
 *       exits where the body exits</li>
 *   <li>{@code Continue}: no node of its own; the incoming connection becomes a
 *       {@code recursion-back} edge to the matching recursive node</li>
 * </ul>
 *
 * A unique initial node leads to the root entry, and the root exit (if any)
 * leads to a unique end node.
 *
 * <p>
 * The builder is stateless; every {@link #build} call works on its own
 * assembly and returns a fresh graph.
 * </p>
 */
public final class CfgBuilder
{
    public Cfg build(ProtocolDeclaration declaration) {
        Objects.requireNonNull(declaration, "declaration");
        return new Assembly().assemble(declaration);
    }

    // ---------------------------------------------------------------------
    // Fragments
    // ---------------------------------------------------------------------

    /**
     * Compiled sub-term.
     *
     * @param entry    first node, or {@code null} for an empty term
     * @param exit     node control leaves from, or {@code null} if control never
     *                 falls through
     * @param backJump true when the entry is a loop target reached by a continue
     */
    private record Fragment(Integer entry, Integer exit, boolean backJump) {

        static final Fragment EMPTY = new Fragment(null, null, false);

        boolean isEmpty() {
            return entry == null;
        }

        boolean fallsThrough() {
            return isEmpty() || exit != null;
        }
    }

    private record RecursionScope(String label, int nodeId) {}

    private static final class Assembly
    {
        private final List<CfgNode> nodes = new ArrayList<>();
        private final List<CfgEdge> edges = new ArrayList<>();
        private final Deque<RecursionScope> scopes = new ArrayDeque<>();
        private int parallelCounter = 0;

        Cfg assemble(ProtocolDeclaration declaration) {
            int initial = add(new InitialNode(nodes.size()));
            Fragment root = compile(declaration.body());
            int end = add(new EndNode(nodes.size()));

            if (root.isEmpty()) {
                edge(initial, end, EdgeType.EPSILON, null);
            } else {
                connect(initial, root, EdgeType.EPSILON, null);
                if (root.exit() != null) {
                    edge(root.exit(), end, EdgeType.SEQUENTIAL, null);
                }
            }
            return new Cfg(declaration.name(), declaration.roles(), nodes, edges, initial, end);
        }

        private Fragment compile(Interaction interaction) {
            return switch (interaction.kind()) {
                case ACTION -> compileAction((Action) interaction);
                case SEQUENCE -> compileSequence((Sequence) interaction);
                case CHOICE -> compileChoice((Choice) interaction);
                case PARALLEL -> compileParallel((Parallel) interaction);
                case RECURSION -> compileRecursion((Recursion) interaction);
                case CONTINUE -> compileContinue((Continue) interaction);
            };
        }

        private Fragment compileAction(Action action) {
            int id = add(new ActionNode(nodes.size(), action));
            return new Fragment(id, id, false);
        }

        private Fragment compileSequence(Sequence sequence) {
            Integer entry = null;
            boolean entryIsBackJump = false;
            Integer tail = null;
            boolean live = true;

            for (Interaction item : sequence.items()) {
                Fragment fragment = compile(item);
                if (fragment.isEmpty()) {
                    continue;
                }
                if (live && entry == null) {
                    entry = fragment.entry();
                    entryIsBackJump = fragment.backJump();
                } else if (tail != null) {
                    connect(tail, fragment, EdgeType.SEQUENTIAL, null);
                }
                // Items after a term that never falls through stay compiled but unreachable.
                if (fragment.exit() == null) {
                    live = false;
                }
                tail = fragment.exit();
            }

            if (entry == null) {
                return Fragment.EMPTY;
            }
            return new Fragment(entry, live ? tail : null, entryIsBackJump);
        }

        private Fragment compileChoice(Choice choice) {
            int branchId = add(new BranchNode(nodes.size(), choice.at(), null));

            List<Fragment> options = new ArrayList<>();
            for (Interaction option : choice.options()) {
                options.add(compile(option));
            }

            Integer mergeId = null;
            if (options.stream().anyMatch(Fragment::fallsThrough)) {
                mergeId = add(new MergeNode(nodes.size()));
            }
            nodes.set(branchId, new BranchNode(branchId, choice.at(), mergeId));

            for (int i = 0; i < options.size(); i++) {
                Fragment option = options.get(i);
                String label = optionLabel(i);
                if (option.isEmpty()) {
                    edge(branchId, mergeId, EdgeType.CHOICE_BRANCH, label);
                } else {
                    connect(branchId, option, EdgeType.CHOICE_BRANCH, label);
                }
            }
            for (Fragment option : options) {
                if (!option.isEmpty() && option.exit() != null) {
                    edge(option.exit(), mergeId, EdgeType.SEQUENTIAL, null);
                }
            }
            return new Fragment(branchId, mergeId, false);
        }

        private Fragment compileParallel(Parallel parallel) {
            String parallelId = "par" + (++parallelCounter);
            int forkId = add(new ForkNode(nodes.size(), parallelId, -1));

            List<Fragment> branches = new ArrayList<>();
            for (Interaction branch : parallel.branches()) {
                branches.add(compile(branch));
            }

            int joinId = add(new JoinNode(nodes.size(), parallelId));
            nodes.set(forkId, new ForkNode(forkId, parallelId, joinId));

            for (int i = 0; i < branches.size(); i++) {
                Fragment branch = branches.get(i);
                String label = optionLabel(i);
                if (branch.isEmpty()) {
                    edge(forkId, joinId, EdgeType.PARALLEL_BRANCH, label);
                } else {
                    connect(forkId, branch, EdgeType.PARALLEL_BRANCH, label);
                }
            }
            boolean allFallThrough = true;
            for (Fragment branch : branches) {
                if (branch.isEmpty()) {
                    continue;
                }
                if (branch.exit() != null) {
                    edge(branch.exit(), joinId, EdgeType.SEQUENTIAL, null);
                } else {
                    allFallThrough = false;
                }
            }
            return new Fragment(forkId, allFallThrough ? joinId : null, false);
        }

        private Fragment compileRecursion(Recursion recursion) {
            int recId = add(new RecursiveNode(nodes.size(), recursion.label()));

            scopes.push(new RecursionScope(recursion.label(), recId));
            Fragment body;
            try {
                body = compile(recursion.body());
            } finally {
                scopes.pop();
            }

            if (body.isEmpty()) {
                return new Fragment(recId, recId, false);
            }
            connect(recId, body, EdgeType.EPSILON, null);
            return new Fragment(recId, body.exit(), false);
        }

        private Fragment compileContinue(Continue jump) {
            for (RecursionScope scope : scopes) {
                if (scope.label().equals(jump.label())) {
                    return new Fragment(scope.nodeId(), null, true);
                }
            }
            throw new CompileException("continue " + jump.label()
                    + " has no enclosing recursion labeled " + jump.label());
        }

        // ---------------------------------------------------------------------
        // Arena helpers
        // ---------------------------------------------------------------------

        private int add(CfgNode node) {
            nodes.add(node);
            return node.id();
        }

        private void connect(int from, Fragment target, EdgeType type, String label) {
            EdgeType effective = type;
            if (target.backJump() && (type == EdgeType.SEQUENTIAL || type == EdgeType.EPSILON)) {
                effective = EdgeType.RECURSION_BACK;
            }
            edge(from, target.entry(), effective, label);
        }

        private void edge(int from, int to, EdgeType type, String label) {
            edges.add(new CfgEdge(edges.size(), from, to, type, label));
        }

        private static String optionLabel(int index) {
            return "branch" + (index + 1);
        }
    }
}
