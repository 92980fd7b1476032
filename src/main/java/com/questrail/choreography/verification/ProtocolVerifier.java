package com.questrail.choreography.verification;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.cfg.CfgEdge;
import com.questrail.choreography.cfg.CfgNode;
import com.questrail.choreography.cfg.CfgNode.BranchNode;
import com.questrail.choreography.cfg.CfgNode.ForkNode;
import com.questrail.choreography.cfg.CfgNode.JoinNode;
import com.questrail.choreography.cfg.EdgeType;
import com.questrail.choreography.cfg.NodeType;
import com.questrail.choreography.config.VerificationOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ProtocolVerifier
 * -----------------------------------------------------------------------------
 * Static well-formedness checks over a compiled {@link Cfg}.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Never mutates the graph; safe to share across threads</li>
 *   <li>Checks are independent and all run; diagnostics accumulate</li>
 *   <li>Diagnostics are ordered by check (see {@link DiagnosticCode}), then by
 *       node id, then by declared role order, so repeated calls on the same
 *       graph return equal reports</li>
 * </ul>
 *
 * A report is valid when it holds no {@link Severity#ERROR} diagnostic, or no
 * diagnostic at all in strict mode.
 *
 * <h2>Faults</h2>
 * A graph whose structure is inconsistent (a fork without a matching join, a
 * branch with fewer than two options, ...) is not something to diagnose; the
 * verifier throws {@link VerificationFault} before running any check.
 */
public final class ProtocolVerifier
{
    private final VerificationOptions options;
    private final List<VerificationCheck> checks;

    public ProtocolVerifier() {
        this(VerificationOptions.defaults());
    }

    public ProtocolVerifier(VerificationOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.checks = List.of(
                new ChoiceSubjectCheck(),
                new ChoiceDeterminismCheck(),
                new KnowledgeOfChoiceCheck(),
                new ParallelRaceCheck(),
                new ParallelEscapeCheck(),
                new RecursionGuardCheck(),
                new RoleCoverageCheck(),
                new ReachabilityCheck());
    }

    public VerificationOptions options() {
        return options;
    }

    public VerificationReport verify(Cfg cfg) {
        Objects.requireNonNull(cfg, "cfg");
        checkStructure(cfg);

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (VerificationCheck check : checks) {
            if (options.isEnabled(check.code())) {
                diagnostics.addAll(check.check(cfg));
            }
        }

        boolean valid = options.strictMode()
                ? diagnostics.isEmpty()
                : diagnostics.stream().noneMatch(Diagnostic::isError);
        return new VerificationReport(valid, diagnostics);
    }

    // ---------------------------------------------------------------------
    // Structural consistency
    // ---------------------------------------------------------------------

    private static void checkStructure(Cfg cfg) {
        if (cfg.node(cfg.initialNodeId()).type() != NodeType.INITIAL) {
            throw new VerificationFault("Start node is not an initial node", cfg.initialNodeId());
        }
        if (cfg.node(cfg.endNodeId()).type() != NodeType.END) {
            throw new VerificationFault("End node id does not name an end node", cfg.endNodeId());
        }

        for (CfgNode node : cfg.nodes()) {
            switch (node.type()) {
                case END -> {
                    if (!cfg.outgoing(node.id()).isEmpty()) {
                        throw new VerificationFault("End node has outgoing edges", node.id());
                    }
                }
                case BRANCH -> checkBranch(cfg, (BranchNode) node);
                case FORK -> checkFork(cfg, (ForkNode) node);
                default -> {
                }
            }
        }

        for (CfgEdge edge : cfg.edges()) {
            if (edge.type() == EdgeType.RECURSION_BACK && cfg.node(edge.to()).type() != NodeType.RECURSIVE) {
                throw new VerificationFault("Recursion-back edge " + edge.id()
                        + " does not target a recursive node", edge.from());
            }
        }
    }

    private static void checkBranch(Cfg cfg, BranchNode branch) {
        if (CfgAnalysis.optionEdges(cfg, branch.id(), EdgeType.CHOICE_BRANCH).size() < 2) {
            throw new VerificationFault("Branch node has fewer than two choice-branch edges", branch.id());
        }
        if (branch.mergeId() != null) {
            int mergeId = branch.mergeId();
            if (mergeId < 0 || mergeId >= cfg.nodeCount() || cfg.node(mergeId).type() != NodeType.MERGE) {
                throw new VerificationFault("Branch node refers to missing merge node " + mergeId, branch.id());
            }
        }
    }

    private static void checkFork(Cfg cfg, ForkNode fork) {
        if (CfgAnalysis.optionEdges(cfg, fork.id(), EdgeType.PARALLEL_BRANCH).size() < 2) {
            throw new VerificationFault("Fork node has fewer than two parallel-branch edges", fork.id());
        }
        int joinId = fork.joinId();
        if (joinId < 0 || joinId >= cfg.nodeCount()
                || !(cfg.node(joinId) instanceof JoinNode join)
                || !join.parallelId().equals(fork.parallelId())) {
            throw new VerificationFault("Fork " + fork.parallelId() + " has no matching join", fork.id());
        }
    }
}
