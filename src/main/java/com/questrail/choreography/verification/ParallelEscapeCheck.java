package com.questrail.choreography.verification;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.cfg.CfgEdge;
import com.questrail.choreography.cfg.CfgNode;
import com.questrail.choreography.cfg.CfgNode.ForkNode;
import com.questrail.choreography.cfg.CfgNode.RecursiveNode;
import com.questrail.choreography.cfg.EdgeType;

import java.util.ArrayList;
import java.util.List;

/**
 * A parallel branch must not jump to a recursion declared outside its region;
 * such a branch never reaches the join.
 */
public final class ParallelEscapeCheck implements VerificationCheck
{
    @Override
    public DiagnosticCode code() {
        return DiagnosticCode.PARALLEL_ESCAPE;
    }

    @Override
    public List<Diagnostic> check(Cfg cfg) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (CfgNode node : cfg.nodes()) {
            if (!(node instanceof ForkNode fork)) {
                continue;
            }
            for (CfgEdge branch : CfgAnalysis.optionEdges(cfg, fork.id(), EdgeType.PARALLEL_BRANCH)) {
                for (CfgEdge jump : CfgAnalysis.loopBacksOf(cfg, branch, fork.joinId())) {
                    // Recursive nodes inside the region are allocated after the fork.
                    if (jump.to() < fork.id()) {
                        String label = cfg.node(jump.to(), RecursiveNode.class).label();
                        diagnostics.add(Diagnostic.at(code(), fork.id(),
                                "Branch " + branch.label() + " of parallel region " + fork.parallelId()
                                        + " continues " + label + " outside the region"));
                        break;
                    }
                }
            }
        }
        return diagnostics;
    }
}
