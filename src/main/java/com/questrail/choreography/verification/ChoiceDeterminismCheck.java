package com.questrail.choreography.verification;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.cfg.CfgEdge;
import com.questrail.choreography.cfg.CfgNode;
import com.questrail.choreography.cfg.CfgNode.ActionNode;
import com.questrail.choreography.cfg.CfgNode.BranchNode;
import com.questrail.choreography.cfg.EdgeType;

import java.util.ArrayList;
import java.util.List;

/**
 * Two options of one choice must not start with the same message (same sender
 * and label); receivers could not tell which option was taken.
 */
public final class ChoiceDeterminismCheck implements VerificationCheck
{
    @Override
    public DiagnosticCode code() {
        return DiagnosticCode.CHOICE_DETERMINISM;
    }

    @Override
    public List<Diagnostic> check(Cfg cfg) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (CfgNode node : cfg.nodes()) {
            if (!(node instanceof BranchNode branch)) {
                continue;
            }
            List<CfgEdge> options = CfgAnalysis.optionEdges(cfg, branch.id(), EdgeType.CHOICE_BRANCH);
            List<List<ActionNode>> firsts = new ArrayList<>();
            for (CfgEdge option : options) {
                firsts.add(CfgAnalysis.firstActions(cfg, option, branch.id(), branch.mergeId()));
            }

            for (int i = 0; i < options.size(); i++) {
                for (int j = i + 1; j < options.size(); j++) {
                    ActionNode clash = sharedStart(firsts.get(i), firsts.get(j));
                    if (clash != null) {
                        diagnostics.add(Diagnostic.at(code(), branch.id(),
                                "Options " + options.get(i).label() + " and " + options.get(j).label()
                                        + " of choice at " + branch.at() + " both start with "
                                        + clash.action().from() + " sending " + clash.action().label()));
                    }
                }
            }
        }
        return diagnostics;
    }

    private static ActionNode sharedStart(List<ActionNode> left, List<ActionNode> right) {
        for (ActionNode a : left) {
            for (ActionNode b : right) {
                if (a.action().from().equals(b.action().from())
                        && a.action().label().equals(b.action().label())) {
                    return a;
                }
            }
        }
        return null;
    }
}
