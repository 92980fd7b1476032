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
 * Every option of a choice must start with a message sent by the deciding
 * role, otherwise the decision is not observable where it is made.
 */
public final class ChoiceSubjectCheck implements VerificationCheck
{
    @Override
    public DiagnosticCode code() {
        return DiagnosticCode.CHOICE_SUBJECT_MISMATCH;
    }

    @Override
    public List<Diagnostic> check(Cfg cfg) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (CfgNode node : cfg.nodes()) {
            if (!(node instanceof BranchNode branch)) {
                continue;
            }
            for (CfgEdge option : CfgAnalysis.optionEdges(cfg, branch.id(), EdgeType.CHOICE_BRANCH)) {
                List<ActionNode> first = CfgAnalysis.firstActions(cfg, option, branch.id(), branch.mergeId());
                if (first.isEmpty()) {
                    diagnostics.add(Diagnostic.at(code(), branch.id(),
                            "Option " + option.label() + " of choice at " + branch.at()
                                    + " starts with no message from " + branch.at()));
                    continue;
                }
                for (ActionNode action : first) {
                    if (!action.action().from().equals(branch.at())) {
                        diagnostics.add(Diagnostic.at(code(), branch.id(),
                                "Option " + option.label() + " of choice at " + branch.at()
                                        + " starts with " + action.action() + " sent by "
                                        + action.action().from()));
                        break;
                    }
                }
            }
        }
        return diagnostics;
    }
}
