package com.questrail.choreography.verification;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.cfg.CfgEdge;
import com.questrail.choreography.cfg.CfgNode;
import com.questrail.choreography.cfg.CfgNode.ActionNode;
import com.questrail.choreography.cfg.CfgNode.BranchNode;
import com.questrail.choreography.cfg.EdgeType;
import com.questrail.choreography.model.Role;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * KnowledgeOfChoiceCheck
 * -----------------------------------------------------------------------------
 * Every role other than the decider that takes part in two or more options of
 * a choice must learn which option is active from the first message it sees.
 *
 * <h2>Rule</h2>
 * For each such role, the first actions involving it in each option are
 * collected (walking the option region, stepping over unrelated actions).
 * The role is flagged when
 * <ul>
 *   <li>its first involvement in some option is a send, or</li>
 *   <li>two options can deliver it a first message with the same label</li>
 * </ul>
 */
public final class KnowledgeOfChoiceCheck implements VerificationCheck
{
    @Override
    public DiagnosticCode code() {
        return DiagnosticCode.KNOWLEDGE_OF_CHOICE;
    }

    @Override
    public List<Diagnostic> check(Cfg cfg) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (CfgNode node : cfg.nodes()) {
            if (!(node instanceof BranchNode branch)) {
                continue;
            }
            List<CfgEdge> options = CfgAnalysis.optionEdges(cfg, branch.id(), EdgeType.CHOICE_BRANCH);
            for (Role role : cfg.roles()) {
                if (role.equals(branch.at())) {
                    continue;
                }
                String problem = problemFor(cfg, branch, options, role);
                if (problem != null) {
                    diagnostics.add(Diagnostic.at(code(), branch.id(),
                            "Role " + role + " cannot tell the options of choice at " + branch.at()
                                    + " apart: " + problem));
                }
            }
        }
        return diagnostics;
    }

    private static String problemFor(Cfg cfg, BranchNode branch, List<CfgEdge> options, Role role) {
        List<CfgEdge> involved = new ArrayList<>();
        List<List<ActionNode>> firsts = new ArrayList<>();
        for (CfgEdge option : options) {
            List<ActionNode> first = CfgAnalysis.firstRelevantActions(cfg, option, branch.mergeId(),
                    action -> action.action().involves(role));
            if (!first.isEmpty()) {
                involved.add(option);
                firsts.add(first);
            }
        }
        if (involved.size() < 2) {
            return null;
        }

        for (int i = 0; i < involved.size(); i++) {
            for (ActionNode action : firsts.get(i)) {
                if (action.action().from().equals(role)) {
                    return "in option " + involved.get(i).label() + " it sends "
                            + action.action().label() + " before receiving anything";
                }
            }
        }

        for (int i = 0; i < involved.size(); i++) {
            Set<String> left = labels(firsts.get(i));
            for (int j = i + 1; j < involved.size(); j++) {
                for (String label : labels(firsts.get(j))) {
                    if (left.contains(label)) {
                        return "options " + involved.get(i).label() + " and " + involved.get(j).label()
                                + " both first deliver " + label;
                    }
                }
            }
        }
        return null;
    }

    private static Set<String> labels(List<ActionNode> actions) {
        Set<String> labels = new TreeSet<>();
        for (ActionNode action : actions) {
            labels.add(action.action().label());
        }
        return labels;
    }
}
