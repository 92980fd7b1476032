package com.questrail.choreography.verification;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.cfg.CfgNode;
import com.questrail.choreography.cfg.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Warns about nodes no execution can reach, typically statements written
 * after a loop that never exits. The end node is exempt: a protocol that
 * loops forever is legitimate.
 */
public final class ReachabilityCheck implements VerificationCheck
{
    @Override
    public DiagnosticCode code() {
        return DiagnosticCode.UNREACHABLE_NODE;
    }

    @Override
    public List<Diagnostic> check(Cfg cfg) {
        Set<Integer> reached = CfgAnalysis.reachableFromInitial(cfg);
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (CfgNode node : cfg.nodes()) {
            if (node.type() != NodeType.END && !reached.contains(node.id())) {
                diagnostics.add(Diagnostic.at(code(), node.id(),
                        "Node " + node.id() + " (" + node.type() + ") is unreachable"));
            }
        }
        return diagnostics;
    }
}
