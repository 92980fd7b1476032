package com.questrail.choreography.verification;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.cfg.CfgEdge;
import com.questrail.choreography.cfg.CfgNode;
import com.questrail.choreography.cfg.CfgNode.RecursiveNode;
import com.questrail.choreography.cfg.NodeType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Every recursion must exchange at least one message before it can come back
 * to itself. Paths are walked from the recursion's body and stop at the first
 * action; reaching the recursive node again means the loop can spin silently.
 * Loop-back edges to other recursive nodes are not followed.
 */
public final class RecursionGuardCheck implements VerificationCheck
{
    @Override
    public DiagnosticCode code() {
        return DiagnosticCode.UNGUARDED_RECURSION;
    }

    @Override
    public List<Diagnostic> check(Cfg cfg) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (CfgNode node : cfg.nodes()) {
            if (node instanceof RecursiveNode rec && returnsSilently(cfg, rec)) {
                diagnostics.add(Diagnostic.at(code(), rec.id(),
                        "Recursion " + rec.label() + " can continue without exchanging a message"));
            }
        }
        return diagnostics;
    }

    private static boolean returnsSilently(Cfg cfg, RecursiveNode rec) {
        Set<Integer> visited = new HashSet<>();
        Deque<Integer> work = new ArrayDeque<>();
        for (CfgEdge edge : cfg.outgoing(rec.id())) {
            work.add(edge.to());
        }
        while (!work.isEmpty()) {
            int id = work.poll();
            if (id == rec.id()) {
                return true;
            }
            if (!visited.add(id) || cfg.node(id).type() == NodeType.ACTION) {
                continue;
            }
            for (CfgEdge edge : cfg.outgoing(id)) {
                // Jumps to other recursions are judged on their own label.
                if (cfg.isLoopBack(edge) && edge.to() != rec.id()) {
                    continue;
                }
                work.add(edge.to());
            }
        }
        return false;
    }
}
