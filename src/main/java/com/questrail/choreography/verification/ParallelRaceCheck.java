package com.questrail.choreography.verification;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.cfg.CfgEdge;
import com.questrail.choreography.cfg.CfgNode;
import com.questrail.choreography.cfg.CfgNode.ActionNode;
import com.questrail.choreography.cfg.CfgNode.ForkNode;
import com.questrail.choreography.cfg.EdgeType;
import com.questrail.choreography.model.Role;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Branches of one parallel region must not race on a shared role.
 *
 * <p>
 * A role is flagged when it sends in two or more branches, or when two or
 * more branches deliver it a message with the same label. Roles that only
 * receive distinct labels from different branches are fine: the labels
 * order nothing and cannot be confused.
 * </p>
 */
public final class ParallelRaceCheck implements VerificationCheck
{
    @Override
    public DiagnosticCode code() {
        return DiagnosticCode.PARALLEL_ROLE_RACE;
    }

    @Override
    public List<Diagnostic> check(Cfg cfg) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (CfgNode node : cfg.nodes()) {
            if (!(node instanceof ForkNode fork)) {
                continue;
            }
            List<CfgEdge> branches = CfgAnalysis.optionEdges(cfg, fork.id(), EdgeType.PARALLEL_BRANCH);

            // role -> branches it sends in; role -> label -> branches delivering it
            Map<Role, Set<Integer>> senders = new HashMap<>();
            Map<Role, Map<String, Set<Integer>>> receivers = new HashMap<>();
            for (int b = 0; b < branches.size(); b++) {
                for (int id : CfgAnalysis.region(cfg, branches.get(b), fork.joinId())) {
                    if (cfg.node(id) instanceof ActionNode action) {
                        senders.computeIfAbsent(action.action().from(), r -> new HashSet<>()).add(b);
                        receivers.computeIfAbsent(action.action().to(), r -> new HashMap<>())
                                .computeIfAbsent(action.action().label(), l -> new HashSet<>())
                                .add(b);
                    }
                }
            }

            for (Role role : cfg.roles()) {
                Set<Integer> sendingBranches = senders.getOrDefault(role, Set.of());
                if (sendingBranches.size() >= 2) {
                    diagnostics.add(Diagnostic.at(code(), fork.id(),
                            "Role " + role + " sends in " + sendingBranches.size()
                                    + " branches of parallel region " + fork.parallelId()));
                    continue;
                }
                Set<String> clashing = new TreeSet<>();
                for (Map.Entry<String, Set<Integer>> entry : receivers.getOrDefault(role, Map.of()).entrySet()) {
                    if (entry.getValue().size() >= 2) {
                        clashing.add(entry.getKey());
                    }
                }
                if (!clashing.isEmpty()) {
                    diagnostics.add(Diagnostic.at(code(), fork.id(),
                            "Role " + role + " receives " + String.join(", ", clashing)
                                    + " from several branches of parallel region " + fork.parallelId()));
                }
            }
        }
        return diagnostics;
    }
}
