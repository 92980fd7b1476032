package com.questrail.choreography.verification;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.cfg.CfgNode;
import com.questrail.choreography.cfg.CfgNode.ActionNode;
import com.questrail.choreography.model.Role;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Every declared role must send or receive at least one message.
 */
public final class RoleCoverageCheck implements VerificationCheck
{
    @Override
    public DiagnosticCode code() {
        return DiagnosticCode.UNUSED_ROLE;
    }

    @Override
    public List<Diagnostic> check(Cfg cfg) {
        Set<Role> used = new HashSet<>();
        for (CfgNode node : cfg.nodes()) {
            if (node instanceof ActionNode action) {
                used.add(action.action().from());
                used.add(action.action().to());
            }
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Role role : cfg.roles()) {
            if (!used.contains(role)) {
                diagnostics.add(Diagnostic.global(code(),
                        "Role " + role + " is declared but never sends or receives"));
            }
        }
        return diagnostics;
    }
}
