package com.questrail.choreography.verification;

import com.questrail.choreography.cfg.Cfg;

import java.util.List;

/**
 * One independent well-formedness rule. A check never mutates the graph and
 * reports its findings in node order.
 */
public interface VerificationCheck
{
    /**
     * The code every diagnostic of this check carries.
     */
    DiagnosticCode code();

    List<Diagnostic> check(Cfg cfg);
}
