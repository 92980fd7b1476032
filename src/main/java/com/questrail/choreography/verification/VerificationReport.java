package com.questrail.choreography.verification;

import java.util.List;
import java.util.Objects;

/**
 * Result of verifying one CFG. Diagnostics are data, not faults: an invalid
 * report is a normal outcome.
 *
 * @param valid       true when no diagnostic makes the protocol ill-formed
 * @param diagnostics every finding, in check order, then node order
 */
public record VerificationReport(boolean valid, List<Diagnostic> diagnostics)
{
    public VerificationReport {
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    public List<Diagnostic> withCode(DiagnosticCode code) {
        return diagnostics.stream().filter(d -> d.code() == code).toList();
    }

    public boolean has(DiagnosticCode code) {
        return diagnostics.stream().anyMatch(d -> d.code() == code);
    }
}
