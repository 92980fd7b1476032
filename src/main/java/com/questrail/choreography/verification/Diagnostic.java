package com.questrail.choreography.verification;

import java.util.Objects;
import java.util.Optional;

/**
 * One verifier finding.
 *
 * @param nodeId the CFG node the finding is anchored on, or {@code null}
 */
public record Diagnostic(DiagnosticCode code, Severity severity, String message, Integer nodeId)
{
    public Diagnostic {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }

    public static Diagnostic at(DiagnosticCode code, int nodeId, String message) {
        return new Diagnostic(code, code.defaultSeverity(), message, nodeId);
    }

    public static Diagnostic global(DiagnosticCode code, String message) {
        return new Diagnostic(code, code.defaultSeverity(), message, null);
    }

    public Optional<Integer> node() {
        return Optional.ofNullable(nodeId);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + code + (nodeId == null ? "" : " @n" + nodeId) + ": " + message;
    }
}
