package com.questrail.choreography.verification;

/**
 * Diagnostic codes, one per verifier check, declared in the order the checks run.
 */
public enum DiagnosticCode
{
    /** An option of a choice does not start with a message sent by the deciding role. */
    CHOICE_SUBJECT_MISMATCH(Severity.ERROR),
    /** Two options of one choice start with the same sender and label. */
    CHOICE_DETERMINISM(Severity.ERROR),
    /** A role taking part in several options cannot tell them apart from its first message. */
    KNOWLEDGE_OF_CHOICE(Severity.ERROR),
    /** Two branches of one parallel region race on a shared role. */
    PARALLEL_ROLE_RACE(Severity.ERROR),
    /** A parallel branch jumps out of its region without reaching the join. */
    PARALLEL_ESCAPE(Severity.ERROR),
    /** A recursion can loop back to itself without exchanging a message. */
    UNGUARDED_RECURSION(Severity.ERROR),
    /** A declared role never sends or receives. */
    UNUSED_ROLE(Severity.ERROR),
    /** A node cannot be reached from the initial node. */
    UNREACHABLE_NODE(Severity.WARNING);

    private final Severity defaultSeverity;

    DiagnosticCode(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }
}
