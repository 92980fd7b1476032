package com.questrail.choreography.verification;

import com.questrail.choreography.api.Choreography;
import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.cfg.CfgEdge;
import com.questrail.choreography.cfg.CfgNode.ActionNode;
import com.questrail.choreography.cfg.CfgNode.EndNode;
import com.questrail.choreography.cfg.CfgNode.ForkNode;
import com.questrail.choreography.cfg.CfgNode.InitialNode;
import com.questrail.choreography.cfg.EdgeType;
import com.questrail.choreography.config.VerificationOptions;
import com.questrail.choreography.model.Action;
import com.questrail.choreography.model.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * One protocol per diagnostic code, plus report validity rules and
 * structural faults on hand-built graphs.
 */
public class ProtocolVerifierTest {

    private ProtocolVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new ProtocolVerifier();
    }

    private static Cfg compile(String source) {
        return Choreography.compile(Choreography.parseProtocol(source));
    }

    private VerificationReport verify(String source) {
        return verifier.verify(compile(source));
    }

    // ---------------------------------------------------------------------
    // Well-formed protocols
    // ---------------------------------------------------------------------

    @Test
    void requestResponseIsValid() {
        VerificationReport report = verify(
                "protocol RR(role Client, role Server) { Client -> Server: Request(); Server -> Client: Response(); }");

        assertTrue(report.valid());
        assertTrue(report.diagnostics().isEmpty());
    }

    @Test
    void guardedLoopIsValid() {
        VerificationReport report = verify("protocol L(role A, role B) { rec L { A -> B: Data(); continue L; } }");

        assertTrue(report.valid());
        assertTrue(report.diagnostics().isEmpty());
    }

    @Test
    void parallelWithDistinctLabelsIsValid() {
        VerificationReport report = verify(
                "protocol D(role A, role B, role C) { par { A -> B: M1(); } and { C -> B: M2(); } }");

        assertTrue(report.valid(), () -> report.diagnostics().toString());
    }

    @Test
    void deciderForwardingItsChoiceIsValid() {
        VerificationReport report = verify("protocol K(role A, role B, role C) {"
                + " choice at A { A -> B: X(); A -> C: Go(); } or { A -> B: Y(); A -> C: Stop(); } }");

        assertTrue(report.valid(), () -> report.diagnostics().toString());
    }

    // ---------------------------------------------------------------------
    // Choice checks
    // ---------------------------------------------------------------------

    @Test
    void optionStartedByAnotherRoleIsFlagged() {
        VerificationReport report = verify("protocol S(role A, role B) {"
                + " choice at A { A -> B: X(); } or { B -> A: Y(); } }");

        assertFalse(report.valid());
        List<Diagnostic> subject = report.withCode(DiagnosticCode.CHOICE_SUBJECT_MISMATCH);
        assertEquals(1, subject.size());
        assertEquals(1, subject.get(0).nodeId());
        assertTrue(subject.get(0).message().contains("branch2"));
        assertEquals(Severity.ERROR, subject.get(0).severity());
    }

    @Test
    void optionsWithSameFirstMessageAreFlagged() {
        VerificationReport report = verify("protocol N(role A, role B) {"
                + " choice at A { A -> B: Go(); A -> B: X(); } or { A -> B: Go(); A -> B: Y(); } }");

        assertFalse(report.valid());
        List<Diagnostic> clash = report.withCode(DiagnosticCode.CHOICE_DETERMINISM);
        assertEquals(1, clash.size());
        assertTrue(clash.get(0).message().contains("Go"));
    }

    @Test
    void uninformedThirdPartyIsFlagged() {
        VerificationReport report = verify("protocol K(role A, role B, role C) {"
                + " choice at A { A -> B: X(); B -> C: Go(); } or { A -> B: Y(); B -> C: Go(); } }");

        assertFalse(report.valid());
        assertEquals(1, report.diagnostics().size());
        Diagnostic diagnostic = report.diagnostics().get(0);
        assertEquals(DiagnosticCode.KNOWLEDGE_OF_CHOICE, diagnostic.code());
        assertTrue(diagnostic.message().startsWith("Role C"));
    }

    @Test
    void thirdPartySendingBeforeLearningIsFlagged() {
        VerificationReport report = verify("protocol K(role A, role B, role C) {"
                + " choice at A { A -> B: X(); C -> B: Hint(); } or { A -> B: Y(); A -> C: Info(); } }");

        List<Diagnostic> knowledge = report.withCode(DiagnosticCode.KNOWLEDGE_OF_CHOICE);
        assertEquals(1, knowledge.size());
        assertTrue(knowledge.get(0).message().contains("sends Hint"));
    }

    @Test
    void thirdPartyLearningAfterNestedParallelIsFlagged() {
        VerificationReport report = verify("protocol P(role A, role B, role C, role D, role E) {"
                + " choice at A {"
                + " A -> B: X(); par { B -> D: Y(); } and { A -> E: W(); } A -> C: Z();"
                + " } or {"
                + " A -> B: X2(); B -> D: Y2(); A -> E: W2(); A -> C: Z(); } }");

        assertFalse(report.valid());
        assertEquals(1, report.diagnostics().size(), () -> report.diagnostics().toString());
        Diagnostic diagnostic = report.diagnostics().get(0);
        assertEquals(DiagnosticCode.KNOWLEDGE_OF_CHOICE, diagnostic.code());
        assertTrue(diagnostic.message().startsWith("Role C"));
        assertTrue(diagnostic.message().contains("both first deliver Z"));
    }

    @Test
    void optionStartingWithParallelChecksEveryBranch() {
        VerificationReport report = verify("protocol S(role A, role B, role C) {"
                + " choice at A { par { A -> B: X(); } and { B -> C: Y(); } } or { A -> B: Z(); } }");

        List<Diagnostic> subject = report.withCode(DiagnosticCode.CHOICE_SUBJECT_MISMATCH);
        assertEquals(1, subject.size());
        assertTrue(subject.get(0).message().contains("branch1"));
        assertTrue(subject.get(0).message().contains("sent by B"));
    }

    @Test
    void nestedChoiceOffersEveryInnerOptionAsFirstMessage() {
        VerificationReport report = verify("protocol Q(role A, role B, role C) {"
                + " choice at A { A -> B: X(); choice at B { B -> C: Go(); } or { B -> C: Stop(); } }"
                + " or { A -> B: Y(); B -> C: Go(); } }");

        assertEquals(1, report.diagnostics().size(), () -> report.diagnostics().toString());
        Diagnostic diagnostic = report.diagnostics().get(0);
        assertEquals(DiagnosticCode.KNOWLEDGE_OF_CHOICE, diagnostic.code());
        assertEquals(1, diagnostic.nodeId());
        assertTrue(diagnostic.message().startsWith("Role C"));
        assertTrue(diagnostic.message().contains("both first deliver Go"));
    }

    @Test
    void optionStartingWithContinueStartsWithLoopBody() {
        VerificationReport distinct = verify("protocol U(role A, role B) {"
                + " rec L { A -> B: Ping(); choice at A { continue L; } or { A -> B: Stop(); } } }");
        VerificationReport clashing = verify("protocol U(role A, role B) {"
                + " rec L { A -> B: Ping(); choice at A { continue L; } or { A -> B: Ping(); } } }");

        assertTrue(distinct.valid(), () -> distinct.diagnostics().toString());
        assertEquals(1, clashing.diagnostics().size(), () -> clashing.diagnostics().toString());
        Diagnostic clash = clashing.diagnostics().get(0);
        assertEquals(DiagnosticCode.CHOICE_DETERMINISM, clash.code());
        assertTrue(clash.message().contains("sending Ping"));
    }

    // ---------------------------------------------------------------------
    // Parallel checks
    // ---------------------------------------------------------------------

    @Test
    void roleSendingInTwoBranchesIsFlagged() {
        VerificationReport report = verify("protocol R(role A, role B, role C) {"
                + " par { A -> B: X(); } and { A -> C: Y(); } }");

        assertEquals(1, report.diagnostics().size());
        Diagnostic race = report.diagnostics().get(0);
        assertEquals(DiagnosticCode.PARALLEL_ROLE_RACE, race.code());
        assertEquals(1, race.nodeId());
        assertTrue(race.message().startsWith("Role A sends in 2 branches"));
    }

    @Test
    void sameLabelDeliveredFromTwoBranchesIsFlagged() {
        VerificationReport report = verify("protocol R(role A, role B, role C) {"
                + " par { A -> C: M(); } and { B -> C: M(); } }");

        assertEquals(1, report.diagnostics().size());
        assertTrue(report.diagnostics().get(0).message().startsWith("Role C receives M"));
    }

    @Test
    void continueLeavingParallelRegionIsFlagged() {
        VerificationReport report = verify("protocol E(role A, role B, role C, role D) {"
                + " rec L { par { A -> B: X(); continue L; } and { C -> D: Y(); } } }");

        assertEquals(1, report.diagnostics().size());
        Diagnostic escape = report.diagnostics().get(0);
        assertEquals(DiagnosticCode.PARALLEL_ESCAPE, escape.code());
        assertTrue(escape.message().contains("continues L"));
    }

    // ---------------------------------------------------------------------
    // Recursion, roles, reachability
    // ---------------------------------------------------------------------

    @Test
    void loopWithoutMessageIsFlagged() {
        VerificationReport report = verify("protocol U(role A, role B) { A -> B: Hello(); rec L { continue L; } }");

        assertFalse(report.valid());
        assertEquals(1, report.diagnostics().size());
        Diagnostic unguarded = report.diagnostics().get(0);
        assertEquals(DiagnosticCode.UNGUARDED_RECURSION, unguarded.code());
        assertEquals(2, unguarded.nodeId());
    }

    @Test
    void loopThroughSilentOptionIsFlagged() {
        VerificationReport report = verify("protocol U(role A, role B) {"
                + " rec L { choice at A { continue L; } or { A -> B: Stop(); } } }");

        assertTrue(report.has(DiagnosticCode.UNGUARDED_RECURSION));
    }

    @Test
    void onlyTheSilentlyReenteredRecursionIsFlagged() {
        VerificationReport report = verify("protocol N(role A, role B) {"
                + " rec L { rec M { choice at A { A -> B: X(); continue M; } or { continue L; } } } }");

        List<Diagnostic> unguarded = report.withCode(DiagnosticCode.UNGUARDED_RECURSION);
        assertEquals(1, unguarded.size());
        assertEquals(1, unguarded.get(0).nodeId());
        assertTrue(unguarded.get(0).message().startsWith("Recursion L"));
    }

    @Test
    void unusedRoleIsReportedGlobally() {
        VerificationReport report = verify("protocol U(role A, role B, role C) { A -> B: X(); }");

        assertFalse(report.valid());
        assertEquals(1, report.diagnostics().size());
        Diagnostic unused = report.diagnostics().get(0);
        assertEquals(DiagnosticCode.UNUSED_ROLE, unused.code());
        assertTrue(unused.node().isEmpty());
        assertTrue(unused.message().contains("Role C"));
    }

    @Test
    void codeAfterEndlessLoopIsWarnedButValid() {
        String source = "protocol W(role A, role B) { rec L { A -> B: X(); continue L; } A -> B: Y(); }";

        VerificationReport report = verify(source);

        assertTrue(report.valid());
        assertEquals(1, report.warnings().size());
        assertTrue(report.errors().isEmpty());
        Diagnostic warning = report.warnings().get(0);
        assertEquals(DiagnosticCode.UNREACHABLE_NODE, warning.code());
        assertEquals(Severity.WARNING, warning.severity());
        assertEquals(3, warning.nodeId());
    }

    @Test
    void strictModeRejectsWarnings() {
        ProtocolVerifier strict = new ProtocolVerifier(VerificationOptions.builder().withStrictMode(true).build());

        VerificationReport report = strict.verify(
                compile("protocol W(role A, role B) { rec L { A -> B: X(); continue L; } A -> B: Y(); }"));

        assertFalse(report.valid());
        assertEquals(1, report.diagnostics().size());
    }

    // ---------------------------------------------------------------------
    // Options and report shape
    // ---------------------------------------------------------------------

    @Test
    void disabledCheckIsSkipped() {
        ProtocolVerifier lenient = new ProtocolVerifier(
                VerificationOptions.builder().withoutCheck(DiagnosticCode.UNUSED_ROLE).build());

        VerificationReport report = lenient.verify(compile("protocol U(role A, role B, role C) { A -> B: X(); }"));

        assertTrue(report.valid());
        assertTrue(report.diagnostics().isEmpty());
    }

    @Test
    void onlySelectedChecksRun() {
        ProtocolVerifier narrow = new ProtocolVerifier(VerificationOptions.builder()
                .withOnlyChecks(EnumSet.of(DiagnosticCode.UNUSED_ROLE))
                .build());

        VerificationReport report = narrow.verify(compile("protocol M(role A, role B, role C) {"
                + " choice at A { B -> A: X(); } or { A -> B: Y(); } }"));

        assertEquals(1, report.diagnostics().size());
        assertEquals(DiagnosticCode.UNUSED_ROLE, report.diagnostics().get(0).code());
    }

    @Test
    void diagnosticsFollowCheckOrder() {
        VerificationReport report = verify("protocol M(role A, role B, role C) {"
                + " choice at A { B -> A: X(); } or { A -> B: Y(); } }");

        assertTrue(report.has(DiagnosticCode.CHOICE_SUBJECT_MISMATCH));
        assertTrue(report.has(DiagnosticCode.UNUSED_ROLE));
        List<Diagnostic> diagnostics = report.diagnostics();
        for (int i = 1; i < diagnostics.size(); i++) {
            assertTrue(diagnostics.get(i - 1).code().ordinal() <= diagnostics.get(i).code().ordinal(),
                    () -> "out of order: " + diagnostics);
        }
        assertEquals(DiagnosticCode.UNUSED_ROLE, diagnostics.get(diagnostics.size() - 1).code());
    }

    @Test
    void verifyingTwiceGivesEqualReports() {
        Cfg cfg = compile("protocol R(role A, role B, role C) {"
                + " par { A -> C: M(); } and { B -> C: M(); } A -> B: Done(); }");

        assertEquals(verifier.verify(cfg), verifier.verify(cfg));
    }

    // ---------------------------------------------------------------------
    // Structural faults
    // ---------------------------------------------------------------------

    @Test
    void forkWithoutJoinIsAFault() {
        Cfg cfg = new Cfg("Broken", List.of(Role.of("A"), Role.of("B")),
                List.of(new InitialNode(0),
                        new ForkNode(1, "par1", 2),
                        new ActionNode(2, Action.of("A", "B", "X")),
                        new ActionNode(3, Action.of("A", "B", "Y")),
                        new EndNode(4)),
                List.of(new CfgEdge(0, 0, 1, EdgeType.EPSILON, null),
                        new CfgEdge(1, 1, 2, EdgeType.PARALLEL_BRANCH, "branch1"),
                        new CfgEdge(2, 1, 3, EdgeType.PARALLEL_BRANCH, "branch2"),
                        new CfgEdge(3, 2, 4, EdgeType.SEQUENTIAL, null),
                        new CfgEdge(4, 3, 4, EdgeType.SEQUENTIAL, null)),
                0, 4);

        VerificationFault fault = assertThrows(VerificationFault.class, () -> verifier.verify(cfg));
        assertEquals(1, fault.nodeId());
    }

    @Test
    void endWithOutgoingEdgeIsAFault() {
        Cfg cfg = new Cfg("Broken", List.of(Role.of("A"), Role.of("B")),
                List.of(new InitialNode(0), new ActionNode(1, Action.of("A", "B", "X")), new EndNode(2)),
                List.of(new CfgEdge(0, 0, 1, EdgeType.EPSILON, null),
                        new CfgEdge(1, 1, 2, EdgeType.SEQUENTIAL, null),
                        new CfgEdge(2, 2, 1, EdgeType.SEQUENTIAL, null)),
                0, 2);

        VerificationFault fault = assertThrows(VerificationFault.class, () -> verifier.verify(cfg));
        assertEquals(2, fault.nodeId());
        assertTrue(fault.getMessage().contains("(node 2)"));
    }
}
