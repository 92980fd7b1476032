package com.questrail.choreography.parser;

import com.questrail.choreography.model.Action;
import com.questrail.choreography.model.Choice;
import com.questrail.choreography.model.Continue;
import com.questrail.choreography.model.Interaction;
import com.questrail.choreography.model.Parallel;
import com.questrail.choreography.model.ProtocolDeclaration;
import com.questrail.choreography.model.ProtocolModule;
import com.questrail.choreography.model.Recursion;
import com.questrail.choreography.model.Role;
import com.questrail.choreography.model.Sequence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProtocolParserTest
 * -----------------------------------------------------------------------------
 * Grammar coverage for both message forms, structured statements, modules,
 * and every rejection the parser is responsible for.
 */
public class ProtocolParserTest {

    private static ProtocolDeclaration parseOne(String source) {
        ProtocolModule module = new ProtocolParser(source).parseModule();
        assertEquals(1, module.declarations().size());
        return module.declarations().get(0);
    }

    private static List<Interaction> bodyOf(String roles, String body) {
        ProtocolDeclaration declaration = parseOne("protocol P(" + roles + ") { " + body + " }");
        return ((Sequence) declaration.body()).items();
    }

    private static ParseException rejects(String source) {
        return assertThrows(ParseException.class, () -> new ProtocolParser(source).parseModule());
    }

    // ---------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------

    @Test
    void parsesHeaderWithOrderedRoles() {
        ProtocolDeclaration declaration = parseOne(
                "protocol RR(role Client, role Server) { Client -> Server: Request(); }");

        assertEquals("RR", declaration.name());
        assertFalse(declaration.global());
        assertEquals(List.of(Role.of("Client"), Role.of("Server")), declaration.roles());
        assertEquals(1, declaration.position().line());
    }

    @Test
    void globalModifierIsRecorded() {
        ProtocolDeclaration declaration = parseOne("global protocol G(role A, role B) { A -> B: M(); }");
        assertTrue(declaration.global());
    }

    @Test
    void moduleHoldsSeveralProtocolsInOrder() {
        ProtocolModule module = new ProtocolParser(
                "protocol First(role A, role B) { A -> B: One(); }\n"
                        + "// a second one\n"
                        + "global protocol Second(role X, role Y) { Two() from X to Y; }\n").parseModule();

        assertEquals(2, module.declarations().size());
        assertEquals("First", module.declarations().get(0).name());
        assertTrue(module.find("Second").isPresent());
        assertTrue(module.find("Third").isEmpty());
    }

    @Test
    void moduleRecordsImportsAndTypeAliases() {
        ProtocolModule module = new ProtocolParser(
                "import \"common/auth\" { Login, Logout };\n"
                        + "import \"common/types\";\n"
                        + "type Basket as List<Item>;\n"
                        + "protocol Shop(role Buyer, role Seller) { Buyer -> Seller: Checkout(Basket); }\n"
                        + "type Receipt as Map<String, Int>;\n").parseModule();

        assertEquals(2, module.imports().size());
        assertEquals("common/auth", module.imports().get(0).modulePath());
        assertEquals(List.of("Login", "Logout"), module.imports().get(0).importedNames());
        assertTrue(module.imports().get(1).importsAll());

        assertEquals(2, module.typeAliases().size());
        assertEquals("List<Item>", module.typeAlias("Basket").orElseThrow().type().render());
        assertEquals("Map<String, Int>", module.typeAlias("Receipt").orElseThrow().type().render());
        assertEquals(5, module.typeAlias("Receipt").orElseThrow().position().line());

        assertEquals(1, module.declarations().size());
        Action checkout = (Action) ((Sequence) module.declarations().get(0).body()).items().get(0);
        assertEquals("Basket", checkout.payloadType().render());
    }

    @Test
    void rejectsDuplicateTypeAlias() {
        ParseException e = rejects("type Id as Int; type Id as String;");

        assertEquals("Duplicate type 'Id'", e.problem());
        assertEquals(17, e.position().column());
    }

    @Test
    void rejectsMalformedModuleDeclarations() {
        assertTrue(rejects("import common;").problem().startsWith("Expected quoted module path"));
        assertTrue(rejects("import \"a\" { X, X };").problem().startsWith("Name 'X' imported twice"));
        assertTrue(rejects("import \"a\" { }").problem().startsWith("Expected imported name"));
        assertTrue(rejects("type Id Int;").problem().startsWith("Expected 'as'"));
        assertTrue(rejects("role A;").problem().startsWith("Expected 'protocol', 'type' or 'import'"));
    }

    @Test
    void emptySourceIsEmptyModule() {
        assertTrue(new ProtocolParser("/* nothing */").parseModule().isEmpty());
    }

    @Test
    void emptyBodyIsEmptySequence() {
        ProtocolDeclaration declaration = parseOne("protocol E(role A, role B) { }");
        assertTrue(((Sequence) declaration.body()).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Messages
    // ---------------------------------------------------------------------

    @Test
    void arrowAndKeywordFormsAreEquivalent() {
        Action arrow = (Action) bodyOf("role A, role B", "A -> B: Hello(String);").get(0);
        Action keyword = (Action) bodyOf("role A, role B", "Hello(String) from A to B;").get(0);

        assertEquals(arrow.from(), keyword.from());
        assertEquals(arrow.to(), keyword.to());
        assertEquals(arrow.label(), keyword.label());
        assertEquals(arrow.payloadType(), keyword.payloadType());
        assertEquals("A -> B: Hello(String)", arrow.toString());
    }

    @Test
    void emptyPayloadIsAbsent() {
        Action action = (Action) bodyOf("role A, role B", "A -> B: Ping();").get(0);
        assertTrue(action.payload().isEmpty());
    }

    @Test
    void parametricPayloadKeepsItsStructure() {
        Action action = (Action) bodyOf("role A, role B", "A -> B: Order(Map<Key, List<Item>>);").get(0);

        assertTrue(action.payloadType().isParametric());
        assertEquals(2, action.payloadType().arguments().size());
        assertEquals("Map<Key, List<Item>>", action.payloadType().render());
    }

    @Test
    void multicastDesugarsIntoConsecutiveActions() {
        List<Interaction> arrow = bodyOf("role A, role B, role C", "A -> B, C: News();");
        List<Interaction> keyword = bodyOf("role A, role B, role C", "News() from A to C, B;");

        assertEquals(2, arrow.size());
        assertEquals(Role.of("B"), ((Action) arrow.get(0)).to());
        assertEquals(Role.of("C"), ((Action) arrow.get(1)).to());

        assertEquals(2, keyword.size());
        assertEquals(Role.of("C"), ((Action) keyword.get(0)).to());
        assertEquals(Role.of("B"), ((Action) keyword.get(1)).to());
    }

    // ---------------------------------------------------------------------
    // Structured statements
    // ---------------------------------------------------------------------

    @Test
    void parsesChoiceWithOptionsInOrder() {
        Choice choice = (Choice) bodyOf("role A, role B",
                "choice at A { A -> B: Opt1(); } or { A -> B: Opt2(); } or { A -> B: Opt3(); }").get(0);

        assertEquals(Role.of("A"), choice.at());
        assertEquals(3, choice.options().size());
        Action third = (Action) ((Sequence) choice.options().get(2)).items().get(0);
        assertEquals("Opt3", third.label());
    }

    @Test
    void parsesParallelBranches() {
        Parallel parallel = (Parallel) bodyOf("role A, role B, role C",
                "par { A -> B: M1(); } and { C -> B: M2(); }").get(0);

        assertEquals(2, parallel.branches().size());
    }

    @Test
    void parsesRecursionWithContinue() {
        Recursion rec = (Recursion) bodyOf("role A, role B",
                "rec Loop { A -> B: Data(); continue Loop; }").get(0);

        assertEquals("Loop", rec.label());
        List<Interaction> body = ((Sequence) rec.body()).items();
        assertEquals(Interaction.Kind.ACTION, body.get(0).kind());
        assertEquals("Loop", ((Continue) body.get(1)).label());
    }

    @Test
    void continueMayTargetAnOuterRecursion() {
        Recursion outer = (Recursion) bodyOf("role A, role B",
                "rec Outer { rec Inner { A -> B: X(); continue Outer; } }").get(0);

        Recursion inner = (Recursion) ((Sequence) outer.body()).items().get(0);
        assertEquals("Inner", inner.label());
    }

    // ---------------------------------------------------------------------
    // Rejections
    // ---------------------------------------------------------------------

    @Test
    void undeclaredRoleIsNamedWithItsPosition() {
        ParseException e = rejects("protocol P(role A, role B) { A -> C: M(); }");

        assertEquals("Undeclared role 'C'", e.problem());
        assertEquals(1, e.position().line());
        assertEquals(35, e.position().column());
    }

    @Test
    void undeclaredRoleInKeywordFormAndChoice() {
        assertTrue(rejects("protocol P(role A, role B) { M() from Z to B; }").getMessage().contains("'Z'"));
        assertTrue(rejects("protocol P(role A, role B) { choice at Q { A -> B: X(); } or { A -> B: Y(); } }")
                .getMessage().contains("'Q'"));
    }

    @Test
    void continueWithoutMatchingRecursionIsRejected() {
        assertTrue(rejects("protocol P(role A, role B) { continue L; }").problem().contains("no enclosing rec"));
        assertTrue(rejects("protocol P(role A, role B) { rec L { A -> B: X(); continue M; } }")
                .problem().contains("continue M"));
    }

    @Test
    void continueOutsideItsRecursionIsRejected() {
        rejects("protocol P(role A, role B) { rec L { A -> B: X(); } continue L; }");
    }

    @Test
    void singleAlternativeChoiceOrParallelIsRejected() {
        assertTrue(rejects("protocol P(role A, role B) { choice at A { A -> B: X(); } }")
                .problem().contains("at least two options"));
        assertTrue(rejects("protocol P(role A, role B) { par { A -> B: X(); } }")
                .problem().contains("at least two branches"));
    }

    @Test
    void duplicateRoleIsRejected() {
        assertEquals("Duplicate role 'A'", rejects("protocol P(role A, role A) { }").problem());
    }

    @Test
    void duplicateProtocolNameIsRejected() {
        ParseException e = rejects("protocol P(role A, role B) { }\nprotocol P(role A, role B) { }");

        assertEquals("Duplicate protocol 'P'", e.problem());
        assertEquals(2, e.position().line());
    }

    @Test
    void selfMessageIsRejected() {
        assertTrue(rejects("protocol P(role A, role B) { A -> A: Echo(); }").problem().contains("itself"));
    }

    @Test
    void repeatedMulticastReceiverIsRejected() {
        assertTrue(rejects("protocol P(role A, role B, role C) { A -> B, C, B: M(); }")
                .problem().contains("listed twice"));
    }

    @Test
    void missingSemicolonReportsFoundToken() {
        ParseException e = rejects("protocol P(role A, role B) { A -> B: M() }");
        assertTrue(e.problem().startsWith("Expected ';' after message"));
        assertTrue(e.problem().contains("'}'"));
    }

    @Test
    void unexpectedEndOfInput() {
        assertTrue(rejects("protocol P(role A, role B) { A -> B: M();").problem().contains("end of input"));
    }

    @Test
    void statementMustStartWithMessageOrKeyword() {
        rejects("protocol P(role A, role B) { A B; }");
        rejects("protocol P(role A, role B) { ; }");
    }
}
