package com.questrail.choreography.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InteractionModelTest {

    @Test
    void actionRendersSurfaceSyntax() {
        Action plain = Action.of("A", "B", "Ping");
        Action typed = new Action(Role.of("Buyer"), Role.of("Seller"), "Order",
                TypeRef.parametric("Map", TypeRef.simple("String"), TypeRef.parametric("List", TypeRef.simple("Item"))),
                SourcePosition.of(3, 5, 40));

        assertEquals("A -> B: Ping()", plain.toString());
        assertEquals("Buyer -> Seller: Order(Map<String, List<Item>>)", typed.toString());
        assertTrue(plain.payload().isEmpty());
        assertTrue(typed.involves(Role.of("Seller")));
        assertFalse(typed.involves(Role.of("Bank")));
    }

    @Test
    void choiceAndParallelNeedTwoAlternatives() {
        Action only = Action.of("A", "B", "X");

        assertThrows(IllegalArgumentException.class, () -> Choice.at("A", only));
        assertThrows(IllegalArgumentException.class, () -> Parallel.of(only));
        assertEquals(2, Choice.at("A", only, Sequence.of()).options().size());
    }

    @Test
    void blankRoleNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Role.of(" "));
        assertThrows(NullPointerException.class, () -> Role.of(null));
    }

    @Test
    void moduleFindsDeclarationByName() {
        ProtocolDeclaration first = ProtocolDeclaration.of("First", List.of(Role.of("A"), Role.of("B")),
                Action.of("A", "B", "X"));
        ProtocolDeclaration second = ProtocolDeclaration.of("Second", List.of(Role.of("A"), Role.of("B")),
                Recursion.of("L", Sequence.of(Action.of("A", "B", "Y"), Continue.of("L"))));
        ProtocolModule module = new ProtocolModule(List.of(first, second));

        assertSame(second, module.find("Second").orElseThrow());
        assertTrue(module.find("Third").isEmpty());
        assertTrue(first.declares(Role.of("B")));
        assertFalse(first.declares(Role.of("C")));
        assertFalse(module.isEmpty());
    }
}
