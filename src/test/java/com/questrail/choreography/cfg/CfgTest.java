package com.questrail.choreography.cfg;

import com.questrail.choreography.cfg.CfgNode.ActionNode;
import com.questrail.choreography.cfg.CfgNode.EndNode;
import com.questrail.choreography.cfg.CfgNode.InitialNode;
import com.questrail.choreography.model.Action;
import com.questrail.choreography.model.Role;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CfgTest {

    private static final List<Role> ROLES = List.of(Role.of("A"), Role.of("B"));

    @Test
    void indexesAdjacencyByNode() {
        Cfg cfg = new Cfg("P", ROLES,
                List.of(new InitialNode(0), new ActionNode(1, Action.of("A", "B", "M")), new EndNode(2)),
                List.of(new CfgEdge(0, 0, 1, EdgeType.EPSILON, null),
                        new CfgEdge(1, 1, 2, EdgeType.SEQUENTIAL, null)),
                0, 2);

        assertEquals(1, cfg.outgoing(0).size());
        assertEquals(1, cfg.incoming(2).size());
        assertTrue(cfg.incoming(0).isEmpty());
        assertEquals("Cfg[P, nodes=3, edges=2]", cfg.toString());
    }

    @Test
    void rejectsEdgeToUnknownNode() {
        assertThrows(IllegalArgumentException.class, () -> new Cfg("P", ROLES,
                List.of(new InitialNode(0), new EndNode(1)),
                List.of(new CfgEdge(0, 0, 7, EdgeType.EPSILON, null)),
                0, 1));
    }

    @Test
    void rejectsNodeIdOutOfPlace() {
        assertThrows(IllegalArgumentException.class, () -> new Cfg("P", ROLES,
                List.of(new InitialNode(0), new EndNode(5)),
                List.of(),
                0, 1));
    }

    @Test
    void typedLookupChecksVariant() {
        Cfg cfg = new Cfg("P", ROLES, List.of(new InitialNode(0), new EndNode(1)),
                List.of(new CfgEdge(0, 0, 1, EdgeType.EPSILON, null)), 0, 1);

        assertThrows(IllegalArgumentException.class, () -> cfg.node(1, ActionNode.class));
        assertThrows(IllegalArgumentException.class, () -> cfg.node(9));
    }
}
