package com.questrail.choreography.cfg;

import com.questrail.choreography.model.Role;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Cfg
 * -----------------------------------------------------------------------------
 * Immutable control-flow graph of one protocol declaration.
 *
 * <h2>Arena layout</h2>
 * Nodes and edges live in two lists owned by the graph and are addressed by
 * integer id, which equals the list index. Outgoing and incoming adjacency is
 * precomputed once; adjacency lists are ordered by edge id, so the outgoing
 * edges of a {@code branch} or {@code fork} node appear in option order.
 *
 * <h2>Sharing</h2>
 * A {@code Cfg} never changes after construction and may be read by any
 * number of simulators and verifiers at once.
 */
public final class Cfg
{
    private final String protocolName;
    private final List<Role> roles;
    private final List<CfgNode> nodes;
    private final List<CfgEdge> edges;
    private final int initialNodeId;
    private final int endNodeId;

    private final List<List<CfgEdge>> outgoing;
    private final List<List<CfgEdge>> incoming;

    public Cfg(String protocolName,
               List<Role> roles,
               List<CfgNode> nodes,
               List<CfgEdge> edges,
               int initialNodeId,
               int endNodeId) {
        this.protocolName = Objects.requireNonNull(protocolName, "protocolName");
        this.roles = List.copyOf(Objects.requireNonNull(roles, "roles"));
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        this.edges = List.copyOf(Objects.requireNonNull(edges, "edges"));

        for (int i = 0; i < this.nodes.size(); i++) {
            if (this.nodes.get(i).id() != i) {
                throw new IllegalArgumentException("Node at index " + i + " has id " + this.nodes.get(i).id());
            }
        }
        checkNodeId(initialNodeId, "initialNodeId");
        checkNodeId(endNodeId, "endNodeId");
        this.initialNodeId = initialNodeId;
        this.endNodeId = endNodeId;

        List<List<CfgEdge>> out = new ArrayList<>();
        List<List<CfgEdge>> in = new ArrayList<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            out.add(new ArrayList<>());
            in.add(new ArrayList<>());
        }
        for (int i = 0; i < this.edges.size(); i++) {
            CfgEdge edge = this.edges.get(i);
            if (edge.id() != i) {
                throw new IllegalArgumentException("Edge at index " + i + " has id " + edge.id());
            }
            checkNodeId(edge.from(), "edge " + i + " source");
            checkNodeId(edge.to(), "edge " + i + " target");
            out.get(edge.from()).add(edge);
            in.get(edge.to()).add(edge);
        }
        this.outgoing = freeze(out);
        this.incoming = freeze(in);
    }

    private void checkNodeId(int id, String what) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException(what + " refers to unknown node " + id);
        }
    }

    private static List<List<CfgEdge>> freeze(List<List<CfgEdge>> lists) {
        List<List<CfgEdge>> frozen = new ArrayList<>(lists.size());
        for (List<CfgEdge> list : lists) {
            frozen.add(List.copyOf(list));
        }
        return Collections.unmodifiableList(frozen);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public String protocolName() {
        return protocolName;
    }

    public List<Role> roles() {
        return roles;
    }

    public List<CfgNode> nodes() {
        return nodes;
    }

    public List<CfgEdge> edges() {
        return edges;
    }

    public int initialNodeId() {
        return initialNodeId;
    }

    public int endNodeId() {
        return endNodeId;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public CfgNode node(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return nodes.get(id);
    }

    /**
     * Returns the node with the given id as the expected variant.
     *
     * @throws IllegalArgumentException if the node is of another type
     */
    public <T extends CfgNode> T node(int id, Class<T> type) {
        CfgNode node = node(id);
        if (!type.isInstance(node)) {
            throw new IllegalArgumentException("Node " + id + " is " + node.type()
                    + ", not " + type.getSimpleName());
        }
        return type.cast(node);
    }

    public List<CfgEdge> outgoing(int nodeId) {
        return outgoing.get(node(nodeId).id());
    }

    public List<CfgEdge> incoming(int nodeId) {
        return incoming.get(node(nodeId).id());
    }

    public List<CfgNode> nodesOfType(NodeType type) {
        List<CfgNode> result = new ArrayList<>();
        for (CfgNode node : nodes) {
            if (node.type() == type) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * True when the edge closes a loop: it is a {@code recursion-back} edge, or
     * it targets a {@code recursive} node that was constructed no later than the
     * edge's source (an option that begins with {@code continue}).
     */
    public boolean isLoopBack(CfgEdge edge) {
        if (edge.type() == EdgeType.RECURSION_BACK) {
            return true;
        }
        return node(edge.to()).type() == NodeType.RECURSIVE && edge.to() <= edge.from();
    }

    @Override
    public String toString() {
        return "Cfg[" + protocolName + ", nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
    }
}
