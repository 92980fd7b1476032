package com.questrail.choreography.cfg;

import com.questrail.choreography.cfg.CfgNode.ActionNode;
import com.questrail.choreography.cfg.CfgNode.BranchNode;
import com.questrail.choreography.cfg.CfgNode.ForkNode;
import com.questrail.choreography.cfg.CfgNode.JoinNode;
import com.questrail.choreography.cfg.CfgNode.RecursiveNode;
import com.questrail.choreography.model.Role;

import java.util.stream.Collectors;

/**
 * Renders a {@link Cfg} as deterministic text, one line per node followed by
 * one line per edge, both in id order.
 *
 * <pre>
 * protocol RR(Client, Server)
 *   n0 INITIAL
 *   n1 ACTION Client -> Server: Request()
 *   ...
 *   e0 n0 -> n1 EPSILON
 * </pre>
 */
public final class CfgPrinter
{
    private CfgPrinter() {}

    public static String print(Cfg cfg) {
        StringBuilder out = new StringBuilder();
        out.append("protocol ")
                .append(cfg.protocolName())
                .append(cfg.roles().stream().map(Role::name).collect(Collectors.joining(", ", "(", ")")))
                .append('\n');

        for (CfgNode node : cfg.nodes()) {
            out.append("  n").append(node.id()).append(' ').append(node.type());
            String detail = detail(node);
            if (!detail.isEmpty()) {
                out.append(' ').append(detail);
            }
            out.append('\n');
        }
        for (CfgEdge edge : cfg.edges()) {
            out.append("  e").append(edge.id())
                    .append(" n").append(edge.from())
                    .append(" -> n").append(edge.to())
                    .append(' ').append(edge.type());
            if (edge.label() != null) {
                out.append(" [").append(edge.label()).append(']');
            }
            out.append('\n');
        }
        return out.toString();
    }

    private static String detail(CfgNode node) {
        switch (node.type()) {
            case ACTION:
                return ((ActionNode) node).action().toString();
            case BRANCH: {
                BranchNode branch = (BranchNode) node;
                return "at " + branch.at() + branch.merge().map(m -> " merge=n" + m).orElse("");
            }
            case FORK: {
                ForkNode fork = (ForkNode) node;
                return fork.parallelId() + " join=n" + fork.joinId();
            }
            case JOIN:
                return ((JoinNode) node).parallelId();
            case RECURSIVE:
                return ((RecursiveNode) node).label();
            default:
                return "";
        }
    }
}
