package com.questrail.choreography.cfg;

import java.util.Objects;
import java.util.Optional;

/**
 * A directed, typed edge between two node ids.
 *
 * @param id    dense edge id (index in {@link Cfg#edges()})
 * @param from  source node id
 * @param to    target node id
 * @param type  edge kind
 * @param label option tag ({@code branch1}, {@code branch2}, ...) on choice and
 *              parallel branch edges, otherwise {@code null}
 */
public record CfgEdge(int id, int from, int to, EdgeType type, String label)
{
    public CfgEdge {
        Objects.requireNonNull(type, "type");
    }

    public Optional<String> optionLabel() {
        return Optional.ofNullable(label);
    }

    public boolean hasLabel(String candidate) {
        return label != null && label.equals(candidate);
    }
}
