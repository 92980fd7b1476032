package com.questrail.choreography.simulation;

import java.util.Objects;

/**
 * One selectable option of the pending choice point.
 *
 * @param index       zero-based position in declaration order
 * @param label       edge label to pass to {@code step}
 * @param targetNode  first node of the option
 * @param description preview of what the option does first
 */
public record ChoiceOption(int index, String label, int targetNode, String description)
{
    public ChoiceOption {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(description, "description");
    }
}
