package com.questrail.choreography.model;

/**
 * Interaction
 * -----------------------------------------------------------------------------
 * A term of the global interaction tree.
 *
 * <h2>Closed variant</h2>
 * The grammar is closed: every interaction is exactly one of
 * <ul>
 *   <li>{@link Action}: a single point-to-point message</li>
 *   <li>{@link Sequence}: ordered composition</li>
 *   <li>{@link Choice}: exclusive alternative decided by one role</li>
 *   <li>{@link Parallel}: unordered concurrent composition</li>
 *   <li>{@link Recursion}: a labeled loop entry point</li>
 *   <li>{@link Continue}: a jump back to an enclosing recursion</li>
 * </ul>
 *
 * Consumers switch on {@link #kind()}; a switch expression over
 * {@link Kind} fails to compile when a case is missing.
 */
public sealed interface Interaction
        permits Action, Sequence, Choice, Parallel, Recursion, Continue
{
    enum Kind {
        ACTION,
        SEQUENCE,
        CHOICE,
        PARALLEL,
        RECURSION,
        CONTINUE
    }

    Kind kind();

    /**
     * Where the term starts in the source text, or {@link SourcePosition#UNKNOWN}
     * for terms built programmatically.
     */
    SourcePosition position();
}
