package com.questrail.choreography.parser;

import com.questrail.choreography.model.SourcePosition;

import java.util.Objects;

/**
 * Indicates that protocol source text is malformed or semantically invalid.
 *
 * This covers:
 * <ul>
 *   <li>Lexical errors (unexpected character, unterminated comment)</li>
 *   <li>Grammar errors (unexpected or missing token)</li>
 *   <li>Scope errors (undeclared role, {@code continue} without an enclosing
 *       {@code rec} of that label)</li>
 *   <li>Shape errors (a {@code choice} or {@code par} with fewer than two
 *       alternatives, duplicate role or protocol names)</li>
 * </ul>
 *
 * The pipeline never recovers from a parse error; the exception is always
 * surfaced to the caller with its location.
 */
public final class ParseException extends RuntimeException
{
    private final String problem;
    private final SourcePosition position;

    public ParseException(String problem, SourcePosition position) {
        super(format(problem, position));
        this.problem = Objects.requireNonNull(problem, "problem");
        this.position = Objects.requireNonNull(position, "position");
    }

    /**
     * The error description without location information.
     */
    public String problem() {
        return problem;
    }

    public SourcePosition position() {
        return position;
    }

    private static String format(String problem, SourcePosition position) {
        return position.isKnown() ? problem + " at " + position : problem;
    }
}
