package com.questrail.choreography.cfg;

/**
 * Raised by {@link CfgBuilder} when an interaction tree breaks an invariant
 * the parser normally guarantees, for example a {@code continue} with no
 * enclosing recursion of that label in a programmatically built tree.
 */
public class CompileException extends RuntimeException
{
    public CompileException(String message) {
        super(message);
    }
}
