package com.questrail.choreography.config;

/**
 * How the simulator resolves a choice point when the caller passes no option.
 */
public enum ChoiceStrategy
{
    /** Take the first option in declaration order. */
    FIRST,
    /** Refuse the step; the caller must name an option. */
    MANUAL
}
