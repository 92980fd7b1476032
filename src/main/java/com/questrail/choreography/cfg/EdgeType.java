package com.questrail.choreography.cfg;

/**
 * Kind of a {@link CfgEdge}.
 */
public enum EdgeType
{
    SEQUENTIAL,
    CHOICE_BRANCH,
    PARALLEL_BRANCH,
    RECURSION_BACK,
    EPSILON
}
