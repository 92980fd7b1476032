package com.questrail.choreography.cfg;

/**
 * Kind of a {@link CfgNode}. Every node of a compiled graph is exactly one of these.
 */
public enum NodeType
{
    /** Unique start node; one epsilon edge into the protocol body. */
    INITIAL,
    /** A single message. */
    ACTION,
    /** Start of a choice; one choice-branch edge per option. */
    BRANCH,
    /** Reconvergence point of a choice. */
    MERGE,
    /** Start of a parallel region; one parallel-branch edge per branch. */
    FORK,
    /** Reconvergence point of a parallel region. */
    JOIN,
    /** Loop entry point, target of matching continue jumps. */
    RECURSIVE,
    /** Normal completion; no outgoing edges. */
    END
}
