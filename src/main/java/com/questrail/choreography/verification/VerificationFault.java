package com.questrail.choreography.verification;

/**
 * The verifier was handed a structurally inconsistent CFG, for example a fork
 * whose join id does not name a join node. Never raised for graphs produced
 * by {@code CfgBuilder}.
 */
public class VerificationFault extends RuntimeException
{
    private final int nodeId;

    public VerificationFault(String message, int nodeId) {
        super(message + " (node " + nodeId + ")");
        this.nodeId = nodeId;
    }

    public int nodeId() {
        return nodeId;
    }
}
