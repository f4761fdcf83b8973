package org.trainload.dataflow.cfg;

import org.checkerframework.javacutil.UserError;

/** Thrown when an edge endpoint or the entry id names a node that was never declared. */
@SuppressWarnings("serial")
public class UnknownNodeReferenceError extends UserError {

    /** The id that could not be resolved. */
    private final int nodeId;

    /**
     * Create a new error.
     *
     * @param nodeId the unresolved node id
     * @param context where the reference appeared, e.g. {@code "edge 3 -> 7"}
     */
    public UnknownNodeReferenceError(int nodeId, String context) {
        super("unknown node " + nodeId + " referenced by " + context);
        this.nodeId = nodeId;
    }

    /** @return the id that could not be resolved */
    public int getNodeId() {
        return nodeId;
    }
}
