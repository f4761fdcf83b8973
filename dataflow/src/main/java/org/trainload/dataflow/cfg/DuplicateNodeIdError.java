package org.trainload.dataflow.cfg;

import org.checkerframework.javacutil.UserError;

/** Thrown when two node declarations share the same id. */
@SuppressWarnings("serial")
public class DuplicateNodeIdError extends UserError {

    /** The id declared more than once. */
    private final int nodeId;

    /**
     * Create a new error.
     *
     * @param nodeId the id declared more than once
     */
    public DuplicateNodeIdError(int nodeId) {
        super("node " + nodeId + " is declared more than once");
        this.nodeId = nodeId;
    }

    /** @return the id declared more than once */
    public int getNodeId() {
        return nodeId;
    }
}
