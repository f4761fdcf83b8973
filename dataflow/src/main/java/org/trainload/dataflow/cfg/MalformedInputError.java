package org.trainload.dataflow.cfg;

import org.checkerframework.javacutil.UserError;

/**
 * Thrown by {@link FlowGraphParser} when a line of the graph description has the wrong number of
 * tokens, a token that is not an integer, or when a line is missing.
 */
@SuppressWarnings("serial")
public class MalformedInputError extends UserError {

    /** The 1-based line number the problem was found on. */
    private final int lineNumber;

    /**
     * Create a new error.
     *
     * @param lineNumber the 1-based line number of the offending line
     * @param message a description of the problem
     */
    public MalformedInputError(int lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    /** @return the 1-based line number the problem was found on */
    public int getLineNumber() {
        return lineNumber;
    }
}
