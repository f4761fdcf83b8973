package org.trainload.dataflow.analysis;

import java.util.Locale;

/** The order in which a {@link Worklist} hands out queued nodes. */
public enum WorklistOrder {
    /** The queued node with the lowest reverse-postorder rank comes first. */
    REVERSE_POSTORDER,
    /** Queued nodes come out in the order they were added. */
    FIFO;

    /**
     * Parse the command-line spelling of an order.
     *
     * @param name {@code rpo} or {@code fifo}, case-insensitive
     * @return the order
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static WorklistOrder fromName(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "rpo":
                return REVERSE_POSTORDER;
            case "fifo":
                return FIFO;
            default:
                throw new IllegalArgumentException("unknown worklist order: " + name);
        }
    }
}
