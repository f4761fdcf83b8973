package org.trainload.dataflow.cfg;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A vertex of a {@link FlowGraph}. Every node removes one flow value (its unload value) and then
 * adds one flow value (its load value) to the facts flowing through it.
 */
public final class GraphNode {

    /** The unique id of this node. */
    private final int id;

    /** The flow value removed when execution passes this node. */
    private final int unload;

    /** The flow value added when execution passes this node. */
    private final int load;

    /**
     * Create a new node.
     *
     * @param id the unique node id
     * @param unload the flow value this node removes
     * @param load the flow value this node adds
     */
    public GraphNode(int id, int unload, int load) {
        this.id = id;
        this.unload = unload;
        this.load = load;
    }

    /** @return the id of this node */
    public int getId() {
        return id;
    }

    /** @return the flow value removed at this node */
    public int getUnload() {
        return unload;
    }

    /** @return the flow value added at this node */
    public int getLoad() {
        return load;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof GraphNode)) {
            return false;
        }
        GraphNode other = (GraphNode) obj;
        return id == other.id && unload == other.unload && load == other.load;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * id + unload) + load;
    }

    @Override
    public String toString() {
        return "GraphNode(" + id + ", unload=" + unload + ", load=" + load + ")";
    }
}
