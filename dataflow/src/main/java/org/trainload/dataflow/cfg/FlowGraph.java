package org.trainload.dataflow.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.BugInCF;

/**
 * An immutable directed graph of {@link GraphNode}s with a designated entry node.
 *
 * <p>Each node is assigned a dense index in declaration order. The index is what analyses use to
 * key their per-node tables; the id is what users see. Successor and predecessor lists keep edges
 * in declaration order, parallel edges included. Self-loops and cycles are legal.
 *
 * <p>Instances are created through {@link Builder}, which validates that node ids are unique and
 * that every edge endpoint and the entry id refer to declared nodes.
 */
public final class FlowGraph {

    /** Nodes in declaration order; the position is the dense index. */
    private final List<GraphNode> nodes;

    /** Map from node id to dense index. */
    private final Map<Integer, Integer> indexById;

    /** Successor ids per node id, only for nodes with at least one outgoing edge. */
    private final Map<Integer, List<Integer>> successors;

    /** Predecessor ids per node id, only for nodes with at least one incoming edge. */
    private final Map<Integer, List<Integer>> predecessors;

    /** Successor indices per dense index. */
    private final int[][] successorIndices;

    /** Predecessor indices per dense index. */
    private final int[][] predecessorIndices;

    /** The number of edges, parallel edges counted separately. */
    private final int edgeCount;

    /** The id of the entry node. */
    private final int entry;

    private FlowGraph(
            List<GraphNode> nodes,
            Map<Integer, Integer> indexById,
            Map<Integer, List<Integer>> successors,
            Map<Integer, List<Integer>> predecessors,
            int edgeCount,
            int entry) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.indexById = Collections.unmodifiableMap(indexById);
        this.successors = Collections.unmodifiableMap(successors);
        this.predecessors = Collections.unmodifiableMap(predecessors);
        this.edgeCount = edgeCount;
        this.entry = entry;
        this.successorIndices = toIndexTable(successors);
        this.predecessorIndices = toIndexTable(predecessors);
    }

    private int[][] toIndexTable(Map<Integer, List<Integer>> adjacency) {
        int[][] table = new int[nodes.size()][];
        for (int i = 0; i < nodes.size(); i++) {
            List<Integer> ids = adjacency.getOrDefault(nodes.get(i).getId(), List.of());
            int[] row = new int[ids.size()];
            for (int j = 0; j < row.length; j++) {
                row[j] = indexById.get(ids.get(j));
            }
            table[i] = row;
        }
        return table;
    }

    /** @return a new, empty builder */
    public static Builder builder() {
        return new Builder();
    }

    /** @return the number of nodes */
    public int size() {
        return nodes.size();
    }

    /** @return the number of edges, parallel edges counted separately */
    public int getEdgeCount() {
        return edgeCount;
    }

    /** @return the id of the entry node */
    public int getEntry() {
        return entry;
    }

    /** @return the dense index of the entry node */
    public int getEntryIndex() {
        return indexById.get(entry);
    }

    /** @return all nodes in declaration order */
    public List<GraphNode> getNodes() {
        return nodes;
    }

    /**
     * Return the node with the given id.
     *
     * @param id a node id
     * @return the node, or {@code null} if no node has that id
     */
    public @Nullable GraphNode getNode(int id) {
        Integer index = indexById.get(id);
        return index == null ? null : nodes.get(index);
    }

    /**
     * @param id a node id
     * @return true if a node with the given id was declared
     */
    public boolean containsNode(int id) {
        return indexById.containsKey(id);
    }

    /**
     * @param id a node id
     * @return the dense index of the node, or -1 if no node has that id
     */
    public int indexOf(int id) {
        Integer index = indexById.get(id);
        return index == null ? -1 : index;
    }

    /**
     * @param index a dense node index
     * @return the node at that index
     */
    public GraphNode getNodeAt(int index) {
        return nodes.get(index);
    }

    /**
     * Return the successor ids of a node in edge declaration order.
     *
     * @param id a node id
     * @return the successor ids; empty if the node has no outgoing edge
     */
    public List<Integer> getSuccessors(int id) {
        return successors.getOrDefault(id, List.of());
    }

    /**
     * Return the predecessor ids of a node in edge declaration order.
     *
     * @param id a node id
     * @return the predecessor ids; empty if the node has no incoming edge
     */
    public List<Integer> getPredecessors(int id) {
        return predecessors.getOrDefault(id, List.of());
    }

    /**
     * Index-based view of {@link #getSuccessors}. The returned array must not be modified.
     *
     * @param index a dense node index
     * @return the dense indices of the successors
     */
    public int[] successorIndices(int index) {
        return successorIndices[index];
    }

    /**
     * Index-based view of {@link #getPredecessors}. The returned array must not be modified.
     *
     * @param index a dense node index
     * @return the dense indices of the predecessors
     */
    public int[] predecessorIndices(int index) {
        return predecessorIndices[index];
    }

    @Override
    public String toString() {
        return "FlowGraph(nodes=" + nodes.size() + ", edges=" + edgeCount + ", entry=" + entry + ")";
    }

    /** Collects nodes, edges and the entry id, and validates them in {@link #build()}. */
    public static final class Builder {

        private final List<GraphNode> nodes = new ArrayList<>();
        private final List<int[]> edges = new ArrayList<>();
        private @Nullable Integer entry;

        private Builder() {}

        /**
         * Declare a node.
         *
         * @param id the node id
         * @param unload the flow value the node removes
         * @param load the flow value the node adds
         * @return this builder
         */
        public Builder addNode(int id, int unload, int load) {
            nodes.add(new GraphNode(id, unload, load));
            return this;
        }

        /**
         * Declare a directed edge.
         *
         * @param from the source node id
         * @param to the target node id
         * @return this builder
         */
        public Builder addEdge(int from, int to) {
            edges.add(new int[] {from, to});
            return this;
        }

        /**
         * Set the entry node.
         *
         * @param id the entry node id
         * @return this builder
         */
        public Builder setEntry(int id) {
            this.entry = id;
            return this;
        }

        /**
         * Validate the collected declarations and create the graph.
         *
         * @return the graph
         * @throws DuplicateNodeIdError if two nodes share an id
         * @throws UnknownNodeReferenceError if an edge or the entry names an undeclared node
         */
        public FlowGraph build() {
            if (entry == null) {
                throw new BugInCF("FlowGraph.Builder::build() called before setEntry()");
            }

            Map<Integer, Integer> indexById = new HashMap<>();
            for (int i = 0; i < nodes.size(); i++) {
                int id = nodes.get(i).getId();
                if (indexById.putIfAbsent(id, i) != null) {
                    throw new DuplicateNodeIdError(id);
                }
            }

            Map<Integer, List<Integer>> successors = new LinkedHashMap<>();
            Map<Integer, List<Integer>> predecessors = new LinkedHashMap<>();
            for (int[] edge : edges) {
                int from = edge[0];
                int to = edge[1];
                if (!indexById.containsKey(from)) {
                    throw new UnknownNodeReferenceError(from, "edge " + from + " -> " + to);
                }
                if (!indexById.containsKey(to)) {
                    throw new UnknownNodeReferenceError(to, "edge " + from + " -> " + to);
                }
                successors.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
                predecessors.computeIfAbsent(to, k -> new ArrayList<>()).add(from);
            }

            if (!indexById.containsKey(entry)) {
                throw new UnknownNodeReferenceError(entry, "the entry declaration");
            }

            successors.replaceAll((id, list) -> Collections.unmodifiableList(list));
            predecessors.replaceAll((id, list) -> Collections.unmodifiableList(list));
            return new FlowGraph(
                    new ArrayList<>(nodes),
                    indexById,
                    successors,
                    predecessors,
                    edges.size(),
                    entry);
        }
    }
}
