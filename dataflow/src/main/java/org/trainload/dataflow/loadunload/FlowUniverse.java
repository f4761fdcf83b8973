package org.trainload.dataflow.loadunload;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import org.trainload.dataflow.cfg.FlowGraph;
import org.trainload.dataflow.cfg.GraphNode;

/**
 * A bijection between the flow values of a graph and the dense range {@code [0, size())}.
 *
 * <p>The universe holds exactly the distinct unload and load values of all nodes. Values are
 * indexed in ascending order, so bit {@code i} of a {@link FlowSetStore} stands for the {@code
 * i}-th smallest value.
 */
public final class FlowUniverse {

    /** The flow values in ascending order; the position is the index. */
    private final int[] values;

    /** Map from flow value to index. */
    private final Map<Integer, Integer> indexByValue;

    private FlowUniverse(int[] values) {
        this.values = values;
        this.indexByValue = new HashMap<>();
        for (int i = 0; i < values.length; i++) {
            indexByValue.put(values[i], i);
        }
    }

    /**
     * Build the universe of all unload and load values of a graph.
     *
     * @param graph the graph
     * @return the universe
     */
    public static FlowUniverse of(FlowGraph graph) {
        TreeSet<Integer> sorted = new TreeSet<>();
        for (GraphNode node : graph.getNodes()) {
            sorted.add(node.getUnload());
            sorted.add(node.getLoad());
        }
        return new FlowUniverse(sorted.stream().mapToInt(Integer::intValue).toArray());
    }

    /** @return the number of distinct flow values, which is the width of every flow set */
    public int size() {
        return values.length;
    }

    /**
     * @param value a flow value
     * @return the index of the value, or -1 if the value is not part of this universe
     */
    public int indexOf(int value) {
        Integer index = indexByValue.get(value);
        return index == null ? -1 : index;
    }

    /**
     * @param value a flow value
     * @return true if the value is part of this universe
     */
    public boolean contains(int value) {
        return indexByValue.containsKey(value);
    }

    /**
     * @param index an index in {@code [0, size())}
     * @return the flow value with that index
     */
    public int valueAt(int index) {
        return values[index];
    }

    @Override
    public String toString() {
        return "FlowUniverse" + Arrays.toString(values);
    }
}
