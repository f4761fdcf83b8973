package org.trainload.dataflow.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.trainload.dataflow.cfg.FlowGraph;
import org.trainload.dataflow.cfg.GraphNode;

/**
 * An {@link AnalysisResult} represents the result of a dataflow analysis by providing the stores
 * before and after every node of the analyzed graph. Nodes the analysis never reached keep the
 * initial store on both sides.
 *
 * @param <S> the store type of the analysis
 */
public class AnalysisResult<S extends Store<S>> {

    /** The analyzed graph. */
    protected final FlowGraph graph;

    /** Input stores per dense node index. */
    protected final List<S> inputs;

    /** Output stores per dense node index. */
    protected final List<S> outputs;

    /** The number of node recomputations the run needed. */
    protected final long processedCount;

    /**
     * Initialize with the final stores of a run.
     *
     * @param graph the analyzed graph
     * @param inputs input stores per dense node index
     * @param outputs output stores per dense node index
     * @param processedCount the number of node recomputations of the run
     */
    public AnalysisResult(FlowGraph graph, List<S> inputs, List<S> outputs, long processedCount) {
        this.graph = graph;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        this.processedCount = processedCount;
    }

    /** @return the analyzed graph */
    public FlowGraph getGraph() {
        return graph;
    }

    /** @return the number of node recomputations the run needed */
    public long getProcessedCount() {
        return processedCount;
    }

    /**
     * Return the store before the node with the given id.
     *
     * @param nodeId a node id
     * @return the input store, or {@code null} if the graph has no such node
     */
    public @Nullable S getInput(int nodeId) {
        int index = graph.indexOf(nodeId);
        return index < 0 ? null : inputs.get(index);
    }

    /**
     * Return the store after the node with the given id.
     *
     * @param nodeId a node id
     * @return the output store, or {@code null} if the graph has no such node
     */
    public @Nullable S getOutput(int nodeId) {
        int index = graph.indexOf(nodeId);
        return index < 0 ? null : outputs.get(index);
    }

    /**
     * Convert the input store of every node, keyed by node id in ascending order.
     *
     * @param converter maps a store to the value to report for it
     * @param <R> the reported type
     * @return a map from every node id to the converted input store
     */
    public <R> Map<Integer, R> mapInputs(Function<? super S, ? extends R> converter) {
        Map<Integer, R> result = new TreeMap<>();
        for (int i = 0; i < graph.size(); i++) {
            GraphNode node = graph.getNodeAt(i);
            result.put(node.getId(), converter.apply(inputs.get(i)));
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("AnalysisResult(");
        sb.append(mapInputs(Object::toString));
        sb.append(", processed=").append(processedCount).append(')');
        return sb.toString();
    }
}
