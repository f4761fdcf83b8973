package org.trainload.dataflow.loadunload;

import java.util.Map;
import java.util.SortedSet;
import org.trainload.dataflow.analysis.AnalysisResult;
import org.trainload.dataflow.analysis.ForwardAnalysisImpl;
import org.trainload.dataflow.analysis.WorklistOrder;
import org.trainload.dataflow.cfg.FlowGraph;

/**
 * Computes, for every node of a {@link FlowGraph}, the flow values that can be present when
 * execution reaches the node from the entry.
 *
 * <p>Each call builds the {@link FlowUniverse} of the graph, runs a {@link ForwardAnalysisImpl}
 * with a {@link LoadUnloadTransfer} and translates the input stores back to flow values. Nodes that
 * are not reachable from the entry get the empty set.
 */
public class LoadUnloadAnalysis {

    /** Slack factor applied to the theoretical bound on node recomputations. */
    private static final long WORK_BOUND_SLACK = 2;

    /** The order nodes are taken from the worklist. */
    private final WorklistOrder worklistOrder;

    /** Create an analysis that polls the worklist in reverse postorder. */
    public LoadUnloadAnalysis() {
        this(WorklistOrder.REVERSE_POSTORDER);
    }

    /**
     * Create an analysis.
     *
     * @param worklistOrder the order nodes are taken from the worklist
     */
    public LoadUnloadAnalysis(WorklistOrder worklistOrder) {
        this.worklistOrder = worklistOrder;
    }

    /** @return the order nodes are taken from the worklist */
    public WorklistOrder getWorklistOrder() {
        return worklistOrder;
    }

    /**
     * Analyze a graph.
     *
     * @param graph the graph
     * @return a map from every node id, in ascending order, to its values in ascending order
     */
    public Map<Integer, SortedSet<Integer>> analyze(FlowGraph graph) {
        return extract(run(graph));
    }

    /**
     * Analyze a graph and keep the stores before and after every node.
     *
     * @param graph the graph
     * @return the result of the forward analysis
     */
    public AnalysisResult<FlowSetStore> run(FlowGraph graph) {
        FlowUniverse universe = FlowUniverse.of(graph);
        ForwardAnalysisImpl<FlowSetStore, LoadUnloadTransfer> analysis =
                new ForwardAnalysisImpl<>(
                        new LoadUnloadTransfer(universe),
                        worklistOrder,
                        workBound(graph, universe));
        analysis.performAnalysis(graph);
        return analysis.getResult();
    }

    /**
     * Translate the input store of every node back to flow values.
     *
     * @param result a finished load/unload analysis
     * @return a map from every node id, in ascending order, to its values in ascending order
     */
    public static Map<Integer, SortedSet<Integer>> extract(AnalysisResult<FlowSetStore> result) {
        return result.mapInputs(FlowSetStore::toValueSet);
    }

    /**
     * An upper bound on node recomputations. Apart from the entry, a node is queued only because
     * the output of a predecessor changed. An output changes at most once per flow value and each
     * change queues at most one node per outgoing edge.
     *
     * @param graph the graph
     * @param universe the universe of the graph
     * @return the maximum number of node recomputations a run may take
     */
    static long workBound(FlowGraph graph, FlowUniverse universe) {
        long perChange = Math.max(1, graph.getEdgeCount());
        return WORK_BOUND_SLACK * (1 + (long) universe.size() * perChange);
    }
}
