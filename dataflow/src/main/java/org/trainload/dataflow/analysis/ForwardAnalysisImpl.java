package org.trainload.dataflow.analysis;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.BugInCF;
import org.trainload.dataflow.cfg.DepthFirstOrder;
import org.trainload.dataflow.cfg.FlowGraph;
import org.trainload.dataflow.cfg.GraphNode;

/**
 * An implementation of a forward analysis to solve a dataflow problem given a {@link FlowGraph}
 * and a forward transfer function.
 *
 * <p>The analysis computes, for every node {@code n},
 *
 * <pre>
 *   input(n)  = input(n) lub output(p) for every predecessor p of n
 *   output(n) = transfer(n, input(n))
 * </pre>
 *
 * starting from the initial store of the transfer function everywhere. The input of a node is
 * folded into its previous value and never replaced, so stores only grow during a run. A node is
 * queued again only when the output of one of its predecessors changed, and the run ends when the
 * worklist is empty. Nodes not reachable from the entry are never processed and keep the initial
 * store.
 *
 * @param <S> the store type used in the analysis
 * @param <T> the transfer function type that is used to approximate runtime behavior
 */
public class ForwardAnalysisImpl<S extends Store<S>, T extends ForwardTransferFunction<S>>
        implements ForwardAnalysis<S, T> {

    /** The transfer function for regular nodes. */
    protected final T transferFunction;

    /** The order nodes are taken from the worklist. */
    protected final WorklistOrder worklistOrder;

    /** Upper bound on node recomputations per run; zero or less means unbounded. */
    protected final long maxIterations;

    /** Is the analysis currently running? */
    protected boolean isRunning = false;

    /** The graph of the current or last run. */
    protected @Nullable FlowGraph graph;

    /** Input stores per dense node index. */
    protected final List<S> inputs;

    /** Output stores per dense node index. */
    protected final List<S> outputs;

    /** The worklist of the current run. */
    protected @Nullable Worklist worklist;

    /** Node recomputations in the current or last run. */
    protected long processedCount;

    /** The result of the last completed run. */
    protected @Nullable AnalysisResult<S> result;

    /**
     * Construct an object that can perform a forward analysis in reverse postorder without a bound
     * on the number of node recomputations.
     *
     * @param transfer the transfer function
     */
    public ForwardAnalysisImpl(T transfer) {
        this(transfer, WorklistOrder.REVERSE_POSTORDER, 0);
    }

    /**
     * Construct an object that can perform a forward analysis.
     *
     * @param transfer the transfer function
     * @param worklistOrder the order nodes are taken from the worklist
     * @param maxIterations upper bound on node recomputations per run; zero or less means unbounded
     */
    public ForwardAnalysisImpl(T transfer, WorklistOrder worklistOrder, long maxIterations) {
        this.transferFunction = transfer;
        this.worklistOrder = worklistOrder;
        this.maxIterations = maxIterations;
        this.inputs = new ArrayList<>();
        this.outputs = new ArrayList<>();
    }

    @Override
    public void performAnalysis(FlowGraph graph) {
        if (isRunning) {
            throw new BugInCF(
                    "ForwardAnalysisImpl::performAnalysis() doesn't expect to get called when analysis is running!");
        }

        isRunning = true;
        try {
            Worklist worklist = init(graph);

            while (!worklist.isEmpty()) {
                int index = worklist.poll();
                processedCount++;
                if (maxIterations > 0 && processedCount > maxIterations) {
                    throw new BugInCF(
                            "ForwardAnalysisImpl::performAnalysis() exceeded "
                                    + maxIterations
                                    + " node recomputations on "
                                    + graph);
                }

                S input = inputs.get(index);
                for (int pred : graph.predecessorIndices(index)) {
                    input = input.leastUpperBound(outputs.get(pred));
                }
                inputs.set(index, input);

                GraphNode node = graph.getNodeAt(index);
                S output = transferFunction.transfer(node, input.copy());
                if (!output.equals(outputs.get(index))) {
                    outputs.set(index, output);
                    for (int succ : graph.successorIndices(index)) {
                        worklist.add(succ);
                    }
                }
            }

            result = new AnalysisResult<>(graph, inputs, outputs, processedCount);
        } finally {
            this.worklist = null;
            isRunning = false;
        }
    }

    /**
     * Reset all per-run state for a new graph and seed the worklist with the entry node.
     *
     * @param graph the graph to analyze
     * @return the seeded worklist
     */
    protected Worklist init(FlowGraph graph) {
        this.graph = graph;
        this.result = null;
        this.processedCount = 0;
        inputs.clear();
        outputs.clear();

        S initialStore = transferFunction.initialStore(graph);
        for (int i = 0; i < graph.size(); i++) {
            inputs.add(initialStore.copy());
            outputs.add(initialStore.copy());
        }

        DepthFirstOrder depthFirstOrder = DepthFirstOrder.compute(graph);
        Worklist worklist = new Worklist(depthFirstOrder, graph.size(), worklistOrder);
        worklist.add(graph.getEntryIndex());
        this.worklist = worklist;
        return worklist;
    }

    @Override
    public boolean isRunning() {
        return isRunning;
    }

    @Override
    public AnalysisResult<S> getResult() {
        if (isRunning || result == null) {
            throw new BugInCF(
                    "ForwardAnalysisImpl::getResult() called before the analysis finished");
        }
        return result;
    }

    @Override
    public T getTransferFunction() {
        return transferFunction;
    }

    @Override
    public WorklistOrder getWorklistOrder() {
        return worklistOrder;
    }

    @Override
    public long getProcessedCount() {
        return processedCount;
    }

    @Override
    public @Nullable S getInput(int nodeId) {
        return readFromStores(inputs, nodeId);
    }

    @Override
    public @Nullable S getOutput(int nodeId) {
        return readFromStores(outputs, nodeId);
    }

    /**
     * Read the store of a node from a per-index table.
     *
     * @param stores input or output stores
     * @param nodeId a node id
     * @return the store, or {@code null} if there is no graph or no such node
     */
    protected @Nullable S readFromStores(List<S> stores, int nodeId) {
        if (graph == null) {
            return null;
        }
        int index = graph.indexOf(nodeId);
        return index < 0 || index >= stores.size() ? null : stores.get(index);
    }
}
