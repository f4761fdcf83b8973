package org.trainload.dataflow.analysis;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.trainload.dataflow.cfg.FlowGraph;

/**
 * General Dataflow Analysis Interface. This interface defines general behaviors of a data-flow
 * analysis, given a {@link FlowGraph} and a transfer function.
 *
 * @param <S> the store type used in the analysis
 * @param <T> the transfer function type that is used to approximate runtime behavior
 */
public interface Analysis<S extends Store<S>, T extends TransferFunction<S>> {

    /**
     * Get the status of the analysis that whether it is currently running.
     *
     * @return true if the analysis is running currently
     */
    boolean isRunning();

    /**
     * Perform the actual analysis. Any state left by a previous run is discarded.
     *
     * @param graph the graph to analyze
     */
    void performAnalysis(FlowGraph graph);

    /**
     * The result of running the analysis. This is only available once the analysis finished
     * running.
     *
     * @return the result of running the analysis
     */
    AnalysisResult<S> getResult();

    /**
     * Get the transfer function of this analysis.
     *
     * @return the transfer function of this analysis
     */
    T getTransferFunction();

    /**
     * Get the store that holds before the node with the given id. Note that if the analysis has
     * not finished yet, this value might not represent the final value for this node.
     *
     * @param nodeId a node id
     * @return the input store, or {@code null} if no graph has been analyzed or the id is unknown
     */
    @Nullable S getInput(int nodeId);

    /**
     * Get the store that holds after the node with the given id. Note that if the analysis has not
     * finished yet, this value might not represent the final value for this node.
     *
     * @param nodeId a node id
     * @return the output store, or {@code null} if no graph has been analyzed or the id is unknown
     */
    @Nullable S getOutput(int nodeId);
}
