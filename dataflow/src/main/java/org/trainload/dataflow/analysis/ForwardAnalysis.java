package org.trainload.dataflow.analysis;

/**
 * General dataflow forward analysis interface. This sub-interface of {@link Analysis} defines the
 * general behaviors of a forward analysis, given a graph and a forward transfer function.
 *
 * @param <S> the store type used in the analysis
 * @param <T> the forward transfer function type that is used to approximate runtime behavior
 */
public interface ForwardAnalysis<S extends Store<S>, T extends ForwardTransferFunction<S>>
        extends Analysis<S, T> {

    /**
     * Get the order in which queued nodes are taken from the worklist.
     *
     * @return the worklist order of this analysis
     */
    WorklistOrder getWorklistOrder();

    /**
     * Get the number of times a node was taken from the worklist and recomputed during the last
     * run. The final stores do not depend on it; the worklist order does.
     *
     * @return the number of node recomputations of the last run
     */
    long getProcessedCount();
}
