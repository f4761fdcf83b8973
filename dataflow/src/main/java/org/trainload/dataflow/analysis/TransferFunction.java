package org.trainload.dataflow.analysis;

import org.trainload.dataflow.cfg.GraphNode;

/**
 * Interface of a transfer function for the abstract interpretation used for the flow analysis.
 *
 * <p>A transfer function determines, for every {@link GraphNode}, the store that holds after the
 * node given the store that holds before it.
 *
 * <p><em>Important</em>: A transfer function is allowed to use (and modify) the store passed in;
 * the ownership is transferred from the caller to that function. Callers that need the input
 * afterwards must pass a copy.
 *
 * @param <S> the {@link Store} used to keep track of intermediate results
 */
public interface TransferFunction<S extends Store<S>> {

    /**
     * Apply this transfer function to one node.
     *
     * @param node the node being analyzed
     * @param input the store before {@code node}
     * @return the store after {@code node}
     */
    S transfer(GraphNode node, S input);
}
