package org.trainload.dataflow.analysis;

import org.trainload.dataflow.cfg.FlowGraph;

/**
 * General interface of a forward transfer function for the abstract interpretation used for the
 * forward flow analysis.
 *
 * <p>A forward transfer function consists of the following components:
 *
 * <ul>
 *   <li>A method {@code initialStore} that determines which store holds at the entry node before
 *       any predecessor contributes to it. The same store is also the starting value of every
 *       input and output store, so it must be the bottom of the lattice.
 *   <li>A method {@code transfer}, inherited from {@link TransferFunction}.
 * </ul>
 *
 * @param <S> the store type used in the analysis
 */
public interface ForwardTransferFunction<S extends Store<S>> extends TransferFunction<S> {

    /**
     * Return the initial store to be used by the forward analysis.
     *
     * @param graph the graph being analyzed
     * @return the initial store
     */
    S initialStore(FlowGraph graph);
}
