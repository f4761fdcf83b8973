package org.trainload.dataflow.loadunload;

import org.trainload.dataflow.analysis.ForwardTransferFunction;
import org.trainload.dataflow.cfg.FlowGraph;
import org.trainload.dataflow.cfg.GraphNode;

/**
 * The transfer function of the load/unload analysis: a node first removes its unload value, then
 * adds its load value. A node whose unload and load values are equal therefore always passes the
 * value on.
 */
public class LoadUnloadTransfer implements ForwardTransferFunction<FlowSetStore> {

    /** The universe of the graph being analyzed. */
    private final FlowUniverse universe;

    /**
     * Create a new transfer function.
     *
     * @param universe the universe of the graph being analyzed
     */
    public LoadUnloadTransfer(FlowUniverse universe) {
        this.universe = universe;
    }

    /** The entry starts with no value present. */
    @Override
    public FlowSetStore initialStore(FlowGraph graph) {
        return FlowSetStore.empty(universe);
    }

    @Override
    public FlowSetStore transfer(GraphNode node, FlowSetStore input) {
        input.unload(node.getUnload());
        input.load(node.getLoad());
        return input;
    }
}
