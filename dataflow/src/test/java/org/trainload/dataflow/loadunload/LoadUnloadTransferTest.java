package org.trainload.dataflow.loadunload;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Set;
import org.junit.Test;
import org.trainload.dataflow.cfg.FlowGraph;
import org.trainload.dataflow.cfg.FlowGraphParser;
import org.trainload.dataflow.cfg.GraphNode;

public class LoadUnloadTransferTest {

    private final FlowGraph graph =
            FlowGraphParser.parse("3 0\n1 10 20\n2 30 30\n3 20 10\n1\n");
    private final FlowUniverse universe = FlowUniverse.of(graph);
    private final LoadUnloadTransfer transfer = new LoadUnloadTransfer(universe);

    private FlowSetStore storeOf(int... values) {
        FlowSetStore store = FlowSetStore.empty(universe);
        for (int value : values) {
            store.load(value);
        }
        return store;
    }

    @Test
    public void initialStoreIsEmpty() {
        assertTrue(transfer.initialStore(graph).isEmpty());
    }

    @Test
    public void unloadsThenLoads() {
        GraphNode node = graph.getNode(1);

        assertEquals(Set.of(20, 30), transfer.transfer(node, storeOf(10, 30)).toValueSet());
        assertEquals(Set.of(20), transfer.transfer(node, storeOf()).toValueSet());
    }

    @Test
    public void equalUnloadAndLoadPassesTheValueOn() {
        GraphNode node = graph.getNode(2);

        assertEquals(Set.of(30), transfer.transfer(node, storeOf()).toValueSet());
        assertEquals(Set.of(30), transfer.transfer(node, storeOf(30)).toValueSet());
    }

    @Test
    public void loadOfAValueJustUnloadedElsewhere() {
        GraphNode node = graph.getNode(3);

        assertEquals(Set.of(10, 30), transfer.transfer(node, storeOf(20, 30)).toValueSet());
    }
}
