package org.trainload.dataflow.loadunload;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import org.junit.Test;
import org.trainload.dataflow.analysis.AnalysisResult;
import org.trainload.dataflow.analysis.WorklistOrder;
import org.trainload.dataflow.cfg.FlowGraph;
import org.trainload.dataflow.cfg.FlowGraphParser;

public class LoadUnloadAnalysisTest {

    private static Map<Integer, SortedSet<Integer>> analyze(String description) {
        return new LoadUnloadAnalysis().analyze(FlowGraphParser.parse(description));
    }

    @Test
    public void chain() {
        Map<Integer, SortedSet<Integer>> result =
                analyze("3 2\n1 10 20\n2 30 40\n3 20 50\n1 2\n2 3\n1\n");

        assertEquals(Set.of(), result.get(1));
        assertEquals(Set.of(20), result.get(2));
        assertEquals(Set.of(20, 40), result.get(3));
    }

    @Test
    public void twoNodeCycle() {
        Map<Integer, SortedSet<Integer>> result = analyze("2 2\n1 1 2\n2 3 4\n1 2\n2 1\n1\n");

        assertEquals(Set.of(2, 4), result.get(1));
        assertEquals(Set.of(2, 4), result.get(2));
    }

    @Test
    public void diamond() {
        Map<Integer, SortedSet<Integer>> result =
                analyze("4 4\n1 0 10\n2 10 20\n3 99 30\n4 0 40\n1 2\n1 3\n2 4\n3 4\n1\n");

        assertEquals(Set.of(), result.get(1));
        assertEquals(Set.of(10), result.get(2));
        assertEquals(Set.of(10), result.get(3));
        assertEquals(Set.of(10, 20, 30), result.get(4));
    }

    @Test
    public void disconnectedComponentStaysEmpty() {
        Map<Integer, SortedSet<Integer>> result =
                analyze(
                        "5 3\n1 0 10\n2 10 20\n3 20 30\n4 0 40\n5 40 50\n"
                                + "1 2\n2 3\n4 5\n1\n");

        assertEquals(Set.of(), result.get(1));
        assertEquals(Set.of(10), result.get(2));
        assertEquals(Set.of(20), result.get(3));
        assertEquals(Set.of(), result.get(4));
        assertEquals(Set.of(), result.get(5));
    }

    @Test
    public void cycleBackToTheEntry() {
        Map<Integer, SortedSet<Integer>> result = analyze("2 2\n1 0 10\n2 10 20\n1 2\n2 1\n1\n");

        assertEquals(Set.of(20), result.get(1));
        assertEquals(Set.of(10, 20), result.get(2));
    }

    @Test
    public void selfLoop() {
        Map<Integer, SortedSet<Integer>> result = analyze("2 2\n1 0 10\n2 0 20\n1 2\n2 2\n1\n");

        assertEquals(Set.of(), result.get(1));
        assertEquals(Set.of(10, 20), result.get(2));
    }

    @Test
    public void threeNodeCycleUnloadsWhatThePreviousNodeLoaded() {
        Map<Integer, SortedSet<Integer>> result =
                analyze("3 3\n1 30 10\n2 10 20\n3 20 30\n1 2\n2 3\n3 1\n1\n");

        assertEquals(Set.of(30), result.get(1));
        assertEquals(Set.of(10), result.get(2));
        assertEquals(Set.of(20), result.get(3));
    }

    @Test
    public void parallelChainsMerge() {
        Map<Integer, SortedSet<Integer>> result =
                analyze(
                        "5 5\n1 0 1\n2 0 2\n3 0 3\n4 0 4\n5 4 5\n"
                                + "1 2\n1 3\n2 4\n3 4\n4 5\n1\n");

        assertEquals(Set.of(1), result.get(2));
        assertEquals(Set.of(1), result.get(3));
        assertEquals(Set.of(1, 2, 3), result.get(4));
        assertEquals(Set.of(1, 2, 3, 4), result.get(5));
    }

    @Test
    public void ladder() {
        Map<Integer, SortedSet<Integer>> result =
                analyze(
                        "6 7\n1 0 10\n2 0 20\n3 0 30\n4 0 40\n5 0 50\n6 0 60\n"
                                + "1 2\n2 3\n4 5\n5 6\n1 4\n2 5\n3 6\n1\n");

        assertEquals(Set.of(10), result.get(4));
        assertEquals(Set.of(10, 20, 40), result.get(5));
        assertEquals(Set.of(10, 20), result.get(3));
        assertEquals(Set.of(10, 20, 30, 40, 50), result.get(6));
    }

    @Test
    public void completeGraphCarriesEveryValueEverywhere() {
        Map<Integer, SortedSet<Integer>> result =
                analyze(
                        "3 6\n1 0 10\n2 0 20\n3 0 30\n"
                                + "1 2\n1 3\n2 1\n2 3\n3 1\n3 2\n1\n");

        for (int id = 1; id <= 3; id++) {
            assertEquals(Set.of(10, 20, 30), result.get(id));
        }
    }

    @Test
    public void nodeThatUnloadsAndLoadsTheSameValuePassesItOn() {
        Map<Integer, SortedSet<Integer>> result =
                analyze("3 2\n1 0 5\n2 5 5\n3 0 0\n1 2\n2 3\n1\n");

        assertEquals(Set.of(5), result.get(2));
        assertEquals(Set.of(5), result.get(3));
    }

    @Test
    public void extremeValuesAndIds() {
        Map<Integer, SortedSet<Integer>> result =
                analyze(
                        "3 2\n"
                                + "2147483647 0 -2147483648\n"
                                + "-5 2147483647 2147483647\n"
                                + "0 7 -1\n"
                                + "2147483647 -5\n"
                                + "-5 0\n"
                                + "2147483647\n");

        assertEquals(List.of(-5, 0, Integer.MAX_VALUE), List.copyOf(result.keySet()));
        assertEquals(Set.of(Integer.MIN_VALUE), result.get(-5));
        assertEquals(List.of(Integer.MIN_VALUE, Integer.MAX_VALUE), List.copyOf(result.get(0)));
    }

    @Test
    public void entryWithAnUnreachablePredecessor() {
        Map<Integer, SortedSet<Integer>> result = analyze("2 1\n1 0 10\n2 0 20\n2 1\n1\n");

        assertEquals(Set.of(), result.get(1));
        assertEquals(Set.of(), result.get(2));
    }

    @Test
    public void singleNode() {
        Map<Integer, SortedSet<Integer>> result = analyze("1 0\n1 0 10\n1\n");

        assertEquals(Map.of(1, Set.of()), result);
    }

    @Test
    public void duplicateEdgesDoNotChangeTheResult() {
        String once = "3 2\n1 0 10\n2 10 20\n3 0 30\n1 2\n2 3\n1\n";
        String twice = "3 4\n1 0 10\n2 10 20\n3 0 30\n1 2\n1 2\n2 3\n2 3\n1\n";

        assertEquals(analyze(once), analyze(twice));
    }

    @Test
    public void worklistOrderDoesNotChangeTheResult() {
        FlowGraph graph =
                FlowGraphParser.parse(
                        "5 7\n1 0 1\n2 1 2\n3 2 3\n4 3 1\n5 0 5\n"
                                + "1 2\n2 3\n3 4\n4 2\n3 5\n5 1\n4 4\n1\n");

        assertEquals(
                new LoadUnloadAnalysis(WorklistOrder.REVERSE_POSTORDER).analyze(graph),
                new LoadUnloadAnalysis(WorklistOrder.FIFO).analyze(graph));
    }

    @Test
    public void longChainWithABackEdge() {
        int n = 100_000;
        FlowGraph.Builder builder = FlowGraph.builder().addNode(1, 0, 1);
        for (int id = 2; id <= n; id++) {
            builder.addNode(id, 1, 2).addEdge(id - 1, id);
        }
        FlowGraph graph = builder.addEdge(n, 1).setEntry(1).build();

        AnalysisResult<FlowSetStore> result = new LoadUnloadAnalysis().run(graph);
        Map<Integer, SortedSet<Integer>> values = LoadUnloadAnalysis.extract(result);

        assertEquals(Set.of(2), values.get(1));
        assertEquals(Set.of(1, 2), values.get(2));
        assertEquals(Set.of(2), values.get(n));
        assertEquals(n + 2, result.getProcessedCount());
    }

    @Test
    public void workBoundCoversEveryValueChangingOverEveryEdge() {
        FlowGraph graph = FlowGraphParser.parse("2 2\n1 1 2\n2 3 4\n1 2\n2 1\n1\n");
        FlowUniverse universe = FlowUniverse.of(graph);

        assertEquals(2 * (1 + 4 * 2), LoadUnloadAnalysis.workBound(graph, universe));
        assertTrue(
                new LoadUnloadAnalysis().run(graph).getProcessedCount()
                        <= LoadUnloadAnalysis.workBound(graph, universe));
    }

    @Test
    public void workBoundOfAGraphWithoutEdges() {
        FlowGraph graph = FlowGraphParser.parse("1 0\n1 3 3\n1\n");

        assertEquals(4, LoadUnloadAnalysis.workBound(graph, FlowUniverse.of(graph)));
    }
}
