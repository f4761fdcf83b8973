package org.trainload.dataflow.cfg;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Reverse-postorder ranks of the nodes reachable from the entry of a {@link FlowGraph}.
 *
 * <p>The traversal is a single depth-first search from the entry that visits successors in edge
 * declaration order and marks each node at most once. A node is emitted in postorder once all of
 * its outgoing edges have been explored; edges into already visited nodes are not followed again.
 * The reverse of that postorder gives the ranks. Nodes not reachable from the entry have no rank.
 *
 * <p>The search keeps its own stack, so long chains do not exhaust the call stack.
 */
public final class DepthFirstOrder {

    /** Rank per dense node index, or -1 for unreachable nodes. */
    private final int[] rankByIndex;

    /** Dense node indices in reverse postorder. */
    private final int[] reversePostorder;

    private DepthFirstOrder(int[] rankByIndex, int[] reversePostorder) {
        this.rankByIndex = rankByIndex;
        this.reversePostorder = reversePostorder;
    }

    /**
     * Compute the reverse postorder of the given graph.
     *
     * @param graph the graph
     * @return the ordering
     */
    public static DepthFirstOrder compute(FlowGraph graph) {
        int n = graph.size();
        boolean[] visited = new boolean[n];
        // position of the next successor to explore, per node on the stack
        int[] nextChild = new int[n];
        int[] postorder = new int[n];
        int postorderSize = 0;

        Deque<Integer> stack = new ArrayDeque<>();
        int entry = graph.getEntryIndex();
        visited[entry] = true;
        stack.push(entry);

        while (!stack.isEmpty()) {
            int current = stack.peek();
            int[] successors = graph.successorIndices(current);
            if (nextChild[current] < successors.length) {
                int successor = successors[nextChild[current]++];
                if (!visited[successor]) {
                    visited[successor] = true;
                    stack.push(successor);
                }
            } else {
                stack.pop();
                postorder[postorderSize++] = current;
            }
        }

        int[] rankByIndex = new int[n];
        Arrays.fill(rankByIndex, -1);
        int[] reversePostorder = new int[postorderSize];
        for (int i = 0; i < postorderSize; i++) {
            int index = postorder[postorderSize - 1 - i];
            reversePostorder[i] = index;
            rankByIndex[index] = i;
        }
        return new DepthFirstOrder(rankByIndex, reversePostorder);
    }

    /**
     * @param index a dense node index
     * @return the reverse-postorder rank of the node, or -1 if it is unreachable from the entry
     */
    public int rankOf(int index) {
        return rankByIndex[index];
    }

    /**
     * @param index a dense node index
     * @return true if the node is reachable from the entry
     */
    public boolean isReachable(int index) {
        return rankByIndex[index] >= 0;
    }

    /** @return the number of nodes reachable from the entry */
    public int size() {
        return reversePostorder.length;
    }

    /**
     * @param rank a reverse-postorder rank
     * @return the dense index of the node with that rank
     */
    public int indexAt(int rank) {
        return reversePostorder[rank];
    }
}
