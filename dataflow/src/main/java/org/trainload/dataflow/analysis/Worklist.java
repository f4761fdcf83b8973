package org.trainload.dataflow.analysis;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.Queue;
import org.checkerframework.javacutil.BugInCF;
import org.trainload.dataflow.cfg.DepthFirstOrder;

/**
 * A worklist of dense node indices with set semantics: adding a node that is already queued has no
 * effect. Only nodes reachable from the entry can be queued.
 *
 * <p>With {@link WorklistOrder#REVERSE_POSTORDER} the node with the lowest reverse-postorder rank
 * is polled first, so on acyclic regions every node is computed after all of its predecessors.
 */
public class Worklist {

    /** The reverse-postorder ranks of the graph being analyzed. */
    protected final DepthFirstOrder depthFirstOrder;

    /** The queued node indices. */
    protected final Queue<Integer> queue;

    /** Membership flag per dense node index. */
    protected final boolean[] queued;

    /**
     * Create an empty worklist.
     *
     * @param depthFirstOrder the ranks of the graph being analyzed
     * @param nodeCount the number of nodes of the graph
     * @param order the order nodes are polled in
     */
    public Worklist(DepthFirstOrder depthFirstOrder, int nodeCount, WorklistOrder order) {
        this.depthFirstOrder = depthFirstOrder;
        this.queued = new boolean[nodeCount];
        switch (order) {
            case REVERSE_POSTORDER:
                this.queue =
                        new PriorityQueue<>(
                                Math.max(1, depthFirstOrder.size()),
                                Comparator.comparingInt(depthFirstOrder::rankOf));
                break;
            case FIFO:
                this.queue = new ArrayDeque<>();
                break;
            default:
                throw new BugInCF("Worklist: unexpected worklist order " + order);
        }
    }

    /**
     * Queue a node unless it is already queued.
     *
     * @param index a dense node index
     * @return true if the node was not queued before
     */
    public boolean add(int index) {
        if (!depthFirstOrder.isReachable(index)) {
            throw new BugInCF("Worklist::add() node index " + index + " is not reachable");
        }
        if (queued[index]) {
            return false;
        }
        queued[index] = true;
        queue.add(index);
        return true;
    }

    /**
     * @param index a dense node index
     * @return true if the node is currently queued
     */
    public boolean contains(int index) {
        return queued[index];
    }

    /** @return true if no node is queued */
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Remove and return the next node.
     *
     * @return the dense index of the next node
     */
    public int poll() {
        Integer index = queue.poll();
        if (index == null) {
            throw new BugInCF("Worklist::poll() called on an empty worklist");
        }
        queued[index] = false;
        return index;
    }

    @Override
    public String toString() {
        return "Worklist(" + queue + ")";
    }
}
