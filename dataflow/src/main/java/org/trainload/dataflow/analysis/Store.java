package org.trainload.dataflow.analysis;

/**
 * A store is the set of facts an analysis tracks at one point of the graph. Stores form a lattice
 * whose join is {@link #leastUpperBound}.
 *
 * <p>Stores are compared with {@link Object#equals}; the fixpoint engine relies on it to decide
 * whether a node's output changed.
 *
 * @param <S> the type of the store returned by {@code copy} and {@code leastUpperBound}; usually
 *     the implementing class itself
 */
public interface Store<S extends Store<S>> {

    /** @return an exact copy of this store */
    S copy();

    /**
     * Compute the least upper bound of two stores.
     *
     * <p><em>Important</em>: This method must fulfill the following contract:
     *
     * <ul>
     *   <li>Does not change {@code this}.
     *   <li>Does not change {@code other}.
     *   <li>Returns a fresh object which is not aliased yet.
     *   <li>Returns an object of the same (dynamic) type as {@code this}, even if the signature is
     *       more permissive.
     *   <li>Is commutative.
     * </ul>
     *
     * @param other the other store
     * @return the join of {@code this} and {@code other}
     */
    S leastUpperBound(S other);
}
