package org.trainload.dataflow.loadunload;

import java.util.BitSet;
import java.util.SortedSet;
import java.util.StringJoiner;
import java.util.TreeSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.BugInCF;
import org.trainload.dataflow.analysis.Store;

/**
 * The set of flow values present at one point of the graph, as a bit vector over a {@link
 * FlowUniverse}.
 */
public class FlowSetStore implements Store<FlowSetStore> {

    /** The universe the bits are indexed by. */
    private final FlowUniverse universe;

    /** Bit {@code i} is set iff {@code universe.valueAt(i)} is present. */
    private final BitSet bits;

    /**
     * Create a new store.
     *
     * @param universe the universe the bits are indexed by
     * @param bits the bits; owned by the new store from now on
     */
    protected FlowSetStore(FlowUniverse universe, BitSet bits) {
        this.universe = universe;
        this.bits = bits;
    }

    /**
     * @param universe a universe
     * @return a new store with no value present
     */
    public static FlowSetStore empty(FlowUniverse universe) {
        return new FlowSetStore(universe, new BitSet(universe.size()));
    }

    /** @return the universe the bits of this store are indexed by */
    public FlowUniverse getUniverse() {
        return universe;
    }

    /**
     * Remove a value from this store.
     *
     * @param value a flow value of the universe
     */
    public void unload(int value) {
        bits.clear(indexOf(value));
    }

    /**
     * Add a value to this store.
     *
     * @param value a flow value of the universe
     */
    public void load(int value) {
        bits.set(indexOf(value));
    }

    /**
     * @param value a flow value
     * @return true if the value is present in this store
     */
    public boolean contains(int value) {
        int index = universe.indexOf(value);
        return index >= 0 && bits.get(index);
    }

    /**
     * @param other another store over the same universe
     * @return true if every value present in {@code other} is present in this store
     */
    public boolean containsAll(FlowSetStore other) {
        checkSameUniverse(other);
        BitSet missing = (BitSet) other.bits.clone();
        missing.andNot(bits);
        return missing.isEmpty();
    }

    /** @return true if no value is present */
    public boolean isEmpty() {
        return bits.isEmpty();
    }

    /** @return the number of values present */
    public int size() {
        return bits.cardinality();
    }

    /**
     * Translate the bits back to flow values.
     *
     * @return the values present in this store, in ascending order
     */
    public SortedSet<Integer> toValueSet() {
        SortedSet<Integer> values = new TreeSet<>();
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            values.add(universe.valueAt(i));
        }
        return values;
    }

    @Override
    public FlowSetStore copy() {
        return new FlowSetStore(universe, (BitSet) bits.clone());
    }

    @Override
    public FlowSetStore leastUpperBound(FlowSetStore other) {
        checkSameUniverse(other);
        BitSet lub = (BitSet) bits.clone();
        lub.or(other.bits);
        return new FlowSetStore(universe, lub);
    }

    private int indexOf(int value) {
        int index = universe.indexOf(value);
        if (index < 0) {
            throw new BugInCF("FlowSetStore: value " + value + " is not in " + universe);
        }
        return index;
    }

    private void checkSameUniverse(FlowSetStore other) {
        if (other.universe != universe) {
            throw new BugInCF("FlowSetStore: stores over different universes cannot be combined");
        }
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof FlowSetStore)) {
            return false;
        }
        FlowSetStore other = (FlowSetStore) obj;
        return universe == other.universe && bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return bits.hashCode();
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (int value : toValueSet()) {
            joiner.add(Integer.toString(value));
        }
        return joiner.toString();
    }
}
