package org.trainload.dataflow.cfg;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Renders analysis results as text, one line per node in ascending id order: the id and a colon,
 * followed by the node's flow values in ascending order. A node without values prints as {@code
 * id:} with nothing after the colon.
 */
public class StringResultFormatter {

    /** The line separator used between nodes. */
    private final String lineSeparator;

    /** Create a formatter that ends every line with {@code \n}. */
    public StringResultFormatter() {
        this("\n");
    }

    /**
     * Create a formatter.
     *
     * @param lineSeparator the string that ends every line
     */
    public StringResultFormatter(String lineSeparator) {
        this.lineSeparator = lineSeparator;
    }

    /**
     * Format a result.
     *
     * @param result a map from node id to the flow values of that node
     * @return the text, one terminated line per node
     */
    public String format(Map<Integer, ? extends Collection<Integer>> result) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, ? extends Collection<Integer>> entry :
                new TreeMap<>(result).entrySet()) {
            sb.append(formatLine(entry.getKey(), entry.getValue())).append(lineSeparator);
        }
        return sb.toString();
    }

    /**
     * Format the line of one node.
     *
     * @param nodeId the node id
     * @param values the flow values of the node, in any order
     * @return the line, without separator
     */
    public String formatLine(int nodeId, Collection<Integer> values) {
        StringBuilder sb = new StringBuilder();
        sb.append(nodeId).append(':');
        for (int value : new TreeSet<>(values)) {
            sb.append(' ').append(value);
        }
        return sb.toString();
    }
}
