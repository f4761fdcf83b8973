package org.trainload.dataflow.cfg;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads the line-oriented description of a {@link FlowGraph}:
 *
 * <pre>
 *   nodeCount edgeCount
 *   id unload load        (nodeCount lines)
 *   from to               (edgeCount lines)
 *   entryId
 * </pre>
 *
 * Tokens are integers separated by whitespace. Blank lines after the entry line are ignored;
 * anything else after it is an error.
 */
public class FlowGraphParser {

    private final BufferedReader reader;
    private int lineNumber = 0;

    private FlowGraphParser(Reader reader) {
        this.reader =
                reader instanceof BufferedReader
                        ? (BufferedReader) reader
                        : new BufferedReader(reader);
    }

    /**
     * Parse a graph description.
     *
     * @param reader the description; not closed by this method
     * @return the graph
     * @throws IOException if reading fails
     * @throws MalformedInputError if a line is missing or has the wrong tokens
     * @throws DuplicateNodeIdError if two nodes share an id
     * @throws UnknownNodeReferenceError if an edge or the entry names an undeclared node
     */
    public static FlowGraph parse(Reader reader) throws IOException {
        return new FlowGraphParser(reader).parseGraph();
    }

    /**
     * Parse a graph description held in a string.
     *
     * @param text the description
     * @return the graph
     */
    public static FlowGraph parse(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new UncheckedIOException("reading from a string failed", e);
        }
    }

    private FlowGraph parseGraph() throws IOException {
        int[] header = readInts("header 'nodeCount edgeCount'", 2);
        int nodeCount = header[0];
        int edgeCount = header[1];
        if (nodeCount < 0 || edgeCount < 0) {
            throw new MalformedInputError(lineNumber, "counts must not be negative");
        }

        FlowGraph.Builder builder = FlowGraph.builder();
        for (int i = 0; i < nodeCount; i++) {
            int[] node = readInts("node 'id unload load'", 3);
            builder.addNode(node[0], node[1], node[2]);
        }
        for (int i = 0; i < edgeCount; i++) {
            int[] edge = readInts("edge 'from to'", 2);
            builder.addEdge(edge[0], edge[1]);
        }
        builder.setEntry(readInts("entry id", 1)[0]);

        String rest;
        while ((rest = reader.readLine()) != null) {
            lineNumber++;
            if (!rest.trim().isEmpty()) {
                throw new MalformedInputError(lineNumber, "unexpected content after the entry id");
            }
        }
        return builder.build();
    }

    /**
     * Read the next line and split it into exactly {@code count} integers.
     *
     * @param what a description of the expected line, for error messages
     * @param count the expected number of tokens
     * @return the parsed integers
     */
    private int[] readInts(String what, int count) throws IOException {
        @Nullable String line = reader.readLine();
        lineNumber++;
        if (line == null) {
            throw new MalformedInputError(lineNumber, "expected " + what + " but input ended");
        }
        String trimmed = line.trim();
        String[] tokens = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
        if (tokens.length != count) {
            throw new MalformedInputError(
                    lineNumber,
                    "expected "
                            + what
                            + " ("
                            + count
                            + " integers) but found "
                            + tokens.length
                            + " tokens");
        }
        int[] values = new int[count];
        for (int i = 0; i < count; i++) {
            try {
                values[i] = Integer.parseInt(tokens[i]);
            } catch (NumberFormatException e) {
                MalformedInputError error =
                        new MalformedInputError(lineNumber, "'" + tokens[i] + "' is not an integer");
                error.initCause(e);
                throw error;
            }
        }
        return values;
    }
}
