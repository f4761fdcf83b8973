package org.trainload.dataflow.cfg;

import java.io.File;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.SortedSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.trainload.dataflow.analysis.AnalysisResult;
import org.trainload.dataflow.analysis.WorklistOrder;
import org.trainload.dataflow.loadunload.FlowSetStore;
import org.trainload.dataflow.loadunload.FlowUniverse;
import org.trainload.dataflow.loadunload.LoadUnloadAnalysis;

/** The load/unload analysis launcher. */
public class FlowGraphLauncher {

    /** Exit status of a successful run. */
    public static final int EXIT_OK = 0;

    /** Exit status for bad arguments and I/O problems. */
    public static final int EXIT_USAGE = 1;

    /** Exit status for a malformed graph description. */
    public static final int EXIT_MALFORMED_INPUT = 2;

    /** Exit status for a duplicate node id or a reference to an undeclared node. */
    public static final int EXIT_INVALID_GRAPH = 3;

    private final PrintStream out;
    private final PrintStream err;

    /**
     * Create a launcher.
     *
     * @param out where results are printed unless {@code -output} is given
     * @param err where errors and statistics are printed
     */
    public FlowGraphLauncher(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /** Main method. */
    public static void main(String[] args) {
        int status = new FlowGraphLauncher(System.out, System.err).run(args, System.in);
        System.exit(status);
    }

    /**
     * Parse the arguments, analyze the graph and print the result.
     *
     * @param args the command-line arguments
     * @param stdin the stream read when no input file is given
     * @return the exit status
     */
    public int run(String[] args, InputStream stdin) {
        @Nullable String input = null;
        @Nullable String output = null;
        WorklistOrder order = WorklistOrder.REVERSE_POSTORDER;
        boolean verbose = false;
        boolean error = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-order":
                    if (i >= args.length - 1) {
                        printError("Did not find <rpo|fifo> after -order.");
                        error = true;
                        continue;
                    }
                    i++;
                    try {
                        order = WorklistOrder.fromName(args[i]);
                    } catch (IllegalArgumentException e) {
                        printError(e.getMessage());
                        error = true;
                    }
                    break;
                case "-output":
                    if (i >= args.length - 1) {
                        printError("Did not find <file> after -output.");
                        error = true;
                        continue;
                    }
                    i++;
                    output = args[i];
                    break;
                case "-verbose":
                    verbose = true;
                    break;
                default:
                    if (input == null && (!args[i].startsWith("-") || args[i].equals("-"))) {
                        input = args[i];
                    } else {
                        printError("Unknown command line argument: " + args[i]);
                        error = true;
                    }
                    break;
            }
        }

        if (error) {
            printUsage();
            return EXIT_USAGE;
        }

        FlowGraph graph;
        try (Reader reader = openInput(input, stdin)) {
            graph = FlowGraphParser.parse(reader);
        } catch (MalformedInputError e) {
            printError(e.getMessage());
            return EXIT_MALFORMED_INPUT;
        } catch (DuplicateNodeIdError | UnknownNodeReferenceError e) {
            printError(e.getMessage());
            return EXIT_INVALID_GRAPH;
        } catch (IOException e) {
            printError("Cannot read input: " + e.getMessage());
            return EXIT_USAGE;
        }

        LoadUnloadAnalysis analysis = new LoadUnloadAnalysis(order);
        AnalysisResult<FlowSetStore> result = analysis.run(graph);
        Map<Integer, SortedSet<Integer>> values = LoadUnloadAnalysis.extract(result);
        String text = new StringResultFormatter().format(values);

        if (verbose) {
            printStatistics(graph, order, result);
        }

        if (output == null) {
            out.print(text);
            out.flush();
        } else {
            try (Writer writer =
                    Files.newBufferedWriter(new File(output).toPath(), StandardCharsets.UTF_8)) {
                writer.write(text);
            } catch (IOException e) {
                printError("Cannot write output file " + output + ": " + e.getMessage());
                return EXIT_USAGE;
            }
        }
        return EXIT_OK;
    }

    private static Reader openInput(@Nullable String input, InputStream stdin) throws IOException {
        if (input == null || input.equals("-")) {
            return new InputStreamReader(new NonClosingInputStream(stdin), StandardCharsets.UTF_8);
        }
        return Files.newBufferedReader(new File(input).toPath(), StandardCharsets.UTF_8);
    }

    private void printStatistics(
            FlowGraph graph, WorklistOrder order, AnalysisResult<FlowSetStore> result) {
        err.println("nodes:           " + graph.size());
        err.println("edges:           " + graph.getEdgeCount());
        err.println("flow values:     " + FlowUniverse.of(graph).size());
        err.println("reachable nodes: " + DepthFirstOrder.compute(graph).size());
        err.println("worklist order:  " + order);
        err.println("recomputations:  " + result.getProcessedCount());
    }

    /** Print an error message. */
    void printError(String string) {
        err.println("ERROR: " + string);
    }

    /** Print usage information. */
    private void printUsage() {
        err.println("Compute the flow values that can reach every node of a graph.");
        err.println("Parameters: [<inputfile>] [-order rpo|fifo] [-output <file>] [-verbose]");
        err.println("    <inputfile>: The graph description (defaults to standard input).");
        err.println("    -order:      The worklist order (defaults to 'rpo').");
        err.println("    -output:     Write the result to a file instead of standard output.");
        err.println("    -verbose:    Print run statistics to standard error.");
    }

    /** Keeps {@link System#in} open when the reader wrapping it is closed. */
    private static final class NonClosingInputStream extends FilterInputStream {
        NonClosingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public void close() {}
    }
}
