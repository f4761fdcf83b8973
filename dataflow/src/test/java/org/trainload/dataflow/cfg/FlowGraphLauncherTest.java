package org.trainload.dataflow.cfg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FlowGraphLauncherTest {

    @Rule public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(InputStream stdin, String... args) {
        FlowGraphLauncher launcher =
                new FlowGraphLauncher(
                        new PrintStream(out, true, StandardCharsets.UTF_8),
                        new PrintStream(err, true, StandardCharsets.UTF_8));
        return launcher.run(args, stdin);
    }

    private int run(String... args) {
        return run(new ByteArrayInputStream(new byte[0]), args);
    }

    private static String scenario(String name) throws URISyntaxException {
        URL url = FlowGraphLauncherTest.class.getResource("/scenarios/" + name);
        return new File(url.toURI()).getPath();
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void analyzesInputFile() throws Exception {
        assertEquals(FlowGraphLauncher.EXIT_OK, run(scenario("chain.txt")));
        assertEquals("1:\n2: 20\n3: 20 40\n", stdout());
        assertEquals("", stderr());
    }

    @Test
    public void readsStandardInputWithoutFileArgument() {
        InputStream stdin =
                new ByteArrayInputStream(
                        "2 2\n1 1 2\n2 3 4\n1 2\n2 1\n1\n".getBytes(StandardCharsets.UTF_8));

        assertEquals(FlowGraphLauncher.EXIT_OK, run(stdin));
        assertEquals("1: 2 4\n2: 2 4\n", stdout());
    }

    @Test
    public void dashMeansStandardInput() {
        InputStream stdin =
                new ByteArrayInputStream("1 0\n1 5 6\n1\n".getBytes(StandardCharsets.UTF_8));

        assertEquals(FlowGraphLauncher.EXIT_OK, run(stdin, "-", "-order", "fifo"));
        assertEquals("1:\n", stdout());
    }

    @Test
    public void fifoOrderPrintsTheSameResult() throws Exception {
        assertEquals(FlowGraphLauncher.EXIT_OK, run(scenario("two-cycle.txt"), "-order", "fifo"));
        assertEquals("1: 2 4\n2: 2 4\n", stdout());
    }

    @Test
    public void verbosePrintsStatistics() throws Exception {
        assertEquals(FlowGraphLauncher.EXIT_OK, run(scenario("chain.txt"), "-verbose"));
        assertTrue(stderr().contains("nodes:           3"));
        assertTrue(stderr().contains("flow values:     5"));
        assertTrue(stderr().contains("reachable nodes: 3"));
        assertTrue(stderr().contains("recomputations:  3"));
    }

    @Test
    public void writesOutputFile() throws Exception {
        File target = new File(folder.getRoot(), "result.txt");

        assertEquals(
                FlowGraphLauncher.EXIT_OK,
                run(scenario("chain.txt"), "-output", target.getPath()));
        assertEquals("", stdout());
        assertEquals(
                "1:\n2: 20\n3: 20 40\n",
                new String(Files.readAllBytes(target.toPath()), StandardCharsets.UTF_8));
    }

    @Test
    public void malformedInput() throws Exception {
        assertEquals(FlowGraphLauncher.EXIT_MALFORMED_INPUT, run(scenario("malformed.txt")));
        assertTrue(stderr().startsWith("ERROR: line 3:"));
        assertEquals("", stdout());
    }

    @Test
    public void unknownNodeReference() throws Exception {
        assertEquals(FlowGraphLauncher.EXIT_INVALID_GRAPH, run(scenario("unknown-node.txt")));
        assertTrue(stderr().contains("unknown node 7"));
        assertEquals("", stdout());
    }

    @Test
    public void duplicateNodeId() throws Exception {
        assertEquals(FlowGraphLauncher.EXIT_INVALID_GRAPH, run(scenario("duplicate-node.txt")));
        assertTrue(stderr().contains("node 1 is declared more than once"));
    }

    @Test
    public void missingInputFile() {
        String missing = new File(folder.getRoot(), "absent.txt").getPath();

        assertEquals(FlowGraphLauncher.EXIT_USAGE, run(missing));
        assertTrue(stderr().startsWith("ERROR: Cannot read input"));
    }

    @Test
    public void unknownArgument() {
        assertEquals(FlowGraphLauncher.EXIT_USAGE, run("-bogus"));
        assertTrue(stderr().contains("Unknown command line argument: -bogus"));
        assertTrue(stderr().contains("Parameters:"));
    }

    @Test
    public void missingOptionValue() {
        assertEquals(FlowGraphLauncher.EXIT_USAGE, run("-order"));
        assertTrue(stderr().contains("Did not find <rpo|fifo> after -order."));
    }

    @Test
    public void unknownWorklistOrder() {
        assertEquals(FlowGraphLauncher.EXIT_USAGE, run("-order", "lifo"));
        assertTrue(stderr().contains("unknown worklist order: lifo"));
    }
}
