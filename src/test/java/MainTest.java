import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path dir;

    private Path patterns(String... lines) throws IOException {
        Path file = dir.resolve("patterns.txt");
        Files.writeString(file, String.join("\n", lines), StandardCharsets.UTF_8);
        return file;
    }

    private static String run(String... args) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
        int code = Main.run(Main.CliOptions.parse(args), out);
        assertEquals(0, code);
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsEveryMatchWithStartAndEnd() throws IOException {
        Path p = patterns("he", "she", "his", "hers");

        String out = run("--patterns", p.toString(), "--input", "ahishers");

        assertEquals(String.join("\n",
                "2\t1\t3\this",
                "0\t4\t5\the",
                "1\t3\t5\tshe",
                "3\t4\t7\thers") + "\n", out.replace("\r\n", "\n"));
    }

    @Test
    void limitStopsEarly() throws IOException {
        Path p = patterns("a");
        String out = run("--patterns=" + p, "--input=aaaaa", "--limit", "2");
        assertEquals(2, out.strip().split("\\R").length);
    }

    @Test
    void countOnly() throws IOException {
        Path p = patterns("a", "aa");
        Path text = dir.resolve("text.txt");
        Files.writeString(text, "aaa", StandardCharsets.UTF_8);

        assertEquals("5", run("--patterns", p.toString(), "--text", text.toString(), "--count").strip());
    }

    @Test
    void byteModeReportsByteOffsets() throws IOException {
        Path p = patterns("x");
        String out = run("--patterns", p.toString(), "--input", "éx", "--bytes");
        assertEquals("0\t2\t2\tx", out.strip());
    }

    @Test
    void blankLinesInPatternFileAreSkipped() throws IOException {
        Path p = patterns("", "b", "");
        assertEquals("1", run("--patterns", p.toString(), "--input", "abc", "--count").strip());
    }

    @Test
    void statsLineIsPrinted() throws IOException {
        Path p = patterns("ab");
        String out = run("--patterns", p.toString(), "--input", "ab", "--stats", "--count");
        assertTrue(out.startsWith("# patterns=1 states=3 columns=3"), out);
    }

    @Test
    void memoryIsReportedWithStats() throws IOException {
        Path p = patterns("he", "she", "his", "hers");
        String out = run("--patterns", p.toString(), "--input", "ushers", "--stats", "--memory", "--count");

        String statsLine = out.lines().findFirst().orElseThrow();
        long bytes = Long.parseLong(statsLine.substring(statsLine.indexOf("bytes=") + 6));
        assertTrue(bytes > 0, statsLine);
        assertTrue(out.strip().endsWith("3"), out);
    }

    @Test
    void missingPatternsGoesToStderr() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int code = Main.run(Main.CliOptions.parse(new String[]{"--input", "abc"}),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(2, code);
        assertEquals("", out.toString(StandardCharsets.UTF_8));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    }

    @Test
    void unreadableFilesExitWithOne() throws IOException {
        Path p = patterns("a");
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8);
        PrintStream out = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
        Path missing = dir.resolve("missing.txt");

        assertEquals(1, Main.run(Main.CliOptions.parse(
                new String[]{"--patterns", missing.toString(), "--input", "a"}), out, errStream));
        assertEquals(1, Main.run(Main.CliOptions.parse(
                new String[]{"--patterns", p.toString(), "--text", missing.toString()}), out, errStream));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("missing.txt"));
    }

    @Test
    void badOptionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliOptions.parse(new String[]{"--nope", "1"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliOptions.parse(new String[]{"--limit"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliOptions.parse(new String[]{"--limit", "0"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliOptions.parse(new String[]{"stray"}));
        assertThrows(IllegalArgumentException.class,
                () -> Main.CliOptions.parse(new String[]{"--text", "a", "--input", "b"}));
    }

    @Test
    void flagsParse() {
        Main.CliOptions o = Main.CliOptions.parse(new String[]{"--bytes", "--count", "--seed", "7", "--benchmark"});
        assertTrue(o.bytes);
        assertTrue(o.countOnly);
        assertTrue(o.benchmark);
        assertFalse(o.stats);
        assertEquals(7L, o.seed);
        assertEquals(Long.MAX_VALUE, o.limit);
    }

    @Test
    void benchmarkOnSmallGeneratedWorkloadAgrees() {
        String out = run("--benchmark", "--text-length", "2000", "--pattern-count", "50", "--seed", "3");
        assertTrue(out.contains("speedup vs regex"), out);
    }
}
