package automaton;

import org.junit.jupiter.api.Test;
import search.EmptyPatternException;
import search.Match;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AhoCorasickTest {

    @Test
    void failedBuildKeepsPatternsAndAllowsRetry() {
        AhoCorasick builder = AhoCorasick.builder()
                .addPattern("he")
                .addPattern("")
                .addPattern("she");

        EmptyPatternException e = assertThrows(EmptyPatternException.class, builder::build);
        assertEquals(1, e.patternId());
        assertEquals(AhoCorasick.Status.NOT_BUILT, builder.status());
        assertEquals(3, builder.size());

        CompiledAutomaton ac = builder.removePattern(1).build();
        assertEquals(AhoCorasick.Status.BUILT, builder.status());
        assertEquals(List.of(new Match(0, 3), new Match(1, 3)), ac.findAll("ushe"));
    }

    @Test
    void addingAPatternResetsStatus() {
        AhoCorasick builder = AhoCorasick.builder().addPattern("a");
        builder.build();
        assertEquals(AhoCorasick.Status.BUILT, builder.status());

        builder.addPattern("b");
        assertEquals(AhoCorasick.Status.NOT_BUILT, builder.status());
        assertEquals(2, builder.build().patterns().size());
    }

    @Test
    void clearedBuilderBuildsEmptyAutomaton() {
        CompiledAutomaton ac = AhoCorasick.builder().addPattern("x").clear().build();
        assertEquals(0, ac.patterns().size());
        assertTrue(ac.findAll("xxx").isEmpty());
    }

    @Test
    void statsAreCollectedOnlyWhenConfigured() {
        AhoCorasick quiet = AhoCorasick.builder().addPattern("abc");
        quiet.build();
        assertNull(quiet.lastStats());

        AhoCorasick noisy = AhoCorasick.builder(AutomatonConfiguration.builder().collectStats(true).build())
                .addPatterns(List.of("he", "she", "his", "hers"));
        noisy.build();
        AutomatonStats stats = noisy.lastStats();
        assertNotNull(stats);
        assertEquals(4, stats.patternCount());
        assertEquals(10, stats.stateCount());
        assertEquals(6, stats.columns());
        assertEquals(4, stats.maxDepth());
        assertEquals(-1L, stats.retainedBytes());
        assertTrue(stats.buildMillis() >= 0.0);
    }

    @Test
    void measuredMemoryIsRecordedInStats() {
        AutomatonConfiguration configuration = AutomatonConfiguration.builder()
                .collectStats(true)
                .measureMemory(true)
                .build();
        AhoCorasick builder = AhoCorasick.builder(configuration)
                .addPatterns(List.of("he", "she", "his", "hers"));
        CompiledAutomaton ac = builder.build();

        long bytes = builder.lastStats().retainedBytes();
        assertTrue(bytes > (long) ac.stateCount() * ac.columns() * Integer.BYTES, "retained " + bytes);
    }

    @Test
    void byteModeMatchesUtf8Offsets() {
        AutomatonConfiguration bytes = AutomatonConfiguration.builder()
                .symbolKind(AutomatonConfiguration.SymbolKind.BYTE)
                .build();
        CompiledAutomaton ac = AhoCorasick.builder(bytes)
                .addPattern("é")
                .addPattern(new byte[]{'x'})
                .build();

        // 'a' = 1 byte, 'é' = 2 bytes
        List<Match> matches = ac.findAll("aéx");
        assertEquals(List.of(new Match(0, 2), new Match(1, 3)), matches);
        assertEquals(matches, ac.findAll("aéx".getBytes(StandardCharsets.UTF_8)));
        assertEquals(2, ac.patterns().get(0).length());
        assertEquals("é", ac.patterns().get(0).text());
    }

    @Test
    void charModeCountsUtf16Units() {
        CompiledAutomaton ac = AhoCorasick.compile(List.of("é"));
        assertEquals(List.of(new Match(0, 1)), ac.findAll("aé"));
    }
}
