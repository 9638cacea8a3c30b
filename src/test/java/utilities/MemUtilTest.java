package utilities;

import automaton.AhoCorasick;
import automaton.CompiledAutomaton;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemUtilTest {

    private final CompiledAutomaton ac = AhoCorasick.compile(List.of("he", "she", "his", "hers"));

    @Test
    void transitionTableEstimateCoversPayload() {
        long bytes = new MemUtil().transitionTableBytes(ac);

        assertTrue(bytes >= (long) ac.stateCount() * ac.columns() * Integer.BYTES);
    }

    @Test
    void retainedSizeIncludesTheGotoTable() {
        MemUtil mem = new MemUtil();

        assertTrue(mem.retainedBytes(ac) >= mem.transitionTableBytes(ac));
    }

    @Test
    void reportDescribesTheAutomaton() {
        MemUtil mem = new MemUtil();
        String report = mem.jolMemoryReport(true, ac);

        assertTrue(report.contains("States            : 10"), report);
        assertTrue(report.contains("Columns           : 6"), report);
        assertTrue(report.contains("Goto table bytes  : " + mem.transitionTableBytes(ac) + " B"), report);
        assertTrue(report.contains("Class footprint"), report);
        assertTrue(report.contains("Pattern set bytes"), report);
    }

    @Test
    void reportWithTotalMatchesRetainedSize() {
        MemUtil mem = new MemUtil();
        MemoryUsageReport report = mem.jolMemoryReportWithTotal(false, ac);

        assertEquals(mem.retainedBytes(ac) / (1024.0 * 1024.0), report.totalMiB(), 1e-9);
        assertTrue(report.totalMiB() > 0.0);
        assertTrue(!report.report().contains("Class footprint"), report.report());
    }
}
