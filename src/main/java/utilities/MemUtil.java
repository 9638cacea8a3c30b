package utilities;

import automaton.CompiledAutomaton;
import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;

import java.util.Locale;

public class MemUtil {

    private static final double MIB = 1024.0 * 1024.0;

    // Retained size of the object graph rooted at root, as JOL walks it.
    public long retainedBytes(Object root) {
        return GraphLayout.parseInstance(root).totalSize();
    }

    // Detailed JOL report for a compiled automaton, optionally with the class footprint table.
    public String jolMemoryReport(boolean includeFootprintTable, CompiledAutomaton automaton) {
        StringBuilder sb = new StringBuilder(4096);

        // VM details (useful to interpret alignment, header sizes, and compressed oops status)
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout total = GraphLayout.parseInstance(automaton);
        sb.append("\n=== Automaton total (automaton as root) ===\n");
        sb.append("States            : ").append(automaton.stateCount()).append('\n');
        sb.append("Columns           : ").append(automaton.columns()).append('\n');
        sb.append("Total bytes       : ").append(total.totalSize()).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", total.totalSize() / MIB))
                .append(" MiB\n");

        sb.append("Goto table bytes  : ").append(transitionTableBytes(automaton)).append(" B\n");

        // The pattern set is shared with the caller, so show it separately too.
        long patternBytes = GraphLayout.parseInstance(automaton.patterns()).totalSize();
        sb.append("Pattern set bytes : ").append(patternBytes).append(" B\n");

        if (includeFootprintTable) {
            sb.append("\n--- Class footprint (automaton root) ---\n");
            sb.append(total.toFootprint()).append('\n');
        }
        return sb.toString();
    }

    // Like jolMemoryReport but also returns the total MiB value.
    public MemoryUsageReport jolMemoryReportWithTotal(boolean includeFootprintTable, CompiledAutomaton automaton) {
        String txt = jolMemoryReport(includeFootprintTable, automaton);
        double totalMiB = retainedBytes(automaton) / MIB;
        return new MemoryUsageReport(txt, totalMiB);
    }

    // Rough size of the dense transition table alone, without walking the heap.
    public long transitionTableBytes(CompiledAutomaton automaton) {
        final int align = VM.current().objectAlignment();
        final int intArrayHeader = 16;
        long payload = (long) automaton.stateCount() * automaton.columns() * Integer.BYTES;
        return alignUp(intArrayHeader + payload, align);
    }

    private static long alignUp(long v, int align) {
        return (v + align - 1) / align * align;
    }
}
