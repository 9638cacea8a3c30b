package automaton;

/**
 * Build summary of one compiled automaton. {@code retainedBytes} is -1 unless memory was measured.
 */
public record AutomatonStats(int patternCount,
                             int stateCount,
                             int columns,
                             long transitionEntries,
                             int outputEntries,
                             int maxDepth,
                             long trieNanos,
                             long compileNanos,
                             long retainedBytes) {

    public static AutomatonStats of(CompiledAutomaton automaton, long trieNanos, long compileNanos, long retainedBytes) {
        int maxDepth = 0;
        for (int s = 0; s < automaton.stateCount(); s++) {
            maxDepth = Math.max(maxDepth, automaton.depth(s));
        }
        return new AutomatonStats(automaton.patterns().size(),
                automaton.stateCount(),
                automaton.columns(),
                (long) automaton.stateCount() * automaton.columns(),
                automaton.outputEntries(),
                maxDepth,
                trieNanos,
                compileNanos,
                retainedBytes);
    }

    public double buildMillis() {
        return (trieNanos + compileNanos) / 1_000_000.0;
    }
}
