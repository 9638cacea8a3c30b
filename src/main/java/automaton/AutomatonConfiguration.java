package automaton;

// Immutable configuration for building automata through AhoCorasick.
public final class AutomatonConfiguration {

    public enum SymbolKind {
        // UTF-16 code units
        CHAR,
        // UTF-8 encoded bytes
        BYTE
    }

    private final SymbolKind symbolKind;
    private final int expectedPatterns;
    private final boolean collectStats;
    private final boolean measureMemory;

    private AutomatonConfiguration(Builder builder) {
        this.symbolKind = builder.symbolKind;
        this.expectedPatterns = builder.expectedPatterns;
        this.collectStats = builder.collectStats;
        this.measureMemory = builder.measureMemory;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static AutomatonConfiguration defaults() { return builder().build(); }

    private void validate() {
        if (symbolKind == null) {
            throw new IllegalArgumentException("symbolKind must not be null");
        }
        if (expectedPatterns < 0) {
            throw new IllegalArgumentException("expectedPatterns must be non-negative");
        }
        if (measureMemory && !collectStats) {
            throw new IllegalArgumentException("measureMemory requires collectStats");
        }
    }

    public SymbolKind symbolKind() { return symbolKind; }
    public int expectedPatterns() { return expectedPatterns; }
    public boolean collectStats() { return collectStats; }
    public boolean measureMemory() { return measureMemory; }

    @Override
    public String toString() {
        return "AutomatonConfiguration{symbolKind=" + symbolKind
                + ", expectedPatterns=" + expectedPatterns
                + ", collectStats=" + collectStats
                + ", measureMemory=" + measureMemory + '}';
    }

    public static final class Builder {
        private SymbolKind symbolKind = SymbolKind.CHAR;
        private int expectedPatterns = 16;
        private boolean collectStats;
        private boolean measureMemory;

        private Builder() {
        }

        public Builder symbolKind(SymbolKind symbolKind) {
            this.symbolKind = symbolKind;
            return this;
        }

        public Builder expectedPatterns(int expectedPatterns) {
            this.expectedPatterns = expectedPatterns;
            return this;
        }

        public Builder collectStats(boolean collectStats) {
            this.collectStats = collectStats;
            return this;
        }

        public Builder measureMemory(boolean measureMemory) {
            this.measureMemory = measureMemory;
            return this;
        }

        public AutomatonConfiguration build() {
            return new AutomatonConfiguration(this);
        }
    }
}
