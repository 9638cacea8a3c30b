package search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered collection of patterns with dense ids 0..size-1.
 * Duplicate strings are kept as separate patterns.
 */
public final class PatternSet implements Iterable<Pattern> {

    private static final PatternSet EMPTY = new PatternSet(List.of());

    private final List<Pattern> patterns;
    private final int totalLength;

    private PatternSet(List<Pattern> patterns) {
        this.patterns = Collections.unmodifiableList(patterns);
        int total = 0;
        for (Pattern p : patterns) {
            total += p.length();
        }
        this.totalLength = total;
    }

    public static PatternSet empty() {
        return EMPTY;
    }

    public static PatternSet ofStrings(List<String> strings) {
        Objects.requireNonNull(strings, "strings");
        Builder b = builder();
        for (String s : strings) {
            b.add(s);
        }
        return b.build();
    }

    public static PatternSet ofStrings(String... strings) {
        return ofStrings(List.of(strings));
    }

    public static PatternSet ofBytes(List<byte[]> arrays) {
        Objects.requireNonNull(arrays, "arrays");
        Builder b = builder();
        for (byte[] a : arrays) {
            b.add(a);
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return patterns.size();
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    public Pattern get(int id) {
        return patterns.get(id);
    }

    public List<Pattern> asList() {
        return patterns;
    }

    // Sum of all pattern lengths, an upper bound on the number of trie states minus one.
    public int totalLength() {
        return totalLength;
    }

    @Override
    public Iterator<Pattern> iterator() {
        return patterns.iterator();
    }

    @Override
    public String toString() {
        return "PatternSet" + patterns;
    }

    public static final class Builder {
        private final List<Pattern> patterns = new ArrayList<>();

        private Builder() {
        }

        public Builder add(String s) {
            patterns.add(Pattern.of(patterns.size(), s));
            return this;
        }

        public Builder addUtf8(String s) {
            patterns.add(Pattern.utf8(patterns.size(), s));
            return this;
        }

        public Builder add(byte[] bytes) {
            patterns.add(Pattern.of(patterns.size(), bytes));
            return this;
        }

        public Builder add(int[] symbols) {
            patterns.add(Pattern.of(patterns.size(), symbols));
            return this;
        }

        public int size() {
            return patterns.size();
        }

        public PatternSet build() {
            if (patterns.isEmpty()) {
                return EMPTY;
            }
            return new PatternSet(new ArrayList<>(patterns));
        }
    }
}
