package trie;

import search.EmptyPatternException;
import search.Pattern;
import search.PatternSet;

import java.util.Objects;

public final class TrieBuilder {

    private TrieBuilder() {
    }

    /**
     * Builds the prefix tree for {@code patterns}, one path per pattern with shared prefixes merged.
     * Every pattern is checked before the first state is created.
     *
     * @throws EmptyPatternException if any pattern has zero length
     */
    public static Trie build(PatternSet patterns) {
        Objects.requireNonNull(patterns, "patterns");
        for (Pattern p : patterns) {
            if (p.isEmpty()) {
                throw new EmptyPatternException(p.id());
            }
        }

        Trie trie = new Trie(patterns.totalLength() + 1);
        for (Pattern p : patterns) {
            trie.insert(p);
        }
        return trie;
    }
}
