package search;

import java.util.List;

public interface MultiPatternMatcher {

    // Every occurrence of every pattern, ordered by (endPosition, patternId).
    List<Match> findAll(CharSequence text);

    long countMatches(CharSequence text);

    PatternSet patterns();
}
