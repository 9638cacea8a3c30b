package search;

/**
 * One occurrence: pattern {@code patternId} ends at text index {@code endPosition} (inclusive).
 */
public record Match(int patternId, int endPosition) implements Comparable<Match> {

    public int startPosition(int patternLength) {
        return endPosition - patternLength + 1;
    }

    public int startPosition(PatternSet patterns) {
        return startPosition(patterns.get(patternId).length());
    }

    @Override
    public int compareTo(Match o) {
        int c = Integer.compare(endPosition, o.endPosition);
        return c != 0 ? c : Integer.compare(patternId, o.patternId);
    }
}
