package search;

// Raised before any state is created when a zero-length pattern is submitted.
public class EmptyPatternException extends IllegalArgumentException {

    private final int patternId;

    public EmptyPatternException(int patternId) {
        super("pattern " + patternId + " is empty; empty patterns are not allowed");
        this.patternId = patternId;
    }

    public int patternId() {
        return patternId;
    }
}
