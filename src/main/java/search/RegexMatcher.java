package search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;

// Baseline matcher: one literal java.util.regex pattern per search string, run one after another.
public class RegexMatcher implements MultiPatternMatcher {

    private final PatternSet patterns;
    private final java.util.regex.Pattern[] compiled;

    public RegexMatcher(PatternSet patterns) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
        this.compiled = new java.util.regex.Pattern[patterns.size()];
        for (Pattern p : patterns) {
            if (p.isEmpty()) {
                throw new EmptyPatternException(p.id());
            }
            if (!isCharPattern(p)) {
                throw new IllegalArgumentException("pattern " + p.id()
                        + " is not a char pattern; the regex baseline only matches UTF-16 text");
            }
            compiled[p.id()] = java.util.regex.Pattern.compile(p.text(), java.util.regex.Pattern.LITERAL);
        }
    }

    // Symbols must be exactly the UTF-16 units of the text, otherwise a literal regex matches something else.
    private static boolean isCharPattern(Pattern p) {
        String text = p.text();
        if (text.length() != p.length()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != p.symbolAt(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public PatternSet patterns() {
        return patterns;
    }

    @Override
    public List<Match> findAll(CharSequence text) {
        Objects.requireNonNull(text, "text");
        ArrayList<Match> out = new ArrayList<>();
        for (int id = 0; id < compiled.length; id++) {
            Matcher matcher = compiled[id].matcher(text);
            // find(int) resets the matcher, so restarting one past the last start also yields overlaps
            int from = 0;
            while (from <= text.length() && matcher.find(from)) {
                out.add(new Match(id, matcher.end() - 1));
                from = matcher.start() + 1;
            }
        }
        Collections.sort(out);
        return out;
    }

    @Override
    public long countMatches(CharSequence text) {
        return findAll(text).size();
    }
}
