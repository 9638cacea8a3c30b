package automaton;

import search.Match;
import search.SymbolSequence;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Lazy scan of one text through a {@link CompiledAutomaton}.
 *
 * The cursor only advances through the text when the caller asks for the next match, so
 * abandoning it part way costs nothing for the unread remainder. Matches come out ordered by
 * end position, then by pattern id. Not thread-safe; the automaton it reads is.
 */
public final class MatchCursor implements Iterator<Match> {

    private final CompiledAutomaton automaton;
    private final Alphabet alphabet;
    private final SymbolSequence text;
    private final int length;

    private int state = CompiledAutomaton.ROOT;
    // index of the last consumed symbol
    private int position = -1;
    // pending slice of the automaton's output ids for the current state
    private int pending;
    private int pendingEnd;

    MatchCursor(CompiledAutomaton automaton, SymbolSequence text) {
        this.automaton = Objects.requireNonNull(automaton, "automaton");
        this.text = Objects.requireNonNull(text, "text");
        this.alphabet = automaton.alphabet();
        this.length = text.length();
    }

    @Override
    public boolean hasNext() {
        if (pending < pendingEnd) {
            return true;
        }
        while (position + 1 < length) {
            position++;
            state = automaton.nextByColumn(state, alphabet.column(text.symbolAt(position)));
            int from = automaton.outputStart(state);
            int to = automaton.outputEnd(state);
            if (from != to) {
                pending = from;
                pendingEnd = to;
                return true;
            }
        }
        return false;
    }

    @Override
    public Match next() {
        if (!hasNext()) {
            throw new NoSuchElementException("no more matches after position " + position);
        }
        return new Match(automaton.outputId(pending++), position);
    }

    // Next match, or null once the text is exhausted.
    public Match nextMatch() {
        return hasNext() ? next() : null;
    }

    // Current automaton state.
    public int state() {
        return state;
    }

    // Index of the last symbol consumed, -1 before the first.
    public int position() {
        return position;
    }

    public boolean isExhausted() {
        return pending >= pendingEnd && position + 1 >= length;
    }
}
