package org.calista.arasaka.autocomplete.rank;

import java.util.Comparator;

/**
 * Ranking order shared by every index implementation.
 *
 * <p>Score descending. Equal scores fall back to the phrase in ascending
 * {@link String#compareTo} order, so "apple" ranks ahead of "apricot" at the same score.
 * Two entries compare equal only when both score and phrase match.</p>
 */
public final class Ranking {

    public static final Comparator<Entry> BEST_FIRST = (a, b) -> {
        int c = Long.compare(b.score, a.score);
        if (c != 0) return c;
        return a.phrase.compareTo(b.phrase);
    };

    private Ranking() {}
}
