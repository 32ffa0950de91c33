package org.calista.arasaka.autocomplete.rank;

import java.util.Objects;

/**
 * Small immutable (score, phrase) pair, the unit of ranking.
 * Natural order is {@link Ranking#BEST_FIRST}: descending score with a stable tie-break.
 */
public final class Entry implements Comparable<Entry> {
    public final long score;
    public final String phrase;

    public Entry(long score, String phrase) {
        this.score = score;
        this.phrase = Objects.requireNonNull(phrase, "phrase");
    }

    public static Entry of(String phrase, long score) {
        return new Entry(score, phrase);
    }

    @Override
    public int compareTo(Entry o) {
        return Ranking.BEST_FIRST.compare(this, o);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Entry e)) return false;
        return score == e.score && phrase.equals(e.phrase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phrase, score);
    }

    @Override
    public String toString() {
        return "Entry{score=" + score + ", phrase=" + phrase + '}';
    }
}
