package org.calista.arasaka.autocomplete.index.impl;

import org.calista.arasaka.autocomplete.index.AutocompleteIndex;
import org.calista.arasaka.autocomplete.rank.Entry;
import org.calista.arasaka.autocomplete.rank.Ranking;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ScanIndex: the brute-force baseline. Keeps everything, scans everything.
 *
 * <p>O(1) insert, O(N * P + M log M) query where M is the number of matches.
 * Kept as the reference answer for {@link TrieIndex}: both rank with
 * {@link Ranking#BEST_FIRST} and match prefixes on whole code points, so their results must
 * agree exactly.</p>
 */
public final class ScanIndex implements AutocompleteIndex {

    private final int limit;
    private final ArrayList<Entry> entries = new ArrayList<>();

    /** Length (in chars) of the longest stored phrase; longer prefixes cannot match. */
    private int maxLength = 0;

    public ScanIndex(int limit) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0: " + limit);
        this.limit = limit;
    }

    @Override
    public void insert(String phrase, long score) {
        Objects.requireNonNull(phrase, "phrase");
        entries.add(new Entry(score, phrase));
        maxLength = Math.max(maxLength, phrase.length());
    }

    @Override
    public List<Entry> queryEntries(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (prefix.length() > maxLength) return List.of();

        ArrayList<Entry> matching = new ArrayList<>();
        for (Entry e : entries) {
            if (startsWithSymbols(e.phrase, prefix)) matching.add(e);
        }
        if (matching.isEmpty()) return List.of();

        matching.sort(Ranking.BEST_FIRST);
        return List.copyOf(matching.subList(0, Math.min(limit, matching.size())));
    }

    /**
     * {@code startsWith} on code points: a prefix ending in a high surrogate does not match a
     * phrase whose next char is the low half of the same symbol.
     */
    static boolean startsWithSymbols(String phrase, String prefix) {
        if (!phrase.startsWith(prefix)) return false;
        int n = prefix.length();
        if (n == 0 || n == phrase.length()) return true;
        return !(Character.isHighSurrogate(prefix.charAt(n - 1)) && Character.isLowSurrogate(phrase.charAt(n)));
    }

    @Override
    public int limit() {
        return limit;
    }

    @Override
    public long size() {
        return entries.size();
    }
}
