package org.calista.arasaka.autocomplete.index;

import org.calista.arasaka.autocomplete.rank.Entry;

import java.util.ArrayList;
import java.util.List;

/**
 * AutocompleteIndex answers "top K by score among phrases starting with a prefix".
 *
 * <p>
 * Implementations share one ranking contract ({@link org.calista.arasaka.autocomplete.rank.Ranking#BEST_FIRST})
 * so they can be compared against each other entry by entry.
 * </p>
 *
 * <ul>
 *   <li>{@code insert} never fails for a non-null phrase; an empty phrase is legal.</li>
 *   <li>{@code query} on a prefix nothing starts with returns an empty list, not an error.</li>
 *   <li>results never exceed {@link #limit()}.</li>
 * </ul>
 */
public interface AutocompleteIndex {

    /** Adds a phrase with its score. Inserting the same phrase again adds another candidate. */
    void insert(String phrase, long score);

    /**
     * Ranked entries (best first) for phrases starting with {@code prefix}.
     * The returned list is unmodifiable.
     */
    List<Entry> queryEntries(String prefix);

    /** Ranked phrases (best first) for {@code prefix}; at most {@link #limit()} of them. */
    default List<String> query(String prefix) {
        List<Entry> ranked = queryEntries(prefix);
        if (ranked.isEmpty()) return List.of();

        ArrayList<String> out = new ArrayList<>(ranked.size());
        for (Entry e : ranked) out.add(e.phrase);
        return List.copyOf(out);
    }

    /** K: the maximum number of results per query. */
    int limit();

    /** Number of accepted {@code insert} calls. */
    long size();
}
