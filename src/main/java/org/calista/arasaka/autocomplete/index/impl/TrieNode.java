package org.calista.arasaka.autocomplete.index.impl;

import org.calista.arasaka.autocomplete.rank.BoundedTopK;
import org.calista.arasaka.autocomplete.rank.Entry;
import org.calista.arasaka.autocomplete.rank.Ranking;

import java.util.HashMap;
import java.util.Map;

/**
 * One trie vertex: the prefix spelled by the path from the root.
 *
 * <p>Children are keyed by Unicode code point and owned exclusively by this node.
 * {@code bestK} caches the best entries of every phrase whose path runs through here.</p>
 */
final class TrieNode {

    private final Map<Integer, TrieNode> children = new HashMap<>(4);
    private final BoundedTopK<Entry> bestK;

    TrieNode(int limit) {
        this.bestK = new BoundedTopK<>(limit, Ranking.BEST_FIRST);
    }

    TrieNode child(int symbol) {
        return children.get(symbol);
    }

    TrieNode addChild(int symbol, int limit) {
        TrieNode c = new TrieNode(limit);
        children.put(symbol, c);
        return c;
    }

    boolean offer(Entry e) {
        return bestK.offer(e);
    }

    BoundedTopK<Entry> bestK() {
        return bestK;
    }
}
