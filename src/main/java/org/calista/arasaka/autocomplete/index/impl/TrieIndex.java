package org.calista.arasaka.autocomplete.index.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.autocomplete.index.AutocompleteIndex;
import org.calista.arasaka.autocomplete.rank.Entry;

import java.util.List;
import java.util.Objects;

/**
 * TrieIndex: prefix tree with a bounded top-K cache at every node.
 *
 * <p>
 * The ranking work happens on insert: each node on the phrase's path (root included) is offered
 * the new entry once, O(L log K) for a phrase of L symbols. A query is then a walk down the prefix
 * plus a sort of at most K cached entries, O(P + K log K).
 * </p>
 *
 * <p>
 * Symbols are Unicode code points. An empty phrase is stored at the root only, so it surfaces
 * just for the empty prefix.
 * </p>
 *
 * <p>Not thread-safe: callers sharing an instance must synchronize writes against reads.</p>
 */
public final class TrieIndex implements AutocompleteIndex {

    private static final Logger log = LogManager.getLogger(TrieIndex.class);

    public static final int DEFAULT_LIMIT = 10;

    private final int limit;
    private final TrieNode root;

    private long size = 0L;
    private long nodeCount = 1L;

    public TrieIndex() {
        this(DEFAULT_LIMIT);
    }

    /**
     * @param limit K, the number of entries kept per node; must be positive
     * @throws IllegalArgumentException if {@code limit <= 0}
     */
    public TrieIndex(int limit) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0: " + limit);
        this.limit = limit;
        this.root = new TrieNode(limit);
        log.debug("TrieIndex created: limit={}", limit);
    }

    @Override
    public void insert(String phrase, long score) {
        Objects.requireNonNull(phrase, "phrase");

        Entry entry = new Entry(score, phrase);
        TrieNode node = root;
        node.offer(entry);

        for (int i = 0; i < phrase.length(); ) {
            int cp = phrase.codePointAt(i);
            i += Character.charCount(cp);

            TrieNode next = node.child(cp);
            if (next == null) {
                next = node.addChild(cp, limit);
                nodeCount++;
            }
            node = next;
            node.offer(entry);
        }
        size++;
    }

    @Override
    public List<Entry> queryEntries(String prefix) {
        TrieNode node = find(Objects.requireNonNull(prefix, "prefix"));
        if (node == null) return List.of();
        return List.copyOf(node.bestK().ranked());
    }

    @Override
    public int limit() {
        return limit;
    }

    @Override
    public long size() {
        return size;
    }

    /** Number of trie nodes, root included. */
    public long nodeCount() {
        return nodeCount;
    }

    /** Node spelling {@code prefix}, or null when no stored phrase starts with it. */
    private TrieNode find(String prefix) {
        TrieNode node = root;
        for (int i = 0; i < prefix.length(); ) {
            int cp = prefix.codePointAt(i);
            i += Character.charCount(cp);

            node = node.child(cp);
            if (node == null) return null;
        }
        return node;
    }

    @Override
    public String toString() {
        return "TrieIndex{limit=" + limit + ", size=" + size + ", nodes=" + nodeCount + '}';
    }
}
