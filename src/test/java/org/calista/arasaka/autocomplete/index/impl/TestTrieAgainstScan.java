package org.calista.arasaka.autocomplete.index.impl;

import org.calista.arasaka.autocomplete.rank.Entry;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Differential test: the trie must return exactly what a full scan + sort returns.
 */
public class TestTrieAgainstScan {

    private static final char[] ALPHABET = {'a', 'b', 'c', ' '};

    private static String randomPhrase(Random gen, int maxLen) {
        int len = gen.nextInt(maxLen + 1);
        StringBuilder sb = new StringBuilder(len);
        for (int i = 0; i < len; i++) sb.append(ALPHABET[gen.nextInt(ALPHABET.length)]);
        return sb.toString();
    }

    @Test
    public void testRandomCorpora() {
        Random gen = new Random(20250731L);

        for (int round = 0; round < 20; round++) {
            int k = 1 + gen.nextInt(6);
            TrieIndex trie = new TrieIndex(k);
            ScanIndex scan = new ScanIndex(k);
            Set<String> seen = new HashSet<>();

            int n = 50 + gen.nextInt(400);
            for (int i = 0; i < n; i++) {
                String phrase = randomPhrase(gen, 6);
                // narrow score range to force ties
                long score = gen.nextInt(20) - 5;
                trie.insert(phrase, score);
                scan.insert(phrase, score);
                seen.add(phrase);
            }

            List<String> prefixes = new ArrayList<>(seen);
            for (int i = 0; i < 50; i++) prefixes.add(randomPhrase(gen, 8));

            for (String prefix : prefixes) {
                List<Entry> expected = scan.queryEntries(prefix);
                assertEquals("k=" + k + " prefix='" + prefix + "'", expected, trie.queryEntries(prefix));
            }
        }
    }

    @Test
    public void testPrefixEndingInsideSurrogatePair() {
        TrieIndex trie = new TrieIndex(3);
        ScanIndex scan = new ScanIndex(3);
        for (String phrase : List.of("\uD83D\uDE00 smile", "\uD83D\uDE00 grin", "\uD83Dx")) {
            trie.insert(phrase, phrase.length());
            scan.insert(phrase, phrase.length());
        }

        // a lone high surrogate is its own symbol: it matches "\uD83Dx" only
        assertEquals(List.of("\uD83Dx"), trie.query("\uD83D"));
        assertEquals(trie.queryEntries("\uD83D"), scan.queryEntries("\uD83D"));

        for (String prefix : List.of("", "\uD83D\uDE00", "\uD83D\uDE00 ", "\uD83D\uDE00 g", "\uDE00", "\uD83Dx")) {
            assertEquals("prefix='" + prefix + "'", scan.queryEntries(prefix), trie.queryEntries(prefix));
        }
        assertEquals(List.of("\uD83D\uDE00 smile", "\uD83D\uDE00 grin"), scan.query("\uD83D\uDE00"));
    }

    @Test
    public void testLongerPrefixResultsWereCandidatesForShorterPrefix() {
        Random gen = new Random(7L);
        TrieIndex trie = new TrieIndex(3);
        List<Entry> inserted = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            String phrase = randomPhrase(gen, 5);
            long score = gen.nextInt(1000);
            trie.insert(phrase, score);
            inserted.add(Entry.of(phrase, score));
        }

        for (String p2 : List.of("a", "ab", "abc", "b a", "cc")) {
            String p1 = p2.substring(0, p2.length() - 1);
            for (Entry e : trie.queryEntries(p2)) {
                assertTrue(e.phrase.startsWith(p2));
                assertTrue(e.phrase.startsWith(p1));
                assertTrue(inserted.contains(e));
            }
        }
    }
}
