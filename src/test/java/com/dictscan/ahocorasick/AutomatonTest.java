package com.dictscan.ahocorasick;

import org.junit.Before;
import org.junit.Test;

import java.util.LinkedHashSet;
import java.util.Random;
import java.util.Set;

import static com.dictscan.ahocorasick.LinkResolverTest.stateOf;
import static org.junit.Assert.*;

public class AutomatonTest {
    private Automaton automaton;

    @Before
    public void setUp() {
        automaton = Automaton.build(LinkResolverTest.DICTIONARY);
    }

    @Test
    public void shape() {
        // root, a, ab, b, ba, bab, bc, bca, c, ca, caa
        assertEquals(11, automaton.nodeCount());
        assertEquals(7, automaton.patternCount());
        assertEquals(3, automaton.maxDepth());
        assertArrayEquals(new char[] { 'a', 'b', 'c' }, automaton.childSymbols(Automaton.ROOT));
        assertArrayEquals(new char[0], automaton.childSymbols(stateOf(automaton, "caa")));
    }

    @Test
    public void transitionFollowsTrieEdges() {
        int a = automaton.transition(Automaton.ROOT, 'a');
        assertEquals(stateOf(automaton, "a"), a);
        assertEquals(stateOf(automaton, "ab"), automaton.transition(a, 'b'));
    }

    @Test
    public void transitionFallsBackAlongSuffixLinks() {
        // ab has no 'c' child; ab -> b -> bc.
        assertEquals(stateOf(automaton, "bc"), automaton.transition(stateOf(automaton, "ab"), 'c'));
        // bc has no 'c' child; bc -> c -> root -> c.
        assertEquals(stateOf(automaton, "c"), automaton.transition(stateOf(automaton, "bc"), 'c'));
        assertEquals(Automaton.ROOT, automaton.transition(stateOf(automaton, "caa"), 'z'));
        assertEquals(Automaton.ROOT, automaton.transition(Automaton.ROOT, 'z'));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void transitionRejectsUnknownState() {
        automaton.transition(automaton.nodeCount(), 'a');
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void transitionRejectsNoState() {
        automaton.transition(Automaton.NO_STATE, 'a');
    }

    @Test
    public void nodeAccessors() {
        int bca = stateOf(automaton, "bca");
        assertEquals(3, automaton.depth(bca));
        assertEquals('a', automaton.symbol(bca));
        assertEquals(stateOf(automaton, "bc"), automaton.parent(bca));
        assertEquals(5, automaton.patternId(bca));
        assertEquals(0, automaton.patternId(stateOf(automaton, "ca")));
    }

    @Test
    public void hasPrefix() {
        assertTrue(automaton.hasPrefix(""));
        assertTrue(automaton.hasPrefix("b"));
        assertTrue(automaton.hasPrefix("ba"));
        assertTrue(automaton.hasPrefix("caa"));
        assertFalse(automaton.hasPrefix("bb"));
        assertFalse(automaton.hasPrefix("caaa"));
        assertFalse(automaton.hasPrefix("z"));
    }

    @Test
    public void lookup() {
        assertEquals(1, automaton.lookup("a"));
        assertEquals(5, automaton.lookup("bca"));
        assertEquals(7, automaton.lookup(new StringBuilder("caa")));
        assertEquals(0, automaton.lookup("ba"));
        assertEquals(0, automaton.lookup(""));
        assertEquals(0, automaton.lookup("abc"));
    }

    @Test(expected = NullPointerException.class)
    public void lookupRejectsNull() {
        automaton.lookup(null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void patternIdZeroIsNotAPattern() {
        automaton.pattern(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void patternIdPastDictionary() {
        automaton.pattern(8);
    }

    @Test
    public void stats() {
        AutomatonStats stats = automaton.getStats();
        assertEquals(11, stats.getNodeCount());
        assertEquals(7, stats.getPatternCount());
        assertEquals(3, stats.getMaxDepth());
        assertTrue(stats.getBuildMillis() >= 0);
        String json = stats.toJson();
        assertTrue(json, json.contains("\"node_count\":11"));
        assertTrue(json, json.contains("\"pattern_count\":7"));
        assertTrue(json, json.contains("\"max_depth\":3"));
        assertTrue(automaton.toString().contains("nodes=11"));
    }

    @Test
    public void structuralInvariantsOnRandomDictionaries() {
        Random random = new Random(7);
        for (int round = 0; round < 50; ++round) {
            Set<String> dictionary = new LinkedHashSet<>();
            int size = 1 + random.nextInt(30);
            while (dictionary.size() < size) {
                dictionary.add(randomString(random, 1 + random.nextInt(6), 3));
            }
            Automaton a = Automaton.build(dictionary);

            Set<Integer> seenIds = new LinkedHashSet<>();
            for (int state = 0; state < a.nodeCount(); ++state) {
                if (a.patternId(state) != 0) assertTrue(seenIds.add(a.patternId(state)));
                if (state == Automaton.ROOT) continue;

                int link = a.suffixLink(state);
                assertTrue(a.depth(link) < a.depth(state));
                assertEquals(a.depth(a.parent(state)) + 1, a.depth(state));

                int dict = a.dictSuffixLink(state);
                if (dict != Automaton.NO_STATE) {
                    assertNotEquals(Automaton.ROOT, dict);
                    assertTrue(a.patternId(dict) != 0);
                    assertTrue(a.depth(dict) < a.depth(state));
                }
            }
            // Ids are dense: every entry of a duplicate-free dictionary owns one terminal.
            assertEquals(dictionary.size(), seenIds.size());
            int id = 1;
            for (String pattern : dictionary) {
                assertEquals(id++, a.lookup(pattern));
            }
        }
    }

    static String randomString(Random random, int length, int alphabet) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; ++i) sb.append((char) ('a' + random.nextInt(alphabet)));
        return sb.toString();
    }
}
