package com.dictscan.ahocorasick;

import org.junit.Test;

import static org.junit.Assert.*;

public class ChildTableTest {

    @Test
    public void emptyTableHasNoChildren() {
        ChildTable table = new ChildTable();
        assertEquals(0, table.size());
        assertEquals(NodeStore.NO_NODE, table.get('a'));
        assertEquals(0, table.keys().length);
        assertEquals(0, table.targets().length);
    }

    @Test
    public void putAndGet() {
        ChildTable table = new ChildTable();
        table.put('c', 3);
        table.put('a', 1);
        table.put('b', 2);
        assertEquals(3, table.size());
        assertEquals(1, table.get('a'));
        assertEquals(2, table.get('b'));
        assertEquals(3, table.get('c'));
        assertEquals(NodeStore.NO_NODE, table.get('d'));
        assertArrayEquals(new char[] { 'c', 'a', 'b' }, table.keys());
    }

    @Test
    public void putRebindsExistingKey() {
        ChildTable table = new ChildTable();
        table.put('x', 1);
        table.put('x', 7);
        assertEquals(1, table.size());
        assertEquals(7, table.get('x'));
    }

    @Test
    public void freezeSortsPairsTogether() {
        ChildTable table = new ChildTable();
        table.put('z', 26);
        table.put('\uffff', 99);
        table.put('a', 1);
        table.put('m', 13);
        table.freeze();
        assertTrue(table.isFrozen());
        assertArrayEquals(new char[] { 'a', 'm', 'z', '\uffff' }, table.keys());
        assertArrayEquals(new int[] { 1, 13, 26, 99 }, table.targets());
        assertEquals(99, table.get('\uffff'));
        assertEquals(13, table.get('m'));
        assertEquals(NodeStore.NO_NODE, table.get('b'));
    }

    @Test
    public void freezeWideTable() {
        ChildTable table = new ChildTable();
        for (int c = Character.MAX_VALUE; c >= 0; c -= 3) {
            table.put((char) c, c + 1);
        }
        table.freeze();
        char[] keys = table.keys();
        for (int i = 1; i < keys.length; ++i) {
            assertTrue(keys[i - 1] < keys[i]);
        }
        for (int c = Character.MAX_VALUE; c >= 0; c -= 3) {
            assertEquals(c + 1, table.get((char) c));
        }
        assertEquals(NodeStore.NO_NODE, table.get((char) (Character.MAX_VALUE - 1)));
    }

    @Test(expected = IllegalStateException.class)
    public void putAfterFreezeFails() {
        ChildTable table = new ChildTable();
        table.put('a', 1);
        table.freeze();
        table.put('b', 2);
    }
}
