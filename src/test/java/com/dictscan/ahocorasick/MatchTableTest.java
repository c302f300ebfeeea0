package com.dictscan.ahocorasick;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class MatchTableTest {

    @Test
    public void asMapListsEveryPattern() {
        MatchTable.Builder builder = MatchTable.builder(3);
        builder.onMatch(2, 4);
        builder.onMatch(2, 9);
        MatchTable table = builder.build();

        Map<Integer, List<Integer>> map = table.asMap();
        assertEquals(Arrays.asList(1, 2, 3), Arrays.asList(map.keySet().toArray()));
        assertEquals(Collections.emptyList(), map.get(1));
        assertEquals(Arrays.asList(4, 9), map.get(2));
        assertEquals(2, table.totalMatches());
        assertFalse(table.isEmpty());
        assertEquals("{1=[], 2=[4, 9], 3=[]}", table.toString());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void offsetsAreReadOnly() {
        MatchTable.Builder builder = MatchTable.builder(1);
        builder.onMatch(1, 0);
        builder.build().offsets(1).add(5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void offsetsRejectIdZero() {
        MatchTable.builder(2).build().offsets(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void offsetsRejectIdPastCount() {
        MatchTable.builder(2).build().offsets(3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void builderRejectsUnknownId() {
        MatchTable.builder(2).onMatch(3, 0);
    }

    @Test(expected = IllegalStateException.class)
    public void builderIsSingleUse() {
        MatchTable.Builder builder = MatchTable.builder(1);
        builder.build();
        builder.onMatch(1, 0);
    }

    @Test
    public void equality() {
        MatchTable.Builder b1 = MatchTable.builder(2);
        MatchTable.Builder b2 = MatchTable.builder(2);
        b1.onMatch(1, 3);
        b2.onMatch(1, 3);
        assertEquals(b1.build(), b2.build());
        assertNotEquals(MatchTable.builder(1).build(), MatchTable.builder(2).build());
    }
}
