package com.dictscan.ahocorasick;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Iterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * Drives an {@link Automaton} over a text in a single pass and reports
 * every occurrence of every pattern by its end offset.
 */
public class MatchScanner {
  private static final Logger log = LoggerFactory.getLogger(MatchScanner.class);

  /**
   * Returns the lists of end offsets of all patterns in {@code text}.
   * Total: an empty text or an automaton without patterns yields a table
   * without matches.
   */
  public static MatchTable scan(Automaton automaton, CharSequence text) {
    checkNotNull(automaton, "automaton");
    MatchTable.Builder builder = MatchTable.builder(automaton.patternCount());
    scan(automaton, text, builder);
    MatchTable table = builder.build();
    if (log.isTraceEnabled()) {
      log.trace("Found {} match(es) in {} char(s)", table.totalMatches(),
                text.length());
    }
    return table;
  }

  /** Reports each match of {@code text} to {@code listener}, in text order. */
  public static void scan(Automaton automaton, CharSequence text,
                          MatchListener listener) {
    new ScanCursor(automaton).feed(text, listener);
  }

  /** Returns a lazy iterator over the matches of {@code text}. */
  public static Iterator<Match> search(Automaton automaton, CharSequence text) {
    return new MatchIterator(automaton, text);
  }

  /** Returns all matches of {@code text}, in text order. */
  public static ImmutableList<Match> matches(Automaton automaton,
                                             CharSequence text) {
    return ImmutableList.copyOf(search(automaton, text));
  }

  private MatchScanner() {
  }
}
