package com.dictscan.demo;

import java.util.Iterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dictscan.ahocorasick.Automaton;
import com.dictscan.ahocorasick.Match;
import com.dictscan.ahocorasick.MatchScanner;
import com.dictscan.ahocorasick.MatchTable;
import com.dictscan.utils.StringUtil;

/**
 * Builds a small dictionary, scans one text and logs what was found.
 */
public class AhoCorasickDemo {
  private static final Logger log = LoggerFactory.getLogger(AhoCorasickDemo.class);

  static final String[] DICTIONARY = { "a", "ab", "bab", "bc", "bca", "c", "caa" };
  static final String TEXT = "abccba";

  public static void main(String[] args) {
    Automaton automaton = Automaton.build(DICTIONARY);
    MatchTable table = run(automaton, TEXT);
    log.info("Total: {} match(es)", table.totalMatches());
  }

  static MatchTable run(Automaton automaton, String text) {
    MatchTable table = MatchScanner.scan(automaton, text);
    for (int id = 1; id <= automaton.patternCount(); ++id) {
      log.info("{}. {} -> {}", id, StringUtil.toDisplayString(automaton.pattern(id)),
               table.offsets(id));
    }

    Iterator<Match> iter = MatchScanner.search(automaton, text);
    while (iter.hasNext()) {
      Match match = iter.next();
      log.info("Found {} at [{}, {}]",
               StringUtil.toDisplayString(automaton.pattern(match.getPatternId())),
               match.getStartOffset(), match.getEndOffset());
    }
    return table;
  }
}
