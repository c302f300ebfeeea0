package com.dictscan.ahocorasick;

/**
 * Receives matches in text order. Within one end offset the longest
 * match comes first, followed by the patterns that are its suffixes.
 */
@FunctionalInterface
public interface MatchListener {
  /**
   * @param patternId id of the matched pattern, in [1, patternCount]
   * @param endOffset 0-based index of the last matched char
   */
  void onMatch(int patternId, int endOffset);
}
