package com.dictscan.ahocorasick;

/** What to do when the same pattern string is added twice. */
public enum DuplicatePolicy {
  /**
   * The later id replaces the earlier one on the shared terminal node.
   * The earlier id keeps its slot in the results but never matches.
   */
  OVERWRITE,
  /** Fail the insertion with a {@link DuplicatePatternException}. */
  REJECT
}
