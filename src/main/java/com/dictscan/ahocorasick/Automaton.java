package com.dictscan.ahocorasick;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
   <p>An immutable Aho-Corasick automaton over {@code char} symbols.
   States are node indices; {@link #ROOT} is the start state.</p>

   <p>Instances are produced by {@link AutomatonBuilder} and never change
   afterwards, so one automaton can be scanned by any number of threads
   at once, each holding its own state.</p>

   <p>
   Example usage:
   <code><pre>
       Automaton automaton = Automaton.build("he", "she", "his", "hers");
       MatchTable matches = MatchScanner.scan(automaton, "ushers");
       System.out.println(matches.offsets(2));  // [3]
   </pre></code>
   </p>
 */
public final class Automaton {
  /** The start state. */
  public static final int ROOT = NodeStore.ROOT;
  /** Returned by link accessors when a link is absent. */
  public static final int NO_STATE = NodeStore.NO_NODE;

  private static final char[] EMPTY_CHARS = new char[0];

  public static AutomatonBuilder builder() {
    return new AutomatonBuilder();
  }

  /**
   * Builds an automaton whose pattern ids are the 1-based positions in
   * {@code dictionary}.
   *
   * @throws IllegalArgumentException if the dictionary or any entry is
   *     null, or an entry is empty
   */
  public static Automaton build(Iterable<String> dictionary) {
    checkArgument(dictionary != null, "Dictionary cannot be null");
    return builder().addAll(dictionary).build();
  }

  public static Automaton build(String... dictionary) {
    checkArgument(dictionary != null, "Dictionary cannot be null");
    return build(Arrays.asList(dictionary));
  }

  private final int[] parents;
  private final char[] symbols;
  private final int[] depths;
  private final int[] patternIds;
  private final int[] suffixLinks;
  private final int[] dictSuffixLinks;
  private final char[][] childKeys;
  private final int[][] childTargets;
  private final ImmutableList<String> patterns;
  private final int maxDepth;
  private final AutomatonStats stats;

  /** Freezes a store whose links have been resolved. */
  Automaton(NodeStore store, List<String> patterns, long buildMillis) {
    int size = store.size();
    this.parents = new int[size];
    this.symbols = new char[size];
    this.depths = new int[size];
    this.patternIds = new int[size];
    this.suffixLinks = new int[size];
    this.dictSuffixLinks = new int[size];
    this.childKeys = new char[size][];
    this.childTargets = new int[size][];

    int deepest = 0;
    for (int i = 0; i < size; ++i) {
      Node node = store.get(i);
      ChildTable children = node.getChildren();
      children.freeze();
      this.parents[i] = node.getParent();
      this.symbols[i] = node.getSymbol();
      this.depths[i] = node.getDepth();
      this.patternIds[i] = node.getPatternId();
      this.suffixLinks[i] = node.getSuffixLink();
      this.dictSuffixLinks[i] = node.getDictSuffixLink();
      this.childKeys[i] = children.keys();
      this.childTargets[i] = children.targets();
      deepest = Math.max(deepest, node.getDepth());
    }
    this.patterns = ImmutableList.copyOf(patterns);
    this.maxDepth = deepest;
    this.stats = new AutomatonStats(size, this.patterns.size(), deepest,
                                    buildMillis);
  }

  /**
   * Returns the state reached from {@code state} on {@code symbol}: the
   * trie child if there is one, the root if {@code state} is the root,
   * otherwise the transition from the suffix link of {@code state}.
   */
  public int transition(int state, char symbol) {
    checkState(state);
    int current = state;
    while (true) {
      int next = childOf(current, symbol);
      if (next != NO_STATE) return next;
      if (current == ROOT) return ROOT;
      current = this.suffixLinks[current];
    }
  }

  /** Returns the trie child of {@code state} on {@code symbol}, or {@link #NO_STATE}. */
  public int child(int state, char symbol) {
    checkState(state);
    return childOf(state, symbol);
  }

  /** Returns the edge labels leaving {@code state}, sorted. */
  public char[] childSymbols(int state) {
    checkState(state);
    char[] keys = this.childKeys[state];
    return (keys.length == 0) ? EMPTY_CHARS : keys.clone();
  }

  public int depth(int state) {
    checkState(state);
    return this.depths[state];
  }

  /** Returns the nearest terminal state on the suffix chain, or {@link #NO_STATE}. */
  public int dictSuffixLink(int state) {
    checkState(state);
    return this.dictSuffixLinks[state];
  }

  public AutomatonStats getStats() {
    return this.stats;
  }

  /**
   * Returns true if {@code chars} is a prefix of at least one pattern.
   * The empty sequence is a prefix of everything.
   */
  public boolean hasPrefix(CharSequence chars) {
    return walk(chars) != NO_STATE;
  }

  /**
   * Returns the id currently bound to exactly {@code chars}, or 0 if it
   * is not a pattern.
   */
  public int lookup(CharSequence chars) {
    int state = walk(chars);
    return (state == NO_STATE) ? 0 : this.patternIds[state];
  }

  public int maxDepth() {
    return this.maxDepth;
  }

  public int nodeCount() {
    return this.parents.length;
  }

  /** Returns the parent state, or {@link #NO_STATE} for the root. */
  public int parent(int state) {
    checkState(state);
    return this.parents[state];
  }

  /** Returns the pattern added under {@code patternId}. */
  public String pattern(int patternId) {
    checkArgument(patternId >= 1 && patternId <= this.patterns.size(),
                  "Pattern id %s is outside [1, %s]", patternId,
                  this.patterns.size());
    return this.patterns.get(patternId - 1);
  }

  public int patternCount() {
    return this.patterns.size();
  }

  /** Returns the id of the pattern ending at {@code state}, or 0. */
  public int patternId(int state) {
    checkState(state);
    return this.patternIds[state];
  }

  /** Returns the dictionary in id order; index {@code i} holds id {@code i + 1}. */
  public ImmutableList<String> patterns() {
    return this.patterns;
  }

  /** Returns the suffix link, or {@link #NO_STATE} for the root. */
  public int suffixLink(int state) {
    checkState(state);
    return this.suffixLinks[state];
  }

  /** Returns the label of the edge into {@code state}; {@code '\0'} for the root. */
  public char symbol(int state) {
    checkState(state);
    return this.symbols[state];
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("patterns", this.patterns.size())
                      .add("nodes", this.parents.length)
                      .add("maxDepth", this.maxDepth)
                      .toString();
  }

  private int childOf(int state, char symbol) {
    int i = Arrays.binarySearch(this.childKeys[state], symbol);
    return (i < 0) ? NO_STATE : this.childTargets[state][i];
  }

  private void checkState(int state) {
    checkElementIndex(state, this.parents.length, "state");
  }

  // Follows trie edges only; returns NO_STATE as soon as an edge is missing.
  private int walk(CharSequence chars) {
    checkNotNull(chars, "chars");
    int state = ROOT;
    for (int i = 0; i < chars.length(); ++i) {
      state = childOf(state, chars.charAt(i));
      if (state == NO_STATE) return NO_STATE;
    }
    return state;
  }
}
