package com.dictscan.ahocorasick;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dictscan.utils.StringUtil;

/**
 * Inserts dictionary patterns into a {@link NodeStore} as labeled paths
 * from the root.
 */
final class TrieBuilder {
  private static final Logger log = LoggerFactory.getLogger(TrieBuilder.class);

  private final NodeStore store;
  private final DuplicatePolicy duplicatePolicy;

  TrieBuilder(NodeStore store, DuplicatePolicy duplicatePolicy) {
    this.store = checkNotNull(store);
    this.duplicatePolicy = checkNotNull(duplicatePolicy);
  }

  /**
   * Extends the trie with {@code pattern} and marks its terminal node
   * with {@code id}.
   *
   * @throws IllegalArgumentException if the pattern is null or empty, or
   *     if {@code id} is not positive
   * @throws DuplicatePatternException if the pattern is already present
   *     and the policy is {@link DuplicatePolicy#REJECT}
   */
  void insert(String pattern, int id) {
    checkArgument(pattern != null, "Pattern cannot be null");
    checkArgument(!pattern.isEmpty(), "Pattern %s cannot be empty", id);
    checkArgument(id > 0, "Pattern id must be positive: %s", id);

    int state = NodeStore.ROOT;
    for (int i = 0; i < pattern.length(); ++i) {
      state = extend(state, pattern.charAt(i));
    }

    Node terminal = this.store.get(state);
    if (terminal.isTerminal()) {
      if (this.duplicatePolicy == DuplicatePolicy.REJECT) {
        throw new DuplicatePatternException(pattern, terminal.getPatternId(), id);
      }
      log.debug("Pattern {} overwrites pattern {}: {}", id,
                terminal.getPatternId(), StringUtil.toDisplayString(pattern));
    }
    terminal.setPatternId(id);
  }

  private int extend(int state, char symbol) {
    int next = this.store.child(state, symbol);
    if (next != NodeStore.NO_NODE) return next;
    next = this.store.allocate(state, symbol);
    this.store.get(state).getChildren().put(symbol, next);
    return next;
  }
}
