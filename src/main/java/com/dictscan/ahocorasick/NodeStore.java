package com.dictscan.ahocorasick;

import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.ArrayList;
import java.util.List;

/**
 * Arena holding every trie node. Nodes are addressed by their position
 * in the arena and are never removed, so an index stays valid for the
 * lifetime of the store.
 */
final class NodeStore {
  /** Index of the root node. */
  static final int ROOT = 0;
  /** Sentinel for an absent link. */
  static final int NO_NODE = -1;

  private final List<Node> nodes = new ArrayList<>();

  NodeStore() {
    this.nodes.add(new Node(NO_NODE, '\0', 0));
  }

  /**
   * Appends a fully initialized node one edge below {@code parent} and
   * returns its index. The caller registers the index in the parent's
   * child table.
   */
  int allocate(int parent, char symbol) {
    int depth = get(parent).getDepth() + 1;
    this.nodes.add(new Node(parent, symbol, depth));
    return this.nodes.size() - 1;
  }

  /** Returns the child of {@code index} labeled {@code symbol}, or {@link #NO_NODE}. */
  int child(int index, char symbol) {
    return get(index).getChildren().get(symbol);
  }

  Node get(int index) {
    checkElementIndex(index, this.nodes.size(), "node");
    return this.nodes.get(index);
  }

  int size() {
    return this.nodes.size();
  }

  /**
   * Goto function with failure fallback. Only valid for states whose
   * suffix chain has already been resolved.
   */
  int transition(int state, char symbol) {
    int current = state;
    while (true) {
      int next = child(current, symbol);
      if (next != NO_NODE) return next;
      if (current == ROOT) return ROOT;
      current = get(current).getSuffixLink();
    }
  }
}
