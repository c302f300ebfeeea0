package com.dictscan.ahocorasick;

/**
 * A node represents one distinct dictionary prefix in the Aho-Corasick
 * trie. All references to other nodes are indices into the owning
 * {@link NodeStore}.
 */
final class Node {
  private final int parent;
  private final char symbol;
  private final int depth;
  private final ChildTable children = new ChildTable();

  private int patternId = 0;
  private int suffixLink = NodeStore.NO_NODE;
  private int dictSuffixLink = NodeStore.NO_NODE;

  Node(int parent, char symbol, int depth) {
    this.parent = parent;
    this.symbol = symbol;
    this.depth = depth;
  }

  ChildTable getChildren() {
    return this.children;
  }

  int getDepth() {
    return this.depth;
  }

  int getDictSuffixLink() {
    return this.dictSuffixLink;
  }

  int getParent() {
    return this.parent;
  }

  /** Returns 0 if no pattern ends at this node. */
  int getPatternId() {
    return this.patternId;
  }

  int getSuffixLink() {
    return this.suffixLink;
  }

  char getSymbol() {
    return this.symbol;
  }

  boolean isTerminal() {
    return this.patternId != 0;
  }

  void setDictSuffixLink(int dictSuffixLink) {
    this.dictSuffixLink = dictSuffixLink;
  }

  void setPatternId(int patternId) {
    this.patternId = patternId;
  }

  void setSuffixLink(int suffixLink) {
    this.suffixLink = suffixLink;
  }
}
