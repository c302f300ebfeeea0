package com.dictscan.ahocorasick;

import java.util.Arrays;

/**
 * An inlined map of chars to child node indices.
 *
 * <p>While the trie is being built, keys are appended in insertion order
 * and looked up linearly; most nodes have one or two children.
 * {@link #freeze()} sorts the pairs so that frozen lookups can binary
 * search.</p>
 */
final class ChildTable {
  private static final char[] EMPTY_CHARS = new char[0];
  private static final int[] EMPTY_INTS = new int[0];

  // keys[i] labels the edge to targets[i]; only the first 'size' slots are used.
  private char[] keys = EMPTY_CHARS;
  private int[] targets = EMPTY_INTS;
  private int size = 0;
  private boolean isFrozen = false;

  /** Returns the child index reached by {@code key}, or {@link NodeStore#NO_NODE}. */
  int get(char key) {
    if (this.isFrozen) {
      int i = Arrays.binarySearch(this.keys, 0, this.size, key);
      return (i < 0) ? NodeStore.NO_NODE : this.targets[i];
    }
    for (int i = 0; i < this.size; ++i) {
      if (this.keys[i] == key) return this.targets[i];
    }
    return NodeStore.NO_NODE;
  }

  /**
   * Binds {@code key} to {@code target}. Re-binding an existing key
   * replaces its target.
   */
  void put(char key, int target) {
    if (this.isFrozen) throw new IllegalStateException(
        "Can't add children to a frozen table.");
    for (int i = 0; i < this.size; ++i) {
      if (this.keys[i] == key) {
        this.targets[i] = target;
        return;
      }
    }
    if (this.size == this.keys.length) {
      int capacity = Math.max(2, this.size * 2);
      this.keys = Arrays.copyOf(this.keys, capacity);
      this.targets = Arrays.copyOf(this.targets, capacity);
    }
    this.keys[this.size] = key;
    this.targets[this.size] = target;
    ++this.size;
  }

  /** Returns a copy of the keys, in insertion order until frozen. */
  char[] keys() {
    return (this.size == 0) ? EMPTY_CHARS : Arrays.copyOf(this.keys, this.size);
  }

  /** Returns a copy of the targets, parallel to {@link #keys()}. */
  int[] targets() {
    return (this.size == 0) ? EMPTY_INTS : Arrays.copyOf(this.targets, this.size);
  }

  int size() {
    return this.size;
  }

  boolean isFrozen() {
    return this.isFrozen;
  }

  /**
   * Trims the arrays and sorts the pairs by key. Idempotent; the table
   * rejects {@link #put} afterwards.
   */
  void freeze() {
    if (this.isFrozen) return;
    // Pack each pair as (key << 32 | target) so one primitive sort orders both.
    long[] packed = new long[this.size];
    for (int i = 0; i < this.size; ++i) {
      packed[i] = ((long) this.keys[i] << 32) | (this.targets[i] & 0xFFFFFFFFL);
    }
    Arrays.sort(packed);
    char[] sortedKeys = new char[this.size];
    int[] sortedTargets = new int[this.size];
    for (int i = 0; i < this.size; ++i) {
      sortedKeys[i] = (char) (packed[i] >>> 32);
      sortedTargets[i] = (int) packed[i];
    }
    this.keys = sortedKeys;
    this.targets = sortedTargets;
    this.isFrozen = true;
  }
}
