package com.dictscan.ahocorasick;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * End offsets of every pattern found in one text, keyed by pattern id.
 * Every id in {@code [1, patternCount]} has an entry; offsets per id are
 * strictly increasing.
 */
public final class MatchTable {

  public static Builder builder(int patternCount) {
    return new Builder(patternCount);
  }

  /** Collects matches reported by a scan. Single use. */
  public static final class Builder implements MatchListener {
    private final List<List<Integer>> offsets;
    private boolean isBuilt = false;

    private Builder(int patternCount) {
      checkArgument(patternCount >= 0, "Negative pattern count: %s",
                    patternCount);
      this.offsets = new ArrayList<>(patternCount);
      for (int i = 0; i < patternCount; ++i) {
        this.offsets.add(new ArrayList<>());
      }
    }

    @Override
    public void onMatch(int patternId, int endOffset) {
      checkState(!this.isBuilt, "Can't add matches after build() is called.");
      checkArgument(patternId >= 1 && patternId <= this.offsets.size(),
                    "Pattern id %s is outside [1, %s]", patternId,
                    this.offsets.size());
      this.offsets.get(patternId - 1).add(endOffset);
    }

    public MatchTable build() {
      checkState(!this.isBuilt, "build() has already been called.");
      this.isBuilt = true;
      ImmutableList.Builder<ImmutableList<Integer>> lists = ImmutableList.builder();
      for (List<Integer> list : this.offsets) {
        lists.add(ImmutableList.copyOf(list));
      }
      return new MatchTable(lists.build());
    }
  }

  // Index i holds the offsets of pattern id i + 1.
  private final ImmutableList<ImmutableList<Integer>> offsets;

  private MatchTable(ImmutableList<ImmutableList<Integer>> offsets) {
    this.offsets = offsets;
  }

  /** Returns every id mapped to its offsets, including ids without matches. */
  public ImmutableSortedMap<Integer, List<Integer>> asMap() {
    ImmutableSortedMap.Builder<Integer, List<Integer>> map =
        ImmutableSortedMap.naturalOrder();
    for (int i = 0; i < this.offsets.size(); ++i) {
      map.put(i + 1, this.offsets.get(i));
    }
    return map.build();
  }

  /** True if no pattern matched. */
  public boolean isEmpty() {
    return totalMatches() == 0;
  }

  /**
   * Returns the end offsets of {@code patternId} in increasing order.
   *
   * @throws IllegalArgumentException if the id is outside
   *     {@code [1, patternCount]}
   */
  public List<Integer> offsets(int patternId) {
    checkArgument(patternId >= 1 && patternId <= this.offsets.size(),
                  "Pattern id %s is outside [1, %s]", patternId,
                  this.offsets.size());
    return this.offsets.get(patternId - 1);
  }

  public int patternCount() {
    return this.offsets.size();
  }

  public int totalMatches() {
    int total = 0;
    for (List<Integer> list : this.offsets) {
      total += list.size();
    }
    return total;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MatchTable)) return false;
    return this.offsets.equals(((MatchTable) o).offsets);
  }

  @Override
  public int hashCode() {
    return this.offsets.hashCode();
  }

  @Override
  public String toString() {
    return asMap().toString();
  }
}
