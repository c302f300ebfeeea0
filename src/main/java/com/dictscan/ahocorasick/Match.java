package com.dictscan.ahocorasick;

import java.util.Objects;

/**
   <p>One occurrence of a pattern in the scanned text. Offsets are
   0-based and inclusive on both ends.</p>
 */
public final class Match {
  private final int patternId;
  private final int endOffset;
  private final int length;

  public Match(int patternId, int endOffset, int length) {
    this.patternId = patternId;
    this.endOffset = endOffset;
    this.length = length;
  }

  /** Returns the index of the last matched char. */
  public int getEndOffset() {
    return this.endOffset;
  }

  public int getLength() {
    return this.length;
  }

  public int getPatternId() {
    return this.patternId;
  }

  /** Returns the index of the first matched char. */
  public int getStartOffset() {
    return this.endOffset - this.length + 1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Match)) return false;
    Match other = (Match) o;
    return this.patternId == other.patternId &&
           this.endOffset == other.endOffset &&
           this.length == other.length;
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.patternId, this.endOffset, this.length);
  }

  @Override
  public String toString() {
    return String.format("#%d[%d..%d]", this.patternId, getStartOffset(),
                         this.endOffset);
  }
}
