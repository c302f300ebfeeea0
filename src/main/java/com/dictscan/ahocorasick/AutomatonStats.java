package com.dictscan.ahocorasick;

import com.dictscan.utils.StringUtil;
import com.google.gson.annotations.SerializedName;

/**
 * Size figures of a built automaton. Serialized with Gson for the build
 * log.
 */
public class AutomatonStats {
  @SerializedName("node_count")
  private final int nodeCount;
  @SerializedName("pattern_count")
  private final int patternCount;
  @SerializedName("max_depth")
  private final int maxDepth;
  @SerializedName("build_millis")
  private final long buildMillis;

  AutomatonStats(int nodeCount, int patternCount, int maxDepth,
                 long buildMillis) {
    this.nodeCount = nodeCount;
    this.patternCount = patternCount;
    this.maxDepth = maxDepth;
    this.buildMillis = buildMillis;
  }

  public long getBuildMillis() {
    return this.buildMillis;
  }

  public int getMaxDepth() {
    return this.maxDepth;
  }

  /** Includes the root. */
  public int getNodeCount() {
    return this.nodeCount;
  }

  public int getPatternCount() {
    return this.patternCount;
  }

  public String toJson() {
    return StringUtil.toJson(this);
  }

  @Override
  public String toString() {
    return toJson();
  }
}
