package com.dictscan.ahocorasick;

/**
 * Thrown when a pattern that is already in the dictionary is added
 * under {@link DuplicatePolicy#REJECT}.
 */
public class DuplicatePatternException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String pattern;
  private final int existingId;
  private final int rejectedId;

  public DuplicatePatternException(String pattern, int existingId,
                                   int rejectedId) {
    super(String.format("Pattern \"%s\" (id %d) duplicates id %d.",
                        pattern, rejectedId, existingId));
    this.pattern = pattern;
    this.existingId = existingId;
    this.rejectedId = rejectedId;
  }

  public int getExistingId() {
    return this.existingId;
  }

  public String getPattern() {
    return this.pattern;
  }

  public int getRejectedId() {
    return this.rejectedId;
  }
}
