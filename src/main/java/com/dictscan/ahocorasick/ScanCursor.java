package com.dictscan.ahocorasick;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * The mutable side of a scan: the current automaton state and the number
 * of chars consumed so far. Text can be fed in any number of chunks; the
 * matches are the same as for one call with the concatenated text, with
 * offsets counted from the start of the first chunk.
 *
 * <p>Each thread scanning a shared automaton needs its own cursor.</p>
 */
public final class ScanCursor {
  private final Automaton automaton;
  private int state;
  private int offset;

  public ScanCursor(Automaton automaton) {
    this(automaton, Automaton.ROOT, 0);
  }

  /**
   * Resumes a scan from a state and offset saved with {@link #getState()}
   * and {@link #getOffset()}.
   */
  public ScanCursor(Automaton automaton, int state, int offset) {
    this.automaton = checkNotNull(automaton, "automaton");
    checkArgument(state >= 0 && state < automaton.nodeCount(),
                  "State %s is not a state of this automaton", state);
    checkArgument(offset >= 0, "Negative offset: %s", offset);
    this.state = state;
    this.offset = offset;
  }

  /** Consumes {@code chunk}, reporting every match that ends inside it. */
  public ScanCursor feed(CharSequence chunk, MatchListener listener) {
    checkNotNull(chunk, "chunk");
    checkNotNull(listener, "listener");
    for (int i = 0; i < chunk.length(); ++i) {
      checkState(this.offset != Integer.MAX_VALUE, "Offset overflow");
      this.state = this.automaton.transition(this.state, chunk.charAt(i));
      emit(this.automaton, this.state, this.offset, listener);
      ++this.offset;
    }
    return this;
  }

  public Automaton getAutomaton() {
    return this.automaton;
  }

  /** Number of chars consumed, which is also the offset of the next char. */
  public int getOffset() {
    return this.offset;
  }

  public int getState() {
    return this.state;
  }

  /** Returns to the root at offset 0. */
  public void reset() {
    this.state = Automaton.ROOT;
    this.offset = 0;
  }

  /**
   * Reports the pattern ending at {@code state}, if any, then every
   * pattern on its dictionary suffix chain.
   */
  static void emit(Automaton automaton, int state, int endOffset,
                   MatchListener listener) {
    int patternId = automaton.patternId(state);
    if (patternId != 0) listener.onMatch(patternId, endOffset);
    for (int output = automaton.dictSuffixLink(state);
         output != Automaton.NO_STATE;
         output = automaton.dictSuffixLink(output)) {
      listener.onMatch(automaton.patternId(output), endOffset);
    }
  }
}
