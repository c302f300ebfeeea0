package com.dictscan.ahocorasick;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
   Iterator over the matches of one text, produced lazily in the order a
   {@link MatchListener} would receive them.
 */
public class MatchIterator implements Iterator<Match> {
  private final Automaton automaton;
  private final CharSequence text;

  private int nextIndex = 0;  // Next char to consume.
  private int state = Automaton.ROOT;
  private int output = Automaton.NO_STATE;  // Next state to report at nextIndex - 1.
  private Match nextMatch;

  MatchIterator(Automaton automaton, CharSequence text) {
    this.automaton = checkNotNull(automaton, "automaton");
    this.text = checkNotNull(text, "text");
    this.nextMatch = advance();
  }

  @Override
  public boolean hasNext() {
    return (this.nextMatch != null);
  }

  @Override
  public Match next() {
    if (!hasNext()) throw new NoSuchElementException();
    Match result = this.nextMatch;
    this.nextMatch = advance();
    return result;
  }

  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }

  private Match advance() {
    while (true) {
      if (this.output != Automaton.NO_STATE) {
        int reported = this.output;
        this.output = this.automaton.dictSuffixLink(reported);
        return new Match(this.automaton.patternId(reported), this.nextIndex - 1,
                         this.automaton.depth(reported));
      }
      if (this.nextIndex >= this.text.length()) return null;

      this.state = this.automaton.transition(this.state,
                                             this.text.charAt(this.nextIndex++));
      this.output = (this.automaton.patternId(this.state) != 0)
          ? this.state : this.automaton.dictSuffixLink(this.state);
    }
  }
}
