package com.dictscan.ahocorasick;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dictscan.utils.Environment;
import com.dictscan.utils.StringUtil;
import com.google.common.base.Stopwatch;

/**
 * Collects dictionary patterns and compiles them into an
 * {@link Automaton}. Pattern ids are assigned 1, 2, 3, ... in the order
 * patterns are added.
 *
 * <p>A builder is single use: after {@link #build()} it rejects further
 * calls. A rejected {@link #add} leaves the builder unchanged. Not
 * thread-safe.</p>
 */
public final class AutomatonBuilder {
  private static final Logger log = LoggerFactory.getLogger(AutomatonBuilder.class);

  private NodeStore store;
  private TrieBuilder trieBuilder;
  private DuplicatePolicy duplicatePolicy;
  private final List<String> patterns;
  private boolean isBuilt;

  AutomatonBuilder() {
    this.store = new NodeStore();
    this.patterns = new ArrayList<>();
    this.isBuilt = false;
    setDuplicatePolicy(Environment.duplicatePolicy());
  }

  /**
   * Adds {@code pattern} under the next id.
   *
   * @throws IllegalArgumentException if {@code pattern} is null or empty
   * @throws DuplicatePatternException if {@code pattern} was already added
   *     and the policy is {@link DuplicatePolicy#REJECT}
   */
  public AutomatonBuilder add(String pattern) {
    checkState(!this.isBuilt, "Can't add patterns after build() is called.");
    int id = this.patterns.size() + 1;
    this.trieBuilder.insert(pattern, id);
    this.patterns.add(pattern);
    if (log.isTraceEnabled()) {
      log.trace("Added pattern {}: {}", id, StringUtil.toDisplayString(pattern));
    }
    return this;
  }

  public AutomatonBuilder addAll(Iterable<String> patterns) {
    checkArgument(patterns != null, "Patterns cannot be null");
    for (String pattern : patterns) {
      add(pattern);
    }
    return this;
  }

  /**
   * Resolves all links and freezes the trie.
   */
  public Automaton build() {
    checkState(!this.isBuilt, "build() has already been called.");
    log.info("Compiling aho-corasick automaton for {} pattern(s)...",
             this.patterns.size());
    Stopwatch stopwatch = Stopwatch.createStarted();

    new LinkResolver(this.store).resolve();
    Automaton automaton = new Automaton(this.store, this.patterns,
                                        stopwatch.elapsed(TimeUnit.MILLISECONDS));
    this.isBuilt = true;
    this.store = null;
    this.trieBuilder = null;

    log.info("Finished compilation in {}: {}", stopwatch, automaton.getStats());
    return automaton;
  }

  /**
   * Overrides the policy taken from {@link Environment}. Must be called
   * before the first pattern is added.
   */
  public AutomatonBuilder duplicatePolicy(DuplicatePolicy duplicatePolicy) {
    checkState(!this.isBuilt, "Can't change policy after build() is called.");
    checkState(this.patterns.isEmpty(),
               "Duplicate policy must be set before adding patterns.");
    setDuplicatePolicy(duplicatePolicy);
    return this;
  }

  public DuplicatePolicy getDuplicatePolicy() {
    return this.duplicatePolicy;
  }

  /** Number of patterns added so far. */
  public int size() {
    return this.patterns.size();
  }

  private void setDuplicatePolicy(DuplicatePolicy duplicatePolicy) {
    this.duplicatePolicy = checkNotNull(duplicatePolicy, "duplicatePolicy");
    this.trieBuilder = new TrieBuilder(this.store, duplicatePolicy);
  }
}
