package com.github.automaton;

/**
 * This represents when the automaton asks its factory for the state graph.
 */
public enum GraphMode {
  // build lazily on the first run and reuse the same graph for every later run
  BUILD_ONCE,
  // build a fresh graph at the start of every run, runs share nothing but the factory
  REBUILD_PER_RUN;
}
