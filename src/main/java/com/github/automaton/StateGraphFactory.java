package com.github.automaton;

/**
 * Builds a state graph and returns its initial state. Called by the automaton when a run needs a
 * graph, see {@link GraphMode}.
 */
@FunctionalInterface
public interface StateGraphFactory<I, D, E extends Exception> {

  SharedState<? extends AutomatonState<I, D, E>> build() throws AutomatonException;

}
