package com.github.automaton;

/**
 * Side effect attached to a {@link Connection}. Runs with the key that matched, right before the
 * automaton moves to the connection's target.
 */
@FunctionalInterface
public interface ConnectionAction<K, D, E extends Exception> {

  void execute(final D data, final K key) throws E;

}
