package com.github.automaton;

import java.util.Optional;

/**
 * Data that can hand out the keys {@link SimpleState} matches its connections against. Usually
 * backed by a cursor over some sequence.
 */
public interface KeyProvidingData<K> {

  /**
   * Advance and return the next key. An empty result means the data is exhausted for the rest of
   * the run. Keys that were handed out are never offered again.
   */
  Optional<K> nextKey();

}
