package com.github.automaton;

/**
 * A node in the automaton graph. States are the stop points of an automaton: each one gets a
 * chance to work on the shared data and then names the state that runs next, or reports why there
 * is none.
 *
 * Notes for implementors:<br>
 * 1. {@link #getId()} must be stable for the lifetime of the state. It is used in run results and
 * diagnostics, never for dispatch.<br>
 * 2. {@link #transition(Object)} is the only extension point. Hand-written states and
 * {@link SimpleState} both satisfy it, so the driver never needs to know which kind it is
 * running.<br>
 * 3. Errors of type E thrown from {@link #transition(Object)} end the run with
 * {@link RunResult.Reason#FAILED}. Partial mutations of the data made before the throw are left in
 * place.<br>
 *
 * @param <I> identifier type, compared with equals()
 * @param <D> shared mutable data handed to every transition
 * @param <E> error type transitions may fail with
 */
public interface AutomatonState<I, D, E extends Exception> {

  /**
   * Identifier of this state.
   */
  I getId();

  /**
   * Perform this state's side effect on the given data and decide where the automaton goes next.
   */
  NextState<I, D, E> transition(final D data) throws E;

}
