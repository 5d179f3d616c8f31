package com.github.automaton;

/**
 * A finite-state automaton that walks a graph of {@link AutomatonState}s over caller owned data
 * until no more state changes can be done.
 *
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this automaton<br>
 * 0b. less boilerplate code is the next most important virtue<br>
 *
 * 1. an automaton instance is single-threaded. {@link #run(Object)} is a plain blocking call that
 * executes every transition on the caller thread. Nested runs of the same automaton from inside
 * one of its own states are rejected.<br>
 *
 * 2. the state graph is produced by a {@link StateGraphFactory} only when a run needs it. With
 * {@link GraphMode#BUILD_ONCE} the graph is built on the first run and reused, with
 * {@link GraphMode#REBUILD_PER_RUN} every run gets its own.<br>
 *
 * 3. the automaton itself never touches the data. All mutation happens inside the states.<br>
 *
 * 4. a run has no iteration bound. A graph that cycles without ever reaching NOT_FOUND or END runs
 * forever, termination is a property of the graph, not of the driver.<br>
 *
 * 5. every run ends in exactly one of the three {@link RunResult.Reason}s. A failed run is never
 * resumed, start a new run instead.<br>
 *
 * @param <I> state identifier type
 * @param <D> data type the states work on
 * @param <E> error type states may fail with
 */
public interface Automaton<I, D, E extends Exception> {

  /**
   * Run the automaton from its initial state over the given data.
   *
   * Returns how the run ended. Errors thrown by states are reported in the result, never thrown.
   * AutomatonException is reserved for misuse of the engine (bad graph factory, states left
   * mutably borrowed, nested runs).
   */
  RunResult<I, E> run(final D data) throws AutomatonException;

  /**
   * Reports the id of this Automaton instance.
   */
  String getId();

  /**
   * Returns the config that this automaton is wired with.
   */
  AutomatonConfiguration getConfiguration();

  /**
   * Report statistics for this automaton.
   */
  AutomatonStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build automatons.
   */
  public final static class AutomatonBuilder<I, D, E extends Exception> {
    private AutomatonConfiguration config;
    private StateGraphFactory<I, D, E> graphFactory;
    private Class<E> errorType;

    public static <I, D, E extends Exception> AutomatonBuilder<I, D, E> newBuilder() {
      return new AutomatonBuilder<>();
    }

    public AutomatonBuilder<I, D, E> config(final AutomatonConfiguration config) {
      this.config = config;
      return this;
    }

    public AutomatonBuilder<I, D, E> graph(final StateGraphFactory<I, D, E> graphFactory) {
      this.graphFactory = graphFactory;
      return this;
    }

    /**
     * Declares the error type of the states. Only needed when E is an unchecked exception: thrown
     * unchecked exceptions of this type are then reported as failed runs instead of escaping
     * {@link Automaton#run(Object)}.
     */
    public AutomatonBuilder<I, D, E> errorType(final Class<E> errorType) {
      this.errorType = errorType;
      return this;
    }

    public Automaton<I, D, E> build() throws AutomatonException {
      if (graphFactory == null) {
        throw new AutomatonException(AutomatonException.Code.INVALID_INITIAL_STATE,
            "State graph factory cannot be null");
      }
      return new AutomatonImpl<>(config != null ? config : AutomatonConfiguration.defaults(),
          graphFactory, errorType);
    }

    private AutomatonBuilder() {}
  }

}
