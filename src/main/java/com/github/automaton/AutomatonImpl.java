package com.github.automaton;

import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonException.Code;

/**
 * The driver loop of an {@link Automaton}.
 *
 * Notes for users:<br>
 * 1. the loop keeps a single "current" state. Every iteration asks it to transition over the data
 * and applies the outcome: CONTINUE swaps in the target, NOT_FOUND and END stop the run, a thrown
 * error stops the run with the error attached.<br>
 *
 * 2. errors are classified as follows. A checked exception thrown from a transition can only be
 * the declared E, so it fails the run. An unchecked exception fails the run only when it is an
 * instance of the error type the automaton was built with, otherwise it propagates to the caller
 * untouched as a programming error.<br>
 *
 * 3. nothing is retried. A failed transition is treated as a data or programming error, not a
 * transient one.<br>
 */
final class AutomatonImpl<I, D, E extends Exception> implements Automaton<I, D, E> {
  private static final Logger logger = LogManager.getLogger(AutomatonImpl.class.getSimpleName());

  private final String automatonId = UUID.randomUUID().toString();

  private final AutomatonConfiguration config;
  private final StateGraphFactory<I, D, E> graphFactory;
  private final Class<E> errorType;
  private final AutomatonStatistics stats;

  // only populated in BUILD_ONCE mode
  private SharedState<? extends AutomatonState<I, D, E>> initialState;
  private boolean running;

  AutomatonImpl(final AutomatonConfiguration config, final StateGraphFactory<I, D, E> graphFactory,
      final Class<E> errorType) {
    this.config = config;
    this.graphFactory = graphFactory;
    this.errorType = errorType;
    this.stats = new AutomatonStatistics(automatonId, config.getRouteCapacity());
    logInfo(automatonId, "Created automaton with " + config);
  }

  @Override
  public RunResult<I, E> run(final D data) throws AutomatonException {
    if (running) {
      throw new AutomatonException(Code.REENTRANT_RUN);
    }
    running = true;
    try {
      final long startMillis = System.currentTimeMillis();
      SharedState<? extends AutomatonState<I, D, E>> current = initialState();
      stats.beginRun();
      RunResult<I, E> result = null;
      while (result == null) {
        final AutomatonState<I, D, E> state = current.borrow();
        stats.visit(state.getId());
        stats.transitioned();
        final NextState<I, D, E> next;
        try {
          next = state.transition(data);
        } catch (Exception problem) {
          final E error = classify(problem);
          logError(automatonId, "Transition of state:" + state.getId() + " failed", error);
          result = RunResult.failed(state.getId(), error);
          break;
        }
        if (next == null) {
          throw new AutomatonException(Code.INVALID_TRANSITION_OUTCOME,
              "State:" + state.getId() + " returned a null transition outcome");
        }
        switch (next.getKind()) {
          case CONTINUE:
            if (logger.isDebugEnabled()) {
              logDebug(automatonId, String.format("Transitioned from %s->%s", state.getId(),
                  next.getTarget().state().getId()));
            }
            current = next.getTarget();
            break;
          case NOT_FOUND:
            result = RunResult.noNextState(state.getId());
            break;
          case END:
            result = RunResult.endOfInput(state.getId());
            break;
          default:
            throw new AutomatonException(Code.INVALID_TRANSITION_OUTCOME,
                "Unsupported transition outcome " + next.getKind());
        }
      }
      stats.endRun(result, System.currentTimeMillis() - startMillis);
      logInfo(automatonId, "Automaton run stopped with " + result);
      return result;
    } finally {
      running = false;
    }
  }

  @Override
  public String getId() {
    return automatonId;
  }

  @Override
  public AutomatonConfiguration getConfiguration() {
    return config;
  }

  @Override
  public AutomatonStatistics getStatistics() {
    return stats;
  }

  private SharedState<? extends AutomatonState<I, D, E>> initialState()
      throws AutomatonException {
    if (config.getGraphMode() == GraphMode.BUILD_ONCE && initialState != null) {
      return initialState;
    }
    final SharedState<? extends AutomatonState<I, D, E>> built;
    try {
      built = graphFactory.build();
    } catch (AutomatonException problem) {
      throw problem;
    } catch (RuntimeException problem) {
      throw new AutomatonException(Code.GRAPH_CONSTRUCTION_FAILURE, problem);
    }
    if (built == null) {
      throw new AutomatonException(Code.INVALID_INITIAL_STATE);
    }
    stats.graphBuilds++;
    logInfo(automatonId, "Built state graph with initial state:" + built.state().getId());
    if (config.getGraphMode() == GraphMode.BUILD_ONCE) {
      initialState = built;
    }
    return built;
  }

  /**
   * Decide whether a throwable escaping a transition is the user's error E or a bug that should
   * propagate.
   */
  @SuppressWarnings("unchecked")
  private E classify(final Exception problem) {
    if (errorType != null && errorType.isInstance(problem)) {
      return errorType.cast(problem);
    }
    if (problem instanceof RuntimeException) {
      throw (RuntimeException) problem;
    }
    // transition() only declares E, so a checked exception here is an E
    return (E) problem;
  }

  private static void logError(final String automatonId, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[a:").append(automatonId).append("] ")
        .append(message).toString(), error);
  }

  private static void logInfo(final String automatonId, final String message) {
    logger.info(new StringBuilder().append("[a:").append(automatonId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String automatonId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[a:").append(automatonId).append("] ")
          .append(message).toString());
    }
  }

}
