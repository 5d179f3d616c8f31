package com.github.automaton;

import java.util.Objects;

/**
 * This object reports why a run of an {@link Automaton} stopped.
 *
 * Exactly one {@link Reason} is set per run. Every result carries the id of the state that was
 * current when the automaton stopped. A FAILED result additionally carries the error thrown by
 * that state, untouched.
 *
 * Callers should check the reason before trusting the contents of the data they ran over, a
 * failure may have happened half way through a mutation.
 */
public final class RunResult<I, E extends Exception> {
  private final Reason reason;
  private final I stateId;
  private final E error;

  private RunResult(final Reason reason, final I stateId, final E error) {
    this.reason = reason;
    this.stateId = stateId;
    this.error = error;
  }

  public static <I, E extends Exception> RunResult<I, E> noNextState(final I stateId) {
    return new RunResult<>(Reason.NO_NEXT_STATE, stateId, null);
  }

  public static <I, E extends Exception> RunResult<I, E> endOfInput(final I stateId) {
    return new RunResult<>(Reason.END_OF_INPUT, stateId, null);
  }

  public static <I, E extends Exception> RunResult<I, E> failed(final I stateId, final E error) {
    Objects.requireNonNull(error, "error cannot be null for a failed run");
    return new RunResult<>(Reason.FAILED, stateId, error);
  }

  public Reason getReason() {
    return reason;
  }

  public I getStateId() {
    return stateId;
  }

  /**
   * The error that failed the run, exactly as thrown. Null unless {@link #isFailed()}.
   */
  public E getError() {
    return error;
  }

  public boolean isStoppedNoNextState() {
    return reason == Reason.NO_NEXT_STATE;
  }

  public boolean isStoppedEndOfInput() {
    return reason == Reason.END_OF_INPUT;
  }

  public boolean isFailed() {
    return reason == Reason.FAILED;
  }

  @Override
  public int hashCode() {
    return Objects.hash(reason, stateId, error);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof RunResult)) {
      return false;
    }
    final RunResult<?, ?> other = (RunResult<?, ?>) obj;
    return reason == other.reason && Objects.equals(stateId, other.stateId)
        && Objects.equals(error, other.error);
  }

  @Override
  public String toString() {
    return "RunResult [reason=" + reason + ", stateId=" + stateId + ", error=" + error + "]";
  }

  public static enum Reason {
    // current state had no satisfying successor
    NO_NEXT_STATE,
    // key source ran dry
    END_OF_INPUT,
    // a transition threw
    FAILED;
  }
}
