package com.github.automaton;

import java.util.Objects;

/**
 * This object encapsulates the outcome of asking an {@link AutomatonState} to transition.
 *
 * A CONTINUE outcome always carries the target state. NOT_FOUND means no connection fits the
 * current situation, END means the data source has nothing more to offer. The driver consumes an
 * outcome as soon as it gets it and never keeps one around. NOT_FOUND and END carry nothing, so a
 * single shared instance of each is handed out.
 */
public final class NextState<I, D, E extends Exception> {
  private static final NextState<?, ?, ?> notFound =
      new NextState<Object, Object, Exception>(Kind.NOT_FOUND, null);
  private static final NextState<?, ?, ?> end =
      new NextState<Object, Object, Exception>(Kind.END, null);

  private final Kind kind;
  private final SharedState<? extends AutomatonState<I, D, E>> target;

  private NextState(final Kind kind,
      final SharedState<? extends AutomatonState<I, D, E>> target) {
    this.kind = kind;
    this.target = target;
  }

  public static <I, D, E extends Exception> NextState<I, D, E> proceed(
      final SharedState<? extends AutomatonState<I, D, E>> target) {
    Objects.requireNonNull(target, "target state cannot be null");
    return new NextState<>(Kind.CONTINUE, target);
  }

  @SuppressWarnings("unchecked")
  public static <I, D, E extends Exception> NextState<I, D, E> notFound() {
    return (NextState<I, D, E>) notFound;
  }

  @SuppressWarnings("unchecked")
  public static <I, D, E extends Exception> NextState<I, D, E> end() {
    return (NextState<I, D, E>) end;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Target of a CONTINUE outcome, null for the other kinds.
   */
  public SharedState<? extends AutomatonState<I, D, E>> getTarget() {
    return target;
  }

  public boolean isContinue() {
    return kind == Kind.CONTINUE;
  }

  public boolean isNotFound() {
    return kind == Kind.NOT_FOUND;
  }

  public boolean isEnd() {
    return kind == Kind.END;
  }

  @Override
  public String toString() {
    return "NextState [kind=" + kind + ", target=" + target + "]";
  }

  public static enum Kind {
    // move on to the carried target state
    CONTINUE,
    // no viable next state from here
    NOT_FOUND,
    // upstream data is exhausted
    END;
  }
}
