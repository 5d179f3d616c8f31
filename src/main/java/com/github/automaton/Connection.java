package com.github.automaton;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A guarded edge of a {@link SimpleState}: a matcher over keys, an optional action and the state to
 * move to. Connections are immutable once built.
 */
public final class Connection<K, I, D, E extends Exception> {
  private final Predicate<? super K> matcher;
  private final ConnectionAction<? super K, ? super D, ? extends E> action;
  private final SharedState<? extends AutomatonState<I, D, E>> target;

  private Connection(final Predicate<? super K> matcher,
      final ConnectionAction<? super K, ? super D, ? extends E> action,
      final SharedState<? extends AutomatonState<I, D, E>> target) {
    this.matcher = Objects.requireNonNull(matcher, "matcher cannot be null");
    this.action = action;
    this.target = Objects.requireNonNull(target, "target state cannot be null");
  }

  public static <K, I, D, E extends Exception> Connection<K, I, D, E> of(
      final Predicate<? super K> matcher,
      final ConnectionAction<? super K, ? super D, ? extends E> action,
      final SharedState<? extends AutomatonState<I, D, E>> target) {
    Objects.requireNonNull(action, "action cannot be null, use withoutAction() instead");
    return new Connection<>(matcher, action, target);
  }

  public static <K, I, D, E extends Exception> Connection<K, I, D, E> withoutAction(
      final Predicate<? super K> matcher,
      final SharedState<? extends AutomatonState<I, D, E>> target) {
    return new Connection<>(matcher, null, target);
  }

  public boolean matches(final K key) {
    return matcher.test(key);
  }

  public boolean hasAction() {
    return action != null;
  }

  /**
   * Run the action, if there is one, with the matched key.
   */
  void fire(final D data, final K key) throws E {
    if (action != null) {
      action.execute(data, key);
    }
  }

  public SharedState<? extends AutomatonState<I, D, E>> getTarget() {
    return target;
  }

  @Override
  public String toString() {
    // target is printed by id only, graphs are usually cyclic
    return "Connection [hasAction=" + hasAction() + ", target=" + target.state().getId() + "]";
  }
}
