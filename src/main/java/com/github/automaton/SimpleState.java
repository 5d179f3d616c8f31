package com.github.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ready-made state driven by an ordered list of {@link Connection}s. Saves writing
 * {@link AutomatonState#transition(Object)} by hand for parser like automatons that consume one key
 * per step.
 *
 * On every transition the state pulls the next key from the data. If the data is exhausted the
 * outcome is END, whatever connections exist. Otherwise connections are tried in the order they
 * were registered and the first one whose matcher accepts the key wins: its action runs and the
 * automaton moves to its target. When nothing matches the outcome is NOT_FOUND.
 *
 * First match wins is what keeps the automaton deterministic even when matchers overlap, so
 * register the more general connections first only if they are meant to shadow later ones.
 *
 * Connections are expected to be registered while the graph is built. Registering during a run is
 * not guarded against.
 */
public final class SimpleState<K, I, D extends KeyProvidingData<K>, E extends Exception>
    implements AutomatonState<I, D, E> {
  private final I id;
  private final List<Connection<K, I, D, E>> connections = new ArrayList<>();

  public SimpleState(final I id) {
    this.id = id;
  }

  public static <K, I, D extends KeyProvidingData<K>, E extends Exception>
      SimpleState<K, I, D, E> newState(final I id) {
    return new SimpleState<>(id);
  }

  /**
   * Convenience for {@code SharedState.of(new SimpleState<>(id))}.
   */
  public static <K, I, D extends KeyProvidingData<K>, E extends Exception>
      SharedState<SimpleState<K, I, D, E>> newShared(final I id) {
    return SharedState.of(new SimpleState<K, I, D, E>(id));
  }

  public SimpleState<K, I, D, E> registerConnection(final Connection<K, I, D, E> connection) {
    if (connection == null) {
      throw new NullPointerException("connection cannot be null");
    }
    connections.add(connection);
    return this;
  }

  public SimpleState<K, I, D, E> registerNextState(final Predicate<? super K> matcher,
      final ConnectionAction<? super K, ? super D, ? extends E> action,
      final SharedState<? extends AutomatonState<I, D, E>> target) {
    return registerConnection(Connection.<K, I, D, E>of(matcher, action, target));
  }

  public SimpleState<K, I, D, E> registerNextState(final Predicate<? super K> matcher,
      final SharedState<? extends AutomatonState<I, D, E>> target) {
    return registerConnection(Connection.<K, I, D, E>withoutAction(matcher, target));
  }

  /**
   * Registered connections in registration order.
   */
  public List<Connection<K, I, D, E>> getConnections() {
    return Collections.unmodifiableList(connections);
  }

  @Override
  public I getId() {
    return id;
  }

  @Override
  public NextState<I, D, E> transition(final D data) throws E {
    final Optional<K> nextKey = data.nextKey();
    if (!nextKey.isPresent()) {
      return NextState.end();
    }
    final K key = nextKey.get();
    for (final Connection<K, I, D, E> connection : connections) {
      if (connection.matches(key)) {
        connection.fire(data, key);
        return NextState.proceed(connection.getTarget());
      }
    }
    return NextState.notFound();
  }

  @Override
  public String toString() {
    return "SimpleState [id=" + id + ", connections=" + connections.size() + "]";
  }
}
