package com.github.automaton;

import java.util.Objects;

import com.github.automaton.AutomatonException.Code;

/**
 * Shared handle to a state. Any number of predecessor states (and the automaton itself) may hold
 * the same handle, which is what lets a graph reference one successor from many places and close
 * cycles.
 *
 * Access is split in two:<br>
 * 1. {@link #borrow()} gives read access and is what the driver uses while running.<br>
 * 2. {@link #borrowMut()} gives exclusive access for wiring a state after it was created, e.g.
 * registering connections that point back at states created later. At most one mutable borrow can
 * be open at a time and no read borrow is granted while it is open. This is checked at runtime.<br>
 *
 * Handles are not thread-safe. A graph shared between automatons running on different threads
 * needs external synchronization.
 */
public final class SharedState<S extends AutomatonState<?, ?, ?>> {
  private final S state;
  private boolean mutablyBorrowed;

  private SharedState(final S state) {
    this.state = state;
  }

  /**
   * Wrap the given state in a new shared handle.
   */
  public static <S extends AutomatonState<?, ?, ?>> SharedState<S> of(final S state) {
    Objects.requireNonNull(state, "state cannot be null");
    return new SharedState<>(state);
  }

  /**
   * Read access to the state. Fails if a mutable borrow is still open.
   */
  public S borrow() throws AutomatonException {
    if (mutablyBorrowed) {
      throw new AutomatonException(Code.STATE_ALREADY_BORROWED,
          "Cannot read state:" + state.getId() + " while it is mutably borrowed");
    }
    return state;
  }

  /**
   * Exclusive access to the state until the returned borrow is closed.
   */
  public MutableBorrow<S> borrowMut() throws AutomatonException {
    if (mutablyBorrowed) {
      throw new AutomatonException(Code.STATE_ALREADY_BORROWED,
          "State:" + state.getId() + " is already mutably borrowed");
    }
    mutablyBorrowed = true;
    return new MutableBorrow<>(this);
  }

  /**
   * Run the modifier under a mutable borrow that is always released afterwards.
   */
  public SharedState<S> modify(final StateModifier<S> modifier) throws AutomatonException {
    try (MutableBorrow<S> borrow = borrowMut()) {
      modifier.modify(borrow.get());
    }
    return this;
  }

  public boolean isMutablyBorrowed() {
    return mutablyBorrowed;
  }

  S state() {
    return state;
  }

  void release() {
    mutablyBorrowed = false;
  }

  @Override
  public String toString() {
    return "SharedState [state=" + state + ", mutablyBorrowed=" + mutablyBorrowed + "]";
  }

  /**
   * Callback used by {@link SharedState#modify(StateModifier)}.
   */
  @FunctionalInterface
  public interface StateModifier<S> {
    void modify(final S state) throws AutomatonException;
  }
}
