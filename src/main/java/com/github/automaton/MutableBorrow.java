package com.github.automaton;

/**
 * An open mutable borrow of a {@link SharedState}. Use it in a try-with-resources block, the
 * borrow is released on {@link #close()}. Closing twice is harmless.
 */
public final class MutableBorrow<S extends AutomatonState<?, ?, ?>> implements AutoCloseable {
  private SharedState<S> owner;

  MutableBorrow(final SharedState<S> owner) {
    this.owner = owner;
  }

  /**
   * The borrowed state. Not usable once this borrow is closed.
   */
  public S get() {
    if (owner == null) {
      throw new IllegalStateException("Mutable borrow was already released");
    }
    return owner.state();
  }

  public boolean isOpen() {
    return owner != null;
  }

  @Override
  public void close() {
    if (owner != null) {
      owner.release();
      owner = null;
    }
  }
}
