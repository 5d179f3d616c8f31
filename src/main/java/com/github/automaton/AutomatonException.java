package com.github.automaton;

/**
 * Single checked exception raised by the automaton engine itself. The code enum encapsulates the
 * misuse conditions the engine can detect. Errors raised by user states are never wrapped in this
 * exception; they are reported through {@link RunResult#getError()} as-is.
 */
public final class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public AutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public AutomatonException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_INITIAL_STATE("State graph factory is missing or produced a null initial state"),
    // 2.
    STATE_ALREADY_BORROWED(
        "State is mutably borrowed. Release the mutable borrow before using the state again"),
    // 3.
    INVALID_TRANSITION_OUTCOME("State transition returned a null outcome"),
    // 4.
    INVALID_AUTOMATON_CONFIG("Automaton configuration is invalid"),
    // 5.
    REENTRANT_RUN("Automaton is already running; runs cannot be nested or shared across threads"),
    // 6.
    GRAPH_CONSTRUCTION_FAILURE(
        "State graph factory failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
