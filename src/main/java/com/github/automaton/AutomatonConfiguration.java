package com.github.automaton;

/**
 * This class encapsulates all the configuration parameters for an Automaton. Use the
 * {@code AutomatonConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. If graphMode is not set, {@link GraphMode#BUILD_ONCE} is used and the state graph factory is
 * invoked lazily on the very first run.<br>
 * 2. routeCapacity bounds how many visited state ids are retained for the last run. A long running
 * cyclic automaton visits an unbounded number of states, only the most recent ones are kept. Set it
 * to 0 to switch route tracing off.<br>
 */
public final class AutomatonConfiguration {
  final static int defaultRouteCapacity = 100;

  private final GraphMode graphMode;
  private final int routeCapacity;

  public GraphMode getGraphMode() {
    return graphMode;
  }

  public int getRouteCapacity() {
    return routeCapacity;
  }

  public static AutomatonConfiguration defaults() {
    return new AutomatonConfiguration(GraphMode.BUILD_ONCE, defaultRouteCapacity);
  }

  public final static class AutomatonConfigurationBuilder {
    private GraphMode graphMode = GraphMode.BUILD_ONCE;
    private int routeCapacity = defaultRouteCapacity;

    public static AutomatonConfigurationBuilder newBuilder() {
      return new AutomatonConfigurationBuilder();
    }

    public AutomatonConfigurationBuilder graphMode(final GraphMode graphMode) {
      this.graphMode = graphMode;
      return this;
    }

    public AutomatonConfigurationBuilder routeCapacity(final int routeCapacity) {
      this.routeCapacity = routeCapacity;
      return this;
    }

    public AutomatonConfiguration build() throws AutomatonException {
      final AutomatonConfiguration config = new AutomatonConfiguration(graphMode, routeCapacity);
      config.validate();
      return config;
    }

    private AutomatonConfigurationBuilder() {}
  }

  private void validate() throws AutomatonException {
    StringBuilder messages = new StringBuilder();
    if (graphMode == null) {
      messages.append("GraphMode cannot be null. ");
    }
    if (routeCapacity < 0) {
      messages.append("routeCapacity cannot be negative. ");
    }
    if (messages.length() > 0) {
      throw new AutomatonException(AutomatonException.Code.INVALID_AUTOMATON_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "AutomatonConfiguration [graphMode=" + graphMode + ", routeCapacity=" + routeCapacity
        + "]";
  }

  private AutomatonConfiguration(final GraphMode graphMode, final int routeCapacity) {
    this.graphMode = graphMode;
    this.routeCapacity = routeCapacity;
  }

}
