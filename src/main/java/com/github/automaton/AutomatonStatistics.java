package com.github.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Simple statistics holder for an automaton and its most recent run.
 */
public final class AutomatonStatistics {
  private final String automatonId;
  private final long startTstampMillis = System.currentTimeMillis();
  private final int routeCapacity;

  int totalRuns;
  int noNextStateStops;
  int endOfInputStops;
  int failures;
  int graphBuilds;
  long totalTransitions;
  long lastRunTransitions;
  long lastRunElapsedMillis;
  // bounded at routeCapacity, oldest ids are dropped first
  private final Deque<Object> lastRoute = new ArrayDeque<>();

  AutomatonStatistics(final String automatonId, final int routeCapacity) {
    this.automatonId = automatonId;
    this.routeCapacity = routeCapacity;
  }

  void beginRun() {
    totalRuns++;
    lastRunTransitions = 0L;
    lastRunElapsedMillis = 0L;
    lastRoute.clear();
  }

  void visit(final Object stateId) {
    if (routeCapacity == 0) {
      return;
    }
    if (lastRoute.size() == routeCapacity) {
      lastRoute.removeFirst();
    }
    lastRoute.addLast(stateId);
  }

  void transitioned() {
    totalTransitions++;
    lastRunTransitions++;
  }

  void endRun(final RunResult<?, ?> result, final long elapsedMillis) {
    lastRunElapsedMillis = elapsedMillis;
    switch (result.getReason()) {
      case NO_NEXT_STATE:
        noNextStateStops++;
        break;
      case END_OF_INPUT:
        endOfInputStops++;
        break;
      case FAILED:
        failures++;
        break;
      default:
        break;
    }
  }

  public String getAutomatonId() {
    return automatonId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public int getTotalRuns() {
    return totalRuns;
  }

  public int getNoNextStateStops() {
    return noNextStateStops;
  }

  public int getEndOfInputStops() {
    return endOfInputStops;
  }

  public int getFailures() {
    return failures;
  }

  public int getGraphBuilds() {
    return graphBuilds;
  }

  public long getTotalTransitions() {
    return totalTransitions;
  }

  public long getLastRunTransitions() {
    return lastRunTransitions;
  }

  public long getLastRunElapsedMillis() {
    return lastRunElapsedMillis;
  }

  /**
   * Ids of the states the last run executed, oldest first. Only the latest routeCapacity entries
   * are kept.
   */
  public List<Object> getLastRoute() {
    return Collections.unmodifiableList(new ArrayList<>(lastRoute));
  }

  @Override
  public String toString() {
    return "AutomatonStatistics [automatonId=" + automatonId + ", startTstampMillis="
        + startTstampMillis + ", totalRuns=" + totalRuns + ", noNextStateStops=" + noNextStateStops
        + ", endOfInputStops=" + endOfInputStops + ", failures=" + failures + ", graphBuilds="
        + graphBuilds + ", totalTransitions=" + totalTransitions + ", lastRunTransitions="
        + lastRunTransitions + ", lastRunElapsedMillis=" + lastRunElapsedMillis + "]";
  }

}
