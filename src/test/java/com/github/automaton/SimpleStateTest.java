package com.github.automaton;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.automaton.Automaton.AutomatonBuilder;

/**
 * Tests for automatons made of SimpleStates that consume one key per transition.
 */
public class SimpleStateTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger = LogManager.getLogger(SimpleStateTest.class.getSimpleName());

  @Test
  public void testPatternMatching() throws AutomatonException {
    final TextMatching matching = new TextMatching("aabbacacaabab");
    final Automaton<Integer, TextMatching, MatchFailure> automaton =
        AutomatonBuilder.<Integer, TextMatching, MatchFailure>newBuilder()
            .graph(SimpleStateTest::abPatternGraph).build();

    final RunResult<Integer, MatchFailure> result = automaton.run(matching);

    assertTrue(result.isStoppedEndOfInput());
    assertEquals(Arrays.asList(1, 9, 11), matching.getMatches());
    // the last key was the 'b' of the final "ab"
    assertEquals(Integer.valueOf(2), result.getStateId());
    // 13 keys plus the transition that found the input exhausted
    assertEquals(14L, automaton.getStatistics().getLastRunTransitions());
  }

  @Test
  public void testPatternMatchingNoMatches() throws AutomatonException {
    final TextMatching matching = new TextMatching("bbbcaaac");
    final Automaton<Integer, TextMatching, MatchFailure> automaton =
        AutomatonBuilder.<Integer, TextMatching, MatchFailure>newBuilder()
            .graph(SimpleStateTest::abPatternGraph).build();

    final RunResult<Integer, MatchFailure> result = automaton.run(matching);

    assertTrue(result.isStoppedEndOfInput());
    assertTrue(matching.getMatches().isEmpty());
    assertEquals(Integer.valueOf(0), result.getStateId());
  }

  @Test
  public void testEmptyInputEndsBeforeAnyMatch() throws AutomatonException {
    final TextMatching matching = new TextMatching("");
    final Automaton<Integer, TextMatching, MatchFailure> automaton =
        AutomatonBuilder.<Integer, TextMatching, MatchFailure>newBuilder()
            .graph(SimpleStateTest::abPatternGraph).build();

    final RunResult<Integer, MatchFailure> result = automaton.run(matching);

    assertTrue(result.isStoppedEndOfInput());
    assertFalse(result.isStoppedNoNextState());
    assertEquals(Integer.valueOf(0), result.getStateId());
    assertTrue(matching.getMatches().isEmpty());
    assertEquals(1L, automaton.getStatistics().getLastRunTransitions());
  }

  @Test
  public void testExhaustionWinsOverConnections() throws MatchFailure {
    final SimpleState<IndexedChar, Integer, TextMatching, MatchFailure> state =
        new SimpleState<>(7);
    final SharedState<SimpleState<IndexedChar, Integer, TextMatching, MatchFailure>> self =
        SharedState.of(state);
    for (int iter = 0; iter < 5; iter++) {
      state.registerNextState(key -> true, (data, key) -> data.addMatch(-1), self);
    }

    final TextMatching matching = new TextMatching("");
    final NextState<Integer, TextMatching, MatchFailure> next = state.transition(matching);

    assertTrue(next.isEnd());
    assertNull(next.getTarget());
    assertTrue(matching.getMatches().isEmpty());
  }

  @Test
  public void testFirstMatchWins() throws AutomatonException {
    final List<String> fired = new ArrayList<>();
    final StateGraphFactory<Integer, TextMatching, MatchFailure> graph = () -> {
      final SharedState<SimpleState<IndexedChar, Integer, TextMatching, MatchFailure>> start =
          SimpleState.newShared(0);
      final SharedState<SimpleState<IndexedChar, Integer, TextMatching, MatchFailure>> first =
          SimpleState.newShared(1);
      final SharedState<SimpleState<IndexedChar, Integer, TextMatching, MatchFailure>> second =
          SimpleState.newShared(2);
      start.modify(state -> {
        state.registerNextState(charMatcher('x', false), (data, key) -> fired.add("first"),
            first);
        state.registerNextState(key -> true, (data, key) -> fired.add("second"), second);
      });
      return start;
    };
    final Automaton<Integer, TextMatching, MatchFailure> automaton =
        AutomatonBuilder.<Integer, TextMatching, MatchFailure>newBuilder().graph(graph).build();

    final RunResult<Integer, MatchFailure> result = automaton.run(new TextMatching("x"));

    // both connections accept 'x', only the one registered first may fire
    assertEquals(Collections.singletonList("first"), fired);
    assertTrue(result.isStoppedEndOfInput());
    assertEquals(Integer.valueOf(1), result.getStateId());
  }

  @Test
  public void testLaterConnectionTakenWhenEarlierDoesNotMatch() throws AutomatonException {
    final List<String> fired = new ArrayList<>();
    final StateGraphFactory<Integer, TextMatching, MatchFailure> graph = () -> {
      final SharedState<SimpleState<IndexedChar, Integer, TextMatching, MatchFailure>> start =
          SimpleState.newShared(0);
      final SharedState<SimpleState<IndexedChar, Integer, TextMatching, MatchFailure>> other =
          SimpleState.newShared(1);
      start.modify(state -> {
        state.registerNextState(charMatcher('x', false), (data, key) -> fired.add("x"), other);
        state.registerNextState(charMatcher('y', false), (data, key) -> fired.add("y"), other);
      });
      return start;
    };
    final Automaton<Integer, TextMatching, MatchFailure> automaton =
        AutomatonBuilder.<Integer, TextMatching, MatchFailure>newBuilder().graph(graph).build();

    automaton.run(new TextMatching("y"));

    assertEquals(Collections.singletonList("y"), fired);
  }

  @Test
  public void testChainOfStates() throws AutomatonException {
    final CountingData data = new CountingData(1, 4);
    final StateGraphFactory<Integer, CountingData, MatchFailure> graph = () -> {
      final SharedState<SimpleState<Integer, Integer, CountingData, MatchFailure>> world =
          SimpleState.newShared(3);
      final SharedState<SimpleState<Integer, Integer, CountingData, MatchFailure>> simple =
          SimpleState.newShared(2);
      final SharedState<SimpleState<Integer, Integer, CountingData, MatchFailure>> hello =
          SimpleState.newShared(1);
      simple.modify(state -> state.registerNextState(key -> key == 2,
          (counting, key) -> counting.append(" simple "), world));
      hello.modify(state -> state.registerNextState(key -> key == 1,
          (counting, key) -> counting.append("Hello"), simple));
      world.modify(state -> state.registerConnection(Connection.of(key -> key == 3,
          (counting, key) -> counting.append("world!"), hello)));
      return hello;
    };
    final Automaton<Integer, CountingData, MatchFailure> automaton =
        AutomatonBuilder.<Integer, CountingData, MatchFailure>newBuilder().graph(graph).build();

    final RunResult<Integer, MatchFailure> result = automaton.run(data);

    assertEquals("Hello simple world!", data.getBuffer());
    assertTrue(result.isStoppedEndOfInput());
    // world! sends the automaton back to hello, which then finds the keys exhausted
    assertEquals(Integer.valueOf(1), result.getStateId());
  }

  @Test
  public void testNoConnectionForKey() throws AutomatonException {
    final CountingData data = new CountingData(2, 3);
    final Automaton<Integer, CountingData, MatchFailure> automaton =
        AutomatonBuilder.<Integer, CountingData, MatchFailure>newBuilder()
            .graph(() -> SimpleState.<Integer, Integer, CountingData, MatchFailure>newShared(1))
            .build();

    final RunResult<Integer, MatchFailure> result = automaton.run(data);

    assertTrue(result.isStoppedNoNextState());
    assertEquals(Integer.valueOf(1), result.getStateId());
    assertEquals("", data.getBuffer());
  }

  @Test
  public void testActionFailureStopsRun() throws AutomatonException {
    final MatchFailure failure = new MatchFailure("no b allowed");
    final List<Integer> visited = new ArrayList<>();
    final StateGraphFactory<Integer, TextMatching, MatchFailure> graph = () -> {
      final SharedState<SimpleState<IndexedChar, Integer, TextMatching, MatchFailure>> start =
          SimpleState.newShared(0);
      start.modify(state -> {
        state.registerNextState(charMatcher('b', false), (data, key) -> {
          throw failure;
        }, start);
        state.registerNextState(key -> true, (data, key) -> visited.add(key.getIndex()), start);
      });
      return start;
    };
    final Automaton<Integer, TextMatching, MatchFailure> automaton =
        AutomatonBuilder.<Integer, TextMatching, MatchFailure>newBuilder().graph(graph).build();

    final RunResult<Integer, MatchFailure> result = automaton.run(new TextMatching("aabaa"));

    assertTrue(result.isFailed());
    assertSame(failure, result.getError());
    assertEquals(Integer.valueOf(0), result.getStateId());
    // nothing after the failing 'b' was processed
    assertEquals(Arrays.asList(0, 1), visited);
    logger.info(automaton.getStatistics().toString());
  }

  @Test
  public void testConnectionsKeepRegistrationOrder() {
    final SharedState<SimpleState<IndexedChar, Integer, TextMatching, MatchFailure>> target =
        SimpleState.newShared(1);
    final SimpleState<IndexedChar, Integer, TextMatching, MatchFailure> state =
        SimpleState.newState(0);
    final Connection<IndexedChar, Integer, TextMatching, MatchFailure> withAction =
        Connection.of(charMatcher('a', false), (data, key) -> data.addMatch(key.getIndex()),
            target);
    final Connection<IndexedChar, Integer, TextMatching, MatchFailure> withoutAction =
        Connection.withoutAction(charMatcher('a', true), target);
    state.registerConnection(withAction).registerConnection(withoutAction);

    assertEquals(Arrays.asList(withAction, withoutAction), state.getConnections());
    assertTrue(withAction.hasAction());
    assertFalse(withoutAction.hasAction());
    assertSame(target, withoutAction.getTarget());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testConnectionsViewIsReadOnly() {
    final SimpleState<IndexedChar, Integer, TextMatching, MatchFailure> state =
        SimpleState.newState(0);
    state.getConnections().add(Connection.withoutAction(key -> true, SharedState.of(state)));
  }

  @Test(expected = NullPointerException.class)
  public void testConnectionRequiresTarget() {
    Connection.<IndexedChar, Integer, TextMatching, MatchFailure>withoutAction(key -> true, null);
  }

  /**
   * Graph finding every "ab" in a text. Each match records the index the "ab" starts at.
   */
  static SharedState<SimpleState<IndexedChar, Integer, TextMatching, MatchFailure>> abPatternGraph()
      throws AutomatonException {
    final SharedState<SimpleState<IndexedChar, Integer, TextMatching, MatchFailure>> nonMatch =
        SimpleState.newShared(0);
    final SharedState<SimpleState<IndexedChar, Integer, TextMatching, MatchFailure>> aState =
        SimpleState.newShared(1);
    final SharedState<SimpleState<IndexedChar, Integer, TextMatching, MatchFailure>> bState =
        SimpleState.newShared(2);
    nonMatch.modify(state -> {
      state.registerNextState(charMatcher('a', true), nonMatch);
      state.registerNextState(charMatcher('a', false), aState);
    });
    aState.modify(state -> {
      state.registerNextState(charMatcher('a', false), aState);
      state.registerNextState(charMatcher('b', true), nonMatch);
      state.registerNextState(charMatcher('b', false),
          (data, key) -> data.addMatch(key.getIndex() - 1), bState);
    });
    bState.modify(state -> {
      state.registerNextState(charMatcher('a', false), aState);
      state.registerNextState(charMatcher('a', true), nonMatch);
    });
    return nonMatch;
  }

  static Predicate<IndexedChar> charMatcher(final char c, final boolean reversed) {
    return key -> (key.getCharacter() == c) ^ reversed;
  }

  /**
   * A character of a text together with its position.
   */
  public static final class IndexedChar {
    private final int index;
    private final char character;

    IndexedChar(final int index, final char character) {
      this.index = index;
      this.character = character;
    }

    public int getIndex() {
      return index;
    }

    public char getCharacter() {
      return character;
    }

    @Override
    public String toString() {
      return index + ":" + character;
    }
  }

  /**
   * Text cursor handing out indexed characters and collecting match positions.
   */
  public static final class TextMatching implements KeyProvidingData<IndexedChar> {
    private final String text;
    private final List<Integer> matches = new ArrayList<>();
    private int cursor;

    public TextMatching(final String text) {
      this.text = text;
    }

    @Override
    public Optional<IndexedChar> nextKey() {
      if (cursor >= text.length()) {
        return Optional.empty();
      }
      final IndexedChar key = new IndexedChar(cursor, text.charAt(cursor));
      cursor++;
      return Optional.of(key);
    }

    void addMatch(final int index) {
      matches.add(index);
    }

    public List<Integer> getMatches() {
      return matches;
    }
  }

  /**
   * Hands out the integers in [start, end) and owns a text buffer.
   */
  public static final class CountingData implements KeyProvidingData<Integer> {
    private final StringBuilder buffer = new StringBuilder();
    private final int end;
    private int current;

    public CountingData(final int start, final int end) {
      this.current = start;
      this.end = end;
    }

    @Override
    public Optional<Integer> nextKey() {
      if (current >= end) {
        return Optional.empty();
      }
      return Optional.of(current++);
    }

    void append(final String text) {
      buffer.append(text);
    }

    public String getBuffer() {
      return buffer.toString();
    }
  }

  public static final class MatchFailure extends Exception {
    private static final long serialVersionUID = 1L;

    public MatchFailure(final String message) {
      super(message);
    }
  }

}
