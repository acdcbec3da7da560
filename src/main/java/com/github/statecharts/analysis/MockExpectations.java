package com.github.statecharts.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.statecharts.model.Arc;
import com.github.statecharts.model.State;
import com.github.statecharts.model.StateMachine;
import com.github.statecharts.model.Transition;

/**
 * Immutable snapshot of the expected number of calls of every mocked hook after one scenario.
 * Only hooks which exist in the generated machine are listed: guards and actions of transitions
 * having some, entering and leaving hooks of states having some.
 */
public final class MockExpectations {
  private final Map<Arc, Integer> guards;
  private final Map<Arc, Integer> actions;
  private final Map<String, Integer> entering;
  private final Map<String, Integer> leaving;

  private MockExpectations(final Map<Arc, Integer> guards, final Map<Arc, Integer> actions,
      final Map<String, Integer> entering, final Map<String, Integer> leaving) {
    this.guards = Collections.unmodifiableMap(guards);
    this.actions = Collections.unmodifiableMap(actions);
    this.entering = Collections.unmodifiableMap(entering);
    this.leaving = Collections.unmodifiableMap(leaving);
  }

  /**
   * Copy the scratch counters of the machine.
   */
  static MockExpectations snapshot(final StateMachine machine) {
    final Map<Arc, Integer> guards = new LinkedHashMap<>();
    final Map<Arc, Integer> actions = new LinkedHashMap<>();
    for (Transition transition : machine.getTransitions()) {
      final Arc arc = Arc.of(transition.getOrigin(), transition.getDestination());
      if (transition.hasGuard()) {
        guards.put(arc, transition.getGuardHits());
      }
      if (transition.hasAction()) {
        actions.put(arc, transition.getActionHits());
      }
    }
    final Map<String, Integer> entering = new LinkedHashMap<>();
    final Map<String, Integer> leaving = new LinkedHashMap<>();
    for (State state : machine.getStates()) {
      if (!state.getEntering().isEmpty()) {
        entering.put(state.getId(), state.getEntryHits());
      }
      if (!state.getLeaving().isEmpty()) {
        leaving.put(state.getId(), state.getExitHits());
      }
    }
    return new MockExpectations(guards, actions, entering, leaving);
  }

  public Map<Arc, Integer> getGuards() {
    return guards;
  }

  public Map<Arc, Integer> getActions() {
    return actions;
  }

  public Map<String, Integer> getEntering() {
    return entering;
  }

  public Map<String, Integer> getLeaving() {
    return leaving;
  }

  public int guardHits(final Arc arc) {
    return count(guards, arc);
  }

  /**
   * Value returned by the guard stub: a guard never crossed by the scenario refuses.
   */
  public boolean guardResult(final Arc arc) {
    return guardHits(arc) > 0;
  }

  public int actionHits(final Arc arc) {
    return count(actions, arc);
  }

  public int entryHits(final String state) {
    return count(entering, state);
  }

  public int exitHits(final String state) {
    return count(leaving, state);
  }

  private static <K> int count(final Map<K, Integer> counters, final K key) {
    final Integer count = counters.get(key);
    return count == null ? 0 : count;
  }

  @Override
  public String toString() {
    return "MockExpectations [guards=" + guards + ", actions=" + actions + ", entering="
        + entering + ", leaving=" + leaving + "]";
  }
}
