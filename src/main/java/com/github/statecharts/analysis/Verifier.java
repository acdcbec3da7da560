package com.github.statecharts.analysis;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.model.Event;
import com.github.statecharts.model.State;
import com.github.statecharts.model.StateMachine;
import com.github.statecharts.model.Transition;

/**
 * Structural checks of a built state machine. Findings are appended to the machine warnings, the
 * translation always goes on.
 *
 * Only the shape of the transitions is checked: guards are never evaluated, so two guards which
 * are not mutually exclusive, or which do not cover all cases, are not detected.
 */
public final class Verifier {
  private static final Logger logger = LogManager.getLogger(Verifier.class.getSimpleName());

  private final int maxCycles;
  private final int maxPathLength;

  public Verifier(final int maxCycles, final int maxPathLength) {
    this.maxCycles = maxCycles;
    this.maxPathLength = maxPathLength;
  }

  /**
   * Run every check, returns the number of warnings they added.
   */
  public int verify(final StateMachine machine) {
    final int before = machine.getWarnings().size();
    verifyInitialState(machine);
    verifyNumberOfEvents(machine);
    verifyIncomingTransitions(machine);
    verifyTransitions(machine);
    verifyInfiniteLoops(machine);
    final int found = machine.getWarnings().size() - before;
    logger.info("Verified state machine " + machine.getName() + ": " + found + " warning(s)");
    return found;
  }

  /**
   * The root machine shall start from {@code [*]}. Nested machines may be entered from any of
   * their states, they are not checked.
   */
  void verifyInitialState(final StateMachine machine) {
    if (machine.isRoot() && !machine.hasInitialState()) {
      machine.warning("Missing initial state in the main state machine");
    }
  }

  void verifyNumberOfEvents(final StateMachine machine) {
    for (Event event : machine.getDispatch().keySet()) {
      if (event.isNamed()) {
        return;
      }
    }
    machine.warning("The state machine shall have at least one event.");
  }

  void verifyIncomingTransitions(final StateMachine machine) {
    for (String state : machine.getStateIds()) {
      if (!State.INITIAL.equals(state) && machine.inDegree(state) == 0) {
        machine.warning("The state " + state + " shall have at least one incoming transition");
      }
    }
  }

  /**
   * A state with several ways out where one way has neither event nor guard: that way is always
   * a candidate, so transitioning to the other states is non deterministic.
   */
  void verifyTransitions(final StateMachine machine) {
    for (String state : machine.getStateIds()) {
      if (machine.outDegree(state) <= 1) {
        continue;
      }
      for (Transition transition : machine.getOutgoing(state)) {
        if (!transition.hasEvent() && !transition.hasGuard()) {
          machine.warning("The state " + state + " has an issue with its transitions: it has"
              + " several possible ways while the way to state " + transition.getDestination()
              + " is always true and therefore will be always a candidate and transition to"
              + " other states is non determinist.");
        }
      }
    }
  }

  /**
   * A cycle where no transition waits for an event never ends. Only the first one is reported.
   */
  void verifyInfiniteLoops(final StateMachine machine) {
    final GraphSearch search = new GraphSearch(maxCycles, maxPathLength);
    final List<List<String>> cycles = search.cycles(machine);
    if (search.isTruncated()) {
      machine.warning("Search of infinite loops stopped after " + cycles.size()
          + " cycles: some loops may not have been checked");
    }
    for (List<String> cycle : cycles) {
      if (cycle.size() == 1) {
        continue;
      }
      boolean withEvent = false;
      for (int i = 0; i < cycle.size(); i++) {
        final String destination = cycle.get((i + 1) % cycle.size());
        if (machine.getTransition(cycle.get(i), destination).hasEvent()) {
          withEvent = true;
          break;
        }
      }
      if (!withEvent) {
        final StringBuilder states = new StringBuilder();
        for (String state : cycle) {
          states.append(state).append(' ');
        }
        states.append(cycle.get(0));
        machine.warning("The state machine has an infinite loop: " + states + ". Add an event!");
        return;
      }
    }
  }
}
