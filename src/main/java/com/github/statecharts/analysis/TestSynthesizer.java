package com.github.statecharts.analysis;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.model.State;
import com.github.statecharts.model.StateMachine;
import com.github.statecharts.model.Transition;

/**
 * Derives the unit test scenarios of a state machine: one per cycle starting from the initial
 * state, one per path from a source state to a sink state. For each scenario the exact number of
 * calls of every guard, action, entering and leaving hook is computed.
 *
 * The scratch counters of the machine are used during the computation and left at zero.
 */
public final class TestSynthesizer {
  private static final Logger logger = LogManager.getLogger(TestSynthesizer.class.getSimpleName());

  private final int maxScenarios;
  private final int maxPathLength;

  public TestSynthesizer(final int maxScenarios, final int maxPathLength) {
    this.maxScenarios = maxScenarios;
    this.maxPathLength = maxPathLength;
  }

  public TestPlan synthesize(final StateMachine machine) {
    final GraphSearch search = new GraphSearch(maxScenarios, maxPathLength);
    final List<String> selfLoops = new ArrayList<>();
    final List<List<String>> cycles = new ArrayList<>();
    for (List<String> cycle : search.cycles(machine)) {
      if (cycle.size() == 1) {
        selfLoops.add(cycle.get(0));
        continue;
      }
      final List<String> rotated = rotate(machine, cycle);
      if (rotated != null) {
        cycles.add(rotated);
      }
    }
    boolean truncated = search.isTruncated();
    final List<List<String>> paths = search.pathsToSinks(machine);
    truncated |= search.isTruncated();
    if (truncated) {
      machine.warning("Test scenarios truncated: at most " + maxScenarios
          + " cycles and paths of at most " + maxPathLength + " states are generated");
    }

    final List<Scenario> cycleScenarios = new ArrayList<>();
    for (List<String> cycle : cycles) {
      cycleScenarios.add(cycleScenario(machine, cycleScenarios.size(), cycle));
    }
    final List<Scenario> pathScenarios = new ArrayList<>();
    for (List<String> path : paths) {
      pathScenarios.add(pathScenario(machine, pathScenarios.size(), path));
    }
    machine.resetHits();
    logger.info("Synthesized " + cycleScenarios.size() + " cycle and " + pathScenarios.size()
        + " path scenarios for " + machine.getName());
    return new TestPlan(machine.getName(), cycleScenarios, pathScenarios, selfLoops, truncated);
  }

  /**
   * Make the cycle start from the first successor of the initial state it goes through, then
   * close it by appending that state again. Returns null when the cycle cannot be reached
   * directly from the initial state.
   *
   * @param cycle the states of the cycle, its first state not repeated at the end
   */
  public static List<String> rotate(final StateMachine machine, final List<String> cycle) {
    if (!machine.hasInitialState()) {
      return null;
    }
    for (String successor : machine.getSuccessors(machine.getInitialState())) {
      final int index = cycle.indexOf(successor);
      if (index >= 0) {
        final List<String> rotated = new ArrayList<>(cycle.subList(index, cycle.size()));
        rotated.addAll(cycle.subList(0, index));
        rotated.add(rotated.get(0));
        return rotated;
      }
    }
    return null;
  }

  private static Scenario cycleScenario(final StateMachine machine, final int index,
      final List<String> cycle) {
    // the machine is entered from its initial state before running the cycle
    final List<String> walk = new ArrayList<>(cycle.size() + 1);
    walk.add(machine.getInitialState());
    walk.addAll(cycle);
    final MockExpectations expectations = count(machine, walk);
    final Transition closing = machine.getTransition(cycle.get(0), cycle.get(1));
    final List<Scenario.Step> steps = steps(machine, walk, closing.hasEvent());
    return new Scenario(Scenario.Kind.CYCLE, index, cycle, steps, expectations,
        !closing.hasEvent());
  }

  private static Scenario pathScenario(final StateMachine machine, final int index,
      final List<String> path) {
    final MockExpectations expectations = count(machine, path);
    return new Scenario(Scenario.Kind.PATH, index, path, steps(machine, path, true),
        expectations, false);
  }

  /**
   * The state reached after a transition can only be checked when the machine then waits for an
   * event, ie. when the next transition has one.
   */
  private static List<Scenario.Step> steps(final StateMachine machine, final List<String> walk,
      final boolean assertLast) {
    final List<Scenario.Step> steps = new ArrayList<>();
    final int last = walk.size() - 2;
    for (int i = 0; i <= last; i++) {
      final Transition transition = machine.getTransition(walk.get(i), walk.get(i + 1));
      final boolean assertAfter = i == last ? assertLast
          : machine.getTransition(walk.get(i + 1), walk.get(i + 2)).hasEvent();
      steps.add(new Scenario.Step(transition, transition.hasEvent(), assertAfter));
    }
    return steps;
  }

  /**
   * Count the hook calls along the walk. Leaving and entering hooks are not called when a
   * transition loops on its state.
   */
  static MockExpectations count(final StateMachine machine, final List<String> walk) {
    machine.resetHits();
    for (int i = 0; i < walk.size() - 1; i++) {
      final String origin = walk.get(i);
      final String destination = walk.get(i + 1);
      machine.getTransition(origin, destination).hit();
      if (!origin.equals(destination)) {
        final State source = machine.getState(origin);
        final State target = machine.getState(destination);
        source.hitLeaving();
        target.hitEntering();
      }
    }
    return MockExpectations.snapshot(machine);
  }
}
