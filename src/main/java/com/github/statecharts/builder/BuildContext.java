package com.github.statecharts.builder;

import java.util.ArrayDeque;
import java.util.Deque;

import com.github.statecharts.model.StateMachine;

/**
 * Traversal context of the model builder: the machine currently being populated and the outer
 * machines saved while a composite state is visited.
 */
final class BuildContext {
  private final MachineRegistry registry;
  private final Deque<StateMachine> outerMachines = new ArrayDeque<>();
  private StateMachine current;

  BuildContext(final MachineRegistry registry) {
    this.registry = registry;
  }

  MachineRegistry getRegistry() {
    return registry;
  }

  StateMachine current() {
    return current;
  }

  /**
   * Save the current machine and make the given one current.
   */
  void push(final StateMachine machine) {
    if (current != null) {
      outerMachines.push(current);
    }
    current = machine;
  }

  /**
   * Restore the machine saved by the matching {@link #push(StateMachine)}.
   */
  void pop() {
    current = outerMachines.isEmpty() ? null : outerMachines.pop();
  }

  int depth() {
    return outerMachines.size() + (current == null ? 0 : 1);
  }
}
