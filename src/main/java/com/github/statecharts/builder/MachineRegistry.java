package com.github.statecharts.builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.model.StateMachine;

/**
 * Registry of all state machines of one translated diagram, keyed by machine name, in discovery
 * order: the root machine first, then nested machines in declaration order.
 *
 * Machines only reference their parent by name; this registry resolves such references.
 */
public final class MachineRegistry {
  private static final Logger logger = LogManager.getLogger(MachineRegistry.class.getSimpleName());

  private final Map<String, StateMachine> allStateMachines = new LinkedHashMap<>();
  private StateMachine root;

  void register(final StateMachine stateMachine) {
    if (allStateMachines.isEmpty()) {
      root = stateMachine;
    }
    final StateMachine previous = allStateMachines.put(stateMachine.getName(), stateMachine);
    if (previous != null) {
      stateMachine.warning("The state machine " + stateMachine.getName()
          + " is declared several times: only its last declaration is generated");
    }
  }

  public StateMachine lookup(final String name) {
    return allStateMachines.get(name);
  }

  public StateMachine getRoot() {
    return root;
  }

  public StateMachine parentOf(final StateMachine stateMachine) {
    return stateMachine.getParentName().map(allStateMachines::get).orElse(null);
  }

  /**
   * All machines, root first then nested ones in declaration order.
   */
  public List<StateMachine> machines() {
    return Collections.unmodifiableList(new ArrayList<>(allStateMachines.values()));
  }

  public int size() {
    return allStateMachines.size();
  }

  /**
   * Drop every machine. The root owns its children so nothing else keeps them alive.
   */
  public void demolish() {
    if (logger.isDebugEnabled()) {
      logger.debug("Demolishing registry of " + allStateMachines.size() + " state machines");
    }
    allStateMachines.clear();
    root = null;
  }
}
