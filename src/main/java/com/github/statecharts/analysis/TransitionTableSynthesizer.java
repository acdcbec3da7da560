package com.github.statecharts.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.github.statecharts.builder.HookNames;
import com.github.statecharts.model.Arc;
import com.github.statecharts.model.Event;
import com.github.statecharts.model.StateMachine;
import com.github.statecharts.model.Transition;

/**
 * Derives one table per named event, in the order events were first declared.
 */
public final class TransitionTableSynthesizer {

  public List<TransitionTable> synthesize(final StateMachine machine) {
    final List<TransitionTable> tables = new ArrayList<>();
    for (Map.Entry<Event, List<Arc>> dispatch : machine.getDispatch().entrySet()) {
      final Event event = dispatch.getKey();
      if (!event.isNamed()) {
        continue;
      }
      final List<TransitionTable.Entry> entries = new ArrayList<>();
      for (Arc arc : dispatch.getValue()) {
        final Transition transition = machine.getTransition(arc.getOrigin(), arc.getDestination());
        entries.add(new TransitionTable.Entry(arc.getOrigin(), arc.getDestination(),
            transition.hasGuard() ? HookNames.guard(arc.getOrigin(), arc.getDestination()) : "",
            transition.hasAction() ? HookNames.action(arc.getOrigin(), arc.getDestination())
                : ""));
      }
      tables.add(new TransitionTable(machine.withParameters(event), entries));
    }
    return tables;
  }
}
