package com.github.statecharts.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StatechartException;
import com.github.statecharts.StatechartException.Code;
import com.github.statecharts.builder.HookNames;
import com.github.statecharts.model.State;
import com.github.statecharts.model.StateMachine;
import com.github.statecharts.model.Transition;

/**
 * Turns the event-less transitions leaving each state into the body of the internal dispatch
 * method of that state, run by the generated machine right after entering the state.
 *
 * Candidates are tried in declaration order. The generated lines carry no base indentation.
 */
public final class Elaborator {
  private static final Logger logger = LogManager.getLogger(Elaborator.class.getSimpleName());

  private static final String INDENT = "  ";

  public void elaborate(final StateMachine machine) throws StatechartException {
    if (machine.isElaborated()) {
      throw new StatechartException(Code.ALREADY_ELABORATED,
          "State machine " + machine.getName() + " is already elaborated");
    }
    int count = 0;
    for (State state : machine.getStates()) {
      final List<Transition> candidates = new ArrayList<>();
      for (Transition transition : machine.getOutgoing(state.getId())) {
        if (!transition.hasEvent()) {
          candidates.add(transition);
        }
      }
      if (!candidates.isEmpty()) {
        state.setInternal(dispatch(machine, state.getId(), candidates));
        count++;
      }
    }
    machine.markElaborated();
    if (logger.isDebugEnabled()) {
      logger.debug("Elaborated " + count + " internal transitions of " + machine.getName());
    }
  }

  private static String dispatch(final StateMachine machine, final String state,
      final List<Transition> candidates) {
    final StringBuilder code = new StringBuilder();
    final Transition first = candidates.get(0);
    if (candidates.size() == 1 && !first.hasGuard()) {
      code.append("// WARNING: Internal transition without event nor guard to state ")
          .append(first.getDestination()).append('\n');
      branch(code, machine, first, "");
      return code.toString();
    }
    // first guard-less candidate, it shadows the following ones
    Transition shadowing = null;
    for (int i = 0; i < candidates.size(); i++) {
      final Transition candidate = candidates.get(i);
      if (!candidate.hasGuard() && shadowing != null) {
        final String message = "Non-deterministic internal transition from state " + state
            + ": the guard-less way to state " + shadowing.getDestination()
            + " shadows the way to state " + candidate.getDestination();
        code.append("// WARNING: ").append(message).append('\n');
        machine.warning(message);
      }
      code.append(i == 0 ? "if (" : "} else if (");
      if (candidate.hasGuard()) {
        code.append(HookNames.guard(state, candidate.getDestination())).append("()");
      } else {
        code.append("true /* no guard */");
        if (shadowing == null) {
          shadowing = candidate;
        }
      }
      code.append(") {\n");
      branch(code, machine, candidate, INDENT);
    }
    code.append("}\n");
    return code.toString();
  }

  private static void branch(final StringBuilder code, final StateMachine machine,
      final Transition transition, final String indent) {
    final String origin = transition.getOrigin();
    final String destination = transition.getDestination();
    code.append(indent).append("logger.debug(\"[")
        .append(machine.getClassName().toUpperCase(Locale.ROOT)).append("][STATE ")
        .append(origin).append("] Candidate for internal transitioning to state ")
        .append(destination).append("\");\n");
    code.append(indent).append("transition(States.").append(HookNames.stateEnum(destination))
        .append(", ")
        .append(transition.hasAction() ? "this::" + HookNames.action(origin, destination) : "null")
        .append(");\n");
  }
}
