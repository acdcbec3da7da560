package com.github.statecharts.emit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StatechartException;
import com.github.statecharts.StatechartException.Code;
import com.github.statecharts.model.Event;
import com.github.statecharts.model.Snippet;
import com.github.statecharts.model.State;
import com.github.statecharts.model.StateMachine;
import com.github.statecharts.model.Transition;

/**
 * Writes a state machine back as a PlantUML state diagram, the way the translator understood it.
 * Reading the written diagram again gives the same graph.
 */
public final class PlantUmlWriter {
  private static final Logger logger = LogManager.getLogger(PlantUmlWriter.class.getSimpleName());

  private static final String STD_ACTION_SEPARATOR = "\\n--\\n";

  public static String fileName(final StateMachine machine) {
    return machine.getName() + "-interpreted.plantuml";
  }

  public Path write(final StateMachine machine, final Path directory) throws StatechartException {
    final Path file = directory.resolve(fileName(machine));
    try {
      Files.write(file, export(machine).getBytes(StandardCharsets.UTF_8));
    } catch (IOException problem) {
      throw new StatechartException(Code.IO_FAILURE, problem);
    }
    logger.info("Wrote " + file);
    return file;
  }

  public String export(final StateMachine machine) {
    return "@startuml\n" + body(machine) + "@enduml\n";
  }

  /**
   * State annotations first, then transitions, one per line.
   */
  public String body(final StateMachine machine) {
    final StringBuilder code = new StringBuilder();
    for (State state : machine.getStates()) {
      if (state.isInitial() || state.isFinal()) {
        continue;
      }
      annotate(code, state.getId(), "entering", state.getEntering());
      annotate(code, state.getId(), "leaving", state.getLeaving());
      annotate(code, state.getId(), "activity", state.getActivity());
      if (!state.getComment().isEmpty()) {
        code.append(state.getId()).append(" : comment / ").append(state.getComment())
            .append('\n');
      }
    }
    for (Transition transition : machine.getTransitions()) {
      code.append(transition(transition)).append('\n');
    }
    return code.toString();
  }

  private static void annotate(final StringBuilder code, final String state, final String what,
      final Snippet snippet) {
    if (snippet.isEmpty()) {
      return;
    }
    for (String line : snippet.getCode().split("\n")) {
      code.append(state).append(" : ").append(what).append(" / ").append(line.trim())
          .append('\n');
    }
  }

  static String transition(final Transition transition) {
    final StringBuilder code = new StringBuilder();
    final boolean withAction = transition.hasAction() && !transition.hasPlaceholderAction();
    if (transition.isStateReaction()) {
      code.append(transition.getOrigin()).append(" : on ").append(event(transition.getEvent()));
      if (transition.hasGuard()) {
        code.append(" [").append(transition.getGuard().flatten()).append(']');
      }
      if (withAction) {
        code.append(" / ").append(transition.getAction().flatten());
      }
      return code.toString();
    }
    final String destination = State.FINAL.equals(transition.getDestination()) ? State.INITIAL
        : transition.getDestination();
    final String arrow = transition.getArrow().isEmpty() ? "->" : transition.getArrow();
    if (arrow.endsWith(">")) {
      code.append(transition.getOrigin()).append(' ').append(arrow).append(' ').append(destination);
    } else {
      code.append(destination).append(' ').append(arrow).append(' ').append(transition.getOrigin());
    }
    if (transition.hasEvent() || transition.hasGuard() || withAction) {
      code.append(" :");
    }
    if (transition.hasEvent()) {
      code.append(' ').append(event(transition.getEvent()));
    }
    if (transition.hasGuard()) {
      code.append(" [").append(transition.getGuard().flatten()).append(']');
    }
    if (withAction) {
      code.append(' ').append(STD_ACTION_SEPARATOR).append(transition.getAction().flatten());
    }
    return code.toString();
  }

  /**
   * A camel case name without parameters is followed by empty parentheses, otherwise reading it
   * back would lower its case.
   */
  private static String event(final Event event) {
    final String declaration = event.declaration();
    if (event.getParameters().isEmpty()
        && !event.getName().equals(event.getName().toLowerCase(Locale.ROOT))) {
      return declaration + "()";
    }
    return declaration;
  }
}
