package com.github.statecharts.emit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StatechartException;
import com.github.statecharts.StatechartException.Code;
import com.github.statecharts.analysis.TransitionTable;
import com.github.statecharts.builder.HookNames;
import com.github.statecharts.model.Broadcast;
import com.github.statecharts.model.CodeInjections.Point;
import com.github.statecharts.model.Event;
import com.github.statecharts.model.Snippet;
import com.github.statecharts.model.State;
import com.github.statecharts.model.StateMachine;
import com.github.statecharts.model.Transition;

/**
 * Writes the Java class of one elaborated state machine. The class extends
 * {@code AbstractStateMachine}, declares its states as a nested enum, dispatches one table of
 * transitions per external event and exposes one overridable hook per guard, action, entering
 * and leaving code of the diagram.
 */
public final class CodeEmitter {
  private static final Logger logger = LogManager.getLogger(CodeEmitter.class.getSimpleName());

  static final String DEFAULT_BRIEF = "State machine concrete implementation.";

  private final Flavor flavor;
  private final String diagramName;
  private final String generatedOn;
  private final PlantUmlWriter plantUml = new PlantUmlWriter();

  public CodeEmitter(final Flavor flavor, final String diagramName, final String generatedOn) {
    this.flavor = flavor;
    this.diagramName = diagramName;
    this.generatedOn = generatedOn;
  }

  public static String fileName(final StateMachine machine) {
    return machine.getClassName() + ".java";
  }

  public Path write(final StateMachine machine, final List<TransitionTable> tables,
      final Path directory) throws StatechartException {
    final Path file = directory.resolve(fileName(machine));
    try {
      Files.write(file, emit(machine, tables).getBytes(StandardCharsets.UTF_8));
    } catch (IOException problem) {
      throw new StatechartException(Code.IO_FAILURE, problem);
    }
    logger.info("Wrote " + file);
    return file;
  }

  public String emit(final StateMachine machine, final List<TransitionTable> tables)
      throws StatechartException {
    if (!machine.isElaborated()) {
      throw new StatechartException(Code.NOT_ELABORATED,
          "State machine " + machine.getName() + " shall be elaborated before generating code");
    }
    final SourceWriter out = new SourceWriter();
    banner(out, diagramName, generatedOn);
    for (String warning : machine.getWarnings()) {
      out.line("// WARNING: " + warning);
    }
    for (String line : machine.getInjections().get(Point.HEADER)) {
      out.line(line);
    }
    out.blank();
    out.line("import org.apache.logging.log4j.LogManager;");
    out.line("import org.apache.logging.log4j.Logger;");
    out.blank();
    out.line("import com.github.statecharts.StatechartException;");
    out.line("import com.github.statecharts.runtime.AbstractStateMachine;");
    out.line("import com.github.statecharts.runtime.Transitions;");
    out.blank();

    final String className = machine.getClassName();
    classComment(out, machine);
    out.open("public " + (flavor == Flavor.HEADER ? "abstract " : "") + "class " + className
        + " extends AbstractStateMachine<" + className + ".States>");
    out.line("private static final Logger logger = LogManager.getLogger(" + className
        + ".class.getSimpleName());");
    out.blank();

    ///// Declarations /////
    statesEnum(out, machine);
    nestedMachineFields(out, machine);
    eventDataFields(out, machine);
    transitionTables(out, tables);

    ///// Life cycle /////
    constructor(out, machine);
    enterMethod(out, machine);
    exitMethod(out, machine);

    ///// External events /////
    eventMethods(out, machine, tables);

    ///// Hooks /////
    transitionHooks(out, machine);
    stateHooks(out, machine);

    if (machine.getInjections().has(Point.CODE)) {
      out.line("// Client code");
      for (String line : machine.getInjections().get(Point.CODE)) {
        out.line(line);
      }
    }
    out.close();
    for (String line : machine.getInjections().get(Point.FOOTER)) {
      out.line(line);
    }
    return out.toString();
  }

  static void banner(final SourceWriter out, final String diagramName, final String generatedOn) {
    out.line("// This file has been generated by the statecharts translator from " + diagramName);
    out.line("// on " + generatedOn + ". Your changes will be lost at the next translation.");
  }

  private void classComment(final SourceWriter out, final StateMachine machine) {
    final List<String> comment = new ArrayList<>();
    if (machine.getInjections().has(Point.BRIEF)) {
      comment.addAll(machine.getInjections().get(Point.BRIEF));
    } else {
      comment.add(DEFAULT_BRIEF);
    }
    comment.add("");
    comment.add("<pre>");
    for (String line : plantUml.body(machine).split("\n")) {
      if (!line.isEmpty()) {
        comment.add(html(line));
      }
    }
    comment.add("</pre>");
    out.javadoc(comment.toArray(new String[0]));
  }

  private static void statesEnum(final SourceWriter out, final StateMachine machine) {
    out.javadoc("States of the state machine.");
    out.open("public static enum States");
    for (State state : machine.getStates()) {
      if (!state.getComment().isEmpty()) {
        out.line("/** " + SourceWriter.escapeComment(state.getComment()) + " */");
      }
      out.line(HookNames.stateEnum(state.getId()) + "(\"" + SourceWriter.escapeString(state.getId())
          + "\"),");
    }
    out.line("IGNORING_EVENT(\"IGNORING_EVENT\"),");
    out.line("CANNOT_HAPPEN(\"CANNOT_HAPPEN\"),");
    out.line("MAX_STATES(\"MAX_STATES\");");
    out.blank();
    out.line("private final String rawName;");
    out.blank();
    out.open("States(final String rawName)");
    out.line("this.rawName = rawName;");
    out.close();
    out.blank();
    out.line("@Override");
    out.open("public String toString()");
    out.line("return rawName;");
    out.close();
    out.close();
    out.blank();
  }

  private void nestedMachineFields(final SourceWriter out, final StateMachine machine) {
    for (StateMachine child : machine.getChildren()) {
      out.line("// Nested state machine " + child.getName());
      if (flavor == Flavor.HEADER) {
        out.line("protected final " + child.getClassName() + " "
            + HookNames.nestedField(child.getName()) + ";");
      } else {
        out.line("protected final " + child.getClassName() + " "
            + HookNames.nestedField(child.getName()) + " = new " + child.getClassName() + "();");
      }
    }
    if (!machine.getChildren().isEmpty()) {
      out.blank();
    }
  }

  private static void eventDataFields(final SourceWriter out, final StateMachine machine) {
    final Set<String> declared = new LinkedHashSet<>();
    for (Event event : externalEvents(machine).keySet()) {
      for (Event.Parameter parameter : event.getParameters()) {
        if (declared.add(parameter.getName())) {
          out.line("// Data for event " + event.getName());
          out.line("protected " + parameter.getType() + " " + parameter.getName() + ";");
        }
      }
    }
    if (!declared.isEmpty()) {
      out.blank();
    }
  }

  private static void transitionTables(final SourceWriter out,
      final List<TransitionTable> tables) {
    for (TransitionTable table : tables) {
      out.line("// State transitions and actions reacting to event " + table.getEvent().getName());
      out.line("private final Transitions<States> " + tableField(table.getEvent())
          + " = Transitions.<States>newTable()");
      out.indent().indent();
      final List<TransitionTable.Entry> entries = table.getEntries();
      for (int i = 0; i < entries.size(); i++) {
        final TransitionTable.Entry entry = entries.get(i);
        out.line(".add(States." + HookNames.stateEnum(entry.getOrigin()) + ", States."
            + HookNames.stateEnum(entry.getDestination()) + ", "
            + (entry.hasGuard() ? "this::" + entry.getGuardHook() : "null") + ", "
            + (entry.hasAction() ? "this::" + entry.getActionHook() : "null") + ")"
            + (i == entries.size() - 1 ? ";" : ""));
      }
      if (entries.isEmpty()) {
        out.line(";");
      }
      out.outdent().outdent();
      out.blank();
    }
  }

  private void constructor(final SourceWriter out, final StateMachine machine) {
    out.javadoc("Default constructor. Start from the initial state and register the hooks of"
        + " the states.");
    out.open("public " + machine.getClassName() + "("
        + machine.getInjections().parameters() + ")");
    out.line("super(States.class, States." + initialEnum(machine) + ");");
    for (String line : machine.getInjections().get(Point.CONS)) {
      out.line(line);
    }
    if (flavor == Flavor.HEADER) {
      for (StateMachine child : machine.getChildren()) {
        out.line(HookNames.nestedField(child.getName()) + " = new" + child.getClassName() + "();");
      }
    }
    for (State state : machine.getStates()) {
      if (state.isInitial()) {
        continue;
      }
      final StringBuilder hooks = new StringBuilder();
      if (!state.getEntering().isEmpty()) {
        hooks.append(".entering(this::").append(HookNames.entering(state.getId())).append(')');
      }
      if (!state.getLeaving().isEmpty()) {
        hooks.append(".leaving(this::").append(HookNames.leaving(state.getId())).append(')');
      }
      if (!state.getActivity().isEmpty()) {
        hooks.append(".activity(this::").append(HookNames.activity(state.getId())).append(')');
      }
      if (state.hasInternal()) {
        hooks.append(".internal(this::").append(HookNames.internal(state.getId())).append(')');
      }
      if (hooks.length() > 0) {
        out.line("hooks(States." + HookNames.stateEnum(state.getId()) + ")" + hooks + ";");
      }
    }
    if (machine.getInjections().has(Point.INIT)) {
      out.line("// Init user code");
      for (String line : machine.getInjections().get(Point.INIT)) {
        out.line(line);
      }
    }
    out.close();
    out.blank();
    if (flavor == Flavor.HEADER) {
      for (StateMachine child : machine.getChildren()) {
        out.javadoc("Create the nested state machine " + child.getName() + ".");
        out.line("protected abstract " + child.getClassName() + " new" + child.getClassName()
            + "();");
        out.blank();
      }
    }
  }

  private static void enterMethod(final SourceWriter out, final StateMachine machine) {
    out.javadoc("Reset the state machine and nested machines. Do the initial internal"
        + " transition.");
    out.line("@Override");
    out.open("public void enter() throws StatechartException");
    out.line("super.enter();");
    for (StateMachine child : machine.getChildren()) {
      out.line(HookNames.nestedField(child.getName()) + ".enter();");
    }
    if (machine.getInjections().has(Point.INIT)) {
      out.line("// Init user code");
      for (String line : machine.getInjections().get(Point.INIT)) {
        out.line(line);
      }
    }
    if (machine.hasInitialState()) {
      final State initial = machine.getState(machine.getInitialState());
      if (initial.hasInternal()) {
        out.line("// Internal transition");
        out.lines(initial.getInternal());
      }
    }
    out.close();
    out.blank();
  }

  private static void exitMethod(final SourceWriter out, final StateMachine machine) {
    out.javadoc("Forget pending transitions of the state machine and nested machines.");
    out.line("@Override");
    out.open("public void exit()");
    out.line("super.exit();");
    for (StateMachine child : machine.getChildren()) {
      out.line(HookNames.nestedField(child.getName()) + ".exit();");
    }
    out.close();
    out.blank();
  }

  /**
   * Reacting events first, in declaration order, then events only forwarded to nested machines.
   */
  private static Map<Event, List<String>> externalEvents(final StateMachine machine) {
    final Map<Event, List<String>> events = new LinkedHashMap<>();
    for (Event event : machine.getEvents()) {
      events.put(event, new ArrayList<>());
    }
    for (Broadcast broadcast : machine.getBroadcasts()) {
      final Event event = machine.withParameters(broadcast.getEvent());
      List<String> targets = events.get(event);
      if (targets == null) {
        targets = new ArrayList<>();
        events.put(event, targets);
      }
      targets.add(broadcast.getMachineName());
    }
    return events;
  }

  private static void eventMethods(final SourceWriter out, final StateMachine machine,
      final List<TransitionTable> tables) {
    final Set<Event> reacting = new LinkedHashSet<>();
    for (TransitionTable table : tables) {
      reacting.add(table.getEvent());
    }
    final String tag = machine.getClassName().toUpperCase(Locale.ROOT);
    for (Map.Entry<Event, List<String>> entry : externalEvents(machine).entrySet()) {
      final Event event = entry.getKey();
      out.javadoc(reacting.contains(event) ? "External event." : "Broadcast external event.");
      out.open("public void " + event.getName() + "(" + formalParameters(event)
          + ") throws StatechartException");
      out.line("logger.debug(\"[" + tag + "][EVENT " + event.getName() + "]\");");
      for (Event.Parameter parameter : event.getParameters()) {
        out.line("this." + parameter.getName() + " = " + parameter.getName() + ";");
      }
      if (reacting.contains(event)) {
        out.line("transition(" + tableField(event) + ");");
      }
      for (String target : entry.getValue()) {
        out.line(HookNames.nestedField(target) + "." + event.caller("") + ";");
      }
      out.close();
      out.blank();
    }
  }

  private void transitionHooks(final SourceWriter out, final StateMachine machine) {
    final String tag = machine.getClassName().toUpperCase(Locale.ROOT);
    for (Transition transition : machine.getTransitions()) {
      final String origin = transition.getOrigin();
      final String destination = transition.getDestination();
      if (transition.hasGuard()) {
        final String guard = transition.getGuard().flatten();
        out.javadoc("Guard the transition from state " + origin + " to state " + destination
            + ".", "Diagram guard: " + guard);
        if (flavor == Flavor.HEADER) {
          out.line("protected abstract boolean " + HookNames.guard(origin, destination) + "();");
        } else {
          out.open("protected boolean " + HookNames.guard(origin, destination) + "()");
          out.line("final boolean guard = (" + guard + ");");
          out.line("logger.debug(\"[" + tag + "][GUARD " + origin + " --> " + destination + ": "
              + SourceWriter.escapeString(guard) + "] result: \" + guard);");
          out.line("return guard;");
          out.close();
        }
        out.blank();
      }
      if (transition.hasAction()) {
        final Snippet action = transition.getAction();
        if (flavor == Flavor.HEADER) {
          out.javadoc("Do the action when transitioning from state " + origin + " to state "
              + destination + ".", "Diagram action: " + action.flatten());
          out.line("protected abstract void " + HookNames.action(origin, destination) + "();");
        } else {
          out.javadoc("Do the action when transitioning from state " + origin + " to state "
              + destination + ".");
          out.open("protected void " + HookNames.action(origin, destination) + "()");
          final String trace = action.getCode().startsWith("//") ? ""
              : ": " + SourceWriter.escapeString(action.flatten());
          out.line("logger.debug(\"[" + tag + "][TRANSITION " + origin + " --> " + destination
              + trace + "]\");");
          statements(out, action);
          out.close();
        }
        out.blank();
      }
    }
  }

  private void stateHooks(final SourceWriter out, final StateMachine machine) {
    final String tag = machine.getClassName().toUpperCase(Locale.ROOT);
    for (State state : machine.getStates()) {
      final String id = state.getId();
      if (!state.getEntering().isEmpty()) {
        hook(out, "Do the action when entering the state " + id + ".",
            HookNames.entering(id), "[" + tag + "][ENTERING STATE " + id + "]",
            state.getEntering(), flavor == Flavor.HEADER);
      }
      if (!state.getLeaving().isEmpty()) {
        hook(out, "Do the action when leaving the state " + id + ".",
            HookNames.leaving(id), "[" + tag + "][LEAVING STATE " + id + "]",
            state.getLeaving(), flavor == Flavor.HEADER);
      }
      if (!state.getActivity().isEmpty()) {
        hook(out, "Do the activity of the state " + id + ".",
            HookNames.activity(id), "[" + tag + "][ACTIVITY STATE " + id + "]",
            state.getActivity(), false);
      }
      // the initial internal transition is inlined in enter()
      if (state.hasInternal() && !state.isInitial()) {
        out.javadoc("Do the internal transition when entering the state " + id + ".");
        out.open("private void " + HookNames.internal(id) + "() throws StatechartException");
        out.line("logger.debug(\"[" + tag + "][INTERNAL TRANSITION FROM STATE " + id + "]\");");
        out.lines(state.getInternal());
        out.close();
        out.blank();
      }
    }
  }

  private static void hook(final SourceWriter out, final String comment, final String name,
      final String trace, final Snippet code, final boolean abstractHook) {
    if (abstractHook) {
      out.javadoc(comment, "Diagram code: " + code.flatten());
      out.line("protected abstract void " + name + "();");
    } else {
      out.javadoc(comment);
      out.open("protected void " + name + "()");
      out.line("logger.debug(\"" + trace + "\");");
      statements(out, code);
      out.close();
    }
    out.blank();
  }

  /**
   * User code, one statement per line. A missing semicolon is added.
   */
  private static void statements(final SourceWriter out, final Snippet code) {
    for (String line : code.getCode().split("\n")) {
      final String statement = line.trim();
      if (statement.isEmpty()) {
        continue;
      }
      if (statement.startsWith("//") || statement.endsWith(";") || statement.endsWith("}")
          || statement.endsWith("{")) {
        out.line(statement);
      } else {
        out.line(statement + ";");
      }
    }
  }

  private static String formalParameters(final Event event) {
    final StringBuilder parameters = new StringBuilder();
    for (Event.Parameter parameter : event.getParameters()) {
      if (parameters.length() > 0) {
        parameters.append(", ");
      }
      parameters.append("final ").append(parameter.getType()).append(' ')
          .append(parameter.getName());
    }
    return parameters.toString();
  }

  static String tableField(final Event event) {
    return event.getName() + "Transitions";
  }

  static String initialEnum(final StateMachine machine) {
    if (machine.hasInitialState()) {
      return HookNames.stateEnum(machine.getInitialState());
    }
    final List<String> states = machine.getStateIds();
    return states.isEmpty() ? "IGNORING_EVENT" : HookNames.stateEnum(states.get(0));
  }

  private static String html(final String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }
}
