package com.github.statecharts.builder;

import java.util.List;
import java.util.Locale;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StatechartException;
import com.github.statecharts.StatechartException.Code;
import com.github.statecharts.model.Arc;
import com.github.statecharts.model.Broadcast;
import com.github.statecharts.model.CodeInjections;
import com.github.statecharts.model.Event;
import com.github.statecharts.model.Snippet;
import com.github.statecharts.model.State;
import com.github.statecharts.model.StateMachine;
import com.github.statecharts.model.Transition;
import com.github.statecharts.syntax.NodeKind;
import com.github.statecharts.syntax.SyntaxNode;

/**
 * Walks the syntax tree of a diagram, depth first, and populates one {@link StateMachine} per
 * nesting level. Nested machines are fully populated before the walk returns to the outer scope.
 */
public final class ModelBuilder {
  private static final Logger logger = LogManager.getLogger(ModelBuilder.class.getSimpleName());

  private static final String STD_ACTION_SEPARATOR = "\\n--\\n";

  private final String classNameSuffix;

  public ModelBuilder(final String classNameSuffix) {
    this.classNameSuffix = classNameSuffix == null ? "" : classNameSuffix;
  }

  /**
   * Build the root machine, named after the diagram, and all of its nested machines.
   */
  public MachineRegistry build(final SyntaxNode diagram, final String rootName)
      throws StatechartException {
    final MachineRegistry registry = new MachineRegistry();
    final StateMachine root = new StateMachine(rootName, rootName + classNameSuffix, null);
    registry.register(root);
    final BuildContext context = new BuildContext(registry);
    context.push(root);
    try {
      for (SyntaxNode node : diagram.getChildren()) {
        visit(context, node);
      }
    } finally {
      context.pop();
    }
    logger.info("Built " + registry.size() + " state machines from diagram " + rootName);
    return registry;
  }

  /**
   * Dispatch one syntax tree node by kind.
   */
  void visit(final BuildContext context, final SyntaxNode node) throws StatechartException {
    final NodeKind kind = NodeKind.fromTag(node.getKind());
    switch (kind) {
      case DIAGRAM:
        for (SyntaxNode child : node.getChildren()) {
          visit(context, child);
        }
        break;
      case CODE_INJECTION:
        parseInjection(context.current(), node.getAttribute(0), node.getAttribute(1));
        break;
      case TRANSITION:
        parseTransition(context, node.getAttribute(0), node.getAttribute(1),
            node.getAttribute(2), node.getChildren(), false);
        break;
      case STATE_BLOCK:
        parseNestedMachine(context, node);
        break;
      case STATE_ENTRY:
      case STATE_EXIT:
      case STATE_ACTIVITY:
      case STATE_COMMENT:
      case STATE_ON:
        parseState(context, kind, node);
        break;
      case COMMENT:
      case SKIN:
      case HIDE:
        break;
      default:
        throw new StatechartException(Code.UNKNOWN_NODE_KIND, "Token " + node.getKind()
            + " not expected at this place in the state machine " + context.current().getName());
    }
  }

  private void parseInjection(final StateMachine machine, final String tag, final String code)
      throws StatechartException {
    final CodeInjections.Point point = CodeInjections.Point.fromTag(tag);
    if (point == null) {
      throw new StatechartException(Code.UNKNOWN_INJECTION,
          "Token " + tag + " not yet managed in the state machine " + machine.getName());
    }
    machine.getInjections().add(point, code);
  }

  /**
   * Composite state: the current machine is saved, a child machine is created, linked and
   * populated from the block content, then the outer machine is restored.
   */
  private void parseNestedMachine(final BuildContext context, final SyntaxNode node)
      throws StatechartException {
    final StateMachine outer = context.current();
    final String name = node.getAttribute(0);
    final StateMachine nested = new StateMachine(name, "Nested" + name + classNameSuffix,
        outer.getName());
    outer.addChild(nested);
    context.getRegistry().register(nested);
    context.push(nested);
    if (logger.isDebugEnabled()) {
      logger.debug("Entering nested state machine " + name + " of " + outer.getName()
          + " at depth " + context.depth());
    }
    try {
      for (SyntaxNode child : node.getChildren()) {
        visit(context, child);
      }
    } finally {
      context.pop();
    }
  }

  /**
   * {@code origin -> destination : event [ guard ] / action} or
   * {@code destination <- origin : event [ guard ] / action}. A state reaction
   * ({@code state : on event [ guard ] / action}) arrives here as a self-loop.
   */
  private void parseTransition(final BuildContext context, final String left, final String arrow,
      final String right, final List<SyntaxNode> suffix, final boolean stateReaction)
      throws StatechartException {
    final StateMachine machine = context.current();
    String origin;
    String destination;
    if (arrow.endsWith(">")) {
      origin = left.toUpperCase(Locale.ROOT);
      destination = right.toUpperCase(Locale.ROOT);
    } else {
      origin = right.toUpperCase(Locale.ROOT);
      destination = left.toUpperCase(Locale.ROOT);
    }

    // initial and final pseudo states
    if (State.INITIAL.equals(origin)) {
      machine.setInitialState(State.INITIAL);
    } else if (State.INITIAL.equals(destination)) {
      destination = State.FINAL;
      machine.setFinalState(State.FINAL);
    }

    // nodes first so the edge never dangles
    machine.addState(origin);
    machine.addState(destination);

    Event event = Event.NONE;
    Snippet guard = Snippet.EMPTY;
    Snippet action = Snippet.EMPTY;
    for (SyntaxNode node : suffix) {
      switch (NodeKind.fromTag(node.getKind())) {
        case EVENT:
          event = Event.parse(node.getAttributes());
          checkMethodName(machine, event.getName());
          break;
        case GUARD:
          guard = Snippet.of(strip(node.getAttribute(0), "[", "]"));
          checkMethodName(machine, guard.getCode());
          break;
        case UML_ACTION:
          action = Snippet.of(strip(node.getAttribute(0), "/", ""));
          checkMethodName(machine, action.getCode());
          break;
        case STD_ACTION:
          action = Snippet.of(strip(node.getAttribute(0), STD_ACTION_SEPARATOR, ""));
          checkMethodName(machine, action.getCode());
          break;
        default:
          throw new StatechartException(Code.UNKNOWN_NODE_KIND, "Token " + node.getKind()
              + " not expected in the transition " + origin + " -> " + destination);
      }
    }

    final Transition transition = new Transition(origin, destination, event, guard, action,
        stateReaction ? "" : arrow, stateReaction);
    if (transition.isSelfLoop() && !transition.hasAction()
        && (stateReaction || !transition.hasEvent())) {
      final String reason = transition.hasEvent() ? "event " + event.getName() : "no event";
      final String message = "no reaction to " + reason + " for internal transition " + origin
          + " -> " + destination;
      transition.usePlaceholderAction(Snippet.of("// Dummy action\n// WARNING: " + message));
      machine.warning("The state " + origin + " has " + message);
    }

    final Transition previous = machine.addTransition(transition);
    if (previous != null) {
      if (previous.hasEvent()) {
        machine.unregisterArc(previous.getEvent(), Arc.of(origin, destination));
      }
      machine.warning("The transition " + origin + " -> " + destination
          + " is declared several times: only its last declaration is kept");
    }
    if (event.isNamed()) {
      machine.registerArc(event, Arc.of(origin, destination));
      bindBroadcasts(context.getRegistry(), machine, event);
    }
  }

  /**
   * A named event of a nested machine is forwarded by each outer machine, hop by hop from the
   * root down to the machine reacting to it.
   */
  private static void bindBroadcasts(final MachineRegistry registry, final StateMachine machine,
      final Event event) {
    StateMachine child = machine;
    StateMachine parent = registry.parentOf(child);
    while (parent != null) {
      parent.addBroadcast(new Broadcast(child.getName(), event));
      child = parent;
      parent = registry.parentOf(child);
    }
  }

  /**
   * {@code state : entry / code}, {@code exit}, {@code do}, {@code comment} or
   * {@code on event [ guard ] / action}.
   */
  private void parseState(final BuildContext context, final NodeKind kind, final SyntaxNode node)
      throws StatechartException {
    final StateMachine machine = context.current();
    final String name = node.getAttribute(0).toUpperCase(Locale.ROOT);
    // create the node first so later annotations never smash the former ones
    final State state = machine.addState(name);
    if (kind == NodeKind.STATE_ON) {
      // a graph edge rather than state text, so cycles and tables see it; entry and exit
      // hooks are not run for it since the state is not left
      parseTransition(context, name, "->", name, node.getChildren(), true);
      return;
    }
    final String code = node.getChildren().isEmpty() ? ""
        : strip(node.getChildren().get(0).getAttribute(0), "/", "");
    switch (kind) {
      case STATE_ENTRY:
        state.addEntering(Snippet.of(code));
        break;
      case STATE_EXIT:
        state.addLeaving(Snippet.of(code));
        break;
      case STATE_ACTIVITY:
        state.addActivity(Snippet.of(code));
        break;
      case STATE_COMMENT:
        state.addComment(code);
        break;
      default:
        throw new StatechartException(Code.UNKNOWN_NODE_KIND,
            "Bad syntax describing a state. Unknown token " + node.getKind());
    }
  }

  private static void checkMethodName(final StateMachine machine, final String code) {
    if (!code.isEmpty() && HookNames.isReserved(code)) {
      machine.warning("The method name " + code
          + " is already used by the base class of the generated state machine");
    }
  }

  private static String strip(final String text, final String prefix, final String suffix) {
    String stripped = text.trim();
    if (!prefix.isEmpty() && stripped.startsWith(prefix)) {
      stripped = stripped.substring(prefix.length());
    }
    if (!suffix.isEmpty() && stripped.endsWith(suffix)) {
      stripped = stripped.substring(0, stripped.length() - suffix.length());
    }
    return stripped.trim();
  }
}
