package com.github.statecharts.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StatechartException;
import com.github.statecharts.StatechartException.Code;

/**
 * One level of a hierarchical state machine: a directed graph of states linked by transitions.
 *
 * Notes:<br>
 * 1. at most one transition exists for an ordered pair of states; states and their successors are
 * kept in insertion order, which is the diagram declaration order<br>
 * 2. the dispatch map groups the (origin, destination) arcs by event, in declaration order. This
 * order is the precedence used at run time when several transitions may react to one event<br>
 * 3. the parent is only known by name, it is resolved through the registry of machines. Children
 * are owned by their parent<br>
 * 4. warnings are append-only; they never stop the translation<br>
 */
public final class StateMachine {
  private static final Logger logger = LogManager.getLogger(StateMachine.class.getSimpleName());

  private final String name;
  private final String className;
  private final String parentName;

  private final Map<String, State> states = new LinkedHashMap<>();
  private final Map<String, Map<String, Transition>> successors = new LinkedHashMap<>();
  private final Map<String, Set<String>> predecessors = new LinkedHashMap<>();
  private final Map<Event, List<Arc>> dispatch = new LinkedHashMap<>();
  private final Set<Broadcast> broadcasts = new LinkedHashSet<>();
  private final List<StateMachine> children = new ArrayList<>();
  private final CodeInjections injections = new CodeInjections();
  private final List<String> warnings = new ArrayList<>();

  private String initialState = "";
  private String finalState = "";
  private boolean elaborated;

  public StateMachine(final String name, final String className, final String parentName) {
    this.name = name;
    this.className = className;
    this.parentName = parentName;
  }

  public String getName() {
    return name;
  }

  public String getClassName() {
    return className;
  }

  public Optional<String> getParentName() {
    return Optional.ofNullable(parentName);
  }

  public boolean isRoot() {
    return parentName == null;
  }

  ///// Graph nodes /////
  /**
   * Create the state if it does not exist yet, otherwise return the existing one untouched.
   */
  public State addState(final String id) {
    State state = states.get(id);
    if (state == null) {
      state = new State(id);
      states.put(id, state);
      successors.put(id, new LinkedHashMap<>());
      predecessors.put(id, new LinkedHashSet<>());
    }
    return state;
  }

  public boolean hasState(final String id) {
    return states.containsKey(id);
  }

  public State getState(final String id) {
    return states.get(id);
  }

  public Collection<State> getStates() {
    return Collections.unmodifiableCollection(states.values());
  }

  public List<String> getStateIds() {
    return new ArrayList<>(states.keySet());
  }

  ///// Graph edges /////
  /**
   * Add the transition as an edge. Both endpoints must already be states. An existing transition
   * between the same ordered pair is replaced and returned.
   */
  public Transition addTransition(final Transition transition) throws StatechartException {
    final String origin = transition.getOrigin();
    final String destination = transition.getDestination();
    if (!hasState(origin) || !hasState(destination)) {
      throw new StatechartException(Code.DANGLING_TRANSITION,
          "Cannot add transition " + origin + " -> " + destination + " to state machine " + name
              + ": missing endpoint state");
    }
    predecessors.get(destination).add(origin);
    return successors.get(origin).put(destination, transition);
  }

  public Transition getTransition(final String origin, final String destination) {
    final Map<String, Transition> out = successors.get(origin);
    return out == null ? null : out.get(destination);
  }

  public boolean hasTransition(final String origin, final String destination) {
    return getTransition(origin, destination) != null;
  }

  /**
   * All transitions, ordered by origin state then by declaration.
   */
  public List<Transition> getTransitions() {
    final List<Transition> transitions = new ArrayList<>();
    for (Map<String, Transition> out : successors.values()) {
      transitions.addAll(out.values());
    }
    return transitions;
  }

  public Collection<Transition> getOutgoing(final String id) {
    final Map<String, Transition> out = successors.get(id);
    return out == null ? Collections.<Transition>emptyList()
        : Collections.unmodifiableCollection(out.values());
  }

  public List<String> getSuccessors(final String id) {
    final Map<String, Transition> out = successors.get(id);
    return out == null ? Collections.<String>emptyList() : new ArrayList<>(out.keySet());
  }

  public List<String> getPredecessors(final String id) {
    final Set<String> in = predecessors.get(id);
    return in == null ? Collections.<String>emptyList() : new ArrayList<>(in);
  }

  public int inDegree(final String id) {
    return getPredecessors(id).size();
  }

  public int outDegree(final String id) {
    return getSuccessors(id).size();
  }

  ///// Initial and final states /////
  public String getInitialState() {
    return initialState;
  }

  public boolean hasInitialState() {
    return !initialState.isEmpty();
  }

  public void setInitialState(final String initialState) {
    this.initialState = initialState;
  }

  public String getFinalState() {
    return finalState;
  }

  public void setFinalState(final String finalState) {
    this.finalState = finalState;
  }

  ///// Events /////
  public void registerArc(final Event event, final Arc arc) {
    dispatch.computeIfAbsent(event, e -> new ArrayList<>()).add(arc);
  }

  /**
   * Forget the arc registered under the given event, dropping the event when no arc is left.
   */
  public void unregisterArc(final Event event, final Arc arc) {
    final List<Arc> arcs = dispatch.get(event);
    if (arcs != null) {
      arcs.remove(arc);
      if (arcs.isEmpty()) {
        dispatch.remove(event);
      }
    }
  }

  public Map<Event, List<Arc>> getDispatch() {
    return Collections.unmodifiableMap(dispatch);
  }

  /**
   * Named events in declaration order. Parameters are taken from the first declaration carrying
   * some.
   */
  public List<Event> getEvents() {
    final List<Event> events = new ArrayList<>();
    for (Event event : dispatch.keySet()) {
      if (event.isNamed()) {
        events.add(withParameters(event));
      }
    }
    return events;
  }

  /**
   * Resolve the declaration of an event carrying parameters, since an event may be referenced bare
   * in some transitions.
   */
  public Event withParameters(final Event event) {
    if (!event.getParameters().isEmpty()) {
      return event;
    }
    for (Transition transition : getTransitions()) {
      if (transition.getEvent().equals(event) && !transition.getEvent().getParameters().isEmpty()) {
        return transition.getEvent();
      }
    }
    for (Broadcast broadcast : broadcasts) {
      if (broadcast.getEvent().equals(event) && !broadcast.getEvent().getParameters().isEmpty()) {
        return broadcast.getEvent();
      }
    }
    return event;
  }

  public boolean addBroadcast(final Broadcast broadcast) {
    return broadcasts.add(broadcast);
  }

  public List<Broadcast> getBroadcasts() {
    return new ArrayList<>(broadcasts);
  }

  ///// Hierarchy /////
  public void addChild(final StateMachine child) {
    children.add(child);
  }

  public List<StateMachine> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public CodeInjections getInjections() {
    return injections;
  }

  ///// Diagnostics /////
  public void warning(final String message) {
    warnings.add(message);
    logger.warn("WARNING in the state machine " + name + ": " + message);
  }

  public List<String> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  ///// Elaboration /////
  public boolean isElaborated() {
    return elaborated;
  }

  public void markElaborated() {
    elaborated = true;
  }

  /**
   * Zero every scratch counter of states and transitions.
   */
  public void resetHits() {
    for (State state : states.values()) {
      state.resetHits();
    }
    for (Transition transition : getTransitions()) {
      transition.resetHits();
    }
  }

  @Override
  public String toString() {
    return "StateMachine [name=" + name + ", className=" + className + ", initialState="
        + initialState + ", states=" + states.size() + ", warnings=" + warnings.size() + "]";
  }
}
