package com.github.statecharts.model;

/**
 * An edge of the state machine graph:
 * {@code origin -> destination : event [ guard ] / action}.
 *
 * The event, guard and action are optional. The hit counters are scratch values only meaningful
 * while a test scenario is being synthesized.
 */
public final class Transition {
  private final String origin;
  private final String destination;
  private final Event event;
  private final Snippet guard;
  private Snippet action;
  // kept to write the diagram back the way it was drawn
  private final String arrow;
  // true when declared as "state : on event [ guard ] / action"
  private final boolean stateReaction;
  private boolean placeholderAction;

  int guardHits;
  int actionHits;

  public Transition(final String origin, final String destination, final Event event,
      final Snippet guard, final Snippet action, final String arrow, final boolean stateReaction) {
    this.origin = origin;
    this.destination = destination;
    this.event = event == null ? Event.NONE : event;
    this.guard = guard == null ? Snippet.EMPTY : guard;
    this.action = action == null ? Snippet.EMPTY : action;
    this.arrow = arrow;
    this.stateReaction = stateReaction;
  }

  public String getOrigin() {
    return origin;
  }

  public String getDestination() {
    return destination;
  }

  public Event getEvent() {
    return event;
  }

  public Snippet getGuard() {
    return guard;
  }

  public Snippet getAction() {
    return action;
  }

  public String getArrow() {
    return arrow;
  }

  public boolean isStateReaction() {
    return stateReaction;
  }

  public boolean isSelfLoop() {
    return origin.equals(destination);
  }

  public boolean hasEvent() {
    return event.isNamed();
  }

  public boolean hasGuard() {
    return !guard.isEmpty();
  }

  public boolean hasAction() {
    return !action.isEmpty();
  }

  /**
   * Replace an empty action by generated code documenting the missing reaction.
   */
  public void usePlaceholderAction(final Snippet placeholder) {
    this.action = placeholder;
    this.placeholderAction = true;
  }

  public boolean hasPlaceholderAction() {
    return placeholderAction;
  }

  public int getGuardHits() {
    return guardHits;
  }

  public int getActionHits() {
    return actionHits;
  }

  public void resetHits() {
    guardHits = 0;
    actionHits = 0;
  }

  public void hit() {
    if (hasGuard()) {
      guardHits++;
    }
    if (hasAction()) {
      actionHits++;
    }
  }

  @Override
  public String toString() {
    return "Transition [origin=" + origin + ", destination=" + destination + ", event="
        + event.getName() + ", guard=" + guard + ", action=" + action + "]";
  }
}
