package com.github.statecharts.analysis;

import java.util.Collections;
import java.util.List;

import com.github.statecharts.model.Event;

/**
 * The transitions reacting to one named event, in declaration order.
 */
public final class TransitionTable {
  private final Event event;
  private final List<Entry> entries;

  public TransitionTable(final Event event, final List<Entry> entries) {
    this.event = event;
    this.entries = Collections.unmodifiableList(entries);
  }

  public Event getEvent() {
    return event;
  }

  public List<Entry> getEntries() {
    return entries;
  }

  @Override
  public String toString() {
    return "TransitionTable [event=" + event.getName() + ", entries=" + entries + "]";
  }

  /**
   * One reaction to the event. Hook names are empty when the transition has no guard or no
   * action.
   */
  public static final class Entry {
    private final String origin;
    private final String destination;
    private final String guardHook;
    private final String actionHook;

    public Entry(final String origin, final String destination, final String guardHook,
        final String actionHook) {
      this.origin = origin;
      this.destination = destination;
      this.guardHook = guardHook;
      this.actionHook = actionHook;
    }

    public String getOrigin() {
      return origin;
    }

    public String getDestination() {
      return destination;
    }

    public String getGuardHook() {
      return guardHook;
    }

    public String getActionHook() {
      return actionHook;
    }

    public boolean hasGuard() {
      return !guardHook.isEmpty();
    }

    public boolean hasAction() {
      return !actionHook.isEmpty();
    }

    @Override
    public String toString() {
      return origin + " -> " + destination;
    }
  }
}
