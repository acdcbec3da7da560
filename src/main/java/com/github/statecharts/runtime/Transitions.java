package com.github.statecharts.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Table of the transitions reacting to one external event, in declaration order. Several entries
 * may share the same origin, their guards are then tried in that order.
 */
public final class Transitions<S extends Enum<S>> {
  private final List<Entry<S>> entries = new ArrayList<>();

  private Transitions() {}

  public static <S extends Enum<S>> Transitions<S> newTable() {
    return new Transitions<S>();
  }

  /**
   * @param guard null when the transition is unconditional
   * @param action null when the transition has no action
   */
  public Transitions<S> add(final S origin, final S destination, final BooleanSupplier guard,
      final Reaction action) {
    entries.add(new Entry<S>(origin, destination, guard, action));
    return this;
  }

  public List<Entry<S>> from(final S origin) {
    final List<Entry<S>> candidates = new ArrayList<>();
    for (Entry<S> entry : entries) {
      if (entry.origin == origin) {
        candidates.add(entry);
      }
    }
    return candidates;
  }

  public List<Entry<S>> entries() {
    return Collections.unmodifiableList(entries);
  }

  /**
   * One row of the table.
   */
  public static final class Entry<S extends Enum<S>> {
    private final S origin;
    private final S destination;
    private final BooleanSupplier guard;
    private final Reaction action;

    private Entry(final S origin, final S destination, final BooleanSupplier guard,
        final Reaction action) {
      this.origin = origin;
      this.destination = destination;
      this.guard = guard;
      this.action = action;
    }

    public S getOrigin() {
      return origin;
    }

    public S getDestination() {
      return destination;
    }

    public boolean accepts() {
      return guard == null || guard.getAsBoolean();
    }

    public Reaction getAction() {
      return action;
    }
  }
}
