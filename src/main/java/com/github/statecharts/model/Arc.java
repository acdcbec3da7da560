package com.github.statecharts.model;

import java.util.Objects;

/**
 * An ordered (origin, destination) pair of state ids, as registered in the dispatch map of a
 * machine.
 */
public final class Arc {
  private final String origin;
  private final String destination;

  private Arc(final String origin, final String destination) {
    this.origin = origin;
    this.destination = destination;
  }

  public static Arc of(final String origin, final String destination) {
    return new Arc(origin, destination);
  }

  public String getOrigin() {
    return origin;
  }

  public String getDestination() {
    return destination;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Arc)) {
      return false;
    }
    Arc arc = (Arc) o;
    return Objects.equals(origin, arc.origin) && Objects.equals(destination, arc.destination);
  }

  @Override
  public int hashCode() {
    return Objects.hash(origin, destination);
  }

  @Override
  public String toString() {
    return origin + " -> " + destination;
  }
}
