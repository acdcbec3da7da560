package com.github.statecharts.model;

import java.util.Objects;

/**
 * Binding telling a machine to forward an external event down to one of its nested machines.
 */
public final class Broadcast {
  private final String machineName;
  private final Event event;

  public Broadcast(final String machineName, final Event event) {
    this.machineName = machineName;
    this.event = event;
  }

  public String getMachineName() {
    return machineName;
  }

  public Event getEvent() {
    return event;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Broadcast)) {
      return false;
    }
    Broadcast other = (Broadcast) o;
    return machineName.equals(other.machineName) && event.equals(other.event);
  }

  @Override
  public int hashCode() {
    return Objects.hash(machineName, event);
  }

  @Override
  public String toString() {
    return "Broadcast [machine=" + machineName + ", event=" + event.getName() + "]";
  }
}
