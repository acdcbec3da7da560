package com.github.statecharts.emit;

import java.util.Locale;

/**
 * Kind of state machine class generated.
 */
public enum Flavor {
  // concrete class, hooks run the diagram code
  SOURCE,
  // abstract skeleton, guards, actions, entering and leaving hooks are left to subclasses
  HEADER;

  /**
   * Resolve the command line spelling, null if unknown.
   */
  public static Flavor fromArgument(final String argument) {
    for (Flavor flavor : values()) {
      if (flavor.name().toLowerCase(Locale.ROOT).equals(argument)) {
        return flavor;
      }
    }
    return null;
  }
}
