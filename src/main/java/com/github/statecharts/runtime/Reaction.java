package com.github.statecharts.runtime;

import com.github.statecharts.StatechartException;

/**
 * A hook of a generated state machine: transition action, state entering, leaving, activity or
 * internal dispatch.
 */
@FunctionalInterface
public interface Reaction {
  void react() throws StatechartException;
}
