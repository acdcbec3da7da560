package com.github.statecharts.analysis;

import java.util.Collections;
import java.util.List;

/**
 * All the scenarios synthesized for one state machine.
 */
public final class TestPlan {
  private final String machineName;
  private final List<Scenario> cycles;
  private final List<Scenario> paths;
  private final List<String> selfLoops;
  private final boolean truncated;

  TestPlan(final String machineName, final List<Scenario> cycles, final List<Scenario> paths,
      final List<String> selfLoops, final boolean truncated) {
    this.machineName = machineName;
    this.cycles = Collections.unmodifiableList(cycles);
    this.paths = Collections.unmodifiableList(paths);
    this.selfLoops = Collections.unmodifiableList(selfLoops);
    this.truncated = truncated;
  }

  public String getMachineName() {
    return machineName;
  }

  public List<Scenario> getCycles() {
    return cycles;
  }

  public List<Scenario> getPaths() {
    return paths;
  }

  /**
   * States looping on themselves. Such cycles are not turned into scenarios.
   */
  public List<String> getSelfLoops() {
    return selfLoops;
  }

  public boolean isTruncated() {
    return truncated;
  }

  public int size() {
    return cycles.size() + paths.size();
  }
}
