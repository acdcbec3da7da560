package com.github.statecharts.analysis;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.statecharts.model.StateMachine;

/**
 * Depth first enumeration of the simple cycles and of the simple source to sink paths of a state
 * machine graph.
 *
 * Both enumerations are exponential in the worst case. They are bounded by a maximum number of
 * results and a maximum number of states per result; {@link #isTruncated()} tells whether a bound
 * was hit during the last enumeration.
 */
public final class GraphSearch {
  private final int maxResults;
  private final int maxPathLength;
  private boolean truncated;

  public GraphSearch(final int maxResults, final int maxPathLength) {
    this.maxResults = maxResults;
    this.maxPathLength = maxPathLength;
  }

  public boolean isTruncated() {
    return truncated;
  }

  /**
   * Every elementary cycle, as the list of its states without repeating the first one. A cycle
   * starts from its state declared first; a self-loop is a cycle of one state.
   */
  public List<List<String>> cycles(final StateMachine machine) {
    truncated = false;
    final List<List<String>> cycles = new ArrayList<>();
    final List<String> nodes = machine.getStateIds();
    final Map<String, Integer> rank = new HashMap<>();
    for (int i = 0; i < nodes.size(); i++) {
      rank.put(nodes.get(i), i);
    }
    for (String start : nodes) {
      final Set<String> path = new LinkedHashSet<>();
      path.add(start);
      if (!searchCycles(machine, rank, start, start, path, cycles)) {
        break;
      }
    }
    return cycles;
  }

  // false once the result budget is spent
  private boolean searchCycles(final StateMachine machine, final Map<String, Integer> rank,
      final String start, final String current, final Set<String> path,
      final List<List<String>> cycles) {
    for (String next : machine.getSuccessors(current)) {
      if (rank.get(next) < rank.get(start)) {
        continue;
      }
      if (next.equals(start)) {
        if (cycles.size() >= maxResults) {
          truncated = true;
          return false;
        }
        cycles.add(new ArrayList<>(path));
      } else if (!path.contains(next)) {
        if (path.size() >= maxPathLength) {
          truncated = true;
          continue;
        }
        path.add(next);
        final boolean more = searchCycles(machine, rank, start, next, path, cycles);
        path.remove(next);
        if (!more) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Every simple path from a state without predecessor to a state without successor.
   */
  public List<List<String>> pathsToSinks(final StateMachine machine) {
    truncated = false;
    final List<String> sources = new ArrayList<>();
    final List<String> sinks = new ArrayList<>();
    for (String state : machine.getStateIds()) {
      if (machine.inDegree(state) == 0) {
        sources.add(state);
      }
      if (machine.outDegree(state) == 0) {
        sinks.add(state);
      }
    }
    final List<List<String>> paths = new ArrayList<>();
    for (String sink : sinks) {
      for (String source : sources) {
        if (source.equals(sink)) {
          continue;
        }
        final Set<String> path = new LinkedHashSet<>();
        path.add(source);
        if (!searchPaths(machine, sink, source, path, paths)) {
          return paths;
        }
      }
    }
    return paths;
  }

  private boolean searchPaths(final StateMachine machine, final String target,
      final String current, final Set<String> path, final List<List<String>> paths) {
    for (String next : machine.getSuccessors(current)) {
      if (path.contains(next)) {
        continue;
      }
      if (path.size() >= maxPathLength) {
        truncated = true;
        return true;
      }
      path.add(next);
      if (next.equals(target)) {
        if (paths.size() >= maxResults) {
          truncated = true;
          return false;
        }
        paths.add(new ArrayList<>(path));
      } else if (!searchPaths(machine, target, next, path, paths)) {
        return false;
      }
      path.remove(next);
    }
    return true;
  }
}
