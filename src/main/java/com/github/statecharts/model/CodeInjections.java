package com.github.statecharts.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Extra lines of user code, declared in the diagram as {@code '[tag] code} comments, to be merged
 * at fixed locations of the generated class.
 */
public final class CodeInjections {

  /**
   * Where a line of injected code lands in the generated sources.
   */
  public static enum Point {
    // main comment of the class
    BRIEF,
    // before the class: package, imports
    HEADER,
    // after the class: extra top level types
    FOOTER,
    // constructor parameters
    PARAM,
    // first statements of the constructor
    CONS,
    // statements run by the constructor and on each enter()
    INIT,
    // extra members of the class
    CODE,
    // extra members of the mocked class in the generated tests
    TEST;

    /**
     * Resolve a diagram tag such as {@code [brief]}, null if the tag is unknown.
     */
    public static Point fromTag(final String tag) {
      String name = tag.trim();
      if (name.startsWith("[") && name.endsWith("]")) {
        name = name.substring(1, name.length() - 1);
      }
      for (Point point : values()) {
        if (point.name().toLowerCase(Locale.ROOT).equals(name)) {
          return point;
        }
      }
      return null;
    }

    public String tag() {
      return '[' + name().toLowerCase(Locale.ROOT) + ']';
    }
  }

  private final Map<Point, List<String>> lines = new EnumMap<>(Point.class);

  public void add(final Point point, final String code) {
    lines.computeIfAbsent(point, p -> new ArrayList<>()).add(code == null ? "" : code.trim());
  }

  public List<String> get(final Point point) {
    final List<String> code = lines.get(point);
    return code == null ? Collections.emptyList() : Collections.unmodifiableList(code);
  }

  public boolean has(final Point point) {
    return !get(point).isEmpty();
  }

  /**
   * Comma separated constructor parameters.
   */
  public String parameters() {
    return String.join(", ", get(Point.PARAM));
  }
}
