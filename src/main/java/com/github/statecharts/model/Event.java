package com.github.statecharts.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.github.statecharts.StatechartException;
import com.github.statecharts.StatechartException.Code;

/**
 * An external event triggering transitions. Its name is a method-style identifier and it may carry
 * parameters. Identity is the name only: an event declared with parameters in one place can be
 * referenced bare elsewhere.
 *
 * Examples of diagram events and their normalized form:<br>
 * {@code get quarter} gives {@code getQuarter()}<br>
 * {@code setSpeed(x)} gives {@code setSpeed(x)}<br>
 * {@code foo bar(int x, y)} gives {@code fooBar(x, y)} where x is typed int and y Object<br>
 */
public final class Event {
  public static final Event NONE = new Event("", Collections.emptyList());

  private final String name;
  private final List<Parameter> parameters;

  public Event(final String name, final List<Parameter> parameters) {
    this.name = name;
    this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
  }

  /**
   * Build an event from the tokens of a diagram event: words, optionally followed by a single
   * parenthesized parameter list which must be the last token.
   */
  public static Event parse(final List<String> tokens) throws StatechartException {
    if (tokens == null || tokens.isEmpty()) {
      return NONE;
    }
    final StringBuilder name = new StringBuilder();
    final List<Parameter> parameters = new ArrayList<>();
    final int count = tokens.size();
    for (int i = 0; i < count; i++) {
      final String token = tokens.get(i).trim();
      if (token.startsWith("(")) {
        if (i != count - 1 || !token.endsWith(")")) {
          throw new StatechartException(Code.MALFORMED_EVENT,
              "Mismatched parenthesis in event " + String.join(" ", tokens));
        }
        for (String parameter : token.substring(1, token.length() - 1).split(",")) {
          if (!parameter.trim().isEmpty()) {
            parameters.add(Parameter.parse(parameter));
          }
        }
      } else if (i == 0) {
        // a single word directly followed by its parameters keeps its case
        if (count > 1 && tokens.get(1).trim().startsWith("(")) {
          name.append(token);
        } else {
          name.append(token.toLowerCase(Locale.ROOT));
        }
      } else {
        name.append(capitalize(token));
      }
    }
    return new Event(name.toString(), parameters);
  }

  private static String capitalize(final String word) {
    if (word.isEmpty()) {
      return word;
    }
    return word.substring(0, 1).toUpperCase(Locale.ROOT)
        + word.substring(1).toLowerCase(Locale.ROOT);
  }

  public String getName() {
    return name;
  }

  public List<Parameter> getParameters() {
    return parameters;
  }

  public boolean isNamed() {
    return !name.isEmpty();
  }

  /**
   * Method-call rendition, eg. {@code fooBar(fsm.x, fsm.y)} for a receiver named fsm.
   */
  public String caller(final String receiver) {
    final StringBuilder call = new StringBuilder(name).append('(');
    for (int i = 0; i < parameters.size(); i++) {
      if (i > 0) {
        call.append(", ");
      }
      if (receiver != null && !receiver.isEmpty()) {
        call.append(receiver).append('.');
      }
      call.append(parameters.get(i).getName());
    }
    return call.append(')').toString();
  }

  /**
   * Diagram rendition, eg. {@code setSpeed(int speed)} or {@code halt}.
   */
  public String declaration() {
    if (parameters.isEmpty()) {
      return name;
    }
    final StringBuilder declaration = new StringBuilder(name).append('(');
    for (int i = 0; i < parameters.size(); i++) {
      if (i > 0) {
        declaration.append(", ");
      }
      declaration.append(parameters.get(i));
    }
    return declaration.append(')').toString();
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return name.equals(((Event) obj).name);
  }

  @Override
  public String toString() {
    return declaration();
  }

  /**
   * Event parameter: a name and an optional Java type.
   */
  public static final class Parameter {
    private final String type;
    private final String name;

    public Parameter(final String type, final String name) {
      this.type = type;
      this.name = name;
    }

    static Parameter parse(final String declaration) {
      final String trimmed = declaration.trim();
      final int space = trimmed.lastIndexOf(' ');
      if (space < 0) {
        return new Parameter("", trimmed);
      }
      return new Parameter(trimmed.substring(0, space).trim(), trimmed.substring(space + 1));
    }

    public String getType() {
      return type.isEmpty() ? "Object" : type;
    }

    public boolean isTyped() {
      return !type.isEmpty();
    }

    public String getName() {
      return name;
    }

    @Override
    public String toString() {
      return type.isEmpty() ? name : type + ' ' + name;
    }
  }
}
