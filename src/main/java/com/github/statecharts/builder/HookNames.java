package com.github.statecharts.builder;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import com.github.statecharts.model.State;

/**
 * Naming conventions shared by the elaborator, the synthesizers and the emitters: state enum
 * constants, hook methods and nested machine fields of the generated classes.
 */
public final class HookNames {
  /**
   * Methods of the runtime base class and of {@link Object} that generated hooks must not shadow.
   */
  public static final Set<String> RESERVED_METHODS =
      Collections.unmodifiableSet(new HashSet<>(Arrays.asList("enter", "exit", "reset", "state",
          "stateName", "transition", "isNesting", "hooks", "toString", "equals", "hashCode",
          "getClass", "notify", "notifyAll", "wait", "clone", "finalize")));

  public static final String INITIAL_ENUM = "CONSTRUCTOR";
  public static final String FINAL_ENUM = "DESTRUCTOR";

  public static String stateEnum(final String state) {
    if (State.INITIAL.equals(state)) {
      return INITIAL_ENUM;
    }
    if (State.FINAL.equals(state)) {
      return FINAL_ENUM;
    }
    return state.replace('.', '_');
  }

  public static String guard(final String origin, final String destination) {
    return "onGuarding_" + stateEnum(origin) + '_' + stateEnum(destination);
  }

  public static String action(final String origin, final String destination) {
    return "onTransitioning_" + stateEnum(origin) + '_' + stateEnum(destination);
  }

  public static String entering(final String state) {
    return "onEntering_" + stateEnum(state);
  }

  public static String leaving(final String state) {
    return "onLeaving_" + stateEnum(state);
  }

  public static String internal(final String state) {
    return "onInternal_" + stateEnum(state);
  }

  public static String activity(final String state) {
    return "onActivity_" + stateEnum(state);
  }

  public static String nestedField(final String machineName) {
    if (machineName.isEmpty()) {
      return "nested";
    }
    return "nested" + machineName.substring(0, 1).toUpperCase(Locale.ROOT)
        + machineName.substring(1);
  }

  /**
   * Method name part of a declaration, eg. {@code foo} for {@code foo(x, y)}.
   */
  public static String methodName(final String code) {
    final int parenthesis = code.indexOf('(');
    return (parenthesis < 0 ? code : code.substring(0, parenthesis)).trim();
  }

  public static boolean isReserved(final String code) {
    return RESERVED_METHODS.contains(methodName(code));
  }

  private HookNames() {}
}
