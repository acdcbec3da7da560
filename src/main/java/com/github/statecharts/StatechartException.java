package com.github.statecharts;

/**
 * Unified single exception that's thrown by the translator and by the runtime of generated state
 * machines. Only fatal conditions are reported this way: anything recoverable ends up as a warning
 * attached to the machine being translated. The code enum encapsulates the various error
 * conditions.
 */
public final class StatechartException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StatechartException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StatechartException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StatechartException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INPUT_NOT_FOUND("Statechart diagram file does not exist"),
    // 2.
    IO_FAILURE("Failed to read or write a file. Check exception stacktrace for more details."),
    // 3.
    SYNTAX_ERROR("Statechart diagram cannot be parsed"),
    // 4.
    UNKNOWN_NODE_KIND("Syntax tree node kind is not managed"),
    // 5.
    UNKNOWN_INJECTION("Code injection tag is not managed"),
    // 6.
    MALFORMED_EVENT("Event parameters must come last, within a single pair of parenthesis"),
    // 7.
    DANGLING_TRANSITION("Transition endpoints must be added as states first"),
    // 8.
    ALREADY_ELABORATED("State machine internal transitions have already been elaborated"),
    // 9.
    NOT_ELABORATED("State machine must be elaborated before generating code"),
    // 10.
    INVALID_CONFIG("Translator configuration is invalid"),
    // 11.
    FORBIDDEN_EVENT("State machine reached a transition that cannot happen"),
    // 12.
    UNKNOWN_STATE("State machine reached an unknown state");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
