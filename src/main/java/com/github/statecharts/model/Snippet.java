package com.github.statecharts.model;

/**
 * Opaque piece of user code (guard expression, action statement, entry/exit/activity body...)
 * carried untouched from the diagram to the generated sources. It is never parsed nor validated.
 */
public final class Snippet {
  public static final Snippet EMPTY = new Snippet("");

  private final String code;

  private Snippet(final String code) {
    this.code = code;
  }

  public static Snippet of(final String code) {
    if (code == null || code.trim().isEmpty()) {
      return EMPTY;
    }
    return new Snippet(code.trim());
  }

  /**
   * Concatenate line by line, used when a state declares the same kind of annotation twice.
   */
  public Snippet append(final Snippet other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    return new Snippet(code + '\n' + other.code);
  }

  public boolean isEmpty() {
    return code.isEmpty();
  }

  public String getCode() {
    return code;
  }

  /**
   * Single line rendition, used in log traces and comments of the generated code.
   */
  public String flatten() {
    return code.replaceAll("\\s*\n\\s*", " ").trim();
  }

  @Override
  public int hashCode() {
    return code.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Snippet)) {
      return false;
    }
    return code.equals(((Snippet) obj).code);
  }

  @Override
  public String toString() {
    return code;
  }
}
