package com.github.statecharts.emit;

/**
 * Accumulates generated source text, two spaces per indentation level.
 */
public final class SourceWriter {
  private static final String INDENT = "  ";

  private final StringBuilder text = new StringBuilder();
  private int depth;

  public SourceWriter line(final String line) {
    if (line.isEmpty()) {
      text.append('\n');
      return this;
    }
    for (int i = 0; i < depth; i++) {
      text.append(INDENT);
    }
    text.append(line).append('\n');
    return this;
  }

  public SourceWriter blank() {
    text.append('\n');
    return this;
  }

  /**
   * Write every line of a multi-line block at the current depth, keeping its own relative
   * indentation.
   */
  public SourceWriter lines(final String block) {
    if (block.isEmpty()) {
      return this;
    }
    for (String line : block.split("\n", -1)) {
      line(line.stripTrailing());
    }
    return this;
  }

  /**
   * Write {@code header {} and indent the following lines.
   */
  public SourceWriter open(final String header) {
    line(header + " {");
    depth++;
    return this;
  }

  /**
   * Outdent and write the closing brace, optionally followed by a suffix such as {@code ;}.
   */
  public SourceWriter close(final String suffix) {
    depth = Math.max(0, depth - 1);
    return line("}" + suffix);
  }

  public SourceWriter close() {
    return close("");
  }

  public SourceWriter indent() {
    depth++;
    return this;
  }

  public SourceWriter outdent() {
    depth = Math.max(0, depth - 1);
    return this;
  }

  /**
   * Javadoc block, one line of text per element.
   */
  public SourceWriter javadoc(final String... comment) {
    line("/**");
    for (String block : comment) {
      for (String line : block.split("\n", -1)) {
        line((" * " + escapeComment(line)).stripTrailing());
      }
    }
    return line(" */");
  }

  @Override
  public String toString() {
    return text.toString();
  }

  /**
   * Keep user text from closing the comment it is written in.
   */
  public static String escapeComment(final String text) {
    return text.replace("*/", "*&#47;");
  }

  /**
   * Content of a Java string literal.
   */
  public static String escapeString(final String text) {
    return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", " ");
  }
}
