package com.github.statecharts.syntax;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StatechartException;
import com.github.statecharts.StatechartException.Code;

/**
 * Reads the line oriented subset of the PlantUML state diagram syntax used by statecharts and
 * produces the syntax tree consumed by the model builder.
 *
 * Supported lines:<br>
 * {@code origin -> destination : event [ guard ] / action} (any arrow length or direction)<br>
 * {@code destination <- origin : event [ guard ] \n--\n action}<br>
 * {@code state : entry / code}, {@code exit}, {@code do}, {@code comment}, {@code on event ...}
 * and their aliases {@code entering}, {@code leaving}, {@code activity}, {@code event}<br>
 * {@code state name {} ... {@code }} for composite states<br>
 * {@code '[tag] code} for code injections, {@code '} comments, {@code skinparam}, {@code hide}<br>
 */
public final class DiagramReader {
  private static final Logger logger = LogManager.getLogger(DiagramReader.class.getSimpleName());

  private static final String NAME = "(\\[\\*\\]|[A-Za-z_][\\w.]*)";
  private static final Pattern TRANSITION = Pattern.compile(
      "^" + NAME + "\\s*(<-+|<-+[A-Za-z]+-+|-+>|-+[A-Za-z]+-+>)\\s*" + NAME + "\\s*(?::(.*))?$");
  private static final Pattern STATE_ANNOTATION = Pattern.compile(
      "^([A-Za-z_][\\w.]*)\\s*:\\s*(entry|exit|entering|leaving|do|activity|comment|on|event)\\b"
          + "\\s*(.*)$");
  private static final Pattern STATE_DESCRIPTION =
      Pattern.compile("^([A-Za-z_][\\w.]*)\\s*:\\s*(.*)$");
  private static final Pattern BLOCK_BEGIN =
      Pattern.compile("^state\\s+([A-Za-z_][\\w.]*)\\s*\\{$");
  private static final Pattern STATE_DECLARATION = Pattern.compile("^state\\s+.*$");
  private static final Pattern INJECTION = Pattern.compile("^'\\s*(\\[[a-z]+\\])\\s?(.*)$");
  private static final Pattern EVENT_PARAMETERS = Pattern.compile("^(.*?)\\s*(\\(.*\\))\\s*$");
  private static final String STD_ACTION_SEPARATOR = "\\n--\\n";

  public SyntaxNode read(final Path diagram) throws StatechartException {
    if (diagram == null || !Files.isRegularFile(diagram)) {
      throw new StatechartException(Code.INPUT_NOT_FOUND,
          "File path " + diagram + " does not exist!");
    }
    try {
      return parse(new String(Files.readAllBytes(diagram), StandardCharsets.UTF_8));
    } catch (IOException problem) {
      throw new StatechartException(Code.IO_FAILURE, problem);
    }
  }

  public SyntaxNode parse(final String text) throws StatechartException {
    final Deque<List<SyntaxNode>> scopes = new ArrayDeque<>();
    final Deque<String> blockNames = new ArrayDeque<>();
    scopes.push(new ArrayList<>());
    final String[] lines = text.split("\r?\n");
    for (int number = 1; number <= lines.length; number++) {
      final String line = lines[number - 1].trim();
      if (line.isEmpty() || line.startsWith("@startuml") || line.startsWith("@enduml")) {
        continue;
      }
      if (line.equals("}")) {
        if (blockNames.isEmpty()) {
          throw syntaxError(number, line, "unbalanced closing brace");
        }
        final List<SyntaxNode> children = scopes.pop();
        scopes.peek().add(SyntaxNode.node(NodeKind.STATE_BLOCK,
            Collections.singletonList(blockNames.pop()), children));
        continue;
      }
      Matcher matcher = BLOCK_BEGIN.matcher(line);
      if (matcher.matches()) {
        blockNames.push(matcher.group(1));
        scopes.push(new ArrayList<>());
        continue;
      }
      scopes.peek().add(parseLine(number, line));
    }
    if (!blockNames.isEmpty()) {
      throw syntaxError(lines.length, "", "composite state " + blockNames.peek() + " not closed");
    }
    final SyntaxNode root = SyntaxNode.node(NodeKind.DIAGRAM, Collections.<String>emptyList(),
        scopes.pop());
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed diagram: " + root);
    }
    return root;
  }

  private SyntaxNode parseLine(final int number, final String line) throws StatechartException {
    Matcher matcher = INJECTION.matcher(line);
    if (matcher.matches()) {
      return SyntaxNode.leaf(NodeKind.CODE_INJECTION, matcher.group(1), matcher.group(2));
    }
    if (line.startsWith("'")) {
      return SyntaxNode.leaf(NodeKind.COMMENT, line.substring(1));
    }
    if (line.startsWith("skinparam")) {
      return SyntaxNode.leaf(NodeKind.SKIN, line);
    }
    if (line.startsWith("hide")) {
      return SyntaxNode.leaf(NodeKind.HIDE, line);
    }
    matcher = TRANSITION.matcher(line);
    if (matcher.matches()) {
      final List<String> attributes =
          Arrays.asList(matcher.group(1), matcher.group(2), matcher.group(3));
      return SyntaxNode.node(NodeKind.TRANSITION, attributes,
          parseLabel(number, line, matcher.group(4)));
    }
    matcher = STATE_ANNOTATION.matcher(line);
    if (matcher.matches()) {
      return parseStateAnnotation(number, line, matcher.group(1), matcher.group(2),
          matcher.group(3));
    }
    if (STATE_DECLARATION.matcher(line).matches()) {
      // plain declarations carry nothing the translator needs
      return SyntaxNode.leaf(NodeKind.COMMENT, line);
    }
    matcher = STATE_DESCRIPTION.matcher(line);
    if (matcher.matches()) {
      return SyntaxNode.node(NodeKind.STATE_COMMENT, Collections.singletonList(matcher.group(1)),
          Collections.singletonList(SyntaxNode.leaf(NodeKind.CODE, "/" + matcher.group(2))));
    }
    throw syntaxError(number, line, "unexpected statement");
  }

  private SyntaxNode parseStateAnnotation(final int number, final String line, final String state,
      final String what, final String rest) throws StatechartException {
    final List<String> attributes = Collections.singletonList(state);
    switch (what) {
      case "on":
      case "event":
        return SyntaxNode.node(NodeKind.STATE_ON, attributes, parseLabel(number, line, rest));
      case "entry":
      case "entering":
        return annotation(NodeKind.STATE_ENTRY, attributes, rest);
      case "exit":
      case "leaving":
        return annotation(NodeKind.STATE_EXIT, attributes, rest);
      case "do":
      case "activity":
        return annotation(NodeKind.STATE_ACTIVITY, attributes, rest);
      case "comment":
        return annotation(NodeKind.STATE_COMMENT, attributes, rest);
      default:
        throw syntaxError(number, line, "unknown state annotation " + what);
    }
  }

  private static SyntaxNode annotation(final NodeKind kind, final List<String> attributes,
      final String code) {
    return SyntaxNode.node(kind, attributes,
        Collections.singletonList(SyntaxNode.leaf(NodeKind.CODE, code.trim())));
  }

  /**
   * Split {@code event [ guard ] / action} into its optional event, guard and action nodes.
   */
  private List<SyntaxNode> parseLabel(final int number, final String line, final String label)
      throws StatechartException {
    final List<SyntaxNode> nodes = new ArrayList<>();
    if (label == null || label.trim().isEmpty()) {
      return nodes;
    }
    String rest = label.trim();
    SyntaxNode action = null;
    final int separator = rest.indexOf(STD_ACTION_SEPARATOR);
    if (separator >= 0) {
      action = SyntaxNode.leaf(NodeKind.STD_ACTION, rest.substring(separator));
      rest = rest.substring(0, separator).trim();
    }
    // the action is opaque: split it off before looking for the guard
    final int slash = topLevelSlash(rest);
    if (slash >= 0) {
      if (action != null) {
        throw syntaxError(number, line, "transition declares two actions");
      }
      action = SyntaxNode.leaf(NodeKind.UML_ACTION, rest.substring(slash));
      rest = rest.substring(0, slash).trim();
    }
    String guard = null;
    final int open = rest.indexOf('[');
    if (open >= 0) {
      final int close = matchingBracket(rest, open);
      if (close < 0) {
        throw syntaxError(number, line, "guard is missing its closing bracket");
      }
      guard = rest.substring(open, close + 1);
      if (!rest.substring(close + 1).trim().isEmpty()) {
        throw syntaxError(number, line, "unexpected text after guard");
      }
      rest = rest.substring(0, open).trim();
    }
    if (!rest.isEmpty()) {
      nodes.add(new SyntaxNode(NodeKind.EVENT.getTag(), eventTokens(rest),
          Collections.<SyntaxNode>emptyList()));
    }
    if (guard != null) {
      nodes.add(SyntaxNode.leaf(NodeKind.GUARD, guard));
    }
    if (action != null) {
      nodes.add(action);
    }
    return nodes;
  }

  private static List<String> eventTokens(final String event) {
    final List<String> tokens = new ArrayList<>();
    String words = event;
    String parameters = null;
    final Matcher matcher = EVENT_PARAMETERS.matcher(event);
    if (matcher.matches()) {
      words = matcher.group(1);
      parameters = matcher.group(2);
    }
    for (String word : words.trim().split("\\s+")) {
      if (!word.isEmpty()) {
        tokens.add(word);
      }
    }
    if (parameters != null) {
      tokens.add(parameters);
    }
    return tokens;
  }

  /**
   * Index of the first {@code /} outside brackets, -1 when none.
   */
  private static int topLevelSlash(final String text) {
    int depth = 0;
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '[') {
        depth++;
      } else if (c == ']') {
        depth--;
      } else if (c == '/' && depth <= 0) {
        return i;
      }
    }
    return -1;
  }

  private static int matchingBracket(final String text, final int open) {
    int depth = 0;
    for (int i = open; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '[') {
        depth++;
      } else if (c == ']') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private static StatechartException syntaxError(final int number, final String line,
      final String reason) {
    return new StatechartException(Code.SYNTAX_ERROR,
        "Line " + number + ": " + reason + (line.isEmpty() ? "" : ": " + line));
  }
}
