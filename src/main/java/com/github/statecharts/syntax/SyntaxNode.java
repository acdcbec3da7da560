package com.github.statecharts.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Node of the syntax tree produced by the parsing stage: a kind tag, ordered attributes (tokens)
 * and ordered children.
 */
public final class SyntaxNode {
  private final String kind;
  private final List<String> attributes;
  private final List<SyntaxNode> children;

  public SyntaxNode(final String kind, final List<String> attributes,
      final List<SyntaxNode> children) {
    this.kind = kind;
    this.attributes = Collections.unmodifiableList(new ArrayList<>(attributes));
    this.children = Collections.unmodifiableList(new ArrayList<>(children));
  }

  public static SyntaxNode leaf(final NodeKind kind, final String... attributes) {
    return new SyntaxNode(kind.getTag(), Arrays.asList(attributes),
        Collections.<SyntaxNode>emptyList());
  }

  public static SyntaxNode node(final NodeKind kind, final List<String> attributes,
      final List<SyntaxNode> children) {
    return new SyntaxNode(kind.getTag(), attributes, children);
  }

  public String getKind() {
    return kind;
  }

  public List<String> getAttributes() {
    return attributes;
  }

  public String getAttribute(final int index) {
    return index < attributes.size() ? attributes.get(index) : "";
  }

  public List<SyntaxNode> getChildren() {
    return children;
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder(kind).append(attributes);
    if (!children.isEmpty()) {
      builder.append(children);
    }
    return builder.toString();
  }
}
