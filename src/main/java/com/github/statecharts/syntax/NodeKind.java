package com.github.statecharts.syntax;

import com.github.statecharts.StatechartException;
import com.github.statecharts.StatechartException.Code;

/**
 * Kinds of syntax tree nodes understood by the model builder. The tag is the name used by the
 * parsing stage.
 */
public enum NodeKind {
  DIAGRAM("diagram"),
  TRANSITION("transition"),
  STATE_BLOCK("state_block"),
  STATE_ENTRY("state_entry"),
  STATE_EXIT("state_exit"),
  STATE_ACTIVITY("state_activity"),
  STATE_COMMENT("state_comment"),
  STATE_ON("state_on"),
  CODE_INJECTION("code_injection"),
  EVENT("event"),
  GUARD("guard"),
  UML_ACTION("uml_action"),
  STD_ACTION("std_action"),
  CODE("code"),
  COMMENT("comment"),
  SKIN("skin"),
  HIDE("hide");

  private final String tag;

  private NodeKind(final String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }

  /**
   * Resolve a tag, also accepting the unofficial state annotation aliases ({@code state_entering},
   * {@code state_leaving}, {@code state_do}, {@code state_event}).
   */
  public static NodeKind fromTag(final String tag) throws StatechartException {
    for (NodeKind kind : values()) {
      if (kind.tag.equals(tag)) {
        return kind;
      }
    }
    switch (tag) {
      case "state_entering":
        return STATE_ENTRY;
      case "state_leaving":
        return STATE_EXIT;
      case "state_do":
        return STATE_ACTIVITY;
      case "state_event":
        return STATE_ON;
      default:
        throw new StatechartException(Code.UNKNOWN_NODE_KIND,
            "Token " + tag + " not yet managed");
    }
  }
}
