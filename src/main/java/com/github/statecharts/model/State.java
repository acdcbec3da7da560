package com.github.statecharts.model;

/**
 * A node of the state machine graph. The id is the upper-cased diagram name, or one of the two
 * sentinels {@link #INITIAL} and {@link #FINAL}.
 *
 * {@code internal} is not authored: it is filled by the elaborator with the dispatch code of the
 * event-less transitions leaving this state.
 */
public final class State {
  public static final String INITIAL = "[*]";
  public static final String FINAL = "*";

  private final String id;
  private String comment = "";
  private Snippet entering = Snippet.EMPTY;
  private Snippet leaving = Snippet.EMPTY;
  private Snippet activity = Snippet.EMPTY;
  private String internal = "";

  int entryHits;
  int exitHits;

  public State(final String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  public boolean isInitial() {
    return INITIAL.equals(id);
  }

  public boolean isFinal() {
    return FINAL.equals(id);
  }

  public String getComment() {
    return comment;
  }

  public void addComment(final String text) {
    if (text == null || text.trim().isEmpty()) {
      return;
    }
    comment = comment.isEmpty() ? text.trim() : comment + ' ' + text.trim();
  }

  public Snippet getEntering() {
    return entering;
  }

  public void addEntering(final Snippet code) {
    entering = entering.append(code);
  }

  public Snippet getLeaving() {
    return leaving;
  }

  public void addLeaving(final Snippet code) {
    leaving = leaving.append(code);
  }

  public Snippet getActivity() {
    return activity;
  }

  public void addActivity(final Snippet code) {
    activity = activity.append(code);
  }

  public String getInternal() {
    return internal;
  }

  public boolean hasInternal() {
    return !internal.isEmpty();
  }

  public void setInternal(final String internal) {
    this.internal = internal;
  }

  public int getEntryHits() {
    return entryHits;
  }

  public int getExitHits() {
    return exitHits;
  }

  public void resetHits() {
    entryHits = 0;
    exitHits = 0;
  }

  public void hitEntering() {
    if (!entering.isEmpty()) {
      entryHits++;
    }
  }

  public void hitLeaving() {
    if (!leaving.isEmpty()) {
      exitHits++;
    }
  }

  @Override
  public String toString() {
    return "State [id=" + id + "]";
  }
}
