package com.github.statecharts.analysis;

import java.util.Collections;
import java.util.List;

import com.github.statecharts.model.Transition;

/**
 * One generated test: a walk along the graph, the events to fire on the way, the states to check
 * and the expected calls of the mocked hooks.
 */
public final class Scenario {

  public static enum Kind {
    CYCLE, PATH
  }

  private final Kind kind;
  private final int index;
  private final List<String> states;
  private final List<Step> steps;
  private final MockExpectations expectations;
  private final boolean unreachableEnd;

  Scenario(final Kind kind, final int index, final List<String> states, final List<Step> steps,
      final MockExpectations expectations, final boolean unreachableEnd) {
    this.kind = kind;
    this.index = index;
    this.states = Collections.unmodifiableList(states);
    this.steps = Collections.unmodifiableList(steps);
    this.expectations = expectations;
    this.unreachableEnd = unreachableEnd;
  }

  public Kind getKind() {
    return kind;
  }

  public int getIndex() {
    return index;
  }

  /**
   * Name of the generated test method, eg. {@code testCycle0}.
   */
  public String getTestName() {
    return (kind == Kind.CYCLE ? "testCycle" : "testPath") + index;
  }

  /**
   * The states of the cycle, closed by its first state again, or the states of the path.
   */
  public List<String> getStates() {
    return states;
  }

  public List<Step> getSteps() {
    return steps;
  }

  public MockExpectations getExpectations() {
    return expectations;
  }

  /**
   * True when the cycle closes on a transition without event: the final state cannot be observed
   * from outside the machine.
   */
  public boolean isUnreachableEnd() {
    return unreachableEnd;
  }

  @Override
  public String toString() {
    return "Scenario [" + getTestName() + ": " + String.join(" ", states) + "]";
  }

  /**
   * Crossing one transition.
   */
  public static final class Step {
    private final Transition transition;
    private final boolean fire;
    private final boolean assertAfter;

    Step(final Transition transition, final boolean fire, final boolean assertAfter) {
      this.transition = transition;
      this.fire = fire;
      this.assertAfter = assertAfter;
    }

    public Transition getTransition() {
      return transition;
    }

    /**
     * The test triggers the event of the transition.
     */
    public boolean isFire() {
      return fire;
    }

    /**
     * The test checks the machine stands in the destination state afterwards. It is only
     * possible when the machine then waits for an event.
     */
    public boolean isAssertAfter() {
      return assertAfter;
    }

    @Override
    public String toString() {
      return "Step [" + transition.getOrigin() + " -> " + transition.getDestination() + ", fire="
          + fire + ", assertAfter=" + assertAfter + "]";
    }
  }
}
