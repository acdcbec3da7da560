package com.github.statecharts.runtime;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.github.statecharts.StatechartException;
import com.github.statecharts.StatechartException.Code;

/**
 * Tests to maintain the sanity and correctness of the runtime of generated machines.
 */
public class AbstractStateMachineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  @Test
  public void testEnterDoesTheInitialTransition() throws StatechartException {
    final Motor motor = new Motor();
    assertEquals(States.CONSTRUCTOR, motor.state());
    motor.enter();
    assertEquals(States.IDLE, motor.state());
    assertEquals("IDLE", motor.stateName());
    assertEquals(Arrays.asList("enter IDLE"), motor.trace);
  }

  @Test
  public void testActionThenLeavingThenEntering() throws StatechartException {
    final Motor motor = new Motor();
    motor.enter();
    motor.trace.clear();
    motor.start();
    assertEquals(States.RUNNING, motor.state());
    assertEquals(Arrays.asList("logStart", "leave IDLE", "enter RUNNING"), motor.trace);
  }

  @Test
  public void testRefusedGuardKeepsTheState() throws StatechartException {
    final Motor motor = new Motor();
    motor.enter();
    motor.ready = false;
    motor.start();
    assertEquals(States.IDLE, motor.state());
    assertFalse(motor.trace.contains("logStart"));
  }

  @Test
  public void testFirstAcceptingGuardWins() throws StatechartException {
    final Motor motor = new Motor();
    motor.enter();
    motor.ready = false;
    motor.boost = true;
    motor.start();
    assertEquals(States.DONE, motor.state());
  }

  @Test
  public void testUnexpectedEventIsIgnored() throws StatechartException {
    final Motor motor = new Motor();
    motor.enter();
    motor.trace.clear();
    motor.stop();
    assertEquals(States.IDLE, motor.state());
    assertTrue(motor.trace.isEmpty());
  }

  @Test
  public void testSelfLoopSkipsEnteringAndLeaving() throws StatechartException {
    final Motor motor = new Motor();
    motor.enter();
    motor.start();
    motor.trace.clear();
    motor.tick();
    motor.tick();
    assertEquals(States.RUNNING, motor.state());
    assertEquals(Arrays.asList("increment", "increment"), motor.trace);
  }

  @Test
  public void testInternalTransitionIsQueued() throws StatechartException {
    final Motor motor = new Motor();
    motor.enter();
    motor.finished = true;
    motor.trace.clear();
    motor.start();
    assertEquals(States.DONE, motor.state());
    assertTrue(motor.nestingInHook);
    assertFalse(motor.isNesting());
    assertEquals(Arrays.asList("logStart", "leave IDLE", "enter RUNNING", "leave RUNNING"),
        motor.trace);
  }

  @Test
  public void testForbiddenEvent() throws StatechartException {
    final Motor motor = new Motor();
    motor.enter();
    try {
      motor.crash();
      fail("a forbidden event must abort");
    } catch (StatechartException expected) {
      assertEquals(Code.FORBIDDEN_EVENT, expected.getCode());
    }
    assertEquals(States.IDLE, motor.state());
  }

  @Test
  public void testResetGoesBackToTheInitialState() throws StatechartException {
    final Motor motor = new Motor();
    motor.enter();
    motor.start();
    motor.reset();
    assertEquals(States.CONSTRUCTOR, motor.state());
    assertEquals("[*]", motor.stateName());
  }

  @Test
  public void testTableKeepsDeclarationOrder() {
    final Transitions<States> table = Transitions.<States>newTable()
        .add(States.IDLE, States.RUNNING, null, null)
        .add(States.RUNNING, States.IDLE, null, null)
        .add(States.IDLE, States.DONE, () -> false, null);
    assertEquals(3, table.entries().size());
    final List<Transitions.Entry<States>> fromIdle = table.from(States.IDLE);
    assertEquals(2, fromIdle.size());
    assertEquals(States.RUNNING, fromIdle.get(0).getDestination());
    assertTrue(fromIdle.get(0).accepts());
    assertEquals(States.DONE, fromIdle.get(1).getDestination());
    assertFalse(fromIdle.get(1).accepts());
    assertTrue(table.from(States.DONE).isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInitialStateMustBeAState() {
    new AbstractStateMachine<States>(States.class, States.MAX_STATES) {};
  }

  static enum States {
    CONSTRUCTOR("[*]"),
    IDLE("IDLE"),
    RUNNING("RUNNING"),
    DONE("DONE"),
    IGNORING_EVENT("IGNORING_EVENT"),
    CANNOT_HAPPEN("CANNOT_HAPPEN"),
    MAX_STATES("MAX_STATES");

    private final String rawName;

    States(final String rawName) {
      this.rawName = rawName;
    }

    @Override
    public String toString() {
      return rawName;
    }
  }

  /**
   * Shaped like a translated diagram:
   * <pre>
   * [*] -> IDLE
   * IDLE -> RUNNING : start [ready] / logStart
   * IDLE -> DONE : start [boost]
   * RUNNING -> IDLE : stop
   * RUNNING -> RUNNING : tick / increment
   * RUNNING -> DONE : [finished]
   * IDLE -> CANNOT_HAPPEN : crash
   * </pre>
   */
  static final class Motor extends AbstractStateMachine<States> {
    final List<String> trace = new ArrayList<>();
    boolean ready = true;
    boolean boost;
    boolean finished;
    boolean nestingInHook;

    private final Transitions<States> startTransitions = Transitions.<States>newTable()
        .add(States.IDLE, States.RUNNING, this::onGuarding_IDLE_RUNNING,
            this::onTransitioning_IDLE_RUNNING)
        .add(States.IDLE, States.DONE, () -> boost, null);
    private final Transitions<States> stopTransitions = Transitions.<States>newTable()
        .add(States.RUNNING, States.IDLE, null, null);
    private final Transitions<States> tickTransitions = Transitions.<States>newTable()
        .add(States.RUNNING, States.RUNNING, null, () -> trace.add("increment"));
    private final Transitions<States> crashTransitions = Transitions.<States>newTable()
        .add(States.IDLE, States.CANNOT_HAPPEN, null, null);

    Motor() {
      super(States.class, States.CONSTRUCTOR);
      hooks(States.IDLE).entering(() -> trace.add("enter IDLE"))
          .leaving(() -> trace.add("leave IDLE"));
      hooks(States.RUNNING).entering(this::onEntering_RUNNING)
          .leaving(() -> trace.add("leave RUNNING")).internal(this::onInternal_RUNNING);
    }

    @Override
    public void enter() throws StatechartException {
      super.enter();
      transition(States.IDLE, null);
    }

    void start() throws StatechartException {
      transition(startTransitions);
    }

    void stop() throws StatechartException {
      transition(stopTransitions);
    }

    void tick() throws StatechartException {
      transition(tickTransitions);
    }

    void crash() throws StatechartException {
      transition(crashTransitions);
    }

    private boolean onGuarding_IDLE_RUNNING() {
      return ready;
    }

    private void onTransitioning_IDLE_RUNNING() {
      trace.add("logStart");
    }

    private void onEntering_RUNNING() {
      nestingInHook = isNesting();
      trace.add("enter RUNNING");
    }

    private void onInternal_RUNNING() throws StatechartException {
      if (finished) {
        transition(States.DONE, null);
      }
    }
  }
}
