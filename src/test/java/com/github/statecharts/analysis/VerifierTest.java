package com.github.statecharts.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.github.statecharts.StatechartException;
import com.github.statecharts.model.StateMachine;

/**
 * Tests of the structural checks.
 */
public class VerifierTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  private final Verifier verifier = new Verifier(100, 64);

  @Test
  public void testWellFormedMachine() throws StatechartException {
    final StateMachine machine = Diagrams.root(Diagrams.MOTOR);
    assertEquals(0, verifier.verify(machine));
    assertTrue(machine.getWarnings().isEmpty());
  }

  @Test
  public void testMissingInitialState() throws StatechartException {
    final StateMachine machine = Diagrams.root("A -> B : go\nB -> A : back\n");
    assertEquals(1, verifier.verify(machine));
    assertEquals("Missing initial state in the main state machine", machine.getWarnings().get(0));
  }

  @Test
  public void testNoEvent() throws StatechartException {
    final StateMachine machine = Diagrams.root("[*] -> A\nA -> B : [x]\n");
    assertEquals(1, verifier.verify(machine));
    assertTrue(machine.getWarnings().get(0).contains("at least one event"));
  }

  @Test
  public void testMissingIncomingTransition() throws StatechartException {
    final StateMachine machine = Diagrams.root("[*] -> A\nA -> B : go\nC -> B : come\n");
    assertEquals(1, verifier.verify(machine));
    assertEquals("The state C shall have at least one incoming transition",
        machine.getWarnings().get(0));
  }

  @Test
  public void testAlwaysTrueWayAmongSeveral() throws StatechartException {
    final StateMachine machine = Diagrams.root(
        "[*] -> A\nA -> B\nA -> C : go\nB -> A : back\nC -> A : back\n");
    assertEquals(1, verifier.verify(machine));
    assertTrue(machine.getWarnings().get(0).contains("The state A has an issue"));
    assertTrue(machine.getWarnings().get(0).contains("the way to state B is always true"));
  }

  @Test
  public void testInfiniteLoop() throws StatechartException {
    final StateMachine machine = Diagrams.root("[*] -> A\nA -> B : go\nB -> C\nC -> B\n");
    assertEquals(1, verifier.verify(machine));
    assertTrue(machine.getWarnings().get(0).contains("infinite loop: B C B"));
  }
}
