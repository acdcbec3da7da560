package com.github.statecharts.emit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;

import org.junit.Test;

import com.github.statecharts.StatechartException;
import com.github.statecharts.builder.ModelBuilder;
import com.github.statecharts.model.State;
import com.github.statecharts.model.StateMachine;
import com.github.statecharts.model.Transition;
import com.github.statecharts.syntax.DiagramReader;

/**
 * Tests of the diagram written back from a state machine.
 */
public class PlantUmlWriterTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  private static final String DIAGRAM = "@startuml\n"
      + "[*] --> IDLE\n"
      + "IDLE -> RUNNING : start [ready] / logStart()\n"
      + "IDLE <- RUNNING : stop \\n--\\n logStop(); count = 0;\n"
      + "RUNNING -> RUNNING : tick [count < 3] / count++\n"
      + "RUNNING -> PARKED : go home\n"
      + "PARKED -> SERVICE : set speed (int x) [x > 0]\n"
      + "SERVICE -> [*]\n"
      + "PARKED : on poke\n"
      + "IDLE -> IDLE\n"
      + "RUNNING : entry / engineOn();\n"
      + "RUNNING : entry / lightsOn();\n"
      + "RUNNING : exit / engineOff();\n"
      + "PARKED : do / wash();\n"
      + "PARKED : comment / waiting for its owner\n"
      + "@enduml\n";

  private final PlantUmlWriter writer = new PlantUmlWriter();

  @Test
  public void testWrittenDiagramReadsBackTheSame() throws StatechartException {
    final StateMachine original = build(DIAGRAM);
    final String exported = writer.export(original);
    assertTrue(exported.startsWith("@startuml\n"));
    assertTrue(exported.endsWith("@enduml\n"));
    final StateMachine copy = build(exported);

    assertEquals(new HashSet<>(original.getStateIds()), new HashSet<>(copy.getStateIds()));
    assertEquals(original.getInitialState(), copy.getInitialState());
    assertEquals(original.getFinalState(), copy.getFinalState());
    assertEquals(original.getTransitions().size(), copy.getTransitions().size());
    for (Transition expected : original.getTransitions()) {
      final Transition actual =
          copy.getTransition(expected.getOrigin(), expected.getDestination());
      assertNotNull(expected.toString(), actual);
      assertEquals(expected.getEvent().declaration(), actual.getEvent().declaration());
      assertEquals(expected.getGuard(), actual.getGuard());
      assertEquals(expected.getAction(), actual.getAction());
      assertEquals(expected.isStateReaction(), actual.isStateReaction());
      assertEquals(expected.hasPlaceholderAction(), actual.hasPlaceholderAction());
    }
    for (State expected : original.getStates()) {
      final State actual = copy.getState(expected.getId());
      assertEquals(expected.getEntering(), actual.getEntering());
      assertEquals(expected.getLeaving(), actual.getLeaving());
      assertEquals(expected.getActivity(), actual.getActivity());
      assertEquals(expected.getComment(), actual.getComment());
    }
  }

  @Test
  public void testTransitionLines() throws StatechartException {
    final StateMachine machine = build(DIAGRAM);
    assertEquals("IDLE -> RUNNING : start [ready] \\n--\\nlogStart()",
        PlantUmlWriter.transition(machine.getTransition("IDLE", "RUNNING")));
    assertEquals("IDLE <- RUNNING : stop \\n--\\nlogStop(); count = 0;",
        PlantUmlWriter.transition(machine.getTransition("RUNNING", "IDLE")));
    assertEquals("RUNNING -> PARKED : goHome()",
        PlantUmlWriter.transition(machine.getTransition("RUNNING", "PARKED")));
    assertEquals("SERVICE -> [*]",
        PlantUmlWriter.transition(machine.getTransition("SERVICE", State.FINAL)));
    assertEquals("IDLE -> IDLE", PlantUmlWriter.transition(machine.getTransition("IDLE", "IDLE")));
    assertEquals("PARKED : on poke",
        PlantUmlWriter.transition(machine.getTransition("PARKED", "PARKED")));
  }

  @Test
  public void testFileName() throws StatechartException {
    assertEquals("Motor-interpreted.plantuml", PlantUmlWriter.fileName(build(DIAGRAM)));
  }

  private static StateMachine build(final String diagram) throws StatechartException {
    return new ModelBuilder("").build(new DiagramReader().parse(diagram), "Motor").getRoot();
  }
}
