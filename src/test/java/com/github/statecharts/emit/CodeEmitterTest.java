package com.github.statecharts.emit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import com.github.statecharts.StatechartException;
import com.github.statecharts.StatechartException.Code;
import com.github.statecharts.analysis.Elaborator;
import com.github.statecharts.analysis.TransitionTable;
import com.github.statecharts.analysis.TransitionTableSynthesizer;
import com.github.statecharts.builder.MachineRegistry;
import com.github.statecharts.builder.ModelBuilder;
import com.github.statecharts.model.StateMachine;
import com.github.statecharts.syntax.DiagramReader;

/**
 * Tests of the generated state machine classes.
 */
public class CodeEmitterTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  static final String MOTOR = "@startuml\n'[header] package com.example.motor;\n"
      + "[*] -> IDLE\n"
      + "IDLE -> RUNNING : start [ready] / logStart()\n"
      + "RUNNING -> IDLE : stop / logStop()\n"
      + "RUNNING -> RUNNING : tick [count<3] / count++\n"
      + "RUNNING : entry / engineOn()\n"
      + "IDLE : comment / engine is off\n"
      + "'[code] private boolean ready;\n'[code] private int count;\n@enduml\n";

  static final String LAMP = "[*] -> OFF\nOFF -> ON : switch on\nON -> OFF : switch off\n"
      + "state ON {\n  [*] -> DIM\n  DIM -> BRIGHT : brighter(int step) [level < 10]\n"
      + "  BRIGHT -> DIM : dimmer\n}\n";

  @Test
  public void testSourceFlavor() throws StatechartException {
    final String code = emit(Flavor.SOURCE, registry(MOTOR, "Motor").getRoot());
    assertTrue(code.startsWith("// This file has been generated by the statecharts translator"
        + " from motor.plantuml\n// on 2026-01-01T00:00:00."));
    assertTrue(code.contains("\npackage com.example.motor;\n"));
    assertTrue(code.contains("import com.github.statecharts.runtime.AbstractStateMachine;"));
    assertTrue(code.contains(" * " + CodeEmitter.DEFAULT_BRIEF + "\n"));
    assertTrue(code.contains(" * IDLE -&gt; RUNNING : start [ready]"));
    assertTrue(code.contains("public class Motor extends AbstractStateMachine<Motor.States> {"));

    // states
    assertTrue(code.contains("CONSTRUCTOR(\"[*]\"),"));
    assertTrue(code.contains("/** engine is off */\n    IDLE(\"IDLE\"),"));
    assertTrue(code.contains("MAX_STATES(\"MAX_STATES\");"));

    // tables and events
    assertTrue(code.contains("private final Transitions<States> startTransitions ="
        + " Transitions.<States>newTable()"));
    assertTrue(code.contains(".add(States.IDLE, States.RUNNING, this::onGuarding_IDLE_RUNNING,"
        + " this::onTransitioning_IDLE_RUNNING);"));
    assertTrue(code.contains(".add(States.RUNNING, States.IDLE, null,"
        + " this::onTransitioning_RUNNING_IDLE);"));
    assertTrue(code.contains("public void start() throws StatechartException {"));
    assertTrue(code.contains("transition(tickTransitions);"));

    // life cycle
    assertTrue(code.contains("super(States.class, States.CONSTRUCTOR);"));
    assertTrue(code.contains("hooks(States.RUNNING).entering(this::onEntering_RUNNING);"));
    assertTrue(code.contains("transition(States.IDLE, null);"));
    assertFalse(code.contains("onInternal_CONSTRUCTOR"));

    // hooks
    assertTrue(code.contains("protected boolean onGuarding_IDLE_RUNNING() {"));
    assertTrue(code.contains("final boolean guard = (ready);"));
    assertTrue(code.contains("protected void onTransitioning_RUNNING_RUNNING() {"));
    assertTrue(code.contains("count++;\n"));
    assertTrue(code.contains("protected void onEntering_RUNNING() {"));
    assertTrue(code.contains("// Client code\n  private boolean ready;\n  private int count;\n"));
    assertTrue(code.endsWith("}\n"));
  }

  @Test
  public void testHeaderFlavor() throws StatechartException {
    final String code = emit(Flavor.HEADER, registry(MOTOR, "Motor").getRoot());
    assertTrue(code.contains("public abstract class Motor extends"));
    assertTrue(code.contains("protected abstract boolean onGuarding_IDLE_RUNNING();"));
    assertTrue(code.contains("protected abstract void onTransitioning_IDLE_RUNNING();"));
    assertTrue(code.contains("protected abstract void onEntering_RUNNING();"));
    assertTrue(code.contains(" * Diagram action: logStart"));
    assertFalse(code.contains("final boolean guard"));
  }

  @Test
  public void testNestedMachines() throws StatechartException {
    final MachineRegistry registry = registry(LAMP, "Lamp");
    final String lamp = emit(Flavor.SOURCE, registry.getRoot());
    assertTrue(lamp.contains("protected final NestedON nestedON = new NestedON();"));
    assertTrue(lamp.contains("protected int step;"));
    assertTrue(lamp.contains("public void brighter(final int step) throws StatechartException {"));
    assertTrue(lamp.contains("this.step = step;"));
    assertTrue(lamp.contains("nestedON.brighter(step);"));
    assertTrue(lamp.contains("nestedON.enter();"));
    assertTrue(lamp.contains("nestedON.exit();"));
    assertFalse(lamp.contains("brighterTransitions"));

    final String header = emit(Flavor.HEADER, registry.getRoot());
    assertTrue(header.contains("protected final NestedON nestedON;"));
    assertTrue(header.contains("nestedON = newNestedON();"));
    assertTrue(header.contains("protected abstract NestedON newNestedON();"));

    final String on = emit(Flavor.SOURCE, registry.lookup("ON"));
    assertTrue(on.contains("public class NestedON extends AbstractStateMachine<NestedON.States>"));
    assertTrue(on.contains("brighterTransitions"));
  }

  @Test
  public void testWarningsAreCopied() throws StatechartException {
    final String code = emit(Flavor.SOURCE, registry("[*] -> A\nA -> A\n", "Motor").getRoot());
    assertTrue(code.contains("// WARNING: The state A has no reaction to no event"));
    assertTrue(code.contains("// Dummy action"));
  }

  @Test
  public void testMachineMustBeElaborated() throws StatechartException {
    final StateMachine machine =
        new ModelBuilder("").build(new DiagramReader().parse(MOTOR), "Motor").getRoot();
    try {
      new CodeEmitter(Flavor.SOURCE, "motor.plantuml", "2026-01-01T00:00:00")
          .emit(machine, new TransitionTableSynthesizer().synthesize(machine));
      fail("code must not be generated before elaboration");
    } catch (StatechartException expected) {
      assertEquals(Code.NOT_ELABORATED, expected.getCode());
    }
  }

  static MachineRegistry registry(final String diagram, final String name)
      throws StatechartException {
    final MachineRegistry registry =
        new ModelBuilder("").build(new DiagramReader().parse(diagram), name);
    for (StateMachine machine : registry.machines()) {
      new Elaborator().elaborate(machine);
    }
    return registry;
  }

  private static String emit(final Flavor flavor, final StateMachine machine)
      throws StatechartException {
    final List<TransitionTable> tables = new TransitionTableSynthesizer().synthesize(machine);
    return new CodeEmitter(flavor, "motor.plantuml", "2026-01-01T00:00:00").emit(machine, tables);
  }
}
