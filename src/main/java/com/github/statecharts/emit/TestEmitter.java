package com.github.statecharts.emit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StatechartException;
import com.github.statecharts.StatechartException.Code;
import com.github.statecharts.analysis.MockExpectations;
import com.github.statecharts.analysis.Scenario;
import com.github.statecharts.analysis.TestPlan;
import com.github.statecharts.builder.HookNames;
import com.github.statecharts.model.Arc;
import com.github.statecharts.model.CodeInjections.Point;
import com.github.statecharts.model.State;
import com.github.statecharts.model.StateMachine;
import com.github.statecharts.model.Transition;

/**
 * Writes the JUnit 4 test class of one state machine. The machine is subclassed by a mock whose
 * guards return stubbed results and whose hooks count their calls; each scenario of the test plan
 * becomes one test method checking the visited states and the number of calls.
 */
public final class TestEmitter {
  private static final Logger logger = LogManager.getLogger(TestEmitter.class.getSimpleName());

  private final Flavor flavor;
  private final String diagramName;
  private final String generatedOn;

  public TestEmitter(final Flavor flavor, final String diagramName, final String generatedOn) {
    this.flavor = flavor;
    this.diagramName = diagramName;
    this.generatedOn = generatedOn;
  }

  public static String testClassName(final StateMachine machine) {
    return machine.getClassName() + "Test";
  }

  public static String mockClassName(final StateMachine machine) {
    return "Mock" + machine.getClassName();
  }

  public static String suiteClassName(final StateMachine root) {
    return root.getClassName() + "AllTests";
  }

  public Path write(final StateMachine machine, final TestPlan plan, final Path directory)
      throws StatechartException {
    return write(directory.resolve(testClassName(machine) + ".java"), emit(machine, plan));
  }

  public Path writeSuite(final StateMachine root, final List<StateMachine> machines,
      final Path directory) throws StatechartException {
    return write(directory.resolve(suiteClassName(root) + ".java"), emitSuite(root, machines));
  }

  private static Path write(final Path file, final String content) throws StatechartException {
    try {
      Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    } catch (IOException problem) {
      throw new StatechartException(Code.IO_FAILURE, problem);
    }
    logger.info("Wrote " + file);
    return file;
  }

  public String emit(final StateMachine machine, final TestPlan plan) {
    final SourceWriter out = new SourceWriter();
    CodeEmitter.banner(out, diagramName, generatedOn);
    packageAndImports(out, machine);
    out.line("import static org.junit.Assert.assertEquals;");
    out.blank();
    out.line("import org.apache.logging.log4j.LogManager;");
    out.line("import org.apache.logging.log4j.Logger;");
    out.line("import org.junit.Test;");
    out.blank();
    out.line("import com.github.statecharts.StatechartException;");
    out.blank();

    final String testClass = testClassName(machine);
    out.javadoc("Tests of the " + machine.getClassName() + " state machine: one test per cycle"
        + " and one test per path to a sink state.");
    out.open("public class " + testClass);
    out.line("private static final Logger logger = LogManager.getLogger(" + testClass
        + ".class.getSimpleName());");
    out.blank();
    mockClass(out, machine);
    for (Scenario scenario : plan.getCycles()) {
      scenario(out, machine, scenario);
    }
    for (Scenario scenario : plan.getPaths()) {
      scenario(out, machine, scenario);
    }
    if (!plan.getSelfLoops().isEmpty()) {
      out.line("// Not tested, states only looping on themselves: "
          + String.join(" ", plan.getSelfLoops()));
    }
    out.close();
    return out.toString();
  }

  /**
   * Runs the tests of every machine of the diagram at once.
   */
  public String emitSuite(final StateMachine root, final List<StateMachine> machines) {
    final SourceWriter out = new SourceWriter();
    CodeEmitter.banner(out, diagramName, generatedOn);
    packageAndImports(out, root);
    out.line("import org.junit.runner.RunWith;");
    out.line("import org.junit.runners.Suite;");
    out.blank();
    out.javadoc("All the tests of the " + root.getName() + " state machines.");
    out.line("@RunWith(Suite.class)");
    out.line("@Suite.SuiteClasses({");
    out.indent();
    for (int i = 0; i < machines.size(); i++) {
      out.line(testClassName(machines.get(i)) + ".class" + (i < machines.size() - 1 ? "," : ""));
    }
    out.outdent();
    out.line("})");
    out.open("public class " + suiteClassName(root));
    out.close();
    return out.toString();
  }

  /**
   * The package and imports of the {@code [header]} code, so the test lands next to the class.
   */
  private static void packageAndImports(final SourceWriter out, final StateMachine machine) {
    boolean any = false;
    for (String line : machine.getInjections().get(Point.HEADER)) {
      if (line.startsWith("package ") || line.startsWith("import ")) {
        out.line(line);
        any = true;
      }
    }
    if (any) {
      out.blank();
    }
  }

  private void mockClass(final SourceWriter out, final StateMachine machine) {
    final String mock = mockClassName(machine);
    out.javadoc("Mocked state machine: guards return their stubbed result, hooks count their"
        + " calls.");
    out.open("static class " + mock + " extends " + machine.getClassName());
    for (Transition transition : machine.getTransitions()) {
      if (transition.hasGuard()) {
        out.line("boolean " + guardResult(transition) + ";");
      }
      if (transition.hasAction()) {
        out.line("int " + calls(HookNames.action(transition.getOrigin(),
            transition.getDestination())) + ";");
      }
    }
    for (State state : machine.getStates()) {
      if (!state.getEntering().isEmpty()) {
        out.line("int " + calls(HookNames.entering(state.getId())) + ";");
      }
      if (!state.getLeaving().isEmpty()) {
        out.line("int " + calls(HookNames.leaving(state.getId())) + ";");
      }
    }
    for (String line : machine.getInjections().get(Point.TEST)) {
      out.line(line);
    }
    out.blank();

    for (Transition transition : machine.getTransitions()) {
      final String origin = transition.getOrigin();
      final String destination = transition.getDestination();
      if (transition.hasGuard()) {
        out.line("@Override");
        out.open("protected boolean " + HookNames.guard(origin, destination) + "()");
        out.line("logger.debug(\"" + SourceWriter.escapeString(transition.getGuard().flatten())
            + "\");");
        out.line("return " + guardResult(transition) + ";");
        out.close();
        out.blank();
      }
      if (transition.hasAction()) {
        counter(out, HookNames.action(origin, destination), transition.hasPlaceholderAction()
            ? "" : transition.getAction().flatten());
      }
    }
    for (State state : machine.getStates()) {
      if (!state.getEntering().isEmpty()) {
        counter(out, HookNames.entering(state.getId()), state.getEntering().flatten());
      }
      if (!state.getLeaving().isEmpty()) {
        counter(out, HookNames.leaving(state.getId()), state.getLeaving().flatten());
      }
    }
    if (flavor == Flavor.HEADER) {
      for (StateMachine child : machine.getChildren()) {
        out.line("@Override");
        out.open("protected " + child.getClassName() + " new" + child.getClassName() + "()");
        out.line("return new " + testClassName(child) + "." + mockClassName(child) + "();");
        out.close();
        out.blank();
      }
    }
    out.close();
    out.blank();
  }

  private static void counter(final SourceWriter out, final String hook, final String code) {
    out.line("@Override");
    out.open("protected void " + hook + "()");
    if (!code.isEmpty()) {
      out.line("logger.debug(\"" + SourceWriter.escapeString(code) + "\");");
    }
    out.line(calls(hook) + "++;");
    out.close();
    out.blank();
  }

  private static void scenario(final SourceWriter out, final StateMachine machine,
      final Scenario scenario) {
    final String tag = machine.getClassName().toUpperCase(Locale.ROOT);
    final String mock = mockClassName(machine);
    final MockExpectations expectations = scenario.getExpectations();
    out.line("@Test");
    out.open("public void " + scenario.getTestName() + "() throws StatechartException");
    out.line("logger.info(\"Check " + (scenario.getKind() == Scenario.Kind.CYCLE ? "cycle: "
        + State.INITIAL + " " : "path: ") + String.join(" ", scenario.getStates()) + "\");");
    out.line("final " + mock + " fsm = new " + mock + "();");
    for (Map.Entry<Arc, Integer> guard : expectations.getGuards().entrySet()) {
      if (guard.getValue() > 0) {
        final Transition transition = machine.getTransition(guard.getKey().getOrigin(),
            guard.getKey().getDestination());
        out.line("fsm." + guardResult(transition) + " = true;");
      }
    }
    out.line("fsm.enter();");

    final List<Scenario.Step> steps = scenario.getSteps();
    for (int i = 0; i < steps.size(); i++) {
      final Scenario.Step step = steps.get(i);
      final Transition transition = step.getTransition();
      if (step.isFire()) {
        out.blank();
        out.line("logger.info(\"[" + tag + "] Triggering event " + transition.getEvent().getName()
            + " [" + SourceWriter.escapeString(transition.getGuard().flatten()) + "]: "
            + transition.getOrigin() + " ==> " + transition.getDestination() + "\");");
        out.line("fsm." + transition.getEvent().caller("fsm") + ";");
      }
      if (step.isAssertAfter()) {
        final String destination = transition.getDestination();
        out.line("assertEquals(" + machine.getClassName() + ".States."
            + HookNames.stateEnum(destination) + ", fsm.state());");
        out.line("assertEquals(\"" + SourceWriter.escapeString(destination)
            + "\", fsm.stateName());");
      } else if (i == steps.size() - 1 && scenario.isUnreachableEnd()) {
        out.line("// WARNING: Malformed state machine: unreachable destination state "
            + transition.getDestination());
      }
    }

    out.blank();
    for (Map.Entry<Arc, Integer> action : expectations.getActions().entrySet()) {
      out.line("assertEquals(" + action.getValue() + ", fsm." + calls(HookNames.action(
          action.getKey().getOrigin(), action.getKey().getDestination())) + ");");
    }
    for (Map.Entry<String, Integer> entering : expectations.getEntering().entrySet()) {
      out.line("assertEquals(" + entering.getValue() + ", fsm."
          + calls(HookNames.entering(entering.getKey())) + ");");
    }
    for (Map.Entry<String, Integer> leaving : expectations.getLeaving().entrySet()) {
      out.line("assertEquals(" + leaving.getValue() + ", fsm."
          + calls(HookNames.leaving(leaving.getKey())) + ");");
    }
    out.close();
    out.blank();
  }

  static String guardResult(final Transition transition) {
    return HookNames.guard(transition.getOrigin(), transition.getDestination()) + "_result";
  }

  static String calls(final String hook) {
    return hook + "_calls";
  }
}
