package com.github.statecharts;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hamcrest.Matcher;
import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.JUnitCore;
import org.junit.runner.Result;
import org.junit.runner.notification.Failure;

import com.github.statecharts.TranslatorConfiguration.TranslatorConfigurationBuilder;
import com.github.statecharts.emit.Flavor;
import com.github.statecharts.runtime.AbstractStateMachine;

/**
 * End to end translations of the diagram fixtures.
 */
public class TranslatorTest {
  private static final Logger logger = LogManager.getLogger(TranslatorTest.class.getSimpleName());

  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testMotor() throws Exception {
    final File output = folder.newFolder("motor");
    final TranslationResult result = translator(Flavor.SOURCE, "", output, false)
        .translate(fixture("Motor.plantuml"));
    logger.info(result);
    assertEquals("Motor", result.getRootName());
    assertEquals(1, result.getMachineCount());
    assertEquals(1, result.getScenarios());
    assertEquals(0, result.getWarningCount());
    assertEquals(Arrays.asList("Motor-interpreted.plantuml", "Motor.java", "MotorTest.java"),
        names(result.getFiles()));
    final String code = new String(
        Files.readAllBytes(output.toPath().resolve("Motor.java")), StandardCharsets.UTF_8);
    assertTrue(code.contains("public class Motor extends AbstractStateMachine<Motor.States>"));
    assertTrue(code.contains("from Motor.plantuml"));
  }

  @Test
  public void testLampWithSuffixAndRunner() throws Exception {
    final File output = folder.newFolder("lamp");
    final TranslationResult result = translator(Flavor.HEADER, "Impl", output, true)
        .translate(fixture("Lamp.plantuml"));
    assertEquals(2, result.getMachineCount());
    assertEquals(2, result.getScenarios());
    assertEquals(Arrays.asList("Lamp-interpreted.plantuml", "LampImpl.java", "LampImplTest.java",
        "ON-interpreted.plantuml", "NestedONImpl.java", "NestedONImplTest.java",
        "LampImplAllTests.java"), names(result.getFiles()));
    for (Path file : result.getFiles()) {
      assertTrue(file + " is missing", Files.isRegularFile(file));
    }
    final String code = new String(
        Files.readAllBytes(output.toPath().resolve("LampImpl.java")), StandardCharsets.UTF_8);
    assertTrue(code.contains("package com.example.lamp;"));
    assertTrue(code.contains(" * Lamp with a dimmable light."));
    assertTrue(code.contains("public abstract class LampImpl"));
    assertTrue(code.contains("protected abstract NestedONImpl newNestedONImpl();"));
    assertTrue(code.contains("/** nothing is lit */"));
  }

  @Test
  public void testOutputDirectoryIsCreated() throws Exception {
    final File output = new File(folder.getRoot(), "deep/down");
    translator(Flavor.SOURCE, "", output, false).translate(fixture("Motor.plantuml"));
    assertTrue(new File(output, "MotorTest.java").isFile());
  }

  @Test
  public void testGeneratedMotorCompilesAndPasses() throws Exception {
    compileAndRun("Motor", "@startuml\n"
        + "[*] -> IDLE\n"
        + "IDLE -> RUNNING : start [ready] / count = 0\n"
        + "RUNNING -> IDLE : stop / ready = false\n"
        + "RUNNING -> RUNNING : tick [count < 3] / count++\n"
        + "RUNNING : entry / logger.info(\"running\")\n"
        + "'[code] private boolean ready;\n"
        + "'[code] private int count;\n"
        + "@enduml\n", 1);
  }

  @Test
  public void testGeneratedNestedMachinesCompileAndPass() throws Exception {
    compileAndRun("Lamp", "@startuml\n"
        + "'[code] private boolean broken;\n"
        + "[*] --> OFF\n"
        + "OFF --> ON : switch on [!broken]\n"
        + "ON --> OFF : switch off / logger.info(\"off\")\n"
        + "state ON {\n"
        + "  '[code] private int level;\n"
        + "  [*] --> DIM\n"
        + "  DIM --> BRIGHT : brighter(int step) [level < 10] / level += step\n"
        + "  BRIGHT --> DIM : dimmer\n"
        + "  BRIGHT : entry / logger.info(\"bright\")\n"
        + "  BRIGHT : exit / logger.info(\"dim\")\n"
        + "}\n"
        + "@enduml\n", 2);
  }

  @Test
  public void testGeneratedInternalChainCompilesAndPasses() throws Exception {
    compileAndRun("Chain", "@startuml\n"
        + "[*] -> IDLE\n"
        + "IDLE -> A : go\n"
        + "A -> B\n"
        + "B -> IDLE\n"
        + "@enduml\n", 1);
  }

  /**
   * Translate the diagram, compile every generated class and run every generated test class.
   */
  private void compileAndRun(final String name, final String diagram, final int expectedRuns)
      throws Exception {
    final JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
    Assume.assumeNotNull(compiler);

    final File workspace = folder.newFolder(name.toLowerCase(Locale.ROOT));
    final Path source = workspace.toPath().resolve(name + ".plantuml");
    Files.write(source, diagram.getBytes(StandardCharsets.UTF_8));
    final File output = new File(workspace, "generated");
    final TranslationResult result =
        translator(Flavor.SOURCE, "", output, false).translate(source);

    final File classes = new File(workspace, "classes");
    assertTrue(classes.mkdir());
    final List<String> arguments = new ArrayList<>(
        Arrays.asList("-proc:none", "-classpath", classpath(), "-d", classes.getPath()));
    final List<String> testClasses = new ArrayList<>();
    for (Path file : result.getFiles()) {
      final String fileName = file.getFileName().toString();
      if (fileName.endsWith(".java")) {
        arguments.add(file.toString());
        if (fileName.endsWith("Test.java")) {
          testClasses.add(fileName.substring(0, fileName.length() - ".java".length()));
        }
      }
    }
    final ByteArrayOutputStream errors = new ByteArrayOutputStream();
    final int status = compiler.run(null, null, errors, arguments.toArray(new String[0]));
    assertEquals(errors.toString(StandardCharsets.UTF_8.name()), 0, status);

    int runs = 0;
    try (URLClassLoader loader = new URLClassLoader(new URL[] {classes.toURI().toURL()},
        TranslatorTest.class.getClassLoader())) {
      for (String testClass : testClasses) {
        final Result run = JUnitCore.runClasses(loader.loadClass(testClass));
        final StringBuilder failures = new StringBuilder(testClass);
        for (Failure failure : run.getFailures()) {
          failures.append('\n').append(failure.toString());
        }
        assertTrue(failures.toString(), run.wasSuccessful());
        runs += run.getRunCount();
      }
    }
    logger.info("Ran " + runs + " generated tests of " + testClasses);
    assertEquals(expectedRuns, runs);
  }

  /**
   * The test class path plus the locations of the classes the generated code imports.
   */
  private static String classpath() throws Exception {
    final StringBuilder classpath = new StringBuilder(System.getProperty("java.class.path"));
    for (Class<?> imported : Arrays.<Class<?>>asList(AbstractStateMachine.class,
        LogManager.class, Test.class, Matcher.class)) {
      classpath.append(File.pathSeparator).append(Paths.get(
          imported.getProtectionDomain().getCodeSource().getLocation().toURI()));
    }
    return classpath.toString();
  }

  private static Translator translator(final Flavor flavor, final String suffix,
      final File output, final boolean runner) throws StatechartException {
    return new Translator(TranslatorConfigurationBuilder.newBuilder().flavor(flavor)
        .classNameSuffix(suffix).outputDirectory(output.toPath()).separatedRunner(runner)
        .build());
  }

  static Path fixture(final String name) throws Exception {
    return Paths.get(TranslatorTest.class.getResource("/diagrams/" + name).toURI());
  }

  private static List<String> names(final List<Path> files) {
    final List<String> names = new ArrayList<>();
    for (Path file : files) {
      names.add(file.getFileName().toString());
    }
    return names;
  }
}
