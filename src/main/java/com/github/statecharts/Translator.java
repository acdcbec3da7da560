package com.github.statecharts;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StatechartException.Code;
import com.github.statecharts.analysis.Elaborator;
import com.github.statecharts.analysis.TestPlan;
import com.github.statecharts.analysis.TestSynthesizer;
import com.github.statecharts.analysis.TransitionTable;
import com.github.statecharts.analysis.TransitionTableSynthesizer;
import com.github.statecharts.analysis.Verifier;
import com.github.statecharts.builder.MachineRegistry;
import com.github.statecharts.builder.ModelBuilder;
import com.github.statecharts.emit.CodeEmitter;
import com.github.statecharts.emit.PlantUmlWriter;
import com.github.statecharts.emit.TestEmitter;
import com.github.statecharts.model.StateMachine;
import com.github.statecharts.syntax.DiagramReader;
import com.github.statecharts.syntax.SyntaxNode;

/**
 * Translates a PlantUML statechart into Java state machine classes and their unit tests.
 *
 * Pipeline, run for each machine of the diagram, root first: build, verify, elaborate the
 * event-less transitions, derive the transition tables and the test scenarios, then write the
 * interpreted diagram, the machine class and its test class.
 */
public final class Translator {
  private static final Logger logger = LogManager.getLogger(Translator.class.getSimpleName());

  private final TranslatorConfiguration config;

  public Translator(final TranslatorConfiguration config) {
    this.config = config;
  }

  public TranslationResult translate(final Path diagram) throws StatechartException {
    final SyntaxNode tree = new DiagramReader().read(diagram);
    final String fileName = diagram.getFileName().toString();
    final int dot = fileName.lastIndexOf('.');
    return translate(tree, dot > 0 ? fileName.substring(0, dot) : fileName, fileName);
  }

  /**
   * @param name the root state machine name, usually the diagram file name without extension
   * @param diagramName the diagram reference written in the generated files
   */
  public TranslationResult translate(final SyntaxNode tree, final String name,
      final String diagramName) throws StatechartException {
    logger.info("Translating " + diagramName + " with " + config);
    final Path directory = config.getOutputDirectory();
    try {
      Files.createDirectories(directory);
    } catch (IOException problem) {
      throw new StatechartException(Code.IO_FAILURE, problem);
    }

    final MachineRegistry registry =
        new ModelBuilder(config.getClassNameSuffix()).build(tree, name);
    final String generatedOn =
        LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME).substring(0, 19);
    final Verifier verifier = new Verifier(config.getMaxScenarios(), config.getMaxPathLength());
    final Elaborator elaborator = new Elaborator();
    final TransitionTableSynthesizer tableSynthesizer = new TransitionTableSynthesizer();
    final TestSynthesizer testSynthesizer =
        new TestSynthesizer(config.getMaxScenarios(), config.getMaxPathLength());
    final PlantUmlWriter plantUmlWriter = new PlantUmlWriter();
    final CodeEmitter codeEmitter =
        new CodeEmitter(config.getFlavor(), diagramName, generatedOn);
    final TestEmitter testEmitter = new TestEmitter(config.getFlavor(), diagramName, generatedOn);

    final List<Path> files = new ArrayList<>();
    final Map<String, List<String>> warnings = new LinkedHashMap<>();
    int scenarios = 0;
    try {
      for (StateMachine machine : registry.machines()) {
        verifier.verify(machine);
        elaborator.elaborate(machine);
        final List<TransitionTable> tables = tableSynthesizer.synthesize(machine);
        final TestPlan plan = testSynthesizer.synthesize(machine);
        scenarios += plan.size();
        files.add(plantUmlWriter.write(machine, directory));
        files.add(codeEmitter.write(machine, tables, directory));
        files.add(testEmitter.write(machine, plan, directory));
        warnings.put(machine.getName(), new ArrayList<>(machine.getWarnings()));
      }
      if (config.getSeparatedRunner()) {
        files.add(testEmitter.writeSuite(registry.getRoot(), registry.machines(), directory));
      }
    } finally {
      registry.demolish();
    }

    final TranslationResult result = new TranslationResult(name, files, warnings, scenarios);
    logger.info("Translated " + diagramName + ": " + result);
    return result;
  }
}
