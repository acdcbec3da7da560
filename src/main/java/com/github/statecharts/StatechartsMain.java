package com.github.statecharts;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.emit.Flavor;

/**
 * Command line entry point:
 * {@code <diagram> source|header [suffix] [--output DIR] [--max-scenarios N]
 * [--max-path-length N] [--separated-runner]}.
 */
public final class StatechartsMain {
  private static final Logger logger = LogManager.getLogger(StatechartsMain.class.getSimpleName());

  public static void main(String[] args) {
    final int status = run(args, System.out);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Parse the arguments and translate, returns the process exit status.
   */
  static int run(final String[] args, final PrintStream console) {
    final List<String> positionals = new ArrayList<>();
    Path outputDirectory = null;
    int maxScenarios = 0;
    int maxPathLength = 0;
    boolean separatedRunner = false;
    try {
      for (int i = 0; i < args.length; i++) {
        switch (args[i]) {
          case "--output":
            if (i + 1 >= args.length) {
              return usage(console);
            }
            outputDirectory = Paths.get(args[++i]);
            break;
          case "--max-scenarios":
            if (i + 1 >= args.length) {
              return usage(console);
            }
            maxScenarios = Integer.parseInt(args[++i]);
            break;
          case "--max-path-length":
            if (i + 1 >= args.length) {
              return usage(console);
            }
            maxPathLength = Integer.parseInt(args[++i]);
            break;
          case "--separated-runner":
            separatedRunner = true;
            break;
          default:
            if (args[i].startsWith("--")) {
              console.println("Unknown option " + args[i]);
              return usage(console);
            }
            positionals.add(args[i]);
        }
      }
    } catch (NumberFormatException problem) {
      console.println("Invalid number: " + problem.getMessage());
      return usage(console);
    }
    if (positionals.size() < 2 || positionals.size() > 3) {
      return usage(console);
    }
    final Flavor flavor = Flavor.fromArgument(positionals.get(1));
    if (flavor == null) {
      console.println("Invalid " + positionals.get(1) + ". Please set instead \"source\" (for"
          + " generating a concrete class) or \"header\" (for generating an abstract class)");
      return usage(console);
    }

    try {
      final TranslatorConfiguration config =
          TranslatorConfiguration.TranslatorConfigurationBuilder.newBuilder().flavor(flavor)
              .classNameSuffix(positionals.size() == 3 ? positionals.get(2) : "")
              .outputDirectory(outputDirectory).maxScenarios(maxScenarios)
              .maxPathLength(maxPathLength).separatedRunner(separatedRunner).build();
      final TranslationResult result =
          new Translator(config).translate(Paths.get(positionals.get(0)));
      for (Path file : result.getFiles()) {
        console.println("Generated " + file);
      }
      return 0;
    } catch (StatechartException problem) {
      logger.error("Translation failed with " + problem.getCode() + ": " + problem.getMessage(),
          problem);
      return 1;
    }
  }

  private static int usage(final PrintStream console) {
    console.println("Command line: StatechartsMain <plantuml file> source|header [suffix]"
        + " [--output DIR] [--max-scenarios N] [--max-path-length N] [--separated-runner]");
    console.println("Where:");
    console.println("   <plantuml file>: the path of a plantuml statechart");
    console.println("   \"source\" or \"header\": to choose between generating a concrete state"
        + " machine class or an abstract one");
    console.println("   [suffix]: is an optional suffix to extend the name of the state machine"
        + " class");
    console.println("   --output DIR: the directory of the generated files, default is the"
        + " current directory");
    console.println("   --max-scenarios N: bound the number of generated cycle and path tests");
    console.println("   --max-path-length N: bound the number of states of a generated test");
    console.println("   --separated-runner: also generate a JUnit suite running all the tests");
    console.println("Example:");
    console.println("   StatechartsMain Motor.plantuml source Controller");
    console.println("Will create a MotorController.java file with a state machine class"
        + " MotorController");
    return 1;
  }
}
