package com.github.statecharts;

import java.nio.file.Path;
import java.nio.file.Paths;

import com.github.statecharts.emit.Flavor;

/**
 * This class encapsulates all the configuration parameters of the Translator. Use the
 * {@code TranslatorConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. if no output directory is set, files are generated in the current working directory<br>
 * 2. cycles and paths are enumerated depth first, which is exponential in the worst case. The
 * number of scenarios per kind and the number of states per scenario are bounded; when a bound is
 * hit the scenarios are truncated and a warning is attached to the machine. Non positive bounds
 * fall back to the defaults<br>
 * 3. the separated runner is a JUnit suite aggregating the tests of all generated machines<br>
 */
public final class TranslatorConfiguration {
  public static final int DEFAULT_MAX_SCENARIOS = 1000;
  public static final int DEFAULT_MAX_PATH_LENGTH = 64;

  private final Flavor flavor;
  private final String classNameSuffix;
  private final Path outputDirectory;
  private final int maxScenarios;
  private final int maxPathLength;
  private final boolean separatedRunner;

  public Flavor getFlavor() {
    return flavor;
  }

  public String getClassNameSuffix() {
    return classNameSuffix;
  }

  public Path getOutputDirectory() {
    return outputDirectory;
  }

  public int getMaxScenarios() {
    return maxScenarios;
  }

  public int getMaxPathLength() {
    return maxPathLength;
  }

  public boolean getSeparatedRunner() {
    return separatedRunner;
  }

  public final static class TranslatorConfigurationBuilder {
    private Flavor flavor;
    private String classNameSuffix;
    private Path outputDirectory;
    private int maxScenarios;
    private int maxPathLength;
    private boolean separatedRunner;

    public static TranslatorConfigurationBuilder newBuilder() {
      return new TranslatorConfigurationBuilder();
    }

    public TranslatorConfigurationBuilder flavor(final Flavor flavor) {
      this.flavor = flavor;
      return this;
    }

    public TranslatorConfigurationBuilder classNameSuffix(final String classNameSuffix) {
      this.classNameSuffix = classNameSuffix;
      return this;
    }

    public TranslatorConfigurationBuilder outputDirectory(final Path outputDirectory) {
      this.outputDirectory = outputDirectory;
      return this;
    }

    public TranslatorConfigurationBuilder maxScenarios(final int maxScenarios) {
      this.maxScenarios = maxScenarios;
      return this;
    }

    public TranslatorConfigurationBuilder maxPathLength(final int maxPathLength) {
      this.maxPathLength = maxPathLength;
      return this;
    }

    public TranslatorConfigurationBuilder separatedRunner(final boolean separatedRunner) {
      this.separatedRunner = separatedRunner;
      return this;
    }

    public TranslatorConfiguration build() throws StatechartException {
      final TranslatorConfiguration config = new TranslatorConfiguration(flavor, classNameSuffix,
          outputDirectory, maxScenarios, maxPathLength, separatedRunner);
      config.validate();
      return config;
    }

    private TranslatorConfigurationBuilder() {}
  }

  private void validate() throws StatechartException {
    StringBuilder messages = new StringBuilder();
    if (flavor == null) {
      messages.append("Flavor cannot be null. ");
    }
    if (!classNameSuffix.isEmpty() && !classNameSuffix.matches("[A-Za-z0-9_]+")) {
      messages.append("Class name suffix must be a valid part of a Java identifier. ");
    }
    if (messages.length() > 0) {
      throw new StatechartException(StatechartException.Code.INVALID_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "TranslatorConfiguration [flavor=" + flavor + ", classNameSuffix=" + classNameSuffix
        + ", outputDirectory=" + outputDirectory + ", maxScenarios=" + maxScenarios
        + ", maxPathLength=" + maxPathLength + ", separatedRunner=" + separatedRunner + "]";
  }

  private TranslatorConfiguration(final Flavor flavor, final String classNameSuffix,
      final Path outputDirectory, final int maxScenarios, final int maxPathLength,
      final boolean separatedRunner) {
    this.flavor = flavor;
    this.classNameSuffix = classNameSuffix == null ? "" : classNameSuffix.trim();
    this.outputDirectory = outputDirectory == null ? Paths.get(".") : outputDirectory;
    this.maxScenarios = maxScenarios <= 0 ? DEFAULT_MAX_SCENARIOS : maxScenarios;
    this.maxPathLength = maxPathLength <= 0 ? DEFAULT_MAX_PATH_LENGTH : maxPathLength;
    this.separatedRunner = separatedRunner;
  }

}
