package com.github.statecharts;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * This object encapsulates the outcome of the translation of one diagram: the generated files
 * and, per state machine, the warnings found while translating it.
 *
 * A translation either succeeds with this result or fails with a {@link StatechartException};
 * warnings never make it fail.
 */
public final class TranslationResult {
  private final String rootName;
  private final List<Path> files;
  private final Map<String, List<String>> warnings;
  private final int scenarios;

  public TranslationResult(final String rootName, final List<Path> files,
      final Map<String, List<String>> warnings, final int scenarios) {
    this.rootName = rootName;
    this.files = Collections.unmodifiableList(new ArrayList<>(files));
    this.warnings = Collections.unmodifiableMap(new LinkedHashMap<>(warnings));
    this.scenarios = scenarios;
  }

  public String getRootName() {
    return rootName;
  }

  public List<Path> getFiles() {
    return files;
  }

  /**
   * Warnings keyed by state machine name, root machine first.
   */
  public Map<String, List<String>> getWarnings() {
    return warnings;
  }

  public int getWarningCount() {
    int count = 0;
    for (List<String> machineWarnings : warnings.values()) {
      count += machineWarnings.size();
    }
    return count;
  }

  public int getMachineCount() {
    return warnings.size();
  }

  /**
   * Number of generated test methods, all machines included.
   */
  public int getScenarios() {
    return scenarios;
  }

  @Override
  public String toString() {
    return "TranslationResult [rootName=" + rootName + ", machines=" + getMachineCount()
        + ", files=" + files.size() + ", warnings=" + getWarningCount() + ", scenarios="
        + scenarios + "]";
  }
}
