package com.github.statecharts;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.file.Paths;

import org.junit.Test;

import com.github.statecharts.StatechartException.Code;
import com.github.statecharts.TranslatorConfiguration.TranslatorConfigurationBuilder;
import com.github.statecharts.emit.Flavor;

/**
 * Tests to maintain the sanity and correctness of the translator configuration.
 */
public class TranslatorConfigurationTest {

  @Test
  public void testDefaults() throws StatechartException {
    final TranslatorConfiguration config =
        TranslatorConfigurationBuilder.newBuilder().flavor(Flavor.SOURCE).build();
    assertEquals(Flavor.SOURCE, config.getFlavor());
    assertEquals("", config.getClassNameSuffix());
    assertEquals(Paths.get("."), config.getOutputDirectory());
    assertEquals(TranslatorConfiguration.DEFAULT_MAX_SCENARIOS, config.getMaxScenarios());
    assertEquals(TranslatorConfiguration.DEFAULT_MAX_PATH_LENGTH, config.getMaxPathLength());
    assertFalse(config.getSeparatedRunner());
  }

  @Test
  public void testExplicitValues() throws StatechartException {
    final TranslatorConfiguration config = TranslatorConfigurationBuilder.newBuilder()
        .flavor(Flavor.HEADER).classNameSuffix("Impl").outputDirectory(Paths.get("out"))
        .maxScenarios(5).maxPathLength(-1).separatedRunner(true).build();
    assertEquals("Impl", config.getClassNameSuffix());
    assertEquals(Paths.get("out"), config.getOutputDirectory());
    assertEquals(5, config.getMaxScenarios());
    assertEquals(TranslatorConfiguration.DEFAULT_MAX_PATH_LENGTH, config.getMaxPathLength());
    assertTrue(config.getSeparatedRunner());
  }

  @Test
  public void testFlavorIsMandatory() {
    try {
      TranslatorConfigurationBuilder.newBuilder().build();
      fail("a configuration without flavor must be refused");
    } catch (StatechartException expected) {
      assertEquals(Code.INVALID_CONFIG, expected.getCode());
    }
  }

  @Test
  public void testSuffixMustFitAnIdentifier() {
    try {
      TranslatorConfigurationBuilder.newBuilder().flavor(Flavor.SOURCE).classNameSuffix("a-b")
          .build();
      fail("a suffix which is not part of an identifier must be refused");
    } catch (StatechartException expected) {
      assertEquals(Code.INVALID_CONFIG, expected.getCode());
    }
  }
}
