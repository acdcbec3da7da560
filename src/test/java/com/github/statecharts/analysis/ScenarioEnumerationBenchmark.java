package com.github.statecharts.analysis;

import org.openjdk.jmh.annotations.Benchmark;

import com.github.statecharts.StatechartException;
import com.github.statecharts.model.StateMachine;

public class ScenarioEnumerationBenchmark {
  // every state reaches every other one: the worst case of the cycle enumeration
  private static final String MESH = "[*] -> S0\n"
      + "S0 -> S1 : a\nS0 -> S2 : b\nS0 -> S3 : c\nS0 -> S4 : d\n"
      + "S1 -> S0 : a\nS1 -> S2 : b\nS1 -> S3 : c\nS1 -> S4 : d\n"
      + "S2 -> S0 : a\nS2 -> S1 : b\nS2 -> S3 : c\nS2 -> S4 : d\n"
      + "S3 -> S0 : a\nS3 -> S1 : b\nS3 -> S2 : c\nS3 -> S4 : d\n"
      + "S4 -> S0 : a\nS4 -> S1 : b\nS4 -> S2 : c\nS4 -> S3 : d\n";

  @Benchmark
  public void testScenarioSynthesis() throws StatechartException {
    // 1. build the model
    final StateMachine machine = Diagrams.root(MESH);

    // 2. check it
    new Verifier(1000, 64).verify(machine);

    // 3. elaborate and derive the tables
    new Elaborator().elaborate(machine);
    new TransitionTableSynthesizer().synthesize(machine);

    // 4. enumerate the test scenarios
    new TestSynthesizer(1000, 64).synthesize(machine);
  }

  public static void main(String args[]) throws StatechartException {
    ScenarioEnumerationBenchmark benchmark = new ScenarioEnumerationBenchmark();
    benchmark.testScenarioSynthesis();
  }

}
