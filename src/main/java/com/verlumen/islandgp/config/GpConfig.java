package com.verlumen.islandgp.config;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.islandgp.tree.TreeSpace;
import io.jenetics.prog.op.Op;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Immutable settings for one genetic programming run.
 *
 * <p>{@link #builder()} pre-populates the tree-shape and variation defaults (constants in {@code
 * [-1, 1)}, depth {@code [2, 4]}, mutation rate 0.05, tournaments of 5) and a logging reporter.
 * {@link Builder#build()} validates the whole configuration before any evolution starts.
 */
@AutoValue
public abstract class GpConfig {
  public static Builder builder() {
    return new AutoValue_GpConfig.Builder()
        .termMin(GpDefaults.TERM_MIN)
        .termMax(GpDefaults.TERM_MAX)
        .depthMin(GpDefaults.DEPTH_MIN)
        .depthMax(GpDefaults.DEPTH_MAX)
        .mutationRate(GpDefaults.MUTATION_RATE)
        .tournamentSize(GpDefaults.TOURNAMENT_SIZE)
        .reportRate(GpDefaults.REPORT_RATE)
        .reportingMode(ReportingMode.NONZERO_REMAINDER)
        .reporter(LoggingProgressReporter.create());
  }

  /** Input symbols, in the order programs receive their arguments. */
  public abstract ImmutableList<String> symbols();

  /** Operators available to inner nodes; each carries its arity and display name. */
  public abstract ImmutableList<Op<Double>> functions();

  public abstract int termMin();

  public abstract int termMax();

  public abstract int depthMin();

  public abstract int depthMax();

  public abstract double mutationRate();

  public abstract int tournamentSize();

  /** Individuals per island. */
  public abstract int forestSize();

  /** Number of islands. */
  public abstract int popSize();

  /** Generations each island runs per coordinator cycle. */
  public abstract int generations();

  /** Coordinator cycles, each ending in a migration. */
  public abstract int cycles();

  public abstract int reportRate();

  public abstract ReportingMode reportingMode();

  public abstract ProgressReporter reporter();

  /** Input tuples, one value per symbol in symbol order. */
  public abstract ImmutableList<ImmutableList<Double>> tests();

  /** Expected outputs, one per test tuple. */
  public abstract ImmutableList<Double> expected();

  /** Seed for the run's random generator; runs with the same seed produce the same result. */
  public abstract OptionalLong seed();

  public abstract Builder toBuilder();

  @Memoized
  public TreeSpace treeSpace() {
    return TreeSpace.builder()
        .symbols(symbols())
        .functions(functions())
        .termMin(termMin())
        .termMax(termMax())
        .depthMin(depthMin())
        .depthMax(depthMax())
        .build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder symbols(ImmutableList<String> symbols);

    public Builder symbols(String... symbols) {
      return symbols(ImmutableList.copyOf(symbols));
    }

    public abstract Builder functions(ImmutableList<Op<Double>> functions);

    @SafeVarargs
    public final Builder functions(Op<Double>... functions) {
      return functions(ImmutableList.copyOf(functions));
    }

    public abstract Builder termMin(int termMin);

    public abstract Builder termMax(int termMax);

    public abstract Builder depthMin(int depthMin);

    public abstract Builder depthMax(int depthMax);

    public abstract Builder mutationRate(double mutationRate);

    public abstract Builder tournamentSize(int tournamentSize);

    public abstract Builder forestSize(int forestSize);

    public abstract Builder popSize(int popSize);

    public abstract Builder generations(int generations);

    public abstract Builder cycles(int cycles);

    public abstract Builder reportRate(int reportRate);

    public abstract Builder reportingMode(ReportingMode reportingMode);

    public abstract Builder reporter(ProgressReporter reporter);

    public abstract Builder tests(ImmutableList<ImmutableList<Double>> tests);

    public abstract Builder expected(ImmutableList<Double> expected);

    public abstract Builder seed(long seed);

    abstract GpConfig autoBuild();

    /**
     * Builds and validates the configuration.
     *
     * @throws IllegalArgumentException listing every problem found, if the configuration is invalid
     * @throws IllegalStateException if a setting without a default was never set
     */
    public GpConfig build() {
      GpConfig config = autoBuild();
      List<String> problems = validate(config);
      if (!problems.isEmpty()) {
        throw new IllegalArgumentException(
            "Invalid GP configuration: " + Joiner.on("; ").join(problems));
      }
      return config;
    }
  }

  private static List<String> validate(GpConfig config) {
    List<String> problems = new ArrayList<>();
    if (config.symbols().isEmpty()) {
      problems.add("symbols cannot be empty");
    } else if (ImmutableSet.copyOf(config.symbols()).size() != config.symbols().size()) {
      problems.add("symbols must be distinct: " + config.symbols());
    }
    if (config.functions().isEmpty()) {
      problems.add("functions cannot be empty");
    }
    for (Op<Double> function : config.functions()) {
      if (function.arity() < 0) {
        problems.add("function " + function.name() + " has negative arity " + function.arity());
      }
    }
    long termWidth = (long) config.termMax() - config.termMin();
    if (termWidth <= 0) {
      problems.add(
          "termMax (" + config.termMax() + ") must exceed termMin (" + config.termMin() + ")");
    } else if (termWidth > Integer.MAX_VALUE) {
      problems.add(
          "constant range [" + config.termMin() + ", " + config.termMax() + ") is too wide");
    }
    if (config.depthMin() < 0) {
      problems.add("depthMin cannot be negative: " + config.depthMin());
    }
    if (config.depthMax() < config.depthMin()) {
      problems.add(
          "depthMax (" + config.depthMax() + ") cannot be less than depthMin ("
              + config.depthMin() + ")");
    }
    if (!(config.mutationRate() >= 0 && config.mutationRate() <= 1)) {
      problems.add("mutationRate must be within [0, 1]: " + config.mutationRate());
    }
    if (config.forestSize() <= 0) {
      problems.add("forestSize must be positive: " + config.forestSize());
    }
    if (config.popSize() <= 0) {
      problems.add("popSize must be positive: " + config.popSize());
    }
    if (config.tournamentSize() < 2) {
      problems.add("tournamentSize must be at least 2: " + config.tournamentSize());
    } else if (config.tournamentSize() > config.forestSize()) {
      problems.add(
          "tournamentSize (" + config.tournamentSize() + ") cannot exceed forestSize ("
              + config.forestSize() + ")");
    }
    if (config.generations() < 0) {
      problems.add("generations cannot be negative: " + config.generations());
    }
    if (config.cycles() < 0) {
      problems.add("cycles cannot be negative: " + config.cycles());
    }
    if (config.reportRate() <= 0) {
      problems.add("reportRate must be positive: " + config.reportRate());
    }
    if (config.tests().size() != config.expected().size()) {
      problems.add(
          "tests (" + config.tests().size() + ") and expected (" + config.expected().size()
              + ") must have the same length");
    }
    for (int i = 0; i < config.tests().size(); i++) {
      if (config.tests().get(i).size() != config.symbols().size()) {
        problems.add(
            "test " + i + " has " + config.tests().get(i).size() + " values but there are "
                + config.symbols().size() + " symbols");
      }
    }
    return problems;
  }
}
