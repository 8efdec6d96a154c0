package com.verlumen.islandgp.evolution;

import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.population.Forest;
import com.verlumen.islandgp.population.Individual;
import com.verlumen.islandgp.population.Population;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Evolves several islands in parallel, reshuffles them between cycles and tracks the global
 * champion.
 */
public interface IslandCoordinator {
  /** Builds a forest of {@code config.forestSize()} freshly generated trees. */
  Forest buildForest(GpConfig config, RandomGenerator random);

  /** Builds {@code config.popSize()} fresh forests. */
  Population buildPopulation(GpConfig config, RandomGenerator random);

  /**
   * For every forest, draws one of its own members, shuffles the forest, drops its first slot and
   * puts the drawn member in front. Forest sizes are preserved; no individual moves between
   * islands.
   */
  Population migrate(Population population, RandomGenerator random);

  /** Runs {@code config.cycles()} cycles starting from a freshly built population. */
  RunResult run(GpConfig config);

  /**
   * Runs {@code config.cycles()} cycles starting from {@code population}, stopping early once the
   * champion has zero error.
   *
   * @throws IllegalArgumentException if the population's shape does not match the configuration
   * @throws com.verlumen.islandgp.fitness.EvaluationException if a candidate program fails
   */
  RunResult run(GpConfig config, Population population, Optional<Individual> best);
}
