package com.verlumen.islandgp.evolution;

import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.population.Forest;
import com.verlumen.islandgp.population.Individual;
import java.util.Optional;
import java.util.random.RandomGenerator;

/** Evolves a single island. */
public interface GenerationEngine {
  /**
   * Runs up to {@code generations} rounds of scoring, tournament selection, crossover and
   * mutation, stopping early once the best individual has zero error.
   *
   * <p>Each round keeps the better of {@code best} and the round's fittest individual (the
   * incumbent wins ties). When there was an incumbent, its successor's tree replaces the first
   * slot of the next forest.
   *
   * @param forest the island's current trees; the returned forest has the same size
   * @param best the champion carried into this run, if any
   */
  GenerationResult run(
      GpConfig config,
      int generations,
      Forest forest,
      Optional<Individual> best,
      RandomGenerator random);
}
