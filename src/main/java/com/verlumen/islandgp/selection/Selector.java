package com.verlumen.islandgp.selection;

import com.google.common.collect.ImmutableList;
import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.population.Forest;
import com.verlumen.islandgp.population.Individual;
import com.verlumen.islandgp.tree.Node;
import java.util.random.RandomGenerator;

/** Fitness-biased parent selection over a scored forest. */
public interface Selector {
  /**
   * Samples {@code config.tournamentSize()} individuals with replacement and returns the crossover
   * of the two fittest. Equal fitness keeps sampling order.
   */
  Node tournamentOnce(GpConfig config, Forest scoredForest, RandomGenerator random);

  /** Runs one tournament per individual of the forest and returns the unscored offspring. */
  ImmutableList<Node> tournamentSelect(GpConfig config, Forest scoredForest, RandomGenerator random);

  /** Returns the individual with the lowest fitness, the first one on ties. */
  Individual bestOf(Forest scoredForest);
}
