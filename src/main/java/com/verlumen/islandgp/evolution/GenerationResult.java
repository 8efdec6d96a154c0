package com.verlumen.islandgp.evolution;

import com.google.auto.value.AutoValue;
import com.verlumen.islandgp.population.Forest;
import com.verlumen.islandgp.population.Individual;
import java.util.Optional;

/** The forest an island ended with and the best individual it has seen. */
@AutoValue
public abstract class GenerationResult {
  public static GenerationResult create(Forest forest, Optional<Individual> best) {
    return new AutoValue_GenerationResult(forest, best);
  }

  public abstract Forest forest();

  public abstract Optional<Individual> best();
}
