package com.verlumen.islandgp.evolution;

import com.google.auto.value.AutoValue;
import com.verlumen.islandgp.population.Individual;
import com.verlumen.islandgp.population.Population;
import java.util.Optional;

/**
 * Outcome of a run: the final population and the global champion. Passing both back to {@link
 * GeneticProgramming#resume} continues the search.
 */
@AutoValue
public abstract class RunResult {
  public static RunResult create(Population population, Optional<Individual> best) {
    return new AutoValue_RunResult(population, best);
  }

  public abstract Population population();

  /** The best individual found, absent only if no generation ran. */
  public abstract Optional<Individual> best();
}
