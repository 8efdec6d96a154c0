package com.verlumen.islandgp.population;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.verlumen.islandgp.tree.Node;
import java.util.Comparator;
import java.util.OptionalDouble;

/**
 * A candidate program paired with its fitness. Fitness is absent until the individual has been
 * scored; lower is better and exactly zero means the program matches every test case.
 */
@AutoValue
public abstract class Individual {
  /** Orders scored individuals from fittest (lowest error) to least fit. */
  public static final Comparator<Individual> BY_FITNESS =
      Comparator.comparingDouble(Individual::requireFitness);

  public static Individual unscored(Node tree) {
    return new AutoValue_Individual(tree, OptionalDouble.empty());
  }

  public static Individual scored(Node tree, double fitness) {
    checkArgument(!(fitness < 0), "Fitness cannot be negative: %s", fitness);
    return new AutoValue_Individual(tree, OptionalDouble.of(fitness));
  }

  public abstract Node tree();

  public abstract OptionalDouble fitness();

  public boolean isScored() {
    return fitness().isPresent();
  }

  /** Returns the fitness, failing if this individual has not been scored. */
  public double requireFitness() {
    checkState(isScored(), "Individual has not been scored: %s", tree());
    return fitness().getAsDouble();
  }

  /** Returns true if this individual was scored with an error of exactly zero. */
  public boolean isPerfect() {
    return isScored() && fitness().getAsDouble() == 0;
  }
}
