package com.verlumen.islandgp.population;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.islandgp.tree.Node;
import java.util.Collection;

/** The population of one island for one generation. */
@AutoValue
public abstract class Forest {
  public static Forest of(Collection<Individual> individuals) {
    return new AutoValue_Forest(ImmutableList.copyOf(individuals));
  }

  /** Creates a forest of unscored individuals, one per tree. */
  public static Forest ofTrees(Collection<? extends Node> trees) {
    return of(trees.stream().map(Individual::unscored).collect(toImmutableList()));
  }

  public abstract ImmutableList<Individual> individuals();

  public int size() {
    return individuals().size();
  }

  public ImmutableList<Node> trees() {
    return individuals().stream().map(Individual::tree).collect(toImmutableList());
  }
}
