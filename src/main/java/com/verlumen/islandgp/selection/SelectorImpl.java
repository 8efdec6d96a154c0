package com.verlumen.islandgp.selection;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.population.Forest;
import com.verlumen.islandgp.population.Individual;
import com.verlumen.islandgp.tree.Node;
import com.verlumen.islandgp.tree.RandomChoices;
import com.verlumen.islandgp.variation.GeneticOperators;
import java.util.random.RandomGenerator;

final class SelectorImpl implements Selector {
  private final GeneticOperators geneticOperators;

  @Inject
  SelectorImpl(GeneticOperators geneticOperators) {
    this.geneticOperators = geneticOperators;
  }

  @Override
  public Node tournamentOnce(GpConfig config, Forest scoredForest, RandomGenerator random) {
    ImmutableList.Builder<Individual> sampled =
        ImmutableList.builderWithExpectedSize(config.tournamentSize());
    for (int i = 0; i < config.tournamentSize(); i++) {
      sampled.add(RandomChoices.pick(random, scoredForest.individuals()));
    }
    // sortedCopyOf is stable, so ties keep sampling order.
    ImmutableList<Individual> ranked =
        ImmutableList.sortedCopyOf(Individual.BY_FITNESS, sampled.build());
    return geneticOperators.crossover(ranked.get(0).tree(), ranked.get(1).tree(), random);
  }

  @Override
  public ImmutableList<Node> tournamentSelect(
      GpConfig config, Forest scoredForest, RandomGenerator random) {
    ImmutableList.Builder<Node> offspring =
        ImmutableList.builderWithExpectedSize(scoredForest.size());
    for (int i = 0; i < scoredForest.size(); i++) {
      offspring.add(tournamentOnce(config, scoredForest, random));
    }
    return offspring.build();
  }

  @Override
  public Individual bestOf(Forest scoredForest) {
    checkArgument(scoredForest.size() > 0, "Cannot pick the best of an empty forest");
    Individual best = scoredForest.individuals().get(0);
    for (Individual candidate : scoredForest.individuals()) {
      if (Individual.BY_FITNESS.compare(candidate, best) < 0) {
        best = candidate;
      }
    }
    return best;
  }
}
