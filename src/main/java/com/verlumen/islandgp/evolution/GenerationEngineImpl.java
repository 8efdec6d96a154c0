package com.verlumen.islandgp.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.fitness.FitnessEvaluator;
import com.verlumen.islandgp.population.Champions;
import com.verlumen.islandgp.population.Forest;
import com.verlumen.islandgp.population.Individual;
import com.verlumen.islandgp.selection.Selector;
import com.verlumen.islandgp.tree.Node;
import com.verlumen.islandgp.variation.GeneticOperators;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

final class GenerationEngineImpl implements GenerationEngine {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final FitnessEvaluator fitnessEvaluator;
  private final GeneticOperators geneticOperators;
  private final Selector selector;

  @Inject
  GenerationEngineImpl(
      FitnessEvaluator fitnessEvaluator, GeneticOperators geneticOperators, Selector selector) {
    this.fitnessEvaluator = fitnessEvaluator;
    this.geneticOperators = geneticOperators;
    this.selector = selector;
  }

  @Override
  public GenerationResult run(
      GpConfig config,
      int generations,
      Forest forest,
      Optional<Individual> best,
      RandomGenerator random) {
    checkArgument(generations >= 0, "Generations cannot be negative: %s", generations);
    checkArgument(forest.size() > 0, "Cannot evolve an empty forest");

    Forest current = forest;
    Optional<Individual> champion = best;
    for (int remaining = generations;
        remaining > 0 && !Champions.isPerfect(champion);
        remaining--) {
      if (config.reportingMode().shouldReport(remaining, config.reportRate())) {
        config.reporter().report(champion, false);
      }

      Forest scored = fitnessEvaluator.scoreForest(config, current);
      Individual generationBest = selector.bestOf(scored);
      Individual nextChampion = Champions.keepBetter(champion, generationBest);

      List<Node> offspring = new ArrayList<>(scored.size());
      for (Node child : selector.tournamentSelect(config, scored, random)) {
        offspring.add(geneticOperators.mutate(config, child, random));
      }
      // Elitism starts once a champion has been carried in; a fresh island skips it.
      if (champion.isPresent()) {
        offspring.set(0, nextChampion.tree());
      }

      logger.atFine().log(
          "Generation %d: best=%s champion=%s",
          generations - remaining + 1,
          generationBest.requireFitness(),
          nextChampion.requireFitness());
      current = Forest.ofTrees(ImmutableList.copyOf(offspring));
      champion = Optional.of(nextChampion);
    }
    return GenerationResult.create(current, champion);
  }
}
