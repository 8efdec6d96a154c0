package com.verlumen.islandgp.evolution;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.inject.Inject;
import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.fitness.EvaluationException;
import com.verlumen.islandgp.population.Champions;
import com.verlumen.islandgp.population.Forest;
import com.verlumen.islandgp.population.Individual;
import com.verlumen.islandgp.population.Population;
import com.verlumen.islandgp.tree.Node;
import com.verlumen.islandgp.tree.RandomChoices;
import com.verlumen.islandgp.tree.TreeGenerator;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SplittableRandom;
import java.util.concurrent.ExecutionException;
import java.util.random.RandomGenerator;

final class IslandCoordinatorImpl implements IslandCoordinator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final GenerationEngine generationEngine;
  private final ListeningExecutorService executor;
  private final TreeGenerator treeGenerator;

  @Inject
  IslandCoordinatorImpl(
      GenerationEngine generationEngine,
      @IslandExecutor ListeningExecutorService executor,
      TreeGenerator treeGenerator) {
    this.generationEngine = generationEngine;
    this.executor = executor;
    this.treeGenerator = treeGenerator;
  }

  @Override
  public Forest buildForest(GpConfig config, RandomGenerator random) {
    List<Node> trees = new ArrayList<>(config.forestSize());
    for (int i = 0; i < config.forestSize(); i++) {
      trees.add(treeGenerator.buildTree(config.treeSpace(), random));
    }
    return Forest.ofTrees(trees);
  }

  @Override
  public Population buildPopulation(GpConfig config, RandomGenerator random) {
    List<Forest> forests = new ArrayList<>(config.popSize());
    for (int i = 0; i < config.popSize(); i++) {
      forests.add(buildForest(config, random));
    }
    return Population.of(forests);
  }

  @Override
  public Population migrate(Population population, RandomGenerator random) {
    List<Forest> migrated = new ArrayList<>(population.size());
    for (Forest forest : population.forests()) {
      Individual drawn = RandomChoices.pick(random, forest.individuals());
      List<Individual> shuffled = RandomChoices.shuffle(random, forest.individuals());
      shuffled.set(0, drawn);
      migrated.add(Forest.of(shuffled));
    }
    return Population.of(migrated);
  }

  @Override
  public RunResult run(GpConfig config) {
    SplittableRandom random = newRandom(config);
    return run(config, buildPopulation(config, random), Optional.empty(), random);
  }

  @Override
  public RunResult run(GpConfig config, Population population, Optional<Individual> best) {
    return run(config, population, best, newRandom(config));
  }

  private RunResult run(
      GpConfig config,
      Population population,
      Optional<Individual> best,
      SplittableRandom random) {
    checkArgument(
        population.size() == config.popSize(),
        "Expected %s forests but got %s",
        config.popSize(),
        population.size());
    for (Forest forest : population.forests()) {
      checkArgument(
          forest.size() == config.forestSize(),
          "Expected forests of %s but got %s",
          config.forestSize(),
          forest.size());
    }

    logger.atInfo().log(
        "Evolving %d islands of %d trees for %d cycles of %d generations",
        config.popSize(),
        config.forestSize(),
        config.cycles(),
        config.generations());
    Population current = population;
    Optional<Individual> champion = best;
    for (int remaining = config.cycles();
        remaining > 0 && !Champions.isPerfect(champion);
        remaining--) {
      if (champion.isPresent()
          && config.reportingMode().shouldReport(remaining, config.reportRate())) {
        config.reporter().report(champion, true);
      }

      ImmutableList<GenerationResult> results = evolveIslands(config, current, champion, random);
      current =
          migrate(
              Population.of(
                  results.stream().map(GenerationResult::forest).collect(toImmutableList())),
              random);
      champion = selectChampion(champion, results);
      logger.atInfo().log(
          "Cycle %d of %d finished, champion fitness %s",
          config.cycles() - remaining + 1,
          config.cycles(),
          champion.map(Individual::requireFitness).orElse(Double.NaN));
    }
    return RunResult.create(current, champion);
  }

  private ImmutableList<GenerationResult> evolveIslands(
      GpConfig config,
      Population population,
      Optional<Individual> champion,
      SplittableRandom random) {
    List<ListenableFuture<GenerationResult>> islands = new ArrayList<>(population.size());
    for (Forest forest : population.forests()) {
      // Split before dispatch so each island's random stream depends only on the seed.
      SplittableRandom islandRandom = random.split();
      islands.add(
          executor.submit(
              () ->
                  generationEngine.run(
                      config, config.generations(), forest, champion, islandRandom)));
    }

    ListenableFuture<List<GenerationResult>> all = Futures.allAsList(islands);
    try {
      return ImmutableList.copyOf(all.get());
    } catch (InterruptedException e) {
      all.cancel(true);
      Thread.currentThread().interrupt();
      throw new EvaluationException("Interrupted while evolving islands", e);
    } catch (ExecutionException e) {
      all.cancel(true);
      logger.atWarning().withCause(e.getCause()).log("Island evolution failed");
      Throwables.throwIfUnchecked(e.getCause());
      throw new UncheckedExecutionException(e.getCause());
    }
  }

  private static Optional<Individual> selectChampion(
      Optional<Individual> incumbent, ImmutableList<GenerationResult> results) {
    Optional<Individual> champion = incumbent;
    Optional<Individual> cycleBest = Optional.empty();
    for (GenerationResult result : results) {
      if (result.best().isPresent()) {
        cycleBest = Optional.of(Champions.keepBetter(cycleBest, result.best().get()));
      }
    }
    if (cycleBest.isPresent()) {
      champion = Optional.of(Champions.keepBetter(incumbent, cycleBest.get()));
    }
    return champion;
  }

  private static SplittableRandom newRandom(GpConfig config) {
    return config.seed().isPresent()
        ? new SplittableRandom(config.seed().getAsLong())
        : new SplittableRandom();
  }
}
