package com.verlumen.islandgp.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.islandgp.fitness.FitnessModule;
import com.verlumen.islandgp.selection.SelectionModule;
import com.verlumen.islandgp.tree.TreeModule;
import com.verlumen.islandgp.variation.VariationModule;
import java.util.concurrent.Executors;

/**
 * Wires the whole engine. Islands and fitness evaluation get separate thread pools so island
 * tasks blocked on scoring never hold the threads that do the scoring.
 */
@AutoValue
public abstract class EvolutionModule extends AbstractModule {
  /** Sizes both pools to the number of available processors. */
  public static EvolutionModule create() {
    int processors = Runtime.getRuntime().availableProcessors();
    return create(processors, processors);
  }

  public static EvolutionModule create(int islandThreads, int evaluationThreads) {
    checkArgument(islandThreads > 0, "Island threads must be positive: %s", islandThreads);
    return new AutoValue_EvolutionModule(islandThreads, evaluationThreads);
  }

  abstract int islandThreads();

  abstract int evaluationThreads();

  @Override
  protected void configure() {
    install(FitnessModule.create(evaluationThreads()));
    install(SelectionModule.create());
    install(TreeModule.create());
    install(VariationModule.create());
    bind(GenerationEngine.class).to(GenerationEngineImpl.class);
    bind(IslandCoordinator.class).to(IslandCoordinatorImpl.class);
  }

  @Provides
  @Singleton
  @IslandExecutor
  ListeningExecutorService provideIslandExecutor() {
    return MoreExecutors.listeningDecorator(
        Executors.newFixedThreadPool(
            islandThreads(),
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("island-%d").build()));
  }
}
