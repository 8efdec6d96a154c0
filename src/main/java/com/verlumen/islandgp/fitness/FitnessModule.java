package com.verlumen.islandgp.fitness;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.util.concurrent.Executors;

public final class FitnessModule extends AbstractModule {
  private final int evaluationThreads;

  public static FitnessModule create(int evaluationThreads) {
    checkArgument(evaluationThreads > 0, "Evaluation threads must be positive: %s", evaluationThreads);
    return new FitnessModule(evaluationThreads);
  }

  private FitnessModule(int evaluationThreads) {
    this.evaluationThreads = evaluationThreads;
  }

  @Override
  protected void configure() {
    bind(FitnessEvaluator.class).to(FitnessEvaluatorImpl.class);
    bind(ProgramCompiler.class).to(InterpretingProgramCompiler.class);
  }

  @Provides
  @Singleton
  @EvaluationExecutor
  ListeningExecutorService provideEvaluationExecutor() {
    return MoreExecutors.listeningDecorator(
        Executors.newFixedThreadPool(
            evaluationThreads,
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("fitness-%d").build()));
  }
}
