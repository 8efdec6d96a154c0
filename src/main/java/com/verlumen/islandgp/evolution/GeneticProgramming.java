package com.verlumen.islandgp.evolution;

import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.fitness.EvaluationExecutor;
import java.time.Duration;

/**
 * Entry point: evolves programs that fit the configured test cases.
 *
 * <p>Each instance owns the island and evaluation thread pools of its injector. Reuse one instance
 * across runs and {@link #close()} it when done.
 */
public final class GeneticProgramming implements AutoCloseable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final IslandCoordinator islandCoordinator;
  private final ListeningExecutorService islandExecutor;
  private final ListeningExecutorService evaluationExecutor;

  /** Creates an engine wired with the default {@link EvolutionModule}. */
  public static GeneticProgramming create() {
    return Guice.createInjector(EvolutionModule.create()).getInstance(GeneticProgramming.class);
  }

  @Inject
  GeneticProgramming(
      IslandCoordinator islandCoordinator,
      @IslandExecutor ListeningExecutorService islandExecutor,
      @EvaluationExecutor ListeningExecutorService evaluationExecutor) {
    this.islandCoordinator = islandCoordinator;
    this.islandExecutor = islandExecutor;
    this.evaluationExecutor = evaluationExecutor;
  }

  /** Evolves a fresh population; {@code result.best()} holds the best program found. */
  public RunResult runGp(GpConfig config) {
    return islandCoordinator.run(config);
  }

  /** Continues a previous run for another {@code config.cycles()} cycles. */
  public RunResult resume(GpConfig config, RunResult previous) {
    return islandCoordinator.run(config, previous.population(), previous.best());
  }

  /** Shuts down both thread pools, waiting briefly for running tasks to finish. */
  @Override
  public void close() {
    boolean islandsStopped =
        MoreExecutors.shutdownAndAwaitTermination(islandExecutor, SHUTDOWN_TIMEOUT);
    boolean evaluationStopped =
        MoreExecutors.shutdownAndAwaitTermination(evaluationExecutor, SHUTDOWN_TIMEOUT);
    if (!islandsStopped || !evaluationStopped) {
      logger.atWarning().log("Thread pools did not terminate within %s", SHUTDOWN_TIMEOUT);
    }
  }
}
