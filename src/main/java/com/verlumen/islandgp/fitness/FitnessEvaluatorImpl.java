package com.verlumen.islandgp.fitness;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.inject.Inject;
import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.population.Forest;
import com.verlumen.islandgp.population.Individual;
import com.verlumen.islandgp.tree.Node;
import java.util.List;
import java.util.concurrent.ExecutionException;

final class FitnessEvaluatorImpl implements FitnessEvaluator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ProgramCompiler programCompiler;
  private final ListeningExecutorService executor;

  @Inject
  FitnessEvaluatorImpl(
      ProgramCompiler programCompiler, @EvaluationExecutor ListeningExecutorService executor) {
    this.programCompiler = programCompiler;
    this.executor = executor;
  }

  @Override
  public double score(GpConfig config, Node tree) {
    Program program = programCompiler.compile(config.symbols(), tree);
    double error = 0;
    for (int i = 0; i < config.tests().size(); i++) {
      double produced = program.apply(toArguments(config.tests().get(i)));
      error += offBy(produced, config.expected().get(i));
    }
    return error;
  }

  @Override
  public Forest scoreForest(GpConfig config, Forest forest) {
    ImmutableList<ListenableFuture<Individual>> evaluations =
        forest.individuals().stream()
            .map(individual -> executor.submit(() -> scoreIndividual(config, individual)))
            .collect(toImmutableList());
    ListenableFuture<List<Individual>> scored = Futures.allAsList(evaluations);
    try {
      return Forest.of(scored.get());
    } catch (InterruptedException e) {
      scored.cancel(true);
      Thread.currentThread().interrupt();
      throw new EvaluationException("Interrupted while scoring forest", e);
    } catch (ExecutionException e) {
      scored.cancel(true);
      logger.atWarning().withCause(e.getCause()).log(
          "Fitness evaluation failed in a forest of %d", forest.size());
      Throwables.throwIfInstanceOf(e.getCause(), EvaluationException.class);
      Throwables.throwIfInstanceOf(e.getCause(), Error.class);
      throw new EvaluationException("Fitness evaluation failed", e.getCause());
    }
  }

  private Individual scoreIndividual(GpConfig config, Individual individual) {
    return Individual.scored(individual.tree(), score(config, individual.tree()));
  }

  static double offBy(double x, double y) {
    return Math.abs(x - y);
  }

  private static double[] toArguments(ImmutableList<Double> values) {
    double[] arguments = new double[values.size()];
    for (int i = 0; i < arguments.length; i++) {
      arguments[i] = values.get(i);
    }
    return arguments;
  }
}
