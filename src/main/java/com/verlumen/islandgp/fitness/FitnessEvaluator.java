package com.verlumen.islandgp.fitness;

import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.population.Forest;
import com.verlumen.islandgp.tree.Node;

/** Scores programs by their total absolute error over the configured test cases. */
public interface FitnessEvaluator {
  /**
   * Returns the sum of {@code |program(test) - expected|} over every test case. Zero means an exact
   * match.
   *
   * @throws EvaluationException if the program cannot be compiled or fails on a test case
   */
  double score(GpConfig config, Node tree);

  /**
   * Scores every individual of {@code forest} concurrently and returns a forest in the same order
   * where every individual carries its fitness.
   *
   * @throws EvaluationException if any individual fails to evaluate; the remaining evaluations are
   *     cancelled
   */
  Forest scoreForest(GpConfig config, Forest forest);
}
