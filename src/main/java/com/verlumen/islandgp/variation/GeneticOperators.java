package com.verlumen.islandgp.variation;

import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.tree.Node;
import java.util.random.RandomGenerator;

/**
 * Tree transformations used to vary a population. None of them enforce the configured depth
 * bounds, so offspring may grow taller than freshly generated trees.
 */
public interface GeneticOperators {
  /**
   * Returns a subtree reached by walking down from the root a random number of steps, bounded by
   * the tree's height, choosing a uniformly random child at each step.
   */
  Node randomSubtree(Node tree, RandomGenerator random);

  /**
   * Returns a copy of {@code tree} where one randomly chosen subtree is replaced by {@code
   * replacement}. Subtrees off the rebuilt path are shared with {@code tree}.
   */
  Node replaceSubtree(Node tree, Node replacement, RandomGenerator random);

  /**
   * With probability {@code config.mutationRate()} replaces a random subtree with a freshly
   * generated tree, otherwise returns {@code tree} itself.
   */
  Node mutate(GpConfig config, Node tree, RandomGenerator random);

  /** Replaces a random subtree of {@code first} with a random subtree of {@code second}. */
  Node crossover(Node first, Node second, RandomGenerator random);
}
