package com.verlumen.islandgp.tree;

import java.util.random.RandomGenerator;

/** Builds random expression trees from a {@link TreeSpace}. */
public interface TreeGenerator {
  /**
   * Returns a random terminal: with even odds either a variable for one of the space's symbols or
   * an integral constant drawn uniformly from {@code [termMin, termMax)}.
   */
  Node terminal(TreeSpace space, RandomGenerator random);

  /**
   * Builds a random tree whose height never exceeds {@code depthMax}. Branches keep growing until
   * {@code depthMin} is reached, after which each level stops with probability one half.
   */
  Node buildTree(TreeSpace space, int depthMax, int depthMin, RandomGenerator random);

  /** Builds a random tree within the space's own depth bounds. */
  default Node buildTree(TreeSpace space, RandomGenerator random) {
    return buildTree(space, space.depthMax(), space.depthMin(), random);
  }
}
