package com.verlumen.islandgp.tree;

import com.google.common.collect.ImmutableList;

/**
 * A node of an immutable expression tree. A node is either a terminal ({@link Variable} or {@link
 * Constant}) or an {@link Operation} applied to an ordered list of child trees.
 *
 * <p>Trees are values. Transformations rebuild the nodes along the changed path and share every
 * untouched subtree with the original tree.
 */
public abstract class Node {
  Node() {}

  /** Returns the ordered child trees, empty for terminals. */
  public abstract ImmutableList<Node> children();

  public abstract boolean isTerminal();

  /** Returns 0 for a terminal, otherwise one more than the height of the tallest child. */
  public abstract int height();
}
