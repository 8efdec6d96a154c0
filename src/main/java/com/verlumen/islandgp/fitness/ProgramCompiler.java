package com.verlumen.islandgp.fitness;

import com.google.common.collect.ImmutableList;
import com.verlumen.islandgp.tree.Node;

/** Turns an expression tree into a callable {@link Program}. */
public interface ProgramCompiler {
  /**
   * Compiles {@code tree} into a program whose parameters are {@code symbols}, in order.
   *
   * @throws EvaluationException if the tree refers to a symbol that is not a parameter
   */
  Program compile(ImmutableList<String> symbols, Node tree);
}
