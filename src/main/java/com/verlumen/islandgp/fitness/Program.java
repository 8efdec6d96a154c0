package com.verlumen.islandgp.fitness;

/** A compiled expression tree, callable with one argument per input symbol. */
@FunctionalInterface
public interface Program {
  /**
   * Evaluates the program.
   *
   * @param arguments one value per input symbol, in symbol order
   * @throws EvaluationException if the argument count is wrong or an operator fails
   */
  double apply(double... arguments);
}
