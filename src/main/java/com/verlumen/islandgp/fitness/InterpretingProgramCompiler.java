package com.verlumen.islandgp.fitness;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import com.verlumen.islandgp.tree.Constant;
import com.verlumen.islandgp.tree.Node;
import com.verlumen.islandgp.tree.Operation;
import com.verlumen.islandgp.tree.Variable;

/**
 * Compiles trees into programs that walk the tree on every call, binding each variable to its
 * argument and applying each operator to its evaluated children.
 */
final class InterpretingProgramCompiler implements ProgramCompiler {
  @Inject
  InterpretingProgramCompiler() {}

  @Override
  public Program compile(ImmutableList<String> symbols, Node tree) {
    ImmutableMap<String, Integer> positions = positionsOf(symbols);
    checkSymbols(tree, positions);
    return arguments -> {
      if (arguments.length != symbols.size()) {
        throw new EvaluationException(
            "Program expects " + symbols.size() + " arguments but got " + arguments.length);
      }
      return evaluate(tree, positions, arguments);
    };
  }

  private static ImmutableMap<String, Integer> positionsOf(ImmutableList<String> symbols) {
    ImmutableMap.Builder<String, Integer> positions = ImmutableMap.builder();
    for (int i = 0; i < symbols.size(); i++) {
      positions.put(symbols.get(i), i);
    }
    try {
      return positions.buildOrThrow();
    } catch (IllegalArgumentException e) {
      throw new EvaluationException("Duplicate symbol in " + symbols, e);
    }
  }

  private static void checkSymbols(Node node, ImmutableMap<String, Integer> positions) {
    if (node instanceof Variable && !positions.containsKey(((Variable) node).name())) {
      throw new EvaluationException("Unknown symbol: " + ((Variable) node).name());
    }
    for (Node child : node.children()) {
      checkSymbols(child, positions);
    }
  }

  private static double evaluate(
      Node node, ImmutableMap<String, Integer> positions, double[] arguments) {
    if (node instanceof Constant) {
      return ((Constant) node).value();
    }
    if (node instanceof Variable) {
      return arguments[positions.get(((Variable) node).name())];
    }
    Operation operation = (Operation) node;
    Double[] values = new Double[operation.children().size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = evaluate(operation.children().get(i), positions, arguments);
    }
    Double result;
    try {
      result = operation.op().apply(values);
    } catch (RuntimeException e) {
      throw new EvaluationException("Operator " + operation.op().name() + " failed", e);
    }
    if (result == null) {
      throw new EvaluationException("Operator " + operation.op().name() + " returned null");
    }
    return result;
  }
}
