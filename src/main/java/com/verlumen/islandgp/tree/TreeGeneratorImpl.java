package com.verlumen.islandgp.tree;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.jenetics.prog.op.Op;
import java.util.random.RandomGenerator;

/** Ramped half-and-half tree construction: fill up to the minimum depth, then grow. */
final class TreeGeneratorImpl implements TreeGenerator {
  private static final double STOP_PROBABILITY = 0.5;
  private static final double SYMBOL_PROBABILITY = 0.5;

  @Inject
  TreeGeneratorImpl() {}

  @Override
  public Node terminal(TreeSpace space, RandomGenerator random) {
    if (RandomChoices.flip(random, SYMBOL_PROBABILITY)) {
      return Variable.of(RandomChoices.pick(random, space.symbols()));
    }
    return Constant.of(space.termMin() + random.nextInt(space.termMax() - space.termMin()));
  }

  @Override
  public Node buildTree(TreeSpace space, int depthMax, int depthMin, RandomGenerator random) {
    checkArgument(depthMax >= 0, "Maximum depth cannot be negative: %s", depthMax);
    if (depthMax == 0 || (depthMin <= 0 && RandomChoices.flip(random, STOP_PROBABILITY))) {
      return terminal(space, random);
    }
    Op<Double> op = RandomChoices.pick(random, space.functions());
    ImmutableList.Builder<Node> children = ImmutableList.builderWithExpectedSize(op.arity());
    for (int i = 0; i < op.arity(); i++) {
      children.add(buildTree(space, depthMax - 1, depthMin - 1, random));
    }
    return Operation.of(op, children.build());
  }
}
