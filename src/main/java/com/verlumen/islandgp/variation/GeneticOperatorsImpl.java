package com.verlumen.islandgp.variation;

import com.google.inject.Inject;
import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.tree.Node;
import com.verlumen.islandgp.tree.Operation;
import com.verlumen.islandgp.tree.RandomChoices;
import com.verlumen.islandgp.tree.TreeGenerator;
import java.util.random.RandomGenerator;

final class GeneticOperatorsImpl implements GeneticOperators {
  private final TreeGenerator treeGenerator;

  @Inject
  GeneticOperatorsImpl(TreeGenerator treeGenerator) {
    this.treeGenerator = treeGenerator;
  }

  @Override
  public Node randomSubtree(Node tree, RandomGenerator random) {
    Node current = tree;
    int steps = RandomChoices.below(random, tree.height());
    while (!current.children().isEmpty() && steps > 0) {
      current = RandomChoices.pick(random, current.children());
      steps = RandomChoices.below(random, steps - 1);
    }
    return current;
  }

  @Override
  public Node replaceSubtree(Node tree, Node replacement, RandomGenerator random) {
    return replaceSubtree(tree, replacement, tree.height(), random);
  }

  private Node replaceSubtree(Node tree, Node replacement, int steps, RandomGenerator random) {
    if (tree.children().isEmpty() || steps == 0) {
      return replacement;
    }
    Operation operation = (Operation) tree;
    int index = random.nextInt(operation.children().size());
    Node rebuilt =
        replaceSubtree(
            operation.children().get(index),
            replacement,
            RandomChoices.below(random, steps - 1),
            random);
    return operation.withChild(index, rebuilt);
  }

  @Override
  public Node mutate(GpConfig config, Node tree, RandomGenerator random) {
    if (!RandomChoices.flip(random, config.mutationRate())) {
      return tree;
    }
    return replaceSubtree(tree, treeGenerator.buildTree(config.treeSpace(), random), random);
  }

  @Override
  public Node crossover(Node first, Node second, RandomGenerator random) {
    return replaceSubtree(first, randomSubtree(second, random), random);
  }
}
