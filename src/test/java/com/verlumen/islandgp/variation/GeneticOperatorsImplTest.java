package com.verlumen.islandgp.variation;

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.tree.Constant;
import com.verlumen.islandgp.tree.Node;
import com.verlumen.islandgp.tree.Operation;
import com.verlumen.islandgp.tree.TreeGenerator;
import com.verlumen.islandgp.tree.TreeSpace;
import com.verlumen.islandgp.tree.Variable;
import io.jenetics.prog.op.MathOp;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class GeneticOperatorsImplTest {
  @Rule public MockitoRule mockitoRule = MockitoJUnit.rule();

  @Bind @Mock private TreeGenerator mockTreeGenerator;

  @Inject private GeneticOperatorsImpl operators;

  private final SplittableRandom random = new SplittableRandom(11);

  private final Variable x = Variable.of("x");
  private final Constant one = Constant.of(1);
  private final Constant two = Constant.of(2);
  private final Operation sum = Operation.of(MathOp.ADD, ImmutableList.of(x, one));
  // (mul (add x 1) 2), height 2
  private final Operation tree = Operation.of(MathOp.MUL, ImmutableList.of(sum, two));

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  private static GpConfig configWithMutationRate(double mutationRate) {
    return GpConfig.builder()
        .symbols("x")
        .functions(MathOp.ADD, MathOp.MUL)
        .mutationRate(mutationRate)
        .forestSize(4)
        .popSize(1)
        .tournamentSize(2)
        .generations(1)
        .cycles(1)
        .tests(ImmutableList.of(ImmutableList.of(1.0)))
        .expected(ImmutableList.of(2.0))
        .build();
  }

  @Test
  public void replaceSubtree_terminal_returnsReplacement() {
    Constant replacement = Constant.of(9);

    assertThat(operators.replaceSubtree(x, replacement, random)).isSameInstanceAs(replacement);
  }

  @Test
  public void replaceSubtree_heightOne_replacesOneChildAndSharesTheOther() {
    for (int i = 0; i < 50; i++) {
      // Arrange
      Constant replacement = Constant.of(9);

      // Act
      Node result = operators.replaceSubtree(sum, replacement, random);

      // Assert
      assertThat(result).isInstanceOf(Operation.class);
      assertThat(((Operation) result).op()).isEqualTo(MathOp.ADD);
      ImmutableList<Node> children = result.children();
      if (children.get(0) == replacement) {
        assertThat(children.get(1)).isSameInstanceAs(one);
      } else {
        assertThat(children.get(0)).isSameInstanceAs(x);
        assertThat(children.get(1)).isSameInstanceAs(replacement);
      }
    }
  }

  @Test
  public void replaceSubtree_keepsSiblingsOnTheRebuiltPathIdentical() {
    for (int i = 0; i < 100; i++) {
      Constant replacement = Constant.of(9);

      Node result = operators.replaceSubtree(tree, replacement, random);

      // From a height-2 root the walk stops one level down, so one child is replaced and the
      // other is shared.
      assertThat(result).isNotSameInstanceAs(tree);
      Node left = result.children().get(0);
      Node right = result.children().get(1);
      if (right == two) {
        assertThat(left).isSameInstanceAs(replacement);
      } else {
        assertThat(left).isSameInstanceAs(sum);
        assertThat(right).isSameInstanceAs(replacement);
      }
    }
    // The original tree is never modified.
    assertThat(tree.children()).containsExactly(sum, two).inOrder();
    assertThat(sum.children()).containsExactly(x, one).inOrder();
  }

  @Test
  public void randomSubtree_returnsNodeOfTheTree() {
    for (int i = 0; i < 100; i++) {
      Node subtree = operators.randomSubtree(tree, random);

      assertThat(containsInstance(tree, subtree)).isTrue();
    }
  }

  @Test
  public void randomSubtree_terminal_returnsItself() {
    assertThat(operators.randomSubtree(one, random)).isSameInstanceAs(one);
  }

  @Test
  public void mutate_zeroRate_returnsSameTree() {
    GpConfig config = configWithMutationRate(0);

    for (int i = 0; i < 50; i++) {
      assertThat(operators.mutate(config, tree, random)).isSameInstanceAs(tree);
    }
    verify(mockTreeGenerator, never())
        .buildTree(any(TreeSpace.class), any(RandomGenerator.class));
  }

  @Test
  public void mutate_fullRate_insertsFreshTree() {
    // Arrange
    GpConfig config = configWithMutationRate(1);
    Node fresh = Operation.of(MathOp.MUL, ImmutableList.of(Constant.of(-1), x));
    when(mockTreeGenerator.buildTree(any(TreeSpace.class), any(RandomGenerator.class)))
        .thenReturn(fresh);

    // Act
    Node mutated = operators.mutate(config, tree, random);

    // Assert
    assertThat(mutated).isNotSameInstanceAs(tree);
    assertThat(containsInstance(mutated, fresh)).isTrue();
    verify(mockTreeGenerator).buildTree(config.treeSpace(), random);
  }

  @Test
  public void crossover_terminals_returnsDonorSubtree() {
    assertThat(operators.crossover(x, two, random)).isSameInstanceAs(two);
  }

  @Test
  public void crossover_graftsSubtreeOfSecondParent() {
    Operation donor = Operation.of(MathOp.ADD, ImmutableList.of(Constant.of(7), Constant.of(8)));

    for (int i = 0; i < 50; i++) {
      Node child = operators.crossover(tree, donor, random);

      boolean graftedDonorPart =
          containsInstance(child, donor)
              || containsInstance(child, donor.children().get(0))
              || containsInstance(child, donor.children().get(1));
      assertThat(graftedDonorPart).isTrue();
    }
  }

  private static boolean containsInstance(Node root, Node target) {
    if (root == target) {
      return true;
    }
    for (Node child : root.children()) {
      if (containsInstance(child, target)) {
        return true;
      }
    }
    return false;
  }
}
