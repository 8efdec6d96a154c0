package com.verlumen.islandgp.population;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.verlumen.islandgp.tree.Constant;
import com.verlumen.islandgp.tree.Variable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IndividualTest {
  @Test
  public void unscored_hasNoFitness() {
    Individual individual = Individual.unscored(Variable.of("x"));

    assertThat(individual.isScored()).isFalse();
    assertThat(individual.isPerfect()).isFalse();
    assertThrows(IllegalStateException.class, individual::requireFitness);
  }

  @Test
  public void scored_zeroFitness_isPerfect() {
    assertThat(Individual.scored(Variable.of("x"), 0).isPerfect()).isTrue();
    assertThat(Individual.scored(Variable.of("x"), 0.5).isPerfect()).isFalse();
  }

  @Test
  public void scored_negativeFitness_throwsException() {
    assertThrows(IllegalArgumentException.class, () -> Individual.scored(Constant.of(1), -1));
  }

  @Test
  public void byFitness_ordersLowestFirstAndKeepsTiesStable() {
    // Arrange
    Individual worst = Individual.scored(Constant.of(0), 9);
    Individual firstTie = Individual.scored(Constant.of(1), 2);
    Individual secondTie = Individual.scored(Constant.of(2), 2);

    // Act
    ImmutableList<Individual> sorted =
        ImmutableList.sortedCopyOf(
            Individual.BY_FITNESS, ImmutableList.of(worst, firstTie, secondTie));

    // Assert
    assertThat(sorted).containsExactly(firstTie, secondTie, worst).inOrder();
  }

  @Test
  public void forestOfTrees_wrapsTreesAsUnscoredIndividuals() {
    Forest forest = Forest.ofTrees(ImmutableList.of(Variable.of("x"), Constant.of(1)));

    assertThat(forest.size()).isEqualTo(2);
    assertThat(forest.trees()).containsExactly(Variable.of("x"), Constant.of(1)).inOrder();
    assertThat(forest.individuals().get(0).isScored()).isFalse();
  }
}
