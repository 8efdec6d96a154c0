package com.verlumen.islandgp.config;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import io.jenetics.prog.op.MathOp;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GpConfigTest {
  private static GpConfig.Builder validBuilder() {
    return GpConfig.builder()
        .symbols("x")
        .functions(MathOp.ADD, MathOp.MUL)
        .forestSize(10)
        .popSize(2)
        .generations(5)
        .cycles(3)
        .tests(ImmutableList.of(ImmutableList.of(1.0), ImmutableList.of(2.0)))
        .expected(ImmutableList.of(2.0, 4.0));
  }

  @Test
  public void build_appliesDefaults() {
    GpConfig config = validBuilder().build();

    assertThat(config.termMin()).isEqualTo(-1);
    assertThat(config.termMax()).isEqualTo(1);
    assertThat(config.depthMin()).isEqualTo(2);
    assertThat(config.depthMax()).isEqualTo(4);
    assertThat(config.mutationRate()).isEqualTo(0.05);
    assertThat(config.tournamentSize()).isEqualTo(5);
    assertThat(config.reportRate()).isEqualTo(1);
    assertThat(config.reportingMode()).isEqualTo(ReportingMode.NONZERO_REMAINDER);
    assertThat(config.reporter()).isInstanceOf(LoggingProgressReporter.class);
    assertThat(config.seed().isPresent()).isFalse();
  }

  @Test
  public void build_callerValuesOverrideDefaults() {
    GpConfig config = validBuilder().depthMax(6).mutationRate(0.2).seed(99L).build();

    assertThat(config.depthMax()).isEqualTo(6);
    assertThat(config.mutationRate()).isEqualTo(0.2);
    assertThat(config.seed().getAsLong()).isEqualTo(99L);
  }

  @Test
  public void treeSpace_mirrorsVocabularyAndDepthBounds() {
    GpConfig config = validBuilder().termMin(-5).termMax(5).build();

    assertThat(config.treeSpace().symbols()).containsExactly("x");
    assertThat(config.treeSpace().functions()).containsExactly(MathOp.ADD, MathOp.MUL).inOrder();
    assertThat(config.treeSpace().termMin()).isEqualTo(-5);
    assertThat(config.treeSpace().termMax()).isEqualTo(5);
    assertThat(config.treeSpace().depthMin()).isEqualTo(2);
    assertThat(config.treeSpace().depthMax()).isEqualTo(4);
  }

  @Test
  public void build_invalidConfiguration_reportsEveryProblemAtOnce() {
    // Arrange
    GpConfig.Builder builder =
        validBuilder()
            .symbols(ImmutableList.of())
            .depthMin(5)
            .depthMax(3)
            .tournamentSize(11)
            .expected(ImmutableList.of(2.0));

    // Act
    IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, builder::build);

    // Assert
    assertThat(thrown).hasMessageThat().contains("symbols cannot be empty");
    assertThat(thrown).hasMessageThat().contains("depthMax (3) cannot be less than depthMin (5)");
    assertThat(thrown).hasMessageThat().contains("tournamentSize (11) cannot exceed forestSize");
    assertThat(thrown).hasMessageThat().contains("must have the same length");
  }

  @Test
  public void build_zeroSizes_throwsException() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () -> validBuilder().forestSize(0).popSize(0).tournamentSize(2).build());

    assertThat(thrown).hasMessageThat().contains("forestSize must be positive");
    assertThat(thrown).hasMessageThat().contains("popSize must be positive");
  }

  @Test
  public void build_testWidthDiffersFromSymbols_throwsException() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                validBuilder()
                    .tests(ImmutableList.of(ImmutableList.of(1.0, 2.0), ImmutableList.of(2.0)))
                    .build());

    assertThat(thrown).hasMessageThat().contains("test 0 has 2 values but there are 1 symbols");
  }

  @Test
  public void build_emptyFunctionsAndBadRanges_throwsException() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                validBuilder()
                    .functions(ImmutableList.of())
                    .termMin(1)
                    .termMax(1)
                    .mutationRate(1.5)
                    .tournamentSize(1)
                    .reportRate(0)
                    .build());

    assertThat(thrown).hasMessageThat().contains("functions cannot be empty");
    assertThat(thrown).hasMessageThat().contains("termMax (1) must exceed termMin (1)");
    assertThat(thrown).hasMessageThat().contains("mutationRate must be within [0, 1]");
    assertThat(thrown).hasMessageThat().contains("tournamentSize must be at least 2");
    assertThat(thrown).hasMessageThat().contains("reportRate must be positive");
  }

  @Test
  public void build_repeatedSymbol_throwsException() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                validBuilder()
                    .symbols("x", "x")
                    .tests(ImmutableList.of(ImmutableList.of(1.0, 1.0), ImmutableList.of(2.0, 2.0)))
                    .build());

    assertThat(thrown).hasMessageThat().contains("symbols must be distinct: [x, x]");
  }

  @Test
  public void build_constantRangeWiderThanInt_throwsException() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () -> validBuilder().termMin(Integer.MIN_VALUE).termMax(1).build());

    assertThat(thrown)
        .hasMessageThat()
        .contains("constant range [" + Integer.MIN_VALUE + ", 1) is too wide");
  }

  @Test
  public void build_widestRepresentableConstantRange_isAccepted() {
    GpConfig config = validBuilder().termMin(Integer.MIN_VALUE).termMax(-1).build();

    assertThat(config.treeSpace().termMin()).isEqualTo(Integer.MIN_VALUE);
  }

  @Test
  public void build_missingRequiredSetting_throwsException() {
    assertThrows(
        IllegalStateException.class,
        () -> GpConfig.builder().symbols("x").functions(MathOp.ADD).build());
  }
}
