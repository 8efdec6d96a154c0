package com.verlumen.islandgp.fitness;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.islandgp.tree.Constant;
import com.verlumen.islandgp.tree.Node;
import com.verlumen.islandgp.tree.Operation;
import com.verlumen.islandgp.tree.Variable;
import io.jenetics.prog.op.MathOp;
import io.jenetics.prog.op.Op;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InterpretingProgramCompilerTest {
  private static final ImmutableList<String> XY = ImmutableList.of("x", "y");

  @Inject private InterpretingProgramCompiler compiler;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void compile_identity_returnsArgument() {
    Program program = compiler.compile(ImmutableList.of("x"), Variable.of("x"));

    assertThat(program.apply(4.5)).isEqualTo(4.5);
  }

  @Test
  public void compile_bindsArgumentsInSymbolOrder() {
    // (x - y) distinguishes the argument order.
    Node tree = Operation.of(MathOp.SUB, ImmutableList.of(Variable.of("x"), Variable.of("y")));

    Program program = compiler.compile(XY, tree);

    assertThat(program.apply(10, 3)).isEqualTo(7.0);
    assertThat(program.apply(3, 10)).isEqualTo(-7.0);
  }

  @Test
  public void compile_nestedOperations_evaluatesChildrenFirst() {
    // (x * (y + 2))
    Node tree =
        Operation.of(
            MathOp.MUL,
            ImmutableList.of(
                Variable.of("x"),
                Operation.of(MathOp.ADD, ImmutableList.of(Variable.of("y"), Constant.of(2)))));

    assertThat(compiler.compile(XY, tree).apply(3, 4)).isEqualTo(18.0);
  }

  @Test
  public void compile_unknownSymbol_throwsEvaluationException() {
    EvaluationException thrown =
        assertThrows(
            EvaluationException.class, () -> compiler.compile(XY, Variable.of("z")));

    assertThat(thrown).hasMessageThat().contains("Unknown symbol: z");
  }

  @Test
  public void apply_wrongArgumentCount_throwsEvaluationException() {
    Program program = compiler.compile(XY, Variable.of("x"));

    EvaluationException thrown = assertThrows(EvaluationException.class, () -> program.apply(1));

    assertThat(thrown).hasMessageThat().contains("expects 2 arguments but got 1");
  }

  @Test
  public void apply_failingOperator_throwsEvaluationExceptionWithCause() {
    // Arrange
    Op<Double> failing =
        Op.of(
            "boom",
            1,
            args -> {
              throw new ArithmeticException("division by zero");
            });
    Program program =
        compiler.compile(XY, Operation.of(failing, ImmutableList.of(Variable.of("x"))));

    // Act
    EvaluationException thrown = assertThrows(EvaluationException.class, () -> program.apply(1, 2));

    // Assert
    assertThat(thrown).hasMessageThat().contains("Operator boom failed");
    assertThat(thrown).hasCauseThat().isInstanceOf(ArithmeticException.class);
  }
}
