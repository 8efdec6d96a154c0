package com.verlumen.islandgp.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import io.jenetics.prog.op.Op;
import java.util.List;

/**
 * Applies an operator to the values of its child trees. The number of children always equals the
 * operator's declared arity.
 */
@AutoValue
public abstract class Operation extends Node {
  /**
   * Creates an operation node.
   *
   * @throws IllegalArgumentException if the number of children differs from the operator's arity
   */
  public static Operation of(Op<Double> op, List<? extends Node> children) {
    checkArgument(
        children.size() == op.arity(),
        "Operator %s expects %s children but got %s",
        op.name(),
        op.arity(),
        children.size());
    return new AutoValue_Operation(op, ImmutableList.copyOf(children));
  }

  public abstract Op<Double> op();

  @Override
  public abstract ImmutableList<Node> children();

  @Override
  public boolean isTerminal() {
    return false;
  }

  @Memoized
  @Override
  public int height() {
    int tallest = 0;
    for (Node child : children()) {
      tallest = Math.max(tallest, child.height());
    }
    return tallest + 1;
  }

  /**
   * Returns a copy of this operation whose child at {@code index} is {@code child}. All other
   * children are shared with this node.
   */
  public Operation withChild(int index, Node child) {
    checkElementIndex(index, children().size());
    ImmutableList.Builder<Node> rebuilt = ImmutableList.builderWithExpectedSize(children().size());
    for (int i = 0; i < children().size(); i++) {
      rebuilt.add(i == index ? child : children().get(i));
    }
    return new AutoValue_Operation(op(), rebuilt.build());
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder("(").append(op().name());
    for (Node child : children()) {
      sb.append(' ').append(child);
    }
    return sb.append(')').toString();
  }
}
