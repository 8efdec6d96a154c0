package com.verlumen.islandgp.tree;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Terminal holding a numeric constant. */
@AutoValue
public abstract class Constant extends Node {
  public static Constant of(double value) {
    return new AutoValue_Constant(value);
  }

  public abstract double value();

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public boolean isTerminal() {
    return true;
  }

  @Override
  public int height() {
    return 0;
  }

  @Override
  public final String toString() {
    return Double.toString(value());
  }
}
