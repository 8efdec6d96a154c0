package com.verlumen.islandgp.tree;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Terminal that stands for one of the program's input symbols. */
@AutoValue
public abstract class Variable extends Node {
  public static Variable of(String name) {
    checkArgument(!name.isEmpty(), "Variable name cannot be empty");
    return new AutoValue_Variable(name);
  }

  public abstract String name();

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
    return name();
  }
}
