package com.verlumen.islandgp.tree;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import io.jenetics.prog.op.Op;

/**
 * The space of trees sampled by a {@link TreeGenerator}: input symbols, operators, the numeric
 * constant range {@code [termMin, termMax)} and the default depth bounds.
 */
@AutoValue
public abstract class TreeSpace {
  public static Builder builder() {
    return new AutoValue_TreeSpace.Builder();
  }

  public abstract ImmutableList<String> symbols();

  public abstract ImmutableList<Op<Double>> functions();

  public abstract int termMin();

  public abstract int termMax();

  public abstract int depthMin();

  public abstract int depthMax();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder symbols(ImmutableList<String> symbols);

    public abstract Builder functions(ImmutableList<Op<Double>> functions);

    public abstract Builder termMin(int termMin);

    public abstract Builder termMax(int termMax);

    public abstract Builder depthMin(int depthMin);

    public abstract Builder depthMax(int depthMax);

    public abstract TreeSpace build();
  }
}
