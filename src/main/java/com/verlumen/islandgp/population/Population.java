package com.verlumen.islandgp.population;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Collection;

/** The forests of all islands, evolved in parallel and reshuffled between cycles. */
@AutoValue
public abstract class Population {
  public static Population of(Collection<Forest> forests) {
    return new AutoValue_Population(ImmutableList.copyOf(forests));
  }

  public abstract ImmutableList<Forest> forests();

  public int size() {
    return forests().size();
  }
}
