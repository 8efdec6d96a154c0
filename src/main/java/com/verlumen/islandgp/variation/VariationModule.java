package com.verlumen.islandgp.variation;

import com.google.inject.AbstractModule;

public final class VariationModule extends AbstractModule {
  public static VariationModule create() {
    return new VariationModule();
  }

  private VariationModule() {}

  @Override
  protected void configure() {
    bind(GeneticOperators.class).to(GeneticOperatorsImpl.class);
  }
}
