package com.verlumen.islandgp.tree;

import com.google.inject.AbstractModule;

public final class TreeModule extends AbstractModule {
  public static TreeModule create() {
    return new TreeModule();
  }

  private TreeModule() {}

  @Override
  protected void configure() {
    bind(TreeGenerator.class).to(TreeGeneratorImpl.class);
  }
}
