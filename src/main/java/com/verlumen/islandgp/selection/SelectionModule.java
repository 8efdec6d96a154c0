package com.verlumen.islandgp.selection;

import com.google.inject.AbstractModule;

public final class SelectionModule extends AbstractModule {
  public static SelectionModule create() {
    return new SelectionModule();
  }

  private SelectionModule() {}

  @Override
  protected void configure() {
    bind(Selector.class).to(SelectorImpl.class);
  }
}
