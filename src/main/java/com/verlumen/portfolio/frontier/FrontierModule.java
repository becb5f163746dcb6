package com.verlumen.portfolio.frontier;

import com.google.inject.AbstractModule;

public final class FrontierModule extends AbstractModule {
  @Override
  protected void configure() {
    bind(FrontierGenerator.class).to(FrontierGeneratorImpl.class);
  }
}
