package com.verlumen.portfolio.optimizer;

import com.google.inject.AbstractModule;

public final class OptimizerModule extends AbstractModule {
  @Override
  protected void configure() {
    bind(Optimizer.class).to(OptimizerImpl.class);
  }
}
