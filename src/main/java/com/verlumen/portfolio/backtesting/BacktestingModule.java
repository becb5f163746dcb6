package com.verlumen.portfolio.backtesting;

import com.google.inject.AbstractModule;

public final class BacktestingModule extends AbstractModule {
  @Override
  protected void configure() {
    bind(BacktestDriver.class).to(BacktestDriverImpl.class);
  }
}
