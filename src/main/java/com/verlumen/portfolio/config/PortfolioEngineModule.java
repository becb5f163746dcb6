package com.verlumen.portfolio.config;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.portfolio.backtesting.BacktestingModule;
import com.verlumen.portfolio.backtesting.FailurePolicy;
import com.verlumen.portfolio.frontier.FrontierModule;
import com.verlumen.portfolio.optimizer.OptimizerModule;
import com.verlumen.portfolio.program.BuilderOptions;
import com.verlumen.portfolio.program.ProgramModule;
import com.verlumen.portfolio.solver.SolverModule;
import java.util.concurrent.Executors;

/** Wires the whole engine from one {@link EngineConfig}. */
@AutoValue
public abstract class PortfolioEngineModule extends AbstractModule {
  public static PortfolioEngineModule create(EngineConfig config) {
    return new AutoValue_PortfolioEngineModule(config);
  }

  abstract EngineConfig config();

  @Override
  protected void configure() {
    install(new ProgramModule());
    install(SolverModule.create(config().solverConfig()));
    install(new OptimizerModule());
    install(new BacktestingModule());
    install(new FrontierModule());
  }

  @Provides
  BuilderOptions provideBuilderOptions() {
    return config().builderOptions();
  }

  @Provides
  FailurePolicy provideFailurePolicy() {
    return config().failurePolicy();
  }

  @Provides
  @Singleton
  ListeningExecutorService provideExecutorService() {
    if (config().parallelism() <= 1) {
      return MoreExecutors.newDirectExecutorService();
    }
    return MoreExecutors.listeningDecorator(
        Executors.newFixedThreadPool(
            config().parallelism(),
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("portfolio-%d").build()));
  }
}
