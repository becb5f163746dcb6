package com.verlumen.portfolio.solver;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.multibindings.MapBinder;
import java.util.concurrent.Executors;

/** Registers the ojAlgo backends and binds the solver adapter. */
@AutoValue
public abstract class SolverModule extends AbstractModule {
  public static SolverModule create(SolverConfig config) {
    return new AutoValue_SolverModule(config);
  }

  abstract SolverConfig config();

  @Override
  protected void configure() {
    MapBinder<String, SolverBackend> backends =
        MapBinder.newMapBinder(binder(), String.class, SolverBackend.class);
    backends
        .addBinding(SolverConfig.OJALGO_LP)
        .toInstance(ExpressionsModelBackend.linear(SolverConfig.OJALGO_LP));
    backends
        .addBinding(SolverConfig.OJALGO_QP)
        .toInstance(ExpressionsModelBackend.quadratic(SolverConfig.OJALGO_QP));
    backends
        .addBinding(SolverConfig.OJALGO_SOCP)
        .toInstance(
            new OuterApproximationConicBackend(
                SolverConfig.OJALGO_SOCP,
                config().conicTolerance(),
                config().conicMaxIterations()));

    bind(SolverConfig.class).toInstance(config());
    bind(SolverAdapter.class).to(SolverAdapterImpl.class);
  }

  @Provides
  @Singleton
  TimeLimiter provideTimeLimiter() {
    return SimpleTimeLimiter.create(
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("solver-%d").build()));
  }
}
