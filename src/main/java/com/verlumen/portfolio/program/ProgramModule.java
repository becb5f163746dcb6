package com.verlumen.portfolio.program;

import com.google.inject.AbstractModule;

/** Binds the problem builder. {@link BuilderOptions} is supplied by the engine configuration. */
public final class ProgramModule extends AbstractModule {
  @Override
  protected void configure() {
    bind(ProblemBuilder.class).to(ProblemBuilderImpl.class);
  }
}
