package com.verlumen.portfolio.config;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Provider;
import com.verlumen.portfolio.backtesting.FailurePolicy;
import com.verlumen.portfolio.errors.ValidationException;
import com.verlumen.portfolio.program.BuilderOptions;
import com.verlumen.portfolio.program.ProblemClass;
import com.verlumen.portfolio.solver.SolverConfig;
import java.time.Duration;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/** Parses command-line style flags into an {@link EngineConfig}. */
@AutoValue
public abstract class EngineArguments implements Provider<EngineConfig> {
  public static EngineArguments create(ImmutableList<String> args) {
    return new AutoValue_EngineArguments(args);
  }

  abstract ImmutableList<String> args();

  @Override
  public EngineConfig get() {
    Namespace namespace;
    try {
      namespace = createParser().parseArgs(args().toArray(new String[0]));
    } catch (ArgumentParserException e) {
      throw new ValidationException("Unable to parse engine arguments: " + e.getMessage(), e);
    }
    try {
      SolverConfig solverConfig =
          SolverConfig.builder()
              .setDefaultBackends(
                  ImmutableMap.of(
                      ProblemClass.LP, namespace.getString("solver.lp"),
                      ProblemClass.QP, namespace.getString("solver.qp"),
                      ProblemClass.SOCP, namespace.getString("solver.socp")))
              .setTimeout(Duration.ofMillis(namespace.getLong("solver.timeoutMillis")))
              .setRetryWithAlternateBackend(namespace.getBoolean("solver.retryAlternate"))
              .setConicTolerance(namespace.getDouble("solver.conicTolerance"))
              .setConicMaxIterations(namespace.getInt("solver.conicMaxIterations"))
              .build();
      return EngineConfig.create(
          solverConfig,
          BuilderOptions.create(namespace.getInt("builder.denseCovarianceLimit")),
          FailurePolicy.fromString(namespace.getString("backtest.failurePolicy")),
          namespace.getInt("parallelism"));
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Invalid engine configuration: " + e.getMessage(), e);
    }
  }

  private static ArgumentParser createParser() {
    SolverConfig solverDefaults = SolverConfig.defaults();
    ArgumentParser parser =
        ArgumentParsers.newFor("PortfolioEngine")
            .build()
            .defaultHelp(true)
            .description("Configuration for portfolio optimization, backtests and frontiers");

    // Solver configuration
    parser
        .addArgument("--solver.lp")
        .setDefault(solverDefaults.defaultBackends().get(ProblemClass.LP))
        .help("Backend used for linear programs");

    parser
        .addArgument("--solver.qp")
        .setDefault(solverDefaults.defaultBackends().get(ProblemClass.QP))
        .help("Backend used for quadratic programs");

    parser
        .addArgument("--solver.socp")
        .setDefault(solverDefaults.defaultBackends().get(ProblemClass.SOCP))
        .help("Backend used for second-order cone programs");

    parser
        .addArgument("--solver.timeoutMillis")
        .type(Long.class)
        .setDefault(solverDefaults.timeout().toMillis())
        .help("Wall-clock limit of one solve in milliseconds");

    parser
        .addArgument("--solver.retryAlternate")
        .type(Boolean.class)
        .setDefault(solverDefaults.retryWithAlternateBackend())
        .help("Retry a timed-out or non-converged solve once on another capable backend");

    parser
        .addArgument("--solver.conicTolerance")
        .type(Double.class)
        .setDefault(solverDefaults.conicTolerance())
        .help("Relative cone violation accepted by the conic backend");

    parser
        .addArgument("--solver.conicMaxIterations")
        .type(Integer.class)
        .setDefault(solverDefaults.conicMaxIterations())
        .help("Cutting-plane rounds before the conic backend gives up");

    // Problem builder
    parser
        .addArgument("--builder.denseCovarianceLimit")
        .type(Integer.class)
        .setDefault(BuilderOptions.DEFAULT_DENSE_COVARIANCE_LIMIT)
        .help("Largest universe whose covariance is emitted as a dense quadratic form");

    // Backtests
    parser
        .addArgument("--backtest.failurePolicy")
        .setDefault(FailurePolicy.HOLD_PREVIOUS.name())
        .help("HOLD_PREVIOUS, UNDEFINED_WEIGHTS or ABORT");

    parser
        .addArgument("--parallelism")
        .type(Integer.class)
        .setDefault(1)
        .help("Threads used for backtest and frontier solves");

    return parser;
  }
}
