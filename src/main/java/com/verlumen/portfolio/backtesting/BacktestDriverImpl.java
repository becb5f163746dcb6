package com.verlumen.portfolio.backtesting;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.inject.Inject;
import com.verlumen.portfolio.errors.InfeasibleProblemException;
import com.verlumen.portfolio.errors.InfeasibleRatioException;
import com.verlumen.portfolio.errors.PortfolioException;
import com.verlumen.portfolio.errors.SolverException;
import com.verlumen.portfolio.errors.SolverFailureException;
import com.verlumen.portfolio.optimizer.OptimizationResult;
import com.verlumen.portfolio.optimizer.Optimizer;
import com.verlumen.portfolio.returns.ReturnSample;
import com.verlumen.portfolio.solver.SolverStatus;
import com.verlumen.portfolio.spec.SolverChoice;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutionException;

/**
 * Default {@link BacktestDriver}.
 *
 * <p>Solves for all scheduled dates are submitted to the injected executor and merged back in
 * chronological order; the failure policy is applied afterwards, walking forward, so that
 * {@link FailurePolicy#HOLD_PREVIOUS} sees the resolved previous entry.
 */
final class BacktestDriverImpl implements BacktestDriver {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Optimizer optimizer;
  private final ListeningExecutorService executor;
  private final FailurePolicy defaultFailurePolicy;

  @Inject
  BacktestDriverImpl(
      Optimizer optimizer, ListeningExecutorService executor, FailurePolicy defaultFailurePolicy) {
    this.optimizer = optimizer;
    this.executor = executor;
    this.defaultFailurePolicy = defaultFailurePolicy;
  }

  @Override
  public BacktestResult run(BacktestRequest request) {
    ReturnSample sample = request.sample();
    RebalanceSchedule schedule = RebalanceSchedule.of(sample.dates(), request.frequency());
    BacktestRun run = new BacktestRun(request.effectiveTrainingLength());
    SolverChoice solverChoice = request.effectiveSolverChoice();
    logger.atInfo().log(
        "Backtesting %s over %d periods, %d scheduled rebalances",
        request.mode(), sample.periods(), schedule.indices().size());

    List<ListenableFuture<Outcome>> futures = new ArrayList<>();
    for (int end : schedule.indices()) {
      int start = request.rollingWindow().map(width -> Math.max(0, end - width)).orElse(0);
      if (!run.visit(end, end - start)) {
        continue;
      }
      futures.add(executor.submit(() -> solve(request, solverChoice, start, end)));
    }
    run.finish();

    ImmutableList<BacktestEntry> entries = resolve(request, await(futures));
    logger.atInfo().log(
        "Backtest finished with %d entries, %d failed",
        entries.size(), entries.stream().filter(BacktestEntry::failed).count());
    return BacktestResult.create(entries);
  }

  private Outcome solve(BacktestRequest request, SolverChoice solverChoice, int start, int end) {
    ReturnSample window = request.sample().window(start, end);
    try {
      OptimizationResult result =
          optimizer.optimize(request.spec(), window, request.mode(), solverChoice);
      return new Outcome(start, end, result, null);
    } catch (InfeasibleProblemException | SolverFailureException e) {
      return new Outcome(start, end, null, e);
    }
  }

  private static List<Outcome> await(List<ListenableFuture<Outcome>> futures) {
    try {
      return Futures.allAsList(futures).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for rebalance solves", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof PortfolioException) {
        throw (PortfolioException) e.getCause();
      }
      throw new IllegalStateException("Rebalance solve failed", e.getCause());
    }
  }

  private ImmutableList<BacktestEntry> resolve(BacktestRequest request, List<Outcome> outcomes) {
    FailurePolicy policy = request.failurePolicy().orElse(defaultFailurePolicy);
    ImmutableList.Builder<BacktestEntry> entries = ImmutableList.builder();
    OptimizationResult previous = null;
    for (Outcome outcome : outcomes) {
      OptimizationResult result = outcome.result;
      if (outcome.failure != null) {
        result = onFailure(request, policy, outcome, previous);
      }
      entries.add(
          BacktestEntry.create(
              request.sample().date(outcome.end), outcome.start, outcome.end, result));
      previous = result;
    }
    return entries.build();
  }

  private static OptimizationResult onFailure(
      BacktestRequest request,
      FailurePolicy policy,
      Outcome outcome,
      OptimizationResult previous) {
    SolverException failure = outcome.failure;
    String backend = failure.backendName();
    SolverStatus status = statusOf(failure);
    logger.atWarning().withCause(failure).log(
        "Rebalance on %s failed with %s, policy %s",
        request.sample().date(outcome.end), status, policy);
    switch (policy) {
      case ABORT:
        throw failure;
      case HOLD_PREVIOUS:
        if (previous != null) {
          return previous.toBuilder()
              .setStatus(status)
              .setSolverName(backend)
              .setComposite(Double.NaN)
              .setKappa(OptionalDouble.empty())
              .build();
        }
        return OptimizationResult.failed(
            request.spec().universe(), request.mode(), backend, status);
      case UNDEFINED_WEIGHTS:
        return OptimizationResult.failed(
            request.spec().universe(), request.mode(), backend, status);
      default:
        throw new IllegalStateException("Unhandled failure policy " + policy);
    }
  }

  private static SolverStatus statusOf(SolverException failure) {
    if (failure instanceof InfeasibleRatioException) {
      return SolverStatus.INFEASIBLE_RATIO;
    }
    if (failure instanceof InfeasibleProblemException) {
      return SolverStatus.INFEASIBLE;
    }
    return ((SolverFailureException) failure).reason() == SolverFailureException.Reason.TIMEOUT
        ? SolverStatus.TIMEOUT
        : SolverStatus.NUMERICAL_FAILURE;
  }

  /** Either the result of one rebalance solve or the failure it raised. */
  private static final class Outcome {
    final int start;
    final int end;
    final OptimizationResult result;
    final SolverException failure;

    Outcome(int start, int end, OptimizationResult result, SolverException failure) {
      this.start = start;
      this.end = end;
      this.result = result;
      this.failure = failure;
    }
  }
}
