package com.verlumen.portfolio.frontier;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.inject.Inject;
import com.verlumen.portfolio.errors.InfeasibleProblemException;
import com.verlumen.portfolio.errors.PortfolioException;
import com.verlumen.portfolio.errors.SolverFailureException;
import com.verlumen.portfolio.optimizer.OptimizationResult;
import com.verlumen.portfolio.optimizer.Optimizer;
import com.verlumen.portfolio.spec.Constraint;
import com.verlumen.portfolio.spec.Objective;
import com.verlumen.portfolio.spec.OptimizationMode;
import com.verlumen.portfolio.spec.PortfolioSpec;
import com.verlumen.portfolio.spec.ReturnTargetConstraint;
import com.verlumen.portfolio.spec.SolverChoice;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Default {@link FrontierGenerator}. Anchors the sweep with a max-mean and a min-risk solve under
 * the request's constraints, then minimizes risk at evenly spaced return targets between the two
 * anchor means.
 */
final class FrontierGeneratorImpl implements FrontierGenerator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Relative slack before a risk decrease between neighbouring points counts as a violation. */
  static final double MONOTONICITY_TOLERANCE = 1e-6;

  /** Mean spread below which the anchors are treated as the same portfolio. */
  static final double MEAN_RANGE_TOLERANCE = 1e-8;

  private final Optimizer optimizer;
  private final ListeningExecutorService executor;

  @Inject
  FrontierGeneratorImpl(Optimizer optimizer, ListeningExecutorService executor) {
    this.optimizer = optimizer;
    this.executor = executor;
  }

  @Override
  public EfficientFrontier generate(FrontierRequest request) {
    PortfolioSpec base =
        request
            .spec()
            .withoutObjectives()
            .filterConstraints(constraint -> constraint.kind() != Constraint.Kind.RETURN_TARGET);
    Objective risk = request.riskMeasure().objective(request.tailProbability());
    SolverChoice solverChoice = request.effectiveSolverChoice();

    OptimizationResult maxMean =
        optimizer.optimize(
            base.withObjective(Objective.meanReturn()),
            request.sample(),
            OptimizationMode.PLAIN,
            solverChoice);
    OptimizationResult minRisk =
        optimizer.optimize(
            base.withObjective(risk), request.sample(), OptimizationMode.PLAIN, solverChoice);
    double low = minRisk.mean();
    double high = Math.max(low, maxMean.mean());
    if (high - low <= MEAN_RANGE_TOLERANCE * Math.max(1.0, Math.abs(high))) {
      logger.atWarning().log(
          "Min-risk portfolio already attains the max mean %.6g; frontier is a single point", high);
      FrontierPoint only =
          FrontierPoint.create(low, minRisk.riskMeasures().get(request.riskMeasure()), minRisk);
      return EfficientFrontier.create(
          request.riskMeasure(), ImmutableList.of(only), ImmutableList.of(), ImmutableList.of());
    }
    logger.atInfo().log(
        "Tracing %d-point %s frontier between means %.6g and %.6g",
        request.pointCount(), request.riskMeasure(), low, high);

    List<Double> targets = new ArrayList<>();
    List<ListenableFuture<Optional<FrontierPoint>>> futures = new ArrayList<>();
    for (int k = 0; k < request.pointCount(); k++) {
      double target = low + (high - low) * k / (request.pointCount() - 1);
      PortfolioSpec pointSpec =
          base.withObjective(risk).withConstraint(ReturnTargetConstraint.exactly(target));
      targets.add(target);
      futures.add(executor.submit(() -> solvePoint(request, pointSpec, target, solverChoice)));
    }
    List<Optional<FrontierPoint>> solved = await(futures);

    ImmutableList.Builder<FrontierPoint> points = ImmutableList.builder();
    ImmutableList.Builder<Integer> violations = ImmutableList.builder();
    ImmutableList.Builder<Double> failedTargets = ImmutableList.builder();
    FrontierPoint previous = null;
    int index = 0;
    for (int k = 0; k < solved.size(); k++) {
      if (solved.get(k).isEmpty()) {
        failedTargets.add(targets.get(k));
        continue;
      }
      FrontierPoint point = solved.get(k).get();
      if (previous != null && decreased(previous.risk(), point.risk())) {
        logger.atWarning().log(
            "Frontier risk fell from %.8g to %.8g at target %.6g",
            previous.risk(), point.risk(), point.target());
        violations.add(index);
      }
      points.add(point);
      previous = point;
      index++;
    }
    return EfficientFrontier.create(
        request.riskMeasure(), points.build(), violations.build(), failedTargets.build());
  }

  private Optional<FrontierPoint> solvePoint(
      FrontierRequest request, PortfolioSpec pointSpec, double target, SolverChoice choice) {
    try {
      OptimizationResult result =
          optimizer.optimize(pointSpec, request.sample(), OptimizationMode.PLAIN, choice);
      return Optional.of(
          FrontierPoint.create(target, result.riskMeasures().get(request.riskMeasure()), result));
    } catch (InfeasibleProblemException | SolverFailureException e) {
      logger.atWarning().withCause(e).log("Frontier target %.6g failed", target);
      return Optional.empty();
    }
  }

  private static boolean decreased(double before, double after) {
    return after < before - MONOTONICITY_TOLERANCE * Math.max(1.0, Math.abs(before));
  }

  private static <T> List<T> await(List<ListenableFuture<T>> futures) {
    try {
      return Futures.allAsList(futures).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while tracing the frontier", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof PortfolioException) {
        throw (PortfolioException) e.getCause();
      }
      throw new IllegalStateException("Frontier solve failed", e.getCause());
    }
  }
}
