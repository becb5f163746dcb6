package com.verlumen.portfolio.solver;

import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.inject.Inject;
import com.verlumen.portfolio.errors.PortfolioException;
import com.verlumen.portfolio.errors.SolverFailureException;
import com.verlumen.portfolio.errors.UnsupportedProblemClassException;
import com.verlumen.portfolio.errors.ValidationException;
import com.verlumen.portfolio.program.CanonicalProgram;
import com.verlumen.portfolio.program.ProblemClass;
import com.verlumen.portfolio.spec.SolverChoice;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link SolverAdapter}. Backends come from the registry bound in {@link SolverModule};
 * the class-to-backend defaults and the timeout come from {@link SolverConfig}.
 */
final class SolverAdapterImpl implements SolverAdapter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Map<String, SolverBackend> backends;
  private final SolverConfig config;
  private final TimeLimiter timeLimiter;

  @Inject
  SolverAdapterImpl(
      Map<String, SolverBackend> backends, SolverConfig config, TimeLimiter timeLimiter) {
    this.backends = backends;
    this.config = config;
    this.timeLimiter = timeLimiter;
  }

  @Override
  public SolverSolution solve(CanonicalProgram program, SolverChoice choice) {
    SolverBackend backend = select(program.problemClass(), choice);
    SolverSolution solution = invoke(backend, program);
    if (!solution.status().isSolverFailure() || !config.retryWithAlternateBackend()) {
      return solution;
    }
    Optional<SolverBackend> alternate =
        backends.values().stream()
            .filter(candidate -> !candidate.name().equals(backend.name()))
            .filter(candidate -> candidate.supports(program.problemClass()))
            .findFirst();
    if (alternate.isEmpty()) {
      logger.atWarning().log(
          "%s returned %s and no alternate backend supports %s",
          backend.name(), solution.status(), program.problemClass());
      return solution;
    }
    logger.atWarning().log(
        "%s returned %s, retrying on %s",
        backend.name(), solution.status(), alternate.get().name());
    return invoke(alternate.get(), program);
  }

  @Override
  public String resolveBackend(ProblemClass problemClass, SolverChoice choice) {
    return select(problemClass, choice).name();
  }

  private SolverBackend select(ProblemClass problemClass, SolverChoice choice) {
    if (choice.isAuto()) {
      String name = config.defaultBackends().get(problemClass);
      if (name == null) {
        throw ValidationException.format("No default backend configured for %s", problemClass);
      }
      return lookup(name);
    }
    SolverBackend backend = lookup(choice.backendName().get());
    if (!backend.supports(problemClass)) {
      throw new UnsupportedProblemClassException(backend.name(), problemClass.name());
    }
    return backend;
  }

  private SolverBackend lookup(String name) {
    SolverBackend backend = backends.get(name);
    if (backend == null) {
      throw ValidationException.format(
          "Unknown solver backend '%s', known backends: %s", name, backends.keySet());
    }
    return backend;
  }

  private SolverSolution invoke(SolverBackend backend, CanonicalProgram program) {
    long timeoutMillis = config.timeout().toMillis();
    try {
      return timeLimiter.callWithTimeout(
          () -> backend.solve(program, config.timeout()), timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      logger.atWarning().log(
          "%s timed out after %d ms on %s", backend.name(), timeoutMillis, program);
      return SolverSolution.failed(backend.name(), SolverStatus.TIMEOUT);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SolverFailureException(
          backend.name(), SolverFailureException.Reason.TIMEOUT, "Interrupted while solving", e);
    } catch (ExecutionException | UncheckedExecutionException | ExecutionError e) {
      // The time limiter wraps whatever the backend threw.
      if (e.getCause() instanceof PortfolioException) {
        throw (PortfolioException) e.getCause();
      }
      logger.atSevere().withCause(e.getCause()).log("%s failed on %s", backend.name(), program);
      return SolverSolution.failed(backend.name(), SolverStatus.NUMERICAL_FAILURE);
    }
  }
}
