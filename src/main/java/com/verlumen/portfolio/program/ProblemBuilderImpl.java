package com.verlumen.portfolio.program;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.portfolio.errors.InvalidObjectiveCombinationException;
import com.verlumen.portfolio.errors.ValidationException;
import com.verlumen.portfolio.returns.MomentEstimates;
import com.verlumen.portfolio.returns.ReturnSample;
import com.verlumen.portfolio.spec.AssetUniverse;
import com.verlumen.portfolio.spec.Bounds;
import com.verlumen.portfolio.spec.BoxConstraint;
import com.verlumen.portfolio.spec.Constraint;
import com.verlumen.portfolio.spec.FactorExposureConstraint;
import com.verlumen.portfolio.spec.GroupConstraint;
import com.verlumen.portfolio.spec.Objective;
import com.verlumen.portfolio.spec.OptimizationMode;
import com.verlumen.portfolio.spec.PortfolioSpec;
import com.verlumen.portfolio.spec.ReturnTargetConstraint;
import com.verlumen.portfolio.spec.WeightSumConstraint;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default {@link ProblemBuilder}.
 *
 * <p>Plain mode adds every return term and every risk term into one quadratic-utility objective.
 * Ratio modes solve the homogeneous substitute: minimize R(y) subject to (μ - r_f)'y = 1 and
 * 1'y = κ, with every constant in the linear constraints multiplied by κ.
 */
final class ProblemBuilderImpl implements ProblemBuilder {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final BuilderOptions options;

  @Inject
  ProblemBuilderImpl(BuilderOptions options) {
    this.options = options;
  }

  @Override
  public CanonicalProgram build(PortfolioSpec spec, ReturnSample window, OptimizationMode mode) {
    validateInputs(spec, window);
    validateObjectives(spec, mode);

    Compilation compilation = new Compilation(spec, window, mode);
    compilation.emitWeights();
    compilation.emitConstraints();
    compilation.emitObjectives();
    CanonicalProgram program = compilation.program.build();
    logger.atFine().log("Built %s for mode %s over %d periods", program, mode, window.periods());
    return program;
  }

  private static void validateInputs(PortfolioSpec spec, ReturnSample window) {
    if (!spec.universe().equals(window.universe())) {
      throw ValidationException.format(
          "Return sample assets %s do not match spec assets %s",
          window.universe().assetIds(), spec.universe().assetIds());
    }
    if (window.isEmpty()) {
      throw new ValidationException("Return window is empty");
    }
    window.requireComplete();
  }

  private static void validateObjectives(PortfolioSpec spec, OptimizationMode mode) {
    if (spec.objectives().isEmpty()) {
      throw new ValidationException("Portfolio spec has no objectives");
    }
    if (!mode.isRatio()) {
      return;
    }
    Objective.Kind expected = mode.ratioDenominator().get().objectiveKind();
    if (spec.returnObjectives().size() != 1
        || spec.riskObjectives().size() != 1
        || spec.riskObjectives().get(0).kind() != expected) {
      throw new InvalidObjectiveCombinationException(
          String.format(
              "%s needs exactly one MEAN_RETURN and one %s objective, got %s",
              mode, expected, spec.objectives()));
    }
  }

  /** State of one build; never shared between calls. */
  private final class Compilation {
    private final PortfolioSpec spec;
    private final ReturnSample window;
    private final MomentEstimates moments;
    private final OptimizationMode mode;
    private final CanonicalProgram.Builder program = CanonicalProgram.builder();
    private final int assets;
    private int kappa = -1;

    Compilation(PortfolioSpec spec, ReturnSample window, OptimizationMode mode) {
      this.spec = spec;
      this.window = window;
      this.moments = MomentEstimates.of(window);
      this.mode = mode;
      this.assets = spec.universe().size();
    }

    private boolean isRatio() {
      return kappa >= 0;
    }

    void emitWeights() {
      AssetUniverse universe = spec.universe();
      String prefix = mode.isRatio() ? "y[" : "w[";
      for (int j = 0; j < assets; j++) {
        program.addVariable(prefix + universe.assetId(j) + "]");
      }
      program.setWeightCount(assets);
      if (!mode.isRatio()) {
        return;
      }
      kappa = program.addVariable("kappa");
      program.setKappaIndex(kappa);

      Map<Integer, Double> numerator = new LinkedHashMap<>();
      for (int j = 0; j < assets; j++) {
        numerator.put(j, moments.mean(j) - spec.riskFreeRate());
      }
      program.addRow("ratio:numerator", numerator, 1.0, 1.0);

      Map<Integer, Double> normalization = allWeights();
      normalization.put(kappa, -1.0);
      program.addRow("ratio:normalization", normalization, 0.0, 0.0);
    }

    void emitConstraints() {
      int index = 0;
      for (Constraint constraint : spec.constraints()) {
        String name = constraint.kind().name().toLowerCase() + "[" + index++ + "]";
        switch (constraint.kind()) {
          case WEIGHT_SUM:
            emitWeightSum(name, (WeightSumConstraint) constraint);
            break;
          case LONG_ONLY:
            for (int j = 0; j < assets; j++) {
              tightenBounds(j, Bounds.atLeast(0.0));
            }
            break;
          case BOX:
            emitBox(name, (BoxConstraint) constraint);
            break;
          case GROUP:
            emitGroup(name, (GroupConstraint) constraint);
            break;
          case RETURN_TARGET:
            emitReturnTarget(name, (ReturnTargetConstraint) constraint);
            break;
          case FACTOR_EXPOSURE:
            emitFactorExposure(name, (FactorExposureConstraint) constraint);
            break;
          default:
            throw ValidationException.format("Unknown constraint kind %s", constraint.kind());
        }
      }
      for (int j = 0; j < assets; j++) {
        if (program.lowerBound(j) > program.upperBound(j)) {
          throw ValidationException.format(
              "Conflicting bounds on %s: [%s, %s]",
              spec.universe().assetId(j), program.lowerBound(j), program.upperBound(j));
        }
      }
    }

    void emitObjectives() {
      List<Objective> riskObjectives = spec.riskObjectives();
      if (!isRatio()) {
        for (Objective objective : spec.returnObjectives()) {
          for (int j = 0; j < assets; j++) {
            program.addLinearObjective(j, -objective.weight() * moments.mean(j));
          }
        }
      }
      for (int k = 0; k < riskObjectives.size(); k++) {
        Objective objective = riskObjectives.get(k);
        double scale = isRatio() ? 1.0 : objective.weight();
        String prefix = objective.kind().name().toLowerCase() + "[" + k + "].";
        switch (objective.kind()) {
          case VARIANCE:
            emitVariance(prefix, scale);
            break;
          case EXPECTED_SHORTFALL:
            emitExpectedShortfall(prefix, scale, objective.tailProbability());
            break;
          case EXPECTED_QUADRATIC_SHORTFALL:
            emitExpectedQuadraticShortfall(prefix, scale, objective.tailProbability());
            break;
          default:
            throw ValidationException.format("Unknown risk objective %s", objective.kind());
        }
      }
    }

    private void emitBox(String name, BoxConstraint box) {
      for (int j = 0; j < assets; j++) {
        Optional<Bounds> bounds = box.boundsFor(spec.universe().assetId(j));
        if (bounds.isEmpty()) {
          continue;
        }
        if (isRatio()) {
          Map<Integer, Double> single = new LinkedHashMap<>();
          single.put(j, 1.0);
          addBoundedRow(name + "." + spec.universe().assetId(j), single, bounds.get());
        } else {
          tightenBounds(j, bounds.get());
        }
      }
    }

    private void emitGroup(String name, GroupConstraint group) {
      Map<Integer, Double> coefficients = new LinkedHashMap<>();
      for (String assetId : group.assetIds()) {
        coefficients.put(spec.universe().indexOf(assetId), 1.0);
      }
      addBoundedRow(name + "." + group.name(), coefficients, group.bounds());
    }

    private void emitReturnTarget(String name, ReturnTargetConstraint target) {
      Map<Integer, Double> coefficients = new LinkedHashMap<>();
      for (int j = 0; j < assets; j++) {
        coefficients.put(j, moments.mean(j));
      }
      Bounds bounds =
          target.comparison() == ReturnTargetConstraint.Comparison.EXACTLY
              ? Bounds.exactly(target.target())
              : Bounds.atLeast(target.target());
      addBoundedRow(name, coefficients, bounds);
    }

    private void emitFactorExposure(String name, FactorExposureConstraint exposure) {
      Map<Integer, Double> coefficients = new LinkedHashMap<>();
      exposure.loadings().forEach(
          (assetId, loading) -> coefficients.put(spec.universe().indexOf(assetId), loading));
      addBoundedRow(name + "." + exposure.factorName(), coefficients, exposure.bounds());
    }

    /** Σ as a dense quadratic form for small universes, otherwise through y = D w. */
    private void emitVariance(String prefix, double scale) {
      double covarianceScale = moments.covarianceScale();
      if (covarianceScale == 0) {
        logger.atFine().log("Single-period window: %s variance term is identically zero", prefix);
        return;
      }
      if (assets <= options.denseCovarianceLimit()) {
        for (int a = 0; a < assets; a++) {
          for (int b = 0; b < assets; b++) {
            double coefficient = scale * moments.covariance(a, b);
            if (coefficient != 0) {
              program.addQuadraticObjective(a, b, coefficient);
            }
          }
        }
        return;
      }
      for (int i = 0; i < window.periods(); i++) {
        int projected = program.addVariable(prefix + "y[" + i + "]");
        Map<Integer, Double> definition = new LinkedHashMap<>();
        definition.put(projected, 1.0);
        for (int j = 0; j < assets; j++) {
          double demeaned = moments.demeaned(i, j);
          if (demeaned != 0) {
            definition.put(j, -demeaned);
          }
        }
        program.addRow(prefix + "factor[" + i + "]", definition, 0.0, 0.0);
        program.addQuadraticObjective(projected, projected, scale * covarianceScale);
      }
    }

    /** -t + 1/(T p) * sum(u), u_i >= t - r_i'w, u_i >= 0. */
    private void emitExpectedShortfall(String prefix, double scale, double tailProbability) {
      int periods = window.periods();
      int threshold = program.addVariable(prefix + "t");
      program.addLinearObjective(threshold, -scale);
      for (int i = 0; i < periods; i++) {
        int excess = program.addVariable(prefix + "u[" + i + "]", 0.0, Double.POSITIVE_INFINITY);
        program.addLinearObjective(excess, scale / (periods * tailProbability));
        addShortfallRow(prefix + "shortfall[" + i + "]", i, excess, threshold);
      }
    }

    /** -t + 1/p * z, s_i >= t - r_i'w, s_i >= 0, ||s||_2 <= z. */
    private void emitExpectedQuadraticShortfall(
        String prefix, double scale, double tailProbability) {
      int threshold = program.addVariable(prefix + "t");
      program.addLinearObjective(threshold, -scale);
      List<Integer> shortfalls = new ArrayList<>();
      for (int i = 0; i < window.periods(); i++) {
        int shortfall =
            program.addVariable(prefix + "s[" + i + "]", 0.0, Double.POSITIVE_INFINITY);
        shortfalls.add(shortfall);
        addShortfallRow(prefix + "shortfall[" + i + "]", i, shortfall, threshold);
      }
      int normBound = program.addVariable(prefix + "z", 0.0, Double.POSITIVE_INFINITY);
      program.addLinearObjective(normBound, scale / tailProbability);
      program.addCone(prefix + "norm", shortfalls, normBound);
    }

    private void addShortfallRow(String name, int period, int shortfall, int threshold) {
      Map<Integer, Double> row = new LinkedHashMap<>();
      row.put(shortfall, 1.0);
      row.put(threshold, -1.0);
      for (int j = 0; j < assets; j++) {
        double value = window.value(period, j);
        if (value != 0) {
          row.put(j, value);
        }
      }
      program.addRow(name, row, 0.0, Double.POSITIVE_INFINITY);
    }

    /** In ratio mode full investment homogenizes to 1'y = κ, the normalization row itself. */
    private void emitWeightSum(String name, WeightSumConstraint constraint) {
      Bounds sum = constraint.bounds();
      if (isRatio() && sum.isEquality() && sum.lower() == 1.0) {
        logger.atFine().log("%s coincides with the ratio normalization; not emitted", name);
        return;
      }
      addBoundedRow(name, allWeights(), sum);
    }

    private Map<Integer, Double> allWeights() {
      Map<Integer, Double> coefficients = new LinkedHashMap<>();
      for (int j = 0; j < assets; j++) {
        coefficients.put(j, 1.0);
      }
      return coefficients;
    }

    private void tightenBounds(int variable, Bounds bounds) {
      program.setBounds(
          variable,
          Math.max(program.lowerBound(variable), bounds.lower()),
          Math.min(program.upperBound(variable), bounds.upper()));
    }

    /** Emits lower <= a'w <= upper, or its κ-homogenized form in ratio mode. */
    private void addBoundedRow(String name, Map<Integer, Double> coefficients, Bounds bounds) {
      if (!isRatio()) {
        program.addRow(name, coefficients, bounds.lower(), bounds.upper());
        return;
      }
      if (bounds.isEquality()) {
        addHomogenizedRow(name, coefficients, bounds.lower(), 0.0, 0.0);
        return;
      }
      if (bounds.hasLower()) {
        addHomogenizedRow(
            name + ":lower", coefficients, bounds.lower(), 0.0, Double.POSITIVE_INFINITY);
      }
      if (bounds.hasUpper()) {
        addHomogenizedRow(
            name + ":upper", coefficients, bounds.upper(), Double.NEGATIVE_INFINITY, 0.0);
      }
    }

    private void addHomogenizedRow(
        String name,
        Map<Integer, Double> coefficients,
        double constant,
        double lower,
        double upper) {
      Map<Integer, Double> row = new LinkedHashMap<>(coefficients);
      if (constant != 0) {
        row.merge(kappa, -constant, Double::sum);
      }
      program.addRow(name, row, lower, upper);
    }
  }
}
