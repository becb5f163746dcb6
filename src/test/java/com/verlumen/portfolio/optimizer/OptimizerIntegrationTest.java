package com.verlumen.portfolio.optimizer;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.verlumen.portfolio.backtesting.FailurePolicy;
import com.verlumen.portfolio.config.EngineConfig;
import com.verlumen.portfolio.config.PortfolioEngineModule;
import com.verlumen.portfolio.errors.InvalidObjectiveCombinationException;
import com.verlumen.portfolio.errors.UnsupportedProblemClassException;
import com.verlumen.portfolio.program.BuilderOptions;
import com.verlumen.portfolio.returns.ReturnSample;
import com.verlumen.portfolio.solver.SolverConfig;
import com.verlumen.portfolio.spec.AssetUniverse;
import com.verlumen.portfolio.spec.Bounds;
import com.verlumen.portfolio.spec.BoxConstraint;
import com.verlumen.portfolio.spec.LongOnlyConstraint;
import com.verlumen.portfolio.spec.Objective;
import com.verlumen.portfolio.spec.OptimizationMode;
import com.verlumen.portfolio.spec.PortfolioSpec;
import com.verlumen.portfolio.spec.RiskMeasure;
import com.verlumen.portfolio.spec.SolverChoice;
import com.verlumen.portfolio.spec.WeightSumConstraint;
import com.verlumen.portfolio.testing.Samples;
import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;

/** End-to-end solves through the ojAlgo backends. */
@RunWith(TestParameterInjector.class)
public class OptimizerIntegrationTest {
  private static final double TOLERANCE = 1e-6;

  @Inject private Optimizer optimizer;

  private final PortfolioSpec budget =
      PortfolioSpec.create(Samples.ABC)
          .withConstraint(WeightSumConstraint.fullInvestment())
          .withConstraint(LongOnlyConstraint.create());

  @Before
  public void setUp() {
    Guice.createInjector(PortfolioEngineModule.create(EngineConfig.defaults()))
        .injectMembers(this);
  }

  @Test
  public void optimize_meanReturn_putsEverythingInBestAsset() {
    // Act
    OptimizationResult result =
        optimizer.optimize(
            budget.withObjective(Objective.meanReturn()),
            Samples.fourMonths(),
            OptimizationMode.PLAIN);

    // Assert
    assertThat(result.weightsArray())
        .usingTolerance(TOLERANCE)
        .containsExactly(0.0, 1.0, 0.0)
        .inOrder();
    assertThat(result.solverName()).isEqualTo(SolverConfig.OJALGO_LP);
    assertThat(result.mean()).isWithin(TOLERANCE).of(0.025);
  }

  @Test
  public void optimize_minVariance_honorsBudgetAndLongOnly() {
    // Act
    OptimizationResult result =
        optimizer.optimize(
            budget.withObjective(Objective.variance()),
            Samples.twelveWeeks(),
            OptimizationMode.PLAIN);

    // Assert
    assertThat(sum(result.weightsArray())).isWithin(TOLERANCE).of(1.0);
    for (double weight : result.weightsArray()) {
      assertThat(weight).isAtLeast(-TOLERANCE);
    }
    assertThat(result.solverName()).isEqualTo(SolverConfig.OJALGO_QP);
    assertThat(result.composite())
        .isWithin(1e-9)
        .of(RiskMeasures.variance(Samples.twelveWeeks(), result.weightsArray()));
  }

  @Test
  public void optimize_uniformBox_capsEveryWeight() {
    // Act
    OptimizationResult result =
        optimizer.optimize(
            budget.withConstraint(BoxConstraint.uniform(0.0, 0.5))
                .withObjective(Objective.meanReturn()),
            Samples.fourMonths(),
            OptimizationMode.PLAIN);

    // Assert
    assertThat(result.weightsArray())
        .usingTolerance(TOLERANCE)
        .containsExactly(0.5, 0.5, 0.0)
        .inOrder();
  }

  @Test
  public void optimize_expectedShortfallAtPinnedWeights_equalsSortedClosedForm() {
    // Arrange
    double[] pinned = {0.2, 0.5, 0.3};
    PortfolioSpec spec =
        PortfolioSpec.create(Samples.ABC)
            .withConstraint(
                BoxConstraint.forAssets(
                    ImmutableMap.of(
                        "A", Bounds.exactly(pinned[0]),
                        "B", Bounds.exactly(pinned[1]),
                        "C", Bounds.exactly(pinned[2]))))
            .withObjective(Objective.expectedShortfall(0.25));

    // Act
    OptimizationResult result =
        optimizer.optimize(spec, Samples.twelveWeeks(), OptimizationMode.PLAIN);

    // Assert
    double closedForm = RiskMeasures.expectedShortfall(Samples.twelveWeeks(), pinned, 0.25);
    assertThat(result.composite()).isWithin(1e-9).of(closedForm);
    assertThat(result.riskMeasures().get(RiskMeasure.EXPECTED_SHORTFALL))
        .isWithin(1e-9)
        .of(closedForm);
  }

  @Test
  public void optimize_quadraticShortfallAtPinnedWeights_nonDecreasingAsTailShrinks() {
    // Arrange
    double[] pinned = {0.4, 0.4, 0.2};
    PortfolioSpec pinnedSpec =
        PortfolioSpec.create(Samples.ABC)
            .withConstraint(
                BoxConstraint.forAssets(
                    ImmutableMap.of(
                        "A", Bounds.exactly(pinned[0]),
                        "B", Bounds.exactly(pinned[1]),
                        "C", Bounds.exactly(pinned[2]))));
    double previous = Double.NEGATIVE_INFINITY;

    // Act & Assert
    for (double p : new double[] {0.5, 0.25, 0.1}) {
      OptimizationResult result =
          optimizer.optimize(
              pinnedSpec.withObjective(Objective.expectedQuadraticShortfall(p)),
              Samples.twelveWeeks(),
              OptimizationMode.PLAIN);
      assertThat(result.solverName()).isEqualTo(SolverConfig.OJALGO_SOCP);
      assertThat(result.composite())
          .isWithin(1e-5)
          .of(RiskMeasures.expectedQuadraticShortfall(Samples.twelveWeeks(), pinned, p));
      assertThat(result.composite()).isAtLeast(previous - 1e-9);
      previous = result.composite();
    }
  }

  @Test
  public void optimize_minRisk_invariantToAssetOrder(@TestParameter RiskMeasure measure) {
    // Arrange
    AssetUniverse reordered = AssetUniverse.of("C", "A", "B");
    PortfolioSpec permuted =
        PortfolioSpec.create(reordered)
            .withConstraint(WeightSumConstraint.fullInvestment())
            .withConstraint(LongOnlyConstraint.create())
            .withObjective(measure.objective(0.25));

    // Act
    OptimizationResult original =
        optimizer.optimize(
            budget.withObjective(measure.objective(0.25)),
            Samples.twelveWeeks(),
            OptimizationMode.PLAIN);
    OptimizationResult shuffled =
        optimizer.optimize(
            permuted, Samples.twelveWeeks().reorder(reordered), OptimizationMode.PLAIN);

    // Assert
    assertThat(shuffled.composite()).isWithin(1e-6).of(original.composite());
  }

  @Test
  public void optimize_maxSharpe_invariantToReturnScale() {
    // Arrange
    PortfolioSpec spec =
        budget.withObjective(Objective.meanReturn()).withObjective(Objective.variance());
    ReturnSample sample = Samples.twelveWeeks();

    // Act
    OptimizationResult base =
        optimizer.optimize(spec, sample, OptimizationMode.MAX_SHARPE_RATIO);
    OptimizationResult scaled =
        optimizer.optimize(spec, sample.scaled(3.0), OptimizationMode.MAX_SHARPE_RATIO);

    // Assert
    assertThat(base.kappa().getAsDouble()).isGreaterThan(0.0);
    assertThat(sum(base.weightsArray())).isWithin(TOLERANCE).of(1.0);
    assertThat(scaled.weightsArray())
        .usingTolerance(1e-4)
        .containsExactly(base.weightsArray())
        .inOrder();
  }

  @Test
  public void optimize_maxSharpeWithBindingBox_capsWeightsAndLowersRatio() {
    // Arrange
    PortfolioSpec spec =
        budget.withObjective(Objective.meanReturn()).withObjective(Objective.variance());
    PortfolioSpec boxed = spec.withConstraint(BoxConstraint.uniform(0.0, 0.4));
    ReturnSample sample = Samples.twelveWeeks();

    // Act
    OptimizationResult free = optimizer.optimize(spec, sample, OptimizationMode.MAX_SHARPE_RATIO);
    OptimizationResult capped =
        optimizer.optimize(boxed, sample, OptimizationMode.MAX_SHARPE_RATIO);

    // Assert
    assertThat(Arrays.stream(free.weightsArray()).max().getAsDouble()).isGreaterThan(0.4);
    assertThat(sum(capped.weightsArray())).isWithin(TOLERANCE).of(1.0);
    for (double weight : capped.weightsArray()) {
      assertThat(weight).isAtLeast(-TOLERANCE);
      assertThat(weight).isAtMost(0.4 + TOLERANCE);
    }
    assertThat(Arrays.stream(capped.weightsArray()).max().getAsDouble())
        .isWithin(1e-5)
        .of(0.4);
    assertThat(sharpe(capped, sample)).isAtMost(sharpe(free, sample) + 1e-9);
  }

  @Test
  public void optimize_maxQuadraticShortfallRatio_invariantToReturnScale() {
    // Arrange
    PortfolioSpec spec =
        budget
            .withObjective(Objective.meanReturn())
            .withObjective(Objective.expectedQuadraticShortfall(0.25));
    ReturnSample sample = Samples.twelveWeeks();

    // Act
    OptimizationResult base = optimizer.optimize(spec, sample, OptimizationMode.MAX_EQS_RATIO);
    OptimizationResult scaled =
        optimizer.optimize(spec, sample.scaled(3.0), OptimizationMode.MAX_EQS_RATIO);

    // Assert
    assertThat(base.kappa().getAsDouble()).isGreaterThan(0.0);
    assertThat(sum(base.weightsArray())).isWithin(TOLERANCE).of(1.0);
    assertThat(base.riskMeasures()).containsKey(RiskMeasure.EXPECTED_QUADRATIC_SHORTFALL);
    assertThat(scaled.weightsArray())
        .usingTolerance(1e-3)
        .containsExactly(base.weightsArray())
        .inOrder();
  }

  @Test
  public void optimize_maxExpectedShortfallRatio_returnsBudgetedWeights() {
    // Arrange
    PortfolioSpec spec =
        budget
            .withObjective(Objective.meanReturn())
            .withObjective(Objective.expectedShortfall(0.25));

    // Act
    OptimizationResult result =
        optimizer.optimize(spec, Samples.twelveWeeks(), OptimizationMode.MAX_ES_RATIO);

    // Assert
    assertThat(result.kappa().isPresent()).isTrue();
    assertThat(sum(result.weightsArray())).isWithin(TOLERANCE).of(1.0);
    assertThat(result.riskMeasures()).containsKey(RiskMeasure.EXPECTED_SHORTFALL);
  }

  @Test
  public void optimize_factorizedVariance_matchesDenseForm() {
    // Arrange
    Optimizer factorized =
        Guice.createInjector(
                PortfolioEngineModule.create(
                    EngineConfig.create(
                        SolverConfig.defaults(),
                        BuilderOptions.create(0),
                        FailurePolicy.HOLD_PREVIOUS,
                        1)))
            .getInstance(Optimizer.class);
    PortfolioSpec spec = budget.withObjective(Objective.variance());

    // Act
    OptimizationResult dense =
        optimizer.optimize(spec, Samples.twelveWeeks(), OptimizationMode.PLAIN);
    OptimizationResult viaFactors =
        factorized.optimize(spec, Samples.twelveWeeks(), OptimizationMode.PLAIN);

    // Assert
    assertThat(viaFactors.composite()).isWithin(1e-8).of(dense.composite());
  }

  @Test
  public void optimize_ratioModeWithMismatchedRisk_throwsInvalidObjectiveCombination() {
    // Arrange
    PortfolioSpec spec =
        budget.withObjective(Objective.meanReturn()).withObjective(Objective.variance());

    // Act & Assert
    assertThrows(
        InvalidObjectiveCombinationException.class,
        () -> optimizer.optimize(spec, Samples.twelveWeeks(), OptimizationMode.MAX_EQS_RATIO));
  }

  @Test
  public void optimize_linearOnlyBackendForQuadraticProgram_throwsUnsupportedProblemClass() {
    // Arrange
    PortfolioSpec spec = budget.withObjective(Objective.variance());

    // Act & Assert
    assertThrows(
        UnsupportedProblemClassException.class,
        () ->
            optimizer.optimize(
                spec,
                Samples.twelveWeeks(),
                OptimizationMode.PLAIN,
                SolverChoice.named(SolverConfig.OJALGO_LP)));
  }

  private static double sharpe(OptimizationResult result, ReturnSample sample) {
    return result.mean() / Math.sqrt(RiskMeasures.variance(sample, result.weightsArray()));
  }

  private static double sum(double[] values) {
    return Arrays.stream(values).sum();
  }
}
