package com.verlumen.portfolio.program;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.portfolio.errors.InvalidObjectiveCombinationException;
import com.verlumen.portfolio.errors.ValidationException;
import com.verlumen.portfolio.returns.ReturnSample;
import com.verlumen.portfolio.spec.AssetUniverse;
import com.verlumen.portfolio.spec.Bounds;
import com.verlumen.portfolio.spec.BoxConstraint;
import com.verlumen.portfolio.spec.GroupConstraint;
import com.verlumen.portfolio.spec.LongOnlyConstraint;
import com.verlumen.portfolio.spec.Objective;
import com.verlumen.portfolio.spec.OptimizationMode;
import com.verlumen.portfolio.spec.PortfolioSpec;
import com.verlumen.portfolio.spec.WeightSumConstraint;
import com.verlumen.portfolio.testing.Samples;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ProblemBuilderImplTest {
  @Bind private BuilderOptions options = BuilderOptions.defaults();

  @Inject private ProblemBuilderImpl builder;

  private final ReturnSample sample = Samples.fourMonths();
  private final PortfolioSpec base =
      PortfolioSpec.create(Samples.ABC)
          .withConstraint(WeightSumConstraint.fullInvestment())
          .withConstraint(LongOnlyConstraint.create());

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void build_meanReturn_isLinearProgramWithNegatedMeans() {
    // Act
    CanonicalProgram program =
        builder.build(base.withObjective(Objective.meanReturn()), sample, OptimizationMode.PLAIN);

    // Assert
    assertThat(program.problemClass()).isEqualTo(ProblemClass.LP);
    assertThat(program.variableCount()).isEqualTo(3);
    assertThat(program.linearCoefficient(1)).isWithin(1e-12).of(-0.025);
    assertThat(program.lowerBound(0)).isEqualTo(0.0);
    assertThat(rowNames(program)).containsExactly("weight_sum[0]");
  }

  @Test
  public void build_variance_isQuadraticProgram() {
    // Act
    CanonicalProgram program =
        builder.build(base.withObjective(Objective.variance()), sample, OptimizationMode.PLAIN);

    // Assert
    assertThat(program.problemClass()).isEqualTo(ProblemClass.QP);
    assertThat(program.quadraticTerms()).isNotEmpty();
    assertThat(program.variableCount()).isEqualTo(3);
  }

  @Test
  public void build_varianceAboveDenseLimit_usesFactorizedForm() {
    // Arrange
    options = BuilderOptions.create(2);
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);

    // Act
    CanonicalProgram program =
        builder.build(base.withObjective(Objective.variance()), sample, OptimizationMode.PLAIN);

    // Assert
    assertThat(program.problemClass()).isEqualTo(ProblemClass.QP);
    assertThat(program.variableCount()).isEqualTo(3 + sample.periods());
    assertThat(program.quadraticTerms()).hasSize(sample.periods());
    assertThat(rowNames(program)).contains("variance[0].factor[3]");
  }

  @Test
  public void build_expectedShortfall_isLinearWithOneAuxiliaryPerPeriod() {
    // Act
    CanonicalProgram program =
        builder.build(
            base.withObjective(Objective.expectedShortfall(0.25)), sample, OptimizationMode.PLAIN);

    // Assert
    assertThat(program.problemClass()).isEqualTo(ProblemClass.LP);
    // w (3), t, u (4)
    assertThat(program.variableCount()).isEqualTo(8);
    assertThat(program.linearCoefficient(3)).isEqualTo(-1.0);
    assertThat(program.linearCoefficient(4)).isWithin(1e-12).of(1.0);
  }

  @Test
  public void build_expectedQuadraticShortfall_isConic() {
    // Act
    CanonicalProgram program =
        builder.build(
            base.withObjective(Objective.expectedQuadraticShortfall(0.2)),
            sample,
            OptimizationMode.PLAIN);

    // Assert
    assertThat(program.problemClass()).isEqualTo(ProblemClass.SOCP);
    assertThat(program.cones()).hasSize(1);
    assertThat(program.cones().get(0).members()).hasSize(sample.periods());
    int z = program.cones().get(0).bound();
    assertThat(program.linearCoefficient(z)).isWithin(1e-12).of(5.0);
  }

  @Test
  public void build_twoRiskObjectives_ownSeparateAuxiliaryBlocks() {
    // Act
    CanonicalProgram program =
        builder.build(
            base.withObjective(Objective.expectedShortfall(0.25))
                .withObjective(Objective.expectedShortfall(0.5, 3.0)),
            sample,
            OptimizationMode.PLAIN);

    // Assert
    assertThat(program.variableCount()).isEqualTo(3 + 2 * (1 + sample.periods()));
    assertThat(program.variableName(8)).isEqualTo("expected_shortfall[1].t");
    assertThat(program.linearCoefficient(8)).isEqualTo(-3.0);
  }

  @Test
  public void build_boxInPlainMode_tightensVariableBounds() {
    // Act
    CanonicalProgram program =
        builder.build(
            base.withConstraint(
                    BoxConstraint.of(
                        Bounds.of(0.0, 0.6), ImmutableMap.of("B", Bounds.of(0.1, 0.4))))
                .withObjective(Objective.meanReturn()),
            sample,
            OptimizationMode.PLAIN);

    // Assert
    assertThat(program.upperBound(0)).isEqualTo(0.6);
    assertThat(program.lowerBound(1)).isEqualTo(0.1);
    assertThat(program.upperBound(1)).isEqualTo(0.4);
  }

  @Test
  public void build_sharpeRatio_homogenizesConstraints() {
    // Arrange
    PortfolioSpec spec =
        base.withConstraint(GroupConstraint.of("ab", List.of("A", "B"), 0.2, 0.8))
            .withObjective(Objective.meanReturn())
            .withObjective(Objective.variance());

    // Act
    CanonicalProgram program = builder.build(spec, sample, OptimizationMode.MAX_SHARPE_RATIO);

    // Assert
    assertThat(program.isRatio()).isTrue();
    int kappa = program.kappaIndex().getAsInt();
    assertThat(program.variableName(kappa)).isEqualTo("kappa");
    assertThat(program.linearCoefficient(0)).isEqualTo(0.0);
    LinearRow groupLower = row(program, "group[2].ab:lower");
    assertThat(groupLower.coefficients()).containsEntry(kappa, -0.2);
    assertThat(groupLower.lower()).isEqualTo(0.0);
    LinearRow numerator = row(program, "ratio:numerator");
    assertThat(numerator.coefficients().get(1)).isWithin(1e-12).of(0.025);
    assertThat(numerator.lower()).isEqualTo(1.0);
  }

  @Test
  public void build_sharpeRatioWithFullInvestment_emitsNormalizationOnce() {
    // Arrange
    PortfolioSpec spec =
        base.withObjective(Objective.meanReturn()).withObjective(Objective.variance());

    // Act
    CanonicalProgram program = builder.build(spec, sample, OptimizationMode.MAX_SHARPE_RATIO);

    // Assert
    assertThat(rowNames(program)).containsExactly("ratio:numerator", "ratio:normalization");
  }

  @Test
  public void build_sharpeRatioWithLeverageRange_homogenizesBothSides() {
    // Arrange
    PortfolioSpec spec =
        PortfolioSpec.create(Samples.ABC)
            .withConstraint(WeightSumConstraint.of(0.5, 1.5))
            .withObjective(Objective.meanReturn())
            .withObjective(Objective.variance());

    // Act
    CanonicalProgram program = builder.build(spec, sample, OptimizationMode.MAX_SHARPE_RATIO);

    // Assert
    int kappa = program.kappaIndex().getAsInt();
    assertThat(row(program, "weight_sum[0]:lower").coefficients()).containsEntry(kappa, -0.5);
    assertThat(row(program, "weight_sum[0]:upper").coefficients()).containsEntry(kappa, -1.5);
  }

  @Test
  public void build_ratioModeWithWrongRiskKind_throwsInvalidObjectiveCombination() {
    // Arrange
    PortfolioSpec spec =
        base.withObjective(Objective.meanReturn()).withObjective(Objective.expectedShortfall(0.1));

    // Act & Assert
    assertThrows(
        InvalidObjectiveCombinationException.class,
        () -> builder.build(spec, sample, OptimizationMode.MAX_SHARPE_RATIO));
  }

  @Test
  public void build_ratioModeWithoutReturnObjective_throwsInvalidObjectiveCombination() {
    // Arrange
    PortfolioSpec spec = base.withObjective(Objective.expectedShortfall(0.1));

    // Act & Assert
    assertThrows(
        InvalidObjectiveCombinationException.class,
        () -> builder.build(spec, sample, OptimizationMode.MAX_ES_RATIO));
  }

  @Test
  public void build_noObjectives_throwsValidationException() {
    assertThrows(
        ValidationException.class, () -> builder.build(base, sample, OptimizationMode.PLAIN));
  }

  @Test
  public void build_universeMismatch_throwsValidationException() {
    // Arrange
    PortfolioSpec spec =
        PortfolioSpec.create(AssetUniverse.of("A", "B", "D")).withObjective(Objective.meanReturn());

    // Act & Assert
    assertThrows(
        ValidationException.class, () -> builder.build(spec, sample, OptimizationMode.PLAIN));
  }

  @Test
  public void build_longOnlyAgainstNegativeBox_throwsValidationException() {
    // Arrange
    PortfolioSpec spec =
        base.withConstraint(BoxConstraint.uniform(-0.5, -0.1))
            .withObjective(Objective.meanReturn());

    // Act & Assert
    ValidationException thrown =
        assertThrows(
            ValidationException.class, () -> builder.build(spec, sample, OptimizationMode.PLAIN));
    assertThat(thrown).hasMessageThat().contains("Conflicting bounds");
  }

  private static List<String> rowNames(CanonicalProgram program) {
    return program.rows().stream().map(LinearRow::name).collect(Collectors.toList());
  }

  private static LinearRow row(CanonicalProgram program, String name) {
    return program.rows().stream()
        .filter(row -> row.name().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("No row " + name + " in " + rowNames(program)));
  }
}
