package com.verlumen.portfolio.frontier;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.portfolio.returns.ReturnSample;
import com.verlumen.portfolio.spec.Objective;
import com.verlumen.portfolio.spec.PortfolioSpec;
import com.verlumen.portfolio.spec.RiskMeasure;
import com.verlumen.portfolio.spec.SolverChoice;
import java.util.Optional;

/** Inputs of one efficient-frontier sweep. */
@AutoValue
public abstract class FrontierRequest {
  public static final int DEFAULT_POINT_COUNT = 25;

  public static Builder builder() {
    return new AutoValue_FrontierRequest.Builder()
        .setRiskMeasure(RiskMeasure.VARIANCE)
        .setPointCount(DEFAULT_POINT_COUNT)
        .setTailProbability(Objective.DEFAULT_TAIL_PROBABILITY);
  }

  /** Universe and constraints; objectives and return targets are replaced during the sweep. */
  public abstract PortfolioSpec spec();

  public abstract ReturnSample sample();

  public abstract RiskMeasure riskMeasure();

  public abstract int pointCount();

  /** Tail probability of shortfall measures; ignored for variance. */
  public abstract double tailProbability();

  public abstract Optional<SolverChoice> solverChoice();

  public SolverChoice effectiveSolverChoice() {
    return solverChoice().orElse(spec().solverChoice());
  }

  /** Builder for {@link FrontierRequest}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSpec(PortfolioSpec spec);

    public abstract Builder setSample(ReturnSample sample);

    public abstract Builder setRiskMeasure(RiskMeasure riskMeasure);

    public abstract Builder setPointCount(int pointCount);

    public abstract Builder setTailProbability(double tailProbability);

    public abstract Builder setSolverChoice(SolverChoice solverChoice);

    abstract FrontierRequest autoBuild();

    public FrontierRequest build() {
      FrontierRequest request = autoBuild();
      checkArgument(request.pointCount() >= 2, "A frontier needs at least two points");
      return request;
    }
  }
}
