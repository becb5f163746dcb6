package com.verlumen.portfolio.program;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Solver-agnostic convex program: minimize c'x + sum(q * x_i * x_j) subject to linear rows,
 * variable bounds and second-order cones.
 *
 * <p>The first {@link #weightCount()} variables are the portfolio weights (or their homogeneous
 * counterparts in ratio mode). Programs are built fresh for each solve and never shared.
 */
public final class CanonicalProgram {
  private final ImmutableList<String> variableNames;
  private final double[] lowerBounds;
  private final double[] upperBounds;
  private final double[] linearObjective;
  private final ImmutableList<QuadraticTerm> quadraticTerms;
  private final ImmutableList<LinearRow> rows;
  private final ImmutableList<SecondOrderCone> cones;
  private final int weightCount;
  private final OptionalInt kappaIndex;
  private final ProblemClass problemClass;

  private CanonicalProgram(Builder builder) {
    this.variableNames = ImmutableList.copyOf(builder.names);
    int size = variableNames.size();
    this.lowerBounds = new double[size];
    this.upperBounds = new double[size];
    this.linearObjective = new double[size];
    for (int v = 0; v < size; v++) {
      lowerBounds[v] = builder.lower.get(v);
      upperBounds[v] = builder.upper.get(v);
      linearObjective[v] = builder.objective.get(v);
    }
    ImmutableList.Builder<QuadraticTerm> quadratic = ImmutableList.builder();
    builder.quadratic.forEach(
        (key, coefficient) -> {
          if (coefficient != 0) {
            quadratic.add(QuadraticTerm.create(key.get(0), key.get(1), coefficient));
          }
        });
    this.quadraticTerms = quadratic.build();
    this.rows = ImmutableList.copyOf(builder.rows);
    this.cones = ImmutableList.copyOf(builder.cones);
    this.weightCount = builder.weightCount;
    this.kappaIndex = builder.kappaIndex;
    if (!cones.isEmpty()) {
      this.problemClass = ProblemClass.SOCP;
    } else if (!quadraticTerms.isEmpty()) {
      this.problemClass = ProblemClass.QP;
    } else {
      this.problemClass = ProblemClass.LP;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public ProblemClass problemClass() {
    return problemClass;
  }

  public int variableCount() {
    return variableNames.size();
  }

  public String variableName(int variable) {
    return variableNames.get(variable);
  }

  public double lowerBound(int variable) {
    return lowerBounds[variable];
  }

  public double upperBound(int variable) {
    return upperBounds[variable];
  }

  public double linearCoefficient(int variable) {
    return linearObjective[variable];
  }

  public ImmutableList<QuadraticTerm> quadraticTerms() {
    return quadraticTerms;
  }

  public ImmutableList<LinearRow> rows() {
    return rows;
  }

  public ImmutableList<SecondOrderCone> cones() {
    return cones;
  }

  /** Number of leading variables holding (possibly homogeneous) weights. */
  public int weightCount() {
    return weightCount;
  }

  /** Index of the normalization scalar κ; present only for ratio programs. */
  public OptionalInt kappaIndex() {
    return kappaIndex;
  }

  public boolean isRatio() {
    return kappaIndex.isPresent();
  }

  /** Objective value at {@code values}. */
  public double objectiveValue(double[] values) {
    checkArgument(values.length == variableCount(), "Expected %s values", variableCount());
    double total = 0;
    for (int v = 0; v < values.length; v++) {
      total += linearObjective[v] * values[v];
    }
    for (QuadraticTerm term : quadraticTerms) {
      total += term.coefficient() * values[term.first()] * values[term.second()];
    }
    return total;
  }

  @Override
  public String toString() {
    return String.format(
        "CanonicalProgram{class=%s, variables=%d, rows=%d, quadraticTerms=%d, cones=%d}",
        problemClass, variableCount(), rows.size(), quadraticTerms.size(), cones.size());
  }

  /** Mutable accumulator used by the problem builder. */
  public static final class Builder {
    private final List<String> names = new ArrayList<>();
    private final List<Double> lower = new ArrayList<>();
    private final List<Double> upper = new ArrayList<>();
    private final List<Double> objective = new ArrayList<>();
    private final Map<List<Integer>, Double> quadratic = new LinkedHashMap<>();
    private final List<LinearRow> rows = new ArrayList<>();
    private final List<SecondOrderCone> cones = new ArrayList<>();
    private int weightCount;
    private OptionalInt kappaIndex = OptionalInt.empty();

    private Builder() {}

    public int addVariable(String name) {
      return addVariable(name, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    public int addVariable(String name, double lowerBound, double upperBound) {
      names.add(name);
      lower.add(lowerBound);
      upper.add(upperBound);
      objective.add(0.0);
      return names.size() - 1;
    }

    public int variableCount() {
      return names.size();
    }

    public double lowerBound(int variable) {
      return lower.get(variable);
    }

    public double upperBound(int variable) {
      return upper.get(variable);
    }

    public void setBounds(int variable, double lowerBound, double upperBound) {
      checkElementIndex(variable, names.size());
      lower.set(variable, lowerBound);
      upper.set(variable, upperBound);
    }

    public void addLinearObjective(int variable, double coefficient) {
      objective.set(variable, objective.get(variable) + coefficient);
    }

    public void addQuadraticObjective(int first, int second, double coefficient) {
      quadratic.merge(ImmutableList.of(first, second), coefficient, Double::sum);
    }

    public void addRow(
        String name, Map<Integer, Double> coefficients, double lowerBound, double upperBound) {
      rows.add(LinearRow.create(name, ImmutableMap.copyOf(coefficients), lowerBound, upperBound));
    }

    public void addCone(String name, List<Integer> members, int bound) {
      cones.add(SecondOrderCone.create(name, ImmutableList.copyOf(members), bound));
    }

    public void setWeightCount(int weightCount) {
      this.weightCount = weightCount;
    }

    public void setKappaIndex(int kappaIndex) {
      this.kappaIndex = OptionalInt.of(kappaIndex);
    }

    public CanonicalProgram build() {
      return new CanonicalProgram(this);
    }
  }
}
