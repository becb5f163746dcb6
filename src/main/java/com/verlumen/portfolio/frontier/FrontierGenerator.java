package com.verlumen.portfolio.frontier;

/** Traces the efficient frontier of a spec's constraint set under one risk measure. */
public interface FrontierGenerator {
  /**
   * Returns up to {@code pointCount} points in ascending mean order. When the min-risk portfolio
   * already has the highest attainable mean the frontier is that single point.
   */
  EfficientFrontier generate(FrontierRequest request);
}
