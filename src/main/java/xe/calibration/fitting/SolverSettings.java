package xe.calibration.fitting;

import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import xe.calibration.exceptions.InvalidParameterException;

/**
 * Limits and tolerances given to the Levenberg-Marquardt solver used by all calibration fits.
 * Immutable; the same settings object can be shared between fits.
 */
public class SolverSettings {

  /**
   * Used in the least squared solver (quit when function output changes by less than this value)
   */
  public static final double DEFAULT_COST_TOLERANCE = 1E-10;
  /**
   * Used in the least squared solver (quit when parameters change by less than this value)
   */
  public static final double DEFAULT_PARAMETER_TOLERANCE = 1E-10;
  public static final int DEFAULT_MAX_ITERATIONS = 5000;
  public static final int DEFAULT_MAX_EVALUATIONS = 10000;

  private final int maxIterations;
  private final int maxEvaluations;
  private final double costTolerance;
  private final double parameterTolerance;

  public SolverSettings() {
    this(DEFAULT_MAX_ITERATIONS, DEFAULT_MAX_EVALUATIONS, DEFAULT_COST_TOLERANCE,
        DEFAULT_PARAMETER_TOLERANCE);
  }

  /**
   * Create solver settings
   *
   * @param maxIterations Most solver iterations allowed before the fit is flagged unconverged
   * @param maxEvaluations Most model evaluations allowed before the fit is flagged unconverged
   * @param costTolerance Relative cost tolerance for convergence
   * @param parameterTolerance Relative parameter tolerance for convergence
   */
  public SolverSettings(int maxIterations, int maxEvaluations, double costTolerance,
      double parameterTolerance) {
    if (maxIterations < 1 || maxEvaluations < 1) {
      throw new InvalidParameterException("solver iteration and evaluation limits must be "
          + "positive, got " + maxIterations + " and " + maxEvaluations);
    }
    if (!(costTolerance > 0.) || !(parameterTolerance > 0.)
        || Double.isInfinite(costTolerance) || Double.isInfinite(parameterTolerance)) {
      throw new InvalidParameterException("solver tolerances must be positive and finite");
    }
    this.maxIterations = maxIterations;
    this.maxEvaluations = maxEvaluations;
    this.costTolerance = costTolerance;
    this.parameterTolerance = parameterTolerance;
  }

  /**
   * Build an optimizer using these tolerances. Limits on iterations and evaluations are set on
   * the least-squares problem rather than the optimizer.
   *
   * @return Levenberg-Marquardt optimizer
   */
  LeastSquaresOptimizer buildOptimizer() {
    return new LevenbergMarquardtOptimizer().
        withCostRelativeTolerance(costTolerance).
        withParameterRelativeTolerance(parameterTolerance);
  }

  public double getCostTolerance() {
    return costTolerance;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public double getParameterTolerance() {
    return parameterTolerance;
  }

}
