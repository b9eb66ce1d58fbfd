package xe.calibration.fitting;

import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.math3.util.Pair;

/**
 * Wraps a least-squares model so that every point the solver evaluates is compared against the
 * target, keeping the lowest-cost point seen. When the solver gives up (iteration or evaluation
 * limits) the optimizer returns nothing, so this is where the best-effort parameters come from.
 */
class BestPointTracker implements MultivariateJacobianFunction {

  private final MultivariateJacobianFunction model;
  private final RealVector target;

  private RealVector bestPoint;
  private double bestCost = Double.POSITIVE_INFINITY;
  private int evaluations = 0;
  private int iterations = 0;

  BestPointTracker(MultivariateJacobianFunction model, RealVector target) {
    this.model = model;
    this.target = target;
  }

  @Override
  public Pair<RealVector, RealMatrix> value(RealVector point) {
    ++evaluations;
    Pair<RealVector, RealMatrix> valueAndJacobian = model.value(point);
    double cost = target.subtract(valueAndJacobian.getFirst()).getNorm();
    if (cost < bestCost || bestPoint == null) {
      bestCost = cost;
      bestPoint = point.copy();
    }
    return valueAndJacobian;
  }

  /**
   * Get a checker that only records the solver's iteration count. It never reports convergence,
   * leaving that to the optimizer's own tolerances.
   *
   * @return checker to hand to the least-squares builder
   */
  ConvergenceChecker<LeastSquaresProblem.Evaluation> iterationCounter() {
    return new ConvergenceChecker<LeastSquaresProblem.Evaluation>() {
      @Override
      public boolean converged(int iteration, LeastSquaresProblem.Evaluation previous,
          LeastSquaresProblem.Evaluation current) {
        iterations = Math.max(iterations, iteration);
        return false;
      }
    };
  }

  RealVector getBestPoint() {
    return bestPoint;
  }

  int getEvaluations() {
    return evaluations;
  }

  int getIterations() {
    return iterations;
  }

}
