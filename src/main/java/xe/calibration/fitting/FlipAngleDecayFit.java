package xe.calibration.fitting;

import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;
import xe.calibration.exceptions.InvalidParameterException;

/**
 * Fit of the gas signal decay over repeated excitations, used to find the flip angle actually
 * delivered. Each excitation leaves cos(flip) of the longitudinal magnetization, so the peak
 * magnitude of acquisition k (counting from 1) follows y[k] = c1 * cos(c2)^(k-1) + c3.
 */
public class FlipAngleDecayFit {

  private static final Logger logger = Logger.getLogger(FlipAngleDecayFit.class);

  /**
   * Starting guess for the flip angle, in degrees
   */
  public static final double FLIP_ANGLE_GUESS = 15.;

  /**
   * Number of parameters in the decay model, and so the fewest acquisitions that can be fit
   */
  public static final int PARAMETER_COUNT = 3;

  private final double[] magnitudes;
  private final double scale;
  private final double flipAngle;
  private final double offset;
  private final boolean converged;
  private final int iterations;

  private FlipAngleDecayFit(double[] magnitudes, double[] params, boolean converged,
      int iterations) {
    this.magnitudes = magnitudes;
    this.scale = params[0];
    this.flipAngle = params[1];
    this.offset = params[2];
    this.converged = converged;
    this.iterations = iterations;
  }

  /**
   * Fit the decay model to the peak magnitudes of consecutive gas acquisitions
   *
   * @param magnitudes Peak magnitude of each acquisition, in acquisition order
   * @param settings Solver limits and tolerances
   * @return fitted decay
   */
  public static FlipAngleDecayFit fit(double[] magnitudes, SolverSettings settings) {
    if (magnitudes == null || magnitudes.length < PARAMETER_COUNT) {
      throw new InvalidParameterException("flip angle fit needs at least " + PARAMETER_COUNT
          + " acquisitions, got " + (magnitudes == null ? 0 : magnitudes.length));
    }
    double max = Double.NEGATIVE_INFINITY;
    for (double magnitude : magnitudes) {
      if (Double.isNaN(magnitude) || Double.isInfinite(magnitude)) {
        throw new InvalidParameterException("gas peak magnitudes must be finite");
      }
      max = Math.max(max, magnitude);
    }

    final double[] data = magnitudes.clone();
    MultivariateJacobianFunction jacobian = new MultivariateJacobianFunction() {
      @Override
      public Pair<RealVector, RealMatrix> value(final RealVector point) {
        return jacobian(point, data.length);
      }
    };

    RealVector target = new ArrayRealVector(data);
    BestPointTracker tracker = new BestPointTracker(jacobian, target);
    RealVector initialGuess =
        new ArrayRealVector(new double[]{max, Math.toRadians(FLIP_ANGLE_GUESS), 0.});

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(initialGuess).
        target(target).
        model(tracker).
        checker(tracker.iterationCounter()).
        lazyEvaluation(false).
        maxEvaluations(settings.getMaxEvaluations()).
        maxIterations(settings.getMaxIterations()).
        build();

    LeastSquaresOptimizer optimizer = settings.buildOptimizer();

    RealVector fitPoint;
    boolean converged;
    int iterations;
    try {
      LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(lsp);
      fitPoint = optimum.getPoint();
      iterations = optimum.getIterations();
      converged = true;
    } catch (TooManyIterationsException | TooManyEvaluationsException e) {
      logger.warn("Flip angle decay fit stopped at solver limit, using best point found: "
          + e.getMessage());
      fitPoint = tracker.getBestPoint();
      iterations = tracker.getIterations();
      converged = false;
    } catch (ConvergenceException e) {
      logger.warn("Flip angle decay fit could not meet tolerances, using best point found", e);
      fitPoint = tracker.getBestPoint();
      iterations = tracker.getIterations();
      converged = false;
    }

    FlipAngleDecayFit result =
        new FlipAngleDecayFit(data, fitPoint.toArray(), converged, iterations);
    logger.debug("Flip angle fit: " + result.getFlipAngleDegrees() + " degrees after "
        + iterations + " iterations");
    return result;
  }

  /**
   * Evaluate the decay model and its Jacobian for acquisitions 1 through count
   *
   * @param point Values of c1, c2 (radians) and c3
   * @param count Number of acquisitions
   * @return model values and Jacobian
   */
  static Pair<RealVector, RealMatrix> jacobian(RealVector point, int count) {
    double c1 = point.getEntry(0);
    double c2 = point.getEntry(1);
    double cos = Math.cos(c2);
    double sin = Math.sin(c2);

    double[] value = new double[count];
    double[][] jacobian = new double[count][PARAMETER_COUNT];
    for (int i = 0; i < count; ++i) {
      // i is k - 1 for acquisition k
      double decay = Math.pow(cos, i);
      value[i] = c1 * decay + point.getEntry(2);
      jacobian[i][0] = decay;
      jacobian[i][1] = i == 0 ? 0. : -c1 * i * sin * Math.pow(cos, i - 1);
      jacobian[i][2] = 1.;
    }
    return new Pair<RealVector, RealMatrix>(new ArrayRealVector(value, false),
        new Array2DRowRealMatrix(jacobian, false));
  }

  /**
   * Evaluate the fitted decay at an acquisition
   *
   * @param acquisition Acquisition number, counting from 1
   * @return modeled peak magnitude
   */
  public double evaluate(int acquisition) {
    return scale * Math.pow(Math.cos(flipAngle), acquisition - 1) + offset;
  }

  /**
   * Get the flip angle delivered per excitation. The model only sees cos(c2), so the sign of the
   * fitted angle carries no information and the magnitude is reported.
   *
   * @return actual flip angle in degrees
   */
  public double getFlipAngleDegrees() {
    return Math.toDegrees(Math.abs(flipAngle));
  }

  /**
   * Get the fitted c2 as the solver left it
   *
   * @return flip angle parameter in radians (may be negative)
   */
  public double getFlipAngleRadians() {
    return flipAngle;
  }

  public double getScale() {
    return scale;
  }

  public double getOffset() {
    return offset;
  }

  public double[] getMagnitudes() {
    return magnitudes.clone();
  }

  public boolean isConverged() {
    return converged;
  }

  public int getIterations() {
    return iterations;
  }

}
