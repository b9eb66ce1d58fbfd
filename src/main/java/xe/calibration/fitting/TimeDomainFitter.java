package xe.calibration.fitting;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;
import xe.calibration.utils.NumericUtils;

/**
 * Fits a sum of damped complex sinusoids to an FID directly in the time domain.
 * The complex residual (model minus observed) is split into its real parts followed by its
 * imaginary parts, giving a real vector of twice the FID length, which is minimized by
 * Levenberg-Marquardt using the analytic Jacobian of the model.
 *
 * For each component the solver varies amplitude, frequency, Lorentzian width and phase; the
 * Gaussian width is varied only for components whose guess has a nonzero Gaussian width.
 * The shared line broadening is held at its given value.
 *
 * If the solver runs out of iterations or evaluations the fit is still returned, using the
 * lowest-cost parameters evaluated, with its convergence flag cleared.
 */
public class TimeDomainFitter {

  private static final Logger logger = Logger.getLogger(TimeDomainFitter.class);

  /**
   * Derivative of the Gaussian decay rate with respect to Gaussian FWHM, divided by the FWHM
   */
  private static final double GAUSSIAN_RATE_SLOPE = Math.PI * Math.PI / (2. * Math.log(2.));

  private final SolverSettings settings;

  public TimeDomainFitter() {
    this(new SolverSettings());
  }

  public TimeDomainFitter(SolverSettings settings) {
    this.settings = settings;
  }

  /**
   * Fit the components of a problem to its observed FID
   *
   * @param problem Observed data and starting guesses
   * @return fitted components, model signal and convergence information
   */
  public FitResult fit(FitProblem problem) {

    final double[] times = problem.getObserved().getTimes();
    final ParameterLayout layout = new ParameterLayout(problem.getGuesses());
    final double broadening = problem.getLineBroadening();

    Complex[] observed = problem.getObserved().getData();
    double[] observedParts = new double[2 * observed.length];
    for (int i = 0; i < observed.length; ++i) {
      observedParts[i] = observed[i].getReal();
      observedParts[observed.length + i] = observed[i].getImaginary();
    }
    RealVector target = new ArrayRealVector(observedParts, false);

    MultivariateJacobianFunction jacobian = new MultivariateJacobianFunction() {
      @Override
      public Pair<RealVector, RealMatrix> value(final RealVector point) {
        return jacobian(point, times, layout, broadening);
      }
    };

    BestPointTracker tracker = new BestPointTracker(jacobian, target);
    RealVector initialGuess = layout.toVector(problem.getGuesses());

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(initialGuess).
        target(target).
        model(tracker).
        checker(tracker.iterationCounter()).
        parameterValidator(layout.validator()).
        lazyEvaluation(false).
        maxEvaluations(settings.getMaxEvaluations()).
        maxIterations(settings.getMaxIterations()).
        build();

    double initialCost = lsp.evaluate(initialGuess).getCost();
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
      logger.warn("Time-domain fit of " + problem.getObserved().getName()
          + " stopped at solver limit, using best point found: " + e.getMessage());
      fitPoint = tracker.getBestPoint();
      iterations = tracker.getIterations();
      converged = false;
    } catch (ConvergenceException e) {
      logger.warn("Time-domain fit of " + problem.getObserved().getName()
          + " could not meet tolerances, using best point found", e);
      fitPoint = tracker.getBestPoint();
      iterations = tracker.getIterations();
      converged = false;
    }

    List<SpectralComponent> fitComponents = layout.toComponents(fitPoint);
    double finalCost = lsp.evaluate(fitPoint).getCost();
    double terms = Math.sqrt(observedParts.length);

    if (converged) {
      logger.debug("Fit of " + problem.getObserved().getName() + " converged after "
          + iterations + " iterations: " + fitComponents);
    }

    return new FitResult(problem, fitComponents, converged, iterations,
        tracker.getEvaluations(), initialCost / terms, finalCost / terms);
  }

  /**
   * Evaluate the model and its Jacobian at a parameter point
   *
   * @param point Parameter values in the layout's order
   * @param times Sample times in seconds
   * @param layout Position of each component's parameters in the point
   * @param broadening Shared extra Lorentzian broadening, Hz
   * @return model (real parts then imaginary parts) and the matching Jacobian
   */
  static Pair<RealVector, RealMatrix> jacobian(RealVector point, double[] times,
      ParameterLayout layout, double broadening) {

    int len = times.length;
    double[] value = new double[2 * len];
    double[][] jacobian = new double[2 * len][layout.size()];

    for (int c = 0; c < layout.componentCount(); ++c) {
      int offset = layout.offset(c);
      double amplitude = point.getEntry(offset);
      double frequency = point.getEntry(offset + 1);
      double lorentzian = point.getEntry(offset + 2);
      double phase = point.getEntry(offset + 3);
      double gaussian = layout.isVoigt(c) ? point.getEntry(offset + 4) : 0.;

      // evaluate at unit amplitude so the amplitude derivative is the basis itself
      double[][] basis = FidModel.evaluate(times, 1., frequency, lorentzian + broadening,
          FidModel.gaussianDecayRate(gaussian), phase);

      for (int i = 0; i < len; ++i) {
        double t = times[i];
        double re = basis[0][i];
        double im = basis[1][i];
        double sRe = amplitude * re;
        double sIm = amplitude * im;

        value[i] += sRe;
        value[len + i] += sIm;

        // d/dA
        jacobian[i][offset] = re;
        jacobian[len + i][offset] = im;
        // d/df = i 2 pi t s
        jacobian[i][offset + 1] = -NumericUtils.TAU * t * sIm;
        jacobian[len + i][offset + 1] = NumericUtils.TAU * t * sRe;
        // d/dL = -pi t s
        jacobian[i][offset + 2] = -Math.PI * t * sRe;
        jacobian[len + i][offset + 2] = -Math.PI * t * sIm;
        // d/dphase = i s
        jacobian[i][offset + 3] = -sIm;
        jacobian[len + i][offset + 3] = sRe;
        if (layout.isVoigt(c)) {
          // d/dG = -t^2 (dg/dG) s
          double scale = -t * t * GAUSSIAN_RATE_SLOPE * gaussian;
          jacobian[i][offset + 4] = scale * sRe;
          jacobian[len + i][offset + 4] = scale * sIm;
        }
      }
    }

    RealVector valueVector = new ArrayRealVector(value, false);
    RealMatrix jacobianMatrix = new Array2DRowRealMatrix(jacobian, false);
    return new Pair<>(valueVector, jacobianMatrix);
  }

  /**
   * Maps components onto the flat parameter vector used by the solver.
   * Each component takes amplitude, frequency, Lorentzian width and phase (radians), followed by
   * Gaussian width for Voigt components.
   */
  static class ParameterLayout {

    private final int[] offsets;
    private final boolean[] voigt;
    private final int size;

    ParameterLayout(List<SpectralComponent> guesses) {
      offsets = new int[guesses.size()];
      voigt = new boolean[guesses.size()];
      int next = 0;
      for (int i = 0; i < guesses.size(); ++i) {
        offsets[i] = next;
        voigt[i] = guesses.get(i).isVoigt();
        next += voigt[i] ? 5 : 4;
      }
      size = next;
    }

    int componentCount() {
      return offsets.length;
    }

    boolean isVoigt(int component) {
      return voigt[component];
    }

    int offset(int component) {
      return offsets[component];
    }

    int size() {
      return size;
    }

    RealVector toVector(List<SpectralComponent> components) {
      double[] vector = new double[size];
      for (int i = 0; i < components.size(); ++i) {
        SpectralComponent component = components.get(i);
        int offset = offsets[i];
        vector[offset] = component.getAmplitude();
        vector[offset + 1] = component.getFrequency();
        vector[offset + 2] = component.getLorentzianWidth();
        vector[offset + 3] = Math.toRadians(component.getPhase());
        if (voigt[i]) {
          vector[offset + 4] = component.getGaussianWidth();
        }
      }
      return new ArrayRealVector(vector, false);
    }

    List<SpectralComponent> toComponents(RealVector point) {
      List<SpectralComponent> components = new ArrayList<>();
      for (int i = 0; i < offsets.length; ++i) {
        int offset = offsets[i];
        // the model depends on the square of the Gaussian width only
        double gaussian = voigt[i] ? Math.abs(point.getEntry(offset + 4)) : 0.;
        components.add(new SpectralComponent(
            point.getEntry(offset),
            point.getEntry(offset + 1),
            Math.max(0., point.getEntry(offset + 2)),
            gaussian,
            Math.toDegrees(point.getEntry(offset + 3))));
      }
      return components;
    }

    /**
     * Get a validator keeping each Lorentzian width at or above zero
     *
     * @return validator to apply to each point the solver evaluates
     */
    ParameterValidator validator() {
      return new ParameterValidator() {
        @Override
        public RealVector validate(RealVector params) {
          for (int offset : offsets) {
            if (params.getEntry(offset + 2) < 0.) {
              params.setEntry(offset + 2, 0.);
            }
          }
          return params;
        }
      };
    }

  }

}
