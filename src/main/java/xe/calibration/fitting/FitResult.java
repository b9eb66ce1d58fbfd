package xe.calibration.fitting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.complex.Complex;
import xe.calibration.input.FidBlock;
import xe.calibration.utils.FFTResult;

/**
 * Fitted components of a {@link FitProblem}, with the model signal they describe and the
 * solver's bookkeeping. Spectra for display are computed on first request using the problem's
 * zero pad size.
 */
public class FitResult {

  private final FitProblem problem;
  private final List<SpectralComponent> components;
  private final boolean converged;
  private final int iterations;
  private final int evaluations;
  private final double initialRms;
  private final double finalRms;

  private final Complex[] modelSignal;
  private final List<Complex[]> componentSignals;

  private FFTResult observedSpectrum;
  private FFTResult modelSpectrum;
  private List<FFTResult> componentSpectra;

  FitResult(FitProblem problem, List<SpectralComponent> components, boolean converged,
      int iterations, int evaluations, double initialRms, double finalRms) {
    this.problem = problem;
    this.components = Collections.unmodifiableList(new ArrayList<>(components));
    this.converged = converged;
    this.iterations = iterations;
    this.evaluations = evaluations;
    this.initialRms = initialRms;
    this.finalRms = finalRms;

    double[] times = problem.getObserved().getTimes();
    double broadening = problem.getLineBroadening();
    modelSignal = FidModel.synthesize(times, components, broadening);
    List<Complex[]> signals = new ArrayList<>();
    for (SpectralComponent component : components) {
      signals.add(FidModel.synthesizeComponent(times, component, broadening));
    }
    componentSignals = Collections.unmodifiableList(signals);
  }

  /**
   * Get the fitted components, in the same order as the guesses they started from
   *
   * @return fitted components
   */
  public List<SpectralComponent> getComponents() {
    return components;
  }

  public SpectralComponent getComponent(int index) {
    return components.get(index);
  }

  /**
   * Get the time-domain signal of all fitted components summed
   *
   * @return model samples at the observed time stamps
   */
  public Complex[] getModelSignal() {
    return modelSignal.clone();
  }

  /**
   * Get the time-domain signal of one fitted component
   *
   * @param index Position of the component
   * @return model samples of that component alone
   */
  public Complex[] getComponentSignal(int index) {
    return componentSignals.get(index).clone();
  }

  public FitProblem getProblem() {
    return problem;
  }

  /**
   * Get whether the solver met its tolerances within its iteration and evaluation limits.
   * When false the components are the best (lowest cost) values the solver reached.
   *
   * @return true if the fit converged
   */
  public boolean isConverged() {
    return converged;
  }

  public int getIterations() {
    return iterations;
  }

  public int getEvaluations() {
    return evaluations;
  }

  /**
   * Get the root-mean-square residual of the starting guesses over all real and imaginary terms
   *
   * @return RMS residual before fitting
   */
  public double getInitialRms() {
    return initialRms;
  }

  /**
   * Get the root-mean-square residual of the fitted components over all real and imaginary terms
   *
   * @return RMS residual after fitting
   */
  public double getFinalRms() {
    return finalRms;
  }

  /**
   * Get the centered spectrum of the observed FID
   *
   * @return spectrum scaled by dwell time
   */
  public FFTResult getObservedSpectrum() {
    if (observedSpectrum == null) {
      FidBlock observed = problem.getObserved();
      observedSpectrum = FFTResult.centeredSpectrum(observed.getData(), observed.getDwellTime(),
          problem.getZeroPadSize());
    }
    return observedSpectrum;
  }

  /**
   * Get the centered spectrum of the summed model
   *
   * @return spectrum scaled by dwell time
   */
  public FFTResult getModelSpectrum() {
    if (modelSpectrum == null) {
      modelSpectrum = FFTResult.centeredSpectrum(modelSignal,
          problem.getObserved().getDwellTime(), problem.getZeroPadSize());
    }
    return modelSpectrum;
  }

  /**
   * Get the centered spectrum of each fitted component alone
   *
   * @return one spectrum per component, in component order
   */
  public List<FFTResult> getComponentSpectra() {
    if (componentSpectra == null) {
      List<FFTResult> spectra = new ArrayList<>();
      for (Complex[] signal : componentSignals) {
        spectra.add(FFTResult.centeredSpectrum(signal, problem.getObserved().getDwellTime(),
            problem.getZeroPadSize()));
      }
      componentSpectra = Collections.unmodifiableList(spectra);
    }
    return componentSpectra;
  }

}
