package xe.calibration.experiment;

import java.text.DecimalFormat;
import java.util.Collections;
import org.jfree.data.xy.XYSeriesCollection;
import xe.calibration.fitting.FitProblem;
import xe.calibration.fitting.FitResult;
import xe.calibration.fitting.SpectralComponent;
import xe.calibration.fitting.TimeDomainFitter;
import xe.calibration.input.FidBlock;
import xe.calibration.input.FidStore;
import xe.calibration.utils.FFTResult;

/**
 * Finds the frequency of the gas resonance relative to the scanner's current center frequency,
 * by fitting a single Lorentzian component to the first gas FID. The remaining gas acquisitions
 * are not used here.
 */
public class GasFrequencyExperiment extends Experiment {

  static final double AMPLITUDE_GUESS = 1E-4;
  static final double LINEWIDTH_GUESS = 30.;
  static final int ZERO_PAD_SIZE = 10000;

  private FitResult fitResult;
  private double frequencyOffset;

  public GasFrequencyExperiment() {
    super();
  }

  @Override
  protected void backend(FidStore fidStore) {
    FidBlock gas = fidStore.getGasFid(0);
    dataNames.add(gas.getName());

    SpectralComponent guess =
        SpectralComponent.lorentzian(AMPLITUDE_GUESS, 0., LINEWIDTH_GUESS, 0.);
    FitProblem problem =
        new FitProblem(gas, Collections.singletonList(guess), 0., ZERO_PAD_SIZE);

    fireStateChange("Fitting gas resonance...");
    fitResult = new TimeDomainFitter(configuration.getSolverSettings()).fit(problem);
    frequencyOffset = CalibrationMetrics.frequencyOffset(fitResult.getComponent(0));

    fireStateChange("Building gas spectrum plots...");
    FFTResult observed = fitResult.getObservedSpectrum();
    FFTResult model = fitResult.getModelSpectrum();
    XYSeriesCollection spectra = new XYSeriesCollection();
    spectra.addSeries(observed.magnitudeSeries(gas.getName() + " spectrum",
        Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY));
    spectra.addSeries(model.magnitudeSeries("Gas fit spectrum",
        Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY));
    xySeriesData.add(spectra);
  }

  @Override
  String[] getDataStrings() {
    DecimalFormat df = DECIMAL_FORMAT.get();
    SpectralComponent gas = fitResult.getComponent(0);
    String result = "Gas frequency offset: " + String.format("%.0f", frequencyOffset) + " Hz"
        + "\nGas linewidth: " + df.format(gas.getLorentzianWidth()) + " Hz"
        + "\nConverged: " + fitResult.isConverged();
    return new String[]{result};
  }

  /**
   * Get the full result of the single-component gas fit
   *
   * @return fit of the first gas FID
   */
  public FitResult getFitResult() {
    return fitResult;
  }

  /**
   * Get the gas frequency offset, which is to be added to the scanner's center frequency
   *
   * @return fitted gas frequency in Hz
   */
  public double getFrequencyOffset() {
    return frequencyOffset;
  }

  @Override
  public boolean hasEnoughData(FidStore fidStore) {
    return fidStore.getGasAcquisitionCount() > 0;
  }

}
