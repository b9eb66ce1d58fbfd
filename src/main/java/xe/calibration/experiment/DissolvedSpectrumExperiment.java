package xe.calibration.experiment;

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;
import org.jfree.data.xy.XYSeriesCollection;
import xe.calibration.fitting.FitProblem;
import xe.calibration.fitting.FitResult;
import xe.calibration.fitting.SpectralComponent;
import xe.calibration.fitting.TimeDomainFitter;
import xe.calibration.input.FidBlock;
import xe.calibration.input.FidStore;
import xe.calibration.utils.FFTResult;

/**
 * Fits the averaged dissolved-phase FID with three components: red blood cells (RBC),
 * tissue/plasma (TP) and the residual gas signal, in that order. The tissue/plasma component
 * is given a Voigt lineshape; the others are Lorentzian.
 * Components are identified only by their position, so the order of the guesses matters.
 */
public class DissolvedSpectrumExperiment extends Experiment {

  public static final int RBC_INDEX = 0;
  public static final int TISSUE_PLASMA_INDEX = 1;
  public static final int GAS_INDEX = 2;

  static final String[] COMPONENT_NAMES = {"RBC", "Tissue/plasma", "Gas"};
  static final double[] AMPLITUDE_GUESSES = {1., 1., 1.};
  static final double[] LORENTZIAN_GUESSES = {250., 200., 30.};
  static final double[] GAUSSIAN_GUESSES = {0., 200., 0.};

  /**
   * Frequency window of the spectrum plots, Hz
   */
  static final double PLOT_LOW_FREQUENCY = -10000.;
  static final double PLOT_HIGH_FREQUENCY = 5000.;

  private FitResult fitResult;

  public DissolvedSpectrumExperiment() {
    super();
  }

  /**
   * Build the starting guesses for the three dissolved components
   *
   * @param frequencyGuesses RBC, tissue/plasma and gas frequencies in Hz
   * @return guesses in RBC, tissue/plasma, gas order
   */
  static List<SpectralComponent> buildGuesses(double[] frequencyGuesses) {
    List<SpectralComponent> guesses = new ArrayList<>();
    for (int i = 0; i < COMPONENT_NAMES.length; ++i) {
      guesses.add(new SpectralComponent(AMPLITUDE_GUESSES[i], frequencyGuesses[i],
          LORENTZIAN_GUESSES[i], GAUSSIAN_GUESSES[i], 0.));
    }
    return guesses;
  }

  @Override
  protected void backend(FidStore fidStore) {
    FidBlock dissolved = fidStore.getDissolvedAverage();
    dataNames.add(dissolved.getName());

    List<SpectralComponent> guesses =
        buildGuesses(configuration.getDissolvedFrequencyGuesses());
    // no padding beyond the native resolution
    FitProblem problem = new FitProblem(dissolved, guesses, 0., dissolved.size());

    fireStateChange("Fitting dissolved spectrum (" + fidStore.getDissolvedAcquisitionCount()
        + " acquisitions averaged)...");
    fitResult = new TimeDomainFitter(configuration.getSolverSettings()).fit(problem);

    fireStateChange("Building dissolved spectrum plots...");
    XYSeriesCollection spectra = new XYSeriesCollection();
    FFTResult observed = fitResult.getObservedSpectrum();
    spectra.addSeries(observed.magnitudeSeries("Dissolved spectrum",
        PLOT_LOW_FREQUENCY, PLOT_HIGH_FREQUENCY));
    List<FFTResult> componentSpectra = fitResult.getComponentSpectra();
    // overall fit is drawn as the sum of the component spectra
    FFTResult model = FFTResult.sum(componentSpectra.toArray(new FFTResult[0]));
    spectra.addSeries(model.magnitudeSeries("Dissolved fit",
        PLOT_LOW_FREQUENCY, PLOT_HIGH_FREQUENCY));
    for (int i = 0; i < componentSpectra.size(); ++i) {
      spectra.addSeries(componentSpectra.get(i).magnitudeSeries(COMPONENT_NAMES[i] + " fit",
          PLOT_LOW_FREQUENCY, PLOT_HIGH_FREQUENCY));
    }
    xySeriesData.add(spectra);
  }

  @Override
  String[] getDataStrings() {
    DecimalFormat df = DECIMAL_FORMAT.get();
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < COMPONENT_NAMES.length; ++i) {
      SpectralComponent component = fitResult.getComponent(i);
      sb.append(COMPONENT_NAMES[i]).append(": amplitude ")
          .append(df.format(component.getAmplitude()))
          .append(", frequency ").append(df.format(component.getFrequency())).append(" Hz")
          .append(", FWHM ").append(df.format(component.getLorentzianWidth()));
      if (component.isVoigt()) {
        sb.append(" / ").append(df.format(component.getGaussianWidth())).append(" (G)");
      }
      sb.append(" Hz, phase ").append(df.format(component.getPhase())).append(" deg");
      if (i + 1 < COMPONENT_NAMES.length) {
        sb.append('\n');
      }
    }
    return new String[]{sb.toString(), "Converged: " + fitResult.isConverged()};
  }

  public FitResult getFitResult() {
    return fitResult;
  }

  public SpectralComponent getRbc() {
    return fitResult.getComponent(RBC_INDEX);
  }

  public SpectralComponent getTissuePlasma() {
    return fitResult.getComponent(TISSUE_PLASMA_INDEX);
  }

  public SpectralComponent getGas() {
    return fitResult.getComponent(GAS_INDEX);
  }

  @Override
  public boolean hasEnoughData(FidStore fidStore) {
    return fidStore.getDissolvedAcquisitionCount() > 0;
  }

}
