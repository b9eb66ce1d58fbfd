package xe.calibration.experiment;

import java.text.DecimalFormat;
import org.apache.log4j.Logger;
import xe.calibration.exceptions.NonConvergenceException;
import xe.calibration.fitting.SpectralComponent;
import xe.calibration.input.FidStore;
import xe.calibration.output.CalibrationResult;

/**
 * Runs the full xenon calibration on one set of FIDs: the gas frequency fit, the flip angle
 * decay fit and the dissolved spectrum fit, then combines their results into the values to be
 * applied on the scanner.
 *
 * Fits that stop at their solver limits are used as they are, unless the configuration asks for
 * converged fits only, in which case a {@link NonConvergenceException} carrying the result is
 * thrown.
 */
public class CalibrationExperiment extends Experiment {

  private static final Logger logger = Logger.getLogger(CalibrationExperiment.class);

  private final GasFrequencyExperiment gasExperiment;
  private final FlipAngleExperiment flipAngleExperiment;
  private final DissolvedSpectrumExperiment dissolvedExperiment;

  private CalibrationResult result;

  public CalibrationExperiment() {
    super();
    gasExperiment = new GasFrequencyExperiment();
    flipAngleExperiment = new FlipAngleExperiment();
    dissolvedExperiment = new DissolvedSpectrumExperiment();
  }

  @Override
  protected void backend(FidStore fidStore) {
    gasExperiment.setConfiguration(configuration);
    flipAngleExperiment.setConfiguration(configuration);
    dissolvedExperiment.setConfiguration(configuration);

    fireStateChange("Fitting gas frequency...");
    gasExperiment.runExperimentOnData(fidStore);
    fireStateChange("Fitting flip angle decay...");
    flipAngleExperiment.runExperimentOnData(fidStore);
    fireStateChange("Fitting dissolved spectrum...");
    dissolvedExperiment.runExperimentOnData(fidStore);

    dataNames.addAll(gasExperiment.getInputNames());
    dataNames.addAll(flipAngleExperiment.getInputNames());
    dataNames.addAll(dissolvedExperiment.getInputNames());
    xySeriesData.addAll(flipAngleExperiment.getData());
    xySeriesData.addAll(dissolvedExperiment.getData());
    xySeriesData.addAll(gasExperiment.getData());

    fireStateChange("Computing calibration values...");
    SpectralComponent rbc = dissolvedExperiment.getRbc();
    SpectralComponent tissuePlasma = dissolvedExperiment.getTissuePlasma();
    double te90 = CalibrationMetrics.te90(configuration.getEchoTime(), rbc, tissuePlasma);
    double rbcToTp = CalibrationMetrics.rbcToTpRatio(rbc, tissuePlasma);

    result = new CalibrationResult(gasExperiment.getFrequencyOffset(),
        flipAngleExperiment.getFlipAngleRatio(), te90, rbcToTp, configuration.getFlipAngle(),
        gasExperiment.getFitResult(), dissolvedExperiment.getFitResult(),
        flipAngleExperiment.getDecayFit());

    logger.info("Calibration (" + configuration.getFieldStrength().getLabel() + "): " + result);
    if (!result.isRbcToTpPlausible()) {
      logger.warn("RBC/TP of " + rbcToTp + " is outside the expected range ["
          + CalibrationResult.PLAUSIBLE_RBC_TP_LOW + ", "
          + CalibrationResult.PLAUSIBLE_RBC_TP_HIGH + "]; check the dissolved fit");
    }
    if (!result.isConverged()) {
      if (configuration.isRequireConvergence()) {
        throw new NonConvergenceException("gas fit converged: "
            + result.getGasFit().isConverged() + ", dissolved fit converged: "
            + result.getDissolvedFit().isConverged() + ", decay fit converged: "
            + result.getDecayFit().isConverged(), result);
      }
      logger.warn("Calibration uses at least one unconverged fit");
    }
  }

  @Override
  String[] getDataStrings() {
    DecimalFormat df = DECIMAL_FORMAT.get();
    String offset = "Frequency offset: " + String.format("%.0f", result.getFrequencyOffset())
        + " Hz";
    String flip = "Flip angle: " + df.format(result.getActualFlipAngle()) + " deg (set "
        + df.format(result.getPrescribedFlipAngle()) + " deg), set/actual "
        + String.format("%.3f", result.getFlipAngleRatio());
    String te90 = "TE90: " + String.format("%.2f", result.getTe90()) + " ms";
    String rbcToTp = "RBC/TP: " + String.format("%.2f", result.getRbcToTp());
    return new String[]{offset, flip, te90, rbcToTp};
  }

  /**
   * Get the text annotations of each step: the decay plot, the dissolved spectrum plot and the
   * gas spectrum plot, followed by the calibration values
   *
   * @return annotation text, one entry per plot plus one for the summary
   */
  @Override
  public String[] getInsetStrings() {
    return new String[]{
        flipAngleExperiment.getReportString(),
        dissolvedExperiment.getReportString(),
        gasExperiment.getReportString(),
        getReportString()
    };
  }

  public GasFrequencyExperiment getGasExperiment() {
    return gasExperiment;
  }

  public FlipAngleExperiment getFlipAngleExperiment() {
    return flipAngleExperiment;
  }

  public DissolvedSpectrumExperiment getDissolvedExperiment() {
    return dissolvedExperiment;
  }

  /**
   * Get the values computed by the last run
   *
   * @return calibration result
   */
  public CalibrationResult getResult() {
    return result;
  }

  @Override
  public boolean hasEnoughData(FidStore fidStore) {
    return gasExperiment.hasEnoughData(fidStore)
        && flipAngleExperiment.hasEnoughData(fidStore)
        && dissolvedExperiment.hasEnoughData(fidStore);
  }

}
