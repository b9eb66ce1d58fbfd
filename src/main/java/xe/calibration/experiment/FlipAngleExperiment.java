package xe.calibration.experiment;

import java.text.DecimalFormat;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import xe.calibration.fitting.FlipAngleDecayFit;
import xe.calibration.input.FidStore;

/**
 * Estimates the flip angle actually delivered to the gas by fitting the decay of the peak gas
 * signal over consecutive acquisitions, and compares it to the prescribed flip angle.
 */
public class FlipAngleExperiment extends Experiment {

  private FlipAngleDecayFit decayFit;
  private double flipAngleRatio;

  public FlipAngleExperiment() {
    super();
  }

  @Override
  protected void backend(FidStore fidStore) {
    for (int i = 0; i < fidStore.getGasAcquisitionCount(); ++i) {
      dataNames.add(FidStore.GAS_NAME + " [" + i + "]");
    }

    fireStateChange("Fitting gas signal decay...");
    double[] magnitudes = fidStore.getGasPeakMagnitudes();
    decayFit = FlipAngleDecayFit.fit(magnitudes, configuration.getSolverSettings());
    flipAngleRatio = CalibrationMetrics.flipAngleRatio(configuration.getFlipAngle(),
        decayFit.getFlipAngleDegrees());

    XYSeries measured = new XYSeries("Gas signal magnitude");
    XYSeries fit = new XYSeries("Decay fit");
    for (int k = 1; k <= magnitudes.length; ++k) {
      measured.add(k, magnitudes[k - 1]);
      fit.add(k, decayFit.evaluate(k));
    }
    XYSeriesCollection decay = new XYSeriesCollection();
    decay.addSeries(measured);
    decay.addSeries(fit);
    xySeriesData.add(decay);
  }

  @Override
  String[] getDataStrings() {
    DecimalFormat df = DECIMAL_FORMAT.get();
    String result = "Prescribed flip angle: " + df.format(configuration.getFlipAngle()) + " deg"
        + "\nActual flip angle: " + df.format(getActualFlipAngle()) + " deg"
        + "\nSet/actual flip ratio: " + String.format("%.3f", flipAngleRatio)
        + "\nConverged: " + decayFit.isConverged();
    return new String[]{result};
  }

  /**
   * Get the flip angle the decay fit found
   *
   * @return actual flip angle in degrees
   */
  public double getActualFlipAngle() {
    return decayFit.getFlipAngleDegrees();
  }

  public FlipAngleDecayFit getDecayFit() {
    return decayFit;
  }

  /**
   * Get the ratio of prescribed to actual flip angle, by which the scanner's flip angle
   * setting should be scaled
   *
   * @return set-to-actual flip ratio
   */
  public double getFlipAngleRatio() {
    return flipAngleRatio;
  }

  @Override
  public boolean hasEnoughData(FidStore fidStore) {
    return fidStore.getGasAcquisitionCount() >= FlipAngleDecayFit.PARAMETER_COUNT;
  }

}
