package xe.calibration.experiment;

import xe.calibration.exceptions.DegenerateFitException;
import xe.calibration.fitting.SpectralComponent;
import xe.calibration.utils.NumericUtils;
import xe.calibration.utils.TimeSeriesUtils;

/**
 * Arithmetic turning fitted parameters into the calibration outputs.
 */
public class CalibrationMetrics {

  /**
   * Smallest RBC to tissue/plasma frequency separation (Hz) for which TE90 is computed
   */
  public static final double MIN_FREQUENCY_SEPARATION = 1E-6;

  public static double frequencyOffset(SpectralComponent gas) {
    return gas.getFrequency();
  }

  /**
   * Ratio of the prescribed flip angle to the one the decay fit found
   *
   * @param prescribed Flip angle set on the scanner, degrees
   * @param actual Fitted flip angle, degrees
   * @return set-to-actual ratio
   */
  public static double flipAngleRatio(double prescribed, double actual) {
    if (actual == 0. || Double.isNaN(actual) || Double.isInfinite(actual)) {
      throw new DegenerateFitException("fitted flip angle is " + actual + " degrees");
    }
    return prescribed / actual;
  }

  /**
   * Reduce a phase difference to [0, 180). Only the magnitude of the difference modulo a half
   * turn is meaningful for the TE90 correction.
   *
   * @param phaseDifference Phase difference in degrees, any value
   * @return wrapped difference in degrees
   */
  public static double wrapPhaseDifference(double phaseDifference) {
    return Math.abs(NumericUtils.rewrapAngleDegrees(phaseDifference)) % 180.;
  }

  /**
   * Echo time shift that brings the RBC and tissue/plasma signals 90 degrees apart
   *
   * @param deltaPhase Wrapped phase difference, degrees
   * @param deltaFrequency Absolute frequency difference, Hz
   * @return shift in seconds
   */
  public static double deltaTe90Seconds(double deltaPhase, double deltaFrequency) {
    if (Double.isNaN(deltaFrequency) || Double.isInfinite(deltaFrequency)
        || deltaFrequency < MIN_FREQUENCY_SEPARATION) {
      throw new DegenerateFitException("RBC and tissue/plasma frequencies are not separated ("
          + deltaFrequency + " Hz)");
    }
    return (90. - deltaPhase) / (360. * deltaFrequency);
  }

  /**
   * Echo time at which the RBC and tissue/plasma signals are 90 degrees apart
   *
   * @param echoTime Echo time the dissolved FIDs were acquired at, ms
   * @param rbc Fitted RBC component
   * @param tissuePlasma Fitted tissue/plasma component
   * @return TE90 in ms
   */
  public static double te90(double echoTime, SpectralComponent rbc,
      SpectralComponent tissuePlasma) {
    double deltaPhase = wrapPhaseDifference(rbc.getPhase() - tissuePlasma.getPhase());
    double deltaFrequency = Math.abs(rbc.getFrequency() - tissuePlasma.getFrequency());
    return echoTime
        + deltaTe90Seconds(deltaPhase, deltaFrequency) * TimeSeriesUtils.MILLIS_PER_SECOND;
  }

  /**
   * Signed ratio of the RBC amplitude to the tissue/plasma amplitude
   *
   * @param rbc Fitted RBC component
   * @param tissuePlasma Fitted tissue/plasma component
   * @return RBC/TP
   */
  public static double rbcToTpRatio(SpectralComponent rbc, SpectralComponent tissuePlasma) {
    if (tissuePlasma.getAmplitude() == 0.) {
      throw new DegenerateFitException("tissue/plasma amplitude is zero");
    }
    return rbc.getAmplitude() / tissuePlasma.getAmplitude();
  }

}
