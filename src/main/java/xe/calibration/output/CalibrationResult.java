package xe.calibration.output;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import xe.calibration.fitting.FitResult;
import xe.calibration.fitting.FlipAngleDecayFit;

/**
 * Outcome of a xenon calibration: the four values to be applied on the scanner (gas frequency
 * offset, set-to-actual flip ratio, TE90 and RBC/TP), plus the fits they were derived from.
 * Values are fixed on construction.
 * The numeric map gives external programs (i.e., callers over the Py4J gateway) every value
 * under a descriptive key.
 */
public class CalibrationResult {

  /**
   * Range of RBC/TP values expected in human lungs; values outside it suggest a poor fit
   */
  public static final double PLAUSIBLE_RBC_TP_LOW = 0.1;
  public static final double PLAUSIBLE_RBC_TP_HIGH = 0.7;

  private final double frequencyOffset;
  private final double flipAngleRatio;
  private final double te90;
  private final double rbcToTp;
  private final double actualFlipAngle;
  private final double prescribedFlipAngle;

  private final FitResult gasFit;
  private final FitResult dissolvedFit;
  private final FlipAngleDecayFit decayFit;

  private final Map<String, double[]> numerMap;

  /**
   * Collect the outputs of a calibration
   *
   * @param frequencyOffset Gas frequency offset, Hz
   * @param flipAngleRatio Prescribed over actual flip angle
   * @param te90 Echo time giving 90 degrees between RBC and tissue/plasma, ms
   * @param rbcToTp Signed RBC over tissue/plasma amplitude
   * @param prescribedFlipAngle Flip angle set on the scanner, degrees
   * @param gasFit Single-component fit of the first gas FID
   * @param dissolvedFit Three-component fit of the averaged dissolved FID
   * @param decayFit Fit of the gas signal decay
   */
  public CalibrationResult(double frequencyOffset, double flipAngleRatio, double te90,
      double rbcToTp, double prescribedFlipAngle, FitResult gasFit, FitResult dissolvedFit,
      FlipAngleDecayFit decayFit) {
    this.frequencyOffset = frequencyOffset;
    this.flipAngleRatio = flipAngleRatio;
    this.te90 = te90;
    this.rbcToTp = rbcToTp;
    this.prescribedFlipAngle = prescribedFlipAngle;
    this.actualFlipAngle = decayFit.getFlipAngleDegrees();
    this.gasFit = gasFit;
    this.dissolvedFit = dissolvedFit;
    this.decayFit = decayFit;

    Map<String, double[]> map = new LinkedHashMap<>();
    map.put("Frequency_offset", new double[]{frequencyOffset});
    map.put("Set_to_actual_flip_ratio", new double[]{flipAngleRatio});
    map.put("TE90", new double[]{te90});
    map.put("RBC_to_TP", new double[]{rbcToTp});
    map.put("Actual_flip_angle", new double[]{actualFlipAngle});
    map.put("Prescribed_flip_angle", new double[]{prescribedFlipAngle});
    map.put("Converged", new double[]{
        gasFit.isConverged() ? 1. : 0.,
        dissolvedFit.isConverged() ? 1. : 0.,
        decayFit.isConverged() ? 1. : 0.});
    numerMap = Collections.unmodifiableMap(map);
  }

  /**
   * Get the center frequency to set on the scanner for the next acquisition
   *
   * @param currentCenterFrequency Center frequency used for the calibration, Hz
   * @return corrected center frequency, Hz
   */
  public double getCenterFrequency(double currentCenterFrequency) {
    return currentCenterFrequency + frequencyOffset;
  }

  public double getFrequencyOffset() {
    return frequencyOffset;
  }

  public double getFlipAngleRatio() {
    return flipAngleRatio;
  }

  /**
   * Get the corrected echo time for dissolved-phase imaging
   *
   * @return TE90 in milliseconds
   */
  public double getTe90() {
    return te90;
  }

  public double getRbcToTp() {
    return rbcToTp;
  }

  public double getActualFlipAngle() {
    return actualFlipAngle;
  }

  public double getPrescribedFlipAngle() {
    return prescribedFlipAngle;
  }

  public FitResult getGasFit() {
    return gasFit;
  }

  public FitResult getDissolvedFit() {
    return dissolvedFit;
  }

  public FlipAngleDecayFit getDecayFit() {
    return decayFit;
  }

  /**
   * Get whether all three fits met their solver tolerances
   *
   * @return true if every fit converged
   */
  public boolean isConverged() {
    return gasFit.isConverged() && dissolvedFit.isConverged() && decayFit.isConverged();
  }

  /**
   * Get whether RBC/TP falls inside the physiologically expected range
   *
   * @return true if RBC/TP is within [0.1, 0.7]
   */
  public boolean isRbcToTpPlausible() {
    return rbcToTp >= PLAUSIBLE_RBC_TP_LOW && rbcToTp <= PLAUSIBLE_RBC_TP_HIGH;
  }

  /**
   * Get the numeric results keyed by description. "Converged" holds one flag per fit
   * (gas, dissolved, decay) as 1 or 0.
   *
   * @return map from result names to values
   */
  public Map<String, double[]> getNumerMap() {
    return numerMap;
  }

  @Override
  public String toString() {
    return String.format("Frequency offset: %.0f Hz, set/actual flip: %.3f, "
        + "TE90: %.2f ms, RBC/TP: %.2f", frequencyOffset, flipAngleRatio, te90, rbcToTp);
  }

}
