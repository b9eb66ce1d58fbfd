package xe.calibration.fitting;

import xe.calibration.exceptions.InvalidParameterException;
import xe.calibration.utils.NumericUtils;

/**
 * One resonance of a time-domain spectral fit: an exponentially (and optionally Gaussian) damped
 * complex sinusoid. Used both for initial guesses and for converged fit values.
 * The lineshape is a Voigt profile when the Gaussian width is nonzero, otherwise Lorentzian.
 */
public class SpectralComponent {

  private final double amplitude;
  private final double frequency;
  private final double lorentzianWidth;
  private final double gaussianWidth;
  private final double phase;

  /**
   * Create a spectral component
   *
   * @param amplitude Signal amplitude at t = 0 (signal units, may be negative)
   * @param frequency Frequency offset in Hz
   * @param lorentzianWidth Lorentzian full width at half max in Hz, not negative
   * @param gaussianWidth Gaussian full width at half max in Hz, not negative (0 for Lorentzian)
   * @param phase Phase in degrees; stored wrapped to [-180, 180)
   */
  public SpectralComponent(double amplitude, double frequency, double lorentzianWidth,
      double gaussianWidth, double phase) {
    double[] values = {amplitude, frequency, lorentzianWidth, gaussianWidth, phase};
    for (double value : values) {
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new InvalidParameterException("spectral component values must be finite, got "
            + amplitude + ", " + frequency + ", " + lorentzianWidth + ", " + gaussianWidth + ", "
            + phase);
      }
    }
    if (lorentzianWidth < 0. || gaussianWidth < 0.) {
      throw new InvalidParameterException("linewidths must not be negative, got "
          + lorentzianWidth + " (Lorentzian) and " + gaussianWidth + " (Gaussian)");
    }
    this.amplitude = amplitude;
    this.frequency = frequency;
    this.lorentzianWidth = lorentzianWidth;
    this.gaussianWidth = gaussianWidth;
    this.phase = NumericUtils.rewrapAngleDegrees(phase);
  }

  /**
   * Create a pure Lorentzian component (no Gaussian broadening)
   *
   * @param amplitude Signal amplitude at t = 0
   * @param frequency Frequency offset in Hz
   * @param lorentzianWidth Lorentzian full width at half max in Hz
   * @param phase Phase in degrees
   * @return component with zero Gaussian width
   */
  public static SpectralComponent lorentzian(double amplitude, double frequency,
      double lorentzianWidth, double phase) {
    return new SpectralComponent(amplitude, frequency, lorentzianWidth, 0., phase);
  }

  public double getAmplitude() {
    return amplitude;
  }

  /**
   * Get the frequency offset of this component
   *
   * @return frequency in Hz
   */
  public double getFrequency() {
    return frequency;
  }

  /**
   * Get the Gaussian linewidth of this component
   *
   * @return full width at half max in Hz
   */
  public double getGaussianWidth() {
    return gaussianWidth;
  }

  /**
   * Get the Lorentzian linewidth of this component
   *
   * @return full width at half max in Hz
   */
  public double getLorentzianWidth() {
    return lorentzianWidth;
  }

  /**
   * Get the phase of this component
   *
   * @return phase in degrees, in [-180, 180)
   */
  public double getPhase() {
    return phase;
  }

  public boolean isVoigt() {
    return gaussianWidth > 0.;
  }

  @Override
  public String toString() {
    return "[amplitude " + amplitude + ", frequency " + frequency + " Hz, FWHM "
        + lorentzianWidth + " Hz (L) / " + gaussianWidth + " Hz (G), phase " + phase + " deg]";
  }

}
