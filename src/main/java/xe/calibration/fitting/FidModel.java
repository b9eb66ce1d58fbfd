package xe.calibration.fitting;

import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.complex.Complex;
import xe.calibration.exceptions.InvalidParameterException;
import xe.calibration.utils.NumericUtils;

/**
 * Complex time-domain model of an FID as a sum of damped, phase-shifted sinusoids.
 * Each component contributes
 * A * exp(i * phase) * exp(i * 2 pi f t) * exp(-pi t (L + lb)) * exp(-t^2 g(G)),
 * where L and G are the Lorentzian and Gaussian full widths at half max, lb is an extra line
 * broadening shared by every component, and g converts a Gaussian FWHM into a time-domain
 * decay constant.
 */
public class FidModel {

  /**
   * Convert a Gaussian linewidth into the constant multiplying t^2 in the time-domain decay.
   * A Gaussian line of FWHM G Hz is the transform of exp(-(pi G)^2 t^2 / (4 ln 2)).
   *
   * @param gaussianWidth Gaussian FWHM in Hz
   * @return decay constant in 1/s^2 (0 for a zero width)
   */
  public static double gaussianDecayRate(double gaussianWidth) {
    double piG = Math.PI * gaussianWidth;
    return piG * piG / (4. * Math.log(2.));
  }

  /**
   * Synthesize the sum of several components over a set of time stamps
   *
   * @param times Time of each sample in seconds
   * @param components Components to sum
   * @param lineBroadening Extra Lorentzian broadening applied to every component, Hz
   * @return complex signal, one value per time stamp (empty for an empty time axis)
   */
  public static Complex[] synthesize(double[] times, List<SpectralComponent> components,
      double lineBroadening) {
    checkBroadening(lineBroadening);
    Complex[] signal = new Complex[times.length];
    Arrays.fill(signal, Complex.ZERO);
    for (SpectralComponent component : components) {
      Complex[] part = synthesizeComponent(times, component, lineBroadening);
      for (int i = 0; i < signal.length; ++i) {
        signal[i] = signal[i].add(part[i]);
      }
    }
    return signal;
  }

  /**
   * Synthesize a single component over a set of time stamps
   *
   * @param times Time of each sample in seconds
   * @param component Component to synthesize
   * @param lineBroadening Extra Lorentzian broadening, Hz
   * @return complex signal, one value per time stamp
   */
  public static Complex[] synthesizeComponent(double[] times, SpectralComponent component,
      double lineBroadening) {
    checkBroadening(lineBroadening);
    double[][] parts = evaluate(times, component.getAmplitude(), component.getFrequency(),
        component.getLorentzianWidth() + lineBroadening,
        gaussianDecayRate(component.getGaussianWidth()), Math.toRadians(component.getPhase()));
    Complex[] signal = new Complex[times.length];
    for (int i = 0; i < times.length; ++i) {
      signal[i] = new Complex(parts[0][i], parts[1][i]);
    }
    return signal;
  }

  /**
   * Evaluate one component as separate real and imaginary arrays. Also used by the fitter, which
   * works on raw parameter values rather than validated components.
   *
   * @param times Time of each sample in seconds
   * @param amplitude Amplitude at t = 0
   * @param frequency Frequency in Hz
   * @param lorentzianWidth Total Lorentzian FWHM (including any extra broadening), Hz
   * @param gaussianRate Gaussian decay constant from {@link #gaussianDecayRate(double)}
   * @param phase Phase in radians
   * @return two arrays: real parts then imaginary parts
   */
  static double[][] evaluate(double[] times, double amplitude, double frequency,
      double lorentzianWidth, double gaussianRate, double phase) {
    double[][] parts = new double[2][times.length];
    for (int i = 0; i < times.length; ++i) {
      double t = times[i];
      double envelope =
          amplitude * Math.exp(-Math.PI * lorentzianWidth * t - gaussianRate * t * t);
      double angle = phase + NumericUtils.TAU * frequency * t;
      parts[0][i] = envelope * Math.cos(angle);
      parts[1][i] = envelope * Math.sin(angle);
    }
    return parts;
  }

  private static void checkBroadening(double lineBroadening) {
    if (!(lineBroadening >= 0.) || Double.isInfinite(lineBroadening)) {
      throw new InvalidParameterException("line broadening must be finite and not negative, got "
          + lineBroadening);
    }
  }

}
