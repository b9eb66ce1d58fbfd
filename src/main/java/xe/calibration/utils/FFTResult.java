package xe.calibration.utils;

import java.util.Arrays;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.jfree.data.xy.XYSeries;

/**
 * Holds the data returned from a Fourier transform of a complex FID
 * (the centered transform and the frequencies matching each point of it).
 * FIDs are complex (quadrature) signals, so both positive and negative frequencies are kept
 * and the transform is shifted so that zero frequency sits at the center of the array.
 * This is used only for displaying fits; fitting itself happens in the time domain.
 */
public class FFTResult {

  final private Complex[] transform; // the FFT data
  final private double[] freqs; // array of frequencies matching the fft data

  /**
   * Instantiate the structure holding an FFT and its frequency range
   *
   * @param inFFT Precalculated FFT result for some timeseries
   * @param inFreq Frequencies matched up to each FFT value
   */
  private FFTResult(Complex[] inFFT, double[] inFreq) {
    transform = inFFT;
    freqs = inFreq;
  }

  /**
   * Get the smallest power of two that is at least as large as the given length.
   * The radix-2 transformer only accepts power-of-two input.
   *
   * @param length Minimum length of the padded series
   * @return power of two no smaller than length (and at least 2)
   */
  public static int paddedLength(int length) {
    int padding = 2;
    while (padding < length) {
      padding *= 2;
    }
    return padding;
  }

  /**
   * Compute the centered spectrum of a complex time series.
   * The series is zero-padded up to the requested length (rounded up to a power of two), the
   * forward transform is taken and shifted so that negative frequencies come first, and the result
   * is scaled by the dwell time so that its magnitude does not depend on the sampling rate.
   *
   * @param timeSeries Complex samples, first sample at t = 0
   * @param dwellTime Time between samples, in seconds
   * @param zeroPadSize Requested length of the padded series; values shorter than the series
   * itself are ignored
   * @return Centered transform and the frequencies (Hz) of each point
   */
  public static FFTResult centeredSpectrum(Complex[] timeSeries, double dwellTime,
      int zeroPadSize) {

    int padding = paddedLength(Math.max(zeroPadSize, timeSeries.length));

    Complex[] toFFT = new Complex[padding];
    System.arraycopy(timeSeries, 0, toFFT, 0, timeSeries.length);
    Arrays.fill(toFFT, timeSeries.length, padding, Complex.ZERO);

    FastFourierTransformer fft =
        new FastFourierTransformer(DftNormalization.STANDARD);
    Complex[] frqDomn = fft.transform(toFFT, TransformType.FORWARD);

    int half = padding / 2;
    double deltaFrq = 1. / (padding * dwellTime);

    Complex[] fftOut = new Complex[padding];
    double[] frequencies = new double[padding];
    for (int i = 0; i < padding; ++i) {
      // shift so that index 0 is the most negative frequency
      fftOut[i] = frqDomn[(i + half) % padding].multiply(dwellTime);
      frequencies[i] = (i - half) * deltaFrq;
    }

    return new FFTResult(fftOut, frequencies);
  }

  /**
   * Sum several spectra taken over the same frequency axis (i.e., per-component fit spectra)
   *
   * @param spectra Spectra to add together; all must share the first spectrum's frequencies
   * @return Spectrum holding the point-by-point sum
   */
  public static FFTResult sum(FFTResult... spectra) {
    double[] frequencies = spectra[0].getFreqs();
    Complex[] total = new Complex[frequencies.length];
    Arrays.fill(total, Complex.ZERO);
    for (FFTResult spectrum : spectra) {
      Complex[] data = spectrum.getFFT();
      for (int i = 0; i < total.length; ++i) {
        total[i] = total[i].add(data[i]);
      }
    }
    return new FFTResult(total, frequencies);
  }

  /**
   * Get the index of the point with largest magnitude (the spectral peak)
   *
   * @return index into the FFT and frequency arrays
   */
  public int getPeakIndex() {
    int peak = 0;
    double max = transform[0].abs();
    for (int i = 1; i < transform.length; ++i) {
      if (transform[i].abs() > max) {
        max = transform[i].abs();
        peak = i;
      }
    }
    return peak;
  }

  /**
   * Get the FFT data held by this object
   *
   * @return Complex array of frequency-space values
   */
  public Complex[] getFFT() {
    return transform;
  }

  /**
   * Get the frequencies of the FFT data
   *
   * @return Array of frequencies in Hz, ascending from -1/(2 * dwell)
   */
  public double[] getFreqs() {
    return freqs;
  }

  /**
   * Build a plottable series of the spectrum magnitude over a frequency window
   *
   * @param name Name of the series
   * @param lowFreq Lowest frequency (Hz) to include
   * @param highFreq Highest frequency (Hz) to include
   * @return XYSeries of (frequency, magnitude) points
   */
  public XYSeries magnitudeSeries(String name, double lowFreq, double highFreq) {
    XYSeries series = new XYSeries(name);
    for (int i = 0; i < freqs.length; ++i) {
      if (freqs[i] < lowFreq || freqs[i] > highFreq) {
        continue;
      }
      series.add(freqs[i], transform[i].abs());
    }
    return series;
  }

}
