package xe.calibration.utils;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import xe.calibration.exceptions.InvalidParameterException;

/**
 * Contains static methods for operating on FID matrices and complex time series.
 * FID matrices are indexed [sample][acquisition], so each column is one acquired FID,
 * matching the way scanner readers hand the data over (samples x acquisitions).
 */
public class TimeSeriesUtils {

  /**
   * Number of milliseconds in a second, used to put TE90 corrections in echo-time units
   */
  public static final double MILLIS_PER_SECOND = 1000.;

  /**
   * Produce the time stamps of a uniformly sampled series, t[k] = k * dwell
   *
   * @param length Number of samples
   * @param dwellTime Time between samples, in seconds
   * @return Array of time values in seconds, starting at 0
   */
  public static double[] timeAxis(int length, double dwellTime) {
    double[] times = new double[length];
    for (int i = 0; i < length; ++i) {
      times[i] = i * dwellTime;
    }
    return times;
  }

  /**
   * Get a single acquisition (column) out of an FID matrix
   *
   * @param fids Matrix of FIDs indexed [sample][acquisition]
   * @param acquisition Index of the acquisition to extract
   * @return Copy of that acquisition's samples
   */
  public static Complex[] getColumn(Complex[][] fids, int acquisition) {
    Complex[] column = new Complex[fids.length];
    for (int i = 0; i < fids.length; ++i) {
      column[i] = fids[i][acquisition];
    }
    return column;
  }

  /**
   * Average all acquisitions of an FID matrix sample by sample, to raise SNR
   *
   * @param fids Matrix of FIDs indexed [sample][acquisition]
   * @return Mean FID, one value per sample
   */
  public static Complex[] columnMean(Complex[][] fids) {
    Complex[] mean = new Complex[fids.length];
    for (int i = 0; i < fids.length; ++i) {
      double real = 0.;
      double imag = 0.;
      for (Complex sample : fids[i]) {
        real += sample.getReal();
        imag += sample.getImaginary();
      }
      mean[i] = new Complex(real / fids[i].length, imag / fids[i].length);
    }
    return mean;
  }

  /**
   * Get the largest magnitude of each acquisition in an FID matrix
   *
   * @param fids Matrix of FIDs indexed [sample][acquisition]
   * @return Peak magnitude per acquisition, in acquisition order
   */
  public static double[] columnMaxMagnitudes(Complex[][] fids) {
    int acquisitions = fids[0].length;
    double[] peaks = new double[acquisitions];
    for (int j = 0; j < acquisitions; ++j) {
      DescriptiveStatistics stats = new DescriptiveStatistics();
      for (Complex[] row : fids) {
        stats.addValue(row[j].abs());
      }
      peaks[j] = stats.getMax();
    }
    return peaks;
  }

  /**
   * Combine separate real and imaginary matrices into one complex FID matrix.
   * Used by callers that cannot pass complex values directly (i.e., over the Py4J gateway).
   *
   * @param real Real parts, indexed [sample][acquisition]
   * @param imag Imaginary parts, same shape as the real parts
   * @return Complex FID matrix
   */
  public static Complex[][] toComplex(double[][] real, double[][] imag) {
    if (real == null || imag == null) {
      throw new InvalidParameterException("real and imaginary parts must both be given");
    }
    if (real.length != imag.length) {
      throw new InvalidParameterException("real part has " + real.length
          + " samples but imaginary part has " + imag.length);
    }
    Complex[][] out = new Complex[real.length][];
    for (int i = 0; i < real.length; ++i) {
      if (real[i] == null || imag[i] == null || real[i].length != imag[i].length) {
        throw new InvalidParameterException("mismatched real and imaginary rows at sample " + i);
      }
      out[i] = new Complex[real[i].length];
      for (int j = 0; j < real[i].length; ++j) {
        out[i][j] = new Complex(real[i][j], imag[i][j]);
      }
    }
    return out;
  }

}
