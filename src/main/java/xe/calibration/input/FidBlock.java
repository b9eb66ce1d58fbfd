package xe.calibration.input;

import org.apache.commons.math3.complex.Complex;
import xe.calibration.exceptions.InvalidParameterException;
import xe.calibration.utils.TimeSeriesUtils;

/**
 * Holds a single complex time series (an FID or an average of FIDs) along with the dwell time
 * separating its samples. The first sample is taken to be at t = 0.
 * Instances are immutable; the sample array is copied in and copied out.
 */
public class FidBlock {

  private final String name;
  private final Complex[] data;
  private final double dwellTime;

  /**
   * Create a time series from complex samples
   *
   * @param name Descriptor of the data (used in plot series names)
   * @param data Complex samples; may be empty
   * @param dwellTime Time between samples in seconds, must be positive and finite
   */
  public FidBlock(String name, Complex[] data, double dwellTime) {
    if (data == null) {
      throw new InvalidParameterException("FID samples for " + name + " are null");
    }
    if (!(dwellTime > 0.) || Double.isInfinite(dwellTime)) {
      throw new InvalidParameterException("dwell time must be positive and finite, got "
          + dwellTime);
    }
    for (int i = 0; i < data.length; ++i) {
      Complex sample = data[i];
      if (sample == null || sample.isNaN() || sample.isInfinite()) {
        throw new InvalidParameterException("sample " + i + " of " + name + " is not finite");
      }
    }
    this.name = name;
    this.data = data.clone();
    this.dwellTime = dwellTime;
  }

  /**
   * Get the samples of this series
   *
   * @return copy of the complex samples
   */
  public Complex[] getData() {
    return data.clone();
  }

  public double getDwellTime() {
    return dwellTime;
  }

  public String getName() {
    return name;
  }

  /**
   * Get the sample rate of this series
   *
   * @return samples per second
   */
  public double getSampleRate() {
    return 1. / dwellTime;
  }

  /**
   * Get the time stamps of each sample, t[k] = k * dwell
   *
   * @return time values in seconds
   */
  public double[] getTimes() {
    return TimeSeriesUtils.timeAxis(data.length, dwellTime);
  }

  /**
   * Get the largest sample magnitude in this series
   *
   * @return peak magnitude, or 0 if the series is empty
   */
  public double getMaxMagnitude() {
    double max = 0.;
    for (Complex sample : data) {
      max = Math.max(max, sample.abs());
    }
    return max;
  }

  public int size() {
    return data.length;
  }

}
