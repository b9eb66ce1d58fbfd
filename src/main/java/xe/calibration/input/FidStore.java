package xe.calibration.input;

import org.apache.commons.math3.complex.Complex;
import xe.calibration.exceptions.InvalidParameterException;
import xe.calibration.utils.TimeSeriesUtils;

/**
 * Holds the FIDs of one calibration acquisition: all dissolved-phase FIDs and all gas-phase FIDs,
 * each as a matrix shaped (samples x acquisitions), sampled at a common dwell time.
 * Reading scanner files and sorting dissolved from gas FIDs is done by the caller; this class
 * only checks that what it is handed is usable and produces the time series the experiments fit.
 * The shape checks happen on construction so that malformed input is rejected before any fitting.
 */
public class FidStore {

  public static final String DISSOLVED_AVERAGE_NAME = "Dissolved FID (mean)";
  public static final String GAS_NAME = "Gas FID";

  private final Complex[][] dissolvedFids;
  private final Complex[][] gasFids;
  private final double dwellTime;

  /**
   * Create the store from complex FID matrices
   *
   * @param dissolvedFids Dissolved FIDs indexed [sample][acquisition]
   * @param gasFids Gas FIDs indexed [sample][acquisition]
   * @param dwellTime Time between samples in seconds
   */
  public FidStore(Complex[][] dissolvedFids, Complex[][] gasFids, double dwellTime) {
    if (!(dwellTime > 0.) || Double.isInfinite(dwellTime)) {
      throw new InvalidParameterException("dwell time must be positive and finite, got "
          + dwellTime);
    }
    this.dissolvedFids = checkedCopy(dissolvedFids, "dissolved");
    this.gasFids = checkedCopy(gasFids, "gas");
    if (this.dissolvedFids.length != this.gasFids.length) {
      throw new InvalidParameterException("dissolved FIDs have " + this.dissolvedFids.length
          + " samples per acquisition but gas FIDs have " + this.gasFids.length);
    }
    this.dwellTime = dwellTime;
  }

  /**
   * Create the store from separate real and imaginary matrices
   *
   * @param dissolvedReal Real part of dissolved FIDs, indexed [sample][acquisition]
   * @param dissolvedImag Imaginary part of dissolved FIDs
   * @param gasReal Real part of gas FIDs, indexed [sample][acquisition]
   * @param gasImag Imaginary part of gas FIDs
   * @param dwellTime Time between samples in seconds
   * @return store holding the combined complex data
   */
  public static FidStore fromParts(double[][] dissolvedReal, double[][] dissolvedImag,
      double[][] gasReal, double[][] gasImag, double dwellTime) {
    return new FidStore(TimeSeriesUtils.toComplex(dissolvedReal, dissolvedImag),
        TimeSeriesUtils.toComplex(gasReal, gasImag), dwellTime);
  }

  private static Complex[][] checkedCopy(Complex[][] fids, String kind) {
    if (fids == null || fids.length == 0) {
      throw new InvalidParameterException(kind + " FID matrix has no samples");
    }
    if (fids[0] == null || fids[0].length == 0) {
      throw new InvalidParameterException(kind + " FID matrix has no acquisitions");
    }
    int acquisitions = fids[0].length;
    Complex[][] copy = new Complex[fids.length][];
    for (int i = 0; i < fids.length; ++i) {
      if (fids[i] == null || fids[i].length != acquisitions) {
        throw new InvalidParameterException(kind + " FID matrix is not rectangular at sample " + i);
      }
      for (int j = 0; j < acquisitions; ++j) {
        Complex sample = fids[i][j];
        if (sample == null || sample.isNaN() || sample.isInfinite()) {
          throw new InvalidParameterException(kind + " FID sample [" + i + "][" + j
              + "] is not finite");
        }
      }
      copy[i] = fids[i].clone();
    }
    return copy;
  }

  /**
   * Get the sample-wise mean of all dissolved FIDs
   *
   * @return averaged dissolved FID as a time series
   */
  public FidBlock getDissolvedAverage() {
    return new FidBlock(DISSOLVED_AVERAGE_NAME, TimeSeriesUtils.columnMean(dissolvedFids),
        dwellTime);
  }

  /**
   * Get a single gas FID
   *
   * @param acquisition Index of the acquisition (0 is the first)
   * @return that gas FID as a time series
   */
  public FidBlock getGasFid(int acquisition) {
    if (acquisition < 0 || acquisition >= getGasAcquisitionCount()) {
      throw new InvalidParameterException("no gas acquisition at index " + acquisition);
    }
    return new FidBlock(GAS_NAME + " [" + acquisition + "]",
        TimeSeriesUtils.getColumn(gasFids, acquisition), dwellTime);
  }

  /**
   * Get the maximum magnitude of each gas FID, in acquisition order
   *
   * @return one peak magnitude per gas acquisition
   */
  public double[] getGasPeakMagnitudes() {
    return TimeSeriesUtils.columnMaxMagnitudes(gasFids);
  }

  public int getDissolvedAcquisitionCount() {
    return dissolvedFids[0].length;
  }

  public double getDwellTime() {
    return dwellTime;
  }

  public int getGasAcquisitionCount() {
    return gasFids[0].length;
  }

  /**
   * Get the number of samples in each FID (shared by dissolved and gas data)
   *
   * @return samples per acquisition
   */
  public int getSampleCount() {
    return gasFids.length;
  }

}
