package xe.calibration.input;

import static org.junit.Assert.assertEquals;

import org.apache.commons.math3.complex.Complex;
import org.junit.Test;
import xe.calibration.exceptions.InvalidParameterException;

public class FidStoreTest {

  @Test
  public void dissolvedAverageIsSampleMean() {
    FidStore store = FidStoreUtils.calibrationScenario();
    assertEquals(FidStoreUtils.SAMPLES, store.getSampleCount());
    assertEquals(FidStoreUtils.DISSOLVED_SCALES.length, store.getDissolvedAcquisitionCount());

    Complex[][] dissolved = FidStoreUtils.dissolvedFids();
    // scales average to 1, so the mean is the unscaled FID
    Complex[] mean = store.getDissolvedAverage().getData();
    for (int i = 0; i < mean.length; i += 37) {
      assertEquals(dissolved[i][1].getReal(), mean[i].getReal(), 1E-12);
      assertEquals(dissolved[i][1].getImaginary(), mean[i].getImaginary(), 1E-12);
    }
    assertEquals(FidStore.DISSOLVED_AVERAGE_NAME, store.getDissolvedAverage().getName());
  }

  @Test
  public void gasPeaksDecayByFlipAngle() {
    FidStore store = FidStoreUtils.calibrationScenario();
    double[] peaks = store.getGasPeakMagnitudes();
    assertEquals(FidStoreUtils.GAS_ACQUISITIONS, peaks.length);
    double decay = Math.cos(Math.toRadians(FidStoreUtils.ACTUAL_FLIP_ANGLE));
    for (int j = 0; j < peaks.length; ++j) {
      assertEquals(FidStoreUtils.GAS_AMPLITUDE * Math.pow(decay, j), peaks[j], 1E-15);
    }
  }

  @Test
  public void gasFidIsNamedByAcquisition() {
    FidStore store = FidStoreUtils.calibrationScenario();
    FidBlock gas = store.getGasFid(3);
    assertEquals("Gas FID [3]", gas.getName());
    assertEquals(FidStoreUtils.DWELL, gas.getDwellTime(), 0.);
    assertEquals(FidStoreUtils.SAMPLES, gas.size());
  }

  @Test
  public void fromPartsMatchesComplexInput() {
    Complex[][] dissolved = FidStoreUtils.dissolvedFids();
    Complex[][] gas = FidStoreUtils.gasFids(4, 10.);
    FidStore store = FidStore.fromParts(FidStoreUtils.realParts(dissolved),
        FidStoreUtils.imaginaryParts(dissolved), FidStoreUtils.realParts(gas),
        FidStoreUtils.imaginaryParts(gas), FidStoreUtils.DWELL);
    assertEquals(4, store.getGasAcquisitionCount());
    assertEquals(gas[5][2], store.getGasFid(2).getData()[5]);
  }

  @Test
  public void inputIsCopied() {
    Complex[][] gas = FidStoreUtils.gasFids(3, 10.);
    FidStore store = new FidStore(FidStoreUtils.dissolvedFids(), gas, FidStoreUtils.DWELL);
    Complex original = gas[0][0];
    gas[0][0] = Complex.ZERO;
    assertEquals(original, store.getGasFid(0).getData()[0]);
  }

  @Test(expected = InvalidParameterException.class)
  public void mismatchedSampleCountsRejected() {
    Complex[][] gas = FidStoreUtils.gasFids(3, 10.);
    Complex[][] shortDissolved = new Complex[10][1];
    for (Complex[] row : shortDissolved) {
      row[0] = Complex.ONE;
    }
    new FidStore(shortDissolved, gas, FidStoreUtils.DWELL);
  }

  @Test(expected = InvalidParameterException.class)
  public void raggedMatrixRejected() {
    Complex[][] gas = FidStoreUtils.gasFids(3, 10.);
    gas[7] = new Complex[]{Complex.ONE};
    new FidStore(FidStoreUtils.dissolvedFids(), gas, FidStoreUtils.DWELL);
  }

  @Test(expected = InvalidParameterException.class)
  public void nonFiniteSampleRejected() {
    Complex[][] gas = FidStoreUtils.gasFids(3, 10.);
    gas[2][1] = new Complex(Double.POSITIVE_INFINITY, 0.);
    new FidStore(FidStoreUtils.dissolvedFids(), gas, FidStoreUtils.DWELL);
  }

  @Test(expected = InvalidParameterException.class)
  public void missingAcquisitionRejected() {
    new FidStore(FidStoreUtils.dissolvedFids(), FidStoreUtils.gasFids(3, 10.), FidStoreUtils.DWELL)
        .getGasFid(3);
  }

}
