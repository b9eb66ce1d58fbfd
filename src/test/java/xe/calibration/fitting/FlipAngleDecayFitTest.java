package xe.calibration.fitting;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.junit.Test;
import xe.calibration.exceptions.InvalidParameterException;

public class FlipAngleDecayFitTest {

  private static double[] decay(double scale, double flipAngle, double offset, int count) {
    double[] magnitudes = new double[count];
    for (int k = 1; k <= count; ++k) {
      magnitudes[k - 1] = scale * Math.pow(Math.cos(Math.toRadians(flipAngle)), k - 1) + offset;
    }
    return magnitudes;
  }

  @Test
  public void fit_exactDecay_recoversFlipAngle() {
    double[] magnitudes = decay(2E-4, 12., 0., 8);
    FlipAngleDecayFit fit = FlipAngleDecayFit.fit(magnitudes, new SolverSettings());
    assertTrue(fit.isConverged());
    assertEquals(12., fit.getFlipAngleDegrees(), 1E-3);
    assertEquals(2E-4, fit.getScale(), 1E-8);
    assertEquals(0., fit.getOffset(), 1E-8);
  }

  @Test
  public void fit_recoversOffset() {
    double[] magnitudes = decay(1., 20., 0.05, 16);
    FlipAngleDecayFit fit = FlipAngleDecayFit.fit(magnitudes, new SolverSettings());
    assertEquals(20., fit.getFlipAngleDegrees(), 1E-3);
    assertEquals(0.05, fit.getOffset(), 1E-5);
    for (int k = 1; k <= magnitudes.length; ++k) {
      assertEquals(magnitudes[k - 1], fit.evaluate(k), 1E-6);
    }
  }

  @Test
  public void fit_threeAcquisitionsIsEnough() {
    FlipAngleDecayFit fit = FlipAngleDecayFit.fit(decay(1., 15., 0., 3), new SolverSettings());
    assertEquals(3, fit.getMagnitudes().length);
    assertEquals(1., fit.evaluate(1), 1E-6);
  }

  @Test(expected = InvalidParameterException.class)
  public void fit_twoAcquisitions_throws() {
    FlipAngleDecayFit.fit(new double[]{1., 0.9}, new SolverSettings());
  }

  @Test(expected = InvalidParameterException.class)
  public void fit_nonFiniteMagnitude_throws() {
    FlipAngleDecayFit.fit(new double[]{1., Double.NaN, 0.8}, new SolverSettings());
  }

  @Test
  public void jacobian_firstAcquisitionDoesNotDependOnFlipAngle() {
    RealVector point = new ArrayRealVector(new double[]{2., Math.toRadians(20.), 0.1});
    Pair<RealVector, RealMatrix> result = FlipAngleDecayFit.jacobian(point, 5);
    assertEquals(2.1, result.getFirst().getEntry(0), 1E-12);
    assertEquals(1., result.getSecond().getEntry(0, 0), 0.);
    assertEquals(0., result.getSecond().getEntry(0, 1), 0.);
    assertEquals(1., result.getSecond().getEntry(0, 2), 0.);
    // second acquisition: d/dc2 of c1 cos(c2) is -c1 sin(c2)
    assertEquals(-2. * Math.sin(Math.toRadians(20.)), result.getSecond().getEntry(1, 1), 1E-12);
  }

  @Test
  public void flipAngleIsReportedAsMagnitude() {
    double[] magnitudes = decay(1., 10., 0., 6);
    FlipAngleDecayFit fit = FlipAngleDecayFit.fit(magnitudes, new SolverSettings());
    assertEquals(Math.abs(Math.toDegrees(fit.getFlipAngleRadians())),
        fit.getFlipAngleDegrees(), 0.);
  }

}
