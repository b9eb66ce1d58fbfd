package xe.calibration.utils;

import static org.junit.Assert.assertEquals;

import java.text.DecimalFormat;
import org.junit.Test;

public class NumericUtilsTest {

  @Test
  public void rewrapDegreesIntoHalfOpenRange() {
    assertEquals(0., NumericUtils.rewrapAngleDegrees(360.), 1E-12);
    assertEquals(-90., NumericUtils.rewrapAngleDegrees(270.), 1E-12);
    assertEquals(90., NumericUtils.rewrapAngleDegrees(-270.), 1E-12);
    assertEquals(-180., NumericUtils.rewrapAngleDegrees(180.), 1E-12);
    assertEquals(-180., NumericUtils.rewrapAngleDegrees(-180.), 1E-12);
    assertEquals(45., NumericUtils.rewrapAngleDegrees(45. + 3 * 360.), 1E-9);
  }

  @Test
  public void rewrapRadians() {
    assertEquals(-Math.PI / 2, NumericUtils.rewrapAngleRadians(3 * Math.PI / 2), 1E-12);
    assertEquals(0.5, NumericUtils.rewrapAngleRadians(0.5 + NumericUtils.TAU), 1E-12);
  }

  @Test
  public void infinityIsPrintable() {
    DecimalFormat df = new DecimalFormat("#.###");
    NumericUtils.setInfinityPrintable(df);
    assertEquals("Inf.", df.format(Double.POSITIVE_INFINITY));
  }

}
