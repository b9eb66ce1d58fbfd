package xe.calibration.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;

/**
 * Class containing methods to serve as math functions, mainly for angle calcs
 * and number formatting
 */
public class NumericUtils {

  /**
   * 2 * Pi, sometimes also referred to as Tau.
   * The number of radians in a full circle.
   */
  public final static double TAU = Math.PI * 2; // radians in full circle

  /**
   * Sets decimalformat object so that infinity can be printed in a text annotation
   *
   * @param df DecimalFormat object to change the infinity symbol value of
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    symbols.setNaN("NaN");
    df.setDecimalFormatSymbols(symbols);
  }

  /**
   * Wrap an angle in degrees into the half-open range [-180, 180).
   * Angles that differ by a whole number of turns map to the same value.
   *
   * @param angle in degrees
   * @return same angle but in [-180, 180)
   */
  public static double rewrapAngleDegrees(double angle) {
    double wrapped = angle - 360. * Math.floor((angle + 180.) / 360.);
    // rounding can land on the open end of the range
    if (wrapped >= 180.) {
      wrapped -= 360.;
    } else if (wrapped < -180.) {
      wrapped += 360.;
    }
    return wrapped;
  }

  /**
   * Wrap an angle in radians into the half-open range [-pi, pi).
   *
   * @param angle in radians
   * @return same angle but in [-pi, pi)
   */
  public static double rewrapAngleRadians(double angle) {
    return Math.toRadians(rewrapAngleDegrees(Math.toDegrees(angle)));
  }

}
