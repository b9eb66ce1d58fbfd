package xe.calibration.exceptions;

/**
 * Thrown when fitted values leave a derived metric undefined, such as two dissolved components
 * with no resolvable frequency separation in the TE90 correction.
 */
public class DegenerateFitException extends ArithmeticException {

  public DegenerateFitException(String message) {
    super("Degenerate fit: " + message);
  }
}
