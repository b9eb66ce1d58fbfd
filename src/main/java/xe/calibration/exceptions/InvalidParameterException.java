package xe.calibration.exceptions;

/**
 * Thrown when input data or configuration cannot be used for fitting: malformed or mismatched
 * FID matrices, non-finite samples or guesses, negative linewidths, non-positive protocol values.
 * Raised before any solver work begins.
 */
public class InvalidParameterException extends IllegalArgumentException {

  public InvalidParameterException(String message) {
    super("Invalid parameter: " + message);
  }

  public InvalidParameterException(String message, Throwable cause) {
    super("Invalid parameter: " + message, cause);
  }
}
