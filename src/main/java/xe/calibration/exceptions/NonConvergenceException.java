package xe.calibration.exceptions;

import xe.calibration.output.CalibrationResult;

/**
 * Thrown when a fit exhausts its solver budget and the caller has asked for converged fits only.
 * The best-effort result computed from the parameters the solver stopped at is still attached.
 */
public class NonConvergenceException extends RuntimeException {

  private final transient CalibrationResult bestEffort;

  public NonConvergenceException(String message, CalibrationResult bestEffort) {
    super("Fit did not converge: " + message);
    this.bestEffort = bestEffort;
  }

  /**
   * Get the result computed from the last parameters the solvers returned
   * @return calibration result built from unconverged fits
   */
  public CalibrationResult getBestEffortResult() {
    return bestEffort;
  }
}
