package xe.calibration.fitting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import xe.calibration.exceptions.InvalidParameterException;
import xe.calibration.input.FidBlock;

/**
 * An observed FID together with the starting guesses of the components to be fit to it.
 * The order of the guesses is kept in the result, so callers that interpret components by
 * position (RBC first, then tissue/plasma, then gas) get them back in the same slots.
 */
public class FitProblem {

  private final FidBlock observed;
  private final List<SpectralComponent> guesses;
  private final double lineBroadening;
  private final int zeroPadSize;

  /**
   * Create a fit problem
   *
   * @param observed FID to fit
   * @param guesses Starting values, one per component (at least one)
   * @param lineBroadening Extra Lorentzian broadening shared by all components, held fixed, Hz
   * @param zeroPadSize Length to pad to when computing display spectra (does not affect fitting)
   */
  public FitProblem(FidBlock observed, List<SpectralComponent> guesses, double lineBroadening,
      int zeroPadSize) {
    if (observed == null || observed.size() == 0) {
      throw new InvalidParameterException("observed FID has no samples");
    }
    if (guesses == null || guesses.isEmpty()) {
      throw new InvalidParameterException("at least one component guess is required");
    }
    for (SpectralComponent guess : guesses) {
      if (guess == null) {
        throw new InvalidParameterException("component guesses must not be null");
      }
    }
    if (!(lineBroadening >= 0.) || Double.isInfinite(lineBroadening)) {
      throw new InvalidParameterException("line broadening must be finite and not negative, got "
          + lineBroadening);
    }
    if (zeroPadSize < 0) {
      throw new InvalidParameterException("zero pad size must not be negative, got "
          + zeroPadSize);
    }
    this.observed = observed;
    this.guesses = Collections.unmodifiableList(new ArrayList<>(guesses));
    this.lineBroadening = lineBroadening;
    this.zeroPadSize = zeroPadSize;

    // each complex sample gives two residual terms
    if (2 * observed.size() < getFreeParameterCount()) {
      throw new InvalidParameterException("FID of " + observed.size() + " samples is too short "
          + "to fit " + getFreeParameterCount() + " parameters");
    }
  }

  /**
   * Count the parameters the solver varies: amplitude, frequency, Lorentzian width and phase of
   * each component, plus the Gaussian width of each Voigt component
   *
   * @return number of free parameters
   */
  public int getFreeParameterCount() {
    int count = 0;
    for (SpectralComponent guess : guesses) {
      count += guess.isVoigt() ? 5 : 4;
    }
    return count;
  }

  public List<SpectralComponent> getGuesses() {
    return guesses;
  }

  public double getLineBroadening() {
    return lineBroadening;
  }

  public FidBlock getObserved() {
    return observed;
  }

  public int getZeroPadSize() {
    return zeroPadSize;
  }

}
