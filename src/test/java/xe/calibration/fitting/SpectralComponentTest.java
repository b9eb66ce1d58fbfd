package xe.calibration.fitting;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import xe.calibration.exceptions.InvalidParameterException;

public class SpectralComponentTest {

  @Test
  public void phaseIsWrapped() {
    assertEquals(-170., new SpectralComponent(1., 0., 10., 0., 190.).getPhase(), 1E-12);
    assertEquals(170., new SpectralComponent(1., 0., 10., 0., -190.).getPhase(), 1E-12);
    assertEquals(-180., new SpectralComponent(1., 0., 10., 0., 180.).getPhase(), 1E-12);
    assertEquals(45., new SpectralComponent(1., 0., 10., 0., 45. + 720.).getPhase(), 1E-9);
  }

  @Test
  public void voigtOnlyWithGaussianWidth() {
    assertFalse(SpectralComponent.lorentzian(1., 0., 10., 0.).isVoigt());
    assertTrue(new SpectralComponent(1., 0., 10., 5., 0.).isVoigt());
  }

  @Test
  public void negativeAmplitudeAllowed() {
    assertEquals(-3., new SpectralComponent(-3., 0., 10., 0., 0.).getAmplitude(), 0.);
  }

  @Test(expected = InvalidParameterException.class)
  public void negativeLorentzianWidth_throws() {
    new SpectralComponent(1., 0., -1., 0., 0.);
  }

  @Test(expected = InvalidParameterException.class)
  public void negativeGaussianWidth_throws() {
    new SpectralComponent(1., 0., 1., -1., 0.);
  }

  @Test(expected = InvalidParameterException.class)
  public void nonFiniteFrequency_throws() {
    new SpectralComponent(1., Double.NaN, 1., 0., 0.);
  }

  @Test(expected = InvalidParameterException.class)
  public void infiniteAmplitude_throws() {
    new SpectralComponent(Double.POSITIVE_INFINITY, 0., 1., 0., 0.);
  }

}
