package xe.calibration.input;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class FieldStrengthTest {

  @Test
  public void labelsResolveToPresets() {
    assertEquals(FieldStrength.THREE_TESLA, FieldStrength.fromLabel("3T"));
    assertEquals(FieldStrength.ONE_POINT_FIVE_TESLA, FieldStrength.fromLabel(" 1.5t "));
    assertNull(FieldStrength.fromLabel("7T"));
  }

  @Test
  public void presetValues() {
    assertEquals(0.45, FieldStrength.THREE_TESLA.getEchoTime(), 0.);
    assertEquals(7430., FieldStrength.THREE_TESLA.getDissolvedFrequencyOffset(), 0.);
    assertEquals(0.8, FieldStrength.ONE_POINT_FIVE_TESLA.getEchoTime(), 0.);
    assertEquals(3715., FieldStrength.ONE_POINT_FIVE_TESLA.getDissolvedFrequencyOffset(), 0.);
    assertArrayEquals(new double[]{0., -700., -7400.},
        FieldStrength.THREE_TESLA.getDissolvedFrequencyGuesses(), 0.);
  }

  @Test
  public void guessesAreCopied() {
    FieldStrength.THREE_TESLA.getDissolvedFrequencyGuesses()[1] = 0.;
    assertEquals(-700., FieldStrength.THREE_TESLA.getDissolvedFrequencyGuesses()[1], 0.);
  }

}
