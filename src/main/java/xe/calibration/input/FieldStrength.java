package xe.calibration.input;

/**
 * Protocol presets for the calibration sequence at each supported field strength.
 * Values follow the 129Xe MRI Clinical Trials Consortium recommendations for the calibration
 * acquisition; the dissolved-phase frequency guesses scale with the field.
 */
public enum FieldStrength {

  THREE_TESLA("3T", 0.45, 7430., new double[]{0., -700., -7400.}),
  ONE_POINT_FIVE_TESLA("1.5T", 0.8, 3715., new double[]{0., -350., -3700.});

  /**
   * Dwell time used by the reference protocol at both field strengths (39 us / 2), in seconds
   */
  public static final double DEFAULT_DWELL_TIME = 39E-6 / 2;

  /**
   * Prescribed flip angle of the reference protocol, in degrees
   */
  public static final double DEFAULT_FLIP_ANGLE = 20.;

  private final String label;
  private final double echoTime;
  private final double dissolvedFrequencyOffset;
  private final double[] dissolvedFrequencyGuesses;

  FieldStrength(String label, double echoTime, double dissolvedFrequencyOffset,
      double[] dissolvedFrequencyGuesses) {
    this.label = label;
    this.echoTime = echoTime;
    this.dissolvedFrequencyOffset = dissolvedFrequencyOffset;
    this.dissolvedFrequencyGuesses = dissolvedFrequencyGuesses;
  }

  /**
   * Look up a preset by the label used in configuration files ("3T", "1.5T")
   *
   * @param label Label of the preset, case-insensitive
   * @return matching preset, or null if none matches
   */
  public static FieldStrength fromLabel(String label) {
    for (FieldStrength fieldStrength : values()) {
      if (fieldStrength.label.equalsIgnoreCase(label.trim())) {
        return fieldStrength;
      }
    }
    return null;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Get the nominal echo time of the dissolved-phase acquisition
   *
   * @return echo time in milliseconds
   */
  public double getEchoTime() {
    return echoTime;
  }

  /**
   * Get the nominal offset of the dissolved resonances from the gas resonance
   *
   * @return offset in Hz
   */
  public double getDissolvedFrequencyOffset() {
    return dissolvedFrequencyOffset;
  }

  /**
   * Get the initial frequency guesses of the dissolved spectrum components, relative to the
   * dissolved-phase center frequency. Order is RBC, tissue/plasma, gas.
   *
   * @return frequency guesses in Hz
   */
  public double[] getDissolvedFrequencyGuesses() {
    return dissolvedFrequencyGuesses.clone();
  }

}
