package xe.calibration.experiment;

/**
 * Enumerated type defining each step of the calibration that can be run on its own,
 * and for creating the associated Experiment class.
 */
public enum ExperimentEnum {

  GASFQ("Gas frequency") {
    @Override
    public Experiment createExperiment() {
      return new GasFrequencyExperiment();
    }
  },
  FLIPA("Flip angle") {
    @Override
    public Experiment createExperiment() {
      return new FlipAngleExperiment();
    }
  },
  DSPEC("Dissolved spectrum") {
    @Override
    public Experiment createExperiment() {
      return new DissolvedSpectrumExperiment();
    }
  },
  XECAL("Xenon calibration") {
    @Override
    public Experiment createExperiment() {
      return new CalibrationExperiment();
    }
  };
  private String name;

  ExperimentEnum(String name) {
    this.name = name;
  }

  public abstract Experiment createExperiment();

  /**
   * Get the full name of this experiment (used for plot names)
   *
   * @return Name of experiment, as String
   */
  public String getName() {
    return name;
  }

}
