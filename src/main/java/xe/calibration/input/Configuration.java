package xe.calibration.input;

import java.io.File;
import java.net.URL;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.ConversionException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;
import xe.calibration.exceptions.InvalidParameterException;
import xe.calibration.fitting.SolverSettings;

/**
 * Configuration of the calibration protocol and of the solver used to fit it.
 * Protocol values (dwell time, echo time, prescribed flip angle, dissolved frequency offset)
 * depend on the field strength the calibration was acquired at; choosing a field strength
 * sets all of them to that preset, after which individual values may be overridden.
 * Solver values bound the Levenberg-Marquardt fits and control whether unconverged fits
 * are accepted.
 */
public class Configuration {

  private static Configuration instance;

  private static final String DEFAULT_CONFIG_PATH = "xe-calibration-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = null;

  private FieldStrength fieldStrength;
  private double dwellTime;
  private double echoTime;
  private double flipAngle;
  private double dissolvedFrequencyOffset;

  private int maxIterations = SolverSettings.DEFAULT_MAX_ITERATIONS;
  private int maxEvaluations = SolverSettings.DEFAULT_MAX_EVALUATIONS;
  private double costTolerance = SolverSettings.DEFAULT_COST_TOLERANCE;
  private double parameterTolerance = SolverSettings.DEFAULT_PARAMETER_TOLERANCE;
  private boolean requireConvergence = false;

  /**
   * Create a configuration using the 3T protocol defaults
   */
  public Configuration() {
    this(FieldStrength.THREE_TESLA);
  }

  /**
   * Create a configuration using the protocol defaults for a given field strength
   *
   * @param fieldStrength Field strength preset to take protocol values from
   */
  public Configuration(FieldStrength fieldStrength) {
    setFieldStrength(fieldStrength);
  }

  /**
   * Read in a configuration from an XML file. Values missing from the file keep their defaults;
   * a file that cannot be parsed, or that holds a value of the wrong type, leaves every value at
   * its default. An unknown field strength label is rejected.
   *
   * @param configLocation Path to the XML file
   * @return configuration holding the file's values
   */
  public static Configuration load(String configLocation) {
    Configuration configuration = new Configuration();
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      configuration.readFrom(new XMLConfiguration(configLocation));
      configuration.loadedConfigPath = configLocation;
      logger.info("Successfully loaded in configuration: " + configLocation);
    } catch (ConfigurationException | ConversionException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
      // values read before the failure are discarded
      configuration = new Configuration();
    }
    return configuration;
  }

  private static Configuration load(URL configLocation) {
    Configuration configuration = new Configuration();
    logger.info("Attempting reading in embedded config from " + configLocation);
    try {
      configuration.readFrom(new XMLConfiguration(configLocation));
      configuration.loadedConfigPath = configLocation.toString();
    } catch (ConfigurationException | ConversionException e) {
      logger.error("Error encountered while reading embedded XML, using defaults", e);
      configuration = new Configuration();
    }
    return configuration;
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists.
   * A config file in the working directory takes precedence over the one embedded in the jar.
   *
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    if (instance == null) {
      File local = new File(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
      URL embedded = Configuration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH);
      if (local.exists()) {
        instance = load(local.getAbsolutePath());
      } else if (embedded != null) {
        instance = load(embedded);
      } else {
        logger.warn("No configuration file found, using built-in 3T defaults");
        instance = new Configuration();
      }
    }
    return instance;
  }

  private void readFrom(XMLConfiguration config) {
    String fieldStrengthParam = config.getString("Protocol.FieldStrength");
    if (fieldStrengthParam != null) {
      FieldStrength preset = FieldStrength.fromLabel(fieldStrengthParam);
      if (preset == null) {
        throw new InvalidParameterException("unknown field strength " + fieldStrengthParam);
      }
      setFieldStrength(preset);
    }

    dwellTime = config.getDouble("Protocol.DwellTime", dwellTime);
    echoTime = config.getDouble("Protocol.EchoTime", echoTime);
    flipAngle = config.getDouble("Protocol.FlipAngle", flipAngle);
    dissolvedFrequencyOffset =
        config.getDouble("Protocol.DissolvedFrequencyOffset", dissolvedFrequencyOffset);

    maxIterations = config.getInt("Solver.MaxIterations", maxIterations);
    maxEvaluations = config.getInt("Solver.MaxEvaluations", maxEvaluations);
    costTolerance = config.getDouble("Solver.CostTolerance", costTolerance);
    parameterTolerance = config.getDouble("Solver.ParameterTolerance", parameterTolerance);
    requireConvergence = config.getBoolean("Solver.RequireConvergence", requireConvergence);
  }

  /**
   * Check that every value can be used for a calibration run
   *
   * @throws InvalidParameterException if any protocol or solver value is unusable
   */
  public void validate() {
    checkPositive("dwell time", dwellTime);
    checkPositive("echo time", echoTime);
    checkPositive("prescribed flip angle", flipAngle);
    if (Double.isNaN(dissolvedFrequencyOffset) || Double.isInfinite(dissolvedFrequencyOffset)) {
      throw new InvalidParameterException("dissolved frequency offset must be finite");
    }
    // constructing the settings checks the solver limits
    getSolverSettings();
  }

  private static void checkPositive(String name, double value) {
    if (!(value > 0.) || Double.isInfinite(value)) {
      throw new InvalidParameterException(name + " must be positive and finite, got " + value);
    }
  }

  /**
   * Get the path the configuration was read from
   *
   * @return file path or resource URL, or null if built from defaults
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  public FieldStrength getFieldStrength() {
    return fieldStrength;
  }

  /**
   * Select a field strength, resetting the protocol values to that preset
   *
   * @param fieldStrength New field strength preset
   */
  public void setFieldStrength(FieldStrength fieldStrength) {
    if (fieldStrength == null) {
      throw new InvalidParameterException("field strength must be given");
    }
    this.fieldStrength = fieldStrength;
    dwellTime = FieldStrength.DEFAULT_DWELL_TIME;
    echoTime = fieldStrength.getEchoTime();
    flipAngle = FieldStrength.DEFAULT_FLIP_ANGLE;
    dissolvedFrequencyOffset = fieldStrength.getDissolvedFrequencyOffset();
  }

  /**
   * Gets the time between FID samples.
   *
   * The property is defined from Configuration.Protocol.DwellTime
   * @return dwell time in seconds
   */
  public double getDwellTime() {
    return dwellTime;
  }

  public void setDwellTime(double dwellTime) {
    this.dwellTime = dwellTime;
  }

  /**
   * Gets the nominal echo time of the dissolved-phase acquisition, which TE90 corrects.
   *
   * The property is defined from Configuration.Protocol.EchoTime
   * @return echo time in milliseconds
   */
  public double getEchoTime() {
    return echoTime;
  }

  public void setEchoTime(double echoTime) {
    this.echoTime = echoTime;
  }

  /**
   * Gets the flip angle prescribed on the scanner for the gas excitations.
   *
   * The property is defined from Configuration.Protocol.FlipAngle
   * @return flip angle in degrees
   */
  public double getFlipAngle() {
    return flipAngle;
  }

  public void setFlipAngle(double flipAngle) {
    this.flipAngle = flipAngle;
  }

  /**
   * Gets the offset of the dissolved-phase excitation from the gas frequency.
   * This is a protocol value reported back to the caller; the dissolved fit does not use it.
   * Its starting frequencies come from the field strength preset
   * (see {@link #getDissolvedFrequencyGuesses()}), so changing this value does not change them.
   *
   * The property is defined from Configuration.Protocol.DissolvedFrequencyOffset
   * @return offset in Hz
   */
  public double getDissolvedFrequencyOffset() {
    return dissolvedFrequencyOffset;
  }

  public void setDissolvedFrequencyOffset(double dissolvedFrequencyOffset) {
    this.dissolvedFrequencyOffset = dissolvedFrequencyOffset;
  }

  /**
   * Gets the starting frequencies of the dissolved spectrum fit for the selected field strength
   *
   * @return RBC, tissue/plasma and gas frequency guesses in Hz
   */
  public double[] getDissolvedFrequencyGuesses() {
    return fieldStrength.getDissolvedFrequencyGuesses();
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public void setMaxEvaluations(int maxEvaluations) {
    this.maxEvaluations = maxEvaluations;
  }

  public double getCostTolerance() {
    return costTolerance;
  }

  public void setCostTolerance(double costTolerance) {
    this.costTolerance = costTolerance;
  }

  public double getParameterTolerance() {
    return parameterTolerance;
  }

  public void setParameterTolerance(double parameterTolerance) {
    this.parameterTolerance = parameterTolerance;
  }

  /**
   * Gets whether a fit that exhausts its solver budget should fail the whole calibration.
   * When false (the default), unconverged fits are used as they are and only flagged.
   *
   * The property is defined from Configuration.Solver.RequireConvergence
   * @return true if unconverged fits are rejected
   */
  public boolean isRequireConvergence() {
    return requireConvergence;
  }

  public void setRequireConvergence(boolean requireConvergence) {
    this.requireConvergence = requireConvergence;
  }

  /**
   * Build the solver settings described by this configuration
   *
   * @return settings for the Levenberg-Marquardt fits
   */
  public SolverSettings getSolverSettings() {
    return new SolverSettings(maxIterations, maxEvaluations, costTolerance, parameterTolerance);
  }

}
