package xe.calibration;

import org.apache.log4j.Logger;
import py4j.GatewayServer;
import py4j.Py4JNetworkException;
import xe.calibration.exceptions.InvalidParameterException;
import xe.calibration.experiment.CalibrationExperiment;
import xe.calibration.input.Configuration;
import xe.calibration.input.FidStore;
import xe.calibration.input.FieldStrength;
import xe.calibration.output.CalibrationResult;

/**
 * CalibrationShell allows running the xenon calibration from a MATLAB or Python environment
 * using Py4J. The caller reads the scanner's calibration file, sorts the FIDs into dissolved and
 * gas matrices (samples x acquisitions) and hands over their real and imaginary parts.
 *
 * It uses the Py4J default port: 25333. If a process is already using that port it silently
 * terminates.
 */
public class CalibrationShell {

  private static final Logger logger = Logger.getLogger(CalibrationShell.class);

  private final CalibrationExperiment experiment;

  public CalibrationShell() {
    experiment = new CalibrationExperiment();
  }

  /**
   * Run the calibration using the loaded configuration (by default the 3T protocol)
   *
   * @param dissolvedReal Real part of dissolved FIDs, indexed [sample][acquisition]
   * @param dissolvedImag Imaginary part of dissolved FIDs
   * @param gasReal Real part of gas FIDs, indexed [sample][acquisition]
   * @param gasImag Imaginary part of gas FIDs
   * @return calibration values and the fits behind them
   */
  public CalibrationResult runCalibration(double[][] dissolvedReal, double[][] dissolvedImag,
      double[][] gasReal, double[][] gasImag) {
    return runCalibration(dissolvedReal, dissolvedImag, gasReal, gasImag,
        Configuration.getInstance());
  }

  /**
   * Run the calibration with the protocol defaults of a given field strength
   *
   * @param dissolvedReal Real part of dissolved FIDs, indexed [sample][acquisition]
   * @param dissolvedImag Imaginary part of dissolved FIDs
   * @param gasReal Real part of gas FIDs, indexed [sample][acquisition]
   * @param gasImag Imaginary part of gas FIDs
   * @param fieldStrength Field strength label, "3T" or "1.5T"
   * @return calibration values and the fits behind them
   */
  public CalibrationResult runCalibration(double[][] dissolvedReal, double[][] dissolvedImag,
      double[][] gasReal, double[][] gasImag, String fieldStrength) {
    FieldStrength preset = fieldStrength == null ? null : FieldStrength.fromLabel(fieldStrength);
    if (preset == null) {
      throw new InvalidParameterException("unknown field strength " + fieldStrength);
    }
    return runCalibration(dissolvedReal, dissolvedImag, gasReal, gasImag,
        new Configuration(preset));
  }

  /**
   * Run the calibration with a given configuration
   *
   * @param dissolvedReal Real part of dissolved FIDs, indexed [sample][acquisition]
   * @param dissolvedImag Imaginary part of dissolved FIDs
   * @param gasReal Real part of gas FIDs, indexed [sample][acquisition]
   * @param gasImag Imaginary part of gas FIDs
   * @param configuration Protocol and solver configuration
   * @return calibration values and the fits behind them
   */
  public CalibrationResult runCalibration(double[][] dissolvedReal, double[][] dissolvedImag,
      double[][] gasReal, double[][] gasImag, Configuration configuration) {
    FidStore fidStore = FidStore.fromParts(dissolvedReal, dissolvedImag, gasReal, gasImag,
        configuration.getDwellTime());
    experiment.setConfiguration(configuration);
    experiment.runExperimentOnData(fidStore);
    return experiment.getResult();
  }

  /**
   * Return the calibration experiment data is being run on.
   * This should not be called until runCalibration(..) has been.
   *
   * @return Calibration experiment, to enable reading plot data and annotations.
   */
  public CalibrationExperiment getExperiment() {
    return experiment;
  }

  public static void main(String[] args) {
    GatewayServer gatewayServer = new GatewayServer(new CalibrationShell());
    try {
      gatewayServer.start();
    } catch (Py4JNetworkException e) {
      logger.error("Could not start gateway server", e);
      System.exit(0);
    }
    logger.info("Gateway Server Started");
  }

}
