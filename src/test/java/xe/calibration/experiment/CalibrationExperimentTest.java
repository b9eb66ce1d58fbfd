package xe.calibration.experiment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Map;
import org.junit.Test;
import xe.calibration.exceptions.InvalidParameterException;
import xe.calibration.exceptions.NonConvergenceException;
import xe.calibration.input.Configuration;
import xe.calibration.input.FidStore;
import xe.calibration.input.FidStoreUtils;
import xe.calibration.output.CalibrationResult;

public class CalibrationExperimentTest {

  // echo time of the 3T protocol plus the delay that turns the 45 degree TP phase into 90
  private static final double EXPECTED_TE90 = 0.45 + 45. / (360. * 700.) * 1000.;

  private static CalibrationExperiment runScenario(Configuration configuration) {
    CalibrationExperiment experiment = new CalibrationExperiment();
    experiment.setConfiguration(configuration);
    experiment.runExperimentOnData(FidStoreUtils.calibrationScenario());
    return experiment;
  }

  @Test
  public void calibratesSyntheticScenario() {
    CalibrationResult result = runScenario(new Configuration()).getResult();
    assertTrue(result.isConverged());
    assertEquals(50., result.getFrequencyOffset(), 1E-2);
    assertEquals(20. / 12., result.getFlipAngleRatio(), 1E-3);
    assertEquals(12., result.getActualFlipAngle(), 1E-3);
    assertEquals(20., result.getPrescribedFlipAngle(), 0.);
    assertEquals(0.5, result.getRbcToTp(), 1E-4);
    assertEquals(EXPECTED_TE90, result.getTe90(), 1E-4);
    assertTrue(result.isRbcToTpPlausible());
  }

  @Test
  public void resultMapHoldsEveryValue() {
    Map<String, double[]> numbers = runScenario(new Configuration()).getResult().getNumerMap();
    assertEquals(7, numbers.size());
    assertEquals(50., numbers.get("Frequency_offset")[0], 1E-2);
    assertEquals(0.5, numbers.get("RBC_to_TP")[0], 1E-4);
    double[] converged = numbers.get("Converged");
    assertEquals(3, converged.length);
    for (double flag : converged) {
      assertEquals(1., flag, 0.);
    }
  }

  @Test
  public void collectsPlotsAndInputsOfEachStep() {
    CalibrationExperiment experiment = runScenario(new Configuration());
    // decay, dissolved spectrum, gas spectrum
    assertEquals(3, experiment.getData().size());
    assertEquals(2, experiment.getData().get(0).getSeriesCount());
    assertEquals(5, experiment.getData().get(1).getSeriesCount());
    assertEquals(2, experiment.getData().get(2).getSeriesCount());

    // gas FID [0] from the frequency fit, all gas FIDs from the decay fit, the dissolved mean
    assertEquals(1 + FidStoreUtils.GAS_ACQUISITIONS + 1, experiment.getInputNames().size());
    assertEquals(FidStore.DISSOLVED_AVERAGE_NAME,
        experiment.getInputNames().get(experiment.getInputNames().size() - 1));
  }

  @Test
  public void insetStringsCoverEachPlotAndSummary() {
    CalibrationExperiment experiment = runScenario(new Configuration());
    String[] insets = experiment.getInsetStrings();
    assertEquals(4, insets.length);
    assertTrue(insets[0].contains("Actual flip angle"));
    assertTrue(insets[1].contains("RBC"));
    assertTrue(insets[2].contains("Gas frequency offset"));
    assertTrue(insets[3].contains("TE90"));
  }

  @Test
  public void strictModeThrowsWithBestEffortResult() {
    Configuration configuration = new Configuration();
    configuration.setMaxIterations(1);
    configuration.setRequireConvergence(true);
    try {
      runScenario(configuration);
      fail("expected an unconverged fit to be rejected");
    } catch (NonConvergenceException e) {
      CalibrationResult bestEffort = e.getBestEffortResult();
      assertNotNull(bestEffort);
      assertFalse(bestEffort.isConverged());
      assertFalse(bestEffort.getGasFit().isConverged());
    }
  }

  @Test
  public void tolerantModeKeepsUnconvergedResult() {
    Configuration configuration = new Configuration();
    configuration.setMaxIterations(1);
    CalibrationExperiment experiment = runScenario(configuration);
    CalibrationResult result = experiment.getResult();
    assertNotNull(result);
    assertFalse(result.isConverged());
    assertEquals(0., result.getNumerMap().get("Converged")[0], 0.);
  }

  @Test(expected = InvalidParameterException.class)
  public void tooFewGasAcquisitionsRejected() {
    CalibrationExperiment experiment = new CalibrationExperiment();
    experiment.setConfiguration(new Configuration());
    experiment.runExperimentOnData(new FidStore(FidStoreUtils.dissolvedFids(),
        FidStoreUtils.gasFids(2, FidStoreUtils.ACTUAL_FLIP_ANGLE), FidStoreUtils.DWELL));
  }

}
