package xe.calibration.experiment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.jfree.data.xy.XYSeriesCollection;
import org.junit.Test;
import xe.calibration.input.Configuration;
import xe.calibration.input.FidStoreUtils;

public class GasFrequencyExperimentTest {

  private static GasFrequencyExperiment runScenario() {
    GasFrequencyExperiment experiment = new GasFrequencyExperiment();
    experiment.setConfiguration(new Configuration());
    experiment.runExperimentOnData(FidStoreUtils.calibrationScenario());
    return experiment;
  }

  @Test
  public void findsGasFrequencyOffset() {
    GasFrequencyExperiment experiment = runScenario();
    assertTrue(experiment.getFitResult().isConverged());
    assertEquals(FidStoreUtils.GAS_FREQUENCY, experiment.getFrequencyOffset(), 1E-2);
    assertEquals(FidStoreUtils.GAS_LINEWIDTH,
        experiment.getFitResult().getComponent(0).getLorentzianWidth(), 1E-2);
    // only the first acquisition is fit, so the amplitude is the undecayed one
    assertEquals(FidStoreUtils.GAS_AMPLITUDE,
        experiment.getFitResult().getComponent(0).getAmplitude(), 1E-7);
  }

  @Test
  public void usesFirstGasAcquisitionOnly() {
    GasFrequencyExperiment experiment = runScenario();
    assertEquals(1, experiment.getInputNames().size());
    assertEquals("Gas FID [0]", experiment.getInputNames().get(0));
  }

  @Test
  public void plotsObservedAndFitSpectra() {
    GasFrequencyExperiment experiment = runScenario();
    assertEquals(1, experiment.getData().size());
    XYSeriesCollection spectra = experiment.getData().get(0);
    assertEquals(2, spectra.getSeriesCount());
    // display spectrum is padded past the requested 10000 points
    assertEquals(16384, spectra.getSeries(0).getItemCount());
  }

  @Test
  public void annotationGivesOffsetInWholeHz() {
    GasFrequencyExperiment experiment = runScenario();
    assertTrue(experiment.getReportString().startsWith("Gas frequency offset: 50 Hz"));
  }

}
