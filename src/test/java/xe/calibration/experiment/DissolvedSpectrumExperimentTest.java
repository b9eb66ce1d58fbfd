package xe.calibration.experiment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.apache.commons.math3.complex.Complex;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.junit.Test;
import xe.calibration.fitting.SpectralComponent;
import xe.calibration.input.Configuration;
import xe.calibration.input.FidStore;
import xe.calibration.input.FidStoreUtils;
import xe.calibration.input.FieldStrength;
import xe.calibration.utils.FFTResult;

public class DissolvedSpectrumExperimentTest {

  private static DissolvedSpectrumExperiment runScenario() {
    DissolvedSpectrumExperiment experiment = new DissolvedSpectrumExperiment();
    experiment.setConfiguration(new Configuration(FieldStrength.THREE_TESLA));
    experiment.runExperimentOnData(FidStoreUtils.calibrationScenario());
    return experiment;
  }

  private static void assertComponentEquals(SpectralComponent expected,
      SpectralComponent actual) {
    assertEquals(expected.getAmplitude(), actual.getAmplitude(), 1E-4);
    assertEquals(expected.getFrequency(), actual.getFrequency(), 1E-2);
    assertEquals(expected.getLorentzianWidth(), actual.getLorentzianWidth(), 1E-1);
    assertEquals(expected.getGaussianWidth(), actual.getGaussianWidth(), 1E-1);
    assertEquals(expected.getPhase(), actual.getPhase(), 1E-2);
  }

  @Test
  public void recoversComponentsInGuessOrder() {
    DissolvedSpectrumExperiment experiment = runScenario();
    assertTrue(experiment.getFitResult().isConverged());
    assertComponentEquals(FidStoreUtils.RBC, experiment.getRbc());
    assertComponentEquals(FidStoreUtils.TISSUE_PLASMA, experiment.getTissuePlasma());
    assertComponentEquals(FidStoreUtils.DISSOLVED_GAS, experiment.getGas());
  }

  @Test
  public void fitsTheAveragedDissolvedFid() {
    DissolvedSpectrumExperiment experiment = runScenario();
    assertEquals(FidStore.DISSOLVED_AVERAGE_NAME, experiment.getInputNames().get(0));
    assertEquals(FidStoreUtils.SAMPLES,
        experiment.getFitResult().getProblem().getObserved().size());
    // no padding past the native length
    assertEquals(FidStoreUtils.SAMPLES, experiment.getFitResult().getProblem().getZeroPadSize());
  }

  @Test
  public void onlyTissuePlasmaIsVoigt() {
    DissolvedSpectrumExperiment experiment = runScenario();
    assertFalse(experiment.getRbc().isVoigt());
    assertTrue(experiment.getTissuePlasma().isVoigt());
    assertFalse(experiment.getGas().isVoigt());
  }

  @Test
  public void plotsSpectrumFitAndComponentsInWindow() {
    DissolvedSpectrumExperiment experiment = runScenario();
    XYSeriesCollection spectra = experiment.getData().get(0);
    assertEquals(5, spectra.getSeriesCount());
    for (int i = 0; i < spectra.getSeriesCount(); ++i) {
      XYSeries series = spectra.getSeries(i);
      assertTrue(series.getItemCount() > 0);
      assertTrue(series.getMinX() >= DissolvedSpectrumExperiment.PLOT_LOW_FREQUENCY);
      assertTrue(series.getMaxX() <= DissolvedSpectrumExperiment.PLOT_HIGH_FREQUENCY);
    }
  }

  @Test
  public void fitOverlayIsSumOfComponentSpectra() {
    DissolvedSpectrumExperiment experiment = runScenario();
    List<FFTResult> components = experiment.getFitResult().getComponentSpectra();
    FFTResult summed = FFTResult.sum(components.toArray(new FFTResult[0]));

    // transform is linear, so the summed components match the full model spectrum
    Complex[] model = experiment.getFitResult().getModelSpectrum().getFFT();
    Complex[] total = summed.getFFT();
    assertEquals(model.length, total.length);
    for (int i = 0; i < model.length; ++i) {
      assertEquals(model[i].getReal(), total[i].getReal(), 1E-9);
      assertEquals(model[i].getImaginary(), total[i].getImaginary(), 1E-9);
    }

    XYSeries plotted = experiment.getData().get(0).getSeries(1);
    XYSeries expected = summed.magnitudeSeries("Expected",
        DissolvedSpectrumExperiment.PLOT_LOW_FREQUENCY,
        DissolvedSpectrumExperiment.PLOT_HIGH_FREQUENCY);
    assertEquals("Dissolved fit", plotted.getKey());
    assertEquals(expected.getItemCount(), plotted.getItemCount());
    for (int i = 0; i < plotted.getItemCount(); ++i) {
      assertEquals(expected.getX(i).doubleValue(), plotted.getX(i).doubleValue(), 0.);
      assertEquals(expected.getY(i).doubleValue(), plotted.getY(i).doubleValue(), 0.);
    }
  }

  @Test
  public void guessesFollowFieldStrength() {
    List<SpectralComponent> guesses = DissolvedSpectrumExperiment.buildGuesses(
        FieldStrength.ONE_POINT_FIVE_TESLA.getDissolvedFrequencyGuesses());
    assertEquals(3, guesses.size());
    assertEquals(0., guesses.get(0).getFrequency(), 0.);
    assertEquals(-350., guesses.get(1).getFrequency(), 0.);
    assertEquals(-3700., guesses.get(2).getFrequency(), 0.);
    assertEquals(250., guesses.get(0).getLorentzianWidth(), 0.);
    assertEquals(200., guesses.get(1).getGaussianWidth(), 0.);
    assertEquals(30., guesses.get(2).getLorentzianWidth(), 0.);
    for (SpectralComponent guess : guesses) {
      assertEquals(1., guess.getAmplitude(), 0.);
      assertEquals(0., guess.getPhase(), 0.);
    }
  }

  @Test
  public void annotationListsEachComponent() {
    String report = runScenario().getReportString();
    assertTrue(report.contains("RBC: amplitude"));
    assertTrue(report.contains("Tissue/plasma: amplitude"));
    assertTrue(report.contains("Gas: amplitude"));
  }

}
