package xe.calibration.experiment;

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import org.jfree.data.xy.XYSeriesCollection;
import xe.calibration.exceptions.InvalidParameterException;
import xe.calibration.input.Configuration;
import xe.calibration.input.FidStore;
import xe.calibration.utils.NumericUtils;

/**
 * This class defines template patterns for each step of the xenon calibration.
 * Concrete extensions of this class are used to define a backend for the calculations
 * of the step, and produce plottable series and annotation text for whatever presentation
 * layer consumes them.
 *
 * Experiments work in a manner similar to builder patterns: set the configuration to use first
 * (by default the shared {@link Configuration#getInstance()} is used), and then call
 * "runExperimentOnData" with a FidStore containing the calibration FIDs.
 *
 * Results beyond the plottable data (fitted parameters, derived values) are read from getters
 * on the concrete experiments. These should not be called unless the experiment has already been
 * run, as they will otherwise not be populated with valid results.
 */
public abstract class Experiment {

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.###");
        NumericUtils.setInfinityPrintable(format);
        return format;
      });

  private final EventListenerList eventHelper;
  Configuration configuration;
  List<XYSeriesCollection> xySeriesData;
  /**
   * Names of the FIDs used by the experiment, in the order they were read
   */
  List<String> dataNames;
  private String status;

  /**
   * Initialize all fields common to experiment objects
   */
  Experiment() {
    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();
    status = "";
    eventHelper = new EventListenerList();
    configuration = Configuration.getInstance();
  }

  /**
   * Stub method to be overridden for other methods to produce String data for experiment result.
   * Includes formatting of numeric data.
   * @return String containing human-readable data
   */
  String[] getDataStrings() {
    return new String[]{""};
  }

  /**
   * Stub method to be overridden for other methods to produce String data for plot data.
   * This may not be used for all plots.
   * @return String containing human-readable data
   */
  public String[] getInsetStrings() {
    return getDataStrings();
  }

  /**
   * Produce the text of all the experiment's results, one result per line
   * @return String containing human-readable data
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    String[] strings = getDataStrings();
    for (int i = 0; i < strings.length; ++i) {
      sb.append(strings[i]);
      if (i + 1 < strings.length) {
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  /**
   * Add an object to the list of objects to be notified when the experiment's
   * status changes
   *
   * @param listener ChangeListener to be notified
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  /**
   * Abstract function that runs the calculations specific to a given procedure,
   * overwritten by concrete experiments with specific operations.
   *
   * @param fidStore Object containing the FIDs to process
   */
  protected abstract void backend(final FidStore fidStore);

  /**
   * Update processing status and notify listeners of change
   *
   * @param newStatus Status change message to notify listeners of
   */
  void fireStateChange(String newStatus) {
    status = newStatus;
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  public Configuration getConfiguration() {
    return configuration;
  }

  /**
   * Set the protocol and solver configuration to run with
   *
   * @param configuration Configuration to use on the next run
   */
  public void setConfiguration(Configuration configuration) {
    if (configuration == null) {
      throw new InvalidParameterException("configuration must be given");
    }
    this.configuration = configuration;
  }

  /**
   * Return the plottable data for this experiment, populated in the backend
   * function of an implementing class.
   * The results are returned as a list, where each list is the data to be
   * placed into a separate chart.
   *
   * @return Plottable data
   */
  public List<XYSeriesCollection> getData() {
    return xySeriesData;
  }

  /**
   * Get the names of data sent into the experiment (set during backend calculations)
   *
   * @return Names of the FIDs used
   */
  public List<String> getInputNames() {
    return dataNames;
  }

  /**
   * Return newest status message produced by this experiment
   *
   * @return String representing status of the experiment
   */
  public String getStatus() {
    return status;
  }

  /**
   * Used to check if the current input has enough data to do the calculation
   * (i.e., the flip angle fit needs at least three gas acquisitions).
   *
   * @param fidStore FidStore to be fed into experiment calculation
   * @return True if there is enough data to be run
   */
  public abstract boolean hasEnoughData(final FidStore fidStore);

  /**
   * Driver to do data processing on inputted data (calls a concrete backend
   * method which is different for each type of experiment).
   * The configuration and the amount of data are checked here, before any fitting is done.
   *
   * @param fidStore FIDs to be processed
   */
  public void runExperimentOnData(final FidStore fidStore) {

    fireStateChange("Checking configuration and data...");

    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();

    configuration.validate();
    if (fidStore == null || !hasEnoughData(fidStore)) {
      throw new InvalidParameterException("not enough data for " + getClass().getSimpleName());
    }

    fireStateChange("Beginning calculations...");

    backend(fidStore);

    fireStateChange("Calculations done!");
  }
}
