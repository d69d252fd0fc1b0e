package de.anton.libs.analyser.libs_analyzer.model;

import de.anton.libs.analyser.libs_analyzer.service.FitConfiguration;
import de.anton.libs.analyser.libs_analyzer.service.IsolationConfiguration;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the state of one analysis session: spectra, region table, isolated regions, fit results
 * and calibration curves, plus the isolation and fit settings.
 * Every stage is derived from the previous ones, so replacing an upstream value clears everything below it.
 * Listeners are notified through {@link PropertyChangeSupport}.
 */
public class SpectraModel {
    private static final Logger logger = LoggerFactory.getLogger(SpectraModel.class);

    public static final String PROP_SPECTRA = "spectra";
    public static final String PROP_REGIONS = "regions";
    public static final String PROP_ISOLATED_REGIONS = "isolatedRegions";
    public static final String PROP_FIT_RESULTS = "fitResults";
    public static final String PROP_CALIBRATION_CURVES = "calibrationCurves";
    public static final String PROP_ISOLATION_CONFIGURATION = "isolationConfiguration";
    public static final String PROP_FIT_CONFIGURATION = "fitConfiguration";

    // Data
    private SpectrumSet spectra = null;
    private List<Region> regions = Collections.emptyList();
    private List<IsolatedRegion> isolatedRegions = Collections.emptyList();
    private FitResults fitResults = null;
    private List<CalibrationCurve> calibrationCurves = Collections.emptyList();

    // Settings
    private IsolationConfiguration isolationConfiguration = IsolationConfiguration.defaults();
    private FitConfiguration fitConfiguration = null;

    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    public SpectraModel() { logger.info("SpectraModel created."); }
    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }

    /** Replaces the spectra; isolated regions, fits and curves are cleared. The region table is kept. */
    public void setSpectra(SpectrumSet newSpectra) {
        SpectrumSet old = this.spectra;
        clearIsolatedRegions();
        this.spectra = newSpectra;
        if (newSpectra != null) { logger.info("Model: Spectra set: {}", newSpectra); }
        else { logger.info("Model: Spectra cleared."); }
        support.firePropertyChange(PROP_SPECTRA, old, newSpectra);
    }

    public void setRegions(List<Region> newRegions) {
        Objects.requireNonNull(newRegions, "Region list cannot be null.");
        List<Region> old = this.regions;
        clearIsolatedRegions();
        this.regions = Collections.unmodifiableList(new ArrayList<>(newRegions));
        logger.info("Model: Region table set with {} region(s).", newRegions.size());
        support.firePropertyChange(PROP_REGIONS, old, this.regions);
    }

    public void setIsolatedRegions(List<IsolatedRegion> newIsolated) {
        Objects.requireNonNull(newIsolated, "Isolated regions cannot be null.");
        List<IsolatedRegion> old = this.isolatedRegions;
        clearFitResults();
        this.isolatedRegions = Collections.unmodifiableList(new ArrayList<>(newIsolated));
        logger.debug("Model: {} isolated region(s) stored.", newIsolated.size());
        support.firePropertyChange(PROP_ISOLATED_REGIONS, old, this.isolatedRegions);
    }

    public void setFitResults(FitResults newResults) {
        FitResults old = this.fitResults;
        clearCalibrationCurves();
        this.fitResults = newResults;
        logger.debug("Model: Fit results stored: {}", newResults);
        support.firePropertyChange(PROP_FIT_RESULTS, old, newResults);
    }

    public void setCalibrationCurves(List<CalibrationCurve> newCurves) {
        Objects.requireNonNull(newCurves, "Calibration curves cannot be null.");
        List<CalibrationCurve> old = this.calibrationCurves;
        this.calibrationCurves = Collections.unmodifiableList(new ArrayList<>(newCurves));
        logger.debug("Model: {} calibration curve(s) stored.", newCurves.size());
        support.firePropertyChange(PROP_CALIBRATION_CURVES, old, this.calibrationCurves);
    }

    /** A changed baseline setting invalidates the isolated windows. */
    public void setIsolationConfiguration(IsolationConfiguration config) {
        IsolationConfiguration newConfig = config == null ? IsolationConfiguration.defaults() : config;
        if (!newConfig.equals(this.isolationConfiguration)) {
            IsolationConfiguration old = this.isolationConfiguration;
            this.isolationConfiguration = newConfig;
            logger.info("Model: Isolation configuration set: {}", newConfig);
            clearIsolatedRegions();
            support.firePropertyChange(PROP_ISOLATION_CONFIGURATION, old, newConfig);
        }
    }

    public void setFitConfiguration(FitConfiguration config) {
        if (!Objects.equals(config, this.fitConfiguration)) {
            FitConfiguration old = this.fitConfiguration;
            this.fitConfiguration = config;
            logger.info("Model: Fit configuration set: {}", config);
            clearFitResults();
            support.firePropertyChange(PROP_FIT_CONFIGURATION, old, config);
        }
    }

    // --- Getters ---
    public SpectrumSet getSpectra() { return spectra; }
    public List<Region> getRegions() { return regions; }
    public List<IsolatedRegion> getIsolatedRegions() { return isolatedRegions; }
    public FitResults getFitResults() { return fitResults; }
    public List<CalibrationCurve> getCalibrationCurves() { return calibrationCurves; }
    public IsolationConfiguration getIsolationConfiguration() { return isolationConfiguration; }
    public FitConfiguration getFitConfiguration() { return fitConfiguration; }
    public boolean isDataLoaded() { return spectra != null && spectra.getSampleCount() > 0; }
    public boolean isReadyForIsolation() { return isDataLoaded() && !regions.isEmpty(); }
    public boolean isReadyForFit() { return !isolatedRegions.isEmpty() && fitConfiguration != null; }
    public boolean isReadyForCalibration() { return fitResults != null && fitResults.isComplete(); }

    // --- Cascading clears ---
    private void clearIsolatedRegions() {
        clearFitResults();
        if (!isolatedRegions.isEmpty()) {
            List<IsolatedRegion> old = this.isolatedRegions;
            this.isolatedRegions = Collections.emptyList();
            logger.debug("Model: Isolated regions cleared.");
            support.firePropertyChange(PROP_ISOLATED_REGIONS, old, this.isolatedRegions);
        }
    }

    private void clearFitResults() {
        clearCalibrationCurves();
        if (fitResults != null) {
            FitResults old = this.fitResults;
            this.fitResults = null;
            logger.debug("Model: Fit results cleared.");
            support.firePropertyChange(PROP_FIT_RESULTS, old, null);
        }
    }

    private void clearCalibrationCurves() {
        if (!calibrationCurves.isEmpty()) {
            List<CalibrationCurve> old = this.calibrationCurves;
            this.calibrationCurves = Collections.emptyList();
            logger.debug("Model: Calibration curves cleared.");
            support.firePropertyChange(PROP_CALIBRATION_CURVES, old, this.calibrationCurves);
        }
    }
}
