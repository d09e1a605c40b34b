package com.civic.anomaly.engine;

import com.civic.anomaly.model.Finding;
import com.civic.anomaly.model.RuleCategory;

import java.util.List;

/**
 * Interface for all category detectors.
 * Each implementation evaluates the active rules of one RuleCategory.
 */
public interface Detector {

    /**
     * The category this detector handles.
     */
    RuleCategory getSupportedCategory();

    /**
     * Evaluate every active rule of the supported category against the dataset.
     * Must not write to the dataset. Recoverable per-rule problems are recorded on
     * the context; anything thrown fails the whole category.
     *
     * @param context rules, baselines, dataset and clock of the running scan
     * @return candidate anomalies, in no particular order
     */
    List<Finding> detect(ScanContext context);
}
