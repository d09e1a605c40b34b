package com.civic.anomaly.repository;

import com.civic.anomaly.model.Anomaly;
import com.civic.anomaly.model.AnomalyFilter;
import com.civic.anomaly.model.ResolutionStatus;

import java.util.List;

/**
 * Anomaly storage. While an anomaly is pending, an open-key entry for its
 * (rule, entity type, entity id) triple guarantees no second pending anomaly is stored.
 */
public interface AnomalyRepository {

    /**
     * Stores the anomaly unless a pending anomaly already holds its open key. A key
     * still held by an anomaly that is missing or no longer pending is taken over.
     * @return true if stored, false if the key was already taken
     */
    boolean insertIfNoneOpen(Anomaly anomaly);

    Anomaly findById(String anomalyId);

    /**
     * Replaces the stored anomaly only if its current status is still {@code expected}.
     * Leaving pending releases the open key.
     * @return false if the anomaly is missing or its status changed concurrently
     */
    boolean updateIfStatus(Anomaly updated, ResolutionStatus expected);

    /** Matching anomalies, newest first, capped at the filter limit. */
    List<Anomaly> query(AnomalyFilter filter);
}
