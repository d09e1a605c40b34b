package com.civic.anomaly.repository;

import com.civic.anomaly.model.StatisticalBaseline;

import java.util.List;

public interface BaselineRepository {

    /** Replaces the baseline with the same (metric, entityType, period) key. */
    void upsert(StatisticalBaseline baseline);

    StatisticalBaseline find(String metricName, String entityType, String timePeriod);

    List<StatisticalBaseline> findAll();
}
