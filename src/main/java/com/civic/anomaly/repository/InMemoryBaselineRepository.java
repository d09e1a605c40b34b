package com.civic.anomaly.repository;

import com.civic.anomaly.model.StatisticalBaseline;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "anomaly.storage", havingValue = "memory")
public class InMemoryBaselineRepository implements BaselineRepository {

    private final Map<String, StatisticalBaseline> storage = new ConcurrentHashMap<>();

    @Override
    public void upsert(StatisticalBaseline baseline) {
        storage.put(baseline.key(), baseline);
    }

    @Override
    public StatisticalBaseline find(String metricName, String entityType, String timePeriod) {
        return storage.get(StatisticalBaseline.key(metricName, entityType, timePeriod));
    }

    @Override
    public List<StatisticalBaseline> findAll() {
        return new ArrayList<>(storage.values());
    }
}
