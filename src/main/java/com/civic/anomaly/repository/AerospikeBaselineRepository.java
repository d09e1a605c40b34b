package com.civic.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.civic.anomaly.config.AerospikeConfig;
import com.civic.anomaly.exception.AnomalyPersistenceException;
import com.civic.anomaly.model.StatisticalBaseline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
@ConditionalOnProperty(name = "anomaly.storage", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeBaselineRepository implements BaselineRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeBaselineRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeBaselineRepository(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                       @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public void upsert(StatisticalBaseline baseline) {
        Key key = new Key(namespace, AerospikeConfig.SET_BASELINES, baseline.key());
        try {
            client.put(writePolicy, key,
                    new Bin("metricName", baseline.getMetricName()),
                    new Bin("entityType", baseline.getEntityType()),
                    new Bin("timePeriod", baseline.getTimePeriod()),
                    new Bin("mean", baseline.getMean()),
                    new Bin("stddev", baseline.getStddev()),
                    new Bin("median", baseline.getMedian()),
                    new Bin("q1", baseline.getQ1()),
                    new Bin("q3", baseline.getQ3()),
                    new Bin("sampleSize", baseline.getSampleSize()),
                    new Bin("calculatedAt", baseline.getCalculatedAt()));
        } catch (AerospikeException e) {
            throw new AnomalyPersistenceException("Failed to store baseline " + baseline.key(), e);
        }
    }

    @Override
    public StatisticalBaseline find(String metricName, String entityType, String timePeriod) {
        Key key = new Key(namespace, AerospikeConfig.SET_BASELINES,
                StatisticalBaseline.key(metricName, entityType, timePeriod));
        try {
            Record record = client.get(readPolicy, key);
            return record != null ? mapRecord(record) : null;
        } catch (AerospikeException e) {
            throw new AnomalyPersistenceException("Failed to read baseline for " + metricName, e);
        }
    }

    @Override
    public List<StatisticalBaseline> findAll() {
        List<StatisticalBaseline> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_BASELINES,
                    (key, record) -> {
                        try {
                            StatisticalBaseline baseline = mapRecord(record);
                            synchronized (results) {
                                results.add(baseline);
                            }
                        } catch (Exception e) {
                            log.warn("Failed to read baseline record: {}", e.getMessage());
                        }
                    });
        } catch (AerospikeException e) {
            throw new AnomalyPersistenceException("Failed to scan baselines", e);
        }
        return results;
    }

    private StatisticalBaseline mapRecord(Record record) {
        return StatisticalBaseline.builder()
                .metricName(record.getString("metricName"))
                .entityType(record.getString("entityType"))
                .timePeriod(record.getString("timePeriod"))
                .mean(record.getDouble("mean"))
                .stddev(record.getDouble("stddev"))
                .median(record.getDouble("median"))
                .q1(record.getDouble("q1"))
                .q3(record.getDouble("q3"))
                .sampleSize(record.getLong("sampleSize"))
                .calculatedAt(record.getLong("calculatedAt"))
                .build();
    }
}
