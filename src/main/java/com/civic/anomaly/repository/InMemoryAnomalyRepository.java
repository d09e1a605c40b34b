package com.civic.anomaly.repository;

import com.civic.anomaly.model.Anomaly;
import com.civic.anomaly.model.AnomalyFilter;
import com.civic.anomaly.model.ResolutionStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Repository
@ConditionalOnProperty(name = "anomaly.storage", havingValue = "memory")
public class InMemoryAnomalyRepository implements AnomalyRepository {

    private final Map<String, Anomaly> storage = new ConcurrentHashMap<>();
    // open key -> anomalyId
    private final Map<String, String> openKeys = new ConcurrentHashMap<>();

    @Override
    public boolean insertIfNoneOpen(Anomaly anomaly) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        openKeys.compute(anomaly.openKey(), (key, heldId) -> {
            if (heldId != null && isPending(heldId)) return heldId;
            storage.put(anomaly.getAnomalyId(), anomaly.toBuilder().build());
            claimed.set(true);
            return anomaly.getAnomalyId();
        });
        return claimed.get();
    }

    private boolean isPending(String anomalyId) {
        Anomaly held = storage.get(anomalyId);
        return held != null && held.getStatus() == ResolutionStatus.PENDING;
    }

    @Override
    public Anomaly findById(String anomalyId) {
        Anomaly anomaly = storage.get(anomalyId);
        return anomaly != null ? anomaly.toBuilder().build() : null;
    }

    @Override
    public boolean updateIfStatus(Anomaly updated, ResolutionStatus expected) {
        AtomicBoolean applied = new AtomicBoolean(false);
        storage.computeIfPresent(updated.getAnomalyId(), (id, current) -> {
            if (current.getStatus() != expected) return current;
            applied.set(true);
            return updated.toBuilder().build();
        });
        if (applied.get() && expected == ResolutionStatus.PENDING && updated.getStatus() != ResolutionStatus.PENDING) {
            openKeys.remove(updated.openKey(), updated.getAnomalyId());
        }
        return applied.get();
    }

    @Override
    public List<Anomaly> query(AnomalyFilter filter) {
        return storage.values().stream()
                .filter(filter::matches)
                .sorted(Comparator.comparingLong(Anomaly::getDetectedAt).reversed())
                .limit(filter.effectiveLimit())
                .map(a -> a.toBuilder().build())
                .toList();
    }
}
