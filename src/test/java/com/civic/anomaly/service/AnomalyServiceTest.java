package com.civic.anomaly.service;

import com.civic.anomaly.config.MetricsConfig;
import com.civic.anomaly.exception.AnomalyNotFoundException;
import com.civic.anomaly.exception.InvalidTransitionException;
import com.civic.anomaly.model.Anomaly;
import com.civic.anomaly.model.AnomalyFilter;
import com.civic.anomaly.model.DetectionMethod;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.ResolutionStatus;
import com.civic.anomaly.repository.InMemoryAnomalyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.civic.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AnomalyServiceTest {

    @Mock private MetricsConfig metricsConfig;

    private final DetectionRule rule = createRule("frequent", DetectionMethod.ACTION_COUNT, 3, "entityType", "citizen");

    private InMemoryAnomalyRepository repository;
    private AnomalyService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAnomalyRepository();
        service = new AnomalyService(repository, metricsConfig, Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    @Test
    void upsertFinding_createsPendingAnomaly() {
        assertThat(service.upsertFinding(createFinding(rule, "C-1", 4))).isTrue();

        List<Anomaly> stored = service.query(AnomalyFilter.all());
        assertThat(stored).hasSize(1);
        Anomaly anomaly = stored.get(0);
        assertThat(anomaly.getStatus()).isEqualTo(ResolutionStatus.PENDING);
        assertThat(anomaly.getRuleName()).isEqualTo("frequent");
        assertThat(anomaly.getSeverity()).isEqualTo(rule.getSeverity());
        assertThat(anomaly.getAnomalyScore()).isEqualTo(4.0);
        assertThat(anomaly.getDetectedAt()).isEqualTo(NOW);
        assertThat(anomaly.getInvestigatedAt()).isNull();
        verify(metricsConfig).recordAnomalyCreated("behavioral", "medium");
    }

    @Test
    void upsertFinding_samePendingKey_isSkipped() {
        assertThat(service.upsertFinding(createFinding(rule, "C-1", 4))).isTrue();
        assertThat(service.upsertFinding(createFinding(rule, "C-1", 9))).isFalse();
        assertThat(service.upsertFinding(createFinding(rule, "C-2", 4))).isTrue();

        assertThat(service.query(AnomalyFilter.all())).hasSize(2);
        assertThat(service.countPending()).isEqualTo(2);
    }

    @Test
    void upsertFinding_afterClosure_createsNewAnomaly() {
        service.upsertFinding(createFinding(rule, "C-1", 4));
        Anomaly first = service.query(AnomalyFilter.all()).get(0);
        service.transition(first.getAnomalyId(), ResolutionStatus.FALSE_POSITIVE, "expected seasonal peak", "analyst-1");

        assertThat(service.upsertFinding(createFinding(rule, "C-1", 4))).isTrue();
        assertThat(service.query(AnomalyFilter.all())).hasSize(2);
        assertThat(service.countPending()).isEqualTo(1);
    }

    @Test
    void upsertFinding_concurrentCallers_createExactlyOne() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return service.upsertFinding(createFinding(rule, "C-1", 4));
                }));
            }
            start.countDown();

            int created = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) created++;
            }
            assertThat(created).isEqualTo(1);
            assertThat(service.query(AnomalyFilter.all())).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void transition_followsLifecycle() {
        service.upsertFinding(createFinding(rule, "C-1", 4));
        String id = service.query(AnomalyFilter.all()).get(0).getAnomalyId();

        Anomaly confirmed = service.transition(id, ResolutionStatus.CONFIRMED, "duplicate applications", "analyst-1");
        assertThat(confirmed.getStatus()).isEqualTo(ResolutionStatus.CONFIRMED);
        assertThat(confirmed.getInvestigatedAt()).isEqualTo(NOW);
        assertThat(confirmed.getInvestigatedBy()).isEqualTo("analyst-1");

        Anomaly resolved = service.transition(id, ResolutionStatus.RESOLVED, null, "analyst-2");
        assertThat(resolved.getStatus()).isEqualTo(ResolutionStatus.RESOLVED);
        assertThat(resolved.getInvestigationNotes()).isEqualTo("duplicate applications");
        assertThat(service.getAnomaly(id).getInvestigatedBy()).isEqualTo("analyst-2");
    }

    @Test
    void transition_outOfTerminalState_rejected() {
        service.upsertFinding(createFinding(rule, "C-1", 4));
        String id = service.query(AnomalyFilter.all()).get(0).getAnomalyId();
        service.transition(id, ResolutionStatus.FALSE_POSITIVE, null, "analyst-1");

        assertThatThrownBy(() -> service.transition(id, ResolutionStatus.CONFIRMED, null, "analyst-1"))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> service.transition(id, ResolutionStatus.PENDING, null, "analyst-1"))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(service.getAnomaly(id).getStatus()).isEqualTo(ResolutionStatus.FALSE_POSITIVE);
    }

    @Test
    void transition_pendingStraightToResolved_rejected() {
        service.upsertFinding(createFinding(rule, "C-1", 4));
        String id = service.query(AnomalyFilter.all()).get(0).getAnomalyId();

        assertThatThrownBy(() -> service.transition(id, ResolutionStatus.RESOLVED, null, null))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void transition_unknownAnomaly_throwsNotFound() {
        assertThatThrownBy(() -> service.transition("missing", ResolutionStatus.CONFIRMED, null, null))
                .isInstanceOf(AnomalyNotFoundException.class);
    }
}
