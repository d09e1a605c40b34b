package com.civic.anomaly.service;

import com.civic.anomaly.config.MetricsConfig;
import com.civic.anomaly.exception.AnomalyNotFoundException;
import com.civic.anomaly.exception.InvalidTransitionException;
import com.civic.anomaly.model.Anomaly;
import com.civic.anomaly.model.AnomalyFilter;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.Finding;
import com.civic.anomaly.model.ResolutionStatus;
import com.civic.anomaly.repository.AnomalyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Anomaly store and investigation workflow.
 */
@Service
public class AnomalyService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyService.class);

    private final AnomalyRepository anomalyRepository;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyService(AnomalyRepository anomalyRepository, MetricsConfig metricsConfig, Clock clock) {
        this.anomalyRepository = anomalyRepository;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Store a finding as a new pending anomaly unless one is already pending for
     * the same (rule, entity). Safe to call concurrently for the same key.
     *
     * @return true if a new anomaly was created
     */
    public boolean upsertFinding(Finding finding) {
        DetectionRule rule = finding.rule();
        Anomaly anomaly = Anomaly.builder()
                .anomalyId(UUID.randomUUID().toString())
                .ruleId(rule.getRuleId())
                .ruleName(rule.getName())
                .category(rule.getCategory())
                .severity(rule.getSeverity())
                .entityType(finding.entityType())
                .entityId(finding.entityId())
                .anomalyScore(finding.score())
                .evidence(finding.evidence())
                .detectedAt(clock.millis())
                .status(ResolutionStatus.PENDING)
                .build();

        boolean created = anomalyRepository.insertIfNoneOpen(anomaly);
        if (created) {
            metricsConfig.recordAnomalyCreated(rule.getCategory().getValue(), rule.getSeverity().getValue());
            log.debug("Anomaly {} created: rule={}, {}={}, score={}",
                    anomaly.getAnomalyId(), rule.getName(), finding.entityType(), finding.entityId(), finding.score());
        } else {
            metricsConfig.recordDuplicateSkipped(rule.getCategory().getValue());
        }
        return created;
    }

    /**
     * Move an anomaly along its investigation lifecycle.
     *
     * @param notes    replaces the current notes when not null
     * @param operator who made the change, may be null
     */
    public Anomaly transition(String anomalyId, ResolutionStatus newStatus, String notes, String operator) {
        Anomaly current = anomalyRepository.findById(anomalyId);
        if (current == null) {
            throw new AnomalyNotFoundException(anomalyId);
        }
        if (!current.getStatus().canTransitionTo(newStatus)) {
            throw new InvalidTransitionException(anomalyId, current.getStatus(), newStatus);
        }

        Anomaly updated = current.toBuilder()
                .status(newStatus)
                .investigationNotes(notes != null ? notes : current.getInvestigationNotes())
                .investigatedBy(operator != null ? operator : current.getInvestigatedBy())
                .investigatedAt(clock.millis())
                .build();

        if (!anomalyRepository.updateIfStatus(updated, current.getStatus())) {
            Anomaly latest = anomalyRepository.findById(anomalyId);
            if (latest == null) {
                throw new AnomalyNotFoundException(anomalyId);
            }
            log.warn("Anomaly {} changed concurrently to {}, transition to {} rejected",
                    anomalyId, latest.getStatus(), newStatus);
            throw new InvalidTransitionException(anomalyId, latest.getStatus(), newStatus);
        }

        metricsConfig.recordTransition(newStatus.getValue());
        log.info("Anomaly {} moved {} -> {} by {}", anomalyId, current.getStatus(), newStatus, operator);
        return updated;
    }

    public Anomaly getAnomaly(String anomalyId) {
        return anomalyRepository.findById(anomalyId);
    }

    public List<Anomaly> query(AnomalyFilter filter) {
        return anomalyRepository.query(filter);
    }

    public int countPending() {
        return anomalyRepository.query(new AnomalyFilter(null, null, ResolutionStatus.PENDING,
                null, null, null, Integer.MAX_VALUE)).size();
    }
}
