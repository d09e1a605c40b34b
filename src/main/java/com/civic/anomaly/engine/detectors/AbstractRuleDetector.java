package com.civic.anomaly.engine.detectors;

import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.dataset.ActivityEvent;
import com.civic.anomaly.engine.Detector;
import com.civic.anomaly.engine.ScanContext;
import com.civic.anomaly.exception.DatasetAccessException;
import com.civic.anomaly.exception.DetectionException;
import com.civic.anomaly.exception.RuleConfigurationException;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates each active rule of the category on its own. A rule that cannot read
 * its data or is misconfigured is recorded as an issue on the scan and the
 * remaining rules still run. Within a rule, an entity that cannot be evaluated
 * is skipped the same way.
 */
public abstract class AbstractRuleDetector implements Detector {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final AnomalyEngineConfig.Defaults defaults;

    protected AbstractRuleDetector(AnomalyEngineConfig config) {
        this.defaults = config.getDefaults();
    }

    @Override
    public List<Finding> detect(ScanContext context) {
        List<Finding> findings = new ArrayList<>();
        for (DetectionRule rule : context.rulesFor(getSupportedCategory())) {
            if (Thread.currentThread().isInterrupted()) {
                throw new DetectionException("Detector interrupted before rule " + rule.getName());
            }
            try {
                List<Finding> ruleFindings = evaluate(rule, context);
                log.debug("Rule {} produced {} findings", rule.getName(), ruleFindings.size());
                findings.addAll(ruleFindings);
            } catch (DatasetAccessException | RuleConfigurationException | DetectionException e) {
                log.warn("Rule {} skipped in scan {}: {}", rule.getName(), context.getScanId(), e.getMessage());
                context.recordIssue(getSupportedCategory(), rule.getName() + ": " + e.getMessage());
            }
        }
        return findings;
    }

    /**
     * Evaluate one rule.
     */
    protected abstract List<Finding> evaluate(DetectionRule rule, ScanContext context);

    /**
     * Runs the evaluation of one entity. A failure is logged and recorded as an issue,
     * the entity is skipped and the rule carries on with the next one.
     */
    protected void evaluateEntity(DetectionRule rule, ScanContext context, String entityId, Runnable evaluation) {
        try {
            if (entityId == null) {
                throw new DetectionException("record has no entity id");
            }
            evaluation.run();
        } catch (DetectionException e) {
            skipEntity(rule, context, entityId, e);
        } catch (RuntimeException e) {
            skipEntity(rule, context, entityId,
                    new DetectionException(e.getClass().getSimpleName() + ": " + e.getMessage(), e));
        }
    }

    /**
     * False, with the event recorded as skipped, when it lacks the ids the rule groups by.
     */
    protected boolean isComplete(ActivityEvent event, boolean needsTarget, DetectionRule rule, ScanContext context) {
        if (event.actorId() != null && (!needsTarget || event.targetId() != null)) {
            return true;
        }
        String missing = event.actorId() == null ? "actor" : "target";
        skipEntity(rule, context, event.eventId(), new DetectionException("event has no " + missing + " id"));
        return false;
    }

    private void skipEntity(DetectionRule rule, ScanContext context, String entityId, DetectionException e) {
        log.warn("Rule {} skipped entity {} in scan {}: {}", rule.getName(), entityId, context.getScanId(), e.getMessage());
        context.recordIssue(getSupportedCategory(), rule.getName() + "/" + entityId + ": " + e.getMessage());
    }

    protected String requireParam(DetectionRule rule, String key) {
        String value = rule.getParam(key);
        if (value == null) {
            throw new RuleConfigurationException("Rule " + rule.getName() + " is missing param '" + key + "'");
        }
        return value;
    }

    protected int intParam(DetectionRule rule, String key, int defaultValue) {
        return (int) rule.getParamAsLong(key, defaultValue);
    }

    protected static boolean matchesEventType(String eventType, String filter) {
        return filter == null || filter.equalsIgnoreCase(eventType);
    }
}
