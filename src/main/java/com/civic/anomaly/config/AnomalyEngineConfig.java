package com.civic.anomaly.config;

import com.civic.anomaly.model.AlertKpi;
import com.civic.anomaly.model.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyEngineConfig {

    // "aerospike" or "memory"
    private String storage = "aerospike";

    // Seed the default rule catalogue at startup, skipping names that already exist.
    private boolean seedRules = true;

    private Scan scan = new Scan();

    private Baseline baseline = new Baseline();

    private Dataset dataset = new Dataset();

    // Fallbacks when a rule does not set the corresponding param.
    private Defaults defaults = new Defaults();

    private Alerting alerting = new Alerting();

    @Data
    public static class Scan {
        // Spring cron expression, "-" disables the scheduled scan
        private String cron = "0 0 2 * * *";
        // Zone for the cron schedule and hour-of-day bucketing
        private String zone = "UTC";
        private int parallelism = 4;
        private Duration detectorTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Baseline {
        private int lookbackDays = 90;
        // Baseline window ends where the detection window starts
        private boolean excludeDetectionWindow = true;
        private Duration metricTimeout = Duration.ofMinutes(1);
    }

    @Data
    public static class Dataset {
        private int queryTimeoutMs = 30000;
    }

    @Data
    public static class Defaults {
        private int detectionDays = 7;
        private int behaviorWindowDays = 30;
        private int hourlyWindowDays = 30;
        private int sequenceWindowDays = 7;
        private int relationshipWindowDays = 90;
        private double iqrMultiplier = 1.5;
        private long maxGapSeconds = 60;
        private int unusualStartHour = 0;
        private int unusualEndHour = 6;
        private int sharedContactMinMembers = 3;
        private double maxPairValue = 10000.0;
    }

    @Data
    public static class Alerting {
        private int windowDays = 7;
        private List<AlertThreshold> thresholds = new ArrayList<>();
    }

    @Data
    public static class AlertThreshold {
        private String name;
        private AlertKpi kpi = AlertKpi.TOTAL;
        private long limit;
        private Severity severity = Severity.HIGH;
    }
}
