package com.company.pmm.config;

import com.company.pmm.domain.MetricBand;
import com.company.pmm.domain.enums.SlaDimension;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static monitoring configuration. Loaded once at startup, read-only afterwards.
 */
@Data
@ConfigurationProperties(prefix = "pmm")
public class MonitoringProperties {

    private Retention retention = new Retention();

    /**
     * Metric name -> band. Metrics without a band are recorded but never alert.
     */
    private Map<String, MetricBand> bands = new LinkedHashMap<>();

    private Detection detection = new Detection();
    private Alerts alerts = new Alerts();
    private Sla sla = new Sla();

    public Optional<MetricBand> bandFor(String metricName) {
        return Optional.ofNullable(bands.get(metricName));
    }

    @Data
    public static class Retention {
        private Duration metricWindow = Duration.ofDays(7);
        private int maxPointsPerSeries = 10_000;
        private Duration performanceWindow = Duration.ofDays(7);
        private int maxSnapshots = 10_000;
        private Duration interactionWindow = Duration.ofDays(30);
    }

    @Data
    public static class Detection {
        private double anomalyZThreshold = 2.0;
        private double highSeverityZThreshold = 3.0;
        private double trendChangeThreshold = 0.15;
        private int minDeclineRun = 4;
        private Duration window = Duration.ofHours(24);
        private int maxPoints = 50;
        private boolean synchronous = false;
        private boolean suppressDuplicates = true;
    }

    @Data
    public static class Alerts {
        private boolean deduplicate = true;
    }

    @Data
    public static class Sla {
        private double responseTimeAvgMs = 200;
        private double responseTimeP95Ms = 500;
        private double availabilityPct = 99.9;
        private double errorRatePct = 1.0;
        private double throughputRps = 100;
        private Duration defaultPeriod = Duration.ofHours(24);

        public double targetFor(SlaDimension dimension) {
            switch (dimension) {
                case RESPONSE_TIME_AVG:
                    return responseTimeAvgMs;
                case RESPONSE_TIME_P95:
                    return responseTimeP95Ms;
                case AVAILABILITY:
                    return availabilityPct;
                case ERROR_RATE:
                    return errorRatePct;
                case THROUGHPUT:
                    return throughputRps;
                default:
                    throw new IllegalArgumentException("Unknown SLA dimension: " + dimension);
            }
        }
    }
}
