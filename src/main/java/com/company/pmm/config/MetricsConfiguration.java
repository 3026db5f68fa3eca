package com.company.pmm.config;

import com.company.pmm.domain.enums.SignalStatus;
import com.company.pmm.repository.AlertRepository;
import com.company.pmm.repository.MetricSeriesRepository;
import com.company.pmm.repository.SignalRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final SignalRepository signalRepository;
    private final AlertRepository alertRepository;
    private final MetricSeriesRepository metricRepository;

    @Bean
    public MeterBinder monitoringGauges() {
        return (registry) -> {
            Gauge.builder("pmm.signals.active", signalRepository, repo -> repo.countByStatus(SignalStatus.ACTIVE))
                    .description("Signals awaiting acknowledgement")
                    .register(registry);

            Gauge.builder("pmm.alerts.active", alertRepository, AlertRepository::countOpen)
                    .description("Alerts not yet resolved")
                    .register(registry);

            Gauge.builder("pmm.metrics.tracked", metricRepository, MetricSeriesRepository::metricCount)
                    .description("Metric series held in memory")
                    .register(registry);

            log.info("Monitoring gauges registered");
        };
    }
}
