package com.company.pmm.scheduled;

import com.company.pmm.repository.FeedbackRepository;
import com.company.pmm.repository.InteractionRepository;
import com.company.pmm.repository.MetricSeriesRepository;
import com.company.pmm.repository.PerformanceSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Evicts expired entries from series that stopped receiving data. Active series
 * evict on append, so this only bounds memory for idle ones.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RetentionSweepJob {

    private final MetricSeriesRepository metricRepository;
    private final PerformanceSnapshotRepository snapshotRepository;
    private final InteractionRepository interactionRepository;
    private final FeedbackRepository feedbackRepository;

    @Scheduled(fixedDelayString = "${pmm.retention.sweep-interval-ms:600000}")
    public void sweep() {
        try {
            int points = metricRepository.evictExpired();
            int snapshots = snapshotRepository.evictExpired();
            int interactions = interactionRepository.evictExpired();
            int feedback = feedbackRepository.evictExpired();

            if (points + snapshots + interactions + feedback > 0) {
                log.info("Retention sweep evicted {} points, {} snapshots, {} interactions, {} feedback",
                        points, snapshots, interactions, feedback);
            }
        } catch (Exception e) {
            log.error("Retention sweep failed", e);
        }
    }
}
