package com.company.pmm.repository;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.UserFeedback;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class FeedbackRepository {

    private final TimeOrderedBuffer<UserFeedback> feedback;
    private final AtomicLong totalReceived = new AtomicLong();
    private final Clock clock;

    public FeedbackRepository(MonitoringProperties properties, Clock clock) {
        this.clock = clock;
        this.feedback = new TimeOrderedBuffer<>(
                UserFeedback::getTimestamp,
                properties.getRetention().getInteractionWindow(),
                Integer.MAX_VALUE);
    }

    public UserFeedback save(UserFeedback entry) {
        feedback.append(entry, clock.instant());
        totalReceived.incrementAndGet();
        return entry;
    }

    public List<UserFeedback> findSince(Instant since) {
        return feedback.between(since, clock.instant());
    }

    public long countTotal() {
        return totalReceived.get();
    }

    public int evictExpired() {
        return feedback.evictExpired(clock.instant());
    }
}
