package com.company.pmm.repository;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.AiInteraction;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class InteractionRepository {

    private final TimeOrderedBuffer<AiInteraction> interactions;
    private final AtomicLong totalLogged = new AtomicLong();
    private final Clock clock;

    public InteractionRepository(MonitoringProperties properties, Clock clock) {
        this.clock = clock;
        this.interactions = new TimeOrderedBuffer<>(
                AiInteraction::getTimestamp,
                properties.getRetention().getInteractionWindow(),
                Integer.MAX_VALUE);
    }

    public AiInteraction save(AiInteraction interaction) {
        interactions.append(interaction, clock.instant());
        totalLogged.incrementAndGet();
        return interaction;
    }

    public long countSince(Instant since) {
        return interactions.between(since, clock.instant()).size();
    }

    /**
     * All interactions ever logged, including ones already past retention.
     */
    public long countTotal() {
        return totalLogged.get();
    }

    public int evictExpired() {
        return interactions.evictExpired(clock.instant());
    }
}
