package com.company.pmm.service;

import com.company.pmm.domain.Complaint;
import com.company.pmm.domain.ComplaintUpdate;
import com.company.pmm.domain.ComplaintUpdate.FieldChange;
import com.company.pmm.domain.enums.ComplaintPriority;
import com.company.pmm.domain.enums.ComplaintStatus;
import com.company.pmm.dto.request.ComplaintRequest;
import com.company.pmm.dto.request.ComplaintUpdateRequest;
import com.company.pmm.dto.response.ComplaintAnalytics;
import com.company.pmm.exception.ComplaintNotFoundException;
import com.company.pmm.repository.ComplaintRepository;
import com.company.pmm.util.IdGenerator;
import com.company.pmm.util.SeriesStatistics;
import com.company.pmm.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
public class ComplaintService {

    private final ComplaintRepository complaintRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final IdGenerator idGenerator = new IdGenerator("CMP", "yyyyMMdd");

    public ComplaintService(ComplaintRepository complaintRepository, MeterRegistry meterRegistry, Clock clock) {
        this.complaintRepository = complaintRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public Complaint create(ComplaintRequest request) {
        Instant now = clock.instant();
        Complaint complaint = Complaint.builder()
                .complaintId(idGenerator.next(now))
                .createdAt(now)
                .userId(request.getUserId())
                .category(request.getCategory())
                .subject(request.getSubject())
                .description(request.getDescription())
                .priority(ComplaintPriority.fromValue(request.getPriority()))
                .relatedInteractionId(request.getRelatedInteractionId())
                .tags(request.getTags() != null ? Collections.unmodifiableList(new ArrayList<>(request.getTags())) : List.of())
                .build();

        complaintRepository.save(complaint);
        log.info("Complaint {} created ({}, priority {})",
                complaint.getComplaintId(), complaint.getCategory(), complaint.getPriority().getValue());
        meterRegistry.counter("pmm.complaints.created", "priority", complaint.getPriority().getValue()).increment();
        return complaint;
    }

    public Complaint get(String complaintId) {
        return complaintRepository.findById(complaintId)
                .orElseThrow(() -> new ComplaintNotFoundException(complaintId));
    }

    /**
     * Complaints matching the optional filters, oldest first.
     *
     * @param days only complaints created in the last {@code days} days; null for all
     */
    public List<Complaint> list(ComplaintStatus status, ComplaintPriority priority, Integer days) {
        Instant since = days != null ? clock.instant().minus(TimeUtils.days(days)) : Instant.MIN;
        return complaintRepository.find(c -> (status == null || c.getStatus() == status)
                && (priority == null || c.getPriority() == priority)
                && !c.getCreatedAt().isBefore(since));
    }

    /**
     * Applies the changed fields and appends an audit entry. A request that changes
     * nothing leaves the complaint and its trail untouched.
     */
    public Complaint update(String complaintId, ComplaintUpdateRequest request) {
        ComplaintStatus newStatus = request.getStatus() != null ? ComplaintStatus.fromValue(request.getStatus()) : null;
        ComplaintPriority newPriority = request.getPriority() != null ? ComplaintPriority.fromValue(request.getPriority()) : null;
        Instant now = clock.instant();

        Complaint updated = complaintRepository.update(complaintId, current -> {
            Map<String, FieldChange> changes = new LinkedHashMap<>();
            Complaint.ComplaintBuilder next = current.toBuilder();

            if (newStatus != null && newStatus != current.getStatus()) {
                changes.put("status", new FieldChange(current.getStatus().getValue(), newStatus.getValue()));
                next.status(newStatus);
                if (newStatus.isTerminal() && !current.getStatus().isTerminal()) {
                    next.resolvedAt(now);
                } else if (!newStatus.isTerminal()) {
                    next.resolvedAt(null);
                }
            }
            if (newPriority != null && newPriority != current.getPriority()) {
                changes.put("priority", new FieldChange(current.getPriority().getValue(), newPriority.getValue()));
                next.priority(newPriority);
            }
            if (request.getAssignedTo() != null && !request.getAssignedTo().equals(current.getAssignedTo())) {
                changes.put("assigned_to", new FieldChange(current.getAssignedTo(), request.getAssignedTo()));
                next.assignedTo(request.getAssignedTo());
            }
            if (request.getResolution() != null && !request.getResolution().equals(current.getResolution())) {
                changes.put("resolution", new FieldChange(current.getResolution(), request.getResolution()));
                next.resolution(request.getResolution());
            }

            if (changes.isEmpty()) {
                return current;
            }

            List<ComplaintUpdate> trail = new ArrayList<>(current.getUpdates());
            trail.add(ComplaintUpdate.builder()
                    .timestamp(now)
                    .updatedBy(request.getUpdatedBy())
                    .changes(Collections.unmodifiableMap(changes))
                    .build());
            return next.updates(Collections.unmodifiableList(trail)).build();
        }).orElseThrow(() -> new ComplaintNotFoundException(complaintId));

        log.info("Complaint {} updated: status={}, priority={}",
                complaintId, updated.getStatus().getValue(), updated.getPriority().getValue());
        return updated;
    }

    public ComplaintAnalytics analytics(int days) {
        Instant now = clock.instant();
        Instant start = now.minus(TimeUtils.days(days));

        List<Complaint> all = complaintRepository.findAll();
        List<Complaint> inPeriod = all.stream()
                .filter(c -> !c.getCreatedAt().isBefore(start))
                .collect(Collectors.toList());

        List<Double> resolutionHours = all.stream()
                .filter(c -> TimeUtils.within(c.getResolvedAt(), start, now))
                .map(c -> TimeUtils.hoursBetween(c.getCreatedAt(), c.getResolvedAt()))
                .collect(Collectors.toList());

        return ComplaintAnalytics.builder()
                .periodDays(days)
                .total(inPeriod.size())
                .byStatus(countBy(inPeriod, c -> c.getStatus().getValue()))
                .byPriority(countBy(inPeriod, c -> c.getPriority().getValue()))
                .byCategory(countBy(inPeriod, Complaint::getCategory))
                .resolutionStats(resolutionStats(resolutionHours))
                .openCount(inPeriod.stream().filter(Complaint::isOpen).count())
                .build();
    }

    public long countOpen() {
        return complaintRepository.find(Complaint::isOpen).size();
    }

    private static ComplaintAnalytics.ResolutionStats resolutionStats(List<Double> hours) {
        if (hours.isEmpty()) {
            return ComplaintAnalytics.ResolutionStats.builder().resolvedCount(0).build();
        }
        double[] values = hours.stream().mapToDouble(Double::doubleValue).toArray();
        double avg = SeriesStatistics.mean(values);
        return ComplaintAnalytics.ResolutionStats.builder()
                .resolvedCount(values.length)
                .avgResolutionHours(SeriesStatistics.round(avg, 2))
                .minResolutionHours(SeriesStatistics.round(SeriesStatistics.min(values), 2))
                .maxResolutionHours(SeriesStatistics.round(SeriesStatistics.max(values), 2))
                .avgResolutionTime(TimeUtils.formatDuration(Math.round(avg * 3_600_000)))
                .build();
    }

    private static Map<String, Long> countBy(List<Complaint> complaints, Function<Complaint, String> key) {
        return complaints.stream()
                .map(key)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
    }
}
