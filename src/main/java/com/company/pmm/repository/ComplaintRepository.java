package com.company.pmm.repository;

import com.company.pmm.domain.Complaint;
import com.company.pmm.util.IdGenerator;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

@Repository
public class ComplaintRepository {

    private static final Comparator<Complaint> BY_CREATED = Comparator
            .comparing(Complaint::getCreatedAt)
            .thenComparingLong((Complaint complaint) -> IdGenerator.sequenceOf(complaint.getComplaintId()))
            .thenComparing(Complaint::getComplaintId);

    private final ConcurrentMap<String, Complaint> complaints = new ConcurrentHashMap<>();

    public Complaint save(Complaint complaint) {
        complaints.put(complaint.getComplaintId(), complaint);
        return complaint;
    }

    public Optional<Complaint> findById(String complaintId) {
        return Optional.ofNullable(complaints.get(complaintId));
    }

    /**
     * Read-modify-write of a single complaint, atomic with respect to other updates of it.
     */
    public Optional<Complaint> update(String complaintId, UnaryOperator<Complaint> transition) {
        return Optional.ofNullable(complaints.computeIfPresent(complaintId, (id, current) -> transition.apply(current)));
    }

    public List<Complaint> findAll() {
        return find(complaint -> true);
    }

    public List<Complaint> find(Predicate<Complaint> filter) {
        return complaints.values().stream()
                .filter(filter)
                .sorted(BY_CREATED)
                .collect(Collectors.toList());
    }
}
