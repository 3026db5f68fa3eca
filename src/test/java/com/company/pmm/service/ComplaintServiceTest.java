package com.company.pmm.service;

import com.company.pmm.domain.Complaint;
import com.company.pmm.domain.enums.ComplaintPriority;
import com.company.pmm.domain.enums.ComplaintStatus;
import com.company.pmm.dto.request.ComplaintRequest;
import com.company.pmm.dto.request.ComplaintUpdateRequest;
import com.company.pmm.dto.response.ComplaintAnalytics;
import com.company.pmm.exception.ComplaintNotFoundException;
import com.company.pmm.repository.ComplaintRepository;
import com.company.pmm.support.MutableClock;
import com.company.pmm.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComplaintServiceTest {

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private ComplaintService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.NOW);
        meterRegistry = new SimpleMeterRegistry();
        service = new ComplaintService(new ComplaintRepository(), meterRegistry, clock);
    }

    @Test
    void createDefaultsToOpenMediumPriority() {
        Complaint complaint = service.create(request("accuracy", null));

        assertThat(complaint.getComplaintId()).startsWith("CMP-20250315-");
        assertThat(complaint.getStatus()).isEqualTo(ComplaintStatus.OPEN);
        assertThat(complaint.getPriority()).isEqualTo(ComplaintPriority.MEDIUM);
        assertThat(complaint.getCreatedAt()).isEqualTo(TestFixtures.NOW);
        assertThat(complaint.getResolvedAt()).isNull();
        assertThat(complaint.getUpdates()).isEmpty();
        assertThat(meterRegistry.counter("pmm.complaints.created", "priority", "medium").count()).isEqualTo(1.0);
    }

    @Test
    void unknownPriorityIsRejected() {
        assertThatThrownBy(() -> service.create(request("accuracy", "urgent")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("urgent");
    }

    @Test
    @DisplayName("Resolving sets resolved_at and records one audit entry with the status change")
    void resolveRecordsAuditTrail() {
        Complaint complaint = service.create(request("bias", "high"));
        clock.advance(Duration.ofMinutes(90));

        Complaint resolved = service.update(complaint.getComplaintId(), ComplaintUpdateRequest.builder()
                .status("resolved")
                .resolution("Model retrained")
                .updatedBy("analyst")
                .build());

        assertThat(resolved.getStatus()).isEqualTo(ComplaintStatus.RESOLVED);
        assertThat(resolved.getResolvedAt()).isEqualTo(TestFixtures.NOW.plus(Duration.ofMinutes(90)));
        assertThat(resolved.getUpdates()).hasSize(1);
        assertThat(resolved.getUpdates().get(0).getUpdatedBy()).isEqualTo("analyst");
        assertThat(resolved.getUpdates().get(0).getChanges())
                .containsOnlyKeys("status", "resolution");
        assertThat(resolved.getUpdates().get(0).getChanges().get("status").getFrom()).isEqualTo("open");
        assertThat(resolved.getUpdates().get(0).getChanges().get("status").getTo()).isEqualTo("resolved");
    }

    @Test
    @DisplayName("resolved_at is kept through resolved -> closed and cleared on reopen")
    void resolvedAtFollowsTerminalStatus() {
        Complaint complaint = service.create(request("bias", null));
        String id = complaint.getComplaintId();

        clock.advance(Duration.ofHours(1));
        service.update(id, status("resolved"));
        clock.advance(Duration.ofHours(1));
        Complaint closed = service.update(id, status("closed"));
        assertThat(closed.getResolvedAt()).isEqualTo(TestFixtures.NOW.plus(Duration.ofHours(1)));

        Complaint reopened = service.update(id, status("in_progress"));
        assertThat(reopened.getResolvedAt()).isNull();
        assertThat(reopened.isOpen()).isTrue();
        assertThat(reopened.getUpdates()).hasSize(3);
    }

    @Test
    @DisplayName("An update that changes nothing leaves the trail untouched")
    void noOpUpdate() {
        Complaint complaint = service.create(request("bias", "low"));

        Complaint same = service.update(complaint.getComplaintId(), ComplaintUpdateRequest.builder()
                .status("open")
                .priority("low")
                .build());

        assertThat(same.getUpdates()).isEmpty();
        assertThat(same.getStatus()).isEqualTo(ComplaintStatus.OPEN);
    }

    @Test
    @DisplayName("Returned complaints cannot be changed outside update()")
    void returnedComplaintsAreImmutable() {
        ComplaintRequest request = request("bias", null);
        request.getTags().add("ui");
        String id = service.create(request).getComplaintId();
        request.getTags().add("late");
        Complaint resolved = service.update(id, status("resolved"));

        assertThatThrownBy(() -> resolved.getUpdates().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> resolved.getTags().add("other"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> resolved.getUpdates().get(0).getChanges().remove("status"))
                .isInstanceOf(UnsupportedOperationException.class);

        Complaint stored = service.get(id);
        assertThat(stored.getTags()).containsExactly("ui");
        assertThat(stored.getUpdates()).hasSize(1);
        assertThat(stored.getResolvedAt()).isEqualTo(TestFixtures.NOW);
    }

    @Test
    void updateUnknownComplaint() {
        assertThatThrownBy(() -> service.update("CMP-missing", status("resolved")))
                .isInstanceOf(ComplaintNotFoundException.class)
                .hasMessageContaining("CMP-missing");
    }

    @Test
    void getUnknownComplaint() {
        assertThatThrownBy(() -> service.get("CMP-missing"))
                .isInstanceOf(ComplaintNotFoundException.class);
    }

    @Test
    void listFiltersByStatusPriorityAndAge() {
        Complaint old = service.create(request("privacy", "high"));
        clock.advance(Duration.ofDays(10));
        Complaint recent = service.create(request("accuracy", "high"));
        service.create(request("accuracy", "low"));
        service.update(recent.getComplaintId(), status("in_progress"));

        assertThat(service.list(null, ComplaintPriority.HIGH, null))
                .extracting(Complaint::getComplaintId)
                .containsExactly(old.getComplaintId(), recent.getComplaintId());
        assertThat(service.list(ComplaintStatus.IN_PROGRESS, null, null))
                .extracting(Complaint::getComplaintId)
                .containsExactly(recent.getComplaintId());
        assertThat(service.list(null, null, 7)).hasSize(2);
    }

    @Test
    @DisplayName("Analytics counts by status, priority and category and averages resolution time")
    void analytics() {
        Complaint first = service.create(request("accuracy", "high"));
        Complaint second = service.create(request("accuracy", "low"));
        service.create(request("bias", "high"));

        clock.advance(Duration.ofMinutes(18 * 60 + 30));
        service.update(first.getComplaintId(), status("resolved"));
        clock.advance(Duration.ofHours(2));
        service.update(second.getComplaintId(), status("closed"));

        ComplaintAnalytics analytics = service.analytics(30);

        assertThat(analytics.getTotal()).isEqualTo(3);
        assertThat(analytics.getOpenCount()).isEqualTo(1);
        assertThat(analytics.getByStatus())
                .containsEntry("resolved", 1L)
                .containsEntry("closed", 1L)
                .containsEntry("open", 1L);
        assertThat(analytics.getByPriority()).containsEntry("high", 2L).containsEntry("low", 1L);
        assertThat(analytics.getByCategory()).containsEntry("accuracy", 2L).containsEntry("bias", 1L);

        ComplaintAnalytics.ResolutionStats stats = analytics.getResolutionStats();
        assertThat(stats.getResolvedCount()).isEqualTo(2);
        assertThat(stats.getMinResolutionHours()).isEqualTo(18.5);
        assertThat(stats.getMaxResolutionHours()).isEqualTo(20.5);
        assertThat(stats.getAvgResolutionHours()).isEqualTo(19.5);
        assertThat(stats.getAvgResolutionTime()).isEqualTo("19h 30m");
        assertThat(service.countOpen()).isEqualTo(1);
    }

    @Test
    void analyticsWithoutResolutions() {
        service.create(request("accuracy", null));

        ComplaintAnalytics.ResolutionStats stats = service.analytics(30).getResolutionStats();

        assertThat(stats.getResolvedCount()).isZero();
        assertThat(stats.getAvgResolutionHours()).isNull();
    }

    private static ComplaintRequest request(String category, String priority) {
        return ComplaintRequest.builder()
                .userId("user-1")
                .category(category)
                .subject("Wrong answer")
                .description("The assistant gave an incorrect answer")
                .priority(priority)
                .build();
    }

    private static ComplaintUpdateRequest status(String status) {
        return ComplaintUpdateRequest.builder().status(status).updatedBy("ops").build();
    }
}
