package com.company.pmm.controller;

import com.company.pmm.domain.Signal;
import com.company.pmm.domain.enums.Severity;
import com.company.pmm.domain.enums.SignalStatus;
import com.company.pmm.domain.enums.SignalType;
import com.company.pmm.dto.response.DetectionRunResponse;
import com.company.pmm.exception.InvalidStatusTransitionException;
import com.company.pmm.exception.SignalNotFoundException;
import com.company.pmm.service.SignalService;
import com.company.pmm.support.MockMvcSupport;
import com.company.pmm.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SignalControllerTest {

    @Mock
    private SignalService signalService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcSupport.mockMvc(new SignalController(signalService));
    }

    @Test
    @DisplayName("Signals are rendered in snake_case with lowercase enum values")
    void activeSignals() throws Exception {
        given(signalService.getActiveSignals()).willReturn(List.of(signal(SignalStatus.ACTIVE)));

        mockMvc.perform(get("/api/v1/signals/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.signals[0].signal_id").value("SIG-1"))
                .andExpect(jsonPath("$.signals[0].type").value("anomaly"))
                .andExpect(jsonPath("$.signals[0].severity").value("high"))
                .andExpect(jsonPath("$.signals[0].status").value("active"))
                .andExpect(jsonPath("$.signals[0].metric_name").value("response_accuracy"));
    }

    @Test
    void detectAcceptsGetAndPost() throws Exception {
        given(signalService.runDetection())
                .willReturn(new DetectionRunResponse(TestFixtures.NOW, 3, 0, List.of()));

        mockMvc.perform(post("/api/v1/signals/detect"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metrics_scanned").value(3))
                .andExpect(jsonPath("$.signals_detected").value(0));
        mockMvc.perform(get("/api/v1/signals/detect"))
                .andExpect(status().isOk());
    }

    @Test
    void historyDefaultsToOneWeek() throws Exception {
        given(signalService.getHistory(null, Duration.ofHours(168))).willReturn(List.of());

        mockMvc.perform(get("/api/v1/signals/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
        verify(signalService).getHistory(null, Duration.ofHours(168));
    }

    @Test
    void historyWithUnknownStatusIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/signals/history").param("status", "bogus"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(signalService);
    }

    @Test
    void unknownSignalIsNotFound() throws Exception {
        given(signalService.getSignal("SIG-x")).willThrow(new SignalNotFoundException("SIG-x"));

        mockMvc.perform(get("/api/v1/signals/SIG-x"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Signal not found: SIG-x"))
                .andExpect(jsonPath("$.timestamp").value("2025-03-15T12:00:00Z"));
    }

    @Test
    void acknowledge() throws Exception {
        given(signalService.acknowledge("SIG-1", "analyst")).willReturn(signal(SignalStatus.ACKNOWLEDGED));

        mockMvc.perform(post("/api/v1/signals/SIG-1/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"acknowledged_by\":\"analyst\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("acknowledged"));
    }

    @Test
    void acknowledgeWithoutActorIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/signals/SIG-1/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.acknowledgedBy").exists());
        verifyNoInteractions(signalService);
    }

    @Test
    void resolvingAFinalSignalIsConflict() throws Exception {
        given(signalService.resolve(any(), any()))
                .willThrow(new InvalidStatusTransitionException("SIG-1", "resolved", "resolved"));

        mockMvc.perform(post("/api/v1/signals/SIG-1/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolved_by\":\"analyst\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void falsePositive() throws Exception {
        given(signalService.markFalsePositive("SIG-1", "analyst")).willReturn(signal(SignalStatus.FALSE_POSITIVE));

        mockMvc.perform(post("/api/v1/signals/SIG-1/false-positive")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolved_by\":\"analyst\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("false_positive"));
    }

    private static Signal signal(SignalStatus status) {
        return Signal.builder()
                .signalId("SIG-1")
                .timestamp(TestFixtures.NOW)
                .signalType(SignalType.ANOMALY)
                .severity(Severity.HIGH)
                .metricName("response_accuracy")
                .detectedValue(0.815)
                .expectedValue(0.935)
                .status(status)
                .build();
    }
}
