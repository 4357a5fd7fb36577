package tech.noetzold.zta.gateway_api.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import tech.noetzold.zta.common.model.AnomalyReason;
import tech.noetzold.zta.common.model.Enforcement;
import tech.noetzold.zta.common.model.SignalBundle;
import tech.noetzold.zta.common.model.SignalType;
import tech.noetzold.zta.common.model.StrideCategory;
import tech.noetzold.zta.common.model.TrustDecision;
import tech.noetzold.zta.gateway_api.model.DecisionCancelledException;
import tech.noetzold.zta.gateway_api.model.DecisionResponse;
import tech.noetzold.zta.gateway_api.model.EnforcementRecord;
import tech.noetzold.zta.gateway_api.model.PersistenceStatus;
import tech.noetzold.zta.gateway_api.service.EnforcementGatewayService;

import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GatewayControllerTest {

    private EnforcementGatewayService service;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        service = mock(EnforcementGatewayService.class);
        mvc = MockMvcBuilders.standaloneSetup(new GatewayController(service))
                .setControllerAdvice(new ErrorHandler())
                .build();
    }

    @Test
    @DisplayName("A step-up decision is returned with its challenge")
    void decision() throws Exception {
        when(service.decide(argThat(b -> b != null && "s1".equals(b.sessionId()))))
                .thenReturn(new DecisionResponse("s1", Enforcement.MFA_STEP_UP, 0.4, TrustDecision.STEP_UP,
                        List.of(AnomalyReason.LOCATION_MISMATCH), Set.of(StrideCategory.SPOOFING),
                        StrideCategory.SPOOFING, 0.7, false, null, "tok-1", null, PersistenceStatus.stored(3L)));

        mvc.perform(post("/gateway/decision").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"s1\",\"signals\":{\"gps\":{\"lat\":1,\"lon\":2}}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enforcement").value("MFA_STEP_UP"))
                .andExpect(jsonPath("$.dominant_stride").value("Spoofing"))
                .andExpect(jsonPath("$.challenge_token").value("tok-1"))
                .andExpect(jsonPath("$.fail_safe").value(false))
                .andExpect(jsonPath("$.persistence.ok").value(true))
                .andExpect(jsonPath("$.failure_detail").doesNotExist());
    }

    @Test
    @DisplayName("A scalar signal value still reaches the pipeline for a decision")
    void scalarSignalValue() throws Exception {
        when(service.decide(argThat(b -> b != null
                && b.signal(SignalType.GPS).map(SignalBundle::isUnreadable).orElse(false)
                && b.signal(SignalType.IP_ORIGIN).isPresent())))
                .thenReturn(new DecisionResponse("s1", Enforcement.MFA_STEP_UP, 0.31, TrustDecision.STEP_UP,
                        List.of(AnomalyReason.SIGNAL_MALFORMED), Set.of(StrideCategory.TAMPERING),
                        StrideCategory.TAMPERING, 0.5, false, null, null, null, PersistenceStatus.stored(4L)));

        mvc.perform(post("/gateway/decision").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"s1\",\"signals\":{\"ip_origin\":{\"ip\":\"81.2.69.160\"},"
                                + "\"gps\":\"51.5,-0.12\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reasons[0]").value("SIGNAL_MALFORMED"))
                .andExpect(jsonPath("$.enforcement").value("MFA_STEP_UP"));
    }

    @Test
    @DisplayName("A cancelled decision answers 503")
    void cancelled() throws Exception {
        when(service.decide(any(SignalBundle.class))).thenThrow(new DecisionCancelledException("siem"));

        mvc.perform(post("/gateway/decision").contentType(MediaType.APPLICATION_JSON).content("{\"signals\":{}}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("DECISION_CANCELLED"));
    }

    @Test
    @DisplayName("Unreadable bodies are rejected with 400")
    void badBody() throws Exception {
        mvc.perform(post("/gateway/decision").contentType(MediaType.APPLICATION_JSON).content("[1,2"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Audit records are listed per session")
    void records() throws Exception {
        EnforcementRecord record = EnforcementRecord.builder()
                .id(5L).sessionId("s1").risk(1.0).decision("DENY").enforcement("DENY")
                .reasons(List.of()).strideCategories(List.of()).failSafe(true)
                .failureDetail("trust unavailable").build();
        when(service.records("s1")).thenReturn(List.of(record));

        mvc.perform(get("/gateway/records").param("session_id", "s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].session_id").value("s1"))
                .andExpect(jsonPath("$[0].failure_detail").value("trust unavailable"));
    }

    @Test
    @DisplayName("Audit queries without session_id are rejected")
    void recordsWithoutSession() throws Exception {
        mvc.perform(get("/gateway/records")).andExpect(status().isBadRequest());
    }
}
