package com.flagship.token_wallet.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.token_wallet.api.dto.MessageRequest;
import com.flagship.token_wallet.api.dto.ParticipantRequest;
import com.flagship.token_wallet.api.dto.StartSessionRequest;
import com.flagship.token_wallet.api.dto.UsageRequest;
import com.flagship.token_wallet.session.SessionType;
import com.flagship.token_wallet.wallet.WalletAccountService;
import com.flagship.token_wallet.wallet.WalletLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private WalletAccountService accountService;

    @Autowired
    private WalletLedger ledger;

    private String fan;
    private String creator;

    @BeforeEach
    void setUp() {
        fan = "fan-" + UUID.randomUUID();
        creator = "creator-" + UUID.randomUUID();
        accountService.openWallet(fan);
        accountService.openWallet(creator);
    }

    private String startRequest(SessionType type) throws Exception {
        return objectMapper.writeValueAsString(StartSessionRequest.builder()
            .sessionType(type)
            .participantA(ParticipantRequest.builder().userId(fan).category("regular").build())
            .participantB(ParticipantRequest.builder().userId(creator).category("creator").earnerEligible(true).build())
            .initiatorId(creator)
            .build());
    }

    private UUID startSession(SessionType type) throws Exception {
        String body = mockMvc.perform(post("/api/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(startRequest(type)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.payer_id").value(fan))
            .andExpect(jsonPath("$.earner_id").value(creator))
            .andExpect(jsonPath("$.state").value("ACTIVE"))
            .andReturn().getResponse().getContentAsString();
        JsonNode json = objectMapper.readTree(body);
        return UUID.fromString(json.get("session_id").asText());
    }

    private String usage(long units) throws Exception {
        return objectMapper.writeValueAsString(UsageRequest.builder().units(units).build());
    }

    @Test
    @DisplayName("Starting without funds returns 402")
    void startWithoutFunds() throws Exception {
        mockMvc.perform(post("/api/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(startRequest(SessionType.VOICE_CALL)))
            .andExpect(status().isPaymentRequired())
            .andExpect(jsonPath("$.code").value("INSUFFICIENT_FUNDS"));
    }

    @Test
    @DisplayName("Call usage is billed per minute and the tick tells the client when to hang up")
    void callLifecycle() throws Exception {
        ledger.mint("topup-" + UUID.randomUUID(), fan, 15, "psp");
        UUID sessionId = startSession(SessionType.VOICE_CALL);

        mockMvc.perform(post("/api/sessions/{id}/usage", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(usage(60)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CHARGED"))
            .andExpect(jsonPath("$.amount_billed_minor").value(10))
            .andExpect(jsonPath("$.terminate").value(false));

        mockMvc.perform(post("/api/sessions/{id}/usage", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(usage(60)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("INSUFFICIENT_FUNDS"))
            .andExpect(jsonPath("$.terminate").value(true));

        mockMvc.perform(get("/api/sessions/{id}", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("ENDED"))
            .andExpect(jsonPath("$.end_reason").value("INSUFFICIENT_FUNDS"))
            .andExpect(jsonPath("$.unbilled_units").value(1));

        mockMvc.perform(post("/api/sessions/{id}/end", sessionId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("INVALID_SESSION_STATE"));
    }

    @Test
    @DisplayName("Chat messages are metered and the session can be ended")
    void chatLifecycle() throws Exception {
        ledger.mint("topup-" + UUID.randomUUID(), fan, 100, "psp");
        UUID sessionId = startSession(SessionType.CHAT);

        mockMvc.perform(post("/api/sessions/{id}/messages", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(MessageRequest.builder()
                    .senderId(creator)
                    .text("one two three four five six seven eight nine ten eleven twelve")
                    .build())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.units_billed").value(2));

        mockMvc.perform(post("/api/sessions/{id}/heartbeat", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("NOTHING_DUE"));

        mockMvc.perform(post("/api/sessions/{id}/end", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.end_reason").value("CLOSED"))
            .andExpect(jsonPath("$.amount_billed_minor").value(2))
            .andExpect(jsonPath("$.earner_amount_minor").value(1))
            .andExpect(jsonPath("$.platform_amount_minor").value(1));
    }

    @Test
    @DisplayName("Negative usage is rejected by validation")
    void negativeUsage() throws Exception {
        mockMvc.perform(post("/api/sessions/{id}/usage", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"units\":-1}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Unknown sessions return 404")
    void unknownSession() throws Exception {
        mockMvc.perform(get("/api/sessions/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
    }
}
