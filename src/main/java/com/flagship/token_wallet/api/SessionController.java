package com.flagship.token_wallet.api;

import com.flagship.token_wallet.api.dto.MessageRequest;
import com.flagship.token_wallet.api.dto.SessionResponse;
import com.flagship.token_wallet.api.dto.SessionSummaryResponse;
import com.flagship.token_wallet.api.dto.StartSessionRequest;
import com.flagship.token_wallet.api.dto.TickResponse;
import com.flagship.token_wallet.api.dto.UsageRequest;
import com.flagship.token_wallet.api.exception.BillingFailureException;
import com.flagship.token_wallet.session.BillingOrchestrator;
import com.flagship.token_wallet.session.SessionHandle;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for metered chat and call sessions.
 *
 * A tick response with {@code terminate=true} tells the client to cut the interaction:
 * the payer ran out of tokens and the session has ended.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final BillingOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<SessionResponse> startSession(@Valid @RequestBody StartSessionRequest request) {
        log.info("Session start requested: type={}, initiator={}", request.getSessionType(), request.getInitiatorId());
        SessionHandle handle = BillingFailureException.unwrap(orchestrator.startSession(
            request.getSessionType(),
            request.getParticipantA().toProfile(),
            request.getParticipantB().toProfile(),
            request.getInitiatorId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(handle));
    }

    @PostMapping("/{sessionId}/usage")
    public ResponseEntity<TickResponse> recordUsage(@PathVariable("sessionId") UUID sessionId,
                                                    @Valid @RequestBody UsageRequest request) {
        return ResponseEntity.ok(TickResponse.from(
            BillingFailureException.unwrap(orchestrator.recordUsage(sessionId, request.getUnits()))));
    }

    @PostMapping("/{sessionId}/messages")
    public ResponseEntity<TickResponse> recordMessage(@PathVariable("sessionId") UUID sessionId,
                                                      @Valid @RequestBody MessageRequest request) {
        return ResponseEntity.ok(TickResponse.from(BillingFailureException.unwrap(
            orchestrator.recordMessage(sessionId, request.getSenderId(), request.getText()))));
    }

    @PostMapping("/{sessionId}/heartbeat")
    public ResponseEntity<TickResponse> heartbeat(@PathVariable("sessionId") UUID sessionId) {
        return ResponseEntity.ok(TickResponse.from(BillingFailureException.unwrap(orchestrator.heartbeat(sessionId))));
    }

    @PostMapping("/{sessionId}/end")
    public ResponseEntity<SessionSummaryResponse> endSession(@PathVariable("sessionId") UUID sessionId) {
        return ResponseEntity.ok(SessionSummaryResponse.from(
            BillingFailureException.unwrap(orchestrator.endSession(sessionId))));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionSummaryResponse> getSession(@PathVariable("sessionId") UUID sessionId) {
        return ResponseEntity.ok(SessionSummaryResponse.from(
            BillingFailureException.unwrap(orchestrator.getSummary(sessionId))));
    }
}
