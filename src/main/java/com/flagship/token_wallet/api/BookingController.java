package com.flagship.token_wallet.api;

import com.flagship.token_wallet.api.dto.CreateBookingRequest;
import com.flagship.token_wallet.api.dto.EscrowResponse;
import com.flagship.token_wallet.api.dto.ResolutionRequest;
import com.flagship.token_wallet.api.exception.BillingFailureException;
import com.flagship.token_wallet.common.BillingError;
import com.flagship.token_wallet.common.BillingResult;
import com.flagship.token_wallet.common.ErrorCode;
import com.flagship.token_wallet.escrow.EscrowManager;
import com.flagship.token_wallet.escrow.EscrowRecord;
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
 * REST controller for escrowed bookings.
 */
@RestController
@RequestMapping("/api/bookings")
@RequiredArgsConstructor
@Slf4j
public class BookingController {

    private final EscrowManager escrowManager;

    @PostMapping
    public ResponseEntity<EscrowResponse> createBooking(@Valid @RequestBody CreateBookingRequest request) {
        log.info("Booking requested: bookingId={}, payer={}, earner={}, amount={}",
            request.getBookingId(), request.getPayerId(), request.getEarnerId(), request.getAmountMinor());
        BillingResult<EscrowRecord> result = request.getBookingId() == null
            ? escrowManager.createBooking(request.getPayerId(), request.getEarnerId(), request.getAmountMinor())
            : escrowManager.hold(request.getBookingId(), request.getPayerId(), request.getEarnerId(),
                request.getAmountMinor());
        return ResponseEntity.status(HttpStatus.CREATED).body(EscrowResponse.from(BillingFailureException.unwrap(result)));
    }

    @PostMapping("/{escrowId}/resolution")
    public ResponseEntity<EscrowResponse> resolve(@PathVariable("escrowId") UUID escrowId,
                                                  @Valid @RequestBody ResolutionRequest request) {
        BillingResult<EscrowRecord> result = switch (request.getAction()) {
            case RELEASE -> escrowManager.release(escrowId);
            case REFUND -> {
                if (request.getRefundFraction() == null) {
                    throw invalid("refund_fraction is required for REFUND");
                }
                yield escrowManager.refund(escrowId, request.getRefundFraction());
            }
            case CANCEL -> escrowManager.cancelBooking(escrowId, request.getCancelledBy(), request.getBookingStart());
        };
        return ResponseEntity.ok(EscrowResponse.from(BillingFailureException.unwrap(result)));
    }

    @GetMapping("/{escrowId}")
    public ResponseEntity<EscrowResponse> getEscrow(@PathVariable("escrowId") UUID escrowId) {
        return escrowManager.getEscrow(escrowId)
            .map(escrow -> ResponseEntity.ok(EscrowResponse.from(escrow)))
            .orElseThrow(() -> new BillingFailureException(
                BillingError.of(ErrorCode.ESCROW_NOT_FOUND, "Escrow not found: " + escrowId)));
    }

    private static BillingFailureException invalid(String message) {
        return new BillingFailureException(BillingError.of(ErrorCode.INVALID_REQUEST, message));
    }
}
