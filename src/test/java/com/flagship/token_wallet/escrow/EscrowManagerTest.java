package com.flagship.token_wallet.escrow;

import com.flagship.token_wallet.common.BillingResult;
import com.flagship.token_wallet.common.ErrorCode;
import com.flagship.token_wallet.event.EscrowHeldEvent;
import com.flagship.token_wallet.event.EscrowResolvedEvent;
import com.flagship.token_wallet.outbox.OutboxEvent;
import com.flagship.token_wallet.outbox.OutboxService;
import com.flagship.token_wallet.wallet.LedgerTransaction;
import com.flagship.token_wallet.wallet.TransactionKind;
import com.flagship.token_wallet.wallet.WalletAccountService;
import com.flagship.token_wallet.wallet.WalletLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Booking escrow: hold with platform fee, release, full and partial refunds,
 * cancellation windows and replays.
 */
@SpringBootTest
class EscrowManagerTest {

    @Autowired
    private EscrowManager escrowManager;

    @Autowired
    private WalletLedger ledger;

    @Autowired
    private WalletAccountService accountService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private Clock clock;

    private String guest;
    private String host;

    @BeforeEach
    void setUp() {
        guest = "guest-" + UUID.randomUUID();
        host = "host-" + UUID.randomUUID();
        accountService.openWallet(guest);
        accountService.openWallet(host);
        assertTrue(ledger.mint("topup-" + UUID.randomUUID(), guest, 1_000, "psp").isSuccess());
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private long balanceOf(String walletId) {
        return ledger.getWallet(walletId).orElseThrow().getBalanceMinor();
    }

    private EscrowRecord hold500() {
        BillingResult<EscrowRecord> held = escrowManager.createBooking(guest, host, 500);
        assertTrue(held.isSuccess(), "hold failed: " + held);
        return held.getValue();
    }

    @Test
    @DisplayName("Holding 500 takes 100 as platform fee and keeps 400 in escrow")
    void holdSplitsFee() {
        printTestHeader("Escrow hold");

        EscrowRecord escrow = hold500();

        printOutput("Escrow", escrow);
        assertEquals(EscrowStatus.HELD, escrow.getStatus());
        assertEquals(500, escrow.getGrossAmountMinor());
        assertEquals(100, escrow.getFeeAmountMinor());
        assertEquals(400, escrow.getHeldAmountMinor());
        assertEquals(500, balanceOf(guest));
        assertEquals(0, balanceOf(host));

        List<LedgerTransaction> legs = ledger.getSessionTransactions(escrow.getEscrowId().toString());
        assertEquals(2, legs.size());
        assertTrue(legs.stream().anyMatch(leg -> leg.getKind() == TransactionKind.FEE && leg.getAmountMinor() == 100));
    }

    @Test
    @DisplayName("Release pays the host the held amount")
    void release() {
        EscrowRecord escrow = hold500();

        BillingResult<EscrowRecord> released = escrowManager.release(escrow.getEscrowId());

        assertTrue(released.isSuccess());
        assertEquals(EscrowStatus.RELEASED, released.getValue().getStatus());
        assertEquals(400, released.getValue().getReleasedAmountMinor());
        assertEquals(400, balanceOf(host));
        assertEquals(500, balanceOf(guest));
    }

    @Test
    @DisplayName("Full refund returns the held amount but not the fee")
    void fullRefund() {
        EscrowRecord escrow = hold500();

        EscrowRecord refunded = escrowManager.refund(escrow.getEscrowId(), BigDecimal.ONE).getValue();

        assertEquals(EscrowStatus.REFUNDED, refunded.getStatus());
        assertEquals(400, refunded.getRefundedAmountMinor());
        assertEquals(900, balanceOf(guest));
        assertEquals(0, balanceOf(host));
    }

    @Test
    @DisplayName("Partial refund splits the held amount between guest and host")
    void partialRefund() {
        EscrowRecord escrow = hold500();

        EscrowRecord resolved = escrowManager.refund(escrow.getEscrowId(), new BigDecimal("0.25")).getValue();

        assertEquals(EscrowStatus.PARTIALLY_REFUNDED, resolved.getStatus());
        assertEquals(100, resolved.getRefundedAmountMinor());
        assertEquals(300, resolved.getReleasedAmountMinor());
        assertEquals(600, balanceOf(guest));
        assertEquals(300, balanceOf(host));
    }

    @Test
    @DisplayName("Guest cancelling 48h ahead gets half of the held amount back")
    void guestCancellation() {
        EscrowRecord escrow = hold500();

        EscrowRecord resolved = escrowManager.cancelBooking(escrow.getEscrowId(),
            CancellationRefundPolicy.CancelledBy.GUEST, clock.instant().plus(Duration.ofHours(48))).getValue();

        assertEquals(EscrowStatus.PARTIALLY_REFUNDED, resolved.getStatus());
        assertEquals(200, resolved.getRefundedAmountMinor());
        assertEquals(200, balanceOf(host));
    }

    @Test
    @DisplayName("Replaying a resolution is a no-op; a different one is INVALID_ESCROW_STATE")
    void resolutionReplay() {
        EscrowRecord escrow = hold500();
        escrowManager.release(escrow.getEscrowId());

        BillingResult<EscrowRecord> replay = escrowManager.release(escrow.getEscrowId());
        BillingResult<EscrowRecord> refund = escrowManager.refund(escrow.getEscrowId(), BigDecimal.ONE);

        assertTrue(replay.isSuccess());
        assertTrue(refund.hasError(ErrorCode.INVALID_ESCROW_STATE));
        assertEquals(400, balanceOf(host));
        assertEquals(500, balanceOf(guest));
    }

    @Test
    @DisplayName("Holding the same booking twice holds once; changed parameters conflict")
    void holdIsIdempotentPerBooking() {
        String bookingId = "booking-" + UUID.randomUUID();

        EscrowRecord first = escrowManager.hold(bookingId, guest, host, 300).getValue();
        EscrowRecord second = escrowManager.hold(bookingId, guest, host, 300).getValue();
        BillingResult<EscrowRecord> changed = escrowManager.hold(bookingId, guest, host, 301);

        assertEquals(first.getEscrowId(), second.getEscrowId());
        assertTrue(changed.hasError(ErrorCode.IDEMPOTENCY_CONFLICT));
        assertEquals(700, balanceOf(guest));
    }

    @Test
    @DisplayName("A guest who cannot afford the booking is rejected and nothing is held")
    void insufficientFunds() {
        BillingResult<EscrowRecord> result = escrowManager.createBooking(guest, host, 5_000);

        assertTrue(result.hasError(ErrorCode.INSUFFICIENT_FUNDS));
        assertEquals(1_000, balanceOf(guest));
    }

    @Test
    @DisplayName("An amount beyond the transfer limit is rejected before any money moves")
    void amountBeyondLimit() {
        BillingResult<EscrowRecord> result = escrowManager.createBooking(guest, host, 2_000_000_000_000_000L);

        assertTrue(result.hasError(ErrorCode.INVALID_REQUEST));
        assertEquals(1_000, balanceOf(guest));
    }

    @Test
    @DisplayName("Unknown escrows are reported as ESCROW_NOT_FOUND")
    void unknownEscrow() {
        assertTrue(escrowManager.release(UUID.randomUUID()).hasError(ErrorCode.ESCROW_NOT_FOUND));
    }

    @Test
    @DisplayName("Hold and resolution are published through the outbox")
    void outboxEvents() {
        EscrowRecord escrow = hold500();
        escrowManager.release(escrow.getEscrowId());

        List<String> types = outboxService.getEventsForAggregate(EscrowManager.AGGREGATE_TYPE, escrow.getEscrowId())
            .stream().map(OutboxEvent::getEventType).toList();

        assertEquals(List.of(EscrowHeldEvent.EVENT_TYPE, EscrowResolvedEvent.EVENT_TYPE), types);
    }
}
