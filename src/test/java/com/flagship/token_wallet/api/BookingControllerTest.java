package com.flagship.token_wallet.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.token_wallet.api.dto.CreateBookingRequest;
import com.flagship.token_wallet.api.dto.ResolutionRequest;
import com.flagship.token_wallet.escrow.CancellationRefundPolicy;
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

import java.time.Duration;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class BookingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private WalletAccountService accountService;

    @Autowired
    private WalletLedger ledger;

    private String guest;
    private String host;
    private String bookingId;

    @BeforeEach
    void setUp() {
        guest = "guest-" + UUID.randomUUID();
        host = "host-" + UUID.randomUUID();
        bookingId = "booking-" + UUID.randomUUID();
        accountService.openWallet(guest);
        accountService.openWallet(host);
        ledger.mint("topup-" + UUID.randomUUID(), guest, 1_000, "psp");
    }

    private String createBooking() throws Exception {
        String body = mockMvc.perform(post("/api/bookings")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(CreateBookingRequest.builder()
                    .bookingId(bookingId)
                    .payerId(guest)
                    .earnerId(host)
                    .amountMinor(500L)
                    .build())))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.booking_id").value(bookingId))
            .andExpect(jsonPath("$.fee_amount_minor").value(100))
            .andExpect(jsonPath("$.held_amount_minor").value(400))
            .andExpect(jsonPath("$.status").value("HELD"))
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("escrow_id").asText();
    }

    private String resolution(ResolutionRequest request) throws Exception {
        return objectMapper.writeValueAsString(request);
    }

    @Test
    @DisplayName("Release pays the host and a conflicting second resolution returns 409")
    void releaseThenRefund() throws Exception {
        String escrowId = createBooking();

        mockMvc.perform(post("/api/bookings/{id}/resolution", escrowId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(resolution(ResolutionRequest.builder().action(ResolutionRequest.Action.RELEASE).build())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("RELEASED"))
            .andExpect(jsonPath("$.released_amount_minor").value(400));

        mockMvc.perform(post("/api/bookings/{id}/resolution", escrowId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(resolution(ResolutionRequest.builder()
                    .action(ResolutionRequest.Action.REFUND)
                    .refundFraction(BigDecimal.ONE)
                    .build())))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("INVALID_ESCROW_STATE"));
    }

    @Test
    @DisplayName("Late guest cancellation refunds nothing and releases everything to the host")
    void lateGuestCancellation() throws Exception {
        String escrowId = createBooking();

        mockMvc.perform(post("/api/bookings/{id}/resolution", escrowId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(resolution(ResolutionRequest.builder()
                    .action(ResolutionRequest.Action.CANCEL)
                    .cancelledBy(CancellationRefundPolicy.CancelledBy.GUEST)
                    .bookingStart(Instant.now().plus(Duration.ofHours(2)))
                    .build())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("RELEASED"))
            .andExpect(jsonPath("$.refunded_amount_minor").value(0));
    }

    @Test
    @DisplayName("Booking the same id twice returns the same escrow")
    void duplicateBooking() throws Exception {
        String first = createBooking();
        String second = createBooking();

        mockMvc.perform(get("/api/bookings/{id}", first))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.escrow_id").value(second));
    }

    @Test
    @DisplayName("A refund without a fraction is a bad request")
    void refundWithoutFraction() throws Exception {
        String escrowId = createBooking();

        mockMvc.perform(post("/api/bookings/{id}/resolution", escrowId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(resolution(ResolutionRequest.builder().action(ResolutionRequest.Action.REFUND).build())))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("An oversized booking amount is a bad request, not a server error")
    void oversizedAmount() throws Exception {
        mockMvc.perform(post("/api/bookings")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"payer_id\":\"" + guest + "\",\"earner_id\":\"" + host
                    + "\",\"amount_minor\":2000000000000000}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("Unknown escrows return 404")
    void unknownEscrow() throws Exception {
        mockMvc.perform(get("/api/bookings/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }
}
