package com.flagship.token_wallet.failure;

import com.flagship.token_wallet.common.BillingResult;
import com.flagship.token_wallet.escrow.BookingOutcome;
import com.flagship.token_wallet.escrow.EscrowManager;
import com.flagship.token_wallet.escrow.EscrowRecord;
import com.flagship.token_wallet.escrow.EscrowStatus;
import com.flagship.token_wallet.outbox.OutboxEvent;
import com.flagship.token_wallet.outbox.OutboxService;
import com.flagship.token_wallet.roles.ParticipantProfile;
import com.flagship.token_wallet.session.BillingOrchestrator;
import com.flagship.token_wallet.session.FinalBillingSummary;
import com.flagship.token_wallet.session.SessionType;
import com.flagship.token_wallet.wallet.LedgerTransaction;
import com.flagship.token_wallet.wallet.TransactionKind;
import com.flagship.token_wallet.wallet.Wallet;
import com.flagship.token_wallet.wallet.WalletAccountService;
import com.flagship.token_wallet.wallet.WalletLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

/**
 * Failure scenarios against a real PostgreSQL.
 *
 * Covers Redis outages, Kafka outages (events wait in the outbox), and concurrent writers
 * racing on the same session or escrow. After every scenario the ledger must still
 * balance: minted minus burned equals the sum of all wallet balances.
 *
 * Skipped when no Docker daemon is available; the H2 suites cover the same operations.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class FailureScenarioTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("token_wallet_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Autowired
    private WalletLedger ledger;

    @Autowired
    private WalletAccountService accountService;

    @Autowired
    private BillingOrchestrator orchestrator;

    @Autowired
    private EscrowManager escrowManager;

    @Autowired
    private OutboxService outboxService;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    private String fan;
    private String creator;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        fan = "fan-" + UUID.randomUUID();
        creator = "creator-" + UUID.randomUUID();
        accountService.openWallet(fan);
        accountService.openWallet(creator);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("FAILURE SCENARIO: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    private void fund(String walletId, long amount) {
        assertTrue(ledger.mint("topup-" + UUID.randomUUID(), walletId, amount, "psp").isSuccess());
    }

    private long balanceOf(String walletId) {
        return ledger.getWallet(walletId).map(Wallet::getBalanceMinor).orElseThrow();
    }

    private UUID startCall() {
        return orchestrator.startSession(SessionType.VOICE_CALL,
                ParticipantProfile.builder().userId(fan).category("regular").build(),
                ParticipantProfile.builder().userId(creator).category("creator").earnerEligible(true).build(),
                fan)
            .getValue()
            .getSessionId();
    }

    private void assertLedgerBalanced() {
        assertTrue(ledger.checkConservation().isBalanced(), "ledger out of balance");
        printSuccess("minted - burned == sum of balances");
    }

    // ========================================================================
    // REDIS
    // ========================================================================

    @Nested
    @DisplayName("1. Redis failures")
    class RedisFailureTests {

        @Test
        @DisplayName("1.1 Transfers and replays work when every Redis call fails")
        void redisDown() {
            printTestHeader("Redis unavailable");
            when(valueOperations.get(anyString()))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));
            doThrow(new RedisConnectionFailureException("Connection refused"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
            fund(fan, 100);
            String transactionId = "tx-" + UUID.randomUUID();

            BillingResult<LedgerTransaction> first =
                ledger.transfer(transactionId, fan, creator, 30, TransactionKind.CHAT, null);
            BillingResult<LedgerTransaction> replay =
                ledger.transfer(transactionId, fan, creator, 30, TransactionKind.CHAT, null);

            assertTrue(first.isSuccess());
            assertTrue(replay.isSuccess());
            assertEquals(first.getValue().getSequenceNumber(), replay.getValue().getSequenceNumber());
            assertEquals(70, balanceOf(fan));
            assertEquals(30, balanceOf(creator));
            printSuccess("replay detected by the database, money moved once");
            assertLedgerBalanced();
        }
    }

    // ========================================================================
    // KAFKA
    // ========================================================================

    @Nested
    @DisplayName("2. Kafka failures")
    class KafkaFailureTests {

        @Test
        @DisplayName("2.1 Session events wait in the outbox while Kafka is unavailable")
        void eventsStayInOutbox() {
            printTestHeader("Kafka unavailable");
            fund(fan, 100);
            UUID sessionId = startCall();
            orchestrator.recordUsage(sessionId, 60);
            orchestrator.endSession(sessionId);

            List<OutboxEvent> events = outboxService.getEventsForAggregate(BillingOrchestrator.AGGREGATE_TYPE, sessionId);
            assertEquals(3, events.size());
            assertTrue(events.stream().noneMatch(OutboxEvent::isPublished));
            assertTrue(outboxService.countUnpublished() >= 3);
            printSuccess("started, charged and ended events are pending publication");
            assertLedgerBalanced();
        }
    }

    // ========================================================================
    // CONCURRENT WRITERS
    // ========================================================================

    @Nested
    @DisplayName("3. Concurrent writers")
    class ConcurrencyTests {

        @Test
        @DisplayName("3.1 Racing ticks on one call bill each minute exactly once")
        void racingTicks() throws Exception {
            printTestHeader("Racing ticks");
            fund(fan, 1_000);
            UUID sessionId = startCall();
            int threads = 10;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch go = new CountDownLatch(1);

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    go.await();
                    return orchestrator.recordUsage(sessionId, 60);
                });
            }
            go.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(60, TimeUnit.SECONDS));

            FinalBillingSummary summary = orchestrator.getSummary(sessionId).getValue();
            assertEquals(10, summary.getUnitsBilled());
            assertEquals(100, summary.getAmountBilledMinor());
            assertEquals(900, balanceOf(fan));
            assertEquals(80, balanceOf(creator));
            printSuccess("10 minutes billed once each");
            assertLedgerBalanced();
        }

        @Test
        @DisplayName("3.2 Release and refund racing on one escrow: exactly one wins")
        void racingResolutions() throws Exception {
            printTestHeader("Racing escrow resolutions");
            fund(fan, 500);
            EscrowRecord held = escrowManager.createBooking(fan, creator, 500).getValue();
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch go = new CountDownLatch(1);

            List<Future<BillingResult<EscrowRecord>>> results = new ArrayList<>();
            results.add(executor.submit(() -> {
                go.await();
                return escrowManager.resolveBooking(held.getEscrowId(), BookingOutcome.release());
            }));
            results.add(executor.submit(() -> {
                go.await();
                return escrowManager.resolveBooking(held.getEscrowId(), BookingOutcome.refund(BigDecimal.ONE));
            }));
            go.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(60, TimeUnit.SECONDS));

            long winners = 0;
            for (Future<BillingResult<EscrowRecord>> result : results) {
                if (result.get().isSuccess()) {
                    winners++;
                }
            }
            assertEquals(1, winners);

            EscrowStatus status = escrowManager.getEscrow(held.getEscrowId()).orElseThrow().getStatus();
            if (status == EscrowStatus.RELEASED) {
                assertEquals(0, balanceOf(fan));
                assertEquals(400, balanceOf(creator));
            } else {
                assertEquals(EscrowStatus.REFUNDED, status);
                assertEquals(400, balanceOf(fan));
                assertEquals(0, balanceOf(creator));
            }
            printSuccess("escrow resolved once as " + status);
            assertLedgerBalanced();
        }
    }
}
