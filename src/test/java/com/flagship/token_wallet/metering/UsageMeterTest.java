package com.flagship.token_wallet.metering;

import com.flagship.token_wallet.pricing.BillingUnit;
import com.flagship.token_wallet.pricing.SubscriptionTier;
import com.flagship.token_wallet.pricing.UnitPrice;
import com.flagship.token_wallet.roles.ResolutionRule;
import com.flagship.token_wallet.roles.RoleResolution;
import com.flagship.token_wallet.session.BillingSession;
import com.flagship.token_wallet.session.SessionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UsageMeterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final UsageMeter meter = new UsageMeter();

    private static BillingSession session(SessionType type, BillingUnit unit, int unitSize) {
        return BillingSession.create(UUID.randomUUID(), type, "a", "b", "a",
                new RoleResolution("a", "b", ResolutionRule.INITIATOR_PAYS), SubscriptionTier.STANDARD,
                new UnitPrice(unit, unitSize, 10, 8_000), FreeChatAllowance.NONE, NOW)
            .activate(NOW);
    }

    private static BillingSession platformChat(FreeChatAllowance freeChat) {
        return BillingSession.create(UUID.randomUUID(), SessionType.CHAT, "a", "b", "a",
                new RoleResolution("a", null, ResolutionRule.INITIATOR_PAYS), SubscriptionTier.STANDARD,
                new UnitPrice(BillingUnit.WORD_BUCKET, 11, 1, 0), freeChat, NOW)
            .activate(NOW);
    }

    @Test
    @DisplayName("Each message rounds up to whole buckets on its own")
    void wordBucketsPerMessage() {
        BillingSession chat = session(SessionType.CHAT, BillingUnit.WORD_BUCKET, 11);

        chat = meter.recordActivity(chat, 11, NOW);
        assertEquals(1, meter.unitsDue(chat));

        chat = meter.recordActivity(chat, 12, NOW);
        assertEquals(3, meter.unitsDue(chat));

        chat = meter.recordActivity(chat, 1, NOW);
        assertEquals(4, meter.unitsDue(chat));
        assertEquals(24, chat.getUsageAccrued());
    }

    @Test
    @DisplayName("Minutes round up over the whole call and are never billed twice")
    void minutesOverWholeCall() {
        BillingSession call = session(SessionType.VOICE_CALL, BillingUnit.MINUTE, 60);

        call = meter.recordActivity(call, 30, NOW);
        assertEquals(1, meter.unitsDue(call));
        call = call.recordBilled(1, 10, 8);

        call = meter.recordActivity(call, 30, NOW);
        assertEquals(0, meter.unitsDue(call));
        assertFalse(meter.shouldBill(call));

        call = meter.recordActivity(call, 1, NOW);
        assertEquals(1, meter.unitsDue(call));
        assertTrue(meter.shouldBill(call));
    }

    @Test
    @DisplayName("Zero usage only refreshes the activity time")
    void zeroUsageTouches() {
        BillingSession call = session(SessionType.VOICE_CALL, BillingUnit.MINUTE, 60);
        Instant later = NOW.plusSeconds(90);

        BillingSession touched = meter.recordActivity(call, 0, later);

        assertEquals(0, touched.getUsageAccrued());
        assertEquals(later, touched.getLastActivityAt());
    }

    @Test
    void negativeUsageRejected() {
        BillingSession call = session(SessionType.VOICE_CALL, BillingUnit.MINUTE, 60);

        assertThrows(IllegalArgumentException.class, () -> meter.recordActivity(call, -1, NOW));
    }

    @Test
    @DisplayName("Each sender's first messages are free, later ones are metered")
    void freeMessagesPerSender() {
        BillingSession chat = platformChat(new FreeChatAllowance(2, 0));

        chat = meter.recordMessage(chat, "a", 30, NOW);
        chat = meter.recordMessage(chat, "a", 30, NOW);
        chat = meter.recordMessage(chat, "b", 30, NOW);
        assertEquals(0, meter.unitsDue(chat));
        assertEquals(3, chat.getFreeMessagesUsed());

        chat = meter.recordMessage(chat, "a", 12, NOW);
        assertEquals(2, meter.unitsDue(chat));
        assertTrue(chat.hasFreeMessageLeft("b"));
        assertFalse(chat.hasFreeMessageLeft("a"));
    }

    @Test
    @DisplayName("A capped free pool covers billable messages until it runs out")
    void cappedFreePool() {
        BillingSession chat = platformChat(new FreeChatAllowance(0, 2));

        chat = meter.recordMessage(chat, "a", 0, NOW);
        assertEquals(0, chat.getFreePoolMessagesUsed(), "an empty message does not use the pool");

        chat = meter.recordMessage(chat, "a", 5, NOW);
        chat = meter.recordMessage(chat, "b", 5, NOW);
        assertEquals(0, meter.unitsDue(chat));
        assertFalse(chat.hasFreePoolMessageLeft());

        chat = meter.recordMessage(chat, "b", 5, NOW);
        assertEquals(1, meter.unitsDue(chat));
    }

    @Test
    @DisplayName("An unlimited free pool never meters a message")
    void unlimitedFreePool() {
        BillingSession chat = platformChat(new FreeChatAllowance(0, FreeChatAllowance.UNLIMITED));

        for (int i = 0; i < 500; i++) {
            chat = meter.recordMessage(chat, i % 2 == 0 ? "a" : "b", 40, NOW);
        }

        assertEquals(0, meter.unitsDue(chat));
        assertEquals(500, chat.getFreeMessagesUsed());
        assertTrue(chat.hasFreePoolMessageLeft());
    }
}
