package com.flagship.token_wallet.roles;

import com.flagship.token_wallet.session.SessionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoleResolverTest {

    private RolePolicyProperties policy;
    private RoleResolver resolver;

    @BeforeEach
    void setUp() {
        policy = new RolePolicyProperties();
        policy.setAsymmetricPairs(List.of(new RolePolicyProperties.AsymmetricPair("regular", "creator")));
        resolver = new RoleResolver(policy);
    }

    private static ParticipantProfile user(String id, String category, boolean eligible, boolean monetized) {
        return ParticipantProfile.builder()
            .userId(id)
            .category(category)
            .earnerEligible(eligible)
            .monetizationActive(monetized)
            .build();
    }

    @Nested
    @DisplayName("Earner override")
    class EarnerOverride {

        @Test
        @DisplayName("The only monetized earner earns even when they start the chat")
        void monetizedInitiatorStillEarns() {
            ParticipantProfile influencer = user("inf", "member", true, true);
            ParticipantProfile fan = user("fan", "member", false, false);

            RoleResolution roles = resolver.resolve(influencer, fan, SessionType.CHAT, "inf");

            assertEquals("fan", roles.getPayerId());
            assertEquals("inf", roles.getEarnerId());
            assertEquals(ResolutionRule.EARNER_OVERRIDE, roles.getRule());
        }

        @Test
        @DisplayName("Override wins over an asymmetric pair pointing the other way")
        void overrideBeatsPairing() {
            ParticipantProfile regular = user("reg", "regular", true, true);
            ParticipantProfile creator = user("cre", "creator", true, false);

            RoleResolution roles = resolver.resolve(regular, creator, SessionType.VOICE_CALL, "cre");

            assertEquals("cre", roles.getPayerId());
            assertEquals("reg", roles.getEarnerId());
        }
    }

    @Nested
    @DisplayName("Asymmetric pairing")
    class AsymmetricPairing {

        @Test
        @DisplayName("The paying category pays whichever side initiates")
        void payingCategoryPaysRegardlessOfInitiator() {
            ParticipantProfile regular = user("reg", "regular", false, false);
            ParticipantProfile creator = user("cre", "creator", true, false);

            RoleResolution startedByCreator = resolver.resolve(creator, regular, SessionType.VIDEO_CALL, "cre");
            RoleResolution startedByRegular = resolver.resolve(regular, creator, SessionType.VIDEO_CALL, "reg");

            for (RoleResolution roles : List.of(startedByCreator, startedByRegular)) {
                assertEquals("reg", roles.getPayerId());
                assertEquals("cre", roles.getEarnerId());
                assertEquals(ResolutionRule.ASYMMETRIC_PAIRING, roles.getRule());
            }
        }

        @Test
        @DisplayName("An ineligible earning-category participant leaves the platform as earner")
        void ineligibleEarnerFallsBackToPlatform() {
            ParticipantProfile regular = user("reg", "regular", false, false);
            ParticipantProfile creator = user("cre", "creator", false, false);

            RoleResolution roles = resolver.resolve(regular, creator, SessionType.CHAT, "cre");

            assertEquals("reg", roles.getPayerId());
            assertTrue(roles.isPlatformEarner());
        }
    }

    @Nested
    @DisplayName("Initiator pays")
    class InitiatorPays {

        @Test
        @DisplayName("Neither eligible: initiator pays and the platform earns")
        void noEligibleEarner() {
            RoleResolution roles = resolver.resolve(
                user("a", "member", false, false), user("b", "member", false, false), SessionType.CHAT, "b");

            assertEquals("b", roles.getPayerId());
            assertNull(roles.getEarnerId());
            assertEquals(ResolutionRule.INITIATOR_PAYS, roles.getRule());
        }

        @Test
        @DisplayName("Only the receiver eligible: receiver earns")
        void receiverEligible() {
            RoleResolution roles = resolver.resolve(
                user("a", "member", false, false), user("b", "member", true, false), SessionType.CHAT, "a");

            assertEquals("a", roles.getPayerId());
            assertEquals("b", roles.getEarnerId());
        }

        @Test
        @DisplayName("Only the initiator eligible: initiator pays and the platform earns")
        void initiatorEligibleOnly() {
            RoleResolution roles = resolver.resolve(
                user("a", "member", true, false), user("b", "member", false, false), SessionType.CHAT, "a");

            assertEquals("a", roles.getPayerId());
            assertTrue(roles.isPlatformEarner());
        }

        @Test
        @DisplayName("Both eligible: the configured policy picks the receiver or the platform")
        void bothEligibleFollowsPolicy() {
            ParticipantProfile a = user("a", "member", true, false);
            ParticipantProfile b = user("b", "member", true, false);

            assertEquals("b", resolver.resolve(a, b, SessionType.CHAT, "a").getEarnerId());

            policy.setBothEligibleEarner(RolePolicyProperties.BothEligibleEarner.PLATFORM);
            assertNull(resolver.resolve(a, b, SessionType.CHAT, "a").getEarnerId());
        }

        @Test
        @DisplayName("Both monetized cancels the override and falls through to initiator pays")
        void bothMonetized() {
            RoleResolution roles = resolver.resolve(
                user("a", "member", true, true), user("b", "member", true, true), SessionType.CHAT, "b");

            assertEquals("b", roles.getPayerId());
            assertEquals("a", roles.getEarnerId());
            assertEquals(ResolutionRule.INITIATOR_PAYS, roles.getRule());
        }
    }

    @Test
    @DisplayName("Same inputs always give the same roles")
    void deterministic() {
        ParticipantProfile a = user("a", "regular", false, false);
        ParticipantProfile b = user("b", "creator", true, false);

        assertEquals(resolver.resolve(a, b, SessionType.CHAT, "a"), resolver.resolve(a, b, SessionType.CHAT, "a"));
    }

    @Test
    @DisplayName("An initiator who is not a participant is rejected")
    void unknownInitiator() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(
            user("a", "member", false, false), user("b", "member", false, false), SessionType.CHAT, "c"));
    }

    @Test
    @DisplayName("A user cannot start a session with themselves")
    void sameUserTwice() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(
            user("a", "member", false, false), user("a", "member", true, true), SessionType.CHAT, "a"));
    }
}
