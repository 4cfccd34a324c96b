package com.flagship.token_wallet.roles;

import com.flagship.token_wallet.session.SessionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Decides who pays and who earns for a new session.
 *
 * Rules, first match wins:
 * <ol>
 *   <li>Earner override: exactly one participant is earner-eligible with monetization on.
 *       That participant earns and the other pays.</li>
 *   <li>Asymmetric pairing: a configured (paying, earning) category pair matches in either
 *       order. The paying-category participant pays; the other earns when eligible,
 *       otherwise the platform earns.</li>
 *   <li>Initiator pays: the earner is the other participant when only they are eligible,
 *       chosen by policy when both are, and the platform otherwise.</li>
 * </ol>
 *
 * Stateless and deterministic. The current rules do not look at the session type.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoleResolver {

    private final RolePolicyProperties policy;

    public RoleResolution resolve(ParticipantProfile participantA,
                                  ParticipantProfile participantB,
                                  SessionType sessionType,
                                  String initiatorId) {
        Objects.requireNonNull(participantA, "participantA");
        Objects.requireNonNull(participantB, "participantB");
        Objects.requireNonNull(sessionType, "sessionType");
        if (participantA.getUserId().equals(participantB.getUserId())) {
            throw new IllegalArgumentException("Participants must be distinct: " + participantA.getUserId());
        }
        ParticipantProfile initiator = pick(participantA, participantB, initiatorId);
        ParticipantProfile receiver = initiator == participantA ? participantB : participantA;

        RoleResolution resolution = earnerOverride(participantA, participantB);
        if (resolution == null) {
            resolution = asymmetricPairing(participantA, participantB);
        }
        if (resolution == null) {
            resolution = initiatorPays(initiator, receiver);
        }

        log.debug("Resolved roles for {} session: payer={}, earner={}, rule={}",
            sessionType, resolution.getPayerId(),
            resolution.isPlatformEarner() ? "platform" : resolution.getEarnerId(), resolution.getRule());
        return resolution;
    }

    private RoleResolution earnerOverride(ParticipantProfile a, ParticipantProfile b) {
        if (a.isMonetizedEarner() == b.isMonetizedEarner()) {
            return null;
        }
        ParticipantProfile earner = a.isMonetizedEarner() ? a : b;
        ParticipantProfile payer = earner == a ? b : a;
        return new RoleResolution(payer.getUserId(), earner.getUserId(), ResolutionRule.EARNER_OVERRIDE);
    }

    private RoleResolution asymmetricPairing(ParticipantProfile a, ParticipantProfile b) {
        for (RolePolicyProperties.AsymmetricPair pair : policy.getAsymmetricPairs()) {
            ParticipantProfile payer = null;
            if (pair.getPayingCategory().equals(a.getCategory()) && pair.getEarningCategory().equals(b.getCategory())) {
                payer = a;
            } else if (pair.getPayingCategory().equals(b.getCategory()) && pair.getEarningCategory().equals(a.getCategory())) {
                payer = b;
            }
            if (payer != null) {
                ParticipantProfile other = payer == a ? b : a;
                String earnerId = other.isEarnerEligible() ? other.getUserId() : null;
                return new RoleResolution(payer.getUserId(), earnerId, ResolutionRule.ASYMMETRIC_PAIRING);
            }
        }
        return null;
    }

    private RoleResolution initiatorPays(ParticipantProfile initiator, ParticipantProfile receiver) {
        String earnerId;
        if (receiver.isEarnerEligible() && initiator.isEarnerEligible()) {
            earnerId = policy.getBothEligibleEarner() == RolePolicyProperties.BothEligibleEarner.RECEIVER
                ? receiver.getUserId()
                : null;
        } else if (receiver.isEarnerEligible()) {
            earnerId = receiver.getUserId();
        } else {
            earnerId = null;
        }
        return new RoleResolution(initiator.getUserId(), earnerId, ResolutionRule.INITIATOR_PAYS);
    }

    private ParticipantProfile pick(ParticipantProfile a, ParticipantProfile b, String initiatorId) {
        if (a.getUserId().equals(initiatorId)) {
            return a;
        }
        if (b.getUserId().equals(initiatorId)) {
            return b;
        }
        throw new IllegalArgumentException("Initiator " + initiatorId + " is not a participant");
    }
}
