package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_wallet.pricing.SubscriptionTier;
import com.flagship.token_wallet.roles.ParticipantProfile;
import com.flagship.token_wallet.roles.Popularity;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Monetization profile of a participant as known by the caller at session start.
 */
@Value
@Builder
@Jacksonized
public class ParticipantRequest {

    @NotBlank(message = "User ID is required")
    @JsonProperty("user_id")
    String userId;

    @JsonProperty("category")
    String category;

    @JsonProperty("earner_eligible")
    boolean earnerEligible;

    @JsonProperty("monetization_active")
    boolean monetizationActive;

    @JsonProperty("tier")
    SubscriptionTier tier;

    @JsonProperty("popularity")
    Popularity popularity;

    @Min(value = 0, message = "Account age must not be negative")
    @JsonProperty("account_age_days")
    int accountAgeDays;

    @JsonProperty("free_pool_restricted")
    boolean freePoolRestricted;

    public ParticipantProfile toProfile() {
        return ParticipantProfile.builder()
            .userId(userId)
            .category(category)
            .earnerEligible(earnerEligible)
            .monetizationActive(monetizationActive)
            .tier(tier != null ? tier : SubscriptionTier.STANDARD)
            .popularity(popularity != null ? popularity : Popularity.HIGH)
            .accountAgeDays(accountAgeDays)
            .freePoolRestricted(freePoolRestricted)
            .build();
    }
}
