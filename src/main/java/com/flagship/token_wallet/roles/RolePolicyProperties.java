package com.flagship.token_wallet.roles;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Role resolution policy (billing.roles.*).
 */
@Configuration
@ConfigurationProperties(prefix = "billing.roles")
@Validated
@Data
public class RolePolicyProperties {

    /**
     * Category pairs where one side always pays, whoever starts the interaction.
     */
    @Valid
    private List<AsymmetricPair> asymmetricPairs = new ArrayList<>();

    /**
     * Who earns under "initiator pays" when both participants are earner-eligible.
     */
    @NotNull
    private BothEligibleEarner bothEligibleEarner = BothEligibleEarner.RECEIVER;

    public enum BothEligibleEarner {
        /** The non-initiating participant earns. */
        RECEIVER,
        /** Neither participant earns; the platform keeps the charge. */
        PLATFORM
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AsymmetricPair {
        @NotBlank
        private String payingCategory;
        @NotBlank
        private String earningCategory;
    }
}
