package com.flagship.token_wallet.health;

import com.flagship.token_wallet.wallet.LedgerProperties;
import com.flagship.token_wallet.wallet.WalletLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and readiness endpoint that needs no actuator authorization.
 *
 * The service is ready once the database answers and the platform revenue and escrow
 * wallets exist; no charge or booking can settle without them.
 */
@RestController
@Slf4j
public class HealthController {

    private final WalletLedger walletLedger;
    private final LedgerProperties ledgerProperties;
    private final Clock clock;

    public HealthController(WalletLedger walletLedger, LedgerProperties ledgerProperties, Clock clock) {
        this.walletLedger = walletLedger;
        this.ledgerProperties = ledgerProperties;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        String systemWallets;
        try {
            boolean present = walletLedger.getWallet(ledgerProperties.getPlatformWalletId()).isPresent()
                && walletLedger.getWallet(ledgerProperties.getEscrowWalletId()).isPresent();
            response.put("database", "UP");
            systemWallets = present ? "UP" : "MISSING";
        } catch (DataAccessException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            response.put("database", "DOWN");
            systemWallets = "UNKNOWN";
        }
        response.put("system_wallets", systemWallets);

        if (!"UP".equals(systemWallets)) {
            response.put("status", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
