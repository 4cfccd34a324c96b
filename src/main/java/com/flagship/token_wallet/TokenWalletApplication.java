package com.flagship.token_wallet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Token wallet and monetization billing engine.
 *
 * Decides who pays and who earns for chats, calls and bookings, meters usage,
 * and moves value between wallets through an append-only ledger.
 */
@SpringBootApplication
@EnableScheduling
public class TokenWalletApplication {

    public static void main(String[] args) {
        SpringApplication.run(TokenWalletApplication.class, args);
    }
}
