package com.flagship.token_wallet.wallet;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Makes sure the platform revenue and escrow holding wallets exist before traffic arrives.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SystemWalletInitializer implements ApplicationRunner {

    private final WalletAccountService accountService;
    private final LedgerProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        accountService.openWallet(properties.getPlatformWalletId());
        accountService.openWallet(properties.getEscrowWalletId());
        log.info("System wallets ready: platform={}, escrow={}",
            properties.getPlatformWalletId(), properties.getEscrowWalletId());
    }
}
