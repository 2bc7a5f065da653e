package com.example.aurawatch;

import com.example.aurawatch.config.MonitorConfig;
import com.example.aurawatch.exception.ErrorCode;
import com.example.aurawatch.exception.StoreException;
import com.example.aurawatch.model.ValidatorIdentity;
import com.example.aurawatch.service.IdentityResolver;
import com.example.aurawatch.service.PollScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Startup sequence: validate settings, resolve and confirm the identity, then poll.
 */
@Component
@ConditionalOnProperty(name = "monitor.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MonitorRunner implements CommandLineRunner {

    private final MonitorConfig config;
    private final IdentityResolver identityResolver;
    private final PollScheduler pollScheduler;

    @Override
    public void run(String... args) {
        config.validate();

        ValidatorIdentity identity = identityResolver.resolve();
        identityResolver.confirm(identity);

        log.info("Monitoring {} (epoch size {}, {} mode, store {})", identity.toHex(), config.getEpochSize(),
                config.isWatch() ? "watch" : "one-shot", config.getStore().isEnabled() ? "enabled" : "disabled");
        try {
            pollScheduler.run(identity);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreException(ErrorCode.STORE_WRITE_FAILED, "schedule store failure: " + e.getMessage(), e);
        }
    }
}
