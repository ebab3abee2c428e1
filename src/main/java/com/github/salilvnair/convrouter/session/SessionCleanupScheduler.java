package com.github.salilvnair.convrouter.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "convrouter.session", name = "cleanup-enabled", havingValue = "true", matchIfMissing = true)
public class SessionCleanupScheduler {

    private final ContextManager contextManager;

    @Scheduled(
            initialDelayString = "${convrouter.session.cleanup-interval-ms:60000}",
            fixedDelayString = "${convrouter.session.cleanup-interval-ms:60000}"
    )
    public void sweep() {
        try {
            int removed = contextManager.cleanupExpiredSessions();
            log.debug("Session sweep finished, {} removed", removed);
        } catch (RuntimeException e) {
            log.error("Session sweep failed: {}", e.getMessage(), e);
        }
    }
}
