package com.github.salilvnair.convrouter.session;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.github.salilvnair.convrouter.support.TestConstants.BOOM;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionCleanupSchedulerTest {

    @Mock
    private ContextManager contextManager;

    @Test
    void sweepDelegatesToContextManager() {
        when(contextManager.cleanupExpiredSessions()).thenReturn(2);

        new SessionCleanupScheduler(contextManager).sweep();

        verify(contextManager, times(1)).cleanupExpiredSessions();
    }

    @Test
    void sweepFailureIsContained() {
        when(contextManager.cleanupExpiredSessions()).thenThrow(new IllegalStateException(BOOM));

        assertDoesNotThrow(() -> new SessionCleanupScheduler(contextManager).sweep());
    }
}
