package com.gt.linker.reconcile;

import com.gt.linker.exception.RemoteUnreachableException;
import com.gt.linker.local.LocalKnowledgePointService;
import com.gt.linker.remote.RemoteKnowledgePointService;
import com.gt.linker.session.AuthSession;
import com.gt.linker.session.AuthenticatedEvent;
import com.gt.linker.session.LoggedOutEvent;
import com.gt.linker.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class ReconciliationTriggerTests {

    private static final int FOREGROUND_THRESHOLD_MINUTES = 15;
    private static final long AUTO_SYNC_INTERVAL_MS = Duration.ofHours(1).toMillis();

    @Mock private ReconciliationService reconciliationService;
    @Mock private RemoteKnowledgePointService remoteKnowledgePointService;
    @Mock private LocalKnowledgePointService localKnowledgePointService;
    @Mock private AuthSession authSession;
    @Mock private Clock clock;

    private ReconciliationTrigger reconciliationTrigger;

    @BeforeEach
    public void setup() {
        reconciliationTrigger = new ReconciliationTrigger(
                reconciliationService,
                remoteKnowledgePointService,
                localKnowledgePointService,
                authSession,
                new TaskExecutorAdapter(Runnable::run),
                clock,
                FOREGROUND_THRESHOLD_MINUTES,
                AUTO_SYNC_INTERVAL_MS);

        when(clock.instant()).thenReturn(TestUtils.TEST_NOW);
        when(authSession.isAuthenticated()).thenReturn(true);
        when(reconciliationService.reconcileNow()).thenReturn(Optional.empty());
    }

    @Test
    public void testLoginTriggersReconciliation() {
        reconciliationTrigger.onAuthenticated(new AuthenticatedEvent(7));

        verify(remoteKnowledgePointService, times(1)).evictAll();
        verify(reconciliationService, times(1)).reconcileNow();
    }

    @Test
    public void testLogoutClearsCachedRemoteData() {
        reconciliationTrigger.onLoggedOut(new LoggedOutEvent(7L));

        verify(localKnowledgePointService, times(1)).clearCachedRemotePoints();
        verify(remoteKnowledgePointService, times(1)).evictAll();
        verify(reconciliationService, never()).reconcileNow();
    }

    @Test
    public void testLongBackgroundTriggersOnForeground() {
        reconciliationTrigger.onBackground();
        when(clock.instant()).thenReturn(TestUtils.TEST_NOW.plus(Duration.ofMinutes(20)));

        reconciliationTrigger.onForeground();

        verify(reconciliationService, times(1)).reconcileNow();
    }

    @Test
    public void testShortBackgroundDoesNotTrigger() {
        reconciliationTrigger.onBackground();
        when(clock.instant()).thenReturn(TestUtils.TEST_NOW.plus(Duration.ofMinutes(5)));

        reconciliationTrigger.onForeground();
        reconciliationTrigger.onForeground();

        verify(reconciliationService, never()).reconcileNow();
    }

    @Test
    public void testForegroundWhileLoggedOutDoesNotTrigger() {
        when(authSession.isAuthenticated()).thenReturn(false);
        reconciliationTrigger.onBackground();
        when(clock.instant()).thenReturn(TestUtils.TEST_NOW.plus(Duration.ofHours(2)));

        reconciliationTrigger.onForeground();

        verify(reconciliationService, never()).reconcileNow();
    }

    @Test
    public void testAutoSyncRunsWhenPointsPendingAndSyncIsStale() {
        when(localKnowledgePointService.countLocalOnly()).thenReturn(2);
        when(reconciliationService.getLastSyncInstant()).thenReturn(Optional.of(TestUtils.TEST_NOW.minus(Duration.ofHours(2))));

        reconciliationTrigger.autoSync();

        verify(reconciliationService, times(1)).reconcileNow();
    }

    @Test
    public void testAutoSyncSkipsRecentSync() {
        when(localKnowledgePointService.countLocalOnly()).thenReturn(2);
        when(reconciliationService.getLastSyncInstant()).thenReturn(Optional.of(TestUtils.TEST_NOW.minus(Duration.ofMinutes(10))));

        reconciliationTrigger.autoSync();

        verify(reconciliationService, never()).reconcileNow();
    }

    @Test
    public void testAutoSyncSkipsWithNothingPending() {
        when(localKnowledgePointService.countLocalOnly()).thenReturn(0);

        reconciliationTrigger.autoSync();

        verify(reconciliationService, never()).reconcileNow();
    }

    @Test
    public void testFailedRunDoesNotEscapeTrigger() {
        when(reconciliationService.reconcileNow()).thenThrow(new RemoteUnreachableException("timeout"));
        when(reconciliationService.getLastSyncInstant()).thenReturn(Optional.<Instant>empty());
        when(localKnowledgePointService.countLocalOnly()).thenReturn(1);

        assertDoesNotThrow(() -> reconciliationTrigger.autoSync());
        assertTrue(reconciliationTrigger.triggerInBackground("retry"));
        verify(reconciliationService, times(2)).reconcileNow();
    }
}
