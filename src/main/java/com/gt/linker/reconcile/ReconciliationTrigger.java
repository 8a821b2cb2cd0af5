package com.gt.linker.reconcile;

import com.gt.linker.conf.BeanConfig;
import com.gt.linker.local.LocalKnowledgePointService;
import com.gt.linker.remote.RemoteKnowledgePointService;
import com.gt.linker.session.AuthSession;
import com.gt.linker.session.AuthenticatedEvent;
import com.gt.linker.session.LoggedOutEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Future;

/**
 * Decides when reconciliation runs: after login, on returning to the foreground after a long
 * background period, and periodically while guest points are still waiting for promotion.
 */
@Component
public class ReconciliationTrigger {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationTrigger.class);

    private final ReconciliationService reconciliationService;
    private final RemoteKnowledgePointService remoteKnowledgePointService;
    private final LocalKnowledgePointService localKnowledgePointService;
    private final AuthSession authSession;
    private final AsyncTaskExecutor reconciliationExecutor;
    private final Clock clock;
    private final Duration foregroundThreshold;
    private final Duration autoSyncInterval;

    private Future<?> currentRun;
    private volatile Instant backgroundedAt;

    @Autowired
    public ReconciliationTrigger(ReconciliationService reconciliationService,
                                 RemoteKnowledgePointService remoteKnowledgePointService,
                                 LocalKnowledgePointService localKnowledgePointService,
                                 AuthSession authSession,
                                 @Qualifier(BeanConfig.RECONCILIATION_EXECUTOR) AsyncTaskExecutor reconciliationExecutor,
                                 Clock clock,
                                 @Value("${linker.reconcile.foregroundThresholdMinutes:15}") int foregroundThresholdMinutes,
                                 @Value("${linker.reconcile.autoSyncIntervalMs:3600000}") long autoSyncIntervalMs) {
        this.reconciliationService = reconciliationService;
        this.remoteKnowledgePointService = remoteKnowledgePointService;
        this.localKnowledgePointService = localKnowledgePointService;
        this.authSession = authSession;
        this.reconciliationExecutor = reconciliationExecutor;
        this.clock = clock;
        this.foregroundThreshold = Duration.ofMinutes(foregroundThresholdMinutes);
        this.autoSyncInterval = Duration.ofMillis(autoSyncIntervalMs);
    }

    @EventListener
    public void onAuthenticated(AuthenticatedEvent event) {
        remoteKnowledgePointService.evictAll();
        triggerInBackground("login of owner " + event.ownerId());
    }

    @EventListener
    public void onLoggedOut(LoggedOutEvent event) {
        cancelCurrentRun();

        localKnowledgePointService.clearCachedRemotePoints();
        remoteKnowledgePointService.evictAll();
    }

    public void onBackground() {
        backgroundedAt = clock.instant();
    }

    public void onForeground() {
        Instant since = backgroundedAt;
        backgroundedAt = null;

        if (since == null || !authSession.isAuthenticated()) {
            return;
        }

        Duration away = Duration.between(since, clock.instant());
        if (away.compareTo(foregroundThreshold) > 0) {
            triggerInBackground("foreground after " + away.toMinutes() + " minutes");
        }
    }

    @Scheduled(fixedDelayString = "${linker.reconcile.autoSyncCheckMs:60000}", initialDelayString = "${linker.reconcile.autoSyncCheckMs:60000}")
    public void autoSync() {
        if (!authSession.isAuthenticated() || localKnowledgePointService.countLocalOnly() == 0) {
            return;
        }

        Optional<Instant> lastSync = reconciliationService.getLastSyncInstant();
        if (lastSync.isEmpty() || Duration.between(lastSync.get(), clock.instant()).compareTo(autoSyncInterval) >= 0) {
            triggerInBackground("auto-sync");
        }
    }

    public synchronized boolean triggerInBackground(String reason) {
        if (currentRun != null && !currentRun.isDone()) {
            log.info("Reconciliation already scheduled, ignoring trigger: {}", reason);
            return false;
        }

        log.info("Triggering reconciliation: {}", reason);
        currentRun = reconciliationExecutor.submit(() -> runReconciliation(reason));

        return true;
    }

    synchronized void cancelCurrentRun() {
        if (currentRun != null && !currentRun.isDone()) {
            log.info("Cancelling in-flight reconciliation");
            currentRun.cancel(true);
        }
        currentRun = null;
    }

    private void runReconciliation(String reason) {
        try {
            reconciliationService.reconcileNow();
        } catch (RuntimeException ex) {
            // Guest points stay in place and the failure is reported through the sync status
            log.warn("Reconciliation triggered by " + reason + " failed", ex);
        }
    }
}
