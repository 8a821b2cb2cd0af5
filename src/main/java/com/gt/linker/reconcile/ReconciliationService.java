package com.gt.linker.reconcile;

import com.gt.linker.exception.IdentityUnresolvableException;
import com.gt.linker.exception.LocalPersistenceException;
import com.gt.linker.exception.NotAuthenticatedException;
import com.gt.linker.exception.RemoteRejectedException;
import com.gt.linker.exception.RemoteUnreachableException;
import com.gt.linker.identity.IdentityResolver;
import com.gt.linker.knowledgePoint.KeyedMutationQueue;
import com.gt.linker.local.LocalKnowledgePointService;
import com.gt.linker.model.CompositeKnowledgePointId;
import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.reconcile.model.ConflictReason;
import com.gt.linker.reconcile.model.ReconciliationConflict;
import com.gt.linker.reconcile.model.ReconciliationResult;
import com.gt.linker.reconcile.model.SyncStatus;
import com.gt.linker.remote.RemoteKnowledgePointService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Promotes guest knowledge points to the remote store.
 * <p>
 * Each local-only point is either adopted (a remote point with the same category and correct phrase
 * already exists) or created remotely. Only after the remote side holds the point is the local row
 * removed, so a failure at any step leaves the guest point in place for the next run.
 * <p>
 * Each promotion holds the point's slot in the {@link KeyedMutationQueue}, so it never overlaps a delete or
 * mastery update of the same guest point. The guest row is re-read inside the slot and skipped if it is gone.
 */
@Component
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final LocalKnowledgePointService localKnowledgePointService;
    private final RemoteKnowledgePointService remoteKnowledgePointService;
    private final IdentityResolver identityResolver;
    private final KeyedMutationQueue mutationQueue;
    private final Clock clock;
    private final int recentErrorLimit;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Deque<String> recentErrors = new ArrayDeque<>();
    private volatile Instant lastSyncInstant;

    @Autowired
    public ReconciliationService(LocalKnowledgePointService localKnowledgePointService,
                                 RemoteKnowledgePointService remoteKnowledgePointService,
                                 IdentityResolver identityResolver,
                                 KeyedMutationQueue mutationQueue,
                                 Clock clock,
                                 @Value("${linker.reconcile.recentErrorLimit:10}") int recentErrorLimit) {
        this.localKnowledgePointService = localKnowledgePointService;
        this.remoteKnowledgePointService = remoteKnowledgePointService;
        this.identityResolver = identityResolver;
        this.mutationQueue = mutationQueue;
        this.clock = clock;
        this.recentErrorLimit = recentErrorLimit;
    }

    public ReconciliationResult reconcile(List<KnowledgePoint> localPoints, List<KnowledgePoint> remotePoints) {
        List<KnowledgePoint> promoted = new ArrayList<>();
        List<ReconciliationConflict> conflicts = new ArrayList<>();
        List<KnowledgePoint> passedThrough = new ArrayList<>();
        List<KnowledgePoint> knownRemotePoints = new ArrayList<>(remotePoints);

        List<KnowledgePoint> pending = new ArrayList<>();
        for (KnowledgePoint localPoint : localPoints) {
            if (localPoint.isLocalOnly()) {
                pending.add(localPoint);
            } else {
                passedThrough.add(localPoint);
            }
        }

        for (int i = 0; i < pending.size(); i++) {
            KnowledgePoint localPoint = pending.get(i);

            if (Thread.currentThread().isInterrupted()) {
                log.info("Reconciliation cancelled with {} knowledge points left", pending.size() - i);
                pending.subList(i, pending.size()).forEach(point ->
                        conflicts.add(new ReconciliationConflict(point, ConflictReason.Cancelled, "Reconciliation cancelled")));
                break;
            }

            try {
                Optional<KnowledgePoint> promotedPoint = promoteInMutationSlot(localPoint, knownRemotePoints);
                promotedPoint.ifPresent(promoted::add);
            } catch (RemoteUnreachableException ex) {
                conflicts.add(new ReconciliationConflict(localPoint, ConflictReason.RemoteUnreachable, ex.getMessage()));
            } catch (RemoteRejectedException ex) {
                conflicts.add(new ReconciliationConflict(localPoint, ConflictReason.RemoteRejected, ex.getMessage()));
            } catch (IdentityUnresolvableException ex) {
                conflicts.add(new ReconciliationConflict(localPoint, ConflictReason.Unidentifiable, ex.getMessage()));
            } catch (NotAuthenticatedException ex) {
                log.info("Session ended during reconciliation, stopping");
                pending.subList(i, pending.size()).forEach(point ->
                        conflicts.add(new ReconciliationConflict(point, ConflictReason.Cancelled, ex.getMessage())));
                break;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.info("Reconciliation cancelled while waiting on knowledge point writes, {} left", pending.size() - i);
                pending.subList(i, pending.size()).forEach(point ->
                        conflicts.add(new ReconciliationConflict(point, ConflictReason.Cancelled, "Reconciliation cancelled")));
                break;
            }
        }

        log.info("Reconciliation promoted {} knowledge points with {} conflicts, {} passed through",
                promoted.size(), conflicts.size(), passedThrough.size());

        return new ReconciliationResult(promoted, conflicts, passedThrough);
    }

    // Returns empty when another run is already in progress
    public Optional<ReconciliationResult> reconcileNow() {
        if (!running.compareAndSet(false, true)) {
            log.info("Reconciliation already running, skipping trigger");
            return Optional.empty();
        }

        try {
            remoteKnowledgePointService.evictAll();

            List<KnowledgePoint> remotePoints = new ArrayList<>(remoteKnowledgePointService.fetchActive());
            remotePoints.addAll(remoteKnowledgePointService.fetchArchived());

            ReconciliationResult result = reconcile(localKnowledgePointService.loadAll(), remotePoints);

            lastSyncInstant = clock.instant();
            result.conflicts().forEach(conflict -> recordError(conflict.message()));

            return Optional.of(result);
        } catch (RemoteUnreachableException | RemoteRejectedException ex) {
            recordError(ex.getMessage());
            throw ex;
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<Instant> getLastSyncInstant() {
        return Optional.ofNullable(lastSyncInstant);
    }

    public SyncStatus getStatus() {
        List<String> errors;
        synchronized (recentErrors) {
            errors = List.copyOf(recentErrors);
        }

        return new SyncStatus(running.get(), localKnowledgePointService.countLocalOnly(), lastSyncInstant, errors);
    }

    private Optional<KnowledgePoint> promoteInMutationSlot(KnowledgePoint snapshot, List<KnowledgePoint> knownRemotePoints)
            throws InterruptedException {
        CompletableFuture<Optional<KnowledgePoint>> slot = mutationQueue.submit(identityResolver.effectiveId(snapshot), () -> {
            Optional<KnowledgePoint> current = localKnowledgePointService.findLocalOnly(snapshot.category(), snapshot.correctPhrase());
            if (current.isEmpty()) {
                log.info("Guest point in category {} was removed before it could be promoted, skipping", snapshot.category());
                return Optional.empty();
            }

            KnowledgePoint promotedPoint = promote(current.get(), knownRemotePoints);
            knownRemotePoints.add(promotedPoint);
            removeLocalCopy(current.get());

            return Optional.of(promotedPoint);
        });

        try {
            return slot.get();
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException) {
                throw (RuntimeException) ex.getCause();
            }
            throw new IllegalStateException("Promotion of guest point failed", ex.getCause());
        }
    }

    private KnowledgePoint promote(KnowledgePoint localPoint, List<KnowledgePoint> knownRemotePoints) {
        Optional<KnowledgePoint> existing = knownRemotePoints.stream()
                .filter(remotePoint -> remotePoint.hasSameContentKey(localPoint))
                .findFirst();

        if (existing.isPresent()) {
            log.info("Adopting existing remote knowledge point for guest point in category {}", localPoint.category());
            return existing.get();
        }

        CompositeKnowledgePointId compositeId = remoteKnowledgePointService.create(localPoint);
        return localPoint.promotedTo(compositeId, clock.instant());
    }

    // The remote copy already exists at this point, a leftover row is adopted on the next run
    private void removeLocalCopy(KnowledgePoint localPoint) {
        try {
            localKnowledgePointService.removeByContentKey(localPoint.category(), localPoint.correctPhrase());
        } catch (LocalPersistenceException ex) {
            log.error("Promoted knowledge point but failed to remove its guest copy in category " + localPoint.category(), ex);
            recordError(ex.getMessage());
        }
    }

    private void recordError(String message) {
        synchronized (recentErrors) {
            recentErrors.addFirst(message == null ? "Unknown error" : message);
            while (recentErrors.size() > recentErrorLimit) {
                recentErrors.removeLast();
            }
        }
    }
}
