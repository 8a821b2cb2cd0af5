package com.gt.linker.knowledgePoint;

import com.gt.linker.exception.IdentityUnresolvableException;
import com.gt.linker.exception.InvalidKnowledgePointException;
import com.gt.linker.exception.KnowledgePointNotFoundException;
import com.gt.linker.exception.LocalPersistenceException;
import com.gt.linker.exception.RemoteRejectedException;
import com.gt.linker.exception.RemoteUnreachableException;
import com.gt.linker.identity.IdentityResolver;
import com.gt.linker.knowledgePoint.model.BatchActionResult;
import com.gt.linker.knowledgePoint.model.KnowledgePointFilter;
import com.gt.linker.knowledgePoint.model.KnowledgePointSort;
import com.gt.linker.knowledgePoint.model.KnowledgePointView;
import com.gt.linker.local.LocalKnowledgePointService;
import com.gt.linker.mastery.MasteryEngine;
import com.gt.linker.model.BatchAction;
import com.gt.linker.model.CompositeKnowledgePointId;
import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.model.KnowledgePointContent;
import com.gt.linker.model.ReviewOutcome;
import com.gt.linker.remote.RemoteKnowledgePointKey;
import com.gt.linker.remote.RemoteKnowledgePointService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Single entry point for reading and mutating knowledge points.
 * <p>
 * Reads merge local-only points with remote points, de-duplicated by effective id with the remote copy
 * taking precedence. Writes are routed to whichever store owns the point and are serialized per
 * effective id. While a write is in flight its expected result is shown in place of the stored point;
 * if the store rejects it the previous view is restored and the failure is rethrown.
 */
@Component
public class KnowledgePointRepository {

    private static final Logger log = LoggerFactory.getLogger(KnowledgePointRepository.class);

    private final IdentityResolver identityResolver;
    private final MasteryEngine masteryEngine;
    private final LocalKnowledgePointService localKnowledgePointService;
    private final RemoteKnowledgePointService remoteKnowledgePointService;
    private final KeyedMutationQueue mutationQueue;
    private final Clock clock;

    private final Map<String, PendingView> viewState = new ConcurrentHashMap<>();

    @Autowired
    public KnowledgePointRepository(IdentityResolver identityResolver,
                                    MasteryEngine masteryEngine,
                                    LocalKnowledgePointService localKnowledgePointService,
                                    RemoteKnowledgePointService remoteKnowledgePointService,
                                    KeyedMutationQueue mutationQueue,
                                    Clock clock) {
        this.identityResolver = identityResolver;
        this.masteryEngine = masteryEngine;
        this.localKnowledgePointService = localKnowledgePointService;
        this.remoteKnowledgePointService = remoteKnowledgePointService;
        this.mutationQueue = mutationQueue;
        this.clock = clock;
    }

    public List<KnowledgePointView> fetchActive(KnowledgePointFilter filter) {
        return filterAndSort(mergedPoints(false), filter);
    }

    public List<KnowledgePointView> fetchArchived(KnowledgePointFilter filter) {
        return filterAndSort(mergedPoints(true), filter);
    }

    public KnowledgePointView find(String effectiveId) {
        PendingView pending = viewState.get(effectiveId);
        if (pending != null) {
            if (pending.point() == null) {
                throw new KnowledgePointNotFoundException(effectiveId);
            }
            return toView(pending.point(), effectiveId);
        }

        return toView(locate(effectiveId).point(), effectiveId);
    }

    public CompletableFuture<KnowledgePointView> create(KnowledgePointContent content) {
        if (content == null || content.correctPhrase() == null || content.correctPhrase().isBlank()) {
            throw new InvalidKnowledgePointException("A knowledge point needs a correct phrase");
        }

        KnowledgePoint guestPoint = KnowledgePoint.newGuestPoint(content, clock.instant());
        String pendingId = identityResolver.effectiveId(guestPoint);

        return mutationQueue.submit(pendingId, () -> {
            if (remoteKnowledgePointService.isAvailable()) {
                try {
                    CompositeKnowledgePointId compositeId = remoteKnowledgePointService.create(guestPoint);
                    KnowledgePoint created = guestPoint.promotedTo(compositeId, clock.instant());

                    return toView(created, identityResolver.effectiveId(created));
                } catch (RemoteUnreachableException ex) {
                    log.warn("Server unreachable, keeping new knowledge point as a guest point until the next sync", ex);
                }
            }

            KnowledgePoint saved = localKnowledgePointService.save(guestPoint);
            return toView(saved, pendingId);
        });
    }

    public CompletableFuture<KnowledgePointView> archive(String effectiveId) {
        return setArchived(effectiveId, true);
    }

    public CompletableFuture<KnowledgePointView> unarchive(String effectiveId) {
        return setArchived(effectiveId, false);
    }

    public CompletableFuture<Void> delete(String effectiveId) {
        return mutationQueue.submit(effectiveId, () -> {
            Target target = locate(effectiveId);

            withOptimisticView(effectiveId, null, () -> {
                deleteFromStore(target);
                return null;
            });

            log.info("Deleted knowledge point {}", effectiveId);
            return null;
        });
    }

    public CompletableFuture<KnowledgePointView> updateMastery(String effectiveId, ReviewOutcome outcome) {
        return mutationQueue.submit(effectiveId, () -> {
            Target target = locate(effectiveId);
            KnowledgePoint updated = masteryEngine.applyOutcome(target.point(), outcome, clock.instant());

            withOptimisticView(effectiveId, updated, () -> {
                if (target.local()) {
                    localKnowledgePointService.update(updated)
                            .orElseThrow(() -> new KnowledgePointNotFoundException(effectiveId));
                } else {
                    remoteKnowledgePointService.updateMastery(remoteKey(target.point()), updated);
                }
                return updated;
            });

            return toView(updated, effectiveId);
        });
    }

    public CompletableFuture<BatchActionResult> batchAction(BatchAction action, List<String> effectiveIds) {
        return mutationQueue.submit(effectiveIds, () -> applyBatch(action, effectiveIds));
    }

    private CompletableFuture<KnowledgePointView> setArchived(String effectiveId, boolean archived) {
        return mutationQueue.submit(effectiveId, () -> {
            Target target = locate(effectiveId);
            if (target.point().archived() == archived) {
                return toView(target.point(), effectiveId);
            }

            KnowledgePoint updated = target.point().withArchived(archived, clock.instant());
            withOptimisticView(effectiveId, updated, () -> {
                writeArchived(target, updated, effectiveId);
                return updated;
            });

            return toView(updated, effectiveId);
        });
    }

    private BatchActionResult applyBatch(BatchAction action, List<String> effectiveIds) {
        List<String> succeeded = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        Map<String, Target> remoteTargets = new LinkedHashMap<>();

        for (String effectiveId : effectiveIds.stream().distinct().toList()) {
            try {
                Target target = locate(effectiveId);
                if (isNoOp(action, target.point())) {
                    succeeded.add(effectiveId);
                } else if (target.local()) {
                    applyLocal(action, target, effectiveId);
                    succeeded.add(effectiveId);
                } else {
                    remoteTargets.put(effectiveId, target);
                }
            } catch (KnowledgePointNotFoundException | LocalPersistenceException | IdentityUnresolvableException ex) {
                failures.put(effectiveId, ex.getMessage());
            }
        }

        if (!remoteTargets.isEmpty()) {
            Map<String, PendingView> priorViews = new LinkedHashMap<>();
            remoteTargets.forEach((effectiveId, target) -> {
                priorViews.put(effectiveId, viewState.get(effectiveId));
                viewState.put(effectiveId, new PendingView(batchResultOf(action, target.point())));
            });

            try {
                remoteKnowledgePointService.batchAction(action,
                        remoteTargets.values().stream().map(target -> remoteKey(target.point())).toList());
                remoteTargets.keySet().forEach(viewState::remove);
                succeeded.addAll(remoteTargets.keySet());
            } catch (RemoteUnreachableException | RemoteRejectedException ex) {
                log.warn("Batch " + action.getCode() + " of " + remoteTargets.size() + " remote knowledge points failed", ex);
                priorViews.forEach(this::restoreView);
                remoteTargets.keySet().forEach(effectiveId -> failures.put(effectiveId, ex.getMessage()));
            }
        }

        log.info("Batch {} applied to {} knowledge points, {} failed", action.getCode(), succeeded.size(), failures.size());
        return new BatchActionResult(succeeded, failures);
    }

    private void applyLocal(BatchAction action, Target target, String effectiveId) {
        KnowledgePoint updated = batchResultOf(action, target.point());

        withOptimisticView(effectiveId, updated, () -> {
            if (action == BatchAction.Delete) {
                deleteFromStore(target);
            } else {
                writeArchived(target, updated, effectiveId);
            }
            return null;
        });
    }

    private boolean isNoOp(BatchAction action, KnowledgePoint point) {
        if (action == BatchAction.Archive) {
            return point.archived();
        } else if (action == BatchAction.Unarchive) {
            return !point.archived();
        }

        return false;
    }

    private KnowledgePoint batchResultOf(BatchAction action, KnowledgePoint point) {
        if (action == BatchAction.Delete) {
            return null;
        }

        return point.withArchived(action == BatchAction.Archive, clock.instant());
    }

    private void writeArchived(Target target, KnowledgePoint updated, String effectiveId) {
        if (target.local()) {
            localKnowledgePointService.update(updated)
                    .orElseThrow(() -> new KnowledgePointNotFoundException(effectiveId));
        } else if (updated.archived()) {
            remoteKnowledgePointService.archive(remoteKey(target.point()));
        } else {
            remoteKnowledgePointService.unarchive(remoteKey(target.point()));
        }
    }

    private void deleteFromStore(Target target) {
        if (target.local()) {
            KnowledgePoint point = target.point();
            localKnowledgePointService.removeByContentKey(point.category(), point.correctPhrase());
        } else {
            remoteKnowledgePointService.delete(remoteKey(target.point()));
        }
    }

    // optimistic == null shows the point as deleted until the store call returns
    private <T> T withOptimisticView(String effectiveId, KnowledgePoint optimistic, Supplier<T> storeOperation) {
        PendingView prior = viewState.get(effectiveId);
        viewState.put(effectiveId, new PendingView(optimistic));

        try {
            T result = storeOperation.get();
            viewState.remove(effectiveId);
            return result;
        } catch (RuntimeException ex) {
            log.warn("Reverting knowledge point {} after failed write: {}", effectiveId, ex.getMessage());
            restoreView(effectiveId, prior);
            throw ex;
        }
    }

    private void restoreView(String effectiveId, PendingView prior) {
        if (prior == null) {
            viewState.remove(effectiveId);
        } else {
            viewState.put(effectiveId, prior);
        }
    }

    private Target locate(String effectiveId) {
        for (KnowledgePoint point : localKnowledgePointService.loadLocalOnly()) {
            if (effectiveId.equals(tryEffectiveId(point).orElse(null))) {
                return new Target(point, true);
            }
        }

        if (remoteKnowledgePointService.isAvailable()) {
            for (boolean archived : new boolean[] { false, true }) {
                for (KnowledgePoint point : remoteOrCached(archived)) {
                    if (effectiveId.equals(tryEffectiveId(point).orElse(null))) {
                        return new Target(point, false);
                    }
                }
            }
        }

        throw new KnowledgePointNotFoundException(effectiveId);
    }

    private List<KnowledgePoint> mergedPoints(boolean archived) {
        Map<String, KnowledgePoint> merged = new LinkedHashMap<>();

        for (KnowledgePoint point : localKnowledgePointService.loadLocalOnly()) {
            if (point.archived() == archived) {
                tryEffectiveId(point).ifPresent(id -> merged.put(id, point));
            }
        }

        if (remoteKnowledgePointService.isAvailable()) {
            for (KnowledgePoint point : remoteOrCached(archived)) {
                tryEffectiveId(point).ifPresent(id -> merged.put(id, point));
            }
        }

        viewState.forEach((effectiveId, pending) -> {
            merged.remove(effectiveId);
            if (pending.point() != null && pending.point().archived() == archived) {
                merged.put(effectiveId, pending.point());
            }
        });

        return new ArrayList<>(merged.values());
    }

    private List<KnowledgePoint> remoteOrCached(boolean archived) {
        List<KnowledgePoint> remotePoints;
        try {
            remotePoints = archived ? remoteKnowledgePointService.fetchArchived() : remoteKnowledgePointService.fetchActive();
        } catch (RemoteUnreachableException ex) {
            log.warn("Server unreachable, showing cached {} knowledge points", archived ? "archived" : "active");
            return localKnowledgePointService.loadCachedRemote(archived);
        }

        try {
            localKnowledgePointService.replaceCachedRemotePoints(archived, remotePoints);
        } catch (LocalPersistenceException ex) {
            log.warn("Unable to refresh offline copy of remote knowledge points", ex);
        }

        return remotePoints;
    }

    private List<KnowledgePointView> filterAndSort(List<KnowledgePoint> points, KnowledgePointFilter filter) {
        KnowledgePointFilter effectiveFilter = filter == null ? KnowledgePointFilter.none() : filter;

        Comparator<KnowledgePointView> order = orderFor(effectiveFilter.sortOrDefault());

        return points.stream()
                .map(point -> tryEffectiveId(point).map(id -> toView(point, id)))
                .flatMap(Optional::stream)
                .filter(view -> effectiveFilter.tier() == null || view.tier() == effectiveFilter.tier())
                .filter(view -> effectiveFilter.category() == null || effectiveFilter.category().equals(view.category()))
                .sorted(order.thenComparing(KnowledgePointView::effectiveId))
                .toList();
    }

    private static Comparator<KnowledgePointView> orderFor(KnowledgePointSort sort) {
        if (sort == KnowledgePointSort.Category) {
            return Comparator.comparing(KnowledgePointView::category, Comparator.nullsLast(Comparator.<String>naturalOrder()))
                    .thenComparing(KnowledgePointView::correctPhrase, Comparator.nullsLast(Comparator.<String>naturalOrder()));
        } else if (sort == KnowledgePointSort.NextReview) {
            return Comparator.comparing(KnowledgePointView::nextReviewDate, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));
        }

        return Comparator.comparingDouble(KnowledgePointView::masteryLevel);
    }

    private Optional<String> tryEffectiveId(KnowledgePoint point) {
        try {
            return Optional.of(identityResolver.effectiveId(point));
        } catch (IdentityUnresolvableException ex) {
            log.warn("Skipping knowledge point without identity: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    private RemoteKnowledgePointKey remoteKey(KnowledgePoint point) {
        return identityResolver.remoteKey(point).orElseThrow(() -> new IdentityUnresolvableException(
                "Knowledge point \"" + point.correctPhrase() + "\" has no server identifier"));
    }

    private KnowledgePointView toView(KnowledgePoint point, String effectiveId) {
        return KnowledgePointView.of(point, effectiveId, masteryEngine.tierOf(point));
    }

    private record Target(KnowledgePoint point, boolean local) { }

    // point is null while a delete is in flight
    private record PendingView(KnowledgePoint point) { }
}
